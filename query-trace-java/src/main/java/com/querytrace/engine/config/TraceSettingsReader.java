package com.querytrace.engine.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.file.Path;

public class TraceSettingsReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and validates a JSON settings file.
     *
     * @throws SettingsReadException if the file is missing, empty or not valid JSON
     * @throws InvalidParameterException if a value is out of range
     */
    public TraceSettings read(Path settingsPath) {
        if (!settingsPath.toFile().exists()) {
            throw new SettingsReadException("Settings file not found: " + settingsPath);
        }
        try (FileReader reader = new FileReader(settingsPath.toFile())) {
            TraceSettings settings = GSON.fromJson(reader, TraceSettings.class);
            if (settings == null) {
                throw new SettingsReadException("Settings file is empty or invalid JSON: " + settingsPath);
            }
            return settings.validate();
        } catch (FileNotFoundException e) {
            throw new SettingsReadException("Settings file not found: " + settingsPath, e);
        } catch (JsonParseException e) {
            throw new SettingsReadException("Malformed settings file " + settingsPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new SettingsReadException("Failed to read settings: " + settingsPath + ": " + e.getMessage(), e);
        }
    }

    public static class SettingsReadException extends RuntimeException {
        public SettingsReadException(String message) { super(message); }
        public SettingsReadException(String message, Throwable cause) { super(message, cause); }
    }
}
