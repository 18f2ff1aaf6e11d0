package com.querytrace.engine.sink;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Trace file writer. Each line is flushed immediately so the file can be tailed while the
 * session runs.
 *
 * Once the file reaches its size cap, one limit marker is written and later records are
 * discarded. An I/O failure is logged once and turns the sink into a discarding sink;
 * the traced statement is never affected.
 */
public class FileTraceSink implements TraceSink {

    static final String SIZE_LIMIT_MARKER = "*** TRACE FILE SIZE LIMIT REACHED - further records discarded";

    private final Path path;
    private final long maxBytes;
    private Writer writer;
    private long bytesWritten;
    private boolean limitReached;

    private FileTraceSink(Path path, Writer writer, long maxBytes) {
        this.path = path;
        this.writer = writer;
        this.maxBytes = maxBytes;
    }

    /**
     * Creates {@code directory} if absent and opens {@code qtrace_<pid>_<epochSeconds>.trc} in it.
     */
    public static FileTraceSink open(Path directory, long pid, Clock clock, int maxSizeKb) throws IOException {
        Files.createDirectories(directory);
        Path file = directory.resolve(fileName(pid, clock.instant().getEpochSecond()));
        return open(file, maxSizeKb);
    }

    public static FileTraceSink open(Path file, int maxSizeKb) throws IOException {
        Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        return new FileTraceSink(file, w, maxSizeKb * 1024L);
    }

    public static String fileName(long pid, long epochSeconds) {
        return "qtrace_" + pid + "_" + epochSeconds + ".trc";
    }

    /** Factory for sessions: every enable opens a fresh file. */
    public static TraceSinkFactory factory(Path directory, long pid, Clock clock, int maxSizeKb) {
        return () -> open(directory, pid, clock, maxSizeKb);
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized void write(String line) {
        if (writer == null || limitReached) return;
        long size = line.getBytes(StandardCharsets.UTF_8).length + 1L;
        try {
            if (bytesWritten + size > maxBytes) {
                limitReached = true;
                writer.write(SIZE_LIMIT_MARKER);
                writer.write('\n');
                writer.flush();
                return;
            }
            writer.write(line);
            writer.write('\n');
            writer.flush();
            bytesWritten += size;
        } catch (IOException e) {
            System.err.println("[query-trace] WARNING: trace file " + path
                + " unavailable, discarding further records: " + e.getMessage());
            closeQuietly();
        }
    }

    @Override
    public synchronized boolean isOpen() {
        return writer != null;
    }

    @Override
    public String location() {
        return path.toString();
    }

    @Override
    public synchronized void close() {
        if (writer == null) return;
        try {
            writer.flush();
            writer.close();
        } catch (IOException e) {
            System.err.println("[query-trace] WARNING: error closing trace file " + path + ": " + e.getMessage());
        } finally {
            writer = null;
        }
    }

    private void closeQuietly() {
        Writer w = writer;
        writer = null;
        try {
            w.close();
        } catch (IOException e) {
            System.err.println("[query-trace] WARNING: error closing trace file " + path + ": " + e.getMessage());
        }
    }
}
