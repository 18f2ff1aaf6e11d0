package com.querytrace.engine;

import com.querytrace.engine.config.InvalidParameterException;
import com.querytrace.engine.config.TraceSettings;
import com.querytrace.engine.config.TraceSettingsReader;
import com.querytrace.engine.session.SessionShutdownHook;
import com.querytrace.engine.session.SessionTraceController;
import com.querytrace.engine.session.ValueRenderer;
import com.querytrace.engine.sink.FileTraceSink;
import com.querytrace.engine.storage.RelFileId;
import com.querytrace.engine.storage.StatementRegistry;
import com.querytrace.engine.storage.StorageManager;
import com.querytrace.engine.storage.TracingStorageManager;
import com.querytrace.engine.usage.ProcfsSnapshotSource;
import com.querytrace.engine.usage.ResourceUsage;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.function.Supplier;

/**
 * Entry point for hosts that embed the tracer.
 *
 *   TraceBootstrap.install("trace_level=12,trace_file_directory=/var/trace", engine::bufferUsage, renderer)
 *
 * Args (key=value pairs separated by comma):
 *   settings               : JSON settings file read first; later keys override it
 *   trace_level            : 0..16 (default: 0)
 *   trace_waits            : "true"/"false" (default: true)
 *   trace_bind_variables   : "true"/"false" (default: true)
 *   trace_buffer_stats     : "true"/"false" (default: true)
 *   os_cache_threshold_us  : 10..10000 (default: 500)
 *   trace_file_max_size_kb : 1024..1048576 (default: 10240)
 *   trace_file_directory   : where qtrace_*.trc files go (default: java.io.tmpdir)
 *   block_size             : engine block size in bytes (default: 8192)
 *   clock_ticks_per_second : /proc CPU tick rate (default: 100)
 */
public final class TraceBootstrap {

    private TraceBootstrap() {}

    /** Shared by every session installed in this JVM. */
    public static final StatementRegistry STATEMENTS = new StatementRegistry();

    /**
     * Builds a session controller over /proc statistics and a file sink, registers a shutdown
     * hook that closes the trace, and enables tracing when the configured level is above 0.
     */
    public static SessionTraceController install(String args, Supplier<ResourceUsage> engineCounters,
                                                 ValueRenderer renderer) {
        TraceSettings settings = parseArgs(args);
        long pid = ProcessHandle.current().pid();
        Clock clock = Clock.systemUTC();

        System.err.println("[query-trace] trace level: " + settings.getTraceLevel());
        System.err.println("[query-trace] output: " + settings.getTraceFileDirectory());
        System.err.println("[query-trace] waits=" + settings.isTraceWaits()
            + " binds=" + settings.isTraceBindVariables()
            + " buffers=" + settings.isTraceBufferStats()
            + " os_cache_threshold_us=" + settings.getOsCacheThresholdUs());

        SessionTraceController controller = new SessionTraceController(
            settings,
            new ProcfsSnapshotSource(engineCounters, settings.getClockTicksPerSecond()),
            FileTraceSink.factory(Path.of(settings.getTraceFileDirectory()), pid, clock,
                settings.getTraceFileMaxSizeKb()),
            renderer,
            clock,
            pid,
            STATEMENTS);

        Runtime.getRuntime().addShutdownHook(new Thread(new SessionShutdownHook(controller)));

        if (settings.getTraceLevel() > 0) {
            controller.enable();
        }
        return controller;
    }

    /**
     * Wraps the host's storage manager so block-level I/O is written to the session's trace
     * file, attributed through {@link #STATEMENTS} under the controller's session id.
     */
    public static StorageManager traceStorage(StorageManager host, SessionTraceController controller,
                                              Function<RelFileId, Optional<String>> relationNames) {
        return new TracingStorageManager(host, controller::currentSink, STATEMENTS, controller::sessionId,
            relationNames);
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    /**
     * @throws InvalidParameterException for out-of-range values; unparsable numbers are ignored
     * @throws TraceSettingsReader.SettingsReadException when the settings file cannot be read
     */
    static TraceSettings parseArgs(String args) {
        TraceSettings settings = new TraceSettings();
        if (args == null || args.isBlank()) return settings;

        String[] parts = args.split(",");
        for (String part : parts) {
            String[] kv = part.split("=", 2);
            if (kv.length == 2 && "settings".equals(kv[0].trim())) {
                settings = new TraceSettingsReader().read(Path.of(kv[1].trim()));
            }
        }

        for (String part : parts) {
            String[] kv = part.split("=", 2);
            if (kv.length != 2) continue;
            String key = kv[0].trim();
            String value = kv[1].trim();
            switch (key) {
                case "trace_level"            -> parseInt(key, value, settings::setTraceLevel);
                case "trace_waits"            -> settings.setTraceWaits(!"false".equalsIgnoreCase(value));
                case "trace_bind_variables"   -> settings.setTraceBindVariables(!"false".equalsIgnoreCase(value));
                case "trace_buffer_stats"     -> settings.setTraceBufferStats(!"false".equalsIgnoreCase(value));
                case "os_cache_threshold_us"  -> parseInt(key, value, settings::setOsCacheThresholdUs);
                case "trace_file_max_size_kb" -> parseInt(key, value, settings::setTraceFileMaxSizeKb);
                case "trace_file_directory"   -> settings.setTraceFileDirectory(value);
                case "block_size"             -> parseInt(key, value, settings::setBlockSize);
                case "clock_ticks_per_second" -> parseInt(key, value, settings::setClockTicksPerSecond);
                case "settings"               -> { }
                default -> System.err.println("[query-trace] WARNING: unknown option ignored: " + key);
            }
        }
        return settings;
    }

    private static void parseInt(String key, String value, IntConsumer setter) {
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            System.err.println("[query-trace] WARNING: " + key + "=" + value + " is not a number, ignored");
            return;
        }
        setter.accept(parsed);
    }
}
