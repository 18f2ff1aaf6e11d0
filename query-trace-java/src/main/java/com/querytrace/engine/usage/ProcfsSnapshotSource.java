package com.querytrace.engine.usage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Snapshot source backed by the Linux /proc filesystem for OS statistics and by a
 * host-provided supplier for the engine's buffer/WAL counters.
 *
 * Reads:
 *   /proc/[pid]/stat   - utime, stime (fields 14 and 15, in clock ticks)
 *   /proc/[pid]/io     - rchar, wchar, syscr, syscw, read_bytes, write_bytes, cancelled_write_bytes
 *   /proc/[pid]/status - VmPeak, VmRSS (kB)
 *
 * /proc/[pid]/io is commonly unreadable for other users' processes; any unreadable
 * file makes the whole OS snapshot unavailable.
 */
public class ProcfsSnapshotSource implements SnapshotSource {

    private final Supplier<ResourceUsage> engineCounters;
    private final Path procRoot;
    private final int clockTicksPerSecond;
    private final AtomicBoolean warned = new AtomicBoolean(false);

    public ProcfsSnapshotSource(Supplier<ResourceUsage> engineCounters, int clockTicksPerSecond) {
        this(engineCounters, Paths.get("/proc"), clockTicksPerSecond);
    }

    public ProcfsSnapshotSource(Supplier<ResourceUsage> engineCounters, Path procRoot, int clockTicksPerSecond) {
        this.engineCounters = engineCounters;
        this.procRoot = procRoot;
        this.clockTicksPerSecond = clockTicksPerSecond;
    }

    @Override
    public ResourceUsage readResourceUsage() {
        ResourceUsage usage = engineCounters.get();
        return usage != null ? usage : ResourceUsage.ZERO;
    }

    @Override
    public Optional<OsUsage> readOsUsage(long pid) {
        Path dir = procRoot.resolve(Long.toString(pid));
        try {
            long[] ticks = parseStatTicks(Files.readString(dir.resolve("stat")));
            IoCounters io = parseIo(Files.readAllLines(dir.resolve("io")));
            long[] mem = parseStatus(Files.readAllLines(dir.resolve("status")));
            if (ticks == null) {
                return Optional.empty();
            }
            return Optional.of(new OsUsage(
                (double) ticks[0] / clockTicksPerSecond,
                (double) ticks[1] / clockTicksPerSecond,
                io.rchar, io.wchar, io.syscr, io.syscw,
                io.readBytes, io.writeBytes, io.cancelledWriteBytes,
                mem[0], mem[1]));
        } catch (IOException | SecurityException e) {
            if (warned.compareAndSet(false, true)) {
                System.err.println("[query-trace] WARNING: OS statistics unavailable for pid "
                    + pid + ": " + e.getMessage());
            }
            return Optional.empty();
        }
    }

    // -----------------------------------------------------------------------
    // Parsers (package-private for tests)
    // -----------------------------------------------------------------------

    /**
     * Returns {utime, stime} in clock ticks, or null if the line is malformed.
     * The command name (field 2) is parenthesised and may contain spaces, so parsing
     * starts after the last ')'.
     */
    static long[] parseStatTicks(String statLine) {
        int close = statLine.lastIndexOf(')');
        if (close < 0 || close + 2 > statLine.length()) return null;
        String[] fields = statLine.substring(close + 2).trim().split("\\s+");
        // fields[0] is field 3 (state); utime is field 14, stime field 15
        if (fields.length < 13) return null;
        try {
            return new long[] { Long.parseLong(fields[11]), Long.parseLong(fields[12]) };
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static IoCounters parseIo(List<String> lines) {
        IoCounters io = new IoCounters();
        for (String line : lines) {
            int colon = line.indexOf(':');
            if (colon < 0) continue;
            String key = line.substring(0, colon).trim();
            long value = parseLongOrZero(line.substring(colon + 1).trim());
            switch (key) {
                case "rchar"                 -> io.rchar = value;
                case "wchar"                 -> io.wchar = value;
                case "syscr"                 -> io.syscr = value;
                case "syscw"                 -> io.syscw = value;
                case "read_bytes"            -> io.readBytes = value;
                case "write_bytes"           -> io.writeBytes = value;
                case "cancelled_write_bytes" -> io.cancelledWriteBytes = value;
                default -> { }
            }
        }
        return io;
    }

    /** Returns {VmRSS, VmPeak} in kB; missing lines read as 0. */
    static long[] parseStatus(List<String> lines) {
        long rss = 0;
        long peak = 0;
        for (String line : lines) {
            if (line.startsWith("VmRSS:")) {
                rss = parseLongOrZero(line.substring(6).replace("kB", "").trim());
            } else if (line.startsWith("VmPeak:")) {
                peak = parseLongOrZero(line.substring(7).replace("kB", "").trim());
            }
        }
        return new long[] { rss, peak };
    }

    private static long parseLongOrZero(String s) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    static final class IoCounters {
        long rchar, wchar, syscr, syscw, readBytes, writeBytes, cancelledWriteBytes;
    }
}
