package com.querytrace.engine.usage;

import java.util.ArrayList;
import java.util.List;

/**
 * Process-level statistics as reported by the operating system.
 *
 * CPU and I/O fields are cumulative counters and are diffed between snapshots.
 * {@code residentKb} and {@code peakKb} are gauges: a diff carries the end snapshot's values.
 */
public record OsUsage(
    double userCpuSeconds,
    double systemCpuSeconds,
    long readChars,
    long writeChars,
    long readSyscalls,
    long writeSyscalls,
    long readBytes,
    long writeBytes,
    long cancelledWriteBytes,
    long residentKb,
    long peakKb
) {

    public double totalCpuSeconds() {
        return userCpuSeconds + systemCpuSeconds;
    }

    public boolean hasStorageIo() {
        return readBytes != 0 || writeBytes != 0;
    }

    public boolean hasAnyIo() {
        return readChars != 0 || writeChars != 0;
    }

    public List<String> negativeFields() {
        List<String> names = new ArrayList<>();
        if (userCpuSeconds < 0)      names.add("utime");
        if (systemCpuSeconds < 0)    names.add("stime");
        if (readChars < 0)           names.add("rchar");
        if (writeChars < 0)          names.add("wchar");
        if (readSyscalls < 0)        names.add("syscr");
        if (writeSyscalls < 0)       names.add("syscw");
        if (readBytes < 0)           names.add("read_bytes");
        if (writeBytes < 0)          names.add("write_bytes");
        if (cancelledWriteBytes < 0) names.add("cancelled_write_bytes");
        return names;
    }
}
