package com.querytrace.engine.config;

import com.google.gson.annotations.SerializedName;

/**
 * Session trace options. Deserialized from a JSON settings file by {@link TraceSettingsReader}
 * or built from agent-style arguments; absent keys fall back to the defaults below.
 *
 * Setters validate their argument and throw {@link InvalidParameterException} without
 * modifying the current value when it is out of range.
 */
public class TraceSettings {

    public static final int DEFAULT_OS_CACHE_THRESHOLD_US = 500;
    public static final int MIN_OS_CACHE_THRESHOLD_US = 10;
    public static final int MAX_OS_CACHE_THRESHOLD_US = 10_000;

    public static final int DEFAULT_FILE_MAX_SIZE_KB = 10 * 1024;
    public static final int MIN_FILE_MAX_SIZE_KB = 1024;
    public static final int MAX_FILE_MAX_SIZE_KB = 1024 * 1024;

    public static final int DEFAULT_BLOCK_SIZE = 8192;
    public static final int DEFAULT_CLOCK_TICKS_PER_SECOND = 100;

    @SerializedName("trace_level")
    private Integer traceLevel;

    @SerializedName("trace_waits")
    private Boolean traceWaits;

    @SerializedName("trace_bind_variables")
    private Boolean traceBindVariables;

    @SerializedName("trace_buffer_stats")
    private Boolean traceBufferStats;

    /** Reads faster than this are attributed to the OS page cache, slower ones to disk. */
    @SerializedName("os_cache_threshold_us")
    private Integer osCacheThresholdUs;

    @SerializedName("trace_file_max_size_kb")
    private Integer traceFileMaxSizeKb;

    @SerializedName("trace_file_directory")
    private String traceFileDirectory;

    @SerializedName("block_size")
    private Integer blockSize;

    /** USER_HZ of the host kernel; /proc reports CPU time in these ticks. */
    @SerializedName("clock_ticks_per_second")
    private Integer clockTicksPerSecond;

    public int getTraceLevel()             { return traceLevel != null ? traceLevel : TraceLevel.OFF; }
    public boolean isTraceWaits()          { return traceWaits == null || traceWaits; }
    public boolean isTraceBindVariables()  { return traceBindVariables == null || traceBindVariables; }
    public boolean isTraceBufferStats()    { return traceBufferStats == null || traceBufferStats; }
    public int getOsCacheThresholdUs()     { return osCacheThresholdUs != null ? osCacheThresholdUs : DEFAULT_OS_CACHE_THRESHOLD_US; }
    public int getTraceFileMaxSizeKb()     { return traceFileMaxSizeKb != null ? traceFileMaxSizeKb : DEFAULT_FILE_MAX_SIZE_KB; }
    public int getBlockSize()              { return blockSize != null ? blockSize : DEFAULT_BLOCK_SIZE; }
    public int getClockTicksPerSecond()    { return clockTicksPerSecond != null ? clockTicksPerSecond : DEFAULT_CLOCK_TICKS_PER_SECOND; }

    public String getTraceFileDirectory() {
        return traceFileDirectory != null && !traceFileDirectory.isBlank()
            ? traceFileDirectory
            : System.getProperty("java.io.tmpdir");
    }

    public TraceSettings setTraceLevel(int level) {
        this.traceLevel = TraceLevel.requireValid(level);
        return this;
    }

    public TraceSettings setTraceWaits(boolean enabled) {
        this.traceWaits = enabled;
        return this;
    }

    public TraceSettings setTraceBindVariables(boolean enabled) {
        this.traceBindVariables = enabled;
        return this;
    }

    public TraceSettings setTraceBufferStats(boolean enabled) {
        this.traceBufferStats = enabled;
        return this;
    }

    public TraceSettings setOsCacheThresholdUs(int thresholdUs) {
        this.osCacheThresholdUs = requireOsCacheThreshold(thresholdUs);
        return this;
    }

    public TraceSettings setTraceFileMaxSizeKb(int sizeKb) {
        if (sizeKb < MIN_FILE_MAX_SIZE_KB || sizeKb > MAX_FILE_MAX_SIZE_KB) {
            throw new InvalidParameterException("trace file max size must be between "
                + MIN_FILE_MAX_SIZE_KB + " and " + MAX_FILE_MAX_SIZE_KB + " KB (got " + sizeKb + ")");
        }
        this.traceFileMaxSizeKb = sizeKb;
        return this;
    }

    public TraceSettings setTraceFileDirectory(String directory) {
        this.traceFileDirectory = directory;
        return this;
    }

    public TraceSettings setBlockSize(int bytes) {
        if (bytes <= 0 || Integer.bitCount(bytes) != 1) {
            throw new InvalidParameterException("block size must be a positive power of two (got " + bytes + ")");
        }
        this.blockSize = bytes;
        return this;
    }

    public TraceSettings setClockTicksPerSecond(int ticks) {
        if (ticks <= 0) {
            throw new InvalidParameterException("clock ticks per second must be positive (got " + ticks + ")");
        }
        this.clockTicksPerSecond = ticks;
        return this;
    }

    /**
     * Re-checks every explicitly set field. Gson writes fields directly and bypasses the
     * setters, so settings read from a file are validated here.
     */
    public TraceSettings validate() {
        if (traceLevel != null) TraceLevel.requireValid(traceLevel);
        if (osCacheThresholdUs != null) requireOsCacheThreshold(osCacheThresholdUs);
        if (traceFileMaxSizeKb != null) setTraceFileMaxSizeKb(traceFileMaxSizeKb);
        if (blockSize != null) setBlockSize(blockSize);
        if (clockTicksPerSecond != null) setClockTicksPerSecond(clockTicksPerSecond);
        return this;
    }

    public static int requireOsCacheThreshold(int thresholdUs) {
        if (thresholdUs < MIN_OS_CACHE_THRESHOLD_US || thresholdUs > MAX_OS_CACHE_THRESHOLD_US) {
            throw new InvalidParameterException("cache threshold must be between "
                + MIN_OS_CACHE_THRESHOLD_US + " and " + MAX_OS_CACHE_THRESHOLD_US
                + " microseconds (got " + thresholdUs + ")");
        }
        return thresholdUs;
    }
}
