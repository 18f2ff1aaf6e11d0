package com.querytrace.engine.config;

/**
 * Numeric trace levels, 10046-style. Levels are thresholds: a session at level 12
 * gets everything level 1, 4 and 8 would produce.
 */
public final class TraceLevel {

    private TraceLevel() {}

    public static final int OFF   = 0;
    public static final int BASIC = 1;
    public static final int BINDS = 4;
    public static final int WAITS = 8;
    public static final int PLAN  = 12;
    public static final int MAX   = 16;

    public static boolean isValid(int level) {
        return level >= OFF && level <= MAX;
    }

    public static int requireValid(int level) {
        if (!isValid(level)) {
            throw new InvalidParameterException(
                "trace level must be between " + OFF + " and " + MAX + " (got " + level + ")");
        }
        return level;
    }
}
