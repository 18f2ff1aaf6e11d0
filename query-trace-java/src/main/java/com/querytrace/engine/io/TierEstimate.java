package com.querytrace.engine.io;

/**
 * Result of the estimation-mode fallback, used when only an aggregate read count and
 * an aggregate read time are known. The split is a heuristic, not an exact accounting.
 */
public record TierEstimate(
    long readCount,
    double totalIoTimeUs,
    double averageUs,
    int thresholdUs,
    long osCacheReads,
    long diskReads
) {}
