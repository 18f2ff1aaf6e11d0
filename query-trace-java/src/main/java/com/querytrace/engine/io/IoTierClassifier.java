package com.querytrace.engine.io;

import com.querytrace.engine.config.TraceSettings;

/**
 * Three-tier I/O classifier.
 *
 * Per access:
 *   no system call             -> ENGINE_CACHE_HIT (no I/O time)
 *   latency below threshold    -> OS_CACHE_HIT
 *   otherwise                  -> DISK_READ
 *
 * With no per-access latency the classifier falls back to {@link #estimate(long, double)},
 * which splits an aggregate read count by the average read latency.
 */
public class IoTierClassifier {

    private final int thresholdUs;

    public IoTierClassifier(int thresholdUs) {
        this.thresholdUs = TraceSettings.requireOsCacheThreshold(thresholdUs);
    }

    public int thresholdUs() {
        return thresholdUs;
    }

    public IoTier tierOf(BlockAccess access) {
        if (access.noSyscall()) return IoTier.ENGINE_CACHE_HIT;
        if (access.latencyUs() < thresholdUs) return IoTier.OS_CACHE_HIT;
        return IoTier.DISK_READ;
    }

    public LatencySample classify(BlockAccess access) {
        IoTier tier = tierOf(access);
        double latency = tier == IoTier.ENGINE_CACHE_HIT ? 0.0 : access.latencyUs();
        return new LatencySample(access.blockIdentifier(), latency, tier);
    }

    /**
     * Estimation mode. With {@code avg = totalIoTimeUs / readCount}:
     * below the threshold every read is attributed to the OS cache; otherwise the disk share is
     * {@code (avg - threshold/2) / (avg + threshold/2)}, clamped to [0, 1] and truncated to a
     * whole block count, and the remainder is attributed to the OS cache.
     */
    public TierEstimate estimate(long readCount, double totalIoTimeUs) {
        if (readCount <= 0) {
            return new TierEstimate(0, totalIoTimeUs, 0.0, thresholdUs, 0, 0);
        }
        double avgUs = totalIoTimeUs / readCount;
        long disk = 0;
        if (avgUs >= thresholdUs) {
            double half = thresholdUs / 2.0;
            double diskRatio = (avgUs - half) / (avgUs + half);
            diskRatio = Math.max(0.0, Math.min(1.0, diskRatio));
            disk = (long) (readCount * diskRatio);
        }
        return new TierEstimate(readCount, totalIoTimeUs, avgUs, thresholdUs, readCount - disk, disk);
    }

    /**
     * Compares the disk-tier count with the OS physical read counter, in blocks of {@code blockSize}.
     */
    public static ReadVerification verify(long diskTierBlocks, long physicalReadBytes, int blockSize) {
        long physicalBlocks = physicalReadBytes / blockSize;
        ReadVerification.Outcome outcome;
        if (physicalBlocks == diskTierBlocks) {
            outcome = ReadVerification.Outcome.MATCH;
        } else if (physicalBlocks < diskTierBlocks) {
            outcome = ReadVerification.Outcome.FEWER_PHYSICAL;
        } else {
            outcome = ReadVerification.Outcome.MORE_PHYSICAL;
        }
        return new ReadVerification(physicalReadBytes, physicalBlocks, diskTierBlocks, outcome);
    }
}
