package com.querytrace.engine.io;

import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Running per-tier counts and summed latency. Engine cache hits contribute zero latency.
 */
public class TierAccumulator {

    private final Map<IoTier, Long> counts = new EnumMap<>(IoTier.class);
    private final Map<IoTier, Double> latencies = new EnumMap<>(IoTier.class);

    public TierAccumulator() {
        for (IoTier tier : IoTier.values()) {
            counts.put(tier, 0L);
            latencies.put(tier, 0.0);
        }
    }

    public void add(LatencySample sample) {
        add(sample.tier(), 1, sample.tier() == IoTier.ENGINE_CACHE_HIT ? 0.0 : sample.latencyUs());
    }

    public void add(IoTier tier, long count, double latencyUs) {
        counts.merge(tier, count, Long::sum);
        latencies.merge(tier, latencyUs, Double::sum);
    }

    public long count(IoTier tier) {
        return counts.get(tier);
    }

    public double totalLatencyUs(IoTier tier) {
        return latencies.get(tier);
    }

    /** Average latency for the tier; empty when the tier has no accesses. */
    public OptionalDouble averageLatencyUs(IoTier tier) {
        long n = counts.get(tier);
        return n == 0 ? OptionalDouble.empty() : OptionalDouble.of(latencies.get(tier) / n);
    }

    public long totalCount() {
        long total = 0;
        for (long n : counts.values()) total += n;
        return total;
    }

    /** Total I/O time across the tiers that issued a system call. */
    public double totalIoTimeUs() {
        return latencies.get(IoTier.OS_CACHE_HIT) + latencies.get(IoTier.DISK_READ);
    }
}
