package com.querytrace.engine.plan;

import com.querytrace.engine.usage.ResourceUsage;

import java.util.Optional;

/**
 * Per-node runtime counters, already finalized by the host.
 *
 * @param loops          number of times the node was started
 * @param rowsTotal      rows produced across all loops
 * @param startupSeconds time to first row
 * @param totalSeconds   total time in the node
 * @param usage          buffer/WAL usage attributed to the node, null when not collected
 */
public record Instrumentation(
    double loops,
    double rowsTotal,
    double startupSeconds,
    double totalSeconds,
    ResourceUsage usage
) {

    public Instrumentation(double loops, double rowsTotal, double startupSeconds, double totalSeconds) {
        this(loops, rowsTotal, startupSeconds, totalSeconds, null);
    }

    public boolean executed() {
        return loops > 0;
    }

    public double rowsPerLoop() {
        return loops > 0 ? rowsTotal / loops : 0.0;
    }

    public Optional<ResourceUsage> resourceUsage() {
        return Optional.ofNullable(usage);
    }
}
