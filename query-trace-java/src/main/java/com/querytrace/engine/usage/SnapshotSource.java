package com.querytrace.engine.usage;

import java.util.Optional;

/**
 * Supplies resource-usage snapshots at phase boundaries. Implementations must not block.
 */
public interface SnapshotSource {

    /** Current cumulative engine buffer/WAL counters for this process. */
    ResourceUsage readResourceUsage();

    /** OS statistics for {@code pid}, or empty when they cannot be read (e.g. permission denied). */
    Optional<OsUsage> readOsUsage(long pid);
}
