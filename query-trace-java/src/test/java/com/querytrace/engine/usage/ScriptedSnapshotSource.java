package com.querytrace.engine.usage;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Snapshot source returning queued snapshots in order. Once a queue is down to its last entry
 * that entry is repeated.
 */
public class ScriptedSnapshotSource implements SnapshotSource {

    private final Deque<ResourceUsage> resources = new ArrayDeque<>();
    private final Deque<OsUsage> os = new ArrayDeque<>();
    private boolean osAvailable = true;
    private int resourceReads;

    public ScriptedSnapshotSource resources(ResourceUsage... snapshots) {
        for (ResourceUsage s : snapshots) resources.add(s);
        return this;
    }

    public ScriptedSnapshotSource os(OsUsage... snapshots) {
        for (OsUsage s : snapshots) os.add(s);
        return this;
    }

    public ScriptedSnapshotSource osUnavailable() {
        osAvailable = false;
        return this;
    }

    public int resourceReads() {
        return resourceReads;
    }

    @Override
    public ResourceUsage readResourceUsage() {
        resourceReads++;
        if (resources.isEmpty()) return ResourceUsage.ZERO;
        return resources.size() > 1 ? resources.poll() : resources.peek();
    }

    @Override
    public Optional<OsUsage> readOsUsage(long pid) {
        if (!osAvailable || os.isEmpty()) return Optional.empty();
        return Optional.of(os.size() > 1 ? os.poll() : os.peek());
    }
}
