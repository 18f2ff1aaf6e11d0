package com.querytrace.engine.usage;

import java.util.ArrayList;
import java.util.List;

/**
 * Engine-side buffer and WAL counters. Snapshots hold cumulative, non-decreasing values;
 * the result of {@link UsageDiff#diff(ResourceUsage, ResourceUsage)} holds per-phase deltas
 * and may contain negative fields when a counter was reset between snapshots.
 *
 * @param blockReadTimeUs cumulative time spent in block reads, 0 when the host does not time I/O
 */
public record ResourceUsage(
    long sharedBlocksHit,
    long sharedBlocksRead,
    long sharedBlocksDirtied,
    long sharedBlocksWritten,
    long localBlocksHit,
    long localBlocksRead,
    long localBlocksDirtied,
    long localBlocksWritten,
    long tempBlocksRead,
    long tempBlocksWritten,
    long walRecords,
    long walFullPageImages,
    long walBytes,
    long blockReadTimeUs
) {

    public static final ResourceUsage ZERO = builder().build();

    public boolean hasSharedActivity() {
        return sharedBlocksHit != 0 || sharedBlocksRead != 0
            || sharedBlocksDirtied != 0 || sharedBlocksWritten != 0;
    }

    public boolean hasLocalActivity() {
        return localBlocksHit != 0 || localBlocksRead != 0
            || localBlocksDirtied != 0 || localBlocksWritten != 0;
    }

    public boolean hasTempActivity() {
        return tempBlocksRead != 0 || tempBlocksWritten != 0;
    }

    public boolean hasWalActivity() {
        return walRecords != 0 || walFullPageImages != 0 || walBytes != 0;
    }

    /** Names of the fields holding a negative value. Empty for any genuine snapshot. */
    public List<String> negativeFields() {
        List<String> names = new ArrayList<>();
        if (sharedBlocksHit < 0)     names.add("shared_blks_hit");
        if (sharedBlocksRead < 0)    names.add("shared_blks_read");
        if (sharedBlocksDirtied < 0) names.add("shared_blks_dirtied");
        if (sharedBlocksWritten < 0) names.add("shared_blks_written");
        if (localBlocksHit < 0)      names.add("local_blks_hit");
        if (localBlocksRead < 0)     names.add("local_blks_read");
        if (localBlocksDirtied < 0)  names.add("local_blks_dirtied");
        if (localBlocksWritten < 0)  names.add("local_blks_written");
        if (tempBlocksRead < 0)      names.add("temp_blks_read");
        if (tempBlocksWritten < 0)   names.add("temp_blks_written");
        if (walRecords < 0)          names.add("wal_records");
        if (walFullPageImages < 0)   names.add("wal_fpi");
        if (walBytes < 0)            names.add("wal_bytes");
        if (blockReadTimeUs < 0)     names.add("blk_read_time");
        return names;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long sharedBlocksHit, sharedBlocksRead, sharedBlocksDirtied, sharedBlocksWritten;
        private long localBlocksHit, localBlocksRead, localBlocksDirtied, localBlocksWritten;
        private long tempBlocksRead, tempBlocksWritten;
        private long walRecords, walFullPageImages, walBytes;
        private long blockReadTimeUs;

        private Builder() {}

        public Builder shared(long hit, long read, long dirtied, long written) {
            this.sharedBlocksHit = hit;
            this.sharedBlocksRead = read;
            this.sharedBlocksDirtied = dirtied;
            this.sharedBlocksWritten = written;
            return this;
        }

        public Builder local(long hit, long read, long dirtied, long written) {
            this.localBlocksHit = hit;
            this.localBlocksRead = read;
            this.localBlocksDirtied = dirtied;
            this.localBlocksWritten = written;
            return this;
        }

        public Builder temp(long read, long written) {
            this.tempBlocksRead = read;
            this.tempBlocksWritten = written;
            return this;
        }

        public Builder wal(long records, long fullPageImages, long bytes) {
            this.walRecords = records;
            this.walFullPageImages = fullPageImages;
            this.walBytes = bytes;
            return this;
        }

        public Builder blockReadTimeUs(long micros) {
            this.blockReadTimeUs = micros;
            return this;
        }

        public ResourceUsage build() {
            return new ResourceUsage(
                sharedBlocksHit, sharedBlocksRead, sharedBlocksDirtied, sharedBlocksWritten,
                localBlocksHit, localBlocksRead, localBlocksDirtied, localBlocksWritten,
                tempBlocksRead, tempBlocksWritten,
                walRecords, walFullPageImages, walBytes,
                blockReadTimeUs);
        }
    }
}
