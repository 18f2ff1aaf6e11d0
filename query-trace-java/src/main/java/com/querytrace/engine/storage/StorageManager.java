package com.querytrace.engine.storage;

import java.io.IOException;

/**
 * Block-level storage operations of the host engine. {@link TracingStorageManager} wraps the
 * host's implementation.
 */
public interface StorageManager {

    void read(RelFileId rel, ForkType fork, long blockNumber, byte[] buffer) throws IOException;

    void write(RelFileId rel, ForkType fork, long blockNumber, byte[] buffer, boolean skipFsync) throws IOException;

    void extend(RelFileId rel, ForkType fork, long blockNumber, byte[] buffer, boolean skipFsync) throws IOException;

    void prefetch(RelFileId rel, ForkType fork, long blockNumber) throws IOException;

    void writeback(RelFileId rel, ForkType fork, long blockNumber, long blockCount) throws IOException;

    void immediateSync(RelFileId rel, ForkType fork) throws IOException;
}
