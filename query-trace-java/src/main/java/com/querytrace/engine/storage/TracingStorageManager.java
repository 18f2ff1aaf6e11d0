package com.querytrace.engine.storage;

import com.querytrace.engine.sink.TraceSink;

import java.io.IOException;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Decorates the host's {@link StorageManager}: every read, write, extend, prefetch, writeback
 * and sync is timed and written to the trace sink as a {@code WAIT} line attributed to the
 * statement the calling session has registered in the {@link StatementRegistry}.
 *
 * Tracing is active only while the sink supplier returns an open sink. Operations that throw
 * are not traced; the exception propagates to the host unchanged.
 */
public class TracingStorageManager implements StorageManager {

    private final StorageManager delegate;
    private final Supplier<TraceSink> sink;
    private final StatementRegistry registry;
    private final LongSupplier sessionKey;
    private final Function<RelFileId, Optional<String>> relationNames;
    private final LongSupplier nanoTime;

    private final AtomicLong attributionMisses = new AtomicLong();

    public TracingStorageManager(StorageManager delegate, Supplier<TraceSink> sink,
                                 StatementRegistry registry, LongSupplier sessionKey,
                                 Function<RelFileId, Optional<String>> relationNames) {
        this(delegate, sink, registry, sessionKey, relationNames, System::nanoTime);
    }

    TracingStorageManager(StorageManager delegate, Supplier<TraceSink> sink,
                          StatementRegistry registry, LongSupplier sessionKey,
                          Function<RelFileId, Optional<String>> relationNames, LongSupplier nanoTime) {
        this.delegate = delegate;
        this.sink = sink;
        this.registry = registry;
        this.sessionKey = sessionKey;
        this.relationNames = relationNames;
        this.nanoTime = nanoTime;
    }

    /** I/O events written with cursor {@code #0} because no statement was registered. */
    public long attributionMisses() {
        return attributionMisses.get();
    }

    @Override
    public void read(RelFileId rel, ForkType fork, long blockNumber, byte[] buffer) throws IOException {
        long start = nanoTime.getAsLong();
        delegate.read(rel, fork, blockNumber, buffer);
        trace(IoOperation.READ, rel, fork, blockNumber, 1, start);
    }

    @Override
    public void write(RelFileId rel, ForkType fork, long blockNumber, byte[] buffer, boolean skipFsync) throws IOException {
        long start = nanoTime.getAsLong();
        delegate.write(rel, fork, blockNumber, buffer, skipFsync);
        trace(IoOperation.WRITE, rel, fork, blockNumber, 1, start);
    }

    @Override
    public void extend(RelFileId rel, ForkType fork, long blockNumber, byte[] buffer, boolean skipFsync) throws IOException {
        long start = nanoTime.getAsLong();
        delegate.extend(rel, fork, blockNumber, buffer, skipFsync);
        trace(IoOperation.EXTEND, rel, fork, blockNumber, 1, start);
    }

    @Override
    public void prefetch(RelFileId rel, ForkType fork, long blockNumber) throws IOException {
        long start = nanoTime.getAsLong();
        delegate.prefetch(rel, fork, blockNumber);
        trace(IoOperation.PREFETCH, rel, fork, blockNumber, 1, start);
    }

    @Override
    public void writeback(RelFileId rel, ForkType fork, long blockNumber, long blockCount) throws IOException {
        long start = nanoTime.getAsLong();
        delegate.writeback(rel, fork, blockNumber, blockCount);
        trace(IoOperation.WRITEBACK, rel, fork, blockNumber, blockCount, start);
    }

    @Override
    public void immediateSync(RelFileId rel, ForkType fork) throws IOException {
        long start = nanoTime.getAsLong();
        delegate.immediateSync(rel, fork);
        trace(IoOperation.SYNC, rel, fork, 0, 0, start);
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private void trace(IoOperation op, RelFileId rel, ForkType fork, long blockNumber, long blockCount, long startNanos) {
        TraceSink out = sink.get();
        if (out == null || !out.isOpen()) return;
        long durationUs = (nanoTime.getAsLong() - startNanos) / 1000;
        try {
            IoTraceEvent event = new IoTraceEvent(cursorFor(sessionKey.getAsLong()), rel, fork, blockNumber, op, durationUs, blockCount);
            out.write(event.toWaitLine(relationNames.apply(rel).orElse(null)));
        } catch (RuntimeException e) {
            System.err.println("[query-trace] WARNING: storage I/O event dropped: " + e);
        }
    }

    private long cursorFor(long key) {
        OptionalLong cursor = registry.lookup(key);
        if (cursor.isPresent()) return cursor.getAsLong();
        if (attributionMisses.getAndIncrement() == 0) {
            System.err.println("[query-trace] WARNING: storage I/O from session " + key
                + " has no registered statement, writing it as #0");
        }
        return 0;
    }
}
