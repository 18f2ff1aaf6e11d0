package com.querytrace.engine.sink;

/**
 * Append-only, line-oriented destination for trace records. Best effort: a closed or failed
 * sink silently discards records.
 */
public interface TraceSink extends AutoCloseable {

    /** Appends one record line. The sink adds the line terminator. */
    void write(String line);

    boolean isOpen();

    /** Human-readable location, e.g. the trace file path. */
    String location();

    /** Flushes and closes the sink. Further writes are discarded. */
    @Override
    void close();
}
