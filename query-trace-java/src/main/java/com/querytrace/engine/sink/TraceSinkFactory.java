package com.querytrace.engine.sink;

import java.io.IOException;

/** Opens a new sink each time a session's tracing is enabled. */
@FunctionalInterface
public interface TraceSinkFactory {
    TraceSink open() throws IOException;
}
