package com.querytrace.engine.session;

import com.querytrace.engine.config.TraceSettings;
import com.querytrace.engine.sink.InMemoryTraceSink;
import com.querytrace.engine.usage.ScriptedSnapshotSource;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SessionShutdownHookTest {

    @Test
    void disablesTracingAndWritesFooter() {
        InMemoryTraceSink sink = new InMemoryTraceSink();
        SessionTraceController controller = new SessionTraceController(
            new TraceSettings().setTraceLevel(1), new ScriptedSnapshotSource(), () -> sink,
            ValueRenderer.stringValueOf(), new MutableClock(Instant.parse("2024-01-01T00:00:00Z")), 1, null);
        controller.enable();

        new SessionShutdownHook(controller).run();

        assertFalse(controller.isEnabled());
        assertTrue(sink.contains("*** Trace file closed"));
        assertEquals(1, sink.closeCount());
    }

    @Test
    void harmlessWhenTracingNeverEnabled() {
        SessionTraceController controller = new SessionTraceController(
            new TraceSettings(), new ScriptedSnapshotSource(), InMemoryTraceSink::new,
            ValueRenderer.stringValueOf(), new MutableClock(Instant.EPOCH), 1, null);
        assertDoesNotThrow(() -> new SessionShutdownHook(controller).run());
        assertFalse(controller.isEnabled());
    }
}
