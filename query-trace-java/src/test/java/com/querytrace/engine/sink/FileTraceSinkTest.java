package com.querytrace.engine.sink;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileTraceSinkTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);

    @Test
    void createsNamedFileInNewDirectory(@TempDir Path tmp) throws Exception {
        Path dir = tmp.resolve("traces/nested");
        try (FileTraceSink sink = FileTraceSink.open(dir, 4242, CLOCK, 1024)) {
            sink.write("PARSE #1");
            assertEquals(dir.resolve("qtrace_4242_1700000000.trc"), sink.path());
            assertEquals(sink.path().toString(), sink.location());
        }
        assertEquals(List.of("PARSE #1"), Files.readAllLines(dir.resolve("qtrace_4242_1700000000.trc")));
    }

    @Test
    void linesAreFlushedImmediately(@TempDir Path tmp) throws Exception {
        FileTraceSink sink = FileTraceSink.open(tmp.resolve("t.trc"), 1024);
        sink.write("EXEC #1");
        assertEquals(List.of("EXEC #1"), Files.readAllLines(sink.path()));
        sink.close();
    }

    @Test
    void sizeCapWritesMarkerOnceThenDiscards(@TempDir Path tmp) throws Exception {
        FileTraceSink sink = FileTraceSink.open(tmp.resolve("t.trc"), 1);
        String line = "x".repeat(99);  // 100 bytes with newline
        for (int i = 0; i < 20; i++) {
            sink.write(line);
        }
        sink.close();

        List<String> lines = Files.readAllLines(sink.path());
        assertEquals(11, lines.size());
        assertEquals(FileTraceSink.SIZE_LIMIT_MARKER, lines.get(10));
        assertEquals(1, lines.stream().filter(FileTraceSink.SIZE_LIMIT_MARKER::equals).count());
    }

    @Test
    void writesAfterCloseAreDiscarded(@TempDir Path tmp) throws Exception {
        FileTraceSink sink = FileTraceSink.open(tmp.resolve("t.trc"), 1024);
        sink.write("one");
        sink.close();
        assertFalse(sink.isOpen());
        assertDoesNotThrow(() -> sink.write("two"));
        assertDoesNotThrow(sink::close);
        assertEquals(List.of("one"), Files.readAllLines(sink.path()));
    }

    @Test
    void factoryOpensFreshFile(@TempDir Path tmp) throws Exception {
        TraceSinkFactory factory = FileTraceSink.factory(tmp, 7, CLOCK, 1024);
        try (TraceSink sink = factory.open()) {
            assertTrue(sink.isOpen());
            assertTrue(sink.location().endsWith("qtrace_7_1700000000.trc"));
        }
    }

    @Test
    void fileName() {
        assertEquals("qtrace_12_34.trc", FileTraceSink.fileName(12, 34));
    }
}
