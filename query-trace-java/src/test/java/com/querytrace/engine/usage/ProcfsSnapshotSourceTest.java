package com.querytrace.engine.usage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ProcfsSnapshotSourceTest {

    // pid (comm) state ppid pgrp session tty tpgid flags minflt cminflt majflt cmajflt utime stime ...
    private static final String STAT =
        "4242 (postgres: app db [local] SELECT) R 1 4242 4242 0 -1 4194304 1200 0 3 0 250 75 0 0 20 0 1 0 100";

    @Test
    void parsesUtimeAndStimeAfterCommandName() {
        long[] ticks = ProcfsSnapshotSource.parseStatTicks(STAT);
        assertNotNull(ticks);
        assertEquals(250, ticks[0]);
        assertEquals(75, ticks[1]);
    }

    @Test
    void malformedStatLineYieldsNull() {
        assertNull(ProcfsSnapshotSource.parseStatTicks("garbage"));
        assertNull(ProcfsSnapshotSource.parseStatTicks("1 (x) R 1 2"));
    }

    @Test
    void parsesIoCounters() {
        ProcfsSnapshotSource.IoCounters io = ProcfsSnapshotSource.parseIo(List.of(
            "rchar: 123456",
            "wchar: 789",
            "syscr: 42",
            "syscw: 7",
            "read_bytes: 81920",
            "write_bytes: 4096",
            "cancelled_write_bytes: 0"));
        assertEquals(123456, io.rchar);
        assertEquals(789, io.wchar);
        assertEquals(42, io.syscr);
        assertEquals(7, io.syscw);
        assertEquals(81920, io.readBytes);
        assertEquals(4096, io.writeBytes);
        assertEquals(0, io.cancelledWriteBytes);
    }

    @Test
    void parsesMemoryFromStatus() {
        long[] mem = ProcfsSnapshotSource.parseStatus(List.of(
            "Name:\tpostgres",
            "VmPeak:\t  220000 kB",
            "VmSize:\t  210000 kB",
            "VmRSS:\t   18000 kB"));
        assertEquals(18000, mem[0]);
        assertEquals(220000, mem[1]);
    }

    @Test
    void readsFakeProcTree(@TempDir Path proc) throws Exception {
        Path dir = Files.createDirectories(proc.resolve("4242"));
        Files.writeString(dir.resolve("stat"), STAT);
        Files.writeString(dir.resolve("io"), "rchar: 1000\nwchar: 10\nsyscr: 4\nsyscw: 1\n"
            + "read_bytes: 16384\nwrite_bytes: 0\ncancelled_write_bytes: 0\n");
        Files.writeString(dir.resolve("status"), "VmPeak:\t 5000 kB\nVmRSS:\t 3000 kB\n");

        ResourceUsage engine = ResourceUsage.builder().shared(5, 1, 0, 0).build();
        ProcfsSnapshotSource source = new ProcfsSnapshotSource(() -> engine, proc, 100);

        Optional<OsUsage> os = source.readOsUsage(4242);
        assertTrue(os.isPresent());
        assertEquals(2.5, os.get().userCpuSeconds(), 1e-9);
        assertEquals(0.75, os.get().systemCpuSeconds(), 1e-9);
        assertEquals(16384, os.get().readBytes());
        assertEquals(3000, os.get().residentKb());
        assertEquals(5000, os.get().peakKb());
        assertSame(engine, source.readResourceUsage());
    }

    @Test
    void unreadableProcessYieldsEmpty(@TempDir Path proc) {
        ProcfsSnapshotSource source = new ProcfsSnapshotSource(() -> null, proc, 100);
        assertEquals(Optional.empty(), source.readOsUsage(99999));
        assertEquals(ResourceUsage.ZERO, source.readResourceUsage());
    }
}
