package com.querytrace.engine.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TraceSettingsTest {

    @Test
    void defaults() {
        TraceSettings s = new TraceSettings();
        assertEquals(0, s.getTraceLevel());
        assertTrue(s.isTraceWaits());
        assertTrue(s.isTraceBindVariables());
        assertTrue(s.isTraceBufferStats());
        assertEquals(500, s.getOsCacheThresholdUs());
        assertEquals(10240, s.getTraceFileMaxSizeKb());
        assertEquals(8192, s.getBlockSize());
        assertEquals(100, s.getClockTicksPerSecond());
        assertEquals(System.getProperty("java.io.tmpdir"), s.getTraceFileDirectory());
    }

    @Test
    void levelBoundsAreInclusive() {
        TraceSettings s = new TraceSettings();
        s.setTraceLevel(0);
        assertEquals(0, s.getTraceLevel());
        s.setTraceLevel(16);
        assertEquals(16, s.getTraceLevel());
    }

    @Test
    void rejectedLevelKeepsPreviousValue() {
        TraceSettings s = new TraceSettings().setTraceLevel(8);
        InvalidParameterException e = assertThrows(InvalidParameterException.class, () -> s.setTraceLevel(17));
        assertTrue(e.getMessage().contains("between 0 and 16"));
        assertThrows(InvalidParameterException.class, () -> s.setTraceLevel(-1));
        assertEquals(8, s.getTraceLevel());
    }

    @Test
    void cacheThresholdRange() {
        TraceSettings s = new TraceSettings();
        s.setOsCacheThresholdUs(10);
        s.setOsCacheThresholdUs(10_000);
        assertThrows(InvalidParameterException.class, () -> s.setOsCacheThresholdUs(9));
        assertThrows(InvalidParameterException.class, () -> s.setOsCacheThresholdUs(10_001));
        assertEquals(10_000, s.getOsCacheThresholdUs());
    }

    @Test
    void fileSizeRange() {
        TraceSettings s = new TraceSettings();
        assertThrows(InvalidParameterException.class, () -> s.setTraceFileMaxSizeKb(1023));
        assertThrows(InvalidParameterException.class, () -> s.setTraceFileMaxSizeKb(1024 * 1024 + 1));
        s.setTraceFileMaxSizeKb(1024);
        assertEquals(1024, s.getTraceFileMaxSizeKb());
    }

    @Test
    void blockSizeMustBePowerOfTwo() {
        TraceSettings s = new TraceSettings();
        assertThrows(InvalidParameterException.class, () -> s.setBlockSize(3000));
        assertThrows(InvalidParameterException.class, () -> s.setBlockSize(0));
        s.setBlockSize(4096);
        assertEquals(4096, s.getBlockSize());
    }

    @Test
    void blankDirectoryFallsBackToTmpdir() {
        TraceSettings s = new TraceSettings().setTraceFileDirectory("  ");
        assertEquals(System.getProperty("java.io.tmpdir"), s.getTraceFileDirectory());
    }

    @Test
    void traceLevelHelpers() {
        assertTrue(TraceLevel.isValid(12));
        assertFalse(TraceLevel.isValid(20));
        assertEquals(4, TraceLevel.requireValid(4));
        assertThrows(InvalidParameterException.class, () -> TraceLevel.requireValid(-3));
    }
}
