package com.querytrace.engine.io;

import com.querytrace.engine.config.InvalidParameterException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IoTierClassifierTest {

    private final IoTierClassifier classifier = new IoTierClassifier(500);

    private TierAccumulator classifyAll(List<BlockAccess> accesses) {
        TierAccumulator acc = new TierAccumulator();
        accesses.forEach(a -> acc.add(classifier.classify(a)));
        return acc;
    }

    // --- per-access classification ---

    @Test
    void noSyscallIsEngineHitRegardlessOfLatency() {
        BlockAccess access = new BlockAccess("1663/5/16384:main:0", 9000, true);
        LatencySample sample = classifier.classify(access);
        assertEquals(IoTier.ENGINE_CACHE_HIT, sample.tier());
        assertEquals(0.0, sample.latencyUs());
    }

    @Test
    void belowThresholdIsOsCache() {
        assertEquals(IoTier.OS_CACHE_HIT, classifier.tierOf(BlockAccess.read("b", 499.9)));
        assertEquals(IoTier.OS_CACHE_HIT, classifier.tierOf(BlockAccess.read("b", 12)));
    }

    @Test
    void atOrAboveThresholdIsDisk() {
        assertEquals(IoTier.DISK_READ, classifier.tierOf(BlockAccess.read("b", 500)));
        assertEquals(IoTier.DISK_READ, classifier.tierOf(BlockAccess.read("b", 8000)));
    }

    @Test
    void aggregatesCountsAndLatencyPerTier() {
        TierAccumulator acc = classifyAll(List.of(
            BlockAccess.hit("a"),
            BlockAccess.hit("b"),
            BlockAccess.read("c", 100),
            BlockAccess.read("d", 300),
            BlockAccess.read("e", 4000)));

        assertEquals(2, acc.count(IoTier.ENGINE_CACHE_HIT));
        assertEquals(2, acc.count(IoTier.OS_CACHE_HIT));
        assertEquals(1, acc.count(IoTier.DISK_READ));
        assertEquals(5, acc.totalCount());
        assertEquals(200.0, acc.averageLatencyUs(IoTier.OS_CACHE_HIT).getAsDouble(), 1e-9);
        assertEquals(4000.0, acc.averageLatencyUs(IoTier.DISK_READ).getAsDouble(), 1e-9);
        assertEquals(4400.0, acc.totalIoTimeUs(), 1e-9);
    }

    @Test
    void averageOmittedForEmptyTier() {
        TierAccumulator acc = classifyAll(List.of(BlockAccess.hit("a")));
        assertTrue(acc.averageLatencyUs(IoTier.DISK_READ).isEmpty());
        assertTrue(acc.averageLatencyUs(IoTier.OS_CACHE_HIT).isEmpty());
    }

    // --- estimation mode ---

    @Test
    void lowAverageAttributesEverythingToOsCache() {
        TierEstimate e = classifier.estimate(100, 20_000);
        assertEquals(200.0, e.averageUs(), 1e-9);
        assertEquals(100, e.osCacheReads());
        assertEquals(0, e.diskReads());
    }

    @Test
    void highAverageGivesDiskMajority() {
        TierEstimate e = classifier.estimate(100, 500_000);
        assertEquals(5000.0, e.averageUs(), 1e-9);
        assertTrue(e.diskReads() > 50, "disk reads should be a strict majority, got " + e.diskReads());
        assertEquals(100, e.diskReads() + e.osCacheReads());
        // (5000 - 250) / (5000 + 250) = 0.9047...
        assertEquals(90, e.diskReads());
    }

    @Test
    void averageExactlyAtThresholdSplits() {
        TierEstimate e = classifier.estimate(10, 5000);
        // (500 - 250) / (500 + 250) = 1/3
        assertEquals(3, e.diskReads());
        assertEquals(7, e.osCacheReads());
    }

    @Test
    void noReadsGivesEmptyEstimate() {
        TierEstimate e = classifier.estimate(0, 1234);
        assertEquals(0, e.osCacheReads());
        assertEquals(0, e.diskReads());
    }

    // --- verification ---

    @Test
    void verificationOutcomes() {
        assertEquals(ReadVerification.Outcome.MATCH, IoTierClassifier.verify(4, 4 * 8192, 8192).outcome());
        assertEquals(ReadVerification.Outcome.FEWER_PHYSICAL, IoTierClassifier.verify(10, 2 * 8192, 8192).outcome());
        assertEquals(ReadVerification.Outcome.MORE_PHYSICAL, IoTierClassifier.verify(1, 5 * 8192, 8192).outcome());
        assertEquals(5, IoTierClassifier.verify(1, 5 * 8192, 8192).physicalBlocks());
    }

    @Test
    void thresholdOutsideRangeRejected() {
        assertThrows(InvalidParameterException.class, () -> new IoTierClassifier(9));
        assertThrows(InvalidParameterException.class, () -> new IoTierClassifier(10_001));
        assertEquals(10, new IoTierClassifier(10).thresholdUs());
        assertEquals(10_000, new IoTierClassifier(10_000).thresholdUs());
    }
}
