package com.querytrace.engine.io;

/**
 * Cross-check of the disk-tier block count against the OS physical-read byte counter.
 * The estimate is never corrected; the outcome is only reported.
 */
public record ReadVerification(long physicalReadBytes, long physicalBlocks, long diskTierBlocks, Outcome outcome) {

    public enum Outcome {
        /** OS reports exactly as many blocks as the disk tier holds. */
        MATCH,
        /** OS reports fewer physical blocks: some "disk" reads were served by the OS cache. */
        FEWER_PHYSICAL,
        /** OS reports more physical blocks, e.g. read-ahead or reads outside the traced statement. */
        MORE_PHYSICAL
    }
}
