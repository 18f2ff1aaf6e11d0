package com.querytrace.engine.storage;

/**
 * One timed storage operation.
 *
 * @param cursorId statement the operation is attributed to, 0 when unattributed
 */
public record IoTraceEvent(
    long cursorId,
    RelFileId rel,
    ForkType fork,
    long blockNumber,
    IoOperation operation,
    long durationUs,
    long blockCount
) {

    /** Renders the event as a wait line; {@code relationName} may be null. */
    public String toWaitLine(String relationName) {
        return "WAIT #" + cursorId + ": nam='db file " + operation.label() + "' ela=" + durationUs + " us"
            + " file#=" + rel
            + " block#=" + blockNumber
            + " blocks=" + blockCount
            + " obj#=" + rel.relation()
            + " fork=" + fork.label()
            + " rel=" + (relationName != null ? relationName : rel.toString());
    }
}
