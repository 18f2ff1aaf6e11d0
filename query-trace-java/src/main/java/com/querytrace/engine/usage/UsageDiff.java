package com.querytrace.engine.usage;

/**
 * Field-by-field {@code end - start} over two snapshots. No clamping: a negative field means
 * the counter was reset between the snapshots and is reported by the caller as an anomaly.
 */
public final class UsageDiff {

    private UsageDiff() {}

    public static ResourceUsage diff(ResourceUsage start, ResourceUsage end) {
        return new ResourceUsage(
            end.sharedBlocksHit()     - start.sharedBlocksHit(),
            end.sharedBlocksRead()    - start.sharedBlocksRead(),
            end.sharedBlocksDirtied() - start.sharedBlocksDirtied(),
            end.sharedBlocksWritten() - start.sharedBlocksWritten(),
            end.localBlocksHit()      - start.localBlocksHit(),
            end.localBlocksRead()     - start.localBlocksRead(),
            end.localBlocksDirtied()  - start.localBlocksDirtied(),
            end.localBlocksWritten()  - start.localBlocksWritten(),
            end.tempBlocksRead()      - start.tempBlocksRead(),
            end.tempBlocksWritten()   - start.tempBlocksWritten(),
            end.walRecords()          - start.walRecords(),
            end.walFullPageImages()   - start.walFullPageImages(),
            end.walBytes()            - start.walBytes(),
            end.blockReadTimeUs()     - start.blockReadTimeUs());
    }

    public static OsUsage diff(OsUsage start, OsUsage end) {
        return new OsUsage(
            end.userCpuSeconds()      - start.userCpuSeconds(),
            end.systemCpuSeconds()    - start.systemCpuSeconds(),
            end.readChars()           - start.readChars(),
            end.writeChars()          - start.writeChars(),
            end.readSyscalls()        - start.readSyscalls(),
            end.writeSyscalls()       - start.writeSyscalls(),
            end.readBytes()           - start.readBytes(),
            end.writeBytes()          - start.writeBytes(),
            end.cancelledWriteBytes() - start.cancelledWriteBytes(),
            end.residentKb(),
            end.peakKb());
    }
}
