package com.querytrace.engine.io;

/**
 * One block access as observed by the host.
 *
 * @param blockIdentifier host-specific block address, e.g. {@code 1663/5/16384:main:42}
 * @param latencyUs       raw access latency in microseconds
 * @param noSyscall       true when the block was served from the engine cache without a system call
 */
public record BlockAccess(String blockIdentifier, double latencyUs, boolean noSyscall) {

    public static BlockAccess hit(String blockIdentifier) {
        return new BlockAccess(blockIdentifier, 0.0, true);
    }

    public static BlockAccess read(String blockIdentifier, double latencyUs) {
        return new BlockAccess(blockIdentifier, latencyUs, false);
    }
}
