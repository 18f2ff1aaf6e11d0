package com.querytrace.engine.io;

/** Where a block access was served from. */
public enum IoTier {
    ENGINE_CACHE_HIT("engine cache"),
    OS_CACHE_HIT("OS cache"),
    DISK_READ("disk");

    private final String label;

    IoTier(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
