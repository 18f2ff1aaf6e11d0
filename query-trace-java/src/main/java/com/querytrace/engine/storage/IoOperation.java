package com.querytrace.engine.storage;

/** Storage operations that are timed; the label becomes the wait name suffix ({@code db file read}). */
public enum IoOperation {
    READ("read"),
    WRITE("write"),
    EXTEND("extend"),
    PREFETCH("prefetch"),
    WRITEBACK("writeback"),
    SYNC("sync");

    private final String label;

    IoOperation(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
