package com.querytrace.engine.storage;

public enum ForkType {
    MAIN("main"),
    FREE_SPACE_MAP("fsm"),
    VISIBILITY_MAP("vm"),
    INIT("init");

    private final String label;

    ForkType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
