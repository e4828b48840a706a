package com.motionbake.codegen.model;

public enum CompositionStrokeCap {
    FLAT("Flat"),
    SQUARE("Square"),
    ROUND("Round"),
    TRIANGLE("Triangle");

    private final String displayName;

    CompositionStrokeCap(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
