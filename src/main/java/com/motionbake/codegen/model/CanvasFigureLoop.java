package com.motionbake.codegen.model;

public enum CanvasFigureLoop {
    OPEN("Open"),
    CLOSED("Closed");

    private final String displayName;

    CanvasFigureLoop(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
