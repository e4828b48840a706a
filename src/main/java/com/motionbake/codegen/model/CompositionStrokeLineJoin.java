package com.motionbake.codegen.model;

public enum CompositionStrokeLineJoin {
    MITER("Miter"),
    BEVEL("Bevel"),
    ROUND("Round"),
    MITER_OR_BEVEL("MiterOrBevel");

    private final String displayName;

    CompositionStrokeLineJoin(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
