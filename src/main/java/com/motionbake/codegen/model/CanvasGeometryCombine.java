package com.motionbake.codegen.model;

public enum CanvasGeometryCombine {
    UNION("Union"),
    INTERSECT("Intersect"),
    XOR("Xor"),
    EXCLUDE("Exclude");

    private final String displayName;

    CanvasGeometryCombine(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
