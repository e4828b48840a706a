package com.motionbake.codegen.model;

public enum CanvasFilledRegionDetermination {
    ALTERNATE("Alternate"),
    WINDING("Winding");

    private final String displayName;

    CanvasFilledRegionDetermination(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
