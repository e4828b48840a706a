package com.motionbake.codegen.model;

/**
 * The value type an expression is known to produce, used only to name the
 * generated factory of a shared expression animation.
 */
public enum ExpressionType {
    BOOLEAN("Boolean"),
    SCALAR("Scalar"),
    VECTOR2("Vector2"),
    VECTOR3("Vector3"),
    VECTOR4("Vector4"),
    COLOR("Color");

    private final String displayName;

    ExpressionType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
