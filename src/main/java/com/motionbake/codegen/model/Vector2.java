package com.motionbake.codegen.model;

/**
 * Immutable 2D vector.
 */
public record Vector2(float x, float y) {

    public static final Vector2 ZERO = new Vector2(0, 0);
    public static final Vector2 ONE = new Vector2(1, 1);
}
