package com.motionbake.codegen.model;

/**
 * Immutable 3D vector.
 */
public record Vector3(float x, float y, float z) {
}
