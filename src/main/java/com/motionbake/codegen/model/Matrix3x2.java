package com.motionbake.codegen.model;

/**
 * 3x2 affine transform matrix, row-major.
 */
public record Matrix3x2(float m11, float m12, float m21, float m22, float m31, float m32) {

    public static final Matrix3x2 IDENTITY = new Matrix3x2(1, 0, 0, 1, 0, 0);
}
