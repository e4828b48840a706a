package com.motionbake.codegen.service.codegen;

import com.motionbake.codegen.model.geometry.CanvasGeometry;

/**
 * Writes the bodies of canvas geometry factories, which depend on the geometry
 * library of the target platform. Each body must leave the created geometry in
 * a local named {@code result}, also assigned to {@code fieldName} when that is
 * not null.
 */
public interface CanvasGeometryWriter {

    /**
     * Resolves a reference from the geometry being written to another geometry.
     */
    @FunctionalInterface
    interface GeometryReferences {
        String referenceTo(CanvasGeometry geometry);
    }

    void writeCombination(CodeBuilder builder, CanvasGeometry.Combination geometry, String typeName,
                          String fieldName, GeometryReferences references);

    void writeEllipse(CodeBuilder builder, CanvasGeometry.Ellipse geometry, String typeName, String fieldName);

    void writePath(CodeBuilder builder, CanvasGeometry.Path geometry, String typeName, String fieldName);

    void writeRoundedRectangle(CodeBuilder builder, CanvasGeometry.RoundedRectangle geometry, String typeName,
                               String fieldName);
}
