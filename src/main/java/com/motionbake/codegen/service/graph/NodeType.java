package com.motionbake.codegen.service.graph;

/**
 * Kinds of objects that can appear as nodes of an object graph.
 */
public enum NodeType {
    COMPOSITION_OBJECT,
    COMPOSITION_PATH,
    CANVAS_GEOMETRY
}
