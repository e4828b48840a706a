package com.motionbake.codegen.service.graph;

import java.util.List;

/**
 * Read-only view of a canonicalized object graph, as consumed by the
 * instantiator generator.
 */
public interface CanonicalGraphView {

    GraphNode getRoot();

    /**
     * Canonical representatives of every group, in construction order.
     */
    List<GraphNode> getCanonicalNodes();

    /**
     * Canonical node of the group the given object belongs to.
     *
     * @throws IllegalArgumentException if the object is not part of the graph
     */
    GraphNode nodeFor(Object obj);
}
