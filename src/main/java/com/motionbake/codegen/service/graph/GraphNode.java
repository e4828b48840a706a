package com.motionbake.codegen.service.graph;

import com.motionbake.codegen.model.Describable;
import com.motionbake.codegen.model.composition.CompositionObject;
import com.motionbake.codegen.model.composition.CompositionObjectType;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One object of an object graph.
 *
 * {@code position} is the depth-first preorder index of the object, which is the
 * order objects get constructed in when the generated code runs. Nodes compare by
 * identity.
 */
@Getter
public final class GraphNode {

    private final Object object;
    private final NodeType nodeType;
    private final int position;

    @Getter(AccessLevel.NONE)
    private final List<GraphNode> inReferences = new ArrayList<>();

    @Setter(AccessLevel.PACKAGE)
    private GraphNode canonical;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.PACKAGE)
    private List<GraphNode> group;

    GraphNode(Object object, NodeType nodeType, int position) {
        this.object = object;
        this.nodeType = nodeType;
        this.position = position;
        this.canonical = this;
        this.group = List.of(this);
    }

    void addInReference(GraphNode referrer) {
        inReferences.add(referrer);
    }

    public boolean isCanonical() {
        return canonical == this;
    }

    /**
     * Members of this node's group of interchangeable nodes, in construction order.
     */
    public List<GraphNode> getNodesInGroup() {
        return Collections.unmodifiableList(group);
    }

    public int getGroupSize() {
        return group.size();
    }

    /**
     * One entry per reference site to this node's group from a canonical node.
     * A node that references the group twice appears twice.
     */
    public List<GraphNode> getCanonicalInRefs() {
        List<GraphNode> result = new ArrayList<>();
        for (GraphNode member : group) {
            for (GraphNode referrer : member.inReferences) {
                if (referrer.isCanonical()) {
                    result.add(referrer);
                }
            }
        }
        return result;
    }

    /**
     * The composition object type, or null when the node is not a composition object.
     */
    public CompositionObjectType getCompositionObjectType() {
        return object instanceof CompositionObject compositionObject ? compositionObject.getType() : null;
    }

    public String getShortDescription() {
        return object instanceof Describable describable ? describable.getShortDescription() : null;
    }

    public String getLongDescription() {
        return object instanceof Describable describable ? describable.getLongDescription() : null;
    }

    @Override
    public String toString() {
        return object + "#" + position;
    }
}
