package com.motionbake.codegen.service.codegen;

import com.motionbake.codegen.model.composition.CompositionObject;
import com.motionbake.codegen.model.geometry.CanvasGeometry;
import com.motionbake.codegen.service.graph.GraphNode;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * A canonical node retained for code generation, with the decisions made for it
 * in one compilation. Instances belong to a single run and are never shared.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
public final class CompiledNode {

    private final GraphNode graphNode;
    private String name;
    private boolean requiresStorage;
    private String inlineExpression;
    private List<GraphNode> inboundReferences = List.of();

    CompiledNode(GraphNode graphNode) {
        this.graphNode = graphNode;
    }

    public Object getObject() {
        return graphNode.getObject();
    }

    public int getConstructionOrderIndex() {
        return graphNode.getPosition();
    }

    public boolean isInlined() {
        return inlineExpression != null;
    }

    /**
     * The cache field name, or null when the node has no storage.
     */
    public String getFieldName() {
        return requiresStorage ? "_" + Character.toLowerCase(name.charAt(0)) + name.substring(1) : null;
    }

    /**
     * Return type of the node's factory method.
     */
    public String getTypeName() {
        return switch (graphNode.getNodeType()) {
            case COMPOSITION_OBJECT -> ((CompositionObject) getObject()).getType().getTypeName();
            case COMPOSITION_PATH -> "CompositionPath";
            case CANVAS_GEOMETRY -> "CanvasGeometry";
        };
    }

    public boolean requiresWin2d() {
        return getObject() instanceof CanvasGeometry;
    }

    /**
     * Text that obtains the object: the inline expression, or a call of the factory.
     */
    public String factoryCall() {
        return isInlined() ? inlineExpression : name + "()";
    }

    @Override
    public String toString() {
        return name == null ? getTypeName() : name;
    }
}
