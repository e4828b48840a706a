package com.motionbake.codegen.service.codegen;

import com.motionbake.codegen.exception.CodegenFaultException;
import com.motionbake.codegen.exception.CodegenFaultException.Fault;
import com.motionbake.codegen.service.graph.CanonicalGraphView;
import com.motionbake.codegen.service.graph.GraphNode;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * State of one compilation: the graph being compiled, the compiled nodes and the
 * resolver memo. Nothing in here outlives the run.
 */
@Getter
public final class CompilationContext {

    private final CanonicalGraphView graph;
    private final Stringifier stringifier;
    private final Duration compositionDuration;
    private final boolean setCommentProperties;
    private final ReferenceResolver resolver;

    @Getter(AccessLevel.NONE)
    private final Map<GraphNode, CompiledNode> compiledNodes = new LinkedHashMap<>();

    public CompilationContext(CanonicalGraphView graph, Stringifier stringifier, Duration compositionDuration,
                              boolean setCommentProperties) {
        this.graph = graph;
        this.stringifier = stringifier;
        this.compositionDuration = compositionDuration;
        this.setCommentProperties = setCommentProperties;
        this.resolver = new ReferenceResolver(this);
    }

    void addCompiledNode(CompiledNode node) {
        compiledNodes.put(node.getGraphNode(), node);
    }

    /**
     * Retained nodes in construction order.
     */
    public Collection<CompiledNode> getCompiledNodes() {
        return Collections.unmodifiableCollection(compiledNodes.values());
    }

    public CompiledNode compiledNodeFor(Object obj) {
        return compiledNodeFor(graph.nodeFor(obj));
    }

    public CompiledNode compiledNodeFor(GraphNode graphNode) {
        CompiledNode node = compiledNodes.get(graphNode.getCanonical());
        if (node == null) {
            throw new CodegenFaultException(Fault.UNRETAINED_NODE, "No compiled node for " + graphNode);
        }
        return node;
    }

    public CompiledNode getRoot() {
        return compiledNodeFor(graph.getRoot());
    }
}
