package com.motionbake.codegen.service.graph;

import com.motionbake.codegen.model.composition.AnimationController;
import com.motionbake.codegen.model.composition.Animator;
import com.motionbake.codegen.model.composition.CompositionAnimation;
import com.motionbake.codegen.model.composition.CompositionContainerShape;
import com.motionbake.codegen.model.composition.CompositionObject;
import com.motionbake.codegen.model.composition.CompositionPathGeometry;
import com.motionbake.codegen.model.composition.CompositionPropertySet;
import com.motionbake.codegen.model.composition.CompositionShape;
import com.motionbake.codegen.model.composition.CompositionSpriteShape;
import com.motionbake.codegen.model.composition.ContainerVisual;
import com.motionbake.codegen.model.composition.KeyFrameAnimation;
import com.motionbake.codegen.model.composition.ShapeVisual;
import com.motionbake.codegen.model.composition.Visual;
import com.motionbake.codegen.model.geometry.CanvasGeometry;
import com.motionbake.codegen.model.geometry.CompositionPath;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Object graph reachable from a root composition object.
 *
 * Nodes are numbered by a depth-first preorder walk that visits references in
 * exactly the order the generated factories ask for them, so a node's position is
 * also its construction order at runtime.
 *
 * Property sets and animation controllers are created implicitly by their owner:
 * references to a property set are recorded against its owner, and references made
 * by an implicit object (its animators) are attributed to the owner.
 */
@Slf4j
public final class ObjectGraph implements CanonicalGraphView {

    private final Map<Object, GraphNode> nodesByObject = new IdentityHashMap<>();
    private final List<GraphNode> nodes = new ArrayList<>();
    private final GraphNode root;

    private ObjectGraph(CompositionObject rootObject) {
        this.root = visit(rootObject, null);
        log.debug("Built object graph with {} nodes", nodes.size());
    }

    public static ObjectGraph fromCompositionObject(CompositionObject root) {
        return new ObjectGraph(root);
    }

    @Override
    public GraphNode getRoot() {
        return root;
    }

    /**
     * All nodes in construction order.
     */
    public List<GraphNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    @Override
    public List<GraphNode> getCanonicalNodes() {
        return nodes.stream().filter(GraphNode::isCanonical).toList();
    }

    @Override
    public GraphNode nodeFor(Object obj) {
        return rawNodeFor(obj).getCanonical();
    }

    /**
     * The node for exactly this object, canonical or not.
     */
    public GraphNode rawNodeFor(Object obj) {
        GraphNode node = nodesByObject.get(obj);
        if (node == null) {
            throw new IllegalArgumentException("Object is not part of the graph: " + obj);
        }
        return node;
    }

    // Visits obj as referenced from referrer (null for implicit or root references).
    private GraphNode visit(Object obj, GraphNode referrer) {
        if (obj instanceof CompositionPropertySet propertySet && referrer != null) {
            // A property set is reached through its owner.
            obj = propertySet.getOwner();
        }

        GraphNode existing = nodesByObject.get(obj);
        if (existing != null) {
            if (referrer != null) {
                existing.addInReference(referrer);
            }
            return existing;
        }

        GraphNode node = new GraphNode(obj, nodeTypeOf(obj), nodes.size());
        nodes.add(node);
        nodesByObject.put(obj, node);
        if (referrer != null) {
            node.addInReference(referrer);
        }

        if (obj instanceof CompositionObject compositionObject) {
            visitCompositionObject(compositionObject, node);
        } else if (obj instanceof CompositionPath path) {
            visit(path.getSource(), node);
        } else if (obj instanceof CanvasGeometry.Combination combination) {
            visit(combination.getA(), node);
            visit(combination.getB(), node);
        }
        return node;
    }

    private void visitCompositionObject(CompositionObject obj, GraphNode node) {
        if (obj instanceof CompositionPropertySet || obj instanceof AnimationController) {
            // Implicit objects: their references are walked as part of their owner.
            return;
        }

        visit(obj.getProperties(), null);

        if (obj instanceof Visual visual) {
            visitIfPresent(visual.getClip(), node);
            if (visual instanceof ContainerVisual container) {
                for (Visual child : container.getChildren()) {
                    visit(child, node);
                }
            }
            if (visual instanceof ShapeVisual shapeVisual) {
                for (CompositionShape shape : shapeVisual.getShapes()) {
                    visit(shape, node);
                }
                visitIfPresent(shapeVisual.getViewBox(), node);
            }
        } else if (obj instanceof CompositionContainerShape containerShape) {
            for (CompositionShape shape : containerShape.getShapes()) {
                visit(shape, node);
            }
        } else if (obj instanceof CompositionSpriteShape spriteShape) {
            visitIfPresent(spriteShape.getFillBrush(), node);
            visitIfPresent(spriteShape.getGeometry(), node);
            visitIfPresent(spriteShape.getStrokeBrush(), node);
        } else if (obj instanceof CompositionPathGeometry pathGeometry) {
            visit(pathGeometry.getPath(), node);
        } else if (obj instanceof CompositionAnimation animation) {
            for (CompositionObject parameter : animation.getReferenceParameters().values()) {
                visit(parameter, node);
            }
            if (animation instanceof KeyFrameAnimation<?> keyFrameAnimation) {
                visitKeyFrames(keyFrameAnimation, node);
            }
        }

        visitAnimators(obj, node);
    }

    private void visitKeyFrames(KeyFrameAnimation<?> animation, GraphNode node) {
        for (KeyFrameAnimation.KeyFrame<?> keyFrame : animation.getKeyFrames()) {
            if (keyFrame instanceof KeyFrameAnimation.ValueKeyFrame<?> valueKeyFrame
                    && valueKeyFrame.getValue() instanceof CompositionPath path) {
                visit(path, node);
            }
            visitIfPresent(keyFrame.getEasing(), node);
        }
    }

    // Animations are attributed to owner, the node whose factory starts them.
    private void visitAnimators(CompositionObject obj, GraphNode owner) {
        for (Animator animator : obj.getAllAnimators()) {
            visit(animator.animation(), owner);
            AnimationController controller = animator.controller();
            if (controller != null) {
                visit(controller, null);
                visit(controller.getProperties(), null);
                visitAnimators(controller, owner);
            }
        }
    }

    private void visitIfPresent(Object obj, GraphNode referrer) {
        if (obj != null) {
            visit(obj, referrer);
        }
    }

    private static NodeType nodeTypeOf(Object obj) {
        if (obj instanceof CompositionObject) {
            return NodeType.COMPOSITION_OBJECT;
        } else if (obj instanceof CompositionPath) {
            return NodeType.COMPOSITION_PATH;
        } else if (obj instanceof CanvasGeometry) {
            return NodeType.CANVAS_GEOMETRY;
        }
        throw new IllegalArgumentException("Unsupported object in scene graph: " + obj.getClass().getName());
    }
}
