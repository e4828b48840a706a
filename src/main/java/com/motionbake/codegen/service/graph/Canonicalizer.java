package com.motionbake.codegen.service.graph;

import com.motionbake.codegen.model.composition.CompositionColorBrush;
import com.motionbake.codegen.model.composition.CompositionEllipseGeometry;
import com.motionbake.codegen.model.composition.CompositionGeometry;
import com.motionbake.codegen.model.composition.CompositionObject;
import com.motionbake.codegen.model.composition.CompositionPathGeometry;
import com.motionbake.codegen.model.composition.CompositionPropertySet;
import com.motionbake.codegen.model.composition.CompositionRectangleGeometry;
import com.motionbake.codegen.model.composition.CompositionRoundedRectangleGeometry;
import com.motionbake.codegen.model.composition.CubicBezierEasingFunction;
import com.motionbake.codegen.model.composition.ExpressionAnimation;
import com.motionbake.codegen.model.composition.KeyFrameAnimation;
import com.motionbake.codegen.model.composition.StepEasingFunction;
import com.motionbake.codegen.model.geometry.CanvasGeometry;
import com.motionbake.codegen.model.geometry.CompositionPath;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups structurally interchangeable nodes of an {@link ObjectGraph}.
 *
 * Two nodes share a group when they have the same variant, equal properties and
 * interchangeable referenced nodes. Visuals, shapes, clips, view boxes and every
 * object that is animated or carries property values keep their identity.
 * Expression animations are grouped by expression text, target and reference
 * parameters. The member with the lowest position becomes the canonical node.
 */
@Slf4j
public final class Canonicalizer {

    private final ObjectGraph graph;
    private final boolean ignoreCommentProperties;
    private final Map<GraphNode, Object> keys = new HashMap<>();
    private final Set<GraphNode> inProgress = new HashSet<>();

    private Canonicalizer(ObjectGraph graph, boolean ignoreCommentProperties) {
        this.graph = graph;
        this.ignoreCommentProperties = ignoreCommentProperties;
    }

    /**
     * Canonicalizes the graph in place.
     *
     * @param ignoreCommentProperties when false, objects with different comments are never grouped
     */
    public static void canonicalize(ObjectGraph graph, boolean ignoreCommentProperties) {
        new Canonicalizer(graph, ignoreCommentProperties).run();
    }

    private void run() {
        Map<Object, List<GraphNode>> groups = new LinkedHashMap<>();
        for (GraphNode node : graph.getNodes()) {
            groups.computeIfAbsent(keyOf(node), k -> new ArrayList<>()).add(node);
        }

        int merged = 0;
        for (List<GraphNode> group : groups.values()) {
            List<GraphNode> members = List.copyOf(group);
            GraphNode canonical = members.get(0);
            for (GraphNode member : members) {
                member.setCanonical(canonical);
                member.setGroup(members);
            }
            merged += members.size() - 1;
        }
        log.debug("Canonicalized {} nodes into {} groups ({} merged)", graph.getNodes().size(), groups.size(), merged);
    }

    private Object keyOf(GraphNode node) {
        Object key = keys.get(node);
        if (key != null) {
            return key;
        }
        if (!inProgress.add(node)) {
            // Reference cycle: fall back to identity.
            return node;
        }
        try {
            key = computeKey(node);
        } finally {
            inProgress.remove(node);
        }
        keys.put(node, key);
        return key;
    }

    private Object keyOfObject(Object obj) {
        if (obj == null) {
            return null;
        }
        if (obj instanceof CompositionPropertySet propertySet) {
            obj = propertySet.getOwner();
        }
        return keyOf(graph.rawNodeFor(obj));
    }

    private Object computeKey(GraphNode node) {
        Object obj = node.getObject();
        return switch (node.getNodeType()) {
            case COMPOSITION_OBJECT -> compositionObjectKey((CompositionObject) obj, node);
            case COMPOSITION_PATH -> key("CompositionPath", keyOfObject(((CompositionPath) obj).getSource()));
            case CANVAS_GEOMETRY -> canvasGeometryKey((CanvasGeometry) obj);
        };
    }

    private Object compositionObjectKey(CompositionObject obj, GraphNode node) {
        if (!obj.getAllAnimators().isEmpty()
                || (obj.getProperties() != obj && obj.getProperties().hasPropertyValues())) {
            return node;
        }
        String comment = ignoreCommentProperties ? null : obj.getComment();

        return switch (obj.getType()) {
            case COMPOSITION_COLOR_BRUSH -> key(obj.getType(), comment, ((CompositionColorBrush) obj).getColor());
            case LINEAR_EASING_FUNCTION -> key(obj.getType(), comment);
            case CUBIC_BEZIER_EASING_FUNCTION -> {
                CubicBezierEasingFunction cubic = (CubicBezierEasingFunction) obj;
                yield key(obj.getType(), comment, cubic.getControlPoint1(), cubic.getControlPoint2());
            }
            case STEP_EASING_FUNCTION -> {
                StepEasingFunction step = (StepEasingFunction) obj;
                yield key(obj.getType(), comment, step.getStepCount(), step.getInitialStep(), step.getFinalStep(),
                        step.isInitialStepSingleFrame(), step.isFinalStepSingleFrame());
            }
            case COMPOSITION_ELLIPSE_GEOMETRY -> {
                CompositionEllipseGeometry ellipse = (CompositionEllipseGeometry) obj;
                yield key(geometryKey(ellipse, comment), ellipse.getCenter(), ellipse.getRadius());
            }
            case COMPOSITION_RECTANGLE_GEOMETRY ->
                    key(geometryKey((CompositionGeometry) obj, comment), ((CompositionRectangleGeometry) obj).getSize());
            case COMPOSITION_ROUNDED_RECTANGLE_GEOMETRY -> {
                CompositionRoundedRectangleGeometry rounded = (CompositionRoundedRectangleGeometry) obj;
                yield key(geometryKey(rounded, comment), rounded.getCornerRadius(), rounded.getSize());
            }
            case COMPOSITION_PATH_GEOMETRY -> {
                CompositionPathGeometry pathGeometry = (CompositionPathGeometry) obj;
                yield key(geometryKey(pathGeometry, comment), keyOfObject(pathGeometry.getPath()));
            }
            case EXPRESSION_ANIMATION -> {
                ExpressionAnimation expression = (ExpressionAnimation) obj;
                yield key(obj.getType(), comment, expression.getExpression(), expression.getTarget(),
                        referenceParametersKey(expression.getReferenceParameters()));
            }
            case COLOR_KEY_FRAME_ANIMATION, SCALAR_KEY_FRAME_ANIMATION, VECTOR2_KEY_FRAME_ANIMATION,
                    VECTOR3_KEY_FRAME_ANIMATION, PATH_KEY_FRAME_ANIMATION ->
                    keyFrameAnimationKey((KeyFrameAnimation<?>) obj, comment);
            case ANIMATION_CONTROLLER, COMPOSITION_PROPERTY_SET, COMPOSITION_CONTAINER_SHAPE,
                    COMPOSITION_SPRITE_SHAPE, COMPOSITION_VIEW_BOX, CONTAINER_VISUAL, SHAPE_VISUAL, INSET_CLIP -> node;
        };
    }

    private Object geometryKey(CompositionGeometry geometry, String comment) {
        return key(geometry.getType(), comment, geometry.getTrimStart(), geometry.getTrimEnd(), geometry.getTrimOffset());
    }

    private Object keyFrameAnimationKey(KeyFrameAnimation<?> animation, String comment) {
        List<Object> keyFrames = new ArrayList<>();
        for (KeyFrameAnimation.KeyFrame<?> keyFrame : animation.getKeyFrames()) {
            Object value;
            if (keyFrame instanceof KeyFrameAnimation.ValueKeyFrame<?> valueKeyFrame) {
                value = valueKeyFrame.getValue() instanceof CompositionPath path
                        ? keyOfObject(path)
                        : valueKeyFrame.getValue();
            } else {
                value = key("expression", ((KeyFrameAnimation.ExpressionKeyFrame<?>) keyFrame).getExpression());
            }
            keyFrames.add(key(keyFrame.getProgress(), value, keyOfObject(keyFrame.getEasing())));
        }
        return key(animation.getType(), comment, animation.getDuration(), animation.getTarget(),
                referenceParametersKey(animation.getReferenceParameters()), keyFrames);
    }

    private Object referenceParametersKey(Map<String, CompositionObject> parameters) {
        List<Object> result = new ArrayList<>();
        parameters.forEach((name, value) -> result.add(key(name, keyOfObject(value))));
        return result;
    }

    private Object canvasGeometryKey(CanvasGeometry geometry) {
        return switch (geometry.getGeometryType()) {
            case COMBINATION -> {
                CanvasGeometry.Combination combination = (CanvasGeometry.Combination) geometry;
                yield key(geometry.getGeometryType(), keyOfObject(combination.getA()), keyOfObject(combination.getB()),
                        combination.getMatrix(), combination.getCombineMode());
            }
            case ELLIPSE -> {
                CanvasGeometry.Ellipse ellipse = (CanvasGeometry.Ellipse) geometry;
                yield key(geometry.getGeometryType(), ellipse.getX(), ellipse.getY(), ellipse.getRadiusX(), ellipse.getRadiusY());
            }
            case PATH -> {
                CanvasGeometry.Path path = (CanvasGeometry.Path) geometry;
                yield key(geometry.getGeometryType(), path.getFilledRegionDetermination(), path.getCommands());
            }
            case ROUNDED_RECTANGLE -> {
                CanvasGeometry.RoundedRectangle rectangle = (CanvasGeometry.RoundedRectangle) geometry;
                yield key(geometry.getGeometryType(), rectangle.getX(), rectangle.getY(), rectangle.getW(), rectangle.getH(),
                        rectangle.getRadiusX(), rectangle.getRadiusY());
            }
        };
    }

    // Value key; tolerates nulls.
    private static List<Object> key(Object... parts) {
        return Arrays.asList(parts);
    }
}
