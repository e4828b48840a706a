package com.motionbake.codegen.service.codegen;

import com.motionbake.codegen.model.Color;
import com.motionbake.codegen.model.Vector2;
import com.motionbake.codegen.model.composition.Animator;
import com.motionbake.codegen.model.composition.ColorKeyFrameAnimation;
import com.motionbake.codegen.model.composition.CompositionColorBrush;
import com.motionbake.codegen.model.composition.CompositionEllipseGeometry;
import com.motionbake.codegen.model.composition.CompositionObject;
import com.motionbake.codegen.model.composition.CompositionObjectType;
import com.motionbake.codegen.model.composition.CompositionRectangleGeometry;
import com.motionbake.codegen.model.composition.CompositionRoundedRectangleGeometry;
import com.motionbake.codegen.model.composition.ExpressionAnimation;
import com.motionbake.codegen.model.composition.ScalarKeyFrameAnimation;
import com.motionbake.codegen.model.geometry.CompositionPath;
import com.motionbake.codegen.service.graph.GraphNode;
import lombok.extern.slf4j.Slf4j;

import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Chooses the nodes that get code, names them and decides their storage.
 *
 * Runs once per compilation before any text is written:
 * <ol>
 *     <li>keeps canonical nodes, except expression animations used once and the
 *     implicit property sets and animation controllers;</li>
 *     <li>names every kept node;</li>
 *     <li>gives storage to nodes referenced from more than one place;</li>
 *     <li>inlines path wrappers referenced from at most one place;</li>
 *     <li>names the root {@code Root}.</li>
 * </ol>
 */
@Slf4j
public final class NodeAnnotator {

    public static final String ROOT_NAME = "Root";

    private static final String COMPOSITION_PREFIX = "Composition";

    private final CompilationContext context;

    private NodeAnnotator(CompilationContext context) {
        this.context = context;
    }

    /**
     * Annotates the graph of {@code context}, registering the compiled nodes with it.
     *
     * @return the compiled root node
     */
    public static CompiledNode annotate(CompilationContext context) {
        return new NodeAnnotator(context).run();
    }

    private CompiledNode run() {
        List<CompiledNode> retained = new ArrayList<>();
        for (GraphNode graphNode : context.getGraph().getCanonicalNodes()) {
            if (isRetained(graphNode)) {
                CompiledNode node = new CompiledNode(graphNode);
                retained.add(node);
                context.addCompiledNode(node);
            }
        }

        assignNames(retained);

        for (CompiledNode node : retained) {
            node.setInboundReferences(filteredInRefs(node.getGraphNode()));
            if (node.getInboundReferences().size() > 1) {
                node.setRequiresStorage(true);
            }
        }

        // The entry point's call of the root factory is not an inbound reference.
        CompiledNode root = context.getRoot();
        if (!root.getGraphNode().getCanonicalInRefs().isEmpty()) {
            root.setRequiresStorage(true);
        }

        for (CompiledNode node : retained) {
            if (node.getObject() instanceof CompositionPath path && node.getInboundReferences().size() <= 1) {
                String sourceCall = context.getResolver().resolve(node.getGraphNode(), path.getSource()).text();
                node.setInlineExpression(context.getStringifier().getNew() + " CompositionPath("
                        + context.getStringifier().factoryCall(sourceCall) + ")");
            }
        }

        root.setName(ROOT_NAME);

        if (log.isDebugEnabled()) {
            for (CompiledNode node : retained) {
                log.debug("{} #{}: storage={}, inline={}, inrefs={}", node.getName(),
                        node.getConstructionOrderIndex(), node.isRequiresStorage(), node.isInlined(),
                        node.getInboundReferences().size());
            }
        }
        return root;
    }

    private static boolean isRetained(GraphNode graphNode) {
        CompositionObjectType type = graphNode.getCompositionObjectType();
        if (type == null) {
            return true;
        }
        return switch (type) {
            case ANIMATION_CONTROLLER, COMPOSITION_PROPERTY_SET -> false;
            // Expressions used once are set up on the reusable expression animation.
            case EXPRESSION_ANIMATION -> !isSingleUseExpression(graphNode);
            default -> true;
        };
    }

    /**
     * Inbound references, minus those from an expression animation used once that
     * animates the node itself. Such an animation is set up inside the node's own
     * factory.
     */
    static List<GraphNode> filteredInRefs(GraphNode node) {
        List<GraphNode> result = new ArrayList<>();
        for (GraphNode referrer : node.getCanonicalInRefs()) {
            if (referrer.getObject() instanceof ExpressionAnimation expression
                    && isSingleUseExpression(referrer)
                    && node.getObject() instanceof CompositionObject target
                    && isAnimatedBy(target, expression)) {
                continue;
            }
            result.add(referrer);
        }
        return result;
    }

    /**
     * Whether {@code node} is an expression animation bound exactly once: a single
     * instance with a single referrer. Such an expression gets no factory.
     */
    static boolean isSingleUseExpression(GraphNode node) {
        return node.getObject() instanceof ExpressionAnimation
                && node.getGroupSize() == 1
                && node.getCanonicalInRefs().size() == 1;
    }

    private static boolean isAnimatedBy(CompositionObject target, ExpressionAnimation expression) {
        for (Animator animator : target.getAllAnimators()) {
            if (animator.animation() instanceof ExpressionAnimation animatorExpression
                    && animatorExpression.getExpression().equals(expression.getExpression())) {
                return true;
            }
        }
        return false;
    }

    // Nodes sharing a base name get a counter suffix, in construction order.
    private static void assignNames(List<CompiledNode> nodes) {
        Map<String, List<CompiledNode>> nodesByBaseName = new LinkedHashMap<>();
        for (CompiledNode node : nodes) {
            nodesByBaseName.computeIfAbsent(baseName(node), k -> new ArrayList<>()).add(node);
        }
        nodesByBaseName.forEach((baseName, group) -> {
            if (group.size() == 1) {
                group.get(0).setName(baseName);
            } else {
                for (int i = 0; i < group.size(); i++) {
                    group.get(i).setName(String.format(Locale.ROOT, "%s_%03d", baseName, i));
                }
            }
        });
    }

    static String baseName(CompiledNode node) {
        String name = switch (node.getGraphNode().getNodeType()) {
            case COMPOSITION_OBJECT -> describe((CompositionObject) node.getObject());
            case COMPOSITION_PATH -> "CompositionPath";
            case CANVAS_GEOMETRY -> "Geometry";
        };
        return name.startsWith(COMPOSITION_PREFIX) ? name.substring(COMPOSITION_PREFIX.length()) : name;
    }

    private static String describe(CompositionObject obj) {
        return switch (obj.getType()) {
            case COLOR_KEY_FRAME_ANIMATION -> withRange("ColorAnimation", describeRange((ColorKeyFrameAnimation) obj));
            case SCALAR_KEY_FRAME_ANIMATION -> withRange("ScalarAnimation", describeRange((ScalarKeyFrameAnimation) obj));
            case VECTOR2_KEY_FRAME_ANIMATION -> "Vector2Animation";
            case COMPOSITION_COLOR_BRUSH -> describeColorBrush((CompositionColorBrush) obj);
            case COMPOSITION_RECTANGLE_GEOMETRY -> "Rectangle_" + vector2Id(((CompositionRectangleGeometry) obj).getSize());
            case COMPOSITION_ROUNDED_RECTANGLE_GEOMETRY ->
                    "RoundedRectangle_" + vector2Id(((CompositionRoundedRectangleGeometry) obj).getSize());
            case COMPOSITION_ELLIPSE_GEOMETRY -> "Ellipse_" + vector2Id(((CompositionEllipseGeometry) obj).getRadius());
            case EXPRESSION_ANIMATION -> {
                ExpressionAnimation expression = (ExpressionAnimation) obj;
                yield expression.getExpressionType() != null
                        ? expression.getExpressionType().getDisplayName() + "ExpressionAnimation"
                        : "ExpressionAnimation";
            }
            default -> obj.getType().getTypeName();
        };
    }

    private static String describeColorBrush(CompositionColorBrush brush) {
        if (brush.getAnimators().isEmpty()) {
            // Canonicalization leaves one brush per unanimated color.
            return "ColorBrush_" + brush.getColor().getName();
        }
        for (Animator animator : brush.getAnimators()) {
            if (animator.animation() instanceof ColorKeyFrameAnimation colorAnimation) {
                return withRange("AnimatedColorBrush", describeRange(colorAnimation));
            }
        }
        return "AnimatedColorBrush";
    }

    private static String withRange(String prefix, String range) {
        return range == null ? prefix : prefix + "_" + range;
    }

    private static String describeRange(ColorKeyFrameAnimation animation) {
        Color first = animation.firstValue();
        Color last = animation.lastValue();
        return first != null && last != null ? first.getName() + "_to_" + last.getName() : null;
    }

    private static String describeRange(ScalarKeyFrameAnimation animation) {
        Float first = animation.firstValue();
        Float last = animation.lastValue();
        return first != null && last != null ? floatId(first) + "_to_" + floatId(last) : null;
    }

    /**
     * A float for use in an identifier: up to 3 decimals, {@code p} for the point
     * and {@code m} for the minus sign.
     */
    static String floatId(float value) {
        DecimalFormat format = new DecimalFormat("0.###", DecimalFormatSymbols.getInstance(Locale.ROOT));
        format.setRoundingMode(RoundingMode.HALF_UP);
        return format.format(value).replace('.', 'p').replace('-', 'm');
    }

    static String vector2Id(Vector2 value) {
        return value.x() == value.y() ? floatId(value.x()) : floatId(value.x()) + "x" + floatId(value.y());
    }
}
