package com.motionbake.codegen.service.codegen;

import com.motionbake.codegen.model.composition.Animator;
import com.motionbake.codegen.model.composition.CompositionObject;
import com.motionbake.codegen.model.composition.CompositionPropertySet;
import com.motionbake.codegen.model.composition.ExpressionAnimation;
import com.motionbake.codegen.service.graph.GraphNode;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Writes the code that starts the animations bound to an object.
 *
 * An expression animation used by a single binding is never given a factory.
 * Instead the reusable expression animation field is reset and configured in
 * place, then started. Every other animation is obtained through the resolver.
 * Animations started with a controller pause the controller and then start the
 * controller's own animations, to any depth.
 */
public final class AnimationBinder {

    public static final String REUSABLE_EXPRESSION_ANIMATION_FIELD = "_reusableExpressionAnimation";

    private static final String DEFAULT_LOCAL = "result";

    private final CompilationContext context;

    public AnimationBinder(CompilationContext context) {
        this.context = context;
    }

    /**
     * Starts the animations of {@code obj}, held in the {@code result} local of the
     * factory of {@code node}.
     */
    public void startAnimations(CodeBuilder builder, CompositionObject obj, CompiledNode node) {
        startAnimations(builder, obj, node.getGraphNode(), DEFAULT_LOCAL, new HashSet<>());
    }

    // declaredLocals spans one factory method.
    private void startAnimations(CodeBuilder builder, CompositionObject obj, GraphNode caller, String localName,
                                 Set<String> declaredLocals) {
        Stringifier s = context.getStringifier();
        String deref = s.getDeref();

        for (Animator animator : obj.getAllAnimators()) {
            String property = s.string(animator.animatedProperty());
            GraphNode animationNode = context.getGraph().nodeFor(animator.animation());

            if (animator.animation() instanceof ExpressionAnimation expression
                    && NodeAnnotator.isSingleUseExpression(animationNode)) {
                String field = REUSABLE_EXPRESSION_ANIMATION_FIELD;
                builder.writeLine(field + deref + "ClearAllParameters();");
                builder.writeLine(field + deref + "Expression = " + s.string(expression.getExpression()) + ";");
                if (expression.getTarget() != null && !expression.getTarget().isBlank()) {
                    builder.writeLine(field + deref + "Target = " + s.string(expression.getTarget()) + ";");
                }
                for (Map.Entry<String, CompositionObject> parameter : expression.getReferenceParameters().entrySet()) {
                    String value = referenceParameterValue(obj, parameter.getValue(), animationNode, localName);
                    builder.writeLine(field + deref + "SetReferenceParameter(" + s.string(parameter.getKey()) + ", " + value + ");");
                }
                builder.writeLine(localName + deref + "StartAnimation(" + property + ", " + field + ");");
            } else {
                String animation = context.getResolver().resolve(caller, context.compiledNodeFor(animationNode)).text();
                builder.writeLine(localName + deref + "StartAnimation(" + property + ", " + animation + ");");
            }

            if (animator.controller() != null) {
                String controller = controllerLocal(localName);
                String lookup = localName + deref + "TryGetAnimationController(" + property + ");";
                if (declaredLocals.add(controller)) {
                    builder.writeLine(s.getVar() + " " + controller + " = " + lookup);
                } else {
                    builder.writeLine(controller + " = " + lookup);
                }
                builder.writeLine(controller + deref + "Pause();");
                startAnimations(builder, animator.controller(), caller, controller, declaredLocals);
            }
        }
    }

    private String referenceParameterValue(CompositionObject obj, CompositionObject value, GraphNode animationNode,
                                           String localName) {
        if (value == obj) {
            return localName;
        }
        if (value instanceof CompositionPropertySet && value == obj.getProperties()) {
            return localName + context.getStringifier().getDeref() + "Properties";
        }
        return context.getResolver().resolve(animationNode, value).text();
    }

    // Each nesting level gets its own local so the levels can coexist in one method.
    private static String controllerLocal(String localName) {
        return DEFAULT_LOCAL.equals(localName) ? "controller" : localName + "Controller";
    }
}
