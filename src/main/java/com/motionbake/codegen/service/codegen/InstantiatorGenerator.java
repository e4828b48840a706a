package com.motionbake.codegen.service.codegen;

import com.motionbake.codegen.model.Vector2;
import com.motionbake.codegen.model.composition.CompositionPropertySet;
import com.motionbake.codegen.service.graph.CanonicalGraphView;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;

/**
 * Compiles a canonicalized object graph into one class of factory methods that
 * rebuild the graph when run.
 *
 * The nodes are annotated when the generator is created. {@link #generateCode}
 * then writes the unit: banner, preamble, class start, constants and fields, the
 * factory methods in name order and the class end. A generator compiles once;
 * create a new one for every output.
 */
@Slf4j
public final class InstantiatorGenerator {

    private static final String[] AUTO_GENERATED_BANNER = {
            "//------------------------------------------------------------------------------",
            "// <auto-generated>",
            "//     This code was generated by a tool.",
            "//",
            "//     Changes to this file may cause incorrect behavior and will be lost if",
            "//     the code is regenerated.",
            "// </auto-generated>",
            "//------------------------------------------------------------------------------",
    };

    private final CompilationContext context;
    private final TargetLanguage targetLanguage;
    private final ObjectFactoryEmitter emitter;

    @Getter
    private final CompiledNode root;

    /** Retained nodes in the order their factories are written. */
    @Getter
    private final List<CompiledNode> compiledNodes;

    private boolean generated;

    public InstantiatorGenerator(CanonicalGraphView graph, TargetLanguage targetLanguage, Duration compositionDuration,
                                 boolean setCommentProperties) {
        this.targetLanguage = targetLanguage;
        this.context = new CompilationContext(graph, targetLanguage.getStringifier(), compositionDuration,
                setCommentProperties);
        this.root = NodeAnnotator.annotate(context);
        this.compiledNodes = context.getCompiledNodes().stream()
                .sorted(Comparator.comparing(CompiledNode::getName))
                .toList();
        this.emitter = new ObjectFactoryEmitter(context, new AnimationBinder(context),
                targetLanguage.getCanvasGeometryWriter());
    }

    /**
     * Writes the unit.
     *
     * @throws IllegalStateException if called more than once
     */
    public String generateCode(String className, float width, float height, CompositionPropertySet progressPropertySet) {
        if (generated) {
            throw new IllegalStateException("Code has already been generated by this generator");
        }
        generated = true;

        Stringifier s = context.getStringifier();
        ClassShellWriter shell = targetLanguage.newClassShellWriter();
        CodeBuilder builder = new CodeBuilder();

        for (String line : AUTO_GENERATED_BANNER) {
            builder.writeLine(line);
        }

        boolean requiresWin2d = compiledNodes.stream().anyMatch(CompiledNode::requiresWin2d);
        shell.writePreamble(builder, requiresWin2d);
        shell.writeClassStart(builder, className, new Vector2(width, height), progressPropertySet,
                context.getCompositionDuration());

        writeField(builder, "const " + s.getInt64TypeName(), ObjectFactoryEmitter.DURATION_TICKS_FIELD + " = "
                + s.int64(StringifierBase.ticks(context.getCompositionDuration())));
        writeField(builder, readonly(s.referenceTypeName("Compositor")), "_c");
        writeField(builder, readonly(s.referenceTypeName("ExpressionAnimation")),
                AnimationBinder.REUSABLE_EXPRESSION_ANIMATION_FIELD);
        for (CompiledNode node : compiledNodes) {
            if (node.isRequiresStorage()) {
                writeField(builder, s.referenceTypeName(node.getTypeName()), node.getFieldName());
            }
        }
        builder.writeLine();

        for (CompiledNode node : compiledNodes) {
            emitter.writeFactory(builder, node);
        }

        shell.writeClassEnd(builder, root, AnimationBinder.REUSABLE_EXPRESSION_ANIMATION_FIELD);

        log.debug("Generated {} factory methods and {} fields for {}", getFactoryMethodCount(), getFieldCount(), className);
        return builder.toString();
    }

    public long getFactoryMethodCount() {
        return compiledNodes.stream().filter(node -> !node.isInlined()).count();
    }

    public long getFieldCount() {
        return compiledNodes.stream().filter(CompiledNode::isRequiresStorage).count();
    }

    private String readonly(String typeName) {
        String prefix = context.getStringifier().getReadonly();
        return prefix == null || prefix.isBlank() ? typeName : prefix + " " + typeName;
    }

    private static void writeField(CodeBuilder builder, String typeName, String fieldName) {
        builder.writeLine(typeName + " " + fieldName + ";");
    }
}
