package com.motionbake.codegen.service.codegen.csharp;

import com.motionbake.codegen.model.Vector2;
import com.motionbake.codegen.model.composition.CompositionPropertySet;
import com.motionbake.codegen.service.codegen.ClassShellWriter;
import com.motionbake.codegen.service.codegen.CodeBuilder;
import com.motionbake.codegen.service.codegen.CompiledNode;
import com.motionbake.codegen.service.codegen.Stringifier;

import java.time.Duration;

/**
 * Wraps the factories in an {@code IAnimatedVisualSource} whose nested
 * {@code AnimatedVisual} class holds the fields and factory methods.
 */
class CSharpClassShellWriter implements ClassShellWriter {

    static final String NAMESPACE = "AnimatedVisuals";
    static final String NESTED_CLASS_NAME = "AnimatedVisual";

    private final Stringifier s;
    private boolean requiresWin2d;
    private Vector2 size = Vector2.ZERO;

    CSharpClassShellWriter(Stringifier stringifier) {
        this.s = stringifier;
    }

    @Override
    public void writePreamble(CodeBuilder builder, boolean requiresWin2d) {
        this.requiresWin2d = requiresWin2d;
        if (requiresWin2d) {
            builder.writeLine("using Microsoft.Graphics.Canvas.Geometry;");
        }
        builder.writeLine("using Microsoft.UI.Xaml.Controls;");
        builder.writeLine("using System;");
        builder.writeLine("using System.Numerics;");
        if (requiresWin2d) {
            builder.writeLine("using Windows.Graphics;");
        }
        builder.writeLine("using Windows.UI;");
        builder.writeLine("using Windows.UI.Composition;");
        builder.writeLine();
    }

    @Override
    public void writeClassStart(CodeBuilder builder, String className, Vector2 size,
                                CompositionPropertySet progressPropertySet, Duration duration) {
        // C# rejects a nested type named like its enclosing type.
        if (NESTED_CLASS_NAME.equals(className)) {
            throw new IllegalArgumentException("Class name must differ from the nested class " + NESTED_CLASS_NAME);
        }
        this.size = size;
        builder.writeLine("namespace " + NAMESPACE);
        builder.openScope();
        builder.writeLine("sealed class " + className + " : IAnimatedVisualSource");
        builder.openScope();
        builder.writeLine("public IAnimatedVisual TryCreateAnimatedVisual(Compositor compositor, out object diagnostics)");
        builder.openScope();
        builder.writeLine("diagnostics = null;");
        builder.writeLine("return new " + NESTED_CLASS_NAME + "(compositor);");
        builder.closeScope();
        builder.writeLine();
        builder.writeLine("sealed class " + NESTED_CLASS_NAME + " : IAnimatedVisual");
        builder.openScope();
    }

    @Override
    public void writeClassEnd(CodeBuilder builder, CompiledNode root, String reusableExpressionAnimationField) {
        if (requiresWin2d) {
            builder.writeLine("static IGeometrySource2D CanvasGeometryToIGeometrySource2D(CanvasGeometry geo)");
            builder.openScope();
            builder.writeLine("return geo;");
            builder.closeScope();
            builder.writeLine();
        }

        builder.writeLine("internal " + NESTED_CLASS_NAME + "(Compositor compositor)");
        builder.openScope();
        builder.writeLine("_c = compositor;");
        builder.writeLine(reusableExpressionAnimationField + " = compositor.CreateExpressionAnimation();");
        builder.writeLine("RootVisual = " + root.factoryCall() + ";");
        builder.closeScope();
        builder.writeLine();
        builder.writeLine("public Visual RootVisual { get; }");
        builder.writeLine();
        builder.writeLine("public TimeSpan Duration => " + s.timeSpan("c_durationTicks") + ";");
        builder.writeLine();
        builder.writeLine("public Vector2 Size => " + s.vector2(size) + ";");
        builder.writeLine();
        builder.writeLine("public void Dispose() => RootVisual.Dispose();");
        builder.closeScope();
        builder.closeScope();
        builder.closeScope();
    }
}
