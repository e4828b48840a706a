package com.motionbake.codegen;

import com.motionbake.codegen.model.Color;
import com.motionbake.codegen.model.Vector2;
import com.motionbake.codegen.model.composition.CompositionColorBrush;
import com.motionbake.codegen.model.composition.CompositionGeometry;
import com.motionbake.codegen.model.composition.CompositionRoundedRectangleGeometry;
import com.motionbake.codegen.model.composition.CompositionSpriteShape;
import com.motionbake.codegen.model.composition.ShapeVisual;
import com.motionbake.codegen.model.composition.Visual;
import com.motionbake.codegen.service.codegen.InstantiatorGenerator;
import com.motionbake.codegen.service.codegen.csharp.CSharpTargetLanguage;
import com.motionbake.codegen.service.graph.Canonicalizer;
import com.motionbake.codegen.service.graph.ObjectGraph;

import java.time.Duration;

/**
 * Small scene graphs shared by the tests.
 */
public final class SceneFixtures {

    public static final Color RED = Color.fromArgb(0xFF, 0xFF, 0x00, 0x00);
    public static final Duration ONE_SECOND = Duration.ofSeconds(1);

    private SceneFixtures() {
    }

    public static CompositionSpriteShape sprite(CompositionColorBrush fill, CompositionGeometry geometry) {
        CompositionSpriteShape sprite = new CompositionSpriteShape();
        sprite.setFillBrush(fill);
        sprite.setGeometry(geometry);
        return sprite;
    }

    public static ShapeVisual shapeVisual(CompositionSpriteShape... shapes) {
        ShapeVisual visual = new ShapeVisual();
        visual.setSize(new Vector2(100, 100));
        for (CompositionSpriteShape shape : shapes) {
            visual.getShapes().add(shape);
        }
        return visual;
    }

    public static CompositionRoundedRectangleGeometry roundedRectangle(float size) {
        CompositionRoundedRectangleGeometry geometry = new CompositionRoundedRectangleGeometry();
        geometry.setSize(new Vector2(size, size));
        return geometry;
    }

    /** A visual with two sprites, each filled with its own red brush. */
    public static ShapeVisual twoRedSprites() {
        return shapeVisual(
                sprite(new CompositionColorBrush(RED), null),
                sprite(new CompositionColorBrush(RED), null));
    }

    public static ObjectGraph canonicalGraph(Visual root) {
        ObjectGraph graph = ObjectGraph.fromCompositionObject(root);
        Canonicalizer.canonicalize(graph, true);
        return graph;
    }

    public static InstantiatorGenerator generator(Visual root) {
        return new InstantiatorGenerator(canonicalGraph(root), new CSharpTargetLanguage(), ONE_SECOND, false);
    }

    public static String generate(Visual root) {
        return generator(root).generateCode("TestVisual", 100, 100, root.getProperties());
    }
}
