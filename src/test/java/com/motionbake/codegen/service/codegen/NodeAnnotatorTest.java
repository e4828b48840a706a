package com.motionbake.codegen.service.codegen;

import com.motionbake.codegen.model.Vector2;
import com.motionbake.codegen.model.composition.CompositionColorBrush;
import com.motionbake.codegen.model.composition.CompositionPathGeometry;
import com.motionbake.codegen.model.composition.CompositionSpriteShape;
import com.motionbake.codegen.model.composition.ExpressionAnimation;
import com.motionbake.codegen.model.composition.ScalarKeyFrameAnimation;
import com.motionbake.codegen.model.composition.ShapeVisual;
import com.motionbake.codegen.model.geometry.CanvasGeometry;
import com.motionbake.codegen.model.geometry.CompositionPath;
import com.motionbake.codegen.service.codegen.csharp.CSharpStringifier;
import org.junit.jupiter.api.Test;

import static com.motionbake.codegen.SceneFixtures.ONE_SECOND;
import static com.motionbake.codegen.SceneFixtures.RED;
import static com.motionbake.codegen.SceneFixtures.canonicalGraph;
import static com.motionbake.codegen.SceneFixtures.shapeVisual;
import static com.motionbake.codegen.SceneFixtures.sprite;
import static com.motionbake.codegen.SceneFixtures.twoRedSprites;
import static org.assertj.core.api.Assertions.assertThat;

class NodeAnnotatorTest {

    private static CompilationContext annotate(ShapeVisual root) {
        CompilationContext context = new CompilationContext(canonicalGraph(root), new CSharpStringifier(), ONE_SECOND,
                false);
        NodeAnnotator.annotate(context);
        return context;
    }

    @Test
    void namesSharedBrushAfterItsColor_andGivesItStorage() {
        ShapeVisual root = twoRedSprites();
        CompilationContext context = annotate(root);

        CompiledNode brush = context.compiledNodeFor(((CompositionSpriteShape) root.getShapes().get(0)).getFillBrush());
        assertThat(brush.getName()).isEqualTo("ColorBrush_Red");
        assertThat(brush.isRequiresStorage()).isTrue();
        assertThat(brush.getFieldName()).isEqualTo("_colorBrush_Red");
        assertThat(brush.getInboundReferences()).hasSize(2);
    }

    @Test
    void suffixesNamesThatCollide_inConstructionOrder() {
        ShapeVisual root = twoRedSprites();
        CompilationContext context = annotate(root);

        assertThat(context.compiledNodeFor(root.getShapes().get(0)).getName()).isEqualTo("SpriteShape_000");
        assertThat(context.compiledNodeFor(root.getShapes().get(1)).getName()).isEqualTo("SpriteShape_001");
        assertThat(context.getCompiledNodes()).extracting(CompiledNode::getName).doesNotHaveDuplicates();
    }

    @Test
    void namesRootRoot_withoutStorage_whenNothingReferencesIt() {
        CompilationContext context = annotate(twoRedSprites());

        CompiledNode root = context.getRoot();
        assertThat(root.getName()).isEqualTo(NodeAnnotator.ROOT_NAME);
        assertThat(root.isRequiresStorage()).isFalse();
        assertThat(root.getFieldName()).isNull();
    }

    @Test
    void givesRootStorage_whenAnExpressionReferencesIt() {
        ShapeVisual root = shapeVisual(sprite(null, null));
        ExpressionAnimation expression = new ExpressionAnimation("_.Progress");
        expression.setReferenceParameter("_", root.getProperties());
        root.getShapes().get(0).startAnimation("Opacity", expression);

        CompilationContext context = annotate(root);

        assertThat(context.getRoot().isRequiresStorage()).isTrue();
        assertThat(context.getRoot().getFieldName()).isEqualTo("_root");
    }

    @Test
    void dropsImplicitObjectsAndExpressionsUsedOnce() {
        ShapeVisual root = shapeVisual(sprite(null, null));
        CompositionSpriteShape shape = (CompositionSpriteShape) root.getShapes().get(0);
        ExpressionAnimation expression = new ExpressionAnimation("my.Offset");
        expression.setReferenceParameter("my", shape);
        shape.startAnimation("Offset", expression);

        CompilationContext context = annotate(root);

        assertThat(context.getCompiledNodes())
                .extracting(node -> node.getObject().getClass().getSimpleName())
                .containsExactlyInAnyOrder("ShapeVisual", "CompositionSpriteShape");
        // The expression's reference back to the shape is set up inside the shape's own factory.
        assertThat(context.compiledNodeFor(shape).getInboundReferences()).hasSize(1);
        assertThat(context.compiledNodeFor(shape).isRequiresStorage()).isFalse();
    }

    @Test
    void keepsExpressionInstance_boundOnTwoShapes() {
        ExpressionAnimation expression = new ExpressionAnimation("Progress * 2");
        CompositionSpriteShape first = sprite(null, null);
        CompositionSpriteShape second = sprite(null, null);
        first.startAnimation("Opacity", expression);
        second.startAnimation("Opacity", expression);

        CompilationContext context = annotate(shapeVisual(first, second));

        assertThat(NodeAnnotator.isSingleUseExpression(context.getGraph().nodeFor(expression))).isFalse();
        CompiledNode node = context.compiledNodeFor(expression);
        assertThat(node.getName()).isEqualTo("ExpressionAnimation");
        assertThat(node.isRequiresStorage()).isTrue();
        assertThat(node.getInboundReferences()).hasSize(2);
    }

    @Test
    void inlinesPathReferencedOnce() {
        CompositionPath path = new CompositionPath(new CanvasGeometry.Ellipse(0, 0, 4, 4));
        ShapeVisual root = shapeVisual(sprite(null, new CompositionPathGeometry(path)));

        CompilationContext context = annotate(root);

        CompiledNode pathNode = context.compiledNodeFor(path);
        assertThat(pathNode.isInlined()).isTrue();
        assertThat(pathNode.factoryCall())
                .isEqualTo("new CompositionPath(CanvasGeometryToIGeometrySource2D(Geometry()))");
    }

    @Test
    void keepsFactoryForPathReferencedTwice() {
        CompositionPath path = new CompositionPath(new CanvasGeometry.Ellipse(0, 0, 4, 4));
        CompositionPathGeometry first = new CompositionPathGeometry(path);
        CompositionPathGeometry second = new CompositionPathGeometry(path);
        second.setTrimEnd(0.5f);
        ShapeVisual root = shapeVisual(sprite(null, first), sprite(null, second));

        CompilationContext context = annotate(root);

        CompiledNode pathNode = context.compiledNodeFor(path);
        assertThat(pathNode.isInlined()).isFalse();
        assertThat(pathNode.isRequiresStorage()).isTrue();
        assertThat(pathNode.getName()).isEqualTo("Path");
    }

    @Test
    void describesScalarAnimationByItsRange() {
        CompositionColorBrush brush = new CompositionColorBrush(RED);
        ScalarKeyFrameAnimation animation = new ScalarKeyFrameAnimation();
        animation.insertKeyFrame(0, 0f, null);
        animation.insertKeyFrame(1, 0.5f, null);
        brush.startAnimation("Opacity", animation);
        ShapeVisual root = shapeVisual(sprite(brush, null));

        CompilationContext context = annotate(root);

        assertThat(context.compiledNodeFor(animation).getName()).isEqualTo("ScalarAnimation_0_to_0p5");
    }

    @Test
    void writesFloatsForIdentifiers() {
        assertThat(NodeAnnotator.floatId(10f)).isEqualTo("10");
        assertThat(NodeAnnotator.floatId(0.5f)).isEqualTo("0p5");
        assertThat(NodeAnnotator.floatId(-1.25f)).isEqualTo("m1p25");
        assertThat(NodeAnnotator.floatId(1f / 3)).isEqualTo("0p333");
        assertThat(NodeAnnotator.vector2Id(new Vector2(10, 10))).isEqualTo("10");
        assertThat(NodeAnnotator.vector2Id(new Vector2(10, 20))).isEqualTo("10x20");
    }
}
