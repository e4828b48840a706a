package com.motionbake.codegen.service.graph;

import com.motionbake.codegen.model.composition.CompositionColorBrush;
import com.motionbake.codegen.model.composition.CompositionPathGeometry;
import com.motionbake.codegen.model.composition.CompositionSpriteShape;
import com.motionbake.codegen.model.composition.ExpressionAnimation;
import com.motionbake.codegen.model.composition.ShapeVisual;
import com.motionbake.codegen.model.geometry.CanvasGeometry;
import com.motionbake.codegen.model.geometry.CompositionPath;
import org.junit.jupiter.api.Test;

import static com.motionbake.codegen.SceneFixtures.RED;
import static com.motionbake.codegen.SceneFixtures.shapeVisual;
import static com.motionbake.codegen.SceneFixtures.sprite;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ObjectGraphTest {

    @Test
    void numbersNodesInConstructionOrder() {
        CompositionColorBrush brush = new CompositionColorBrush(RED);
        CompositionSpriteShape shape = sprite(brush, null);
        ShapeVisual root = shapeVisual(shape);

        ObjectGraph graph = ObjectGraph.fromCompositionObject(root);

        assertThat(graph.getRoot().getPosition()).isZero();
        assertThat(graph.rawNodeFor(root.getProperties()).getPosition()).isEqualTo(1);
        assertThat(graph.rawNodeFor(shape).getPosition()).isEqualTo(2);
        assertThat(graph.rawNodeFor(brush).getPosition()).isEqualTo(4);
    }

    @Test
    void visitsPathAndCanvasGeometryAfterTheirReferrer() {
        CanvasGeometry.Ellipse ellipse = new CanvasGeometry.Ellipse(0, 0, 5, 5);
        CompositionPath path = new CompositionPath(ellipse);
        CompositionPathGeometry geometry = new CompositionPathGeometry(path);
        ShapeVisual root = shapeVisual(sprite(null, geometry));

        ObjectGraph graph = ObjectGraph.fromCompositionObject(root);

        GraphNode pathNode = graph.rawNodeFor(path);
        GraphNode ellipseNode = graph.rawNodeFor(ellipse);
        assertThat(pathNode.getNodeType()).isEqualTo(NodeType.COMPOSITION_PATH);
        assertThat(ellipseNode.getNodeType()).isEqualTo(NodeType.CANVAS_GEOMETRY);
        assertThat(pathNode.getPosition()).isGreaterThan(graph.rawNodeFor(geometry).getPosition());
        assertThat(ellipseNode.getPosition()).isEqualTo(pathNode.getPosition() + 1);
    }

    @Test
    void recordsPropertySetReferencesAgainstTheOwner() {
        ShapeVisual root = new ShapeVisual();
        CompositionSpriteShape shape = sprite(null, null);
        root.getShapes().add(shape);
        ExpressionAnimation expression = new ExpressionAnimation("root.Progress");
        expression.setReferenceParameter("root", root.getProperties());
        shape.startAnimation("Offset", expression);

        ObjectGraph graph = ObjectGraph.fromCompositionObject(root);

        assertThat(graph.getRoot().getCanonicalInRefs()).containsExactly(graph.rawNodeFor(expression));
        assertThat(graph.rawNodeFor(root.getProperties()).getCanonicalInRefs()).isEmpty();
        // Animations are referenced by the object that starts them.
        assertThat(graph.rawNodeFor(expression).getCanonicalInRefs()).containsExactly(graph.rawNodeFor(shape));
    }

    @Test
    void countsEveryReferenceSite() {
        CompositionColorBrush brush = new CompositionColorBrush(RED);
        CompositionSpriteShape shape = sprite(brush, null);
        shape.setStrokeBrush(brush);

        ObjectGraph graph = ObjectGraph.fromCompositionObject(shapeVisual(shape));

        assertThat(graph.rawNodeFor(brush).getCanonicalInRefs()).hasSize(2);
    }

    @Test
    void rejectsObjectsOutsideTheGraph() {
        ObjectGraph graph = ObjectGraph.fromCompositionObject(shapeVisual());

        assertThatThrownBy(() -> graph.nodeFor(new CompositionColorBrush(RED)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
