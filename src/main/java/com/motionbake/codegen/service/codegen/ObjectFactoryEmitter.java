package com.motionbake.codegen.service.codegen;

import com.motionbake.codegen.exception.CodegenFaultException;
import com.motionbake.codegen.exception.CodegenFaultException.Fault;
import com.motionbake.codegen.model.CompositionStrokeCap;
import com.motionbake.codegen.model.CompositionStrokeLineJoin;
import com.motionbake.codegen.model.Vector2;
import com.motionbake.codegen.model.composition.ColorKeyFrameAnimation;
import com.motionbake.codegen.model.composition.CompositionAnimation;
import com.motionbake.codegen.model.composition.CompositionClip;
import com.motionbake.codegen.model.composition.CompositionColorBrush;
import com.motionbake.codegen.model.composition.CompositionContainerShape;
import com.motionbake.codegen.model.composition.CompositionEllipseGeometry;
import com.motionbake.codegen.model.composition.CompositionGeometry;
import com.motionbake.codegen.model.composition.CompositionObject;
import com.motionbake.codegen.model.composition.CompositionPathGeometry;
import com.motionbake.codegen.model.composition.CompositionPropertySet;
import com.motionbake.codegen.model.composition.CompositionRectangleGeometry;
import com.motionbake.codegen.model.composition.CompositionRoundedRectangleGeometry;
import com.motionbake.codegen.model.composition.CompositionShape;
import com.motionbake.codegen.model.composition.CompositionSpriteShape;
import com.motionbake.codegen.model.composition.CompositionViewBox;
import com.motionbake.codegen.model.composition.ContainerVisual;
import com.motionbake.codegen.model.composition.CubicBezierEasingFunction;
import com.motionbake.codegen.model.composition.ExpressionAnimation;
import com.motionbake.codegen.model.composition.InsetClip;
import com.motionbake.codegen.model.composition.KeyFrameAnimation;
import com.motionbake.codegen.model.composition.LinearEasingFunction;
import com.motionbake.codegen.model.composition.PathKeyFrameAnimation;
import com.motionbake.codegen.model.composition.ScalarKeyFrameAnimation;
import com.motionbake.codegen.model.composition.ShapeVisual;
import com.motionbake.codegen.model.composition.StepEasingFunction;
import com.motionbake.codegen.model.composition.Vector2KeyFrameAnimation;
import com.motionbake.codegen.model.composition.Vector3KeyFrameAnimation;
import com.motionbake.codegen.model.composition.Visual;
import com.motionbake.codegen.model.geometry.CanvasGeometry;
import com.motionbake.codegen.model.geometry.CompositionPath;
import com.motionbake.codegen.service.graph.GraphNode;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Writes the factory method of a compiled node.
 *
 * Every factory creates its object into a {@code result} local (and the cache
 * field when the node has storage), sets the properties that differ from the
 * runtime defaults, wires up referenced objects through the resolver, starts its
 * animations and returns the result. Objects with nothing to set get a one-line
 * factory.
 */
public final class ObjectFactoryEmitter {

    public static final String DURATION_TICKS_FIELD = "c_durationTicks";

    private final CompilationContext context;
    private final AnimationBinder binder;
    private final CanvasGeometryWriter geometryWriter;
    private final Stringifier s;
    private final String deref;

    public ObjectFactoryEmitter(CompilationContext context, AnimationBinder binder, CanvasGeometryWriter geometryWriter) {
        this.context = context;
        this.binder = binder;
        this.geometryWriter = geometryWriter;
        this.s = context.getStringifier();
        this.deref = s.getDeref();
    }

    /**
     * Writes the factory of {@code node}. Inlined nodes have no factory and write nothing.
     */
    public void writeFactory(CodeBuilder builder, CompiledNode node) {
        if (node.isInlined()) {
            return;
        }
        switch (node.getGraphNode().getNodeType()) {
            case COMPOSITION_OBJECT -> writeCompositionObjectFactory(builder, (CompositionObject) node.getObject(), node);
            case COMPOSITION_PATH -> writeCompositionPathFactory(builder, (CompositionPath) node.getObject(), node);
            case CANVAS_GEOMETRY -> writeCanvasGeometryFactory(builder, (CanvasGeometry) node.getObject(), node);
        }
    }

    private void writeCompositionObjectFactory(CodeBuilder builder, CompositionObject obj, CompiledNode node) {
        Runnable writer = switch (obj.getType()) {
            case COLOR_KEY_FRAME_ANIMATION -> () -> writeColorKeyFrameAnimation(builder, (ColorKeyFrameAnimation) obj, node);
            case COMPOSITION_COLOR_BRUSH -> () -> writeColorBrush(builder, (CompositionColorBrush) obj, node);
            case COMPOSITION_CONTAINER_SHAPE -> () -> writeContainerShape(builder, (CompositionContainerShape) obj, node);
            case COMPOSITION_ELLIPSE_GEOMETRY -> () -> writeEllipseGeometry(builder, (CompositionEllipseGeometry) obj, node);
            case COMPOSITION_PATH_GEOMETRY -> () -> writePathGeometry(builder, (CompositionPathGeometry) obj, node);
            case COMPOSITION_RECTANGLE_GEOMETRY ->
                    () -> writeRectangleGeometry(builder, (CompositionRectangleGeometry) obj, node);
            case COMPOSITION_ROUNDED_RECTANGLE_GEOMETRY ->
                    () -> writeRoundedRectangleGeometry(builder, (CompositionRoundedRectangleGeometry) obj, node);
            case COMPOSITION_SPRITE_SHAPE -> () -> writeSpriteShape(builder, (CompositionSpriteShape) obj, node);
            case COMPOSITION_VIEW_BOX -> () -> writeViewBox(builder, (CompositionViewBox) obj, node);
            case CONTAINER_VISUAL -> () -> writeContainerVisual(builder, (ContainerVisual) obj, node);
            case CUBIC_BEZIER_EASING_FUNCTION ->
                    () -> writeCubicBezierEasingFunction(builder, (CubicBezierEasingFunction) obj, node);
            case EXPRESSION_ANIMATION -> () -> writeExpressionAnimation(builder, (ExpressionAnimation) obj, node);
            case INSET_CLIP -> () -> writeInsetClip(builder, (InsetClip) obj, node);
            case LINEAR_EASING_FUNCTION -> () -> writeLinearEasingFunction(builder, (LinearEasingFunction) obj, node);
            case PATH_KEY_FRAME_ANIMATION -> () -> writePathKeyFrameAnimation(builder, (PathKeyFrameAnimation) obj, node);
            case SCALAR_KEY_FRAME_ANIMATION ->
                    () -> writeScalarKeyFrameAnimation(builder, (ScalarKeyFrameAnimation) obj, node);
            case SHAPE_VISUAL -> () -> writeShapeVisual(builder, (ShapeVisual) obj, node);
            case STEP_EASING_FUNCTION -> () -> writeStepEasingFunction(builder, (StepEasingFunction) obj, node);
            case VECTOR2_KEY_FRAME_ANIMATION ->
                    () -> writeVector2KeyFrameAnimation(builder, (Vector2KeyFrameAnimation) obj, node);
            case VECTOR3_KEY_FRAME_ANIMATION ->
                    () -> writeVector3KeyFrameAnimation(builder, (Vector3KeyFrameAnimation) obj, node);
            // Created by their owner and written as part of the owner's factory.
            case ANIMATION_CONTROLLER, COMPOSITION_PROPERTY_SET -> throw new CodegenFaultException(
                    Fault.UNRETAINED_NODE, "No factory is written for " + obj.getType().getTypeName());
        };
        writer.run();
    }

    private void writeCanvasGeometryFactory(CodeBuilder builder, CanvasGeometry obj, CompiledNode node) {
        String typeName = s.referenceTypeName(node.getTypeName());
        String fieldName = node.getFieldName();
        writeObjectFactoryStart(builder, node);
        switch (obj.getGeometryType()) {
            case COMBINATION -> geometryWriter.writeCombination(builder, (CanvasGeometry.Combination) obj, typeName, fieldName,
                    geometry -> reference(node, geometry));
            case ELLIPSE -> geometryWriter.writeEllipse(builder, (CanvasGeometry.Ellipse) obj, typeName, fieldName);
            case PATH -> geometryWriter.writePath(builder, (CanvasGeometry.Path) obj, typeName, fieldName);
            case ROUNDED_RECTANGLE ->
                    geometryWriter.writeRoundedRectangle(builder, (CanvasGeometry.RoundedRectangle) obj, typeName, fieldName);
        }
        writeObjectFactoryEnd(builder);
    }

    private void writeCompositionPathFactory(CodeBuilder builder, CompositionPath obj, CompiledNode node) {
        writeObjectFactoryStart(builder, node);
        writeCreateAssignment(builder, node,
                s.getNew() + " CompositionPath(" + s.factoryCall(reference(node, obj.getSource())) + ")");
        writeObjectFactoryEnd(builder);
    }

    private void writeColorBrush(CodeBuilder builder, CompositionColorBrush obj, CompiledNode node) {
        String create = "_c" + deref + "CreateColorBrush(" + s.color(obj.getColor()) + ")";
        if (obj.getAllAnimators().isEmpty() && !hasObjectProperties(obj)) {
            writeSimpleObjectFactory(builder, node, create);
            return;
        }
        writeObjectFactoryStart(builder, node);
        writeCreateAssignment(builder, node, create);
        initializeCompositionObject(builder, obj);
        binder.startAnimations(builder, obj, node);
        writeObjectFactoryEnd(builder);
    }

    private void writeContainerShape(CodeBuilder builder, CompositionContainerShape obj, CompiledNode node) {
        writeObjectFactoryStart(builder, node);
        writeCreateAssignment(builder, node, "_c" + deref + "CreateContainerShape()");
        initializeCompositionShape(builder, obj);
        if (!obj.getShapes().isEmpty()) {
            builder.writeLine(s.getVar() + " shapes = result" + deref + "Shapes;");
            for (CompositionShape shape : obj.getShapes()) {
                builder.writeLine("shapes" + deref + s.getIListAdd() + "(" + reference(node, shape) + ");");
            }
        }
        binder.startAnimations(builder, obj, node);
        writeObjectFactoryEnd(builder);
    }

    private void writeEllipseGeometry(CodeBuilder builder, CompositionEllipseGeometry obj, CompiledNode node) {
        writeObjectFactoryStart(builder, node);
        writeCreateAssignment(builder, node, "_c" + deref + "CreateEllipseGeometry()");
        initializeCompositionGeometry(builder, obj);
        if (!Vector2.ZERO.equals(obj.getCenter())) {
            builder.writeLine("result" + deref + "Center = " + s.vector2(obj.getCenter()) + ";");
        }
        builder.writeLine("result" + deref + "Radius = " + s.vector2(obj.getRadius()) + ";");
        binder.startAnimations(builder, obj, node);
        writeObjectFactoryEnd(builder);
    }

    private void writePathGeometry(CodeBuilder builder, CompositionPathGeometry obj, CompiledNode node) {
        writeObjectFactoryStart(builder, node);
        writeCreateAssignment(builder, node, "_c" + deref + "CreatePathGeometry(" + reference(node, obj.getPath()) + ")");
        initializeCompositionGeometry(builder, obj);
        binder.startAnimations(builder, obj, node);
        writeObjectFactoryEnd(builder);
    }

    private void writeRectangleGeometry(CodeBuilder builder, CompositionRectangleGeometry obj, CompiledNode node) {
        writeObjectFactoryStart(builder, node);
        writeCreateAssignment(builder, node, "_c" + deref + "CreateRectangleGeometry()");
        initializeCompositionGeometry(builder, obj);
        builder.writeLine("result" + deref + "Size = " + s.vector2(obj.getSize()) + ";");
        binder.startAnimations(builder, obj, node);
        writeObjectFactoryEnd(builder);
    }

    private void writeRoundedRectangleGeometry(CodeBuilder builder, CompositionRoundedRectangleGeometry obj,
                                               CompiledNode node) {
        writeObjectFactoryStart(builder, node);
        writeCreateAssignment(builder, node, "_c" + deref + "CreateRoundedRectangleGeometry()");
        initializeCompositionGeometry(builder, obj);
        builder.writeLine("result" + deref + "CornerRadius = " + s.vector2(obj.getCornerRadius()) + ";");
        builder.writeLine("result" + deref + "Size = " + s.vector2(obj.getSize()) + ";");
        binder.startAnimations(builder, obj, node);
        writeObjectFactoryEnd(builder);
    }

    private void writeSpriteShape(CodeBuilder builder, CompositionSpriteShape obj, CompiledNode node) {
        writeObjectFactoryStart(builder, node);
        writeCreateAssignment(builder, node, "_c" + deref + "CreateSpriteShape()");
        initializeCompositionShape(builder, obj);

        if (obj.getFillBrush() != null) {
            builder.writeLine("result" + deref + "FillBrush = " + reference(node, obj.getFillBrush()) + ";");
        }
        if (obj.getGeometry() != null) {
            builder.writeLine("result" + deref + "Geometry = " + reference(node, obj.getGeometry()) + ";");
        }
        if (obj.isStrokeNonScaling()) {
            builder.writeLine("result" + deref + "IsStrokeNonScaling = " + s.bool(true) + ";");
        }
        if (obj.getStrokeBrush() != null) {
            builder.writeLine("result" + deref + "StrokeBrush = " + reference(node, obj.getStrokeBrush()) + ";");
        }
        if (obj.getStrokeDashCap() != CompositionStrokeCap.FLAT) {
            builder.writeLine("result" + deref + "StrokeDashCap = " + strokeCap(obj.getStrokeDashCap()) + ";");
        }
        if (obj.getStrokeDashOffset() != 0) {
            builder.writeLine("result" + deref + "StrokeDashOffset = " + s.float32(obj.getStrokeDashOffset()) + ";");
        }
        if (!obj.getStrokeDashArray().isEmpty()) {
            builder.writeLine(s.getVar() + " strokeDashArray = result" + deref + "StrokeDashArray;");
            for (Float dash : obj.getStrokeDashArray()) {
                builder.writeLine("strokeDashArray" + deref + s.getIListAdd() + "(" + s.float32(dash) + ");");
            }
        }
        if (obj.getStrokeEndCap() != CompositionStrokeCap.FLAT) {
            builder.writeLine("result" + deref + "StrokeEndCap = " + strokeCap(obj.getStrokeEndCap()) + ";");
        }
        if (obj.getStrokeLineJoin() != CompositionStrokeLineJoin.MITER) {
            builder.writeLine("result" + deref + "StrokeLineJoin = " + strokeLineJoin(obj.getStrokeLineJoin()) + ";");
        }
        if (obj.getStrokeStartCap() != CompositionStrokeCap.FLAT) {
            builder.writeLine("result" + deref + "StrokeStartCap = " + strokeCap(obj.getStrokeStartCap()) + ";");
        }
        if (obj.getStrokeMiterLimit() != 1) {
            builder.writeLine("result" + deref + "StrokeMiterLimit = " + s.float32(obj.getStrokeMiterLimit()) + ";");
        }
        if (obj.getStrokeThickness() != 1) {
            builder.writeLine("result" + deref + "StrokeThickness = " + s.float32(obj.getStrokeThickness()) + ";");
        }
        binder.startAnimations(builder, obj, node);
        writeObjectFactoryEnd(builder);
    }

    private void writeViewBox(CodeBuilder builder, CompositionViewBox obj, CompiledNode node) {
        writeObjectFactoryStart(builder, node);
        writeCreateAssignment(builder, node, "_c" + deref + "CreateViewBox()");
        initializeCompositionObject(builder, obj);
        builder.writeLine("result" + deref + "Size = " + s.vector2(obj.getSize()) + ";");
        binder.startAnimations(builder, obj, node);
        writeObjectFactoryEnd(builder);
    }

    private void writeContainerVisual(CodeBuilder builder, ContainerVisual obj, CompiledNode node) {
        writeObjectFactoryStart(builder, node);
        writeCreateAssignment(builder, node, "_c" + deref + "CreateContainerVisual()");
        initializeContainerVisual(builder, obj, node);
        binder.startAnimations(builder, obj, node);
        writeObjectFactoryEnd(builder);
    }

    private void writeShapeVisual(CodeBuilder builder, ShapeVisual obj, CompiledNode node) {
        writeObjectFactoryStart(builder, node);
        writeCreateAssignment(builder, node, "_c" + deref + "CreateShapeVisual()");
        initializeContainerVisual(builder, obj, node);
        if (!obj.getShapes().isEmpty()) {
            builder.writeLine(s.getVar() + " shapes = result" + deref + "Shapes;");
            for (CompositionShape shape : obj.getShapes()) {
                builder.writeComment(shape.getShortDescription());
                builder.writeLine("shapes" + deref + s.getIListAdd() + "(" + reference(node, shape) + ");");
            }
        }
        if (obj.getViewBox() != null) {
            builder.writeLine("result" + deref + "ViewBox = " + reference(node, obj.getViewBox()) + ";");
        }
        binder.startAnimations(builder, obj, node);
        writeObjectFactoryEnd(builder);
    }

    private void writeCubicBezierEasingFunction(CodeBuilder builder, CubicBezierEasingFunction obj, CompiledNode node) {
        writeSimpleObjectFactory(builder, node, "_c" + deref + "CreateCubicBezierEasingFunction("
                + s.vector2(obj.getControlPoint1()) + ", " + s.vector2(obj.getControlPoint2()) + ")");
    }

    private void writeLinearEasingFunction(CodeBuilder builder, LinearEasingFunction obj, CompiledNode node) {
        writeSimpleObjectFactory(builder, node, "_c" + deref + "CreateLinearEasingFunction()");
    }

    private void writeStepEasingFunction(CodeBuilder builder, StepEasingFunction obj, CompiledNode node) {
        writeObjectFactoryStart(builder, node);
        writeCreateAssignment(builder, node, "_c" + deref + "CreateStepEasingFunction()");
        if (obj.getFinalStep() != 1) {
            builder.writeLine("result" + deref + "FinalStep = " + s.int32(obj.getFinalStep()) + ";");
        }
        if (obj.getInitialStep() != 0) {
            builder.writeLine("result" + deref + "InitialStep = " + s.int32(obj.getInitialStep()) + ";");
        }
        if (obj.isFinalStepSingleFrame()) {
            builder.writeLine("result" + deref + "IsFinalStepSingleFrame = " + s.bool(true) + ";");
        }
        if (obj.isInitialStepSingleFrame()) {
            builder.writeLine("result" + deref + "IsInitialStepSingleFrame = " + s.bool(true) + ";");
        }
        if (obj.getStepCount() != 1) {
            builder.writeLine("result" + deref + "StepCount = " + s.int32(obj.getStepCount()) + ";");
        }
        writeObjectFactoryEnd(builder);
    }

    private void writeExpressionAnimation(CodeBuilder builder, ExpressionAnimation obj, CompiledNode node) {
        writeObjectFactoryStart(builder, node);
        writeCreateAssignment(builder, node, "_c" + deref + "CreateExpressionAnimation()");
        initializeCompositionAnimation(builder, obj, node);
        builder.writeLine("result" + deref + "Expression = " + s.string(obj.getExpression()) + ";");
        binder.startAnimations(builder, obj, node);
        writeObjectFactoryEnd(builder);
    }

    private void writeInsetClip(CodeBuilder builder, InsetClip obj, CompiledNode node) {
        writeObjectFactoryStart(builder, node);
        writeCreateAssignment(builder, node, "_c" + deref + "CreateInsetClip()");
        initializeCompositionClip(builder, obj);
        if (obj.getLeftInset() != 0) {
            builder.writeLine("result" + deref + "LeftInset = " + s.float32(obj.getLeftInset()) + ";");
        }
        if (obj.getRightInset() != 0) {
            builder.writeLine("result" + deref + "RightInset = " + s.float32(obj.getRightInset()) + ";");
        }
        if (obj.getTopInset() != 0) {
            builder.writeLine("result" + deref + "TopInset = " + s.float32(obj.getTopInset()) + ";");
        }
        if (obj.getBottomInset() != 0) {
            builder.writeLine("result" + deref + "BottomInset = " + s.float32(obj.getBottomInset()) + ";");
        }
        binder.startAnimations(builder, obj, node);
        writeObjectFactoryEnd(builder);
    }

    private void writeColorKeyFrameAnimation(CodeBuilder builder, ColorKeyFrameAnimation obj, CompiledNode node) {
        writeKeyFrameAnimation(builder, obj, node, "CreateColorKeyFrameAnimation", s::color, color -> color.getName());
    }

    private void writeScalarKeyFrameAnimation(CodeBuilder builder, ScalarKeyFrameAnimation obj, CompiledNode node) {
        writeKeyFrameAnimation(builder, obj, node, "CreateScalarKeyFrameAnimation", s::float32, null);
    }

    private void writeVector2KeyFrameAnimation(CodeBuilder builder, Vector2KeyFrameAnimation obj, CompiledNode node) {
        writeKeyFrameAnimation(builder, obj, node, "CreateVector2KeyFrameAnimation", s::vector2, null);
    }

    private void writeVector3KeyFrameAnimation(CodeBuilder builder, Vector3KeyFrameAnimation obj, CompiledNode node) {
        writeKeyFrameAnimation(builder, obj, node, "CreateVector3KeyFrameAnimation", s::vector3, null);
    }

    private void writePathKeyFrameAnimation(CodeBuilder builder, PathKeyFrameAnimation obj, CompiledNode node) {
        writeKeyFrameAnimation(builder, obj, node, "CreatePathKeyFrameAnimation", path -> reference(node, path), null);
    }

    /**
     * @param valueComment optional comment written before each value keyframe
     */
    private <T> void writeKeyFrameAnimation(CodeBuilder builder, KeyFrameAnimation<T> obj, CompiledNode node,
                                            String createMethod, Function<T, String> valueText,
                                            Function<T, String> valueComment) {
        writeObjectFactoryStart(builder, node);
        writeCreateAssignment(builder, node, "_c" + deref + createMethod + "()");
        initializeCompositionAnimation(builder, obj, node);
        builder.writeLine("result" + deref + "Duration = " + timeSpan(obj.getDuration()) + ";");

        for (KeyFrameAnimation.KeyFrame<T> keyFrame : obj.getKeyFrames()) {
            String progress = s.float32(keyFrame.getProgress());
            if (keyFrame instanceof KeyFrameAnimation.ValueKeyFrame<T> valueKeyFrame) {
                if (valueComment != null) {
                    builder.writeComment(valueComment.apply(valueKeyFrame.getValue()));
                }
                String value = valueText.apply(valueKeyFrame.getValue());
                builder.writeLine("result" + deref + "InsertKeyFrame(" + progress + ", " + value
                        + easingArgument(node, keyFrame) + ");");
            } else {
                String expression = s.string(((KeyFrameAnimation.ExpressionKeyFrame<T>) keyFrame).getExpression());
                builder.writeLine("result" + deref + "InsertExpressionKeyFrame(" + progress + ", " + expression
                        + easingArgument(node, keyFrame) + ");");
            }
        }
        binder.startAnimations(builder, obj, node);
        writeObjectFactoryEnd(builder);
    }

    private String easingArgument(CompiledNode node, KeyFrameAnimation.KeyFrame<?> keyFrame) {
        return keyFrame.getEasing() == null ? "" : ", " + reference(node, keyFrame.getEasing());
    }

    private void initializeCompositionObject(CodeBuilder builder, CompositionObject obj) {
        if (context.isSetCommentProperties() && obj.getComment() != null && !obj.getComment().isBlank()) {
            builder.writeLine("result" + deref + "Comment = " + s.string(obj.getComment()) + ";");
        }

        CompositionPropertySet propertySet = obj.getProperties();
        if (propertySet.hasPropertyValues()) {
            builder.writeLine(s.getVar() + " propertySet = result" + deref + "Properties;");
            for (Map.Entry<String, Float> property : propertySet.getScalarProperties().entrySet()) {
                builder.writeLine("propertySet" + deref + "InsertScalar(" + s.string(property.getKey()) + ", "
                        + s.float32(property.getValue()) + ");");
            }
            for (Map.Entry<String, Vector2> property : propertySet.getVector2Properties().entrySet()) {
                builder.writeLine("propertySet" + deref + "InsertVector2(" + s.string(property.getKey()) + ", "
                        + s.vector2(property.getValue()) + ");");
            }
        }
    }

    private void initializeVisual(CodeBuilder builder, Visual obj, CompiledNode node) {
        initializeCompositionObject(builder, obj);
        if (obj.getCenterPoint() != null) {
            builder.writeLine("result" + deref + "CenterPoint = " + s.vector3(obj.getCenterPoint()) + ";");
        }
        if (obj.getClip() != null) {
            builder.writeLine("result" + deref + "Clip = " + reference(node, obj.getClip()) + ";");
        }
        if (obj.getOffset() != null) {
            builder.writeLine("result" + deref + "Offset = " + s.vector3(obj.getOffset()) + ";");
        }
        if (obj.getRotationAngleInDegrees() != null) {
            builder.writeLine("result" + deref + "RotationAngleInDegrees = " + s.float32(obj.getRotationAngleInDegrees()) + ";");
        }
        if (obj.getScale() != null) {
            builder.writeLine("result" + deref + "Scale = " + s.vector3(obj.getScale()) + ";");
        }
        if (obj.getSize() != null) {
            builder.writeLine("result" + deref + "Size = " + s.vector2(obj.getSize()) + ";");
        }
    }

    private void initializeContainerVisual(CodeBuilder builder, ContainerVisual obj, CompiledNode node) {
        initializeVisual(builder, obj, node);
        if (!obj.getChildren().isEmpty()) {
            builder.writeLine(s.getVar() + " children = result" + deref + "Children;");
            for (Visual child : obj.getChildren()) {
                builder.writeLine("children" + deref + "InsertAtTop(" + reference(node, child) + ");");
            }
        }
    }

    private void initializeCompositionClip(CodeBuilder builder, CompositionClip obj) {
        initializeCompositionObject(builder, obj);
        if (!Vector2.ZERO.equals(obj.getCenterPoint())) {
            builder.writeLine("result" + deref + "CenterPoint = " + s.vector2(obj.getCenterPoint()) + ";");
        }
        if (!Vector2.ONE.equals(obj.getScale())) {
            builder.writeLine("result" + deref + "Scale = " + s.vector2(obj.getScale()) + ";");
        }
    }

    private void initializeCompositionShape(CodeBuilder builder, CompositionShape obj) {
        initializeCompositionObject(builder, obj);
        if (obj.getCenterPoint() != null) {
            builder.writeLine("result" + deref + "CenterPoint = " + s.vector2(obj.getCenterPoint()) + ";");
        }
        if (obj.getOffset() != null) {
            builder.writeLine("result" + deref + "Offset = " + s.vector2(obj.getOffset()) + ";");
        }
        if (obj.getRotationAngleInDegrees() != null) {
            builder.writeLine("result" + deref + "RotationAngleInDegrees = " + s.float32(obj.getRotationAngleInDegrees()) + ";");
        }
        if (obj.getScale() != null) {
            builder.writeLine("result" + deref + "Scale = " + s.vector2(obj.getScale()) + ";");
        }
    }

    private void initializeCompositionGeometry(CodeBuilder builder, CompositionGeometry obj) {
        initializeCompositionObject(builder, obj);
        if (obj.getTrimEnd() != 1) {
            builder.writeLine("result" + deref + "TrimEnd = " + s.float32(obj.getTrimEnd()) + ";");
        }
        if (obj.getTrimOffset() != 0) {
            builder.writeLine("result" + deref + "TrimOffset = " + s.float32(obj.getTrimOffset()) + ";");
        }
        if (obj.getTrimStart() != 0) {
            builder.writeLine("result" + deref + "TrimStart = " + s.float32(obj.getTrimStart()) + ";");
        }
    }

    private void initializeCompositionAnimation(CodeBuilder builder, CompositionAnimation obj, CompiledNode node) {
        initializeCompositionObject(builder, obj);
        if (obj.getTarget() != null && !obj.getTarget().isBlank()) {
            builder.writeLine("result" + deref + "Target = " + s.string(obj.getTarget()) + ";");
        }
        for (Map.Entry<String, CompositionObject> parameter : obj.getReferenceParameters().entrySet()) {
            builder.writeLine("result" + deref + "SetReferenceParameter(" + s.string(parameter.getKey()) + ", "
                    + reference(node, parameter.getValue()) + ");");
        }
    }

    private boolean hasObjectProperties(CompositionObject obj) {
        return obj.getProperties().hasPropertyValues()
                || (context.isSetCommentProperties() && obj.getComment() != null && !obj.getComment().isBlank());
    }

    private String reference(CompiledNode caller, Object callee) {
        return context.getResolver().resolve(caller.getGraphNode(), callee).text();
    }

    private String timeSpan(Duration value) {
        return value.equals(context.getCompositionDuration()) ? s.timeSpan(DURATION_TICKS_FIELD) : s.timeSpan(value);
    }

    private String strokeCap(CompositionStrokeCap value) {
        return "CompositionStrokeCap" + s.getScopeResolve() + value.getDisplayName();
    }

    private String strokeLineJoin(CompositionStrokeLineJoin value) {
        return "CompositionStrokeLineJoin" + s.getScopeResolve() + value.getDisplayName();
    }

    private void writeCreateAssignment(CodeBuilder builder, CompiledNode node, String createCallText) {
        if (node.isRequiresStorage()) {
            builder.writeLine(s.getVar() + " result = " + node.getFieldName() + " = " + createCallText + ";");
        } else {
            builder.writeLine(s.getVar() + " result = " + createCallText + ";");
        }
    }

    private void writeSimpleObjectFactory(CodeBuilder builder, CompiledNode node, String createCallText) {
        writeObjectFactoryStart(builder, node);
        if (node.isRequiresStorage()) {
            builder.writeLine("return " + node.getFieldName() + " = " + createCallText + ";");
        } else {
            builder.writeLine("return " + createCallText + ";");
        }
        builder.closeScope();
        builder.writeLine();
    }

    private void writeObjectFactoryStart(CodeBuilder builder, CompiledNode node) {
        builder.writeComment(longComment(node));
        builder.writeLine(s.referenceTypeName(node.getTypeName()) + " " + node.getName() + "()");
        builder.openScope();
    }

    private void writeObjectFactoryEnd(CodeBuilder builder) {
        builder.writeLine("return result;");
        builder.closeScope();
        builder.writeLine();
    }

    /**
     * Short descriptions of the chain of single referrers leading to the node, most
     * distant first and each indented two more spaces, followed by the node's own
     * long description.
     */
    String longComment(CompiledNode node) {
        List<String> lines = new ArrayList<>();
        int indent = 0;
        for (String ancestor : ancestorShortComments(node.getGraphNode(), new HashSet<>())) {
            lines.add(" ".repeat(indent) + ancestor);
            indent += 2;
        }
        String own = node.getGraphNode().getLongDescription();
        if (own != null && !own.isBlank()) {
            lines.add(own);
        }
        return String.join("\n", lines);
    }

    private List<String> ancestorShortComments(GraphNode node, Set<GraphNode> visited) {
        Set<GraphNode> parents = new LinkedHashSet<>(node.getCanonicalInRefs());
        if (parents.size() != 1) {
            return new ArrayList<>();
        }
        GraphNode parent = parents.iterator().next();
        String shortComment = parent.getShortDescription();
        if (shortComment == null || shortComment.isBlank() || !visited.add(parent)) {
            return new ArrayList<>();
        }
        List<String> result = ancestorShortComments(parent, visited);
        result.add(shortComment);
        return result;
    }
}
