package com.motionbake.codegen.model.composition;

/**
 * The closed set of composition object variants. {@link #getTypeName()} is the
 * name of the corresponding runtime type in generated code.
 */
public enum CompositionObjectType {
    ANIMATION_CONTROLLER("AnimationController"),
    COLOR_KEY_FRAME_ANIMATION("ColorKeyFrameAnimation"),
    COMPOSITION_COLOR_BRUSH("CompositionColorBrush"),
    COMPOSITION_CONTAINER_SHAPE("CompositionContainerShape"),
    COMPOSITION_ELLIPSE_GEOMETRY("CompositionEllipseGeometry"),
    COMPOSITION_PATH_GEOMETRY("CompositionPathGeometry"),
    COMPOSITION_PROPERTY_SET("CompositionPropertySet"),
    COMPOSITION_RECTANGLE_GEOMETRY("CompositionRectangleGeometry"),
    COMPOSITION_ROUNDED_RECTANGLE_GEOMETRY("CompositionRoundedRectangleGeometry"),
    COMPOSITION_SPRITE_SHAPE("CompositionSpriteShape"),
    COMPOSITION_VIEW_BOX("CompositionViewBox"),
    CONTAINER_VISUAL("ContainerVisual"),
    CUBIC_BEZIER_EASING_FUNCTION("CubicBezierEasingFunction"),
    EXPRESSION_ANIMATION("ExpressionAnimation"),
    INSET_CLIP("InsetClip"),
    LINEAR_EASING_FUNCTION("LinearEasingFunction"),
    PATH_KEY_FRAME_ANIMATION("PathKeyFrameAnimation"),
    SCALAR_KEY_FRAME_ANIMATION("ScalarKeyFrameAnimation"),
    SHAPE_VISUAL("ShapeVisual"),
    STEP_EASING_FUNCTION("StepEasingFunction"),
    VECTOR2_KEY_FRAME_ANIMATION("Vector2KeyFrameAnimation"),
    VECTOR3_KEY_FRAME_ANIMATION("Vector3KeyFrameAnimation");

    private final String typeName;

    CompositionObjectType(String typeName) {
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
