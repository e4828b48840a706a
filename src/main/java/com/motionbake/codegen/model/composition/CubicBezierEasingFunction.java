package com.motionbake.codegen.model.composition;

import com.motionbake.codegen.model.Vector2;
import lombok.Getter;

@Getter
public final class CubicBezierEasingFunction extends CompositionEasingFunction {

    private final Vector2 controlPoint1;
    private final Vector2 controlPoint2;

    public CubicBezierEasingFunction(Vector2 controlPoint1, Vector2 controlPoint2) {
        this.controlPoint1 = controlPoint1;
        this.controlPoint2 = controlPoint2;
    }

    @Override
    public CompositionObjectType getType() {
        return CompositionObjectType.CUBIC_BEZIER_EASING_FUNCTION;
    }
}
