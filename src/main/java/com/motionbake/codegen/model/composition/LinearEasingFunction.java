package com.motionbake.codegen.model.composition;

public final class LinearEasingFunction extends CompositionEasingFunction {

    @Override
    public CompositionObjectType getType() {
        return CompositionObjectType.LINEAR_EASING_FUNCTION;
    }
}
