package com.motionbake.codegen.model.composition;

public final class ScalarKeyFrameAnimation extends KeyFrameAnimation<Float> {

    @Override
    public CompositionObjectType getType() {
        return CompositionObjectType.SCALAR_KEY_FRAME_ANIMATION;
    }
}
