package com.motionbake.codegen.model.composition;

import com.motionbake.codegen.model.Color;

public final class ColorKeyFrameAnimation extends KeyFrameAnimation<Color> {

    @Override
    public CompositionObjectType getType() {
        return CompositionObjectType.COLOR_KEY_FRAME_ANIMATION;
    }
}
