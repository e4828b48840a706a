package com.motionbake.codegen.model.composition;

import com.motionbake.codegen.model.Vector2;

public final class Vector2KeyFrameAnimation extends KeyFrameAnimation<Vector2> {

    @Override
    public CompositionObjectType getType() {
        return CompositionObjectType.VECTOR2_KEY_FRAME_ANIMATION;
    }
}
