package com.motionbake.codegen.model.composition;

import com.motionbake.codegen.model.Vector3;

public final class Vector3KeyFrameAnimation extends KeyFrameAnimation<Vector3> {

    @Override
    public CompositionObjectType getType() {
        return CompositionObjectType.VECTOR3_KEY_FRAME_ANIMATION;
    }
}
