package com.motionbake.codegen.model.composition;

import com.motionbake.codegen.model.geometry.CompositionPath;

public final class PathKeyFrameAnimation extends KeyFrameAnimation<CompositionPath> {

    @Override
    public CompositionObjectType getType() {
        return CompositionObjectType.PATH_KEY_FRAME_ANIMATION;
    }
}
