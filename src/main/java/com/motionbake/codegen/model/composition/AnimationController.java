package com.motionbake.codegen.model.composition;

import lombok.Getter;

/**
 * Controller created implicitly when an animation is started with a
 * controller. Its own properties (typically {@code Progress}) may be animated.
 */
public final class AnimationController extends CompositionObject {

    @Getter
    private final CompositionObject owner;

    AnimationController(CompositionObject owner) {
        this.owner = owner;
    }

    @Override
    public CompositionObjectType getType() {
        return CompositionObjectType.ANIMATION_CONTROLLER;
    }
}
