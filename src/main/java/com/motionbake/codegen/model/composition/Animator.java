package com.motionbake.codegen.model.composition;

/**
 * Binding of an animation to a named property, with an optional controller.
 */
public record Animator(String animatedProperty, CompositionAnimation animation, AnimationController controller) {
}
