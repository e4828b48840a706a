package com.motionbake.codegen.model.composition;

public abstract class CompositionEasingFunction extends CompositionObject {
}
