package com.motionbake.codegen.model.composition;

public abstract class CompositionBrush extends CompositionObject {
}
