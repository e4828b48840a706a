package com.motionbake.codegen.model.composition;

import com.motionbake.codegen.model.Vector2;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public abstract class CompositionClip extends CompositionObject {

    private Vector2 centerPoint = Vector2.ZERO;
    private Vector2 scale = Vector2.ONE;
}
