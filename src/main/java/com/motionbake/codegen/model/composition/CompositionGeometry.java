package com.motionbake.codegen.model.composition;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public abstract class CompositionGeometry extends CompositionObject {

    private float trimStart = 0;
    private float trimEnd = 1;
    private float trimOffset = 0;
}
