package com.motionbake.codegen.model.composition;

import com.motionbake.codegen.model.Vector2;
import lombok.Getter;
import lombok.Setter;

/**
 * Base of shapes. Unset (null) transform properties keep the runtime defaults.
 */
@Getter
@Setter
public abstract class CompositionShape extends CompositionObject {

    private Vector2 centerPoint;
    private Vector2 offset;
    private Float rotationAngleInDegrees;
    private Vector2 scale;
}
