package com.motionbake.codegen.model.composition;

import com.motionbake.codegen.model.Vector2;
import com.motionbake.codegen.model.Vector3;
import lombok.Getter;
import lombok.Setter;

/**
 * Base of visuals. Unset (null) properties keep the runtime defaults.
 */
@Getter
@Setter
public abstract class Visual extends CompositionObject {

    private Vector3 centerPoint;
    private CompositionClip clip;
    private Vector3 offset;
    private Float rotationAngleInDegrees;
    private Vector3 scale;
    private Vector2 size;
}
