package com.motionbake.codegen.model.composition;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public final class InsetClip extends CompositionClip {

    private float leftInset;
    private float rightInset;
    private float topInset;
    private float bottomInset;

    @Override
    public CompositionObjectType getType() {
        return CompositionObjectType.INSET_CLIP;
    }
}
