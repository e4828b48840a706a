package com.motionbake.codegen.model.composition;

import com.motionbake.codegen.model.Vector2;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public final class CompositionViewBox extends CompositionObject {

    private Vector2 size = Vector2.ZERO;

    @Override
    public CompositionObjectType getType() {
        return CompositionObjectType.COMPOSITION_VIEW_BOX;
    }
}
