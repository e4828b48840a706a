package com.motionbake.codegen.model.composition;

import com.motionbake.codegen.model.Vector2;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public final class CompositionRoundedRectangleGeometry extends CompositionGeometry {

    private Vector2 cornerRadius = Vector2.ZERO;
    private Vector2 size = Vector2.ZERO;

    @Override
    public CompositionObjectType getType() {
        return CompositionObjectType.COMPOSITION_ROUNDED_RECTANGLE_GEOMETRY;
    }
}
