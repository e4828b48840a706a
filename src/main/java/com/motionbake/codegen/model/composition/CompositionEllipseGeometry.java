package com.motionbake.codegen.model.composition;

import com.motionbake.codegen.model.Vector2;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public final class CompositionEllipseGeometry extends CompositionGeometry {

    private Vector2 center = Vector2.ZERO;
    private Vector2 radius = Vector2.ZERO;

    @Override
    public CompositionObjectType getType() {
        return CompositionObjectType.COMPOSITION_ELLIPSE_GEOMETRY;
    }
}
