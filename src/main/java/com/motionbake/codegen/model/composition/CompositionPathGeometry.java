package com.motionbake.codegen.model.composition;

import com.motionbake.codegen.model.geometry.CompositionPath;
import lombok.Getter;

@Getter
public final class CompositionPathGeometry extends CompositionGeometry {

    private final CompositionPath path;

    public CompositionPathGeometry(CompositionPath path) {
        this.path = path;
    }

    @Override
    public CompositionObjectType getType() {
        return CompositionObjectType.COMPOSITION_PATH_GEOMETRY;
    }
}
