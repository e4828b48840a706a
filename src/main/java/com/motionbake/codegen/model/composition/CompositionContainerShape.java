package com.motionbake.codegen.model.composition;

import java.util.ArrayList;
import java.util.List;

public final class CompositionContainerShape extends CompositionShape {

    private final List<CompositionShape> shapes = new ArrayList<>();

    public List<CompositionShape> getShapes() {
        return shapes;
    }

    @Override
    public CompositionObjectType getType() {
        return CompositionObjectType.COMPOSITION_CONTAINER_SHAPE;
    }
}
