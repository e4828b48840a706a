package com.motionbake.codegen.model.composition;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

public final class ShapeVisual extends ContainerVisual {

    private final List<CompositionShape> shapes = new ArrayList<>();

    @Getter
    @Setter
    private CompositionViewBox viewBox;

    public List<CompositionShape> getShapes() {
        return shapes;
    }

    @Override
    public CompositionObjectType getType() {
        return CompositionObjectType.SHAPE_VISUAL;
    }
}
