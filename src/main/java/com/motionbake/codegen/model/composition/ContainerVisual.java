package com.motionbake.codegen.model.composition;

import java.util.ArrayList;
import java.util.List;

public class ContainerVisual extends Visual {

    private final List<Visual> children = new ArrayList<>();

    public List<Visual> getChildren() {
        return children;
    }

    @Override
    public CompositionObjectType getType() {
        return CompositionObjectType.CONTAINER_VISUAL;
    }
}
