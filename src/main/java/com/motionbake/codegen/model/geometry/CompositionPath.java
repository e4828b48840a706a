package com.motionbake.codegen.model.geometry;

import com.motionbake.codegen.model.Describable;
import lombok.Getter;
import lombok.Setter;

/**
 * Thin wrapper that turns a canvas geometry into a composition path source.
 */
@Getter
@Setter
public final class CompositionPath implements Describable {

    private final CanvasGeometry source;
    private String shortDescription;
    private String longDescription;

    public CompositionPath(CanvasGeometry source) {
        this.source = source;
    }

    @Override
    public String toString() {
        return "CompositionPath";
    }
}
