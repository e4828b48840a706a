package com.motionbake.codegen.model.composition;

import com.motionbake.codegen.model.Color;
import lombok.Getter;

@Getter
public final class CompositionColorBrush extends CompositionBrush {

    private final Color color;

    public CompositionColorBrush(Color color) {
        this.color = color;
    }

    @Override
    public CompositionObjectType getType() {
        return CompositionObjectType.COMPOSITION_COLOR_BRUSH;
    }
}
