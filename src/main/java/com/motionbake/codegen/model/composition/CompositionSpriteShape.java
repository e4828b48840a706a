package com.motionbake.codegen.model.composition;

import com.motionbake.codegen.model.CompositionStrokeCap;
import com.motionbake.codegen.model.CompositionStrokeLineJoin;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
public final class CompositionSpriteShape extends CompositionShape {

    private CompositionBrush fillBrush;
    private CompositionGeometry geometry;
    private CompositionBrush strokeBrush;
    private boolean strokeNonScaling;
    private CompositionStrokeCap strokeDashCap = CompositionStrokeCap.FLAT;
    private float strokeDashOffset = 0;
    private final List<Float> strokeDashArray = new ArrayList<>();
    private CompositionStrokeCap strokeEndCap = CompositionStrokeCap.FLAT;
    private CompositionStrokeLineJoin strokeLineJoin = CompositionStrokeLineJoin.MITER;
    private CompositionStrokeCap strokeStartCap = CompositionStrokeCap.FLAT;
    private float strokeMiterLimit = 1;
    private float strokeThickness = 1;

    @Override
    public CompositionObjectType getType() {
        return CompositionObjectType.COMPOSITION_SPRITE_SHAPE;
    }
}
