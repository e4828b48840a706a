package com.motionbake.codegen.model.composition;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public final class StepEasingFunction extends CompositionEasingFunction {

    private int stepCount = 1;
    private int initialStep = 0;
    private int finalStep = 1;
    private boolean initialStepSingleFrame;
    private boolean finalStepSingleFrame;

    @Override
    public CompositionObjectType getType() {
        return CompositionObjectType.STEP_EASING_FUNCTION;
    }
}
