package com.motionbake.codegen.model.composition;

import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keyframe animation over values of type {@code T}.
 */
@Getter
@Setter
public abstract class KeyFrameAnimation<T> extends CompositionAnimation {

    private Duration duration = Duration.ZERO;

    private final List<KeyFrame<T>> keyFrames = new ArrayList<>();

    public List<KeyFrame<T>> getKeyFrames() {
        return Collections.unmodifiableList(keyFrames);
    }

    public KeyFrameAnimation<T> insertKeyFrame(float progress, T value, CompositionEasingFunction easing) {
        keyFrames.add(new ValueKeyFrame<>(progress, easing, value));
        return this;
    }

    public KeyFrameAnimation<T> insertExpressionKeyFrame(float progress, String expression, CompositionEasingFunction easing) {
        keyFrames.add(new ExpressionKeyFrame<>(progress, easing, expression));
        return this;
    }

    /**
     * Value of the first keyframe, or null if it is an expression keyframe or
     * there are no keyframes.
     */
    public T firstValue() {
        return keyFrames.isEmpty() ? null : valueOf(keyFrames.get(0));
    }

    public T lastValue() {
        return keyFrames.isEmpty() ? null : valueOf(keyFrames.get(keyFrames.size() - 1));
    }

    private T valueOf(KeyFrame<T> keyFrame) {
        return keyFrame instanceof ValueKeyFrame<T> valueKeyFrame ? valueKeyFrame.getValue() : null;
    }

    @Getter
    public abstract static class KeyFrame<T> {
        private final float progress;
        private final CompositionEasingFunction easing;

        protected KeyFrame(float progress, CompositionEasingFunction easing) {
            this.progress = progress;
            this.easing = easing;
        }
    }

    @Getter
    public static final class ValueKeyFrame<T> extends KeyFrame<T> {
        private final T value;

        public ValueKeyFrame(float progress, CompositionEasingFunction easing, T value) {
            super(progress, easing);
            this.value = value;
        }
    }

    @Getter
    public static final class ExpressionKeyFrame<T> extends KeyFrame<T> {
        private final String expression;

        public ExpressionKeyFrame(float progress, CompositionEasingFunction easing, String expression) {
            super(progress, easing);
            this.expression = expression;
        }
    }
}
