package com.motionbake.codegen.model.composition;

import com.motionbake.codegen.model.ExpressionType;
import lombok.Getter;
import lombok.Setter;

import java.util.Objects;

@Getter
@Setter
public final class ExpressionAnimation extends CompositionAnimation {

    private final String expression;

    // Null when the expression's result type could not be inferred.
    private ExpressionType expressionType;

    public ExpressionAnimation(String expression) {
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public ExpressionAnimation(String expression, ExpressionType expressionType) {
        this(expression);
        this.expressionType = expressionType;
    }

    @Override
    public CompositionObjectType getType() {
        return CompositionObjectType.EXPRESSION_ANIMATION;
    }
}
