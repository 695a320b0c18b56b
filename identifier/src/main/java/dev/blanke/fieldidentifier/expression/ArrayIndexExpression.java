package dev.blanke.fieldidentifier.expression;

import static java.util.Objects.requireNonNull;

/**
 * A read of the element at {@link #index()} of the array {@link #array()} evaluates to.
 */
public record ArrayIndexExpression(Expression array, Expression index) implements Expression {

    public ArrayIndexExpression {
        requireNonNull(array);
        requireNonNull(index);
    }

    @Override
    public Class<?> type() {
        return array.type().getComponentType();
    }

    @Override
    public String toString() {
        return "%s[%s]".formatted(array, index);
    }
}
