package dev.blanke.fieldidentifier.expression;

import static java.util.Objects.requireNonNull;

/**
 * A type conversion of {@link #operand()} to {@link #type()}, covering reference casts as well as boxing and unboxing.
 */
public record ConvertExpression(Expression operand, Class<?> type) implements Expression {

    public ConvertExpression {
        requireNonNull(operand);
        requireNonNull(type);
    }

    @Override
    public String toString() {
        return "(%s) %s".formatted(type.getSimpleName(), operand);
    }
}
