package dev.blanke.fieldidentifier.expression;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * An expression already holding its value, such as a variable captured by a lambda or a literal.
 *
 * @param value The held value. Primitive values are stored boxed.
 *
 * @param type The static type of the value, which may be a primitive type.
 */
public record ConstantExpression(@Nullable Object value, Class<?> type) implements Expression {

    public ConstantExpression {
        requireNonNull(type);
    }

    @Override
    public String toString() {
        if (value instanceof String string)
            return '"' + string + '"';
        if ((value == null) || type.isPrimitive())
            return String.valueOf(value);
        return "<%s>".formatted(type.getSimpleName());
    }
}
