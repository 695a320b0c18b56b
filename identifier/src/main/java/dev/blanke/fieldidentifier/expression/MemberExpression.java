package dev.blanke.fieldidentifier.expression;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A read of {@link #member()} off the object that {@link #expression()} evaluates to.
 *
 * @param expression The owner sub-expression, or {@code null} if {@code member} is static.
 *
 * @param member The field or property being read.
 *
 * @param type The type under which the value is read. Either the member's own type or, for members declared with a
 *             type variable, the type argument of the use site.
 */
public record MemberExpression(@Nullable Expression expression, Member member, Class<?> type) implements Expression {

    public MemberExpression {
        requireNonNull(member);
        requireNonNull(type);
    }

    @Override
    public String toString() {
        final var owner = (expression != null) ? expression.toString() : member.declaringClass().getSimpleName();
        return owner + '.' + member.name();
    }
}
