package dev.blanke.fieldidentifier.expression;

import java.lang.reflect.Method;
import java.util.List;
import java.util.stream.Collectors;

import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * An invocation of {@link #method()} on {@link #target()} with the given {@link #arguments()}.
 *
 * @param target The receiver of the invocation, or {@code null} if {@code method} is static.
 */
public record MethodCallExpression(@Nullable Expression target, Method method, List<Expression> arguments)
        implements Expression {

    public MethodCallExpression {
        requireNonNull(method);
        arguments = List.copyOf(arguments);
    }

    @Override
    public Class<?> type() {
        return method.getReturnType();
    }

    @Override
    public String toString() {
        final var receiver = (target != null) ? target.toString() : method.getDeclaringClass().getSimpleName();
        return arguments.stream()
            .map(Expression::toString)
            .collect(Collectors.joining(", ", receiver + '.' + method.getName() + '(', ")"));
    }
}
