package dev.blanke.fieldidentifier.expression;

import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * An unevaluated zero-argument function whose {@link #body()} can be inspected, and on demand compiled and invoked.
 *
 * @param <T> The type of the value produced when the lambda is invoked.
 *
 * @see Expressions#lambda(Expression)
 */
public final class LambdaExpression<T> {

    private final Expression body;

    private final Class<T> type;

    LambdaExpression(final Expression body, final Class<T> type) {
        this.body = requireNonNull(body);
        this.type = requireNonNull(type);
    }

    public Expression body() {
        return body;
    }

    public Class<T> type() {
        return type;
    }

    /**
     * Compiles the {@link #body()} into a function which evaluates the expression tree each time it is invoked.
     * <p>
     * Compiled functions are not cached: every call creates a new one.
     *
     * @return A function evaluating this lambda.
     *
     * @throws ExpressionEvaluationException If a member referenced by the tree is not accessible.
     */
    public Supplier<T> compile() {
        return ExpressionCompiler.compile(this);
    }

    /**
     * Compiles this lambda and evaluates it once.
     *
     * @see #compile()
     */
    public T invoke() {
        return compile().get();
    }

    @Override
    public String toString() {
        return "() -> " + body;
    }
}
