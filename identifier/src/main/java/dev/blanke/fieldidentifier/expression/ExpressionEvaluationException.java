package dev.blanke.fieldidentifier.expression;

/**
 * An {@code ExpressionEvaluationException} is thrown if an expression tree cannot be compiled or if evaluating it
 * raised a checked exception.
 * <p>
 * Unchecked exceptions thrown by the code being evaluated, e.g. by a getter, are propagated as they are.
 */
public final class ExpressionEvaluationException extends RuntimeException {

    public ExpressionEvaluationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
