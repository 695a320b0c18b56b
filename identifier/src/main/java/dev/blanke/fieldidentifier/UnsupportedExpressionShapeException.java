package dev.blanke.fieldidentifier;

/**
 * An {@code UnsupportedExpressionShapeException} is thrown if an accessor does not describe a member read, e.g. because
 * it invokes a method, indexes an array, or returns a literal.
 */
public final class UnsupportedExpressionShapeException extends UnsupportedExpressionException {

    public UnsupportedExpressionShapeException(final String message) {
        super(message);
    }

    public UnsupportedExpressionShapeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
