package dev.blanke.fieldidentifier;

/**
 * Base class of the exceptions thrown when an accessor expression cannot be resolved to a {@link FieldIdentifier}.
 * <p>
 * All subclasses denote programming errors at the call site, which is why they are unchecked.
 *
 * @see FieldIdentifier#create(dev.blanke.fieldidentifier.expression.LambdaExpression)
 */
public abstract class UnsupportedExpressionException extends RuntimeException {

    protected UnsupportedExpressionException(final String message) {
        super(message);
    }

    protected UnsupportedExpressionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
