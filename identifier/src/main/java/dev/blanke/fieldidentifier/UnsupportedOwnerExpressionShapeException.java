package dev.blanke.fieldidentifier;

/**
 * An {@code UnsupportedOwnerExpressionShapeException} is thrown if the object owning the member read by an accessor is
 * given by anything other than a constant or a further member read. This includes static members, which have no
 * owner at all.
 */
public final class UnsupportedOwnerExpressionShapeException extends UnsupportedExpressionException {

    public UnsupportedOwnerExpressionShapeException(final String message) {
        super(message);
    }
}
