package dev.blanke.fieldidentifier;

/**
 * An {@code UnsupportedMemberKindException} is thrown if the member read by an accessor is neither a field nor a
 * property.
 */
public final class UnsupportedMemberKindException extends UnsupportedExpressionException {

    public UnsupportedMemberKindException(final String message) {
        super(message);
    }
}
