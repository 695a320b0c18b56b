package dev.blanke.fieldidentifier;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.Set;

import org.jetbrains.annotations.NotNull;

import dev.blanke.fieldidentifier.expression.ConstantExpression;
import dev.blanke.fieldidentifier.expression.ConvertExpression;
import dev.blanke.fieldidentifier.expression.Expressions;
import dev.blanke.fieldidentifier.expression.FieldMember;
import dev.blanke.fieldidentifier.expression.LambdaExpression;
import dev.blanke.fieldidentifier.expression.MemberExpression;
import dev.blanke.fieldidentifier.expression.PropertyMember;
import dev.blanke.fieldidentifier.lambda.Accessor;
import dev.blanke.fieldidentifier.lambda.LambdaLifter;

/**
 * Uniquely identifies a single editable field, i.e. a field or property of a specific owner object.
 * <p>
 * Two {@code FieldIdentifier}s are equal if they refer to the very same owner instance and their field names match
 * exactly. The owner's own {@link Object#equals(Object)} is never consulted, so that two distinct but equal model
 * objects can be told apart.
 * <p>
 * Instances are obtained through one of the {@code create} methods:
 * <pre>{@code
 * FieldIdentifier.create(person, "name");
 * FieldIdentifier.create(() -> person.address.city);
 * FieldIdentifier.create(person::getName);
 * }</pre>
 */
public final class FieldIdentifier {

    /**
     * Instances of these classes are value-based and do not have a stable identity.
     */
    private static final Set<Class<?>> WRAPPER_TYPES = Set.of(Boolean.class, Byte.class, Character.class,
        Short.class, Integer.class, Long.class, Float.class, Double.class);

    private static final Logger LOGGER = System.getLogger(FieldIdentifier.class.getName());

    /**
     * The object owning the identified field. Compared by reference.
     */
    private final Object owner;

    /**
     * The name of the identified field. Compared ordinally.
     */
    private final String fieldName;

    // The constructor is private so that both creation paths run through the same validation.
    private FieldIdentifier(final Object owner, final String fieldName) {
        if ((fieldName == null) || fieldName.isEmpty())
            throw new IllegalArgumentException("The field name must not be null or empty.");
        if (owner == null)
            throw new IllegalArgumentException("The owner must not be null.");
        if (WRAPPER_TYPES.contains(owner.getClass())) {
            throw new IllegalArgumentException(
                "The owner must have a stable identity, but was a '%s'.".formatted(owner.getClass().getName()));
        }
        this.owner     = owner;
        this.fieldName = fieldName;
    }

    /**
     * Returns the {@code FieldIdentifier} of the field named {@code fieldName} on {@code owner}.
     *
     * @param owner The object owning the field. Must not be an instance of a primitive wrapper class.
     *
     * @param fieldName The name of the field.
     *
     * @throws IllegalArgumentException If {@code owner} is {@code null} or a primitive wrapper, or if {@code fieldName}
     *                                  is {@code null} or empty.
     */
    public static @NotNull FieldIdentifier create(final Object owner, final String fieldName) {
        return new FieldIdentifier(owner, fieldName);
    }

    /**
     * Returns the {@code FieldIdentifier} of the field read by the given accessor lambda or bound method reference.
     *
     * @throws UnsupportedExpressionException If the accessor does not read a field or property of an object.
     *
     * @see LambdaLifter#lift(Accessor)
     * @see #create(LambdaExpression)
     */
    public static <T> @NotNull FieldIdentifier create(final Accessor<T> accessor) {
        return create(LambdaLifter.lift(accessor));
    }

    /**
     * Returns the {@code FieldIdentifier} of the field read by the body of {@code accessorExpression}.
     * <p>
     * The body must be a {@link MemberExpression} reading a field or property, optionally wrapped in a single
     * conversion to {@link Object}. Its owner must either be a {@link ConstantExpression}, or a further
     * {@code MemberExpression}, which is then evaluated exactly once to obtain the owner object.
     *
     * @throws UnsupportedExpressionShapeException If the body is not a member read.
     *
     * @throws UnsupportedMemberKindException If the member is neither a field nor a property.
     *
     * @throws UnsupportedOwnerExpressionShapeException If the owner of the member is neither a constant nor a member
     *                                                  read.
     *
     * @throws IllegalArgumentException If the resolved owner, or any value the owner expression dereferences, is
     *                                  {@code null}.
     */
    public static <T> @NotNull FieldIdentifier create(final LambdaExpression<T> accessorExpression) {
        var possibleMemberExpression = accessorExpression.body();

        // Unwrap conversions to Object, as introduced by boxing the value of a primitive field.
        if ((possibleMemberExpression instanceof ConvertExpression convert) && (convert.type() == Object.class))
            possibleMemberExpression = convert.operand();

        if (!(possibleMemberExpression instanceof MemberExpression memberExpression)) {
            throw new UnsupportedExpressionShapeException(
                "Only member expressions are supported, but got '%s'.".formatted(possibleMemberExpression));
        }

        final String fieldName;
        if (memberExpression.member() instanceof PropertyMember property)
            fieldName = property.name();
        else if (memberExpression.member() instanceof FieldMember field)
            fieldName = field.name();
        else {
            throw new UnsupportedMemberKindException(
                "Only fields and properties are supported, but '%s' is a %s.".formatted(
                    memberExpression.member().name(), memberExpression.member().getClass().getSimpleName()));
        }

        final Object owner;
        final var ownerExpression = memberExpression.expression();
        if (ownerExpression instanceof ConstantExpression constant)
            owner = constant.value();
        else if (ownerExpression instanceof MemberExpression nestedMemberExpression) {
            LOGGER.log(Level.TRACE, "Evaluating owner expression {0}", nestedMemberExpression);
            owner = evaluateOwner(nestedMemberExpression, fieldName);
        } else {
            throw new UnsupportedOwnerExpressionShapeException(
                "Only constant and member expressions are supported as owner of '%s', but got '%s'.".formatted(
                    fieldName, ownerExpression));
        }
        return new FieldIdentifier(owner, fieldName);
    }

    /**
     * Evaluates the owner chain of the member {@code fieldName} once.
     *
     * @throws IllegalArgumentException If any value along the chain is {@code null}, so that a null anywhere in the
     *                                  chain is reported the same way as a null immediate owner.
     */
    private static Object evaluateOwner(final MemberExpression ownerExpression, final String fieldName) {
        try {
            return Expressions.lambda(ownerExpression).compile().get();
        } catch (final NullPointerException exception) {
            throw new IllegalArgumentException(
                "The owner '%s' of '%s' could not be evaluated, because it dereferences null.".formatted(
                    ownerExpression, fieldName), exception);
        }
    }

    public Object getOwner() {
        return owner;
    }

    public String getFieldName() {
        return fieldName;
    }

    @Override
    public boolean equals(final Object object) {
        return (this == object) || (object instanceof FieldIdentifier other)
            && (owner == other.owner)
            && fieldName.equals(other.fieldName);
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(owner) + fieldName.hashCode();
    }

    @Override
    public String toString() {
        return "FieldIdentifier[owner=%s@%x, fieldName=%s]".formatted(
            owner.getClass().getName(), System.identityHashCode(owner), fieldName);
    }
}
