package dev.blanke.fieldidentifier.expression;

import java.lang.invoke.MethodType;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Factory methods for the nodes of an {@link Expression} tree.
 * <p>
 * Each factory validates its input eagerly and throws an {@link IllegalArgumentException} for trees that could not be
 * evaluated, so that a malformed tree never reaches {@link LambdaExpression#compile()}.
 */
public final class Expressions {

    // Prevent instantiation of utility class.
    private Expressions() {
    }

    //region Constants
    public static @NotNull ConstantExpression constant(final @Nullable Object value) {
        return new ConstantExpression(value, (value != null) ? value.getClass() : Object.class);
    }

    /**
     * @param value The constant value, which must be a boxed instance of {@code type} if {@code type} is primitive.
     *
     * @param type The static type of the constant.
     */
    public static @NotNull ConstantExpression constant(final @Nullable Object value, final Class<?> type) {
        requireNonNull(type);
        if (type == void.class)
            throw new IllegalArgumentException("A constant cannot be of type void.");
        if (type.isPrimitive() ? !wrap(type).isInstance(value) : ((value != null) && !type.isInstance(value))) {
            throw new IllegalArgumentException(
                "Value '%s' is not an instance of '%s'.".formatted(value, type.getName()));
        }
        return new ConstantExpression(value, type);
    }
    //endregion

    public static @NotNull ConvertExpression convert(final Expression operand, final Class<?> type) {
        requireNonNull(operand);
        if (type == void.class)
            throw new IllegalArgumentException("Cannot convert to void.");
        return new ConvertExpression(operand, type);
    }

    //region Members
    /**
     * Creates a read of the field {@code name} declared by the type of {@code owner} or one of its superclasses.
     */
    public static @NotNull MemberExpression field(final Expression owner, final String name) {
        return member(owner, new FieldMember(Members.findField(owner.type(), name)));
    }

    /**
     * @param owner The owner of the field, or {@code null} if {@code field} is static.
     */
    public static @NotNull MemberExpression field(final @Nullable Expression owner, final Field field) {
        return member(owner, new FieldMember(field));
    }

    /**
     * Creates a read of the property {@code name} on the object {@code owner} evaluates to.
     *
     * @see Members#findGetter(Class, String)
     */
    public static @NotNull MemberExpression property(final Expression owner, final String name) {
        return member(owner, new PropertyMember(name, Members.findGetter(owner.type(), name)));
    }

    /**
     * @throws IllegalArgumentException If {@code getter} is not a getter according to
     *                                  {@link Members#propertyName(Method)}.
     */
    public static @NotNull MemberExpression property(final Expression owner, final Method getter) {
        final var name = Members.propertyName(getter).orElseThrow(() ->
            new IllegalArgumentException("'%s' is not a property getter.".formatted(getter)));
        return member(owner, new PropertyMember(name, getter));
    }

    public static @NotNull MemberExpression member(final @Nullable Expression owner, final Member member) {
        return member(owner, member, member.type());
    }

    /**
     * Creates a read of {@code member} whose result is seen as the given {@code type}, which must be {@code member}'s
     * own type or a reference subtype of it.
     *
     * @param owner The owner sub-expression, or {@code null} if {@code member} is static.
     */
    public static @NotNull MemberExpression member(final @Nullable Expression owner, final Member member,
                                                   final Class<?> type) {
        requireNonNull(member);
        requireNonNull(type);
        checkReceiver(owner, member.declaringClass(), member.isStatic(), member.name());

        if ((type != member.type()) && (type.isPrimitive() || !member.type().isAssignableFrom(type))) {
            throw new IllegalArgumentException("Member '%s' of type '%s' cannot be read as '%s'.".formatted(
                member.name(), member.type().getName(), type.getName()));
        }
        return new MemberExpression(owner, member, type);
    }
    //endregion

    /**
     * @param target The receiver of the invocation, or {@code null} if {@code method} is static.
     */
    public static @NotNull MethodCallExpression call(final @Nullable Expression target, final Method method,
                                                     final Expression... arguments) {
        return call(target, method, Arrays.asList(arguments));
    }

    public static @NotNull MethodCallExpression call(final @Nullable Expression target, final Method method,
                                                     final List<Expression> arguments) {
        requireNonNull(method);
        checkReceiver(target, method.getDeclaringClass(), Modifier.isStatic(method.getModifiers()), method.getName());

        if (arguments.size() != method.getParameterCount()) {
            throw new IllegalArgumentException("Method '%s' expects %d arguments but %d were given.".formatted(
                method.getName(), method.getParameterCount(), arguments.size()));
        }
        return new MethodCallExpression(target, method, arguments);
    }

    public static @NotNull ArrayIndexExpression arrayIndex(final Expression array, final Expression index) {
        if (!array.type().isArray())
            throw new IllegalArgumentException("'%s' is not an array.".formatted(array));
        if (wrap(index.type()) != Integer.class)
            throw new IllegalArgumentException("Array index '%s' must be of type int.".formatted(index));
        return new ArrayIndexExpression(array, index);
    }

    //region Lambdas
    /**
     * Wraps {@code body} into a zero-argument lambda whose result is seen as {@link Object}.
     */
    public static @NotNull LambdaExpression<Object> lambda(final Expression body) {
        return new LambdaExpression<>(body, Object.class);
    }

    public static <T> @NotNull LambdaExpression<T> lambda(final Expression body, final Class<T> type) {
        requireNonNull(body);
        if (!wrap(type).isAssignableFrom(wrap(body.type()))) {
            throw new IllegalArgumentException("Body of type '%s' is not assignable to '%s'.".formatted(
                body.type().getName(), type.getName()));
        }
        return new LambdaExpression<>(body, type);
    }
    //endregion

    private static void checkReceiver(final @Nullable Expression receiver, final Class<?> declaringClass,
                                      final boolean isStatic, final String name) {
        if (isStatic) {
            if (receiver != null)
                throw new IllegalArgumentException("Static member '%s' must not have an owner.".formatted(name));
            return;
        }
        if (receiver == null)
            throw new IllegalArgumentException("Instance member '%s' requires an owner.".formatted(name));
        if (receiver.type().isPrimitive() || !declaringClass.isAssignableFrom(receiver.type())) {
            throw new IllegalArgumentException("Member '%s' is not declared by '%s'.".formatted(
                name, receiver.type().getName()));
        }
    }

    /**
     * @return The wrapper class of {@code type} if it is primitive, otherwise {@code type} itself.
     */
    static Class<?> wrap(final Class<?> type) {
        return MethodType.methodType(type).wrap().returnType();
    }
}
