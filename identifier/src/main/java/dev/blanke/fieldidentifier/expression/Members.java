package dev.blanke.fieldidentifier.expression;

import java.beans.Introspector;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.Optional;

import org.jetbrains.annotations.NotNull;

/**
 * A utility class for looking up the {@link Member}s of a class reflectively.
 */
public final class Members {

    // Prevent instantiation of utility class.
    private Members() {
    }

    /**
     * Finds the field with the given {@code name} declared by {@code type} or one of its superclasses.
     *
     * @throws IllegalArgumentException If no such field exists.
     */
    public static @NotNull Field findField(final Class<?> type, final String name) {
        for (Class<?> current = type; current != null; current = current.getSuperclass()) {
            for (final var field : current.getDeclaredFields()) {
                if (field.getName().equals(name))
                    return field;
            }
        }
        throw new IllegalArgumentException("'%s' is not a field of '%s'.".formatted(name, type.getName()));
    }

    /**
     * Finds the getter of the property {@code name} on {@code type}.
     * <p>
     * Record component accessors take precedence over the JavaBeans naming conventions {@code getName()} and
     * {@code isName()}, the latter only being recognized for {@code boolean} properties.
     *
     * @throws IllegalArgumentException If {@code type} does not expose a readable property of that name.
     */
    public static @NotNull Method findGetter(final Class<?> type, final String name) {
        if (!name.isEmpty()) {
            final var capitalized = Character.toUpperCase(name.charAt(0)) + name.substring(1);
            for (final var candidate : new String[] { name, "get" + capitalized, "is" + capitalized }) {
                final var getter = findPublicMethod(type, candidate);
                if ((getter != null) && propertyName(getter).filter(name::equals).isPresent())
                    return getter;
            }
        }
        throw new IllegalArgumentException("'%s' is not a readable property of '%s'.".formatted(name, type.getName()));
    }

    private static Method findPublicMethod(final Class<?> type, final String name) {
        try {
            return type.getMethod(name);
        } catch (final NoSuchMethodException exception) {
            return null;
        }
    }

    /**
     * Derives the name of the property read by {@code method}, if it is a getter at all.
     * <p>
     * Static methods, methods with parameters, {@code void} methods and methods declared by {@link Object} are never
     * getters.
     *
     * @param method The method which might be a getter.
     *
     * @return The property name, or an empty {@link Optional} if {@code method} is not a getter.
     */
    public static Optional<String> propertyName(final Method method) {
        if (Modifier.isStatic(method.getModifiers()) || (method.getParameterCount() != 0)
                || (method.getReturnType() == void.class) || (method.getDeclaringClass() == Object.class))
            return Optional.empty();

        final var declaringClass = method.getDeclaringClass();
        if (declaringClass.isRecord()) {
            for (final RecordComponent component : declaringClass.getRecordComponents()) {
                if (component.getName().equals(method.getName()))
                    return Optional.of(component.getName());
            }
        }

        final var name = method.getName();
        if (name.startsWith("get") && (name.length() > 3))
            return Optional.of(Introspector.decapitalize(name.substring(3)));
        if (name.startsWith("is") && (name.length() > 2) && (method.getReturnType() == boolean.class))
            return Optional.of(Introspector.decapitalize(name.substring(2)));
        return Optional.empty();
    }

    /**
     * Classifies {@code method} as either a {@link PropertyMember} or a plain {@link MethodMember}.
     */
    public static @NotNull Member of(final Method method) {
        return propertyName(method)
            .<Member>map(name -> new PropertyMember(name, method))
            .orElseGet(() -> new MethodMember(method));
    }
}
