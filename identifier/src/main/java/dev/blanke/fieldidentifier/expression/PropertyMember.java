package dev.blanke.fieldidentifier.expression;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;

import static java.util.Objects.requireNonNull;

/**
 * A {@link Member} denoting a read-only view of a property through its getter.
 *
 * @param name The property name, e.g. {@code title} for a getter named {@code getTitle}.
 *
 * @param getter The zero-argument method returning the property value.
 *
 * @see Members#propertyName(Method)
 */
public record PropertyMember(String name, Method getter) implements Member {

    public PropertyMember {
        requireNonNull(name);
        requireNonNull(getter);
        if (name.isEmpty())
            throw new IllegalArgumentException("Property name must not be empty.");
        if (getter.getParameterCount() != 0)
            throw new IllegalArgumentException("Getter '%s' must not declare parameters.".formatted(getter));
    }

    @Override
    public Class<?> declaringClass() {
        return getter.getDeclaringClass();
    }

    @Override
    public Class<?> type() {
        return getter.getReturnType();
    }

    @Override
    public Type genericType() {
        return getter.getGenericReturnType();
    }

    @Override
    public boolean isStatic() {
        return Modifier.isStatic(getter.getModifiers());
    }
}
