package dev.blanke.fieldidentifier.expression;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;

import static java.util.Objects.requireNonNull;

/**
 * A {@link Member} backed by a method which is not considered to be a property getter.
 */
public record MethodMember(Method method) implements Member {

    public MethodMember {
        requireNonNull(method);
    }

    @Override
    public String name() {
        return method.getName();
    }

    @Override
    public Class<?> declaringClass() {
        return method.getDeclaringClass();
    }

    @Override
    public Class<?> type() {
        return method.getReturnType();
    }

    @Override
    public Type genericType() {
        return method.getGenericReturnType();
    }

    @Override
    public boolean isStatic() {
        return Modifier.isStatic(method.getModifiers());
    }
}
