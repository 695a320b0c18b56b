package dev.blanke.fieldidentifier.expression;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;

import static java.util.Objects.requireNonNull;

/**
 * A {@link Member} backed by a {@link Field}.
 *
 * @param field The reflected field.
 */
public record FieldMember(Field field) implements Member {

    public FieldMember {
        requireNonNull(field);
    }

    @Override
    public String name() {
        return field.getName();
    }

    @Override
    public Class<?> declaringClass() {
        return field.getDeclaringClass();
    }

    @Override
    public Class<?> type() {
        return field.getType();
    }

    @Override
    public Type genericType() {
        return field.getGenericType();
    }

    @Override
    public boolean isStatic() {
        return Modifier.isStatic(field.getModifiers());
    }
}
