package dev.blanke.fieldidentifier.expression;

import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;

/**
 * A member of a class which can be read off an owner object by a {@link MemberExpression}.
 * <p>
 * The set of member kinds is closed: a member is either a {@link FieldMember}, a {@link PropertyMember} backed by a
 * getter method, or a {@link MethodMember} for any other method.
 */
public sealed interface Member permits FieldMember, PropertyMember, MethodMember {

    /**
     * @return The name of the member. For properties this is the property name rather than the getter's name.
     */
    String name();

    Class<?> declaringClass();

    /**
     * @return The erased type of the value produced by reading this member.
     */
    Class<?> type();

    Type genericType();

    boolean isStatic();

    /**
     * Checks whether the member is declared with a bare type variable as its type, meaning that javac inserts a
     * {@code checkcast} after each read to restore the type argument of the use site.
     */
    default boolean hasTypeVariableType() {
        return genericType() instanceof TypeVariable<?>;
    }
}
