package dev.blanke.fieldidentifier.lambda;

import java.lang.reflect.Method;
import java.util.ArrayDeque;
import java.util.HashSet;

import org.objectweb.asm.Type;

/**
 * A utility class resolving the internal names and descriptors found in class files to reflective objects.
 */
final class ClassLookup {

    // Prevent instantiation of utility class.
    private ClassLookup() {
    }

    /**
     * @param internalName An internal class name of the form {@code java/lang/Object}.
     *
     * @throws TypeNotPresentException If the class cannot be loaded through {@code loader}.
     */
    static Class<?> forInternalName(final String internalName, final ClassLoader loader) {
        return forType(Type.getObjectType(internalName), loader);
    }

    static Class<?> forType(final Type type, final ClassLoader loader) {
        return switch (type.getSort()) {
            case Type.BOOLEAN -> boolean.class;
            case Type.CHAR    -> char.class;
            case Type.BYTE    -> byte.class;
            case Type.SHORT   -> short.class;
            case Type.INT     -> int.class;
            case Type.FLOAT   -> float.class;
            case Type.LONG    -> long.class;
            case Type.DOUBLE  -> double.class;
            case Type.VOID    -> void.class;
            // Class.forName expects array names in their descriptor form, e.g. "[Ljava.lang.String;".
            case Type.ARRAY   -> load(type.getDescriptor().replace('/', '.'), loader);
            case Type.OBJECT  -> load(type.getClassName(), loader);
            default -> throw new IllegalArgumentException("Unrecognized type sort '%d'".formatted(type.getSort()));
        };
    }

    private static Class<?> load(final String name, final ClassLoader loader) {
        try {
            return Class.forName(name, false, loader);
        } catch (final ClassNotFoundException exception) {
            throw new TypeNotPresentException(name, exception);
        }
    }

    /**
     * Finds the method with the given {@code name} and {@code descriptor} which an invocation instruction referencing
     * {@code owner} resolves to, searching superclasses first and superinterfaces afterwards.
     *
     * @throws IllegalStateException If no such method exists, which means that the class file is out of sync with the
     *                               loaded classes.
     */
    static Method findMethod(final Class<?> owner, final String name, final String descriptor) {
        for (Class<?> current = owner; current != null; current = current.getSuperclass()) {
            final var method = findDeclaredMethod(current, name, descriptor);
            if (method != null)
                return method;
        }

        final var visited    = new HashSet<Class<?>>();
        final var interfaces = new ArrayDeque<Class<?>>();
        for (Class<?> current = owner; current != null; current = current.getSuperclass())
            interfaces.add(current);
        while (!interfaces.isEmpty()) {
            final var current = interfaces.poll();
            for (final var superInterface : current.getInterfaces()) {
                if (!visited.add(superInterface))
                    continue;
                final var method = findDeclaredMethod(superInterface, name, descriptor);
                if (method != null)
                    return method;
                interfaces.add(superInterface);
            }
        }
        throw new IllegalStateException(
            "Method %s%s not found in '%s'.".formatted(name, descriptor, owner.getName()));
    }

    private static Method findDeclaredMethod(final Class<?> type, final String name, final String descriptor) {
        for (final var method : type.getDeclaredMethods()) {
            if (method.getName().equals(name) && Type.getMethodDescriptor(method).equals(descriptor))
                return method;
        }
        return null;
    }
}
