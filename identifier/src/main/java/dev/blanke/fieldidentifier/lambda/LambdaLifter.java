package dev.blanke.fieldidentifier.lambda;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.lang.invoke.MethodHandleInfo;
import java.lang.invoke.SerializedLambda;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

import dev.blanke.fieldidentifier.UnsupportedExpressionShapeException;
import dev.blanke.fieldidentifier.expression.Expression;
import dev.blanke.fieldidentifier.expression.Expressions;
import dev.blanke.fieldidentifier.expression.LambdaExpression;
import dev.blanke.fieldidentifier.expression.Members;
import dev.blanke.fieldidentifier.expression.PropertyMember;

/**
 * Recovers the expression tree of a compiled {@link Accessor} lambda or bound method reference.
 * <p>
 * Java does not retain lambda bodies as data, but a serializable lambda reveals the method implementing it along with
 * its captured arguments through a {@link SerializedLambda}. For lambda expressions, the class file declaring that
 * implementation method is read with ASM and its bytecode is translated back into an {@link Expression} by an
 * {@link ExpressionBuildingMethodVisitor}. Method references are translated directly from the referenced method.
 * <p>
 * Captured arguments, including a captured {@code this}, become constant expressions holding the values captured at
 * the time the lambda was created. No code of the lambda is executed during lifting.
 */
public final class LambdaLifter {

    private static final int ASM_API_VERSION = Opcodes.ASM9;

    /**
     * Prefix of the names javac gives to the synthetic methods implementing lambda bodies.
     */
    private static final String LAMBDA_METHOD_PREFIX = "lambda$";

    private static final Logger LOGGER = System.getLogger(LambdaLifter.class.getName());

    // Prevent instantiation of utility class.
    private LambdaLifter() {
    }

    /**
     * Lifts {@code accessor} into a {@link LambdaExpression} describing its body.
     *
     * @param accessor A lambda expression or bound method reference.
     *
     * @return The expression tree equivalent to the body of {@code accessor}.
     *
     * @throws UnsupportedExpressionShapeException If {@code accessor} is not a lambda or method reference, or if its
     *                                             body consists of anything else than reads of fields, properties,
     *                                             array elements and method results.
     *
     * @throws TypeNotPresentException If a class referenced by the lambda body cannot be loaded.
     */
    @SuppressWarnings("unchecked")
    public static <T> @NotNull LambdaExpression<T> lift(final Accessor<T> accessor) {
        final var serializedLambda = serialize(Objects.requireNonNull(accessor));
        final var loader           = classLoaderOf(accessor.getClass());
        final var implClass        = ClassLookup.forInternalName(serializedLambda.getImplClass(), loader);
        final var capturedArgs     = new ArrayList<>(serializedLambda.getCapturedArgCount());
        for (int i = 0; i < serializedLambda.getCapturedArgCount(); ++i)
            capturedArgs.add(serializedLambda.getCapturedArg(i));

        final Expression body =
            serializedLambda.getImplMethodName().startsWith(LAMBDA_METHOD_PREFIX)
                ? liftLambdaBody(serializedLambda, implClass, capturedArgs)
                : liftMethodReference(serializedLambda, implClass, capturedArgs);
        LOGGER.log(Level.DEBUG, "Lifted {0}.{1} to {2}",
            implClass.getName(), serializedLambda.getImplMethodName(), body);

        // The erased result type is all that can be recovered for T.
        return (LambdaExpression<T>) Expressions.lambda(body);
    }

    private static SerializedLambda serialize(final Accessor<?> accessor) {
        final Method writeReplace;
        try {
            writeReplace = accessor.getClass().getDeclaredMethod("writeReplace");
        } catch (final NoSuchMethodException exception) {
            throw new UnsupportedExpressionShapeException(
                "Accessor of type '%s' is neither a lambda expression nor a method reference.".formatted(
                    accessor.getClass().getName()), exception);
        }

        final var replacement = invokeWriteReplace(writeReplace, accessor);
        if (!(replacement instanceof SerializedLambda serializedLambda)) {
            throw new UnsupportedExpressionShapeException(
                "Accessor of type '%s' is not a serializable lambda.".formatted(accessor.getClass().getName()));
        }
        return serializedLambda;
    }

    /**
     * Invokes the {@code writeReplace} method of {@code receiver}, which is private for lambda classes.
     *
     * @throws IllegalStateException If the method cannot be made accessible, e.g. because the class of
     *                               {@code receiver} is in a package that is not open to this library, or if the
     *                               invocation fails.
     */
    static Object invokeWriteReplace(final Method writeReplace, final Object receiver) {
        if (!writeReplace.trySetAccessible()) {
            throw new IllegalStateException(
                "Could not serialize accessor of type '%s': %s is not accessible.".formatted(
                    receiver.getClass().getName(), writeReplace.getName()));
        }
        try {
            return writeReplace.invoke(receiver);
        } catch (final ReflectiveOperationException exception) {
            throw new IllegalStateException(
                "Could not serialize accessor of type '%s'.".formatted(receiver.getClass().getName()), exception);
        }
    }

    private static Expression liftMethodReference(final SerializedLambda serializedLambda, final Class<?> implClass,
                                                  final List<Object> capturedArgs) {
        if (serializedLambda.getImplMethodKind() == MethodHandleInfo.REF_newInvokeSpecial) {
            throw new UnsupportedExpressionShapeException(
                "Constructor reference to '%s' is not a member read.".formatted(implClass.getName()));
        }
        final var method = ClassLookup.findMethod(implClass, serializedLambda.getImplMethodName(),
            serializedLambda.getImplMethodSignature());
        final var parameterTypes = method.getParameterTypes();

        return switch (serializedLambda.getImplMethodKind()) {
            case MethodHandleInfo.REF_invokeVirtual, MethodHandleInfo.REF_invokeInterface -> {
                if (capturedArgs.isEmpty()) {
                    throw new UnsupportedExpressionShapeException(
                        "Method reference '%s' is not bound to a receiver.".formatted(method.getName()));
                }
                final var receiver  = Expressions.constant(capturedArgs.get(0), implClass);
                final var arguments = new ArrayList<Expression>();
                for (int i = 1; i < capturedArgs.size(); ++i)
                    arguments.add(Expressions.constant(capturedArgs.get(i), parameterTypes[i - 1]));
                yield liftInvocation(receiver, method, arguments);
            }
            case MethodHandleInfo.REF_invokeStatic -> {
                final var arguments = new ArrayList<Expression>();
                for (int i = 0; i < capturedArgs.size(); ++i)
                    arguments.add(Expressions.constant(capturedArgs.get(i), parameterTypes[i]));
                yield liftInvocation(null, method, arguments);
            }
            default -> throw new UnsupportedExpressionShapeException(
                "Method reference kind '%s' of '%s' is not supported.".formatted(
                    MethodHandleInfo.referenceKindToString(serializedLambda.getImplMethodKind()), method.getName()));
        };
    }

    private static Expression liftLambdaBody(final SerializedLambda serializedLambda, final Class<?> implClass,
                                             final List<Object> capturedArgs) {
        final var classVisitor = new ImplMethodClassVisitor(implClass, serializedLambda.getImplMethodName(),
            serializedLambda.getImplMethodSignature(), capturedArgs);
        new ClassReader(readClassFile(implClass))
            .accept(classVisitor, ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES);
        return classVisitor.getBody();
    }

    /**
     * Translates the invocation of {@code method} into a property read if it is a getter invoked on an object, or into
     * a method call otherwise.
     *
     * @param target The receiver of the invocation, or {@code null} if {@code method} is static.
     */
    static Expression liftInvocation(final @Nullable Expression target, final Method method,
                                     final List<Expression> arguments) {
        if ((target != null) && arguments.isEmpty()) {
            final var member = Members.of(method);
            if (member instanceof PropertyMember)
                return Expressions.member(target, member);
        }
        return Expressions.call(target, method, arguments);
    }

    private static byte[] readClassFile(final Class<?> type) {
        final var resourceName = type.getName().replace('.', '/') + ".class";
        try (final var stream = classLoaderOf(type).getResourceAsStream(resourceName)) {
            if (stream == null) {
                throw new UnsupportedExpressionShapeException(
                    "The class file of '%s' is not available.".formatted(type.getName()));
            }
            return stream.readAllBytes();
        } catch (final IOException exception) {
            throw new UncheckedIOException(exception);
        }
    }

    private static ClassLoader classLoaderOf(final Class<?> type) {
        final var loader = type.getClassLoader();
        return (loader != null) ? loader : ClassLoader.getSystemClassLoader();
    }

    /**
     * Locates the implementation method of a lambda and lifts its body.
     */
    private static final class ImplMethodClassVisitor extends ClassVisitor {

        private final Class<?> implClass;

        private final String implMethodName;

        private final String implMethodDescriptor;

        private final List<Object> capturedArgs;

        private ExpressionBuildingMethodVisitor methodVisitor;

        private ImplMethodClassVisitor(final Class<?> implClass, final String implMethodName,
                                       final String implMethodDescriptor, final List<Object> capturedArgs) {
            super(ASM_API_VERSION);

            this.implClass            = implClass;
            this.implMethodName       = implMethodName;
            this.implMethodDescriptor = implMethodDescriptor;
            this.capturedArgs         = capturedArgs;
        }

        @Override
        public MethodVisitor visitMethod(final int access, final String name, final String descriptor,
                                         final String signature, final String[] exceptions) {
            if (!name.equals(implMethodName) || !descriptor.equals(implMethodDescriptor))
                return null;

            final var loader     = classLoaderOf(implClass);
            final var parameters = new HashMap<Integer, Expression>();
            var slot     = 0;
            var captured = 0;

            // Lambdas capturing 'this' are compiled to instance methods receiving it as first captured argument.
            if ((access & Opcodes.ACC_STATIC) == 0)
                parameters.put(slot++, Expressions.constant(capturedArgs.get(captured++), implClass));

            for (final var argumentType : Type.getArgumentTypes(descriptor)) {
                if (captured < capturedArgs.size()) {
                    parameters.put(slot, Expressions.constant(capturedArgs.get(captured++),
                        ClassLookup.forType(argumentType, loader)));
                }
                slot += argumentType.getSize();
            }
            return methodVisitor = new ExpressionBuildingMethodVisitor(api, parameters, loader,
                implClass.getSimpleName() + '.' + name);
        }

        Expression getBody() {
            if (methodVisitor == null) {
                throw new IllegalStateException("Lambda implementation method %s%s not found in '%s'.".formatted(
                    implMethodName, implMethodDescriptor, implClass.getName()));
            }
            return methodVisitor.getBody();
        }
    }
}
