package dev.blanke.fieldidentifier.expression;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.AccessibleObject;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static java.lang.invoke.MethodType.methodType;

/**
 * Compiles an {@link Expression} tree into a {@link MethodHandle} of type {@code ()R} by composing one handle per node.
 * <p>
 * Members are made accessible before being unreflected, which allows expressions to read private fields of the
 * classes that define the accessor lambdas.
 */
final class ExpressionCompiler {

    private static final MethodHandles.Lookup LOOKUP = MethodHandles.lookup();

    /**
     * {@link Class#cast(Object)} of type {@code (Class, Object)Object}.
     */
    private static final MethodHandle CLASS_CAST;

    static {
        try {
            CLASS_CAST = LOOKUP.findVirtual(Class.class, "cast", methodType(Object.class, Object.class));
        } catch (final ReflectiveOperationException exception) {
            throw new ExceptionInInitializerError(exception);
        }
    }

    // Prevent instantiation of utility class.
    private ExpressionCompiler() {
    }

    static <T> Supplier<T> compile(final LambdaExpression<T> lambda) {
        final var handle = compile(lambda.body()).asType(methodType(lambda.type()));
        return () -> invoke(handle, lambda);
    }

    @SuppressWarnings("unchecked")
    private static <T> T invoke(final MethodHandle handle, final LambdaExpression<T> lambda) {
        try {
            return (T) handle.invoke();
        } catch (final RuntimeException | Error exception) {
            throw exception;
        } catch (final Throwable throwable) {
            throw new ExpressionEvaluationException("Evaluation of '%s' failed.".formatted(lambda), throwable);
        }
    }

    private static MethodHandle compile(final Expression expression) {
        if (expression instanceof ConstantExpression constant)
            return MethodHandles.constant(constant.type(), constant.value());

        if (expression instanceof ConvertExpression convert)
            return convert(compile(convert.operand()), convert.type());

        if (expression instanceof MemberExpression memberExpression) {
            final var member = memberExpression.member();
            final var operands = new ArrayList<Expression>(1);
            if (!member.isStatic())
                operands.add(memberExpression.expression());
            return bind(unreflect(member), operands).asType(methodType(memberExpression.type()));
        }

        if (expression instanceof MethodCallExpression call) {
            final var operands = new ArrayList<Expression>(call.arguments().size() + 1);
            if (call.target() != null)
                operands.add(call.target());
            operands.addAll(call.arguments());
            return bind(unreflect(new MethodMember(call.method())), operands);
        }

        if (expression instanceof ArrayIndexExpression arrayIndex) {
            return bind(MethodHandles.arrayElementGetter(arrayIndex.array().type()),
                List.of(arrayIndex.array(), arrayIndex.index()));
        }
        throw new IllegalStateException("Unknown expression node: " + expression.getClass().getName());
    }

    /**
     * Converts the result of {@code handle} to {@code type} the way a Java cast expression does.
     * <p>
     * Reference casts are checked, including casts to interfaces, and unboxing a {@code null} reference throws a
     * {@link NullPointerException}. Only conversions between primitive types may narrow.
     */
    private static MethodHandle convert(final MethodHandle handle, final Class<?> type) {
        final var source = handle.type().returnType();
        if (source.isPrimitive()) {
            return type.isPrimitive()
                ? MethodHandles.explicitCastArguments(handle, methodType(type))
                : handle.asType(methodType(type));
        }
        // (int) object is (int) (Integer) object, so a reference is cast to the wrapper before being unboxed.
        final var referenceType = type.isPrimitive() ? Expressions.wrap(type) : type;
        final var checked = MethodHandles.filterReturnValue(handle.asType(methodType(Object.class)),
            CLASS_CAST.bindTo(referenceType));
        return checked.asType(methodType(type));
    }

    /**
     * Replaces the leading parameters of {@code handle} with the values of the compiled {@code operands}, one operand
     * per parameter.
     */
    private static MethodHandle bind(MethodHandle handle, final List<Expression> operands) {
        for (final var operand : operands) {
            final var parameterType = handle.type().parameterType(0);
            handle = MethodHandles.collectArguments(handle, 0, compile(operand).asType(methodType(parameterType)));
        }
        return handle;
    }

    private static MethodHandle unreflect(final Member member) {
        try {
            if (member instanceof FieldMember fieldMember)
                return LOOKUP.unreflectGetter(accessible(fieldMember.field()));
            if (member instanceof PropertyMember property)
                return LOOKUP.unreflect(accessible(property.getter())).asFixedArity();
            if (member instanceof MethodMember method)
                return LOOKUP.unreflect(accessible(method.method())).asFixedArity();
        } catch (final IllegalAccessException exception) {
            throw new ExpressionEvaluationException(
                "Member '%s' of '%s' is not accessible.".formatted(member.name(), member.declaringClass().getName()),
                exception);
        }
        throw new IllegalStateException("Unknown member kind: " + member.getClass().getName());
    }

    private static <M extends AccessibleObject> M accessible(final M member) {
        // Failure is reported by the subsequent unreflect call as an IllegalAccessException.
        //noinspection ResultOfMethodCallIgnored
        member.trySetAccessible();
        return member;
    }
}
