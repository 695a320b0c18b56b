package dev.blanke.fieldidentifier.lambda;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.jetbrains.annotations.Nullable;

import org.objectweb.asm.Handle;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Type;
import org.objectweb.asm.util.Printer;

import dev.blanke.fieldidentifier.UnsupportedExpressionShapeException;
import dev.blanke.fieldidentifier.expression.Expression;
import dev.blanke.fieldidentifier.expression.Expressions;
import dev.blanke.fieldidentifier.expression.MemberExpression;
import dev.blanke.fieldidentifier.expression.Members;

import static org.objectweb.asm.Opcodes.*;

/**
 * Symbolically executes the straight-line body of a lambda implementation method, pushing and popping
 * {@link Expression}s instead of values, and records the expression left on the stack by the return instruction.
 * <p>
 * Only instructions which read state are understood. Any instruction that writes state, branches, creates objects or
 * computes a new value fails the lifting with an {@link UnsupportedExpressionShapeException}.
 */
final class ExpressionBuildingMethodVisitor extends MethodVisitor {

    /**
     * Internal names of the classes whose {@code valueOf} methods javac uses for boxing primitive values.
     */
    private static final Set<String> WRAPPER_INTERNAL_NAMES = Set.of("java/lang/Boolean", "java/lang/Byte",
        "java/lang/Character", "java/lang/Short", "java/lang/Integer", "java/lang/Long", "java/lang/Float",
        "java/lang/Double");

    /**
     * Maps local variable slots holding parameters of the implementation method to the values captured by the lambda.
     */
    private final Map<Integer, Expression> parameters;

    private final ClassLoader loader;

    /**
     * A human-readable name of the method being visited for use in error messages.
     */
    private final String methodName;

    private final Deque<Expression> stack = new ArrayDeque<>();

    private Expression body;

    ExpressionBuildingMethodVisitor(final int api, final Map<Integer, Expression> parameters,
                                    final ClassLoader loader, final String methodName) {
        super(api);

        this.parameters = Map.copyOf(parameters);
        this.loader     = Objects.requireNonNull(loader);
        this.methodName = Objects.requireNonNull(methodName);
    }

    /**
     * @return The expression returned by the visited method.
     *
     * @throws IllegalStateException If the method has not been visited (yet).
     */
    Expression getBody() {
        if (body == null)
            throw new IllegalStateException("No return instruction has been visited in " + methodName + '.');
        return body;
    }

    @Override
    public void visitInsn(final int opcode) {
        switch (opcode) {
            case ACONST_NULL -> stack.push(Expressions.constant(null));
            case ICONST_M1, ICONST_0, ICONST_1, ICONST_2, ICONST_3, ICONST_4, ICONST_5 ->
                stack.push(Expressions.constant(opcode - ICONST_0, int.class));
            case LCONST_0, LCONST_1 -> stack.push(Expressions.constant((long) (opcode - LCONST_0), long.class));
            case FCONST_0, FCONST_1, FCONST_2 ->
                stack.push(Expressions.constant((float) (opcode - FCONST_0), float.class));
            case DCONST_0, DCONST_1 -> stack.push(Expressions.constant((double) (opcode - DCONST_0), double.class));
            case IALOAD, LALOAD, FALOAD, DALOAD, AALOAD, BALOAD, CALOAD, SALOAD -> {
                final var index = pop();
                stack.push(Expressions.arrayIndex(pop(), index));
            }
            case IRETURN, LRETURN, FRETURN, DRETURN, ARETURN -> body = pop();
            default -> throw unsupported(opcode);
        }
    }

    @Override
    public void visitIntInsn(final int opcode, final int operand) {
        if ((opcode != BIPUSH) && (opcode != SIPUSH))
            throw unsupported(opcode);
        stack.push(Expressions.constant(operand, int.class));
    }

    @Override
    public void visitLdcInsn(final Object value) {
        if (value instanceof Integer)
            stack.push(Expressions.constant(value, int.class));
        else if (value instanceof Long)
            stack.push(Expressions.constant(value, long.class));
        else if (value instanceof Float)
            stack.push(Expressions.constant(value, float.class));
        else if (value instanceof Double)
            stack.push(Expressions.constant(value, double.class));
        else if (value instanceof String)
            stack.push(Expressions.constant(value, String.class));
        else if ((value instanceof Type type) && (type.getSort() != Type.METHOD))
            stack.push(Expressions.constant(ClassLookup.forType(type, loader), Class.class));
        else
            throw unsupported("ldc " + value);
    }

    @Override
    public void visitVarInsn(final int opcode, final int varIndex) {
        switch (opcode) {
            case ILOAD, LLOAD, FLOAD, DLOAD, ALOAD -> {
                final var parameter = parameters.get(varIndex);
                if (parameter == null)
                    throw unsupported("load of local variable " + varIndex);
                stack.push(parameter);
            }
            default -> throw unsupported(opcode);
        }
    }

    @Override
    public void visitFieldInsn(final int opcode, final String owner, final String name, final String descriptor) {
        final var field = Members.findField(ClassLookup.forInternalName(owner, loader), name);
        switch (opcode) {
            case GETFIELD  -> stack.push(Expressions.field(pop(), field));
            case GETSTATIC -> stack.push(Expressions.field(null, field));
            default -> throw unsupported(opcode);
        }
    }

    @Override
    public void visitMethodInsn(final int opcode, final String owner, final String name, final String descriptor,
                                final boolean isInterface) {
        if (isBoxing(opcode, owner, name, descriptor)) {
            // Boxing widens a primitive value to a reference, which is what a conversion to Object denotes.
            stack.push(Expressions.convert(pop(), Object.class));
            return;
        }
        if (name.equals("<init>"))
            throw unsupported("object creation");

        final var arguments = new ArrayList<Expression>();
        for (int i = Type.getArgumentTypes(descriptor).length; i > 0; --i)
            arguments.add(pop());
        Collections.reverse(arguments);

        final var method = ClassLookup.findMethod(ClassLookup.forInternalName(owner, loader), name, descriptor);
        final Expression target =
            switch (opcode) {
                case INVOKESTATIC -> null;
                case INVOKEVIRTUAL, INVOKEINTERFACE, INVOKESPECIAL -> pop();
                default -> throw unsupported(opcode);
            };
        stack.push(LambdaLifter.liftInvocation(target, method, arguments));
    }

    private static boolean isBoxing(final int opcode, final String owner, final String name, final String descriptor) {
        if ((opcode != INVOKESTATIC) || !name.equals("valueOf") || !WRAPPER_INTERNAL_NAMES.contains(owner))
            return false;
        final var argumentTypes = Type.getArgumentTypes(descriptor);
        return (argumentTypes.length == 1) && (argumentTypes[0].getSort() < Type.ARRAY);
    }

    @Override
    public void visitTypeInsn(final int opcode, final String type) {
        if (opcode != CHECKCAST)
            throw unsupported(opcode);

        final var operand  = pop();
        final var castType = ClassLookup.forInternalName(type, loader);
        /*
         * javac casts the erased value of a member declared with a type variable back to the type argument of the use
         * site. Such a cast is not part of the source expression, so it narrows the member read instead.
         */
        if ((operand instanceof MemberExpression member) && member.member().hasTypeVariableType())
            stack.push(Expressions.member(member.expression(), member.member(), castType));
        else
            stack.push(Expressions.convert(operand, castType));
    }

    //region Unsupported instructions
    @Override
    public void visitIincInsn(final int varIndex, final int increment) {
        throw unsupported(IINC);
    }

    @Override
    public void visitJumpInsn(final int opcode, final Label label) {
        throw unsupported(opcode);
    }

    @Override
    public void visitTableSwitchInsn(final int min, final int max, final Label dflt, final Label... labels) {
        throw unsupported(TABLESWITCH);
    }

    @Override
    public void visitLookupSwitchInsn(final Label dflt, final int[] keys, final Label[] labels) {
        throw unsupported(LOOKUPSWITCH);
    }

    @Override
    public void visitInvokeDynamicInsn(final String name, final String descriptor, final Handle bootstrapMethodHandle,
                                       final Object... bootstrapMethodArguments) {
        throw unsupported(INVOKEDYNAMIC);
    }

    @Override
    public void visitMultiANewArrayInsn(final String descriptor, final int numDimensions) {
        throw unsupported(MULTIANEWARRAY);
    }

    @Override
    public void visitTryCatchBlock(final Label start, final Label end, final Label handler,
                                   final @Nullable String type) {
        throw unsupported("exception handler");
    }
    //endregion

    private Expression pop() {
        final var expression = stack.poll();
        if (expression == null)
            throw new IllegalStateException("Operand stack underflow in " + methodName + '.');
        return expression;
    }

    private UnsupportedExpressionShapeException unsupported(final int opcode) {
        return unsupported(Printer.OPCODES[opcode].toLowerCase());
    }

    private UnsupportedExpressionShapeException unsupported(final String what) {
        return new UnsupportedExpressionShapeException(
            "Only member reads are supported, but %s uses %s.".formatted(methodName, what));
    }
}
