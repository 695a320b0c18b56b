package dev.blanke.fieldidentifier.expression;

/**
 * A node of an unevaluated, side-effect free expression tree describing how a value is read.
 * <p>
 * The set of node kinds is closed so that consumers can destructure a tree by matching on each permitted subtype and
 * reject everything else explicitly. Instances are created through {@link Expressions}, which validates them eagerly.
 *
 * @see LambdaExpression
 */
public sealed interface Expression
    permits ConstantExpression, ConvertExpression, MemberExpression, MethodCallExpression, ArrayIndexExpression {

    /**
     * @return The static type of the value this expression evaluates to.
     */
    Class<?> type();
}
