package dev.blanke.fieldidentifier.lambda;

import java.io.Serializable;
import java.util.function.Supplier;

/**
 * A zero-argument function reading a value, whose body can be recovered by {@link LambdaLifter#lift(Accessor)}.
 * <p>
 * The interface extends {@link Serializable} so that javac compiles lambdas targeting it into serializable lambdas,
 * which expose their implementation method and captured arguments through a
 * {@link java.lang.invoke.SerializedLambda}.
 *
 * @param <T> The type of the value read.
 */
@FunctionalInterface
public interface Accessor<T> extends Supplier<T>, Serializable {
}
