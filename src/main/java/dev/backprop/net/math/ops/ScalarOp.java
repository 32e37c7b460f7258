package dev.backprop.net.math.ops;

/**
 * Scalar function mapped over every element by {@link dev.backprop.net.math.Matrix#apply(ScalarOp)}.
 *
 * <p>Implementations are small named objects rather than ad-hoc lambdas so a map
 * step can be inspected (and compared) after the fact. Stateless operations are
 * exposed as {@code INSTANCE} singletons; parameterized ones carry their parameter
 * as a final field.
 */
@FunctionalInterface
public interface ScalarOp {

    double apply(double x);
}
