package dev.backprop.net.losses;

import dev.backprop.net.math.Matrix;
import dev.backprop.net.math.ops.Complement;
import dev.backprop.net.math.ops.Log2;
import dev.backprop.net.math.ops.Negate;

/**
 * Cross-entropy between a one-hot target and sigmoid outputs.
 *
 * <p>Loss: sum(-y * log2(a) - (1 - y) * log2(1 - a))
 * <p>Output delta: a - y
 *
 * <p>The delta is the gradient with respect to the output pre-activations. The sigmoid
 * derivative cancels against the derivative of the loss, so no sigmoid-prime factor is
 * applied at the output layer.
 */
public final class CrossEntropyLoss {

    public static final CrossEntropyLoss INSTANCE = new CrossEntropyLoss();

    private CrossEntropyLoss() {} // Private constructor for singleton

    /**
     * Cost of a single example.
     *
     * @param output sigmoid activations of the output layer
     * @param target one-hot target of the same shape
     */
    public double cost(Matrix output, Matrix target) {
        Matrix positive = target.apply(Negate.INSTANCE)
                .elementwiseMultiply(output.apply(Log2.INSTANCE));
        Matrix negative = target.apply(Complement.INSTANCE)
                .elementwiseMultiply(output.apply(Complement.INSTANCE).apply(Log2.INSTANCE));
        return positive.subtract(negative).sum();
    }

    /**
     * Error of the output layer with respect to its pre-activations.
     */
    public Matrix outputDelta(Matrix output, Matrix target) {
        return output.subtract(target);
    }
}
