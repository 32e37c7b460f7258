package dev.backprop.net.math.ops;

/**
 * Multiplication by a fixed factor: f(x) = factor * x.
 *
 * <p>Used for the learning-rate step and the L2 weight decay factor of a mini-batch update.
 */
public final class Scale implements ScalarOp {

    private final double factor;

    public Scale(double factor) {
        this.factor = factor;
    }

    public double getFactor() {
        return factor;
    }

    @Override
    public double apply(double x) {
        return factor * x;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Scale && Double.compare(((Scale) o).factor, factor) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(factor);
    }

    @Override
    public String toString() {
        return "Scale[" + factor + "]";
    }
}
