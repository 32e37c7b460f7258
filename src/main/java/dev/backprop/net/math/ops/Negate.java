package dev.backprop.net.math.ops;

/**
 * Negation: f(x) = -x
 */
public final class Negate implements ScalarOp {

    public static final Negate INSTANCE = new Negate();

    private Negate() {}

    @Override
    public double apply(double x) {
        return -x;
    }

    @Override
    public String toString() {
        return "Negate";
    }
}
