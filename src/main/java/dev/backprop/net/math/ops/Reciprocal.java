package dev.backprop.net.math.ops;

/**
 * Reciprocal: f(x) = 1 / x
 */
public final class Reciprocal implements ScalarOp {

    public static final Reciprocal INSTANCE = new Reciprocal();

    private Reciprocal() {}

    @Override
    public double apply(double x) {
        return 1.0 / x;
    }

    @Override
    public String toString() {
        return "Reciprocal";
    }
}
