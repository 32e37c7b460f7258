package dev.backprop.net.math.ops;

/**
 * Increment: f(x) = 1 + x
 */
public final class Increment implements ScalarOp {

    public static final Increment INSTANCE = new Increment();

    private Increment() {}

    @Override
    public double apply(double x) {
        return 1.0 + x;
    }

    @Override
    public String toString() {
        return "Increment";
    }
}
