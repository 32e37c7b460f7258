package dev.backprop.net.math.ops;

/**
 * Complement: f(x) = 1 - x. Used for the (1 - y) terms of cross-entropy and the sigmoid derivative.
 */
public final class Complement implements ScalarOp {

    public static final Complement INSTANCE = new Complement();

    private Complement() {}

    @Override
    public double apply(double x) {
        return 1.0 - x;
    }

    @Override
    public String toString() {
        return "Complement";
    }
}
