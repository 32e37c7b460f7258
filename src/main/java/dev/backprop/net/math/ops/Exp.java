package dev.backprop.net.math.ops;

/**
 * Natural exponential: f(x) = e^x
 */
public final class Exp implements ScalarOp {

    public static final Exp INSTANCE = new Exp();

    private Exp() {}

    @Override
    public double apply(double x) {
        return Math.exp(x);
    }

    @Override
    public String toString() {
        return "Exp";
    }
}
