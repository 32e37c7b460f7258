package dev.backprop.net.math.ops;

/**
 * Base-2 logarithm: f(x) = log2(x). Returns negative infinity at 0 and NaN below it.
 */
public final class Log2 implements ScalarOp {

    public static final Log2 INSTANCE = new Log2();

    private static final double LN2 = Math.log(2.0);

    private Log2() {}

    @Override
    public double apply(double x) {
        return Math.log(x) / LN2;
    }

    @Override
    public String toString() {
        return "Log2";
    }
}
