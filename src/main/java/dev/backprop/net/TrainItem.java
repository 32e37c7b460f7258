package dev.backprop.net;

import dev.backprop.net.math.Matrix;

/**
 * A labeled training example: a 1xN feature row, a class label, and the number of classes.
 *
 * <p>The label is the index of the output neuron that should fire, so it must be a
 * non-negative whole number below {@code distinctClasses}. Items are immutable.
 */
public final class TrainItem {

    private final Matrix values;
    private final double label;
    private final int distinctClasses;

    public TrainItem(Matrix values, double label, int distinctClasses) {
        if (values.rows() != 1)
            throw new IllegalArgumentException("Feature matrix must have exactly one row: " + values.rows());
        if (distinctClasses <= 0)
            throw new IllegalArgumentException("Distinct class count must be positive: " + distinctClasses);
        if (label < 0 || label >= distinctClasses || label != Math.rint(label))
            throw new IllegalArgumentException("Label must be a class index in [0, " + distinctClasses + "): " + label);
        this.values = values.copy();
        this.label = label;
        this.distinctClasses = distinctClasses;
    }

    public static TrainItem of(double[] values, double label, int distinctClasses) {
        return new TrainItem(Matrix.of(values.length, values), label, distinctClasses);
    }

    /**
     * @return copy of the feature row
     */
    public Matrix values() {
        return values.copy();
    }

    // shared view for the forward pass; never mutated
    Matrix input() {
        return values;
    }

    public int featureCount() {
        return values.cols();
    }

    public double label() {
        return label;
    }

    public int distinctClasses() {
        return distinctClasses;
    }

    /**
     * One-hot row of width {@code distinctClasses} with a 1 at the label index.
     */
    public Matrix target() {
        return Matrix.oneHot(1, distinctClasses, 0, (int) label);
    }

    @Override
    public String toString() {
        return "TrainItem[features=" + values.cols() + ", label=" + label + ", classes=" + distinctClasses + "]";
    }
}
