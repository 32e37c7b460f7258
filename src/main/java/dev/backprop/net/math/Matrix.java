package dev.backprop.net.math;

import dev.backprop.net.math.ops.Complement;
import dev.backprop.net.math.ops.Exp;
import dev.backprop.net.math.ops.Increment;
import dev.backprop.net.math.ops.Negate;
import dev.backprop.net.math.ops.Reciprocal;
import dev.backprop.net.math.ops.ScalarOp;
import dev.backprop.net.serialization.ModelFormatException;
import dev.backprop.net.serialization.Serializable;
import dev.backprop.net.serialization.SerializationConstants;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Locale;
import java.util.random.RandomGenerator;

/**
 * Dense row-major matrix of doubles.
 *
 * <p>Matrices behave as values: every operation allocates and returns a new matrix and
 * leaves its operands untouched. The only mutator is {@link #set(int, int, double)}, which
 * exists for building a matrix element by element. Storage is never shared between two
 * instances, so a copied matrix can be mutated without affecting its source.
 *
 * <p>Shape rules:
 * <ul>
 *   <li>{@link #add}, {@link #subtract} and {@link #elementwiseMultiply} need identical shapes</li>
 *   <li>{@link #dot} needs {@code this.cols() == other.rows()}</li>
 * </ul>
 * Violations raise {@link ShapeMismatchException}.
 */
public final class Matrix implements Serializable {

    private final int rows;
    private final int cols;
    private final double[] values;

    private Matrix(int rows, int cols, double[] values) {
        this.rows = rows;
        this.cols = cols;
        this.values = values;
    }

    // ===============================
    // FACTORIES
    // ===============================

    /**
     * Zero-filled matrix of the given shape.
     */
    public static Matrix zeros(int rows, int cols) {
        if (rows < 0 || cols < 0)
            throw new IllegalArgumentException("Matrix dimensions must be non-negative: " + rows + "x" + cols);
        int size;
        try {
            size = Math.multiplyExact(rows, cols);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Matrix " + rows + "x" + cols + " exceeds the maximum element count", e);
        }
        return new Matrix(rows, cols, new double[size]);
    }

    /**
     * Matrix with every entry drawn from a standard normal distribution.
     */
    public static Matrix random(int rows, int cols, RandomGenerator random) {
        Matrix m = zeros(rows, cols);
        for (int i = 0; i < m.values.length; i++)
            m.values[i] = random.nextGaussian();
        return m;
    }

    /**
     * Standard normal entries divided by {@code sqrt(rows)}.
     *
     * <p>Used for weights: with {@code rows} as the fan-in, the variance of a pre-activation
     * stays around one whatever the width of the previous layer.
     */
    public static Matrix randomNormalized(int rows, int cols, RandomGenerator random) {
        Matrix m = zeros(rows, cols);
        double scale = Math.sqrt(rows);
        for (int i = 0; i < m.values.length; i++)
            m.values[i] = random.nextGaussian() / scale;
        return m;
    }

    /**
     * Wraps a row-major value sequence. The values are copied.
     *
     * @param cols column count; the number of values must be a multiple of it
     * @param values row-major values
     */
    public static Matrix of(int cols, double... values) {
        if (cols < 0)
            throw new IllegalArgumentException("Column count must be non-negative: " + cols);
        if (cols == 0 ? values.length != 0 : values.length % cols != 0)
            throw new IllegalArgumentException("Value count " + values.length + " is not a multiple of " + cols + " columns");
        int rows = cols == 0 ? 0 : values.length / cols;
        return new Matrix(rows, cols, Arrays.copyOf(values, values.length));
    }

    /**
     * Zero matrix with a single 1.0 at ({@code row}, {@code col}).
     *
     * @throws MatrixIndexOutOfRangeException if the hot position is outside the matrix
     */
    public static Matrix oneHot(int rows, int cols, int row, int col) {
        Matrix m = zeros(rows, cols);
        m.set(row, col, 1.0);
        return m;
    }

    // ===============================
    // SHAPE AND ACCESS
    // ===============================

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return rows == 0 || cols == 0;
    }

    public boolean sameShape(Matrix other) {
        return rows == other.rows && cols == other.cols;
    }

    /**
     * @throws MatrixIndexOutOfRangeException if either index is negative or past the last row/column
     */
    public double get(int row, int col) {
        checkPosition(row, col);
        return values[row * cols + col];
    }

    /**
     * Writes a single element in place. Intended for construction only.
     *
     * @throws MatrixIndexOutOfRangeException if either index is negative or past the last row/column
     */
    public void set(int row, int col, double value) {
        checkPosition(row, col);
        values[row * cols + col] = value;
    }

    /**
     * Copy of the row-major values.
     */
    public double[] values() {
        return Arrays.copyOf(values, values.length);
    }

    public Matrix copy() {
        return new Matrix(rows, cols, Arrays.copyOf(values, values.length));
    }

    private void checkPosition(int row, int col) {
        if (row < 0 || col < 0 || row >= rows || col >= cols)
            throw new MatrixIndexOutOfRangeException(row, col, rows, cols);
    }

    // ===============================
    // ELEMENTWISE OPERATIONS
    // ===============================

    public Matrix add(Matrix other) {
        checkSameShape("add", other);
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++)
            result[i] = values[i] + other.values[i];
        return new Matrix(rows, cols, result);
    }

    public Matrix subtract(Matrix other) {
        checkSameShape("subtract", other);
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++)
            result[i] = values[i] - other.values[i];
        return new Matrix(rows, cols, result);
    }

    public Matrix elementwiseMultiply(Matrix other) {
        checkSameShape("elementwiseMultiply", other);
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++)
            result[i] = values[i] * other.values[i];
        return new Matrix(rows, cols, result);
    }

    /**
     * Maps {@code op} over every element.
     */
    public Matrix apply(ScalarOp op) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++)
            result[i] = op.apply(values[i]);
        return new Matrix(rows, cols, result);
    }

    private void checkSameShape(String operation, Matrix other) {
        if (!sameShape(other))
            throw new ShapeMismatchException(operation, this, other);
    }

    // ===============================
    // LINEAR ALGEBRA
    // ===============================

    /**
     * Matrix product {@code this x other}, shaped {@code this.rows() x other.cols()}.
     *
     * @throws ShapeMismatchException if {@code this.cols() != other.rows()}
     */
    public Matrix dot(Matrix other) {
        if (cols != other.rows)
            throw new ShapeMismatchException("dot", this, other);

        int outCols = other.cols;
        double[] result = new double[rows * outCols];
        for (int i = 0; i < rows; i++) {
            int rowOffset = i * cols;
            for (int j = 0; j < outCols; j++) {
                double sum = 0.0;
                for (int k = 0; k < cols; k++)
                    sum += values[rowOffset + k] * other.values[k * outCols + j];
                result[i * outCols + j] = sum;
            }
        }
        return new Matrix(rows, outCols, result);
    }

    public Matrix transpose() {
        double[] result = new double[values.length];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++)
                result[j * rows + i] = values[i * cols + j];
        }
        return new Matrix(cols, rows, result);
    }

    public double sum() {
        double sum = 0.0;
        for (double value : values)
            sum += value;
        return sum;
    }

    // ===============================
    // EXTREMES
    // ===============================

    /**
     * Flat row-major index of the largest element; ties go to the first one.
     *
     * @throws EmptyMatrixException if the matrix has no rows or no columns
     */
    public int maxIndex() {
        if (isEmpty())
            throw new EmptyMatrixException("maxIndex");
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best])
                best = i;
        }
        return best;
    }

    public double maxValue() {
        return values[maxIndex()];
    }

    /**
     * Flat row-major index of the smallest element; ties go to the first one.
     *
     * @throws EmptyMatrixException if the matrix has no rows or no columns
     */
    public int minIndex() {
        if (isEmpty())
            throw new EmptyMatrixException("minIndex");
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] < values[best])
                best = i;
        }
        return best;
    }

    public double minValue() {
        return values[minIndex()];
    }

    // ===============================
    // ACTIVATIONS
    // ===============================

    /**
     * Elementwise logistic function 1 / (1 + e^-x).
     */
    public Matrix sigmoid() {
        return apply(Negate.INSTANCE)
                .apply(Exp.INSTANCE)
                .apply(Increment.INSTANCE)
                .apply(Reciprocal.INSTANCE);
    }

    /**
     * Elementwise derivative of the logistic function, sigmoid(x) * (1 - sigmoid(x)).
     */
    public Matrix sigmoidPrime() {
        Matrix s = sigmoid();
        return s.elementwiseMultiply(s.apply(Complement.INSTANCE));
    }

    // ===============================
    // SERIALIZATION
    // ===============================

    @Override
    public void writeTo(DataOutputStream out, int version) throws IOException {
        out.writeInt(cols);
        out.writeInt(values.length);
        for (double value : values)
            out.writeDouble(value);
    }

    // doubles read before the value array grows again; bounds the allocation for truncated input
    private static final int READ_CHUNK = 8192;

    /**
     * Reads a matrix written by {@link #writeTo(DataOutputStream, int)}.
     *
     * <p>The record holds only the column count and the value count, so a matrix with rows but
     * no columns comes back as 0x0. Use {@link #deserialize(DataInputStream, int, int, int)}
     * when the shape is known.
     */
    public static Matrix deserialize(DataInputStream in, int version) throws IOException {
        int cols = in.readInt();
        int count = in.readInt();
        if (cols < 0 || count < 0)
            throw new ModelFormatException("Negative matrix dimensions: cols=" + cols + ", values=" + count);
        if (cols == 0 ? count != 0 : count % cols != 0)
            throw new ModelFormatException("Matrix value count " + count + " is not a multiple of " + cols + " columns");

        return new Matrix(cols == 0 ? 0 : count / cols, cols, readValues(in, count));
    }

    /**
     * Reads a matrix record that must have the given shape. The record header is checked
     * before any value is read.
     *
     * @throws ModelFormatException if the record does not describe a {@code rows x cols} matrix
     */
    public static Matrix deserialize(DataInputStream in, int version, int rows, int cols) throws IOException {
        int storedCols = in.readInt();
        int count = in.readInt();
        if (storedCols != cols || (long) count != (long) rows * cols)
            throw new ModelFormatException(String.format("Expected a %dx%d matrix but found cols=%d, values=%d",
                    rows, cols, storedCols, count));

        return new Matrix(rows, cols, readValues(in, count));
    }

    private static double[] readValues(DataInputStream in, int count) throws IOException {
        double[] values = new double[Math.min(count, READ_CHUNK)];
        for (int i = 0; i < count; i++) {
            if (i == values.length)
                values = Arrays.copyOf(values, (int) Math.min(count, 2L * values.length));
            values[i] = in.readDouble();
        }
        return values;
    }

    @Override
    public int getSerializedSize(int version) {
        return 8 + values.length * 8;
    }

    @Override
    public int getTypeId() {
        return SerializationConstants.TYPE_MATRIX;
    }

    // ===============================
    // OBJECT
    // ===============================

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Matrix)) return false;
        Matrix other = (Matrix) o;
        return rows == other.rows && cols == other.cols && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + cols) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        if (isEmpty())
            return "| |";

        double max = maxValue();
        int width = Double.isFinite(max) ? integerDigits(max) + 6 : 10;
        String format = "%" + width + ".2f";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < rows; i++) {
            if (i > 0) sb.append('\n');
            sb.append("| ");
            for (int j = 0; j < cols; j++)
                sb.append(String.format(Locale.ROOT, format, values[i * cols + j]));
            sb.append(" |");
        }
        return sb.toString();
    }

    // digits past the first for values >= 10
    private static int integerDigits(double value) {
        int digits = 0;
        while (value >= 10) {
            value /= 10;
            digits++;
        }
        return digits;
    }
}
