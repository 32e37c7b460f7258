package dev.backprop.net.math;

/**
 * Operand dimensions are incompatible for an elementwise or multiplicative operation.
 */
public class ShapeMismatchException extends MatrixException {

    private final int leftRows;
    private final int leftCols;
    private final int rightRows;
    private final int rightCols;

    public ShapeMismatchException(String operation, Matrix left, Matrix right) {
        super(String.format("%s: incompatible shapes %dx%d and %dx%d",
                operation, left.rows(), left.cols(), right.rows(), right.cols()));
        this.leftRows = left.rows();
        this.leftCols = left.cols();
        this.rightRows = right.rows();
        this.rightCols = right.cols();
    }

    public int getLeftRows() { return leftRows; }
    public int getLeftCols() { return leftCols; }
    public int getRightRows() { return rightRows; }
    public int getRightCols() { return rightCols; }
}
