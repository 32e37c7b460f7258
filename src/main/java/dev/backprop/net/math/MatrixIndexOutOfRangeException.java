package dev.backprop.net.math;

/**
 * Indexed access outside of a matrix's bounds.
 */
public class MatrixIndexOutOfRangeException extends MatrixException {

    private final int row;
    private final int col;

    public MatrixIndexOutOfRangeException(int row, int col, int rows, int cols) {
        super(String.format("Position (%d, %d) is outside of a %dx%d matrix", row, col, rows, cols));
        this.row = row;
        this.col = col;
    }

    public int getRow() { return row; }
    public int getCol() { return col; }
}
