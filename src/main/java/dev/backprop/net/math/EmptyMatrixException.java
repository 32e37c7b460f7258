package dev.backprop.net.math;

/**
 * Extreme value queried on a matrix with zero rows or zero columns.
 */
public class EmptyMatrixException extends MatrixException {

    public EmptyMatrixException(String operation) {
        super(operation + " is undefined for an empty matrix");
    }
}
