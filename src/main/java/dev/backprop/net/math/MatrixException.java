package dev.backprop.net.math;

/**
 * Base type for failures raised by {@link Matrix} operations.
 */
public class MatrixException extends RuntimeException {

    public MatrixException(String message) {
        super(message);
    }
}
