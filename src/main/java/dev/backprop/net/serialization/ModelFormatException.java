package dev.backprop.net.serialization;

import java.io.IOException;

/**
 * Persisted model data is malformed: wrong header, unknown type, or dimensions that do not
 * describe a valid network.
 */
public class ModelFormatException extends IOException {

    public ModelFormatException(String message) {
        super(message);
    }
}
