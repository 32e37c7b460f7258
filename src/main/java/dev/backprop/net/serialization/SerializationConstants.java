package dev.backprop.net.serialization;

/**
 * Constants for the network model format.
 */
public final class SerializationConstants {

    // File format identification
    public static final int MAGIC_NUMBER = 0x42504E4E; // "BPNN"
    public static final int CURRENT_VERSION = 1;

    public static final int TYPE_NETWORK = 0;
    public static final int TYPE_MATRIX = 1;

    // File structure markers
    public static final int SECTION_END = 0x1999;

    private SerializationConstants() {}
}
