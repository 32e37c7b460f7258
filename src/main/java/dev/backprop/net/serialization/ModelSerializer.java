package dev.backprop.net.serialization;

import dev.backprop.net.Network;
import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;

import java.io.*;
import java.nio.file.Path;

/**
 * Network persistence with Zstd compression.
 *
 * <p>Layout: header (magic, version, timestamp), type id, network record, end marker.
 * Weights and biases are written as raw doubles, so a save/load round trip is bit exact.
 */
public class ModelSerializer {

    // Compression level: 1=fast, 22=max compression, 3=good balance
    private static final int COMPRESSION_LEVEL = 3;

    /**
     * Save a network to file with compression.
     *
     * @param network the network to save
     * @param filePath path to save the model
     * @throws IOException if saving fails
     */
    public static void save(Network network, Path filePath) throws IOException {
        try (FileOutputStream fileOut = new FileOutputStream(filePath.toFile());
             BufferedOutputStream buffered = new BufferedOutputStream(fileOut, 64 * 1024);
             ZstdOutputStream zstdOut = new ZstdOutputStream(buffered, COMPRESSION_LEVEL);
             DataOutputStream out = new DataOutputStream(zstdOut)) {
            write(network, out);
        }
    }

    /**
     * Load a network from file.
     *
     * @param filePath path to the model file
     * @return the loaded network
     * @throws ModelFormatException if the file does not hold a valid network
     * @throws IOException if reading fails
     */
    public static Network load(Path filePath) throws IOException {
        try (FileInputStream fileIn = new FileInputStream(filePath.toFile());
             BufferedInputStream buffered = new BufferedInputStream(fileIn, 64 * 1024);
             ZstdInputStream zstdIn = new ZstdInputStream(buffered);
             DataInputStream in = new DataInputStream(zstdIn)) {
            return read(in);
        }
    }

    /**
     * Uncompressed in-memory form of a network.
     */
    public static byte[] toBytes(Network network) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(estimateSize(network));
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            write(network, out);
        }
        return bytes.toByteArray();
    }

    /**
     * Reads a network produced by {@link #toBytes(Network)}.
     */
    public static Network fromBytes(byte[] data) throws IOException {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(data))) {
            return read(in);
        }
    }

    /**
     * Uncompressed size of a network record including header and end marker.
     */
    public static int estimateSize(Network network) {
        return 16 + 4 + network.getSerializedSize(SerializationConstants.CURRENT_VERSION) + 4;
    }

    private static void write(Network network, DataOutputStream out) throws IOException {
        writeHeader(out);
        out.writeInt(network.getTypeId());
        network.writeTo(out, SerializationConstants.CURRENT_VERSION);
        out.writeInt(SerializationConstants.SECTION_END);
    }

    private static Network read(DataInputStream in) throws IOException {
        int version = validateHeader(in);

        int typeId = in.readInt();
        if (typeId != SerializationConstants.TYPE_NETWORK)
            throw new ModelFormatException("Expected network record but found type " + typeId);

        Network network = Network.deserialize(in, version);

        int endMarker = in.readInt();
        if (endMarker != SerializationConstants.SECTION_END)
            throw new ModelFormatException("Invalid file format: missing end marker");

        return network;
    }

    private static void writeHeader(DataOutputStream out) throws IOException {
        out.writeInt(SerializationConstants.MAGIC_NUMBER);
        out.writeInt(SerializationConstants.CURRENT_VERSION);
        out.writeLong(System.currentTimeMillis()); // Timestamp
    }

    private static int validateHeader(DataInputStream in) throws IOException {
        int magic = in.readInt();
        if (magic != SerializationConstants.MAGIC_NUMBER)
            throw new ModelFormatException("Invalid file format: wrong magic number");

        int version = in.readInt();
        if (version < 1 || version > SerializationConstants.CURRENT_VERSION)
            throw new ModelFormatException("Unsupported file version: " + version +
                                           " (current version: " + SerializationConstants.CURRENT_VERSION + ")");

        in.readLong(); // timestamp, informational only
        return version;
    }

    private ModelSerializer() {}
}
