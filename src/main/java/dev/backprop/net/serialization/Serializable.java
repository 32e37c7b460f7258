package dev.backprop.net.serialization;

import java.io.DataOutputStream;
import java.io.IOException;

/**
 * Binary serialization contract.
 *
 * <p>Each class owns its data format: it writes itself with {@link #writeTo} and offers a
 * static {@code deserialize(DataInputStream, int)} that reads back what {@code writeTo}
 * produced for the same version.
 */
public interface Serializable {

    /**
     * Write this object's data to the output stream.
     *
     * @param out output stream to write to
     * @param version serialization version for compatibility
     * @throws IOException if writing fails
     */
    void writeTo(DataOutputStream out, int version) throws IOException;

    /**
     * Get the serialized size in bytes, excluding any type id written by the caller.
     *
     * @param version serialization version
     * @return size in bytes
     */
    int getSerializedSize(int version);

    /**
     * @return type identifier written ahead of this object's data
     */
    int getTypeId();
}
