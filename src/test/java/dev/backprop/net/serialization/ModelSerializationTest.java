package dev.backprop.net.serialization;

import dev.backprop.net.Network;
import dev.backprop.net.math.Matrix;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class ModelSerializationTest {

    @TempDir
    Path tempDir;

    private static void assertSameParameters(Network expected, Network actual) {
        assertArrayEquals(expected.layerSizes(), actual.layerSizes());
        for (int i = 0; i < expected.layerCount() - 1; i++) {
            assertEquals(expected.weights(i), actual.weights(i));
            assertEquals(expected.biases(i), actual.biases(i));
        }
    }

    @Test
    void testSaveAndLoadFile() throws IOException {
        Network net = Network.newBuilder().layers(3, 5, 4, 2).withSeed(11).build();
        Path file = tempDir.resolve("model.bin");

        net.save(file);
        assertTrue(Files.size(file) > 0);
        Network loaded = Network.load(file);

        assertSameParameters(net, loaded);
        Matrix input = Matrix.of(3, 0.1, -0.7, 2.5);
        assertEquals(net.feedForward(input), loaded.feedForward(input));
    }

    @Test
    void testBytesRoundTrip() throws IOException {
        Network net = Network.newBuilder().layers(2, 3, 1).withSeed(5).build();

        byte[] bytes = ModelSerializer.toBytes(net);
        assertEquals(ModelSerializer.estimateSize(net), bytes.length);

        assertSameParameters(net, ModelSerializer.fromBytes(bytes));
    }

    @Test
    void testMatrixKeepsSpecialValues() throws IOException {
        Matrix m = Matrix.of(2, Double.NaN, Double.POSITIVE_INFINITY, -0.0, Double.MIN_VALUE);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            m.writeTo(out, SerializationConstants.CURRENT_VERSION);
        }
        assertEquals(m.getSerializedSize(SerializationConstants.CURRENT_VERSION), bytes.size());

        Matrix read = Matrix.deserialize(new DataInputStream(new ByteArrayInputStream(bytes.toByteArray())),
                SerializationConstants.CURRENT_VERSION);

        assertEquals(2, read.rows());
        assertEquals(2, read.cols());
        assertTrue(Double.isNaN(read.get(0, 0)));
        assertEquals(Double.POSITIVE_INFINITY, read.get(0, 1));
        assertEquals(Double.doubleToRawLongBits(-0.0), Double.doubleToRawLongBits(read.get(1, 0)));
        assertEquals(Double.MIN_VALUE, read.get(1, 1));
    }

    @Test
    void testRejectsWrongMagic() throws IOException {
        byte[] bytes = ModelSerializer.toBytes(Network.newBuilder().layers(2, 2).withSeed(1).build());
        bytes[0] = 0;

        ModelFormatException e = assertThrows(ModelFormatException.class, () -> ModelSerializer.fromBytes(bytes));
        assertTrue(e.getMessage().contains("magic"));
    }

    @Test
    void testRejectsUnsupportedVersion() throws IOException {
        byte[] bytes = ModelSerializer.toBytes(Network.newBuilder().layers(2, 2).withSeed(1).build());
        bytes[7] = (byte) (SerializationConstants.CURRENT_VERSION + 1);

        assertThrows(ModelFormatException.class, () -> ModelSerializer.fromBytes(bytes));
    }

    @Test
    void testRejectsWrongTypeId() throws IOException {
        byte[] bytes = ModelSerializer.toBytes(Network.newBuilder().layers(2, 2).withSeed(1).build());
        // type id follows the 16 byte header
        bytes[19] = (byte) SerializationConstants.TYPE_MATRIX;

        assertThrows(ModelFormatException.class, () -> ModelSerializer.fromBytes(bytes));
    }

    @Test
    void testRejectsMissingEndMarker() throws IOException {
        byte[] bytes = ModelSerializer.toBytes(Network.newBuilder().layers(2, 2).withSeed(1).build());
        bytes[bytes.length - 1] ^= 0x01;

        assertThrows(ModelFormatException.class, () -> ModelSerializer.fromBytes(bytes));
    }

    @Test
    void testRejectsTruncatedData() throws IOException {
        byte[] bytes = ModelSerializer.toBytes(Network.newBuilder().layers(2, 3, 2).withSeed(1).build());
        byte[] truncated = Arrays.copyOf(bytes, bytes.length - 12);

        assertThrows(EOFException.class, () -> ModelSerializer.fromBytes(truncated));
    }

    @Test
    void testRejectsInconsistentShapes() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeInt(SerializationConstants.MAGIC_NUMBER);
            out.writeInt(SerializationConstants.CURRENT_VERSION);
            out.writeLong(0L);
            out.writeInt(SerializationConstants.TYPE_NETWORK);
            out.writeInt(2);
            out.writeInt(2);
            out.writeInt(3);
            // weights claim 3x2 where 2x3 is needed
            Matrix.zeros(3, 2).writeTo(out, SerializationConstants.CURRENT_VERSION);
            Matrix.zeros(1, 3).writeTo(out, SerializationConstants.CURRENT_VERSION);
            out.writeInt(SerializationConstants.SECTION_END);
        }

        ModelFormatException e = assertThrows(ModelFormatException.class,
                () -> ModelSerializer.fromBytes(bytes.toByteArray()));
        assertTrue(e.getMessage().startsWith("Expected a 2x3 matrix"));
    }

    private static DataOutputStream networkHeader(ByteArrayOutputStream bytes, int... layers) throws IOException {
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeInt(SerializationConstants.MAGIC_NUMBER);
        out.writeInt(SerializationConstants.CURRENT_VERSION);
        out.writeLong(0L);
        out.writeInt(SerializationConstants.TYPE_NETWORK);
        out.writeInt(layers.length);
        for (int size : layers)
            out.writeInt(size);
        return out;
    }

    @Test
    void testRejectsHugeValueCountWithoutAllocating() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = networkHeader(bytes, 2, 2)) {
            out.writeInt(1);
            out.writeInt(Integer.MAX_VALUE - 8);
        }

        assertThrows(ModelFormatException.class, () -> ModelSerializer.fromBytes(bytes.toByteArray()));
    }

    @Test
    void testLargeDeclaredShapeWithMissingValuesIsTruncation() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = networkHeader(bytes, 40000, 40000)) {
            out.writeInt(40000);
            out.writeInt(40000 * 40000);
            out.writeDouble(1.0);
        }

        assertThrows(EOFException.class, () -> ModelSerializer.fromBytes(bytes.toByteArray()));
    }

    @Test
    void testRejectsOversizedWeights() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = networkHeader(bytes, 65536, 65536)) {
            out.writeInt(65536);
            out.writeInt(0);
        }

        assertThrows(ModelFormatException.class, () -> ModelSerializer.fromBytes(bytes.toByteArray()));
    }

    @Test
    void testRejectsHugeLayerCount() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeInt(SerializationConstants.MAGIC_NUMBER);
            out.writeInt(SerializationConstants.CURRENT_VERSION);
            out.writeLong(0L);
            out.writeInt(SerializationConstants.TYPE_NETWORK);
            out.writeInt(Integer.MAX_VALUE);
        }

        assertThrows(ModelFormatException.class, () -> ModelSerializer.fromBytes(bytes.toByteArray()));
    }

    @Test
    void testRejectsNonPositiveLayerSize() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = networkHeader(bytes, 2, -3)) {
            out.writeInt(SerializationConstants.SECTION_END);
        }

        assertThrows(ModelFormatException.class, () -> ModelSerializer.fromBytes(bytes.toByteArray()));
    }

    @Test
    void testShapedReadKeepsRowsOfColumnlessMatrix() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            Matrix.zeros(3, 0).writeTo(out, SerializationConstants.CURRENT_VERSION);
        }
        byte[] record = bytes.toByteArray();

        Matrix unshaped = Matrix.deserialize(new DataInputStream(new ByteArrayInputStream(record)),
                SerializationConstants.CURRENT_VERSION);
        Matrix shaped = Matrix.deserialize(new DataInputStream(new ByteArrayInputStream(record)),
                SerializationConstants.CURRENT_VERSION, 3, 0);

        assertEquals(0, unshaped.rows());
        assertEquals(Matrix.zeros(3, 0), shaped);
        assertThrows(ModelFormatException.class, () -> Matrix.deserialize(
                new DataInputStream(new ByteArrayInputStream(record)), SerializationConstants.CURRENT_VERSION, 2, 1));
    }

    @Test
    void testRejectsSingleLayer() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeInt(SerializationConstants.MAGIC_NUMBER);
            out.writeInt(SerializationConstants.CURRENT_VERSION);
            out.writeLong(0L);
            out.writeInt(SerializationConstants.TYPE_NETWORK);
            out.writeInt(1);
            out.writeInt(4);
        }

        assertThrows(ModelFormatException.class, () -> ModelSerializer.fromBytes(bytes.toByteArray()));
    }

    @Test
    void testRejectsRaggedMatrix() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        assertDoesNotThrow(() -> {
            try (DataOutputStream out = new DataOutputStream(bytes)) {
                out.writeInt(3);
                out.writeInt(4);
            }
        });

        assertThrows(ModelFormatException.class, () -> Matrix.deserialize(
                new DataInputStream(new ByteArrayInputStream(bytes.toByteArray())),
                SerializationConstants.CURRENT_VERSION));
    }

    @Test
    void testLoadRejectsNonZstdFile() throws IOException {
        Path file = tempDir.resolve("garbage.bin");
        Files.write(file, new byte[]{1, 2, 3, 4, 5, 6, 7, 8});

        assertThrows(IOException.class, () -> Network.load(file));
    }
}
