package dev.backprop.net;

import dev.backprop.net.math.Matrix;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TrainItemTest {

    @Test
    void testOfBuildsSingleRow() {
        TrainItem item = TrainItem.of(new double[]{0.1, 0.2, 0.3}, 2, 4);

        assertEquals(3, item.featureCount());
        assertEquals(1, item.values().rows());
        assertEquals(2.0, item.label());
        assertEquals(4, item.distinctClasses());
    }

    @Test
    void testTargetIsOneHotAtLabel() {
        TrainItem item = TrainItem.of(new double[]{1}, 2, 4);

        assertArrayEquals(new double[]{0, 0, 1, 0}, item.target().values());
    }

    @Test
    void testItemIsImmutable() {
        double[] raw = {1, 2};
        Matrix features = Matrix.of(2, raw);
        TrainItem item = new TrainItem(features, 0, 2);

        raw[0] = 9;
        features.set(0, 1, 9);
        item.values().set(0, 0, 9);

        assertArrayEquals(new double[]{1, 2}, item.values().values());
    }

    @Test
    void testInvalidLabelsRejected() {
        assertThrows(IllegalArgumentException.class, () -> TrainItem.of(new double[]{1}, 2, 2));
        assertThrows(IllegalArgumentException.class, () -> TrainItem.of(new double[]{1}, -1, 2));
        assertThrows(IllegalArgumentException.class, () -> TrainItem.of(new double[]{1}, 0.5, 2));
        assertThrows(IllegalArgumentException.class, () -> TrainItem.of(new double[]{1}, 0, 0));
    }

    @Test
    void testFeaturesMustBeOneRow() {
        assertThrows(IllegalArgumentException.class, () -> new TrainItem(Matrix.zeros(2, 2), 0, 2));
    }
}
