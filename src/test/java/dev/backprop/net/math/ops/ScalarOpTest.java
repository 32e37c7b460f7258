package dev.backprop.net.math.ops;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScalarOpTest {

    private static final double DELTA = 1e-12;

    @Test
    void testStatelessOps() {
        assertEquals(-2.5, Negate.INSTANCE.apply(2.5));
        assertEquals(3.5, Increment.INSTANCE.apply(2.5));
        assertEquals(-1.5, Complement.INSTANCE.apply(2.5));
        assertEquals(0.4, Reciprocal.INSTANCE.apply(2.5), DELTA);
        assertEquals(Math.E, Exp.INSTANCE.apply(1.0), DELTA);
        assertEquals(3.0, Log2.INSTANCE.apply(8.0), DELTA);
    }

    @Test
    void testLog2Edges() {
        assertEquals(Double.NEGATIVE_INFINITY, Log2.INSTANCE.apply(0.0));
        assertTrue(Double.isNaN(Log2.INSTANCE.apply(-1.0)));
        assertEquals(-1.0, Log2.INSTANCE.apply(0.5), DELTA);
    }

    @Test
    void testScaleCarriesItsFactor() {
        Scale scale = new Scale(0.5);

        assertEquals(0.5, scale.getFactor());
        assertEquals(2.0, scale.apply(4.0));
        assertEquals(new Scale(0.5), scale);
        assertNotEquals(new Scale(0.25), scale);
        assertEquals("Scale[0.5]", scale.toString());
    }
}
