package org.streamingml.statespace;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ArmaOrderTest {

    @Test
    void splitAndJoinAreInverse() {
        ArmaOrder order = new ArmaOrder(3, 2);
        double[] theta = {0.5, -0.3, 0.1, 0.4, 0.2};

        double[][] parts = order.split(theta);

        assertArrayEquals(new double[]{0.5, -0.3, 0.1}, parts[0], 0.0);
        assertArrayEquals(new double[]{0.4, 0.2}, parts[1], 0.0);
        assertArrayEquals(theta, order.join(parts[0], parts[1]), 0.0);
    }

    @Test
    void stateDimensionCoversBothLagDepths() {
        assertEquals(3, new ArmaOrder(3, 2).getStateDimension());
        assertEquals(5, new ArmaOrder(1, 4).getStateDimension());
        assertEquals(1, new ArmaOrder(0, 0).getStateDimension());
        assertEquals(5, new ArmaOrder(3, 2).getParameterCount());
    }

    @Test
    void rejectsNegativeOrdersAndBadVectors() {
        assertThrows(ConstructionException.class, () -> new ArmaOrder(-1, 0));
        assertThrows(ConstructionException.class, () -> new ArmaOrder(1, 1).split(new double[]{0.5}));
        assertThrows(ConstructionException.class, () -> new ArmaOrder(1, 1).split(null));
        assertThrows(ConstructionException.class, () -> new ArmaOrder(1, 1).join(new double[]{0.5}, new double[0]));
    }

    @Test
    void equalityIsByOrders() {
        assertEquals(new ArmaOrder(3, 2), new ArmaOrder(3, 2));
        assertEquals(new ArmaOrder(3, 2).hashCode(), new ArmaOrder(3, 2).hashCode());
        assertNotEquals(new ArmaOrder(2, 3), new ArmaOrder(3, 2));
        assertEquals("ARMA(3,2)", new ArmaOrder(3, 2).toString());
    }

    @Test
    void contextRejectsEmptySeries() {
        assertThrows(ConstructionException.class, () -> new EstimationContext(new ArmaOrder(1, 0), new double[0]));
        assertThrows(ConstructionException.class, () -> new EstimationContext(null, new double[]{1.0}));
    }
}
