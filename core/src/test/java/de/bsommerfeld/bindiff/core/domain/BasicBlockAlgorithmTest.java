package de.bsommerfeld.bindiff.core.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BasicBlockAlgorithmTest {

    @Test
    void codes_shouldBeContiguousFromZero() {
        BasicBlockAlgorithm[] values = BasicBlockAlgorithm.values();
        assertEquals(21, values.length);
        for (int i = 0; i < values.length; i++) {
            assertEquals(i, values[i].code());
        }
    }

    @Test
    void edgesPrimeProduct_shouldBeCode1() {
        assertEquals(1, BasicBlockAlgorithm.EDGES_PRIME_PRODUCT.code());
        assertEquals("basicBlock: edges prime product", BasicBlockAlgorithm.EDGES_PRIME_PRODUCT.lookupLabel());
    }

    @Test
    void manual_shouldBeLastCode() {
        assertEquals(20, BasicBlockAlgorithm.MANUAL.code());
        assertSame(BasicBlockAlgorithm.MANUAL, BasicBlockAlgorithm.fromCode(20));
    }

    @Test
    void fromCode_shouldRoundTripEveryMember() {
        for (BasicBlockAlgorithm algorithm : BasicBlockAlgorithm.values()) {
            assertSame(algorithm, BasicBlockAlgorithm.fromCode(algorithm.code()));
        }
    }

    @Test
    void fromCode_shouldRejectUnknownCode() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> BasicBlockAlgorithm.fromCode(42));
        assertTrue(e.getMessage().contains("42"));
    }
}
