package de.bsommerfeld.bindiff.core.util;

import de.bsommerfeld.bindiff.core.domain.Address;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AddressCodecTest {

    @Test
    void decode_shouldReinterpretNegativeStoredValues() {
        Address address = AddressCodec.decode(-1L);
        assertEquals("18446744073709551615", address.toUnsignedString());
    }

    @Test
    void decode_shouldKeepSmallValues() {
        assertEquals(Address.of(0x401000L), AddressCodec.decode(0x401000L));
    }

    @Test
    void encode_shouldStoreBitPatternUnchanged() {
        assertEquals(-1L, AddressCodec.encode(Address.parse("0xFFFFFFFFFFFFFFFF")));
        assertEquals(Long.MIN_VALUE, AddressCodec.encode(Address.parse("0x8000000000000000")));
        assertEquals(0x1000L, AddressCodec.encode(Address.of(0x1000L)));
    }

    @Test
    void decodeEncode_shouldBeInverse() {
        long[] samples = { 0L, 1L, 0x7FFFFFFFFFFFFFFFL, Long.MIN_VALUE, -2L, -1L };
        for (long stored : samples) {
            assertEquals(stored, AddressCodec.encode(AddressCodec.decode(stored)));
        }
    }
}
