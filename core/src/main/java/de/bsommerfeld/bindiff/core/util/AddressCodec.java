package de.bsommerfeld.bindiff.core.util;

import de.bsommerfeld.bindiff.core.domain.Address;

/**
 * Converts between the signed 64-bit INTEGER that SQLite persists and the
 * canonical unsigned {@link Address}.
 *
 * <p>
 * SQLite has no unsigned column type. Addresses at or above
 * {@code 0x8000000000000000} come back from the driver as negative
 * {@code long} values; {@link #decode(long)} reinterprets the bit pattern as
 * unsigned. Writes store the pattern unchanged, so {@code encode(decode(x))}
 * and {@code decode(encode(a))} are both identities.
 */
public final class AddressCodec {

    private AddressCodec() {
    }

    /** Reinterprets a stored column value as an unsigned address. */
    public static Address decode(long stored) {
        return Address.of(stored);
    }

    /** Returns the bit pattern to bind into a signed INTEGER column. */
    public static long encode(Address address) {
        return address.bits();
    }
}
