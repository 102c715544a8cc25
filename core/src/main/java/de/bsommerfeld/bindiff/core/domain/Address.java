package de.bsommerfeld.bindiff.core.domain;

import java.math.BigInteger;

/**
 * Unsigned 64-bit address inside an analyzed binary.
 *
 * <p>
 * Java has no unsigned {@code long}, so the address is held as its raw
 * 64-bit pattern in {@link #bits()} and every observable operation (ordering,
 * rendering, {@link #toBigInteger()}) interprets that pattern as unsigned.
 * {@code 0xFFFFFFFFFFFFFFFF} therefore prints as {@code 18446744073709551615},
 * never as {@code -1}.
 *
 * @param bits the raw 64-bit pattern, signed only from Java's point of view
 */
public record Address(long bits) implements Comparable<Address> {

    public static final Address ZERO = new Address(0L);

    /** Largest address, {@code 2^64 - 1}. */
    public static final Address MAX = new Address(-1L);

    private static final BigInteger UNSIGNED_LIMIT = BigInteger.ONE.shiftLeft(Long.SIZE);

    /** Wraps a raw 64-bit pattern. */
    public static Address of(long bits) {
        return new Address(bits);
    }

    /**
     * Creates an address from an arbitrary-precision value.
     *
     * @throws IllegalArgumentException if the value lies outside
     *                                  {@code [0, 2^64 - 1]}
     */
    public static Address of(BigInteger value) {
        if (value.signum() < 0 || value.compareTo(UNSIGNED_LIMIT) >= 0) {
            throw new IllegalArgumentException("Address out of unsigned 64-bit range: " + value);
        }
        return new Address(value.longValue());
    }

    /**
     * Parses {@code 0x}-prefixed hexadecimal or plain unsigned decimal text.
     *
     * @throws IllegalArgumentException if the text is not a valid unsigned
     *                                  64-bit number
     */
    public static Address parse(String text) {
        String trimmed = text.trim();
        try {
            if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
                return new Address(Long.parseUnsignedLong(trimmed.substring(2), 16));
            }
            return new Address(Long.parseUnsignedLong(trimmed));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an unsigned 64-bit address: " + text, e);
        }
    }

    public BigInteger toBigInteger() {
        BigInteger value = BigInteger.valueOf(bits);
        return bits < 0 ? value.add(UNSIGNED_LIMIT) : value;
    }

    public String toUnsignedString() {
        return Long.toUnsignedString(bits);
    }

    /** Lower-case hex with {@code 0x} prefix, e.g. {@code 0x401000}. */
    public String toHexString() {
        return "0x" + Long.toHexString(bits);
    }

    @Override
    public int compareTo(Address other) {
        return Long.compareUnsigned(bits, other.bits);
    }

    @Override
    public String toString() {
        return toHexString();
    }
}
