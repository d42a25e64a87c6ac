package com.hdlsim.proxy.value;

import java.math.BigInteger;

/**
 * Immutable fixed-width bit vector, most significant bit first.
 *
 * Each position holds one of {@code 0}, {@code 1}, {@code x} (unknown) or
 * {@code z} (high impedance), or one of the remaining std_logic values VHDL
 * simulators report: {@code U} (uninitialised), {@code W} (weak unknown),
 * {@code L} (weak 0), {@code H} (weak 1) and {@code -} (don't care). The width
 * is fixed when the vector is created, which for values read from the
 * simulator means at the time of the read.
 *
 * Case is normalised: x and z are stored lower-case, U W L H upper-case.
 *
 * A vector is resolvable to an integer when every position is 0, 1, L, H or -.
 * L and - resolve to 0 and H to 1.
 */
public final class BitVector {
    private final String binStr;

    /**
     * @param binStr bit pattern, MSB first, in either case
     * @throws IllegalArgumentException if the pattern is empty or contains any
     *                                  other character
     */
    public BitVector(String binStr) {
        if (binStr == null || binStr.isEmpty())
            throw new IllegalArgumentException("Bit pattern must not be empty");
        char[] bits = binStr.toCharArray();
        for (int i = 0; i < bits.length; i++)
            bits[i] = normalise(bits[i], binStr);
        this.binStr = new String(bits);
    }

    private static char normalise(char c, String binStr) {
        return switch (c) {
            case '0', '1', '-' -> c;
            case 'x', 'X' -> 'x';
            case 'z', 'Z' -> 'z';
            case 'u', 'U' -> 'U';
            case 'w', 'W' -> 'W';
            case 'l', 'L' -> 'L';
            case 'h', 'H' -> 'H';
            default -> throw new IllegalArgumentException("Invalid character '" + c + "' in bit pattern: " + binStr);
        };
    }

    public static BitVector of(long value, int width) {
        return of(BigInteger.valueOf(value), width);
    }

    /**
     * Encodes an integer into {@code width} bits. Negative values are stored in
     * two's complement.
     *
     * @throws IllegalArgumentException if the value needs more than
     *                                  {@code width} bits
     */
    public static BitVector of(BigInteger value, int width) {
        if (width <= 0)
            throw new IllegalArgumentException("Width must be positive: " + width);
        int needed = value.signum() < 0 ? value.bitLength() + 1 : value.bitLength();
        if (needed > width)
            throw new IllegalArgumentException("Value " + value + " does not fit in " + width + " bits");

        BigInteger unsigned = value.signum() < 0 ? value.add(BigInteger.ONE.shiftLeft(width)) : value;
        String digits = unsigned.toString(2);
        StringBuilder sb = new StringBuilder(width);
        for (int i = digits.length(); i < width; i++)
            sb.append('0');
        return new BitVector(sb.append(digits).toString());
    }

    public int width() {
        return binStr.length();
    }

    public String binStr() {
        return binStr;
    }

    /** Bit at position {@code i}, counted from the least significant end. */
    public char bit(int i) {
        return binStr.charAt(binStr.length() - 1 - i);
    }

    public boolean isResolvable() {
        for (int i = 0; i < binStr.length(); i++) {
            if (resolve(binStr.charAt(i)) == 0)
                return false;
        }
        return true;
    }

    /**
     * Unsigned integer value.
     *
     * @throws IllegalStateException if any bit is x, z, U or W
     */
    public BigInteger toBigInteger() {
        return new BigInteger(resolved(), 2);
    }

    /** Unsigned value truncated to 64 bits. */
    public long toLong() {
        return toBigInteger().longValue();
    }

    /** Value interpreted as a two's complement signed integer. */
    public BigInteger toSignedBigInteger() {
        String bits = resolved();
        BigInteger unsigned = new BigInteger(bits, 2);
        return bits.charAt(0) == '1' ? unsigned.subtract(BigInteger.ONE.shiftLeft(width())) : unsigned;
    }

    private String resolved() {
        char[] bits = new char[binStr.length()];
        for (int i = 0; i < bits.length; i++) {
            bits[i] = resolve(binStr.charAt(i));
            if (bits[i] == 0)
                throw new IllegalStateException("Unresolvable bit pattern: " + binStr);
        }
        return new String(bits);
    }

    // 0 marks a position with no integer meaning
    private static char resolve(char c) {
        return switch (c) {
            case '0', 'L', '-' -> '0';
            case '1', 'H' -> '1';
            default -> 0;
        };
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BitVector other && binStr.equals(other.binStr);
    }

    @Override
    public int hashCode() {
        return binStr.hashCode();
    }

    @Override
    public String toString() {
        return binStr;
    }
}
