package io.github.eutro.yul2cairo.passes.convert;

import io.github.eutro.yul2cairo.ir.Yul;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A Yul literal split into the two 128-bit halves of a Cairo {@code Uint256}.
 * <p>
 * Integers are split arithmetically. Byte strings are left-aligned: the first 16 bytes
 * form the high half and the rest the low half, each padded with zero bytes on the right.
 * Booleans are the integers 1 and 0.
 */
public final class Uint256Literal {
    public static final int HALF_BYTES = 16;
    public static final BigInteger UINT128_BOUND = BigInteger.ONE.shiftLeft(HALF_BYTES * 8);
    public static final BigInteger UINT256_BOUND = BigInteger.ONE.shiftLeft(HALF_BYTES * 16);

    public final BigInteger low;
    public final BigInteger high;
    private final String lowRepr;
    private final String highRepr;

    private Uint256Literal(BigInteger low, BigInteger high, String lowRepr, String highRepr) {
        this.low = low;
        this.high = high;
        this.lowRepr = lowRepr;
        this.highRepr = highRepr;
    }

    public static Uint256Literal of(Yul.Literal literal) {
        if (literal.value instanceof String) {
            return ofString((String) literal.value);
        } else if (literal.value instanceof Boolean) {
            return ofInteger((Boolean) literal.value ? BigInteger.ONE : BigInteger.ZERO);
        } else {
            return ofInteger((BigInteger) literal.value);
        }
    }

    public static Uint256Literal ofInteger(BigInteger value) {
        if (value.signum() < 0 || value.compareTo(UINT256_BOUND) >= 0) {
            throw new IllegalArgumentException("Literal " + value + " does not fit in a Uint256");
        }
        BigInteger[] highLow = value.divideAndRemainder(UINT128_BOUND);
        return new Uint256Literal(
                highLow[1],
                highLow[0],
                highLow[1].toString(),
                highLow[0].toString()
        );
    }

    public static Uint256Literal ofString(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) > 0xFF) {
                throw new IllegalArgumentException("String literal \"" + value
                        + "\" has a character that is not a single byte at index " + i);
            }
        }
        byte[] bytes = value.getBytes(StandardCharsets.ISO_8859_1);
        if (bytes.length > 2 * HALF_BYTES) {
            throw new IllegalArgumentException("String literal \"" + value + "\" is longer than "
                    + 2 * HALF_BYTES + " bytes");
        }
        byte[] highBytes = Arrays.copyOfRange(bytes, 0, Math.min(bytes.length, HALF_BYTES));
        byte[] lowBytes = Arrays.copyOfRange(bytes, highBytes.length, bytes.length);
        return new Uint256Literal(
                halfValue(lowBytes),
                halfValue(highBytes),
                halfRepr(lowBytes),
                halfRepr(highBytes)
        );
    }

    private static BigInteger halfValue(byte[] bytes) {
        return new BigInteger(1, Arrays.copyOf(bytes, HALF_BYTES));
    }

    private static boolean isShortStringSafe(byte[] bytes) {
        for (byte b : bytes) {
            if (b < 0x20 || b > 0x7e || b == '\'' || b == '\\') return false;
        }
        return true;
    }

    private static String halfRepr(byte[] bytes) {
        if (bytes.length == 0) return "''";
        if (!isShortStringSafe(bytes)) {
            return "0x" + halfValue(bytes).toString(16);
        }
        return "'" + new String(bytes, StandardCharsets.ISO_8859_1) + "' * 256**" + (HALF_BYTES - bytes.length);
    }

    /**
     * Recombine the halves into one integer.
     *
     * @return The value of the literal as an integer.
     */
    public BigInteger toBigInteger() {
        return high.shiftLeft(HALF_BYTES * 8).or(low);
    }

    /**
     * Read the halves back as a left-aligned byte string, dropping the zero padding.
     *
     * @return The string this literal encodes.
     */
    public String toByteString() {
        byte[] bytes = new byte[2 * HALF_BYTES];
        byte[] all = toBigInteger().toByteArray();
        int copied = Math.min(all.length, bytes.length);
        System.arraycopy(all, all.length - copied, bytes, bytes.length - copied, copied);
        int end = bytes.length;
        while (end > 0 && bytes[end - 1] == 0) end--;
        return new String(bytes, 0, end, StandardCharsets.ISO_8859_1);
    }

    public String render() {
        return "Uint256(low=" + lowRepr + ", high=" + highRepr + ")";
    }

    @Override
    public String toString() {
        return render();
    }
}
