package me.christianrobert.bsontranspiler.transformer.evaluator;

import java.util.Arrays;
import java.util.Locale;

/**
 * A 12-byte object id.
 */
public final class ObjectIdValue {

    public static final String INVALID_ARGUMENT =
            "Argument passed in must be a single String of 12 bytes or a string of 24 hex characters";

    /** Largest timestamp the four leading bytes can hold. */
    public static final long MAX_TIME = 0xFFFFFFFFL;

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final byte[] bytes;

    private ObjectIdValue(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Creates an id from a 24 character hex string or a 12 character string (one byte per char).
     *
     * @throws EvaluationException for any other input
     */
    public static ObjectIdValue fromString(String value) {
        if (value.length() == 24 && value.chars().allMatch(ObjectIdValue::isHexDigit)) {
            byte[] bytes = new byte[12];
            String lower = value.toLowerCase(Locale.ROOT);
            for (int i = 0; i < 12; i++) {
                bytes[i] = (byte) Integer.parseInt(lower.substring(i * 2, i * 2 + 2), 16);
            }
            return new ObjectIdValue(bytes);
        }
        if (value.length() == 12 && value.chars().allMatch(c -> c < 256)) {
            byte[] bytes = new byte[12];
            for (int i = 0; i < 12; i++) {
                bytes[i] = (byte) value.charAt(i);
            }
            return new ObjectIdValue(bytes);
        }
        throw new EvaluationException(INVALID_ARGUMENT);
    }

    /**
     * Creates an id whose first four bytes are the big-endian timestamp (seconds) and the rest zero.
     */
    public static ObjectIdValue fromTime(long epochSeconds) {
        if (epochSeconds < 0 || epochSeconds > MAX_TIME) {
            throw new EvaluationException("ObjectId time " + epochSeconds + " is outside the 32-bit timestamp range");
        }
        byte[] bytes = new byte[12];
        int time = (int) epochSeconds;
        bytes[0] = (byte) (time >>> 24);
        bytes[1] = (byte) (time >>> 16);
        bytes[2] = (byte) (time >>> 8);
        bytes[3] = (byte) time;
        return new ObjectIdValue(bytes);
    }

    public String toHexString() {
        StringBuilder sb = new StringBuilder(24);
        for (byte b : bytes) {
            sb.append(HEX[(b >> 4) & 0xf]).append(HEX[b & 0xf]);
        }
        return sb.toString();
    }

    private static boolean isHexDigit(int c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ObjectIdValue && Arrays.equals(bytes, ((ObjectIdValue) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHexString();
    }
}
