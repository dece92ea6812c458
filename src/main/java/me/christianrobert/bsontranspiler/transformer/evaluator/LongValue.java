package me.christianrobert.bsontranspiler.transformer.evaluator;

/**
 * A 64-bit integer assembled from two 32-bit halves.
 */
public final class LongValue {

    private final long value;

    public LongValue(long value) {
        this.value = value;
    }

    /**
     * Combines the low and high 32-bit halves. Both halves are truncated to signed 32-bit first.
     */
    public static LongValue fromBits(int low, int high) {
        return new LongValue(((long) high << 32) | (low & 0xffffffffL));
    }

    public long getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LongValue && ((LongValue) o).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
