package me.christianrobert.bsontranspiler.transformer.evaluator;

import java.util.Objects;

/**
 * Binary data with its numeric subtype.
 */
public final class BinaryValue {

    public static final int DEFAULT_SUBTYPE = 0;

    private final String data;
    private final int subtype;

    public BinaryValue(String data, int subtype) {
        this.data = Objects.requireNonNull(data, "data");
        this.subtype = subtype;
    }

    public String getData() {
        return data;
    }

    public int getSubtype() {
        return subtype;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BinaryValue)) {
            return false;
        }
        BinaryValue that = (BinaryValue) o;
        return subtype == that.subtype && data.equals(that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(data, subtype);
    }

    @Override
    public String toString() {
        return data;
    }
}
