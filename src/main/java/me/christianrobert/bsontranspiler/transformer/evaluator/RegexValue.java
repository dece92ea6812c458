package me.christianrobert.bsontranspiler.transformer.evaluator;

import java.util.Objects;

/**
 * A native regular expression: its source text and its flags in canonical order.
 */
public final class RegexValue {

    private final String source;
    private final String flags;

    public RegexValue(String source, String flags) {
        this.source = Objects.requireNonNull(source, "source");
        this.flags = Objects.requireNonNull(flags, "flags");
    }

    public String getSource() {
        return source;
    }

    public String getFlags() {
        return flags;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof RegexValue)) {
            return false;
        }
        RegexValue that = (RegexValue) o;
        return source.equals(that.source) && flags.equals(that.flags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, flags);
    }

    @Override
    public String toString() {
        return "/" + source + "/" + flags;
    }
}
