package me.christianrobert.bsontranspiler.transformer.evaluator;

/**
 * The {@code undefined} value. Distinct from {@code null}.
 */
public final class Undefined {

    public static final Undefined INSTANCE = new Undefined();

    private Undefined() {
    }

    @Override
    public String toString() {
        return "undefined";
    }
}
