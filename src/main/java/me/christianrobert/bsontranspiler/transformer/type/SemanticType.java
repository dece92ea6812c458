package me.christianrobert.bsontranspiler.transformer.type;

/**
 * Semantic type inferred for a translated expression.
 *
 * <p>Constructor rules validate their arguments against these values, e.g.
 * {@code Timestamp(low, high)} requires both arguments to be {@link #INTEGER}.</p>
 *
 * <p>Types are carried in the {@code Translation} returned for each node, never
 * stored on the parse tree itself.</p>
 */
public enum SemanticType {

    // Primitive kinds
    STRING,
    INTEGER,
    DECIMAL,
    OCTAL,
    BOOLEAN,
    NULL,
    UNDEFINED,

    // Structural kinds
    OBJECT,
    ARRAY,
    REGEX,

    // Document-literal kinds
    OBJECT_ID,
    BINARY,
    CODE,
    TIMESTAMP,
    LONG,
    SYMBOL,
    MIN_KEY,
    MAX_KEY,
    DBREF,
    DATE,
    BSON_REGEX,

    /**
     * Nodes handled by the default children translator (identifiers, arithmetic, member access).
     */
    UNKNOWN;

    /**
     * Checks whether this type is one of the given types.
     */
    public boolean isOneOf(SemanticType... candidates) {
        for (SemanticType candidate : candidates) {
            if (this == candidate) {
                return true;
            }
        }
        return false;
    }

    /**
     * Numeric kinds accepted by the {@code Double} and {@code Number} constructors (together with strings).
     */
    public boolean isNumeric() {
        return this == INTEGER || this == DECIMAL;
    }
}
