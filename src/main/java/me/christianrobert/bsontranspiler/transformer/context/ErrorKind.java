package me.christianrobert.bsontranspiler.transformer.context;

/**
 * Kind of a failed {@link Translation}.
 */
public enum ErrorKind {

    /** Wrong number of constructor arguments. */
    ARITY,

    /** An argument's inferred type does not match what the constructor requires. */
    TYPE,

    /** The argument is accepted syntactically but fails a secondary check (non-numeric text, unsupported flag). */
    VALUE,

    /** The constant evaluator could not fold the expression. The message is the evaluator's, unmodified. */
    EVALUATION
}
