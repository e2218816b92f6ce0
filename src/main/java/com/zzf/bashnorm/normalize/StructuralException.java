package com.zzf.bashnorm.normalize;

/**
 * An attachment or arity rule of the normalized grammar was violated.
 */
public class StructuralException extends NormalizationException {

    public enum Reason {
        AMBIGUOUS_ATTACHMENT,
        MALFORMED_PIPELINE,
        COMPOUND_COMMAND,
        MISSING_OPERAND,
        ARITY_VIOLATION,
        ILLEGAL_CHILD,
        DEPTH_EXCEEDED
    }

    private final Reason reason;

    public StructuralException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public String category() {
        return "structural:" + reason.name().toLowerCase();
    }
}
