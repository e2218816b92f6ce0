package com.zzf.bashnorm.syntax;

/**
 * Raised when the shell grammar engine rejects its input outright.
 */
public class ShellParseException extends RuntimeException {

    public enum Reason {
        MATCHED_PAIR,
        PARSING_ERROR,
        NOT_IMPLEMENTED,
        EMPTY_INPUT,
        NOT_A_COMMAND
    }

    private final Reason reason;
    private final int position;

    public ShellParseException(Reason reason, String message) {
        this(reason, message, -1);
    }

    public ShellParseException(Reason reason, String message, int position) {
        super(position >= 0 ? message + " (position " + position + ")" : message);
        this.reason = reason;
        this.position = position;
    }

    public Reason getReason() {
        return reason;
    }

    public int getPosition() {
        return position;
    }
}
