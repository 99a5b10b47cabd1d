package com.g11macro.manager.exception;

public class RonParseException extends Exception {

    private final int position;

    public RonParseException(String message, int position) {
        super(message);
        this.position = position;
    }

    public RonParseException(String message, int position, Throwable cause) {
        super(message, cause);
        this.position = position;
    }

    /**
     * Offset into the source text of the token that failed, or -1 when input ran out.
     */
    public int getPosition() {
        return position;
    }
}
