package com.think.script.parser;

/**
 * Base of every error the language core reports. Carries the 1-based source
 * position of the offending construct, or -1 when no position is known.
 */
public abstract class ThinkException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;

    protected ThinkException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean hasPosition() {
        return line > 0;
    }

    /** The message without the position prefix. */
    public String getDetail() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        if (!hasPosition()) return super.getMessage();
        return "[line " + line + ", column " + column + "] " + super.getMessage();
    }
}
