package com.think.script.parser;

/**
 * Error raised while a program executes. Aborts the whole execute call; it is
 * never retried and never continues with later run statements.
 */
public class ThinkRuntimeException extends ThinkException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        UNDEFINED_VARIABLE,
        UNDEFINED_CALLABLE,
        TYPE_MISMATCH,
        DIVISION_BY_ZERO,
        /** Int result outside the 64-bit range. */
        INTEGER_OVERFLOW,
        INDEX_ERROR,
        /** Missing dict key; reported as an index error by {@link #isIndexError()}. */
        DICT_KEY_ERROR,
        INVALID_ARGUMENT,
        CALL_DEPTH_EXCEEDED,
        ITERATION_LIMIT
    }

    private final Kind kind;

    public ThinkRuntimeException(Kind kind, String message) {
        this(kind, message, -1, -1);
    }

    public ThinkRuntimeException(Kind kind, String message, Token token) {
        this(kind, message, token == null ? -1 : token.line, token == null ? -1 : token.column);
    }

    public ThinkRuntimeException(Kind kind, String message, int line, int column) {
        super(message, line, column);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isIndexError() {
        return kind == Kind.INDEX_ERROR || kind == Kind.DICT_KEY_ERROR;
    }

    /** Returns this error if it is already positioned, otherwise a copy anchored at {@code token}. */
    ThinkRuntimeException at(Token token) {
        if (hasPosition() || token == null) return this;
        return new ThinkRuntimeException(kind, getDetail(), token);
    }
}
