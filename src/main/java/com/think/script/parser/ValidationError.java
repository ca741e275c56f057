package com.think.script.parser;

import java.util.Objects;

/** One structural diagnostic. Validation collects all of them before reporting. */
public final class ValidationError {
    private final int line;
    private final int column;
    private final String message;

    public ValidationError(int line, int column, String message) {
        this.line = line;
        this.column = column;
        this.message = message;
    }

    static ValidationError at(Token token, String message) {
        return token == null ? new ValidationError(-1, -1, message)
                : new ValidationError(token.line, token.column, message);
    }

    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getMessage() { return message; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationError)) return false;
        ValidationError other = (ValidationError) o;
        return line == other.line && column == other.column && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, column, message);
    }

    @Override
    public String toString() {
        if (line < 0) return message;
        return "line " + line + ", column " + column + ": " + message;
    }
}
