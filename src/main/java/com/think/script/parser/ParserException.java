package com.think.script.parser;

/**
 * Grammar violation. Parsing aborts on the first one; no partial program is
 * produced.
 */
public class ParserException extends ThinkException {

    private static final long serialVersionUID = 1L;

    private final String expected;
    private final String found;

    public ParserException(Token token, String expected) {
        super("Expected " + expected + " but found " + token.describe(), token.line, token.column);
        this.expected = expected;
        this.found = token.describe();
    }

    public ParserException(Token token, String expected, String message) {
        super(message, token.line, token.column);
        this.expected = expected;
        this.found = token.describe();
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }
}
