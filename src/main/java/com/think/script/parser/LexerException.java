package com.think.script.parser;

/** Unrecognized input in the source text. Lexing never recovers. */
public class LexerException extends ThinkException {

    private static final long serialVersionUID = 1L;

    public LexerException(String message, int line, int column) {
        super(message, line, column);
    }
}
