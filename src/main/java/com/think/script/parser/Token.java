package com.think.script.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    final Object literal;
    public final int line;
    public final int column;

    public Token(TokenType type, String lexeme, Object literal, int line, int column) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
    }

    /** Human readable form used in "found ..." parser diagnostics. */
    public String describe() {
        switch (type) {
            case NEWLINE: return "end of line";
            case INDENT:  return "indent";
            case DEDENT:  return "dedent";
            case EOF:     return "end of input";
            case STRING:  return "string \"" + literal + "\"";
            default:      return "'" + lexeme + "'";
        }
    }

    @Override
    public String toString() {
        return type + " " + lexeme + " @" + line + ":" + column;
    }
}
