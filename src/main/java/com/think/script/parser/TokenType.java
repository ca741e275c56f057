package com.think.script.parser;

public enum TokenType {
    // Delimiters
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET, LEFT_BRACE, RIGHT_BRACE,
    COMMA, COLON,

    // Operators
    PLUS, MINUS, STAR, SLASH,
    EQUAL, EQUAL_EQUAL, BANG_EQUAL,
    GREATER, GREATER_EQUAL, LESS, LESS_EQUAL,

    // Literals
    IDENTIFIER, STRING, INT, FLOAT,

    // Keywords
    OBJECTIVE, TASK, STEP, SUBTASK, RUN,
    DECIDE, IF, ELIF, ELSE, THEN,
    FOR, WHILE, IN, RANGE, ENUMERATE, RETURN, END,
    TRUE, FALSE, NONE, AND, OR, NOT,

    // Layout
    NEWLINE, INDENT, DEDENT,

    EOF
}
