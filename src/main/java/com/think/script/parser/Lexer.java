package com.think.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.think.debug.Debug;

/**
 * Turns source text into tokens, including the NEWLINE / INDENT / DEDENT layout
 * tokens that delimit blocks. The first logical line fixes the base indentation.
 */
public class Lexer {
    private static final String TAG = "think.lexer";
    private static final int TAB_WIDTH = 4;

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int nesting = 0;
    private boolean atLineStart = true;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("objective", TokenType.OBJECTIVE);
        map.put("task", TokenType.TASK);
        map.put("step", TokenType.STEP);
        map.put("subtask", TokenType.SUBTASK);
        map.put("run", TokenType.RUN);
        map.put("decide", TokenType.DECIDE);
        map.put("if", TokenType.IF);
        map.put("elif", TokenType.ELIF);
        map.put("else", TokenType.ELSE);
        map.put("then", TokenType.THEN);
        map.put("for", TokenType.FOR);
        map.put("while", TokenType.WHILE);
        map.put("in", TokenType.IN);
        map.put("range", TokenType.RANGE);
        map.put("enumerate", TokenType.ENUMERATE);
        map.put("return", TokenType.RETURN);
        map.put("end", TokenType.END);
        map.put("True", TokenType.TRUE);
        map.put("False", TokenType.FALSE);
        map.put("None", TokenType.NONE);
        map.put("and", TokenType.AND);
        map.put("or", TokenType.OR);
        map.put("not", TokenType.NOT);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this.source = source == null ? "" : source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            if (atLineStart) {
                indentation();
                continue;
            }
            start = current;
            scanToken();
        }

        if (!tokens.isEmpty() && last().type != TokenType.NEWLINE) {
            tokens.add(new Token(TokenType.NEWLINE, "", null, line, current - lineStart + 1));
        }
        while (indents.size() > 1) {
            indents.pop();
            tokens.add(new Token(TokenType.DEDENT, "", null, line, 1));
        }
        tokens.add(new Token(TokenType.EOF, "", null, line, current - lineStart + 1));
        Debug.get().t(TAG, "tokenized " + tokens.size() + " tokens over " + line + " lines");
        return tokens;
    }

    /** Measures leading whitespace of a physical line and emits INDENT / DEDENT as needed. */
    private void indentation() {
        int width = 0;
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ') width++;
            else if (c == '\t') width += TAB_WIDTH - (width % TAB_WIDTH);
            else if (c != '\r') break;
            advance();
        }
        if (isAtEnd()) return;

        char c = peek();
        if (c == '#') {
            while (!isAtEnd() && peek() != '\n') advance();
            return;
        }
        if (c == '\n') {
            advance();
            newLine();
            return;
        }

        atLineStart = false;
        if (indents.isEmpty()) {
            indents.push(width);
            return;
        }

        int top = indents.peek();
        if (width > top) {
            indents.push(width);
            tokens.add(new Token(TokenType.INDENT, "", null, line, width + 1));
        } else if (width < top) {
            while (!indents.isEmpty() && width < indents.peek()) {
                indents.pop();
                tokens.add(new Token(TokenType.DEDENT, "", null, line, width + 1));
            }
            if (indents.isEmpty() || indents.peek() != width) {
                throw new LexerException("Inconsistent dedent: indentation does not match any enclosing block", line, width + 1);
            }
        }
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': open(TokenType.LEFT_PAREN); break;
            case ')': close(TokenType.RIGHT_PAREN); break;
            case '[': open(TokenType.LEFT_BRACKET); break;
            case ']': close(TokenType.RIGHT_BRACKET); break;
            case '{': open(TokenType.LEFT_BRACE); break;
            case '}': close(TokenType.RIGHT_BRACE); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '/': addToken(TokenType.SLASH); break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '!':
                if (match('=')) addToken(TokenType.BANG_EQUAL);
                else throw error("Unexpected character '!'");
                break;
            case '#':
                while (!isAtEnd() && peek() != '\n') advance();
                break;
            case ' ': case '\r': case '\t':
                break;
            case '\n':
                if (nesting == 0) {
                    tokens.add(new Token(TokenType.NEWLINE, "\n", null, line, start - lineStart + 1));
                    atLineStart = true;
                }
                newLine();
                break;
            case '"': case '\'':
                string(c);
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else throw error("Unexpected character '" + c + "'");
        }
    }

    private void open(TokenType type) {
        nesting++;
        addToken(type);
    }

    private void close(TokenType type) {
        if (nesting > 0) nesting--;
        addToken(type);
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        addToken(type);
    }

    private void number() {
        boolean isFloat = false;
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            advance();
            while (isDigit(peek())) advance();
        }
        if (peek() == 'e' || peek() == 'E') {
            int mark = current;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            if (isDigit(peek())) {
                isFloat = true;
                while (isDigit(peek())) advance();
            } else {
                current = mark;
            }
        }

        String text = source.substring(start, current);
        if (isFloat) {
            addToken(TokenType.FLOAT, Double.parseDouble(text));
            return;
        }
        try {
            addToken(TokenType.INT, Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw error("Integer literal out of range: " + text);
        }
    }

    private void string(char quote) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\n') throw error("Unterminated string");
            if (c == '\\' && !isAtEnd()) {
                char esc = advance();
                switch (esc) {
                    case 'n': sb.append('\n'); break;
                    case 't': sb.append('\t'); break;
                    case '\\': sb.append('\\'); break;
                    case '\'': sb.append('\''); break;
                    case '"': sb.append('"'); break;
                    default: sb.append('\\').append(esc);
                }
            } else {
                sb.append(c);
            }
        }
        if (isAtEnd()) throw error("Unterminated string");
        advance();
        addToken(TokenType.STRING, sb.toString());
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private Token last() { return tokens.get(tokens.size() - 1); }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, line, start - lineStart + 1));
    }

    private LexerException error(String msg) {
        return new LexerException(msg, line, start - lineStart + 1);
    }
}
