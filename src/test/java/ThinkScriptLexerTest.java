import org.junit.jupiter.api.Test;

import com.think.script.parser.Lexer;
import com.think.script.parser.LexerException;
import com.think.script.parser.Token;
import com.think.script.parser.TokenType;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ThinkScriptLexerTest {

    private static List<TokenType> types(String source) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : new Lexer(source).tokenize()) out.add(t.type);
        return out;
    }

    @Test
    void indentedBlock_producesIndentAndDedent() {
        List<TokenType> types = types(
                "task \"A\":\n" +
                "    x = 1\n"
        );

        assertEquals(List.of(
                TokenType.TASK, TokenType.STRING, TokenType.COLON, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.INT, TokenType.NEWLINE,
                TokenType.DEDENT, TokenType.EOF
        ), types);
    }

    @Test
    void blankAndCommentLines_produceNothing() {
        List<TokenType> types = types(
                "x = 1\n" +
                "\n" +
                "    # indented comment does not open a block\n" +
                "y = 2  # trailing comment\n"
        );

        assertEquals(List.of(
                TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.INT, TokenType.NEWLINE,
                TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.INT, TokenType.NEWLINE,
                TokenType.EOF
        ), types);
    }

    @Test
    void newlinesInsideBrackets_areIgnored() {
        List<TokenType> types = types(
                "xs = [1,\n" +
                "      2,\n" +
                "  3]\n"
        );

        assertFalse(types.contains(TokenType.INDENT));
        assertEquals(1, types.stream().filter(t -> t == TokenType.NEWLINE).count());
    }

    @Test
    void uniformlyIndentedSource_setsBaseIndentation() {
        List<TokenType> types = types(
                "        x = 1\n" +
                "        y = 2\n"
        );

        assertFalse(types.contains(TokenType.INDENT));
        assertFalse(types.contains(TokenType.DEDENT));
    }

    @Test
    void numbers_intFloatAndExponent() {
        List<Token> tokens = new Lexer("a = 42 + 1.5e3 + 1e-10 + 2.0e5 + 0.25").tokenize();

        assertEquals(TokenType.INT, tokens.get(2).type);
        assertEquals(TokenType.FLOAT, tokens.get(4).type);
        assertEquals("1.5e3", tokens.get(4).lexeme);
        assertEquals(TokenType.FLOAT, tokens.get(6).type);
        assertEquals(TokenType.FLOAT, tokens.get(8).type);
        assertEquals(TokenType.FLOAT, tokens.get(10).type);
    }

    @Test
    void strings_bothQuotesAndEscapes() {
        List<Token> tokens = new Lexer("a = 'it\\'s' + \"say \\\"hi\\\"\\n\"").tokenize();

        assertEquals(TokenType.STRING, tokens.get(2).type);
        assertEquals(TokenType.STRING, tokens.get(4).type);
        assertEquals("'it\\'s'", tokens.get(2).lexeme);
        assertTrue(tokens.get(4).describe().contains("say \"hi\""));
    }

    @Test
    void keywords_areRecognized() {
        List<TokenType> types = types("objective task step subtask run decide if elif else then for while in range enumerate return end True False None and or not");

        assertEquals(List.of(
                TokenType.OBJECTIVE, TokenType.TASK, TokenType.STEP, TokenType.SUBTASK, TokenType.RUN,
                TokenType.DECIDE, TokenType.IF, TokenType.ELIF, TokenType.ELSE, TokenType.THEN,
                TokenType.FOR, TokenType.WHILE, TokenType.IN, TokenType.RANGE, TokenType.ENUMERATE,
                TokenType.RETURN, TokenType.END, TokenType.TRUE, TokenType.FALSE, TokenType.NONE,
                TokenType.AND, TokenType.OR, TokenType.NOT, TokenType.NEWLINE, TokenType.EOF
        ), types);
    }

    @Test
    void tokensCarryOneBasedPositions() {
        List<Token> tokens = new Lexer("x = 1\n  \ny = 2").tokenize();
        Token y = tokens.get(4);

        assertEquals("y", y.lexeme);
        assertEquals(3, y.line);
        assertEquals(1, y.column);
    }

    @Test
    void unexpectedCharacter_isLexerErrorWithPosition() {
        LexerException ex = assertThrows(LexerException.class, () -> new Lexer("x = 1\ny = 2 $ 3").tokenize());

        assertEquals(2, ex.getLine());
        assertEquals(7, ex.getColumn());
        assertTrue(ex.getMessage().contains("'$'"), ex.getMessage());
    }

    @Test
    void unterminatedString_isLexerError() {
        LexerException ex = assertThrows(LexerException.class, () -> new Lexer("x = \"open\ny = 1").tokenize());
        assertTrue(ex.getMessage().contains("Unterminated string"), ex.getMessage());
    }

    @Test
    void dedentToUnknownWidth_isLexerError() {
        LexerException ex = assertThrows(LexerException.class, () -> new Lexer(
                "task \"A\":\n" +
                "        x = 1\n" +
                "    y = 2\n"
        ).tokenize());

        assertEquals(3, ex.getLine());
        assertTrue(ex.getMessage().contains("Inconsistent dedent"), ex.getMessage());
    }
}
