package com.think.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.think.debug.Debug;
import com.think.script.parser.Expr.Binary;
import com.think.script.parser.Expr.Call;
import com.think.script.parser.Expr.DictLiteral;
import com.think.script.parser.Expr.ExprInterface;
import com.think.script.parser.Expr.Index;
import com.think.script.parser.Expr.ListLiteral;
import com.think.script.parser.Expr.Literal;
import com.think.script.parser.Expr.Logical;
import com.think.script.parser.Expr.Unary;
import com.think.script.parser.Expr.Variable;
import com.think.script.parser.Program.Member;
import com.think.script.parser.Program.Objective;
import com.think.script.parser.Program.Run;
import com.think.script.parser.Program.Step;
import com.think.script.parser.Program.Subtask;
import com.think.script.parser.Program.Task;
import com.think.script.parser.Statement.Assignment;
import com.think.script.parser.Statement.Branch;
import com.think.script.parser.Statement.Decide;
import com.think.script.parser.Statement.ExprStmt;
import com.think.script.parser.Statement.ForLoop;
import com.think.script.parser.Statement.Print;
import com.think.script.parser.Statement.Return;
import com.think.script.parser.Statement.Stmt;
import com.think.script.parser.Statement.WhileLoop;

/**
 * Recursive-descent parser with one token of lookahead. The first grammar
 * violation aborts the parse with a {@link ParserException}.
 */
public class Parser {
    private static final String TAG = "think.parser";

    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    public Program parse() {
        skipNewlines();
        if (!check(TokenType.OBJECTIVE)) {
            throw new ParserException(peek(), "'objective'",
                    "Expected 'objective' as the first declaration but found " + peek().describe());
        }

        List<Objective> objectives = new ArrayList<>();
        List<Task> tasks = new ArrayList<>();
        List<Run> runs = new ArrayList<>();

        while (!isAtEnd()) {
            if (match(TokenType.OBJECTIVE)) objectives.add(objective());
            else if (match(TokenType.TASK)) tasks.add(task());
            else if (match(TokenType.RUN)) runs.add(run());
            else if (match(TokenType.NEWLINE)) continue;
            else throw new ParserException(peek(), "'task' or 'run' declaration");
        }

        Debug.get().d(TAG, "parsed " + tasks.size() + " task(s) and " + runs.size() + " run statement(s)");
        return new Program(objectives, tasks, runs);
    }

    // -------------------------
    // Declarations
    // -------------------------

    private Objective objective() {
        Token keyword = previous();
        Token text = consume(TokenType.STRING, "objective text in quotes");
        endOfLine("objective");
        return new Objective(keyword, (String) text.literal);
    }

    private Run run() {
        Token keyword = previous();
        Token target = consume(TokenType.STRING, "task name in quotes after 'run'");
        endOfLine("run statement");
        return new Run(keyword, (String) target.literal);
    }

    private Task task() {
        Token keyword = previous();
        Token name = consume(TokenType.STRING, "task name in quotes");
        consume(TokenType.COLON, "':' after task name");
        consume(TokenType.NEWLINE, "end of line after ':'");
        consume(TokenType.INDENT, "indented task body");

        List<Member> members = new ArrayList<>();
        while (!check(TokenType.DEDENT) && !isAtEnd()) {
            if (match(TokenType.STEP)) {
                Token kw = previous();
                String stepName = memberName("step");
                members.add(new Step(kw, stepName, block()));
            } else if (match(TokenType.SUBTASK)) {
                Token kw = previous();
                String subtaskName = memberName("subtask");
                members.add(new Subtask(kw, subtaskName, block()));
            } else {
                throw new ParserException(peek(), "'step' or 'subtask'");
            }
        }
        consume(TokenType.DEDENT, "end of task body");
        return new Task(keyword, (String) name.literal, members);
    }

    private String memberName(String kind) {
        Token name = consume(TokenType.STRING, kind + " name in quotes");
        consume(TokenType.COLON, "':' after " + kind + " name");
        return (String) name.literal;
    }

    /** NEWLINE INDENT statement+ DEDENT, entered right after a ':'. */
    private List<Stmt> block() {
        consume(TokenType.NEWLINE, "end of line after ':'");
        consume(TokenType.INDENT, "indented block");
        List<Stmt> statements = new ArrayList<>();
        while (!check(TokenType.DEDENT) && !isAtEnd()) {
            statements.add(statement());
        }
        consume(TokenType.DEDENT, "end of block");
        return statements;
    }

    // -------------------------
    // Statements
    // -------------------------

    private Stmt statement() {
        if (match(TokenType.DECIDE)) return decideStatement();
        if (match(TokenType.FOR)) return forStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.RETURN)) return returnStatement();
        if (check(TokenType.IDENTIFIER) && "print".equals(peek().lexeme) && checkNext(TokenType.LEFT_PAREN)) {
            return printStatement();
        }
        return expressionStatement();
    }

    private Stmt decideStatement() {
        Token keyword = previous();
        consume(TokenType.COLON, "':' after 'decide'");
        consume(TokenType.NEWLINE, "end of line after ':'");
        consume(TokenType.INDENT, "indented decide block");

        List<Branch> branches = new ArrayList<>();
        List<Stmt> elseBody = null;

        Token first = consume(TokenType.IF, "'if' as the first branch of decide");
        branches.add(branch(first));
        while (true) {
            if (match(TokenType.ELIF)) {
                branches.add(branch(previous()));
                continue;
            }
            if (match(TokenType.ELSE)) {
                Token elseToken = previous();
                if (match(TokenType.IF)) {
                    branches.add(branch(elseToken));
                    continue;
                }
                consume(TokenType.COLON, "':' after 'else'");
                elseBody = block();
            }
            break;
        }
        consume(TokenType.DEDENT, "end of decide block");

        Token end = null;
        if (match(TokenType.END)) {
            end = previous();
            endOfLine("'end'");
        }
        return new Decide(keyword, branches, elseBody, end);
    }

    private Branch branch(Token keyword) {
        ExprInterface condition = expression();
        match(TokenType.THEN);
        consume(TokenType.COLON, "':' after condition");
        return new Branch(keyword, condition, block());
    }

    private Stmt forStatement() {
        Token keyword = previous();
        Token first = consume(TokenType.IDENTIFIER, "loop variable name after 'for'");
        Token second = null;
        if (match(TokenType.COMMA)) {
            second = consume(TokenType.IDENTIFIER, "value variable name after ','");
        }
        consume(TokenType.IN, "'in' after loop variable");

        if (match(TokenType.RANGE)) {
            Token rangeToken = previous();
            if (second != null) {
                throw new ParserException(rangeToken, "a single loop variable",
                        "range() loops take a single loop variable");
            }
            consume(TokenType.LEFT_PAREN, "'(' after 'range'");
            ExprInterface a = expression();
            ExprInterface b = null;
            if (match(TokenType.COMMA)) b = expression();
            consume(TokenType.RIGHT_PAREN, "')' after range arguments");
            consume(TokenType.COLON, "':' after for clause");
            List<Stmt> body = block();
            Token end = loopEnd("for", keyword);
            return (b == null)
                    ? ForLoop.overRange(keyword, first, null, a, body, end)
                    : ForLoop.overRange(keyword, first, a, b, body, end);
        }

        if (match(TokenType.ENUMERATE)) {
            Token enumerateToken = previous();
            if (second == null) {
                throw new ParserException(enumerateToken, "two loop variables",
                        "enumerate() loops need an index and a value variable, as in: for i, item in enumerate(items)");
            }
            consume(TokenType.LEFT_PAREN, "'(' after 'enumerate'");
            ExprInterface iterable = expression();
            consume(TokenType.RIGHT_PAREN, "')' after enumerate argument");
            consume(TokenType.COLON, "':' after for clause");
            List<Stmt> body = block();
            Token end = loopEnd("for", keyword);
            return ForLoop.overEnumerate(keyword, first, second, iterable, body, end);
        }

        if (second != null) {
            throw new ParserException(peek(), "enumerate(...)",
                    "Two loop variables are only allowed with enumerate(...)");
        }
        ExprInterface iterable = expression();
        consume(TokenType.COLON, "':' after for clause");
        List<Stmt> body = block();
        Token end = loopEnd("for", keyword);
        return ForLoop.overSequence(keyword, first, iterable, body, end);
    }

    private Stmt whileStatement() {
        Token keyword = previous();
        ExprInterface condition = expression();
        consume(TokenType.COLON, "':' after while condition");
        List<Stmt> body = block();
        Token end = loopEnd("while", keyword);
        return new WhileLoop(keyword, condition, body, end);
    }

    private Token loopEnd(String kind, Token opener) {
        if (!check(TokenType.END)) {
            throw new ParserException(peek(), "'end'",
                    "Expected 'end' closing the " + kind + " loop opened at line " + opener.line
                            + " but found " + peek().describe());
        }
        Token end = advance();
        endOfLine("'end'");
        return end;
    }

    private Stmt returnStatement() {
        Token keyword = previous();
        ExprInterface value = null;
        if (!check(TokenType.NEWLINE)) {
            value = expression();
        }
        endOfLine("return statement");
        return new Return(keyword, value);
    }

    private Stmt printStatement() {
        Token keyword = advance();
        consume(TokenType.LEFT_PAREN, "'(' after 'print'");
        List<ExprInterface> args = arguments();
        endOfLine("print statement");
        return new Print(keyword, args);
    }

    private Stmt expressionStatement() {
        ExprInterface expr = expression();
        if (match(TokenType.EQUAL)) {
            Token equals = previous();
            if (!(expr instanceof Variable)) {
                throw new ParserException(equals, "a variable name before '='",
                        "Invalid assignment target: only variable names can be assigned");
            }
            ExprInterface value = expression();
            endOfLine("assignment");
            return new Assignment(((Variable) expr).name, value);
        }
        endOfLine("expression");
        return new ExprStmt(expr);
    }

    // -------------------------
    // Expressions
    // -------------------------

    private ExprInterface expression() { return or(); }

    private ExprInterface or() {
        ExprInterface expr = and();
        while (match(TokenType.OR)) {
            Token op = previous();
            ExprInterface right = and();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private ExprInterface and() {
        ExprInterface expr = comparison();
        while (match(TokenType.AND)) {
            Token op = previous();
            ExprInterface right = comparison();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    /** Comparisons do not chain: {@code a < b < c} is rejected rather than folded left. */
    private ExprInterface comparison() {
        ExprInterface expr = additive();
        if (matchComparison()) {
            Token op = previous();
            ExprInterface right = additive();
            expr = new Binary(expr, op, right);
            if (matchComparison()) {
                Token second = previous();
                throw new ParserException(second, "end of comparison",
                        "Chained comparison '" + op.lexeme + " ... " + second.lexeme
                                + "' is not supported; join the comparisons with 'and'");
            }
        }
        return expr;
    }

    private boolean matchComparison() {
        return match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL,
                TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL);
    }

    private ExprInterface additive() {
        ExprInterface expr = multiplicative();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            ExprInterface right = multiplicative();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface multiplicative() {
        ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH)) {
            Token op = previous();
            ExprInterface right = unary();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface unary() {
        if (match(TokenType.NOT, TokenType.MINUS)) {
            Token op = previous();
            ExprInterface right = unary();
            return new Unary(op, right);
        }
        return postfix();
    }

    private ExprInterface postfix() {
        ExprInterface expr = primary();
        while (match(TokenType.LEFT_BRACKET)) {
            Token bracket = previous();
            ExprInterface index = expression();
            consume(TokenType.RIGHT_BRACKET, "']' after index");
            expr = new Index(expr, index, bracket);
        }
        return expr;
    }

    private ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(previous(), Boolean.FALSE);
        if (match(TokenType.TRUE)) return new Literal(previous(), Boolean.TRUE);
        if (match(TokenType.NONE)) return new Literal(previous(), null);
        if (match(TokenType.INT, TokenType.FLOAT, TokenType.STRING)) {
            return new Literal(previous(), previous().literal);
        }

        if (match(TokenType.IDENTIFIER)) {
            Token name = previous();
            if (match(TokenType.LEFT_PAREN)) return new Call(name, arguments());
            return new Variable(name);
        }

        // range(...) and enumerate(...) are keywords but evaluate like any other call
        if (match(TokenType.RANGE, TokenType.ENUMERATE)) {
            Token name = previous();
            consume(TokenType.LEFT_PAREN, "'(' after '" + name.lexeme + "'");
            return new Call(name, arguments());
        }

        if (match(TokenType.LEFT_PAREN)) {
            ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "')' after expression");
            return expr;
        }

        if (match(TokenType.LEFT_BRACKET)) {
            Token bracket = previous();
            List<ExprInterface> items = new ArrayList<>();
            while (!check(TokenType.RIGHT_BRACKET)) {
                items.add(expression());
                if (!match(TokenType.COMMA)) break;
            }
            consume(TokenType.RIGHT_BRACKET, "']' after list items");
            return new ListLiteral(bracket, items);
        }

        if (match(TokenType.LEFT_BRACE)) {
            Token brace = previous();
            List<ExprInterface> keys = new ArrayList<>();
            List<ExprInterface> values = new ArrayList<>();
            while (!check(TokenType.RIGHT_BRACE)) {
                keys.add(expression());
                consume(TokenType.COLON, "':' after dict key");
                values.add(expression());
                if (!match(TokenType.COMMA)) break;
            }
            consume(TokenType.RIGHT_BRACE, "'}' after dict entries");
            return new DictLiteral(brace, keys, values);
        }

        throw new ParserException(peek(), "expression");
    }

    /** Arguments after an already consumed '(' up to and including ')'. */
    private List<ExprInterface> arguments() {
        List<ExprInterface> arguments = new ArrayList<>();
        while (!check(TokenType.RIGHT_PAREN)) {
            arguments.add(expression());
            if (!match(TokenType.COMMA)) break;
        }
        consume(TokenType.RIGHT_PAREN, "')' after arguments");
        return arguments;
    }

    // -------------------------
    // Token helpers
    // -------------------------

    private void endOfLine(String after) {
        if (check(TokenType.NEWLINE)) {
            advance();
            return;
        }
        throw new ParserException(peek(), "end of line after " + after);
    }

    private void skipNewlines() {
        while (match(TokenType.NEWLINE)) {
            // blank leading lines
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String expected) {
        if (check(type)) return advance();
        throw new ParserException(peek(), expected);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return type == TokenType.EOF;
        return peek().type == type;
    }

    private boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }
}
