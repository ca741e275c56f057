package com.think.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.think.script.parser.Expr.Binary;
import com.think.script.parser.Expr.Call;
import com.think.script.parser.Expr.DictLiteral;
import com.think.script.parser.Expr.ExprInterface;
import com.think.script.parser.Expr.ExprVisitor;
import com.think.script.parser.Expr.Index;
import com.think.script.parser.Expr.ListLiteral;
import com.think.script.parser.Expr.Literal;
import com.think.script.parser.Expr.Logical;
import com.think.script.parser.Expr.Unary;
import com.think.script.parser.Expr.Variable;

/**
 * Renders an expression back to source form, e.g. {@code score >= 90 and passed}.
 * Used for condition and loop text in the trace. Parentheses are added only
 * where precedence needs them.
 */
public final class ExprPrinter implements ExprVisitor<String> {

    private static final ExprPrinter INSTANCE = new ExprPrinter();

    private ExprPrinter() {}

    public static String print(ExprInterface expr) {
        return expr == null ? "" : expr.accept(INSTANCE);
    }

    private static int precedence(ExprInterface expr) {
        if (expr instanceof Logical) {
            return ((Logical) expr).operator.type == TokenType.OR ? 1 : 2;
        }
        if (expr instanceof Binary) {
            switch (((Binary) expr).operator.type) {
                case PLUS:
                case MINUS: return 4;
                case STAR:
                case SLASH: return 5;
                default:    return 3;
            }
        }
        if (expr instanceof Unary) return 6;
        return 7;
    }

    private String operand(ExprInterface child, int parent, boolean right) {
        String text = child.accept(this);
        int p = precedence(child);
        if (p < parent || (right && p == parent)) return "(" + text + ")";
        return text;
    }

    private String infix(ExprInterface left, Token op, ExprInterface right, ExprInterface self) {
        int p = precedence(self);
        return operand(left, p, false) + " " + op.lexeme + " " + operand(right, p, true);
    }

    private String join(List<ExprInterface> items) {
        List<String> parts = new ArrayList<>(items.size());
        for (ExprInterface item : items) parts.add(item.accept(this));
        return String.join(", ", parts);
    }

    @Override
    public String visitLiteralExpr(Literal expr) {
        return Interpreter.literal(expr.value).repr();
    }

    @Override
    public String visitListLiteralExpr(ListLiteral expr) {
        return "[" + join(expr.items) + "]";
    }

    @Override
    public String visitDictLiteralExpr(DictLiteral expr) {
        List<String> parts = new ArrayList<>(expr.keys.size());
        for (int i = 0; i < expr.keys.size(); i++) {
            parts.add(expr.keys.get(i).accept(this) + ": " + expr.values.get(i).accept(this));
        }
        return "{" + String.join(", ", parts) + "}";
    }

    @Override
    public String visitVariableExpr(Variable expr) {
        return expr.name.lexeme;
    }

    @Override
    public String visitBinaryExpr(Binary expr) {
        return infix(expr.left, expr.operator, expr.right, expr);
    }

    @Override
    public String visitLogicalExpr(Logical expr) {
        return infix(expr.left, expr.operator, expr.right, expr);
    }

    @Override
    public String visitUnaryExpr(Unary expr) {
        String sep = expr.operator.type == TokenType.NOT ? " " : "";
        return expr.operator.lexeme + sep + operand(expr.right, 6, false);
    }

    @Override
    public String visitIndexExpr(Index expr) {
        return operand(expr.target, 7, false) + "[" + expr.index.accept(this) + "]";
    }

    @Override
    public String visitCallExpr(Call expr) {
        return expr.name() + "(" + join(expr.arguments) + ")";
    }
}
