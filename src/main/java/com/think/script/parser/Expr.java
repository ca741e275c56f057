package com.think.script.parser;

import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);

        /** Token anchoring this expression's source position. */
        Token token();
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitListLiteralExpr(ListLiteral expr);
        R visitDictLiteralExpr(DictLiteral expr);
        R visitVariableExpr(Variable expr);
        R visitBinaryExpr(Binary expr);
        R visitLogicalExpr(Logical expr);
        R visitUnaryExpr(Unary expr);
        R visitIndexExpr(Index expr);
        R visitCallExpr(Call expr);
    }

    /** Int (Long), Float (Double), String, Bool (Boolean) or None (null). */
    public static final class Literal implements ExprInterface {
        public final Token token;
        public final Object value;

        public Literal(Token token, Object value) {
            this.token = token;
            this.value = value;
        }

        @Override
        public Token token() { return token; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class ListLiteral implements ExprInterface {
        public final Token bracket;
        public final List<ExprInterface> items;

        public ListLiteral(Token bracket, List<ExprInterface> items) {
            this.bracket = bracket;
            this.items = List.copyOf(items);
        }

        @Override
        public Token token() { return bracket; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitListLiteralExpr(this);
        }
    }

    /** Ordered key/value pairs; a repeated key overwrites the earlier value at runtime. */
    public static final class DictLiteral implements ExprInterface {
        public final Token brace;
        public final List<ExprInterface> keys;
        public final List<ExprInterface> values;

        public DictLiteral(Token brace, List<ExprInterface> keys, List<ExprInterface> values) {
            if (keys.size() != values.size()) {
                throw new IllegalArgumentException("dict literal needs one value per key");
            }
            this.brace = brace;
            this.keys = List.copyOf(keys);
            this.values = List.copyOf(values);
        }

        @Override
        public Token token() { return brace; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitDictLiteralExpr(this);
        }
    }

    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override
        public Token token() { return name; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public Token token() { return operator; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    /** Short-circuit {@code and} / {@code or}. */
    public static final class Logical implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Logical(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public Token token() { return operator; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }
    }

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public Token token() { return operator; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    public static final class Index implements ExprInterface {
        public final ExprInterface target;
        public final ExprInterface index;
        public final Token bracket;

        public Index(ExprInterface target, ExprInterface index, Token bracket) {
            this.target = target;
            this.index = index;
            this.bracket = bracket;
        }

        @Override
        public Token token() { return bracket; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }
    }

    /**
     * Call by name. Whether the name is a built-in or a subtask is decided when
     * the call executes.
     */
    public static final class Call implements ExprInterface {
        public final Token callee;
        public final List<ExprInterface> arguments;

        public Call(Token callee, List<ExprInterface> arguments) {
            this.callee = callee;
            this.arguments = List.copyOf(arguments);
        }

        public String name() { return callee.lexeme; }

        @Override
        public Token token() { return callee; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }
}
