package com.think.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);

        Token token();
    }

    public interface StmtVisitor {
        void visitAssignmentStmt(Assignment stmt);
        void visitDecideStmt(Decide stmt);
        void visitForStmt(ForLoop stmt);
        void visitWhileStmt(WhileLoop stmt);
        void visitReturnStmt(Return stmt);
        void visitExprStmt(ExprStmt stmt);
        void visitPrintStmt(Print stmt);
    }

    public static final class Assignment implements Stmt {
        public final Token name;
        public final Expr.ExprInterface value;

        public Assignment(Token name, Expr.ExprInterface value) {
            this.name = name;
            this.value = value;
        }

        public Token token() { return name; }
        public void accept(StmtVisitor visitor) { visitor.visitAssignmentStmt(this); }
    }

    /** One {@code if} / {@code elif} arm of a decide block. */
    public static final class Branch {
        public final Token keyword;
        public final Expr.ExprInterface condition;
        public final List<Stmt> body;

        public Branch(Token keyword, Expr.ExprInterface condition, List<Stmt> body) {
            this.keyword = keyword;
            this.condition = condition;
            this.body = List.copyOf(body);
        }

        public boolean isElif() {
            return keyword.type != TokenType.IF;
        }
    }

    /** if / elif / else. First true branch wins; no fallthrough. */
    public static final class Decide implements Stmt {
        public final Token keyword;
        public final List<Branch> branches;
        public final List<Stmt> elseBody; // may be null
        public final Token end;           // explicit 'end', may be null

        public Decide(Token keyword, List<Branch> branches, List<Stmt> elseBody, Token end) {
            this.keyword = keyword;
            this.branches = List.copyOf(branches);
            this.elseBody = elseBody == null ? null : List.copyOf(elseBody);
            this.end = end;
        }

        public Token token() { return keyword; }
        public void accept(StmtVisitor visitor) { visitor.visitDecideStmt(this); }
    }

    public static final class ForLoop implements Stmt {
        public enum Kind { SEQUENCE, RANGE, ENUMERATE }

        public final Token keyword;
        public final Kind kind;
        public final Token indexVariable; // ENUMERATE only
        public final Token variable;
        public final Expr.ExprInterface iterable;   // SEQUENCE and ENUMERATE
        public final Expr.ExprInterface rangeStart; // RANGE, may be null (starts at 0)
        public final Expr.ExprInterface rangeEnd;   // RANGE
        public final List<Stmt> body;
        public final Token end;

        private ForLoop(Token keyword, Kind kind, Token indexVariable, Token variable,
                        Expr.ExprInterface iterable, Expr.ExprInterface rangeStart, Expr.ExprInterface rangeEnd,
                        List<Stmt> body, Token end) {
            this.keyword = keyword;
            this.kind = kind;
            this.indexVariable = indexVariable;
            this.variable = variable;
            this.iterable = iterable;
            this.rangeStart = rangeStart;
            this.rangeEnd = rangeEnd;
            this.body = List.copyOf(body);
            this.end = end;
        }

        public static ForLoop overSequence(Token keyword, Token variable, Expr.ExprInterface iterable,
                                           List<Stmt> body, Token end) {
            return new ForLoop(keyword, Kind.SEQUENCE, null, variable, iterable, null, null, body, end);
        }

        public static ForLoop overRange(Token keyword, Token variable, Expr.ExprInterface start,
                                        Expr.ExprInterface stop, List<Stmt> body, Token end) {
            return new ForLoop(keyword, Kind.RANGE, null, variable, null, start, stop, body, end);
        }

        public static ForLoop overEnumerate(Token keyword, Token indexVariable, Token variable,
                                            Expr.ExprInterface iterable, List<Stmt> body, Token end) {
            return new ForLoop(keyword, Kind.ENUMERATE, indexVariable, variable, iterable, null, null, body, end);
        }

        public Token token() { return keyword; }
        public void accept(StmtVisitor visitor) { visitor.visitForStmt(this); }
    }

    public static final class WhileLoop implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface condition;
        public final List<Stmt> body;
        public final Token end;

        public WhileLoop(Token keyword, Expr.ExprInterface condition, List<Stmt> body, Token end) {
            this.keyword = keyword;
            this.condition = condition;
            this.body = List.copyOf(body);
            this.end = end;
        }

        public Token token() { return keyword; }
        public void accept(StmtVisitor visitor) { visitor.visitWhileStmt(this); }
    }

    public static final class Return implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface value; // may be null

        public Return(Token keyword, Expr.ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }

        public Token token() { return keyword; }
        public void accept(StmtVisitor visitor) { visitor.visitReturnStmt(this); }
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;

        public ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }

        public Token token() { return expression.token(); }
        public void accept(StmtVisitor visitor) { visitor.visitExprStmt(this); }
    }

    public static final class Print implements Stmt {
        public final Token keyword;
        public final List<Expr.ExprInterface> arguments;

        public Print(Token keyword, List<Expr.ExprInterface> arguments) {
            this.keyword = keyword;
            this.arguments = List.copyOf(arguments);
        }

        public Token token() { return keyword; }
        public void accept(StmtVisitor visitor) { visitor.visitPrintStmt(this); }
    }
}
