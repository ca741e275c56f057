package com.think.script.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.think.debug.Debug;
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
import com.think.script.parser.Program.Member;
import com.think.script.parser.Program.Objective;
import com.think.script.parser.Program.Run;
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
import com.think.script.parser.Statement.StmtVisitor;
import com.think.script.parser.Statement.WhileLoop;

/**
 * Structural checks run between parsing and execution. Every check runs and
 * every diagnostic is collected; the program is never modified.
 */
public class Validator implements StmtVisitor, ExprVisitor<Void> {
    private static final String TAG = "think.validator";

    private final Program program;
    private final List<ValidationError> errors = new ArrayList<>();
    private SubtaskRegistry registry;

    private boolean insideSubtask;
    private boolean sawReturn;

    public Validator(Program program) {
        this.program = program;
    }

    public List<ValidationError> validate() {
        errors.clear();
        checkObjectives();
        checkTaskNames();
        registry = buildRegistry();
        checkRuns();

        for (Task task : program.tasks) {
            if (task.members.isEmpty()) {
                error(task.keyword, "Task '" + task.name + "' has no steps or subtasks");
            }
            for (Member member : task.members) {
                checkMember(member);
            }
        }

        if (errors.isEmpty()) {
            Debug.get().d(TAG, "program is valid (" + program.tasks.size() + " task(s), "
                    + registry.size() + " subtask(s))");
        } else {
            Debug.get().d(TAG, errors.size() + " validation error(s)");
        }
        return new ArrayList<>(errors);
    }

    /** Registry of the last {@link #validate()} call. */
    public SubtaskRegistry registry() {
        if (registry == null) throw new IllegalStateException("validate() has not run");
        return registry;
    }

    private void checkObjectives() {
        if (program.objectives.isEmpty()) {
            errors.add(new ValidationError(1, 1, "Program must declare an objective"));
            return;
        }
        Objective first = program.objectives.get(0);
        for (int i = 1; i < program.objectives.size(); i++) {
            error(program.objectives.get(i).keyword,
                    "Duplicate objective (a program has exactly one; first declared at line " + first.keyword.line + ")");
        }
    }

    private void checkTaskNames() {
        Map<String, Task> seen = new LinkedHashMap<>();
        for (Task task : program.tasks) {
            Task first = seen.get(task.name);
            if (first == null) {
                seen.put(task.name, task);
                continue;
            }
            error(task.keyword, "Duplicate task '" + task.name + "' (first declared at line "
                    + first.keyword.line + ", column " + first.keyword.column + ")");
        }
    }

    private SubtaskRegistry buildRegistry() {
        Map<String, Subtask> byName = new LinkedHashMap<>();
        for (Subtask s : program.allSubtasks()) {
            String key = s.normalizedName();
            Subtask first = byName.get(key);
            if (first == null) {
                byName.put(key, s);
                continue;
            }
            error(s.keyword, "Subtask '" + s.name + "' conflicts with subtask '" + first.name
                    + "' declared at line " + first.keyword.line + " (both are called as " + key + "())");
        }
        return new SubtaskRegistry(byName);
    }

    private void checkRuns() {
        for (Run run : program.runs) {
            if (program.findTask(run.taskName) == null) {
                error(run.keyword, "Run target '" + run.taskName + "' is not a declared task");
            }
        }
    }

    private void checkMember(Member member) {
        insideSubtask = member instanceof Subtask;
        sawReturn = false;
        String what = insideSubtask ? "Subtask" : "Step";
        if (member.body().isEmpty()) {
            error(member.keyword(), what + " '" + member.name() + "' has an empty body");
        }
        checkBody(member.body());
        if (insideSubtask && !sawReturn) {
            Debug.get().w(TAG, "subtask '" + member.name() + "' never returns a value; calls yield None");
        }
    }

    private void checkBody(List<Stmt> body) {
        for (Stmt stmt : body) {
            stmt.accept(this);
        }
    }

    private void checkNonEmpty(List<Stmt> body, Token anchor, String what) {
        if (body == null || body.isEmpty()) {
            error(anchor, what + " has an empty body");
        }
    }

    private void check(ExprInterface expr) {
        if (expr != null) expr.accept(this);
    }

    private void error(Token at, String message) {
        errors.add(ValidationError.at(at, message));
    }

    // Statements

    @Override
    public void visitAssignmentStmt(Assignment stmt) {
        check(stmt.value);
    }

    @Override
    public void visitDecideStmt(Decide stmt) {
        if (stmt.branches.isEmpty()) {
            error(stmt.keyword, "Decide block needs at least one 'if' branch");
        }
        for (Branch branch : stmt.branches) {
            check(branch.condition);
            checkNonEmpty(branch.body, branch.keyword, "'" + branch.keyword.lexeme + "' branch");
            checkBody(branch.body);
        }
        if (stmt.elseBody != null) {
            checkNonEmpty(stmt.elseBody, stmt.keyword, "'else' branch");
            checkBody(stmt.elseBody);
        }
    }

    @Override
    public void visitForStmt(ForLoop stmt) {
        if (stmt.end == null) {
            error(stmt.keyword, "For loop is missing its 'end'");
        }
        check(stmt.iterable);
        check(stmt.rangeStart);
        check(stmt.rangeEnd);
        checkNonEmpty(stmt.body, stmt.keyword, "For loop");
        checkBody(stmt.body);
    }

    @Override
    public void visitWhileStmt(WhileLoop stmt) {
        if (stmt.end == null) {
            error(stmt.keyword, "While loop is missing its 'end'");
        }
        check(stmt.condition);
        checkNonEmpty(stmt.body, stmt.keyword, "While loop");
        checkBody(stmt.body);
    }

    @Override
    public void visitReturnStmt(Return stmt) {
        if (!insideSubtask) {
            error(stmt.keyword, "'return' is only allowed inside a subtask");
        }
        sawReturn = true;
        check(stmt.value);
    }

    @Override
    public void visitExprStmt(ExprStmt stmt) {
        check(stmt.expression);
    }

    @Override
    public void visitPrintStmt(Print stmt) {
        for (ExprInterface arg : stmt.arguments) check(arg);
    }

    // Expressions

    @Override
    public Void visitLiteralExpr(Literal expr) {
        return null;
    }

    @Override
    public Void visitListLiteralExpr(ListLiteral expr) {
        for (ExprInterface item : expr.items) check(item);
        return null;
    }

    @Override
    public Void visitDictLiteralExpr(DictLiteral expr) {
        for (int i = 0; i < expr.keys.size(); i++) {
            check(expr.keys.get(i));
            check(expr.values.get(i));
        }
        return null;
    }

    @Override
    public Void visitVariableExpr(Variable expr) {
        return null;
    }

    @Override
    public Void visitBinaryExpr(Binary expr) {
        check(expr.left);
        check(expr.right);
        return null;
    }

    @Override
    public Void visitLogicalExpr(Logical expr) {
        check(expr.left);
        check(expr.right);
        return null;
    }

    @Override
    public Void visitUnaryExpr(Unary expr) {
        check(expr.right);
        return null;
    }

    @Override
    public Void visitIndexExpr(Index expr) {
        check(expr.target);
        check(expr.index);
        return null;
    }

    @Override
    public Void visitCallExpr(Call expr) {
        String name = expr.name();
        if (!Builtins.isBuiltin(name)) {
            Subtask target = registry.lookup(name);
            if (target == null) {
                error(expr.callee, "Unknown function or subtask '" + name + "'");
            } else if (!expr.arguments.isEmpty()) {
                error(expr.callee, "Subtask '" + target.name + "' takes no arguments");
            }
        }
        for (ExprInterface arg : expr.arguments) check(arg);
        return null;
    }
}
