package com.think.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import com.think.debug.Debug;
import com.think.script.parser.Builtins.BuiltinFunction;
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
import com.think.script.parser.Statement.StmtVisitor;
import com.think.script.parser.Statement.WhileLoop;
import com.think.script.parser.ThinkRuntimeException.Kind;
import com.think.script.trace.TraceEvent;
import com.think.script.trace.TraceSink;

/**
 * Tree-walking evaluator for one execution of a validated program.
 *
 * Each run statement gets a fresh flat {@link Environment}; steps execute in
 * declaration order and subtasks only when called, sharing the caller's task
 * environment. Trace events are emitted only when a sink is present.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor {
    private static final String TAG = "think.interpreter";

    private final Program program;
    private final SubtaskRegistry subtasks;
    private final TraceSink trace;
    private final Consumer<String> outputListener;
    private final int maxCallDepth;
    private final int maxIterationsShown;
    private final long maxLoopIterations;

    private final Deque<CallFrame> callStack = new ArrayDeque<CallFrame>();
    private final List<String> output = new ArrayList<>();
    private final Map<String, Map<String, Value>> taskStates = new LinkedHashMap<>();

    Environment env;
    private int depth;
    private Token current;

    public Interpreter(Program program, SubtaskRegistry subtasks, TraceSink trace, Consumer<String> outputListener,
                       int maxCallDepth, int maxIterationsShown, long maxLoopIterations) {
        this.program = program;
        this.subtasks = subtasks;
        this.trace = trace;
        this.outputListener = outputListener;
        this.maxCallDepth = maxCallDepth;
        this.maxIterationsShown = maxIterationsShown;
        this.maxLoopIterations = maxLoopIterations;
    }

    /** Executes every run statement in order. The first runtime error aborts the whole execution. */
    public void execute() {
        depth = 0;
        String objective = program.objective == null ? "" : program.objective.text;
        open(TraceEvent.Kind.PROGRAM_START, objective, null, program.objective == null ? null : program.objective.keyword);
        for (Run run : program.runs) {
            executeTask(run);
        }
        close(TraceEvent.Kind.PROGRAM_END, objective, null, null);
        Debug.get().d(TAG, "executed " + program.runs.size() + " run statement(s), "
                + output.size() + " output line(s)");
    }

    /** Lines written by print, in order. */
    public List<String> output() {
        return Collections.unmodifiableList(output);
    }

    /** Final variables of every executed task, keyed by task name. */
    public Map<String, Map<String, Value>> taskStates() {
        return Collections.unmodifiableMap(taskStates);
    }

    private void executeTask(Run run) {
        Task task = program.findTask(run.taskName);
        if (task == null) {
            throw new ThinkRuntimeException(Kind.UNDEFINED_CALLABLE,
                    "No task named '" + run.taskName + "'", run.keyword);
        }
        env = new Environment(task.name, subtasks);
        open(TraceEvent.Kind.TASK_START, task.name, null, task.keyword);
        for (Member member : task.members) {
            if (member instanceof Step) executeStep((Step) member);
        }
        close(TraceEvent.Kind.TASK_END, task.name, null, task.keyword);
        taskStates.put(task.name, env.snapshot());
    }

    private void executeStep(Step step) {
        open(TraceEvent.Kind.STEP_START, step.name, null, step.keyword);
        executeBlock(step.body);
        close(TraceEvent.Kind.STEP_END, step.name, null, step.keyword);
    }

    private void executeBlock(List<Stmt> body) {
        for (Stmt stmt : body) {
            current = stmt.token();
            stmt.accept(this);
        }
    }

    /** Runs a subtask body against the caller's task environment. */
    Value callSubtask(Subtask subtask, Token callSite) {
        if (callStack.size() >= maxCallDepth) {
            throw new ThinkRuntimeException(Kind.CALL_DEPTH_EXCEEDED,
                    "Maximum subtask call depth of " + maxCallDepth + " exceeded calling '" + subtask.name + "'", callSite);
        }
        callStack.push(new CallFrame(subtask.name, callSite));
        open(TraceEvent.Kind.SUBTASK_START, subtask.name, null, callSite);
        Value result = Value.none();
        try {
            executeBlock(subtask.body);
        } catch (ReturnSignal r) {
            result = r.value;
        } finally {
            callStack.pop();
        }
        close(TraceEvent.Kind.SUBTASK_END, subtask.name, result.repr(), callSite);
        return result;
    }

    /** Writes one output line: the arguments' print forms joined by a space. */
    void print(List<Value> args) {
        List<String> parts = new ArrayList<>(args.size());
        for (Value v : args) parts.add(v.str());
        String line = String.join(" ", parts);
        output.add(line);
        if (outputListener != null) outputListener.accept(line);
        emit(TraceEvent.Kind.OUTPUT, null, line, current);
    }

    // Trace plumbing

    private boolean tracing() {
        return trace != null;
    }

    private void emit(TraceEvent.Kind kind, String label, String detail, Token at) {
        if (trace == null) return;
        trace.event(new TraceEvent(kind, depth, label, detail, at == null ? -1 : at.line));
    }

    private void open(TraceEvent.Kind kind, String label, String detail, Token at) {
        emit(kind, label, detail, at);
        depth++;
    }

    private void close(TraceEvent.Kind kind, String label, String detail, Token at) {
        depth--;
        emit(kind, label, detail, at);
    }

    /** Closes a block a subtask return is leaving, so every start event keeps its end event. */
    private ReturnSignal unwind(ReturnSignal r, TraceEvent.Kind kind, String label, String detail, Token at) {
        close(kind, label, detail, at);
        return r;
    }

    private void iteration(int n, long total, String bindings, Token at) {
        if (!tracing()) return;
        if (n <= maxIterationsShown) {
            emit(TraceEvent.Kind.LOOP_ITERATION, "#" + n, bindings, at);
        } else if (n == maxIterationsShown + 1) {
            String more = total >= 0 ? "... " + (total - maxIterationsShown) + " more iterations will be processed ..."
                    : "... more iterations will be processed ...";
            emit(TraceEvent.Kind.INFO, null, more, at);
        }
    }

    // Statements

    @Override
    public void visitAssignmentStmt(Assignment stmt) {
        Value value = evaluate(stmt.value).copy();
        env.assign(stmt.name.lexeme, value);
        if (tracing()) emit(TraceEvent.Kind.VARIABLE_ASSIGNED, stmt.name.lexeme, value.repr(), stmt.name);
    }

    @Override
    public void visitDecideStmt(Decide stmt) {
        Token end = stmt.end == null ? stmt.keyword : stmt.end;
        open(TraceEvent.Kind.DECISION_START, null, null, stmt.keyword);
        try {
            boolean taken = false;
            for (Branch branch : stmt.branches) {
                Value cond = evaluate(branch.condition);
                if (tracing()) {
                    emit(TraceEvent.Kind.CONDITION_CHECKED, ExprPrinter.print(branch.condition), cond.repr(), branch.keyword);
                }
                if (cond.isTruthy()) {
                    emit(TraceEvent.Kind.BRANCH_TAKEN, null,
                            "Taking " + (branch.isElif() ? "elif" : "if") + " branch", branch.keyword);
                    runBranch(branch.body);
                    taken = true;
                    break;
                }
            }
            if (!taken) {
                if (stmt.elseBody != null) {
                    emit(TraceEvent.Kind.BRANCH_TAKEN, null, "No conditions were true, taking else branch", stmt.keyword);
                    runBranch(stmt.elseBody);
                } else {
                    emit(TraceEvent.Kind.BRANCH_TAKEN, null, "No conditions were true, nothing to do", stmt.keyword);
                }
            }
        } catch (ReturnSignal r) {
            throw unwind(r, TraceEvent.Kind.DECISION_END, null, null, end);
        }
        close(TraceEvent.Kind.DECISION_END, null, null, end);
    }

    private void runBranch(List<Stmt> body) {
        depth++;
        try {
            executeBlock(body);
        } finally {
            depth--;
        }
    }

    @Override
    public void visitForStmt(ForLoop stmt) {
        switch (stmt.kind) {
            case RANGE:
                runRangeLoop(stmt);
                break;
            case ENUMERATE:
                runEnumerateLoop(stmt);
                break;
            default:
                runSequenceLoop(stmt);
                break;
        }
    }

    private List<Value> loopItems(ExprInterface iterable) {
        Value source = evaluate(iterable);
        try {
            return Builtins.iterationItems(source);
        } catch (ThinkRuntimeException e) {
            throw e.at(iterable.token());
        }
    }

    private void runSequenceLoop(ForLoop stmt) {
        List<Value> items = loopItems(stmt.iterable);
        String source = ExprPrinter.print(stmt.iterable);
        String var = stmt.variable.lexeme;
        open(TraceEvent.Kind.LOOP_START, source,
                "Starting a loop that will go through each item in " + source, stmt.keyword);
        int n = 0;
        try {
            for (Value item : items) {
                n++;
                Value bound = item.copy();
                env.assign(var, bound);
                if (tracing()) iteration(n, items.size(), var + " = " + bound.repr(), stmt.keyword);
                executeBlock(stmt.body);
            }
        } catch (ReturnSignal r) {
            throw unwind(r, TraceEvent.Kind.LOOP_END, source, Integer.toString(n), stmt.end);
        }
        close(TraceEvent.Kind.LOOP_END, source, Integer.toString(n), stmt.end);
    }

    private void runEnumerateLoop(ForLoop stmt) {
        List<Value> items = loopItems(stmt.iterable);
        String source = ExprPrinter.print(stmt.iterable);
        String indexVar = stmt.indexVariable.lexeme;
        String var = stmt.variable.lexeme;
        open(TraceEvent.Kind.LOOP_START, source, "Starting an enumerate loop over " + source, stmt.keyword);
        int n = 0;
        try {
            for (Value item : items) {
                Value bound = item.copy();
                env.assign(indexVar, Value.integer(n));
                env.assign(var, bound);
                n++;
                if (tracing()) {
                    iteration(n, items.size(), indexVar + " = " + (n - 1) + ", " + var + " = " + bound.repr(), stmt.keyword);
                }
                executeBlock(stmt.body);
            }
        } catch (ReturnSignal r) {
            throw unwind(r, TraceEvent.Kind.LOOP_END, source, Integer.toString(n), stmt.end);
        }
        close(TraceEvent.Kind.LOOP_END, source, Integer.toString(n), stmt.end);
    }

    private void runRangeLoop(ForLoop stmt) {
        long start = stmt.rangeStart == null ? 0L : rangeBound(stmt.rangeStart);
        long stop = rangeBound(stmt.rangeEnd);
        String var = stmt.variable.lexeme;
        open(TraceEvent.Kind.LOOP_START, "range",
                "Starting range loop from " + start + " to " + stop, stmt.keyword);
        long total = Math.max(0L, stop - start);
        int n = 0;
        try {
            for (long i = start; i < stop; i++) {
                n++;
                env.assign(var, Value.integer(i));
                if (tracing()) iteration(n, total, var + " = " + i, stmt.keyword);
                executeBlock(stmt.body);
            }
        } catch (ReturnSignal r) {
            throw unwind(r, TraceEvent.Kind.LOOP_END, "range", Integer.toString(n), stmt.end);
        }
        close(TraceEvent.Kind.LOOP_END, "range", Integer.toString(n), stmt.end);
    }

    private long rangeBound(ExprInterface expr) {
        Value v = evaluate(expr);
        if (v.type != Value.Type.INT) {
            throw new ThinkRuntimeException(Kind.TYPE_MISMATCH,
                    "range() expects an int, got " + v.typeName(), expr.token());
        }
        return v.asInt();
    }

    @Override
    public void visitWhileStmt(WhileLoop stmt) {
        String source = ExprPrinter.print(stmt.condition);
        open(TraceEvent.Kind.LOOP_START, source, "Starting while loop: while " + source, stmt.keyword);
        int n = 0;
        try {
            while (evaluate(stmt.condition).isTruthy()) {
                n++;
                if (maxLoopIterations > 0 && n > maxLoopIterations) {
                    throw new ThinkRuntimeException(Kind.ITERATION_LIMIT,
                            "While loop exceeded " + maxLoopIterations + " iterations", stmt.keyword);
                }
                iteration(n, -1, "", stmt.keyword);
                executeBlock(stmt.body);
            }
        } catch (ReturnSignal r) {
            throw unwind(r, TraceEvent.Kind.LOOP_END, source, Integer.toString(n), stmt.end);
        }
        close(TraceEvent.Kind.LOOP_END, source, Integer.toString(n), stmt.end);
    }

    @Override
    public void visitReturnStmt(Return stmt) {
        if (callStack.isEmpty()) {
            throw new IllegalStateException("return outside of a subtask at line " + stmt.keyword.line);
        }
        Value value = stmt.value == null ? Value.none() : evaluate(stmt.value);
        throw new ReturnSignal(value);
    }

    @Override
    public void visitExprStmt(ExprStmt stmt) {
        evaluate(stmt.expression);
    }

    @Override
    public void visitPrintStmt(Print stmt) {
        List<Value> args = new ArrayList<>(stmt.arguments.size());
        for (ExprInterface arg : stmt.arguments) args.add(evaluate(arg));
        current = stmt.keyword;
        print(args);
    }

    // Expressions

    private Value evaluate(ExprInterface expr) {
        return expr.accept(this);
    }

    static Value literal(Object raw) {
        if (raw == null) return Value.none();
        if (raw instanceof Long) return Value.integer((Long) raw);
        if (raw instanceof Double) return Value.floating((Double) raw);
        if (raw instanceof Boolean) return Value.bool((Boolean) raw);
        if (raw instanceof String) return Value.string((String) raw);
        throw new IllegalArgumentException("Unsupported literal " + raw.getClass().getName());
    }

    @Override
    public Value visitLiteralExpr(Literal expr) {
        return literal(expr.value);
    }

    @Override
    public Value visitListLiteralExpr(ListLiteral expr) {
        List<Value> items = new ArrayList<>(expr.items.size());
        for (ExprInterface item : expr.items) items.add(evaluate(item).copy());
        return Value.list(items);
    }

    @Override
    public Value visitDictLiteralExpr(DictLiteral expr) {
        Map<String, Value> entries = new LinkedHashMap<>();
        for (int i = 0; i < expr.keys.size(); i++) {
            ExprInterface keyExpr = expr.keys.get(i);
            Value key = evaluate(keyExpr);
            if (key.type != Value.Type.STRING) {
                throw new ThinkRuntimeException(Kind.TYPE_MISMATCH,
                        "Dict keys must be strings, not " + key.typeName(), keyExpr.token());
            }
            entries.put(key.asString(), evaluate(expr.values.get(i)).copy());
        }
        return Value.dict(entries);
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        return env.get(expr.name);
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value left = evaluate(expr.left);
        Value right = evaluate(expr.right);
        Token op = expr.operator;

        switch (op.type) {
            case PLUS:
                if (left.isNumber() && right.isNumber()) return arithmetic(left, right, op);
                if (left.type == Value.Type.STRING && right.type == Value.Type.STRING) {
                    return Value.string(left.asString() + right.asString());
                }
                if (left.type == Value.Type.LIST && right.type == Value.Type.LIST) {
                    List<Value> joined = new ArrayList<>(left.asList().size() + right.asList().size());
                    for (Value v : left.asList()) joined.add(v.copy());
                    for (Value v : right.asList()) joined.add(v.copy());
                    return Value.list(joined);
                }
                throw operandMismatch(op, left, right);
            case MINUS:
            case STAR:
            case SLASH:
                if (!left.isNumber() || !right.isNumber()) throw operandMismatch(op, left, right);
                return arithmetic(left, right, op);
            case EQUAL_EQUAL:
                return Value.bool(left.equals(right));
            case BANG_EQUAL:
                return Value.bool(!left.equals(right));
            case GREATER:
                return Value.bool(compare(left, right, op) > 0);
            case GREATER_EQUAL:
                return Value.bool(compare(left, right, op) >= 0);
            case LESS:
                return Value.bool(compare(left, right, op) < 0);
            case LESS_EQUAL:
                return Value.bool(compare(left, right, op) <= 0);
            default:
                throw new IllegalStateException("Unknown binary operator " + op.lexeme);
        }
    }

    private static ThinkRuntimeException operandMismatch(Token op, Value left, Value right) {
        return new ThinkRuntimeException(Kind.TYPE_MISMATCH, "Unsupported operand types for " + op.lexeme
                + ": '" + left.typeName() + "' and '" + right.typeName() + "'", op);
    }

    private static int compare(Value left, Value right, Token op) {
        try {
            return Builtins.compare(left, right, op.lexeme);
        } catch (ThinkRuntimeException e) {
            throw e.at(op);
        }
    }

    private static Value arithmetic(Value left, Value right, Token op) {
        if (op.type == TokenType.SLASH) {
            double divisor = right.asNumber();
            if (divisor == 0.0) {
                throw new ThinkRuntimeException(Kind.DIVISION_BY_ZERO, "Division by zero", op);
            }
            return Value.floating(left.asNumber() / divisor);
        }
        if (left.type == Value.Type.INT && right.type == Value.Type.INT) {
            long a = left.asInt();
            long b = right.asInt();
            try {
                switch (op.type) {
                    case PLUS:  return Value.integer(Math.addExact(a, b));
                    case MINUS: return Value.integer(Math.subtractExact(a, b));
                    default:    return Value.integer(Math.multiplyExact(a, b));
                }
            } catch (ArithmeticException e) {
                throw new ThinkRuntimeException(Kind.INTEGER_OVERFLOW,
                        "Integer overflow in " + a + " " + op.lexeme + " " + b, op);
            }
        }
        double a = left.asNumber();
        double b = right.asNumber();
        switch (op.type) {
            case PLUS:  return Value.floating(a + b);
            case MINUS: return Value.floating(a - b);
            default:    return Value.floating(a * b);
        }
    }

    @Override
    public Value visitLogicalExpr(Logical expr) {
        boolean left = evaluate(expr.left).isTruthy();
        if (expr.operator.type == TokenType.OR) {
            if (left) return Value.bool(true);
        } else {
            if (!left) return Value.bool(false);
        }
        return Value.bool(evaluate(expr.right).isTruthy());
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value right = evaluate(expr.right);
        if (expr.operator.type == TokenType.NOT) return Value.bool(!right.isTruthy());
        if (right.type == Value.Type.INT) {
            if (right.asInt() == Long.MIN_VALUE) {
                throw new ThinkRuntimeException(Kind.INTEGER_OVERFLOW,
                        "Integer overflow negating " + right.asInt(), expr.operator);
            }
            return Value.integer(-right.asInt());
        }
        if (right.type == Value.Type.FLOAT) return Value.floating(-right.asNumber());
        throw new ThinkRuntimeException(Kind.TYPE_MISMATCH,
                "Bad operand type for unary -: '" + right.typeName() + "'", expr.operator);
    }

    @Override
    public Value visitIndexExpr(Index expr) {
        Value target = evaluate(expr.target);
        Value index = evaluate(expr.index);

        if (target.type == Value.Type.LIST) {
            if (index.type != Value.Type.INT) {
                throw new ThinkRuntimeException(Kind.TYPE_MISMATCH,
                        "List indices must be integers, not " + index.typeName(), expr.bracket);
            }
            List<Value> list = target.asList();
            long i = index.asInt();
            long resolved = i < 0 ? list.size() + i : i;
            if (resolved < 0 || resolved >= list.size()) {
                throw new ThinkRuntimeException(Kind.INDEX_ERROR,
                        "List index " + i + " out of range (size " + list.size() + ")", expr.bracket);
            }
            return list.get((int) resolved);
        }

        if (target.type == Value.Type.DICT) {
            if (index.type != Value.Type.STRING) {
                throw new ThinkRuntimeException(Kind.TYPE_MISMATCH,
                        "Dict keys must be strings, not " + index.typeName(), expr.bracket);
            }
            Value v = target.asDict().get(index.asString());
            if (v == null) {
                throw new ThinkRuntimeException(Kind.DICT_KEY_ERROR,
                        "Key " + index.repr() + " not found in dict", expr.bracket);
            }
            return v;
        }

        throw new ThinkRuntimeException(Kind.TYPE_MISMATCH,
                "'" + target.typeName() + "' object is not subscriptable", expr.bracket);
    }

    @Override
    public Value visitCallExpr(Call expr) {
        Callable callable = resolve(expr);
        List<Value> args = new ArrayList<>(expr.arguments.size());
        for (ExprInterface arg : expr.arguments) args.add(evaluate(arg));
        current = expr.callee;
        return callable.invoke(this, expr, args);
    }

    private Callable resolve(Call expr) {
        String name = expr.name();
        BuiltinFunction fn = Builtins.lookup(name);
        if (fn != null) return new Callable.Builtin(name, fn);
        Subtask subtask = env.lookupSubtask(name);
        if (subtask != null) return new Callable.SubtaskCall(subtask);
        throw new ThinkRuntimeException(Kind.UNDEFINED_CALLABLE,
                "Undefined function or subtask '" + name + "'", expr.callee);
    }
}
