package com.think.script;

import java.util.ArrayList;
import java.util.List;

import com.think.debug.Debug;
import com.think.script.parser.Interpreter;
import com.think.script.parser.Lexer;
import com.think.script.parser.Parser;
import com.think.script.parser.Program;
import com.think.script.parser.ThinkException;
import com.think.script.parser.ThinkRuntimeException;
import com.think.script.parser.Token;
import com.think.script.parser.ValidationError;
import com.think.script.parser.Validator;
import com.think.script.trace.TraceCollector;
import com.think.script.trace.TraceEvent;
import com.think.script.trace.TraceFormatter;
import com.think.script.trace.TraceSink;

/**
 * ThinkScript engine.
 *
 * - Programs declare one objective, group work into tasks made of steps and
 *   subtasks, and select tasks to execute with run statements
 * - Indentation blocks; loops are closed by an explicit 'end'
 * - Types: int, float, str, bool, list, dict, None
 * - Pipeline: parse, validate, execute. Execution refuses invalid programs
 * - Explain mode records every task, step, assignment, decision and loop and
 *   renders it in one of six styles
 *
 * Engine-level limits seed every execution; {@link ExecutionOptions} can
 * override them per call. Not thread-safe: run one execution at a time.
 */
public class ThinkScript {
    private static final String TAG = "think.engine";

    private int maxCallDepth = 64;
    private int maxIterationsShown = 5;
    private long maxLoopIterations = 0L;

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("maxCallDepth must be >= 1");
        this.maxCallDepth = depth;
    }

    public void setMaxIterationsShown(int shown) {
        if (shown < 0) throw new IllegalArgumentException("maxIterationsShown must be >= 0");
        this.maxIterationsShown = shown;
    }

    /** Caps while-loop iterations; 0 (the default) leaves loops unbounded. */
    public void setMaxLoopIterations(long max) {
        if (max < 0) throw new IllegalArgumentException("maxLoopIterations must be >= 0");
        this.maxLoopIterations = max;
    }

    public int getMaxCallDepth() { return maxCallDepth; }
    public int getMaxIterationsShown() { return maxIterationsShown; }
    public long getMaxLoopIterations() { return maxLoopIterations; }

    /** Lexes and parses; the first lexical or syntax error aborts. */
    public Program parse(String source) {
        try {
            List<Token> tokens = new Lexer(source).tokenize();
            return new Parser(tokens).parse();
        } catch (ThinkException e) {
            Debug.get().e(TAG, "parse failed: " + e.getMessage());
            throw e;
        }
    }

    /** All structural diagnostics for {@code program}; empty when it may be executed. */
    public List<ValidationError> validate(Program program) {
        return new Validator(program).validate();
    }

    public ExecutionResult execute(Program program) {
        return execute(program, ExecutionOptions.defaults());
    }

    public ExecutionResult execute(Program program, ExecutionOptions options) {
        if (options == null) options = ExecutionOptions.defaults();

        Validator validator = new Validator(program);
        List<ValidationError> errors = validator.validate();
        if (!errors.isEmpty()) {
            ThinkValidationException ex = new ThinkValidationException(errors);
            Debug.get().e(TAG, ex.getMessage());
            throw ex;
        }

        TraceCollector collector = options.isExplain() ? new TraceCollector() : null;
        List<TraceSink> sinks = new ArrayList<>(options.getTraceSinks());
        if (collector != null) sinks.add(collector);
        TraceSink trace = sinks.isEmpty() ? null : fanOut(sinks);

        Interpreter interpreter = new Interpreter(program, validator.registry(), trace, options.getOutputListener(),
                options.maxCallDepthOr(maxCallDepth),
                options.maxIterationsShownOr(maxIterationsShown),
                options.maxLoopIterationsOr(maxLoopIterations));
        try {
            interpreter.execute();
        } catch (ThinkRuntimeException e) {
            Debug.get().e(TAG, "runtime error (" + e.getKind() + "): " + e.getMessage(), e);
            throw e;
        }

        List<TraceEvent> events = collector == null ? List.of() : collector.events();
        String rendered = collector == null ? null : TraceFormatter.format(events, options.getStyle());
        return new ExecutionResult(interpreter.output(), rendered, events, interpreter.taskStates());
    }

    /** Parse, validate and execute in one call. */
    public ExecutionResult run(String source, ExecutionOptions options) {
        return execute(parse(source), options);
    }

    public ExecutionResult run(String source) {
        return run(source, ExecutionOptions.defaults());
    }

    private static TraceSink fanOut(List<TraceSink> sinks) {
        if (sinks.size() == 1) return sinks.get(0);
        List<TraceSink> copy = List.copyOf(sinks);
        return event -> {
            for (TraceSink s : copy) s.event(event);
        };
    }
}
