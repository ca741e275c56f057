package com.think.script;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.think.script.parser.Value;
import com.think.script.trace.TraceEvent;

/** Outcome of one successful execution. */
public final class ExecutionResult {

    private final List<String> outputLines;
    private final String trace;
    private final List<TraceEvent> events;
    private final Map<String, Map<String, Value>> taskStates;

    ExecutionResult(List<String> outputLines, String trace, List<TraceEvent> events,
                    Map<String, Map<String, Value>> taskStates) {
        this.outputLines = List.copyOf(outputLines);
        this.trace = trace;
        this.events = List.copyOf(events);
        this.taskStates = taskStates;
    }

    /** Everything print wrote, one line per call, newline separated. */
    public String getProgramOutput() {
        return String.join("\n", outputLines);
    }

    public List<String> getOutputLines() {
        return outputLines;
    }

    /** Rendered explain-mode trace; empty when explain was off. */
    public Optional<String> getTrace() {
        return Optional.ofNullable(trace);
    }

    /** Recorded events; empty when explain was off. */
    public List<TraceEvent> getEvents() {
        return events;
    }

    /** Final variables of each executed task, keyed by task name. */
    public Map<String, Map<String, Value>> getTaskStates() {
        return taskStates;
    }

    /** Final value of {@code variable} in {@code task}, or null. */
    public Value getVariable(String task, String variable) {
        Map<String, Value> vars = taskStates.get(task);
        return vars == null ? null : vars.get(variable);
    }
}
