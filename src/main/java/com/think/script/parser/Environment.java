package com.think.script.parser;

import java.util.LinkedHashMap;
import java.util.Map;

import com.think.script.parser.Program.Subtask;

/**
 * Variables of one task execution. Flat: every step and every subtask called
 * while the task runs reads and writes this single map. The registry link is
 * only used to find callable subtasks, never to look up variables.
 */
public class Environment {
    private final String taskName;
    private final SubtaskRegistry subtasks;
    private final Map<String, Value> values = new LinkedHashMap<>();

    public Environment(String taskName, SubtaskRegistry subtasks) {
        this.taskName = taskName;
        this.subtasks = subtasks;
    }

    public Value get(Token name) {
        Value v = values.get(name.lexeme);
        if (v == null) {
            throw new ThinkRuntimeException(ThinkRuntimeException.Kind.UNDEFINED_VARIABLE,
                    "Undefined variable '" + name.lexeme + "' in task '" + taskName + "' (assign it before reading it)", name);
        }
        return v;
    }

    /** Binds or rebinds {@code name}; callers pass an already copied value. */
    public void assign(String name, Value value) {
        values.put(name, value);
    }

    public Subtask lookupSubtask(String callName) {
        return subtasks == null ? null : subtasks.lookup(callName);
    }

    /** Read-only copy of the current bindings in assignment order. */
    public Map<String, Value> snapshot() {
        Map<String, Value> out = new LinkedHashMap<>();
        for (Map.Entry<String, Value> e : values.entrySet()) {
            out.put(e.getKey(), e.getValue().frozen());
        }
        return out;
    }
}
