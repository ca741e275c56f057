package com.think.script.parser;

import java.util.List;

import com.think.script.parser.Builtins.BuiltinFunction;
import com.think.script.parser.Expr.Call;
import com.think.script.parser.Program.Subtask;

/**
 * Resolved target of a call: a built-in or a subtask. Resolution tries the
 * built-in table first, then the subtask registry.
 */
abstract class Callable {
    final String name;

    Callable(String name) {
        this.name = name;
    }

    abstract Value invoke(Interpreter interpreter, Call call, List<Value> args);

    static final class Builtin extends Callable {
        private final BuiltinFunction fn;

        Builtin(String name, BuiltinFunction fn) {
            super(name);
            this.fn = fn;
        }

        @Override
        Value invoke(Interpreter interpreter, Call call, List<Value> args) {
            try {
                return fn.call(interpreter, args);
            } catch (ThinkRuntimeException e) {
                throw e.at(call.callee);
            }
        }
    }

    static final class SubtaskCall extends Callable {
        private final Subtask subtask;

        SubtaskCall(Subtask subtask) {
            super(subtask.name);
            this.subtask = subtask;
        }

        @Override
        Value invoke(Interpreter interpreter, Call call, List<Value> args) {
            if (!args.isEmpty()) {
                throw new ThinkRuntimeException(ThinkRuntimeException.Kind.INVALID_ARGUMENT,
                        "Subtask '" + subtask.name + "' takes no arguments", call.callee);
            }
            return interpreter.callSubtask(subtask, call.callee);
        }
    }
}
