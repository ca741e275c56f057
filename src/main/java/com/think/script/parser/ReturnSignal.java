package com.think.script.parser;

/** Unwinds a subtask body on {@code return}. Never escapes the interpreter. */
final class ReturnSignal extends RuntimeException {
    private static final long serialVersionUID = 1L;
    final transient Value value;

    ReturnSignal(Value value) {
        super(null, null, false, false);
        this.value = value;
    }
}
