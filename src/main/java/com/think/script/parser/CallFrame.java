package com.think.script.parser;

/** One active subtask call; the stack of these bounds recursion depth. */
public class CallFrame {
    final String subtaskName;
    final Token callSite;

    CallFrame(String subtaskName, Token callSite) {
        this.subtaskName = subtaskName;
        this.callSite = callSite;
    }
}
