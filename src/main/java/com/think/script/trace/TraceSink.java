package com.think.script.trace;

/**
 * Receives trace events in the exact order the interpreter produces them.
 */
public interface TraceSink {
    void event(TraceEvent event);
}
