package com.think.script.trace;

import com.think.debug.Debug;

/** Forwards every event to the debug hub at INFO level, tagged {@code think.trace}. */
public final class TraceLogSink implements TraceSink {

    @Override
    public void event(TraceEvent event) {
        Debug.get().i("think.trace", TraceFormatter.indent(event.depth()) + event.message());
    }

}
