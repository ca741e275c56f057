package com.think.script.trace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class TraceCollector implements TraceSink {
    private final List<TraceEvent> events = new ArrayList<>();

    @Override
    public void event(TraceEvent event) {
        events.add(event);
    }

    public List<TraceEvent> events() {
        return Collections.unmodifiableList(events);
    }
}
