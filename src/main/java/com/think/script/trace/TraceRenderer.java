package com.think.script.trace;

/**
 * Turns one event into its decorated text. The indent is already computed from
 * the event depth; a renderer may return several lines, each of which must
 * start with the indent.
 */
public interface TraceRenderer {
    String render(TraceEvent event, String indent);
}
