package com.think.script.trace;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders an event stream in one style, indenting each entry two spaces per
 * depth level. Stateless.
 */
public final class TraceFormatter {

    private TraceFormatter() {}

    public static String indent(int depth) {
        return "  ".repeat(Math.max(0, depth));
    }

    /** One rendered entry per event, in event order. */
    public static List<String> entries(List<TraceEvent> events, TraceStyle style) {
        TraceRenderer renderer = (style == null ? TraceStyle.DEFAULT : style).renderer();
        List<String> out = new ArrayList<>(events.size());
        for (TraceEvent e : events) {
            String indent = indent(e.depth());
            out.add(renderer.render(continued(e, indent), indent));
        }
        return out;
    }

    /** Indents line breaks inside an event's text so continuation lines keep the event's depth. */
    private static TraceEvent continued(TraceEvent e, String indent) {
        if (indent.isEmpty() || (e.label().indexOf('\n') < 0 && e.detail().indexOf('\n') < 0)) return e;
        String br = "\n" + indent;
        return new TraceEvent(e.kind(), e.depth(), e.label().replace("\n", br), e.detail().replace("\n", br), e.line());
    }

    public static String format(List<TraceEvent> events, TraceStyle style) {
        return String.join("\n", entries(events, style));
    }
}
