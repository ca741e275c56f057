package com.think.script.trace;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * The six explain-mode presentations. Each style only decorates
 * {@link TraceEvent#message()}; none adds, drops or reorders entries.
 */
public enum TraceStyle {

    DEFAULT((e, indent) -> indent + "[" + e.kind().category() + "] " + e.message()),

    MINIMAL((e, indent) -> indent + e.kind().category() + ": " + e.message()),

    DETAILED(TraceStyle::detailed),

    COLOR(TraceStyle::color),

    MARKDOWN(TraceStyle::markdown),

    EDUCATIONAL(TraceStyle::educational);

    private static final String RULE = "─".repeat(40);
    private static final String PROGRAM_RULE = "=".repeat(60);

    private static final String BOLD = "\033[1m";
    private static final String RESET = "\033[0m";
    private static final Map<TraceEvent.Kind, String> COLORS = new EnumMap<>(TraceEvent.Kind.class);
    private static final Map<TraceEvent.Kind, String> ICONS = new EnumMap<>(TraceEvent.Kind.class);

    static {
        String blue = "\033[94m", yellow = "\033[93m", red = "\033[91m", green = "\033[92m";
        String cyan = "\033[96m", lightCyan = "\033[36m", lightGreen = "\033[32m";
        String magenta = "\033[95m", lightMagenta = "\033[35m";
        COLORS.put(TraceEvent.Kind.PROGRAM_START, blue);
        COLORS.put(TraceEvent.Kind.PROGRAM_END, blue);
        COLORS.put(TraceEvent.Kind.TASK_START, blue);
        COLORS.put(TraceEvent.Kind.TASK_END, blue);
        COLORS.put(TraceEvent.Kind.STEP_START, yellow);
        COLORS.put(TraceEvent.Kind.STEP_END, yellow);
        COLORS.put(TraceEvent.Kind.VARIABLE_ASSIGNED, red);
        COLORS.put(TraceEvent.Kind.OUTPUT, green);
        COLORS.put(TraceEvent.Kind.SUBTASK_START, green);
        COLORS.put(TraceEvent.Kind.SUBTASK_END, green);
        COLORS.put(TraceEvent.Kind.LOOP_START, cyan);
        COLORS.put(TraceEvent.Kind.LOOP_ITERATION, lightCyan);
        COLORS.put(TraceEvent.Kind.LOOP_END, lightGreen);
        COLORS.put(TraceEvent.Kind.DECISION_END, lightGreen);
        COLORS.put(TraceEvent.Kind.DECISION_START, magenta);
        COLORS.put(TraceEvent.Kind.CONDITION_CHECKED, lightMagenta);
        COLORS.put(TraceEvent.Kind.BRANCH_TAKEN, lightMagenta);

        ICONS.put(TraceEvent.Kind.DECISION_START, "🤔");
        ICONS.put(TraceEvent.Kind.CONDITION_CHECKED, "⚖️");
        ICONS.put(TraceEvent.Kind.BRANCH_TAKEN, "↪️");
        ICONS.put(TraceEvent.Kind.LOOP_START, "🔄");
        ICONS.put(TraceEvent.Kind.LOOP_ITERATION, "👉");
        ICONS.put(TraceEvent.Kind.INFO, "ℹ️");
        ICONS.put(TraceEvent.Kind.LOOP_END, "✅");
        ICONS.put(TraceEvent.Kind.DECISION_END, "✅");
        ICONS.put(TraceEvent.Kind.VARIABLE_ASSIGNED, "📝");
    }

    private final TraceRenderer renderer;

    TraceStyle(TraceRenderer renderer) {
        this.renderer = renderer;
    }

    public TraceRenderer renderer() {
        return renderer;
    }

    /** Case-insensitive lookup; null or blank selects {@link #DEFAULT}. */
    public static TraceStyle fromName(String name) {
        if (name == null || name.isBlank()) return DEFAULT;
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown trace style '" + name
                    + "' (expected default, minimal, detailed, color, markdown or educational)", e);
        }
    }

    private static String detailed(TraceEvent e, String indent) {
        if (e.kind() == TraceEvent.Kind.PROGRAM_START) {
            return indent + PROGRAM_RULE + "\n"
                    + indent + "PROGRAM EXECUTION: " + e.message() + "\n"
                    + indent + PROGRAM_RULE;
        }
        return indent + RULE + "\n"
                + indent + e.kind().category() + ": " + e.message() + "\n"
                + indent + RULE;
    }

    private static String color(TraceEvent e, String indent) {
        String c = COLORS.getOrDefault(e.kind(), "\033[37m");
        return indent + c + BOLD + e.kind().category() + RESET + ": " + e.message();
    }

    private static String markdown(TraceEvent e, String indent) {
        switch (e.kind()) {
            case PROGRAM_START:
                return indent + "# " + e.message();
            case TASK_START:
            case TASK_END:
                return indent + "## " + e.message();
            case SUBTASK_START:
            case SUBTASK_END:
                return indent + "### " + e.message();
            case STEP_START:
            case STEP_END:
                return indent + "#### " + e.message();
            case VARIABLE_ASSIGNED:
                return indent + "* " + e.message();
            case OUTPUT:
                return indent + "> " + e.message();
            default:
                return indent + "- " + e.message();
        }
    }

    private static String educational(TraceEvent e, String indent) {
        if (e.kind() == TraceEvent.Kind.OUTPUT) return indent + "📤 Output: " + e.message();
        return indent + ICONS.getOrDefault(e.kind(), "•") + " " + e.message();
    }
}
