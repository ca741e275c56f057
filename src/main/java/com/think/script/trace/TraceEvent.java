package com.think.script.trace;

/**
 * One structural record of execution. Renderers only decorate the text that
 * {@link #message()} produces, so every style shows the same entries at the
 * same depths.
 */
public final class TraceEvent {

    public enum Kind {
        PROGRAM_START("PROGRAM"),
        PROGRAM_END("PROGRAM"),
        TASK_START("TASK"),
        TASK_END("TASK"),
        STEP_START("STEP"),
        STEP_END("STEP"),
        SUBTASK_START("SUBTASK"),
        SUBTASK_END("SUBTASK"),
        VARIABLE_ASSIGNED("VARIABLE"),
        OUTPUT("OUTPUT"),
        DECISION_START("DECISION"),
        CONDITION_CHECKED("CHECK"),
        BRANCH_TAKEN("BRANCH"),
        DECISION_END("COMPLETE"),
        LOOP_START("LOOP"),
        LOOP_ITERATION("ITERATION"),
        LOOP_END("COMPLETE"),
        INFO("INFO");

        private final String category;

        Kind(String category) {
            this.category = category;
        }

        /** Upper-case label the text styles print in front of the message. */
        public String category() {
            return category;
        }

        public boolean opensBlock() {
            return name().endsWith("_START");
        }

        public boolean closesBlock() {
            return name().endsWith("_END");
        }
    }

    private final Kind kind;
    private final int depth;
    private final String label;
    private final String detail;
    private final int line;

    public TraceEvent(Kind kind, int depth, String label, String detail, int line) {
        if (kind == null) throw new IllegalArgumentException("kind is required");
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
        this.kind = kind;
        this.depth = depth;
        this.label = label == null ? "" : label;
        this.detail = detail == null ? "" : detail;
        this.line = line;
    }

    public Kind kind() { return kind; }
    public int depth() { return depth; }

    /** Subject of the event: task, step or variable name, condition source. */
    public String label() { return label; }

    /** Value-ish payload: assigned value, output text, condition result. */
    public String detail() { return detail; }

    /** 1-based source line, or -1 for synthetic events. */
    public int line() { return line; }

    /** Plain-language description shared by every style. */
    public String message() {
        switch (kind) {
            case PROGRAM_START:
                return label;
            case PROGRAM_END:
                return "Program finished";
            case TASK_START:
            case STEP_START:
            case SUBTASK_START:
                return "Executing " + label;
            case TASK_END:
            case STEP_END:
                return "Finished " + label;
            case SUBTASK_END:
                return label + " returned " + detail;
            case VARIABLE_ASSIGNED:
                return "Assigned " + detail + " to " + label;
            case OUTPUT:
                return detail;
            case DECISION_START:
                return "Starting a conditional block";
            case CONDITION_CHECKED:
                return "Checking if " + label + " (evaluates to " + detail + ")";
            case DECISION_END:
                return "Decision complete";
            case LOOP_ITERATION:
                return detail.isEmpty() ? "Loop " + label : "Loop " + label + ": " + detail;
            case LOOP_END:
                return "Loop finished after " + detail + " iterations";
            case BRANCH_TAKEN:
            case LOOP_START:
            case INFO:
            default:
                return detail;
        }
    }

    @Override
    public String toString() {
        return kind + "@" + depth + " " + message();
    }
}
