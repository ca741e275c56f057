package com.think.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

import com.think.script.trace.TraceSink;
import com.think.script.trace.TraceStyle;

/**
 * Per-call settings for {@link ThinkScript#execute}. Limits left unset fall
 * back to the engine's values.
 */
public final class ExecutionOptions {

    private boolean explain;
    private TraceStyle style = TraceStyle.DEFAULT;
    private final List<TraceSink> sinks = new ArrayList<>();
    private Consumer<String> outputListener;
    private Integer maxCallDepth;
    private Integer maxIterationsShown;
    private Long maxLoopIterations;

    public static ExecutionOptions defaults() {
        return new ExecutionOptions();
    }

    /** Explain mode with the given style, e.g. {@code explain("markdown")}. */
    public static ExecutionOptions explain(String style) {
        return new ExecutionOptions().setExplain(true).setStyle(TraceStyle.fromName(style));
    }

    public ExecutionOptions setExplain(boolean explain) {
        this.explain = explain;
        return this;
    }

    public ExecutionOptions setStyle(TraceStyle style) {
        this.style = style == null ? TraceStyle.DEFAULT : style;
        return this;
    }

    /** Extra receiver of every trace event; events are produced even when explain is off. */
    public ExecutionOptions addTraceSink(TraceSink sink) {
        if (sink != null) sinks.add(sink);
        return this;
    }

    /** Called with each output line as it is printed. */
    public ExecutionOptions setOutputListener(Consumer<String> listener) {
        this.outputListener = listener;
        return this;
    }

    public ExecutionOptions setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("maxCallDepth must be >= 1");
        this.maxCallDepth = depth;
        return this;
    }

    public ExecutionOptions setMaxIterationsShown(int shown) {
        if (shown < 0) throw new IllegalArgumentException("maxIterationsShown must be >= 0");
        this.maxIterationsShown = shown;
        return this;
    }

    /** 0 disables the while-loop guard. */
    public ExecutionOptions setMaxLoopIterations(long max) {
        if (max < 0) throw new IllegalArgumentException("maxLoopIterations must be >= 0");
        this.maxLoopIterations = max;
        return this;
    }

    public boolean isExplain() { return explain; }
    public TraceStyle getStyle() { return style; }
    public List<TraceSink> getTraceSinks() { return Collections.unmodifiableList(sinks); }
    public Consumer<String> getOutputListener() { return outputListener; }

    int maxCallDepthOr(int fallback) { return maxCallDepth == null ? fallback : maxCallDepth; }
    int maxIterationsShownOr(int fallback) { return maxIterationsShown == null ? fallback : maxIterationsShown; }
    long maxLoopIterationsOr(long fallback) { return maxLoopIterations == null ? fallback : maxLoopIterations; }
}
