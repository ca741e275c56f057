import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.think.debug.Debug;
import com.think.debug.DebugLevel;
import com.think.script.ExecutionOptions;
import com.think.script.ExecutionResult;
import com.think.script.ThinkScript;
import com.think.script.trace.TraceCollector;
import com.think.script.trace.TraceEvent;
import com.think.script.trace.TraceEvent.Kind;
import com.think.script.trace.TraceFormatter;
import com.think.script.trace.TraceLogSink;
import com.think.script.trace.TraceStyle;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ThinkScriptTraceTest {

    private static final String GRADES = """
            objective "Calculate the class average"
            task "Grades":
                subtask "Calculate Average":
                    total = sum(scores)
                    return total / len(scores)
                step "Load":
                    scores = [80, 85, 90]
                step "Report":
                    average = calculate_average()
                    print(average)
            run "Grades"
            """;

    private final ThinkScript ts = new ThinkScript();

    @AfterEach
    void resetDebug() {
        Debug.get().setSink(null);
    }

    private static List<Kind> kinds(List<TraceEvent> events) {
        List<Kind> out = new ArrayList<>();
        for (TraceEvent e : events) out.add(e.kind());
        return out;
    }

    private static List<Integer> depths(List<TraceEvent> events) {
        List<Integer> out = new ArrayList<>();
        for (TraceEvent e : events) out.add(e.depth());
        return out;
    }

    @Test
    void events_followProgramTaskStepNesting() {
        ExecutionResult r = ts.run(GRADES, ExecutionOptions.explain("default"));
        List<TraceEvent> events = r.getEvents();

        assertEquals(List.of(
                Kind.PROGRAM_START,
                Kind.TASK_START,
                Kind.STEP_START, Kind.VARIABLE_ASSIGNED, Kind.STEP_END,
                Kind.STEP_START,
                Kind.SUBTASK_START, Kind.VARIABLE_ASSIGNED, Kind.SUBTASK_END,
                Kind.VARIABLE_ASSIGNED, Kind.OUTPUT,
                Kind.STEP_END,
                Kind.TASK_END,
                Kind.PROGRAM_END
        ), kinds(events));
        assertEquals(List.of(0, 1, 2, 3, 2, 2, 3, 4, 3, 3, 3, 2, 1, 0), depths(events));

        assertEquals("85.0", events.get(10).message());
        assertEquals("Calculate Average returned 85.0", events.get(8).message());
        assertEquals("Assigned [80, 85, 90] to scores", events.get(3).message());
        assertEquals(7, events.get(3).line());
    }

    @Test
    void defaultStyle_rendersBracketedCategoriesIndentedByDepth() {
        String trace = ts.run(GRADES, ExecutionOptions.explain("default")).getTrace().orElseThrow();
        String[] lines = trace.split("\n");

        assertEquals("[PROGRAM] Calculate the class average", lines[0]);
        assertEquals("  [TASK] Executing Grades", lines[1]);
        assertEquals("    [STEP] Executing Load", lines[2]);
        assertEquals("      [VARIABLE] Assigned [80, 85, 90] to scores", lines[3]);
        assertEquals("      [OUTPUT] 85.0", lines[10]);
    }

    @Test
    void allStyles_produceTheSameEntriesInTheSameOrder() {
        List<TraceEvent> reference = ts.run(GRADES, ExecutionOptions.explain("default")).getEvents();

        for (TraceStyle style : TraceStyle.values()) {
            ExecutionResult r = ts.run(GRADES, ExecutionOptions.defaults().setExplain(true).setStyle(style));
            List<TraceEvent> events = r.getEvents();
            assertEquals(kinds(reference), kinds(events), style.name());
            assertEquals(depths(reference), depths(events), style.name());

            List<String> entries = TraceFormatter.entries(events, style);
            assertEquals(events.size(), entries.size(), style.name());
            for (int i = 0; i < events.size(); i++) {
                String entry = entries.get(i);
                assertTrue(entry.startsWith(TraceFormatter.indent(events.get(i).depth())), style + ": " + entry);
                assertTrue(entry.contains(events.get(i).message()), style + ": " + entry);
            }
        }
    }

    @Test
    void styleDecorations() {
        TraceEvent task = new TraceEvent(Kind.TASK_START, 1, "Grades", null, 2);
        TraceEvent variable = new TraceEvent(Kind.VARIABLE_ASSIGNED, 3, "x", "5", 4);
        TraceEvent output = new TraceEvent(Kind.OUTPUT, 3, null, "hello", 5);
        List<TraceEvent> events = List.of(task, variable, output);

        assertEquals(List.of("  TASK: Executing Grades", "      VARIABLE: Assigned 5 to x", "      OUTPUT: hello"),
                TraceFormatter.entries(events, TraceStyle.MINIMAL));
        assertEquals(List.of("  ## Executing Grades", "      * Assigned 5 to x", "      > hello"),
                TraceFormatter.entries(events, TraceStyle.MARKDOWN));
        assertEquals(List.of("  • Executing Grades", "      📝 Assigned 5 to x", "      📤 Output: hello"),
                TraceFormatter.entries(events, TraceStyle.EDUCATIONAL));
        assertEquals("  \033[94m\033[1mTASK\033[0m: Executing Grades",
                TraceFormatter.entries(events, TraceStyle.COLOR).get(0));

        String detailed = TraceFormatter.entries(events, TraceStyle.DETAILED).get(0);
        assertEquals("  " + "─".repeat(40) + "\n  TASK: Executing Grades\n  " + "─".repeat(40), detailed);
    }

    @Test
    void detailedStyle_programHeaderUsesDoubleRule() {
        String trace = ts.run(GRADES, ExecutionOptions.explain("detailed")).getTrace().orElseThrow();

        assertTrue(trace.startsWith("=".repeat(60) + "\nPROGRAM EXECUTION: Calculate the class average\n"), trace);
    }

    @Test
    void decide_emitsChecksAndTheTakenBranch() {
        ExecutionResult r = ts.run("""
                objective "grading"
                task "T":
                    step "s":
                        score = 85
                        decide:
                            if score >= 90:
                                grade = "A"
                            elif score >= 80 and score < 90:
                                grade = "B"
                            else:
                                grade = "C"
                run "T"
                """, ExecutionOptions.explain("minimal"));

        List<TraceEvent> events = r.getEvents();
        List<String> messages = new ArrayList<>();
        for (TraceEvent e : events) messages.add(e.message());

        assertTrue(messages.contains("Starting a conditional block"));
        assertTrue(messages.contains("Checking if score >= 90 (evaluates to False)"));
        assertTrue(messages.contains("Checking if score >= 80 and score < 90 (evaluates to True)"));
        assertTrue(messages.contains("Taking elif branch"));
        assertTrue(messages.contains("Decision complete"));

        TraceEvent decision = events.get(kinds(events).indexOf(Kind.DECISION_START));
        TraceEvent assigned = null;
        for (TraceEvent e : events) {
            if (e.kind() == Kind.VARIABLE_ASSIGNED && e.label().equals("grade")) assigned = e;
        }
        assertNotNull(assigned);
        assertEquals(decision.depth() + 2, assigned.depth());
        assertEquals(decision.depth(), events.get(kinds(events).indexOf(Kind.DECISION_END)).depth());
    }

    @Test
    void loops_showOnlyTheFirstIterations() {
        ExecutionResult r = ts.run("""
                objective "loop"
                task "T":
                    step "s":
                        total = 0
                        for x in [1, 2, 3, 4, 5, 6, 7, 8]:
                            total = total + x
                        end
                run "T"
                """, ExecutionOptions.explain("default").setMaxIterationsShown(3));

        List<TraceEvent> events = r.getEvents();
        List<TraceEvent> iterations = new ArrayList<>();
        List<TraceEvent> infos = new ArrayList<>();
        for (TraceEvent e : events) {
            if (e.kind() == Kind.LOOP_ITERATION) iterations.add(e);
            if (e.kind() == Kind.INFO) infos.add(e);
        }

        assertEquals(3, iterations.size());
        assertEquals("Loop #1: x = 1", iterations.get(0).message());
        assertEquals(1, infos.size());
        assertEquals("... 5 more iterations will be processed ...", infos.get(0).message());

        TraceEvent end = events.get(kinds(events).indexOf(Kind.LOOP_END));
        assertEquals("Loop finished after 8 iterations", end.message());
        TraceEvent start = events.get(kinds(events).indexOf(Kind.LOOP_START));
        assertEquals("Starting a loop that will go through each item in [1, 2, 3, 4, 5, 6, 7, 8]", start.message());
        assertEquals(start.depth(), end.depth());
        assertEquals(start.depth() + 1, iterations.get(0).depth());
    }

    @Test
    void rangeAndEnumerateLoops_describeTheirBindings() {
        ExecutionResult r = ts.run("""
                objective "loops"
                task "T":
                    step "s":
                        for i in range(1, 3):
                            x = i
                        end
                        for i, name in enumerate(["a", "b"]):
                            y = name
                        end
                run "T"
                """, ExecutionOptions.explain("default"));

        List<String> messages = new ArrayList<>();
        for (TraceEvent e : r.getEvents()) messages.add(e.message());

        assertTrue(messages.contains("Starting range loop from 1 to 3"));
        assertTrue(messages.contains("Loop #2: i = 2"));
        assertTrue(messages.contains("Starting an enumerate loop over ['a', 'b']"));
        assertTrue(messages.contains("Loop #2: i = 1, name = 'b'"));
    }

    @Test
    void returnFromInsideLoopAndDecide_stillClosesEveryBlock() {
        ExecutionResult r = ts.run("""
                objective "search"
                task "T":
                    subtask "First Big":
                        for x in xs:
                            decide:
                                if x > 2:
                                    return x
                        end
                        return None
                    step "s":
                        xs = [1, 3, 5]
                        big = first_big()
                run "T"
                """, ExecutionOptions.explain("default"));

        List<TraceEvent> events = r.getEvents();
        Deque<TraceEvent> open = new ArrayDeque<>();
        for (TraceEvent e : events) {
            if (e.kind().opensBlock()) {
                open.push(e);
            } else if (e.kind().closesBlock()) {
                TraceEvent start = open.pop();
                String block = start.kind().name().replace("_START", "");
                assertEquals(block + "_END", e.kind().name(), "closing " + start);
                assertEquals(start.depth(), e.depth(), "closing " + start);
            }
        }
        assertTrue(open.isEmpty(), "unclosed: " + open);

        assertTrue(r.getTrace().orElseThrow().contains("Loop finished after 2 iterations"));
        assertEquals(3L, r.getVariable("T", "big").asInt());
    }

    @Test
    void multilineOutput_keepsTheEventIndentOnEveryLine() {
        ExecutionResult r = ts.run("""
                objective "lines"
                task "T":
                    step "s":
                        print("a\\nb")
                run "T"
                """, ExecutionOptions.explain("default"));

        String trace = r.getTrace().orElseThrow();
        assertTrue(trace.contains("      [OUTPUT] a\n      b"), trace);
        assertEquals("a\nb", r.getProgramOutput());

        for (TraceStyle style : TraceStyle.values()) {
            for (TraceEvent e : r.getEvents()) {
                String indent = TraceFormatter.indent(e.depth());
                String entry = TraceFormatter.entries(List.of(e), style).get(0);
                for (String line : entry.split("\n")) {
                    assertTrue(line.startsWith(indent), style + ": " + line);
                }
            }
        }
    }

    @Test
    void extraSinks_receiveEventsWithoutExplain() {
        TraceCollector collector = new TraceCollector();
        ExecutionResult r = ts.run(GRADES, ExecutionOptions.defaults().addTraceSink(collector));

        assertTrue(r.getTrace().isEmpty());
        assertEquals(14, collector.events().size());
    }

    @Test
    void logSink_forwardsToDebugHub() {
        List<String> logged = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> {
            if (level == DebugLevel.INFO && tag.equals("think.trace")) logged.add(message);
        });

        ts.run(GRADES, ExecutionOptions.defaults().addTraceSink(new TraceLogSink()));

        assertEquals(14, logged.size());
        assertEquals("  Executing Grades", logged.get(1));
    }

    @Test
    void styleNames_areCaseInsensitive() {
        assertEquals(TraceStyle.MARKDOWN, TraceStyle.fromName("Markdown"));
        assertEquals(TraceStyle.DEFAULT, TraceStyle.fromName(null));
        assertThrows(IllegalArgumentException.class, () -> TraceStyle.fromName("fancy"));
    }
}
