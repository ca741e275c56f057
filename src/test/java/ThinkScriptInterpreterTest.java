import org.junit.jupiter.api.Test;

import com.think.script.ExecutionOptions;
import com.think.script.ExecutionResult;
import com.think.script.ThinkScript;
import com.think.script.parser.Value;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ThinkScriptInterpreterTest {

    private final ThinkScript ts = new ThinkScript();

    /** Wraps statements into a one-step program and runs it. */
    private ExecutionResult runStep(String body) {
        StringBuilder sb = new StringBuilder();
        sb.append("objective \"test\"\n");
        sb.append("task \"T\":\n");
        sb.append("    step \"s\":\n");
        for (String line : body.split("\n")) {
            sb.append("        ").append(line).append('\n');
        }
        sb.append("run \"T\"\n");
        return ts.run(sb.toString());
    }

    private static Value v(ExecutionResult r, String name) {
        Value val = r.getVariable("T", name);
        assertNotNull(val, "Expected variable in task state: " + name);
        return val;
    }

    @Test
    void gradesScenario_printsAverage() {
        ExecutionResult r = ts.run("""
                objective "Calculate the class average"

                task "Grades":
                    subtask "Calculate Average":
                        total = sum(scores)
                        count = len(scores)
                        return total / count
                    step "Load scores":
                        scores = [80, 85, 90]
                    step "Report":
                        average = calculate_average()
                        print(average)

                run "Grades"
                """);

        assertEquals("85.0", r.getProgramOutput());
        assertEquals(85.0, r.getVariable("Grades", "average").asNumber(), 1e-9);
    }

    @Test
    void subtaskWritesAreVisibleToLaterSteps() {
        ExecutionResult r = ts.run("""
                objective "scope"
                task "T":
                    subtask "Prepare":
                        shared = "from subtask"
                        return None
                    step "First":
                        prepare()
                    step "Second":
                        print(shared)
                run "T"
                """);

        assertEquals("from subtask", r.getProgramOutput());
    }

    @Test
    void subtasksOnlyRunWhenCalled_andStepsRunInOrder() {
        ExecutionResult r = ts.run("""
                objective "order"
                task "T":
                    step "One":
                        print("one")
                    subtask "Never Called":
                        print("subtask")
                        return 0
                    step "Two":
                        print("two")
                run "T"
                """);

        assertEquals(List.of("one", "two"), r.getOutputLines());
    }

    @Test
    void eachRunGetsAFreshEnvironment() {
        ExecutionResult r = ts.run("""
                objective "isolation"
                task "A":
                    step "s":
                        x = 1
                task "B":
                    step "s":
                        y = 2
                run "A"
                run "B"
                """);

        assertNotNull(r.getVariable("A", "x"));
        assertNull(r.getVariable("B", "x"));
        assertEquals(2L, r.getVariable("B", "y").asInt());
    }

    @Test
    void variablesFromAnotherTask_areUndefined() {
        assertThrows(com.think.script.parser.ThinkRuntimeException.class, () -> ts.run("""
                objective "isolation"
                task "A":
                    step "s":
                        x = 1
                task "B":
                    step "s":
                        print(x)
                run "A"
                run "B"
                """));
    }

    @Test
    void decide_firstTrueBranchWins() {
        ExecutionResult r = runStep(String.join("\n",
                "score = 95",
                "decide:",
                "    if score >= 90 then:",
                "        grade = \"A\"",
                "    elif score >= 80:",
                "        grade = \"B\"",
                "    else:",
                "        grade = \"F\"",
                "print(grade)"));

        assertEquals("A", r.getProgramOutput());
    }

    @Test
    void decide_fallsToElse_andSkipsWithoutElse() {
        ExecutionResult r = runStep(String.join("\n",
                "x = 1",
                "decide:",
                "    if x > 5:",
                "        print(\"big\")",
                "    else:",
                "        print(\"small\")",
                "decide:",
                "    if x > 5:",
                "        print(\"never\")",
                "print(\"after\")"));

        assertEquals(List.of("small", "after"), r.getOutputLines());
    }

    @Test
    void arithmetic_intStaysIntDivisionIsFloat() {
        ExecutionResult r = runStep(String.join("\n",
                "a = 2 + 3 * 4",
                "b = (2 + 3) * 4",
                "c = 10 / 2",
                "d = 7 - 2.5",
                "e = -a",
                "print(a, b, c, d, e)"));

        assertEquals(Value.Type.INT, v(r, "a").getType());
        assertEquals(14L, v(r, "a").asInt());
        assertEquals(20L, v(r, "b").asInt());
        assertEquals(Value.Type.FLOAT, v(r, "c").getType());
        assertEquals("14 20 5.0 4.5 -14", r.getProgramOutput());
    }

    @Test
    void concatenation_stringsAndLists() {
        ExecutionResult r = runStep(String.join("\n",
                "s = \"think\" + \"script\"",
                "xs = [1, 2] + [3]",
                "print(s, xs)"));

        assertEquals("thinkscript [1, 2, 3]", r.getProgramOutput());
    }

    @Test
    void comparisonsAndLogic() {
        ExecutionResult r = runStep(String.join("\n",
                "a = 3 < 5",
                "b = \"apple\" < \"banana\"",
                "c = 2 == 2.0",
                "d = [1, [2]] == [1, [2]]",
                "e = not (a and False)",
                "f = 0 or \"\"",
                "g = {\"k\": 1} != {\"k\": 2}",
                "print(a, b, c, d, e, f, g)"));

        assertEquals("True True True True True False True", r.getProgramOutput());
    }

    @Test
    void logicalOperators_shortCircuit() {
        ExecutionResult r = runStep(String.join("\n",
                "a = False and undefined_name",
                "b = True or undefined_name",
                "print(a, b)"));

        assertEquals("False True", r.getProgramOutput());
    }

    @Test
    void indexing_listsWithNegativeIndicesAndDicts() {
        ExecutionResult r = runStep(String.join("\n",
                "xs = [10, 20, 30]",
                "person = {\"name\": \"Alice\", \"age\": 30}",
                "print(xs[0], xs[-1], person[\"name\"], [[1, 2], [3]][1][0])"));

        assertEquals("10 30 Alice 3", r.getProgramOutput());
    }

    @Test
    void forLoop_overListStringDictAndRange() {
        ExecutionResult r = runStep(String.join("\n",
                "total = 0",
                "for x in [1, 2, 3]:",
                "    total = total + x",
                "end",
                "letters = \"\"",
                "for ch in \"abc\":",
                "    letters = ch + letters",
                "end",
                "keys = []",
                "for k in {\"a\": 1, \"b\": 2}:",
                "    keys = keys + [k]",
                "end",
                "r = []",
                "for i in range(3):",
                "    r = r + [i]",
                "end",
                "for i in range(5, 7):",
                "    r = r + [i]",
                "end",
                "print(total, letters, keys, r)"));

        assertEquals("6 cba ['a', 'b'] [0, 1, 2, 5, 6]", r.getProgramOutput());
    }

    @Test
    void forLoop_enumerateBindsIndexAndValue() {
        ExecutionResult r = runStep(String.join("\n",
                "for i, name in enumerate([\"x\", \"y\"]):",
                "    print(i, name)",
                "end"));

        assertEquals(List.of("0 x", "1 y"), r.getOutputLines());
        assertEquals(1L, v(r, "i").asInt());
    }

    @Test
    void whileLoop_isPreTest() {
        ExecutionResult r = runStep(String.join("\n",
                "n = 3",
                "count = 0",
                "while n > 0:",
                "    n = n - 1",
                "    count = count + 1",
                "end",
                "while False:",
                "    count = 100",
                "end",
                "print(count)"));

        assertEquals("3", r.getProgramOutput());
    }

    @Test
    void builtins_sumLenMaxMinAndConversions() {
        ExecutionResult r = runStep(String.join("\n",
                "xs = [3, 1, 2]",
                "print(sum(xs), len(xs), max(xs), min(xs), max(4, 9, 2), len(\"hey\"), len({}))",
                "print(sum([1, 2.5]), str(5) + \"!\", int(\"42\"), int(3.9), float(2), abs(-3), round(2.5), round(3.14159, 2))",
                "print(range(3), enumerate([\"a\"]))"));

        assertEquals(List.of(
                "6 3 3 1 9 3 0",
                "3.5 5! 42 3 2.0 3 2 3.14",
                "[0, 1, 2] [[0, 'a']]"), r.getOutputLines());
    }

    @Test
    void printFormatsValuesInLanguageNotation() {
        ExecutionResult r = runStep(String.join("\n",
                "print(True, None, 3e-05, 2.0e5, [\"a\", 1.5], {\"name\": \"Alice\"})"));

        assertEquals("True None 3e-05 200000.0 ['a', 1.5] {'name': 'Alice'}", r.getProgramOutput());
    }

    @Test
    void subtaskWithoutReturn_yieldsNone() {
        ExecutionResult r = ts.run("""
                objective "none"
                task "T":
                    subtask "Greet":
                        print("hello")
                    step "s":
                        result = greet()
                        print(result)
                run "T"
                """);

        assertEquals(List.of("hello", "None"), r.getOutputLines());
    }

    @Test
    void returnInsideLoop_endsSubtaskImmediately() {
        ExecutionResult r = ts.run("""
                objective "search"
                task "T":
                    subtask "First Even":
                        for x in numbers:
                            decide:
                                if x / 2 == int(x / 2):
                                    return x
                        end
                        return None
                    step "s":
                        numbers = [3, 5, 8, 10]
                        print(first_even())
                run "T"
                """);

        assertEquals("8", r.getProgramOutput());
    }

    @Test
    void recursionThroughSharedScope_terminates() {
        ExecutionResult r = ts.run("""
                objective "countdown"
                task "T":
                    subtask "Count Down":
                        decide:
                            if n > 0:
                                n = n - 1
                                count_down()
                        return n
                    step "s":
                        n = 5
                        print(count_down())
                run "T"
                """);

        assertEquals("0", r.getProgramOutput());
    }

    @Test
    void outputListener_receivesEachLine() {
        List<String> seen = new ArrayList<>();
        ts.run("""
                objective "o"
                task "T":
                    step "s":
                        print("a")
                        print("b", 2)
                run "T"
                """, ExecutionOptions.defaults().setOutputListener(seen::add));

        assertEquals(List.of("a", "b 2"), seen);
    }

    @Test
    void taskStates_areReadOnlySnapshots() {
        ExecutionResult r = runStep("xs = [1, 2]");

        assertThrows(UnsupportedOperationException.class, () -> v(r, "xs").asList().add(Value.integer(3)));
    }

    @Test
    void explainOff_producesNoTrace() {
        ExecutionResult r = runStep("x = 1");

        assertTrue(r.getTrace().isEmpty());
        assertTrue(r.getEvents().isEmpty());
    }
}
