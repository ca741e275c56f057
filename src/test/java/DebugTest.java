import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.think.debug.Debug;
import com.think.debug.DebugLevel;
import com.think.script.ExecutionResult;
import com.think.script.ThinkScript;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DebugTest {

    @AfterEach
    void resetDebug() {
        Debug.get().setSink(null);
    }

    @Test
    void runWorksWithTheDefaultSink() {
        assertNotNull(Debug.get().getSink());

        ExecutionResult r = new ThinkScript().run("""
                objective "hello"
                task "T":
                    step "s":
                        print("hi")
                run "T"
                """);

        assertEquals("hi", r.getProgramOutput());
    }

    @Test
    void nullSinkRestoresNoop() {
        List<String> seen = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> seen.add(tag + ":" + message));
        Debug.get().w("think.test", "first");

        Debug.get().setSink(null);
        Debug.get().w("think.test", "second");
        Debug.get().log(DebugLevel.ERROR, "think.test", "third", new IllegalStateException());

        assertNotNull(Debug.get().getSink());
        assertEquals(List.of("think.test:first"), seen);
    }
}
