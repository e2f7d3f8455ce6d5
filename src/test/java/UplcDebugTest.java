import com.uplc.debug.Debug;
import com.uplc.debug.DebugLevel;
import com.uplc.decompiler.UplcDecompiler;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class UplcDebugTest {

    @Test
    public void default_sink_is_installed() {
        assertNotNull(Debug.get().getSink());
    }

    @Test
    public void pipeline_runs_with_the_default_sink() {
        Debug.get().setSink(null);
        assertNotNull(Debug.get().getSink());

        UplcDecompiler d = new UplcDecompiler();
        String out = d.generate(d.analyzeContract(d.parse("(lam r (con unit ()))")));
        assertTrue(out.contains("True"), out);
    }

    @Test
    public void installed_sink_receives_component_messages() {
        List<String> lines = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> lines.add(level + " " + tag + " " + message));
        try {
            UplcDecompiler d = new UplcDecompiler();
            d.analyzeContract(d.parse("(lam r (con unit ()))"));
        } finally {
            Debug.get().setSink(null);
        }

        assertTrue(lines.stream().anyMatch(l -> l.startsWith(DebugLevel.DEBUG + " Parser ")), lines.toString());
        assertTrue(lines.stream().anyMatch(l -> l.startsWith(DebugLevel.DEBUG + " Patterns ")), lines.toString());
    }
}
