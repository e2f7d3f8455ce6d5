import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.uplc.decompiler.DecompilerCli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class UplcCliTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return DecompilerCli.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private Path write(String name, String content) throws Exception {
        Path p = dir.resolve(name);
        Files.writeString(p, content, StandardCharsets.UTF_8);
        return p;
    }

    @Test
    public void missing_argument_is_a_usage_error() {
        assertEquals(2, run());
        assertTrue(stderr().contains("Usage"));
    }

    @Test
    public void unknown_format_is_a_usage_error() throws Exception {
        Path p = write("m.uplc", "(program 1.0.0 (lam x (con unit ())))");
        assertEquals(2, run("--format=pdf", p.toString()));
    }

    @Test
    public void unknown_option_is_a_usage_error() throws Exception {
        Path p = write("m.uplc", "(program 1.0.0 (lam x (con unit ())))");

        assertEquals(2, run("--formt=json", p.toString()));
        assertTrue(stderr().contains("Unknown option: --formt"), stderr());
        assertEquals("", stdout());
    }

    @Test
    public void unreadable_file_exits_with_three() {
        assertEquals(3, run(dir.resolve("nope.uplc").toString()));
        assertTrue(stderr().contains("Failed to read input file"));
    }

    @Test
    public void source_is_printed_by_default() throws Exception {
        Path p = write("escrow.uplc", UplcPatternsTest.fixture("escrow.uplc"));

        assertEquals(0, run(p.toString()));
        assertTrue(stdout().contains("validator script {"), stdout());
        assertTrue(stdout().contains("when redeemer is {"), stdout());
    }

    @Test
    public void parse_errors_exit_with_one() throws Exception {
        Path p = write("bad.uplc", "(program 1.0.0 (lam x (var y)))");

        assertEquals(1, run(p.toString()));
        assertTrue(stderr().contains("Parse error"), stderr());
        assertTrue(stderr().contains("Unbound variable 'y'"), stderr());
    }

    @Test
    public void json_report_describes_the_structure() throws Exception {
        Path p = write("escrow.uplc", UplcPatternsTest.fixture("escrow.uplc"));

        assertEquals(0, run("--format=json", p.toString()));
        JsonNode report = new ObjectMapper().readTree(stdout());
        assertEquals("spend", report.get("purpose").asText());
        assertEquals(3, report.get("redeemer").get("variants").size());
        assertTrue(report.get("datum").get("used").asBoolean());
    }

    @Test
    public void decoded_json_input_is_converted() throws Exception {
        Path p = write("tree.json", "{\"type\":\"lam\",\"body\":{\"type\":\"con\",\"constType\":[3],\"value\":null}}");

        assertEquals(0, run("--format=text", p.toString()));
        assertEquals("(lam a (con unit ()))", stdout().trim());
    }

    @Test
    public void strict_mode_rejects_unrecognized_nodes() throws Exception {
        Path p = write("tree.json", "{\"type\":\"lam\",\"body\":{\"type\":\"teleport\"}}");

        assertEquals(1, run("--strict", p.toString()));
        assertTrue(stderr().contains("Conversion error"), stderr());
    }

    @Test
    public void diagnostic_mode_tolerates_unrecognized_nodes() throws Exception {
        Path p = write("tree.json", "{\"type\":\"lam\",\"body\":{\"type\":\"teleport\"}}");
        assertEquals(0, run(p.toString()));
    }

    @Test
    public void malformed_json_exits_with_one() throws Exception {
        Path p = write("tree.json", "{\"type\":");
        assertEquals(1, run(p.toString()));
        assertTrue(stderr().contains("Malformed decoded tree"), stderr());
    }

    @Test
    public void ir_format_prints_the_lowered_module() throws Exception {
        Path p = write("sum.uplc", "[(builtin addInteger) (con integer 2) (con integer 3)]");

        assertEquals(0, run("--format=ir", p.toString()));
        assertTrue(stdout().contains("return 5"), stdout());

        out.reset();
        assertEquals(0, run("--format=ir", "--no-fold", p.toString()));
        assertTrue(stdout().contains("(2 + 3)"), stdout());
    }
}
