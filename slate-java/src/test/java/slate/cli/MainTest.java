package slate.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return Main.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8).strip();
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void simplifies_a_program() {
        assertEquals(Main.OK, run("1 + 2"));
        assertEquals("3", out());
        assertEquals("", err());
    }

    @Test
    void output_forms() {
        assertEquals(Main.OK, run("-o", "s-expression", "x + 1 + 2"));
        assertEquals("(+ x 3)", out());

        out.reset();
        assertEquals(Main.OK, run("--output-form", "latex", "--frac", "x / 2"));
        assertEquals("\\frac{x}{2}", out());
    }

    @Test
    void errors_go_to_stderr_with_exit_one() {
        assertEquals(Main.ERRORS, run("4 -"));
        assertTrue(err().contains("error[P0002]"), err());
        assertTrue(err().contains("1 | 4 -"), err());
    }

    @Test
    void warnings_alone_exit_zero() {
        assertEquals(Main.OK, run("a := 1; a := 2"));
        assertEquals("a := 1\na := 2", out().replace("\r", ""));
        assertTrue(err().contains("warning[V0001]"), err());
    }

    @Test
    void parse_only_and_pattern_modes() {
        assertEquals(Main.OK, run("--parse-only", "1 + 2"));
        assertEquals("1 + 2", out());

        out.reset();
        assertEquals(Main.OK, run("--expr-pat", "$a * 1"));
        assertEquals("$a * 1", out());

        out.reset();
        assertEquals(Main.ERRORS, run("--expr-pat", "x + _a"));
        assertTrue(err().contains("P0005"), err());
    }

    @Test
    void explain_a_code() {
        assertEquals(Main.OK, run("--explain", "P0002"));
        assertTrue(out().startsWith("P0002: Expected an expression"), out());
        assertEquals(Main.USAGE, run("--explain", "Z9999"));
    }

    @Test
    void usage_errors() {
        assertEquals(Main.USAGE, run());
        assertEquals(Main.USAGE, run("--bogus", "1"));
        assertTrue(err().contains("unknown option --bogus"), err());
        assertEquals(Main.USAGE, run("-o", "html", "1"));
        assertEquals(Main.USAGE, run("1", "2"));
        assertEquals(Main.OK, run("--help"));
        assertTrue(out().startsWith("Usage: slate"));
    }

    @Test
    void program_after_double_dash() {
        assertEquals(Main.OK, run("--", "-x", "+", "x"));
        assertEquals("0", out());
    }

    @Test
    void reads_program_from_file(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("prog.slate");
        Files.writeString(file, "a := 2 * 2\na + 1\n");
        assertEquals(Main.OK, run("-f", file.toString()));
        assertEquals("a := 4\na + 1", out().replace("\r", ""));

        assertEquals(Main.ERRORS, run("-f", dir.resolve("missing.slate").toString()));
        assertTrue(err().contains("cannot read"));
    }

    @Test
    void configuration_and_rule_files(@TempDir Path dir) throws IOException {
        Path noTypeset = dir.resolve("slate.json");
        Files.writeString(noTypeset, "{ \"typeset\": { \"enabled\": false } }");
        assertEquals(Main.USAGE, run("--config", noTypeset.toString(), "-o", "latex", "1"));

        Path badRules = dir.resolve("rules.json");
        Files.writeString(badRules, "[ { \"name\": \"bad\", \"rule\": \"_a -> _b\" } ]");
        assertEquals(Main.ERRORS, run("--rules", badRules.toString(), "1"));
        assertTrue(err().contains("Failed to build rules"), err());

        Path badConfig = dir.resolve("broken.json");
        Files.writeString(badConfig, "{ \"minPasses\": ");
        assertEquals(Main.ERRORS, run("--config", badConfig.toString(), "1"));
    }
}
