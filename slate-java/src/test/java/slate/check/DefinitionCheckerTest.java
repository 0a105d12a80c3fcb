package slate.check;

import org.junit.jupiter.api.Test;
import slate.ast.Program;
import slate.diag.DiagnosticCode;
import slate.diag.Diagnostics;
import slate.math.Rational;
import slate.parser.Parser;
import slate.rewrite.RewriteEngine;
import slate.rewrite.RuleRegistry;

import static org.junit.jupiter.api.Assertions.*;

public class DefinitionCheckerTest {

    private static final DefinitionChecker CHECKER = new DefinitionChecker(new RewriteEngine(RuleRegistry.defaults()));

    private static DefinitionChecker.Result check(String src) {
        var diags = new Diagnostics();
        Program p = Parser.parse(src, diags);
        assertTrue(diags.isEmpty(), () -> "unexpected diagnostics: " + diags.all());
        return CHECKER.check(p);
    }

    @Test
    void different_concrete_values_are_incompatible() {
        var r = check("a := 1\na := 12 - 10");
        assertEquals(1, r.diagnostics().size());
        var d = r.diagnostics().get(0);
        assertEquals(DiagnosticCode.V0001, d.code());
        assertEquals(2, d.span().line());
        assertEquals(1, d.labels().get(0).span().line());
        assertTrue(d.message().contains("2"));
        assertTrue(d.labels().get(0).message().contains("1"));
    }

    @Test
    void equal_values_are_compatible() {
        assertTrue(check("a := 2\na := 4 / 2\na := 1 + 1").diagnostics().isEmpty());
    }

    @Test
    void partially_bound_definitions_are_never_flagged() {
        assertTrue(check("a := c\na := 2c").diagnostics().isEmpty());
        assertTrue(check("a := x + 1\na := 5").diagnostics().isEmpty());
    }

    @Test
    void later_values_propagate_back_to_earlier_definitions() {
        var r = check("a := c\na := 2c\nc := 1");
        assertEquals(1, r.diagnostics().size());
        assertEquals(DiagnosticCode.V0001, r.diagnostics().get(0).code());
        assertEquals(Rational.ONE, r.valueOf("a").orElseThrow());
        assertEquals(Rational.ONE, r.valueOf("c").orElseThrow());
    }

    @Test
    void values_propagate_through_chains() {
        var r = check("b := a + 1\nc := b * 2\na := 3");
        assertTrue(r.diagnostics().isEmpty());
        assertEquals(Rational.of(8), r.valueOf("c").orElseThrow());
        assertEquals(3, r.resolved().size());
    }

    @Test
    void each_later_conflict_is_reported_against_the_first() {
        var r = check("a := 1\na := 2\na := 3\na := 1");
        assertEquals(2, r.diagnostics().size());
    }

    @Test
    void reported_pairs_are_capped() {
        var src = new StringBuilder("a := 0\n");
        for (int i = 1; i <= DefinitionChecker.MAX_DEFINITION_PAIRS + 20; i++) {
            src.append("a := ").append(i).append('\n');
        }
        assertEquals(DefinitionChecker.MAX_DEFINITION_PAIRS, check(src.toString()).diagnostics().size());
    }

    @Test
    void slot_table_keeps_definitions_in_program_order() {
        var r = check("x := 1\ny := 2\nx := 3");
        assertEquals(2, r.slots().size());
        assertEquals("x", r.slots().name(0));
        assertEquals(2, r.slots().definitions("x").size());
        assertTrue(r.slots().definitions("z").isEmpty());
    }
}
