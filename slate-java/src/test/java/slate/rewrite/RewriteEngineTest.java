package slate.rewrite;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import slate.ast.expr.Expr;
import slate.ast.expr.Num;
import slate.diag.Diagnostics;
import slate.emit.PrettyEmitter;
import slate.parser.Parser;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static slate.ast.expr.Exprs.*;

public class RewriteEngineTest {

    private static final RewriteEngine ENGINE = new RewriteEngine(RuleRegistry.defaults());
    private static final PrettyEmitter PRETTY = new PrettyEmitter();

    private static Expr parse(String src) {
        var diags = new Diagnostics();
        var p = Parser.parse(src, diags);
        assertFalse(diags.hasErrors(), () -> "parse errors: " + diags.all());
        return p.statements().get(0).expr();
    }

    private static String simplify(String src) {
        return PRETTY.emit(ENGINE.simplify(parse(src)).expr());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "1 + 2                     | 3",
            "x + 1 + 2                 | x + 3",
            "x(x + 2*3) / (x + 6)      | x",
            "b + a                     | a + b",
            "a + b                     | a + b",
            "x + x                     | x * 2",
            "2x - x                    | x",
            "x - x                     | 0",
            "x / x                     | 1",
            "3 - x                     | -x + 3",
            "-(-x)                     | x",
            "x * x * x                 | x ^ 3",
            "x ^ 2 * x ^ -2            | 1",
            "b * a * a                 | a ^ 2 * b",
            "0.1 + 0.2                 | 3 / 10",
            "1/3 + 1/6                 | 1 / 2",
            "2 ^ 10                    | 1024",
            "2 ^ -2                    | 1 / 4",
            "x / 2 + x / 2             | x",
            "6x / 4                    | x * 3 / 2",
            "-2x / 4                   | -(x / 2)",
            "0 * y                     | 0",
            "1 ^ y                     | 1",
            "(x ^ 2) ^ 3               | x ^ 6",
            "(x * y) ^ 2               | x ^ 2 * y ^ 2",
            "(2x) ^ 2                  | x ^ 2 * 4",
            "(-x) ^ 2                  | x ^ 2",
            "(-x) ^ 3                  | -(x ^ 3)",
            "x ^ y * x                 | x ^ (y + 1)",
            "2 ^ (1/2) * 2 ^ (1/2)     | 2",
    })
    void simplifies_to_canonical_form(String input, String expected) {
        assertEquals(expected, simplify(input));
    }

    @Test
    void simplification_is_idempotent() {
        for (String src : new String[]{"x(x + 2*3) / (x + 6)", "3 - x + y / 2", "(a + b) ^ 2 / c", "x / 0 + 1"}) {
            Expr once = ENGINE.simplify(parse(src)).expr();
            Simplification twice = ENGINE.simplify(once);
            assertEquals(once, twice.expr(), src);
            assertEquals(1, twice.passes(), src);
        }
    }

    @Test
    void commutative_inputs_converge() {
        assertEquals(ENGINE.simplify(parse("x * y + 2")).expr(), ENGINE.simplify(parse("2 + y * x")).expr());
        assertEquals(ENGINE.simplify(parse("a + b + c")).expr(), ENGINE.simplify(parse("c + (b + a)")).expr());
    }

    @Test
    void pretty_output_round_trips() {
        for (String src : new String[]{"x / 2 + 1 / 3", "3 - x", "-2x / 4", "(a + b) ^ 2 / c", "x ^ -1", "(x - y) * (x + y)"}) {
            Expr simplified = ENGINE.simplify(parse(src)).expr();
            Expr again = ENGINE.simplify(parse(PRETTY.emit(simplified))).expr();
            assertEquals(simplified, again, src);
        }
    }

    @Test
    void division_by_literal_zero_is_reported_and_kept() {
        Simplification s = ENGINE.simplify(parse("x / 0"));
        assertEquals(div(var("x"), num(0)), s.expr());
        assertTrue(s.hasIssue(RewriteIssue.Kind.DIVISION_BY_ZERO));
        assertEquals(1, s.issues().size());
        assertTrue(s.converged());
    }

    @Test
    void zero_to_a_negative_power_is_division_by_zero() {
        Simplification s = ENGINE.simplify(parse("(2 - 2) ^ -1"));
        assertTrue(s.hasIssue(RewriteIssue.Kind.DIVISION_BY_ZERO));
        assertEquals(pow(num(0), num(-1)), s.expr());
    }

    @Test
    void division_by_non_literal_is_left_alone() {
        Simplification s = ENGINE.simplify(parse("1 / y"));
        assertEquals(div(num(1), var("y")), s.expr());
        assertTrue(s.issues().isEmpty());
    }

    @Test
    void cycling_rules_stop_with_a_warning() {
        var registry = RuleRegistry.builder().add("swap", "_a ^ _b -> _b ^ _a").build();
        var engine = new RewriteEngine(registry);
        Simplification s = engine.simplify(parse("x ^ y"));
        assertFalse(s.converged());
        assertTrue(s.hasIssue(RewriteIssue.Kind.NOT_CONVERGED));
        assertTrue(s.passes() <= engine.limits().passLimit(3));
    }

    @Test
    void growing_rules_hit_the_pass_limit() {
        var registry = RuleRegistry.builder().add("grow", "$a -> $a + 1").build();
        var limits = new EngineLimits(5, 1, 64, 1024);
        Simplification s = new RewriteEngine(registry, limits).simplify(var("x"));
        assertFalse(s.converged());
        assertEquals(5, s.passes());
    }

    @Test
    void non_convergence_is_reported_as_an_issue_only() {
        var registry = RuleRegistry.builder().add("grow", "$a -> $a + 1").build();
        var engine = new RewriteEngine(registry, new EngineLimits(5, 1, 64, 1024));
        PrintStream saved = System.err;
        var captured = new ByteArrayOutputStream();
        System.setErr(new PrintStream(captured, true, StandardCharsets.UTF_8));
        try {
            assertTrue(engine.simplify(var("x")).hasIssue(RewriteIssue.Kind.NOT_CONVERGED));
        } finally {
            System.setErr(saved);
        }
        assertEquals("", captured.toString(StandardCharsets.UTF_8));
    }

    @Test
    void huge_exponents_are_not_folded() {
        var engine = new RewriteEngine(RuleRegistry.defaults(), new EngineLimits(16, 4, 10, 1024));
        assertEquals(pow(num(2), num(11)), engine.simplify(pow(num(2), num(11))).expr());
        assertEquals(num(1024), engine.simplify(pow(num(2), num(10))).expr());
    }

    @Test
    void nested_literal_powers_stay_unfolded_past_the_bit_budget() {
        Simplification s = ENGINE.simplify(parse("((2^4096)^4096)^4096"));
        assertTrue(s.converged());
        assertTrue(s.issues().isEmpty());
        assertFalse(s.expr() instanceof Num);
        assertEquals(s.expr(), ENGINE.simplify(s.expr()).expr());

        var tight = new RewriteEngine(RuleRegistry.defaults(), new EngineLimits(16, 4, 4096, 16));
        assertEquals(pow(num(2), num(20)), tight.simplify(parse("2 ^ 20")).expr());
        assertEquals(num(256), tight.simplify(parse("2 ^ 8")).expr());
    }

    @Test
    void denying_fold_constants_keeps_literal_powers() {
        var registry = RuleRegistry.builder().deny(BuiltinRule.FOLD_CONSTANTS).build();
        assertFalse(registry.foldsConstants());
        // sums are still combined by canonicalization
        assertEquals(num(3), new RewriteEngine(registry).simplify(parse("1 + 2")).expr());
    }

    @Test
    void custom_rule_with_condition() {
        var registry = RuleRegistry.builder()
                .add("halve", "#a * _b -> _b", List.of("even #a"))
                .build();
        var engine = new RewriteEngine(registry);
        assertEquals(var("x"), engine.simplify(parse("4x")).expr());
        assertEquals(mul(var("x"), num(3)), engine.simplify(parse("3x")).expr());
    }
}
