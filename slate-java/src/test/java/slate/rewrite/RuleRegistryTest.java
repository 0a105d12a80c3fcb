package slate.rewrite;

import org.junit.jupiter.api.Test;
import slate.ast.expr.Expr;
import slate.diag.Diagnostics;
import slate.parser.Parser;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static slate.ast.expr.Exprs.*;

public class RuleRegistryTest {

    private static Expr pattern(String src) {
        return Parser.parsePattern(src, new Diagnostics()).orElseThrow();
    }

    @Test
    void defaults_contain_every_builtin_but_folding_in_order() {
        var registry = RuleRegistry.defaults();
        assertTrue(registry.foldsConstants());
        assertEquals(BuiltinRule.values().length - 1, registry.rules().size());
        assertEquals(BuiltinRule.EXPONENT_IDENTITY, registry.rules().get(0));
    }

    @Test
    void denylist_removes_builtins_case_insensitively() {
        var registry = RuleRegistry.builder().deny("one_base").deny(BuiltinRule.ZERO_EXPONENT).build();
        assertFalse(registry.rules().contains(BuiltinRule.ONE_BASE));
        assertFalse(registry.rules().contains(BuiltinRule.ZERO_EXPONENT));
        assertTrue(registry.applyFirst(pow(num(1), var("y"))).isEmpty());
    }

    @Test
    void custom_rules_follow_builtins() {
        var registry = RuleRegistry.builder().add("double", "_a + _a -> 2 * _a").build();
        var last = registry.rules().get(registry.rules().size() - 1);
        assertEquals("double", last.name());
        assertTrue(last instanceof PatternRule);
    }

    @Test
    void replacement_using_unbound_pattern_is_rejected() {
        var ex = assertThrows(RuleConfigurationException.class,
                () -> RuleRegistry.builder().add("bad", "_a + 1 -> _b").build());
        assertEquals(1, ex.problems().size());
        assertTrue(ex.problems().get(0).contains("_b"));
    }

    @Test
    void every_problem_is_collected() {
        var ex = assertThrows(RuleConfigurationException.class, () -> RuleRegistry.builder()
                .deny("no_such_rule")
                .add("no-arrow", "_a + 1")
                .add("plain-variable", "x + _a -> _a")
                .add("unknown-condition", "_a -> _a", List.of("prime _a"))
                .add("condition-on-unbound", "_a -> _a", List.of("nonzero _c"))
                .build());
        assertEquals(5, ex.problems().size());
        assertTrue(ex.getMessage().startsWith("Failed to build rules with 5 errors."));
    }

    @Test
    void duplicate_names_are_rejected() {
        assertThrows(RuleConfigurationException.class, () -> RuleRegistry.builder()
                .add("r", "_a -> _a")
                .add("r", "_b -> _b")
                .build());
        assertThrows(RuleConfigurationException.class, () -> RuleRegistry.builder()
                .add("ONE_BASE", "_a -> _a")
                .build());
    }

    @Test
    void pattern_matching_respects_kinds() {
        assertTrue(PatternMatcher.match(pattern("$a"), var("x")).isPresent());
        assertTrue(PatternMatcher.match(pattern("$a"), num(1)).isEmpty());
        assertTrue(PatternMatcher.match(pattern("#a"), num(1)).isPresent());
        assertTrue(PatternMatcher.match(pattern("#a"), var("x")).isEmpty());
        assertTrue(PatternMatcher.match(pattern("_a"), add(var("x"), num(1))).isPresent());
    }

    @Test
    void repeated_pattern_variable_must_bind_equal_expressions() {
        assertTrue(PatternMatcher.match(pattern("_a - _a"), sub(var("x"), var("x"))).isPresent());
        assertTrue(PatternMatcher.match(pattern("_a - _a"), sub(var("x"), var("y"))).isEmpty());
    }

    @Test
    void commutative_operators_match_either_order() {
        var b = PatternMatcher.match(pattern("#k * $v"), mul(var("x"), num(3))).orElseThrow();
        assertEquals(num(3), b.get("#k"));
        assertEquals(var("x"), b.get("$v"));
        assertTrue(PatternMatcher.match(pattern("#k / $v"), div(var("x"), num(3))).isEmpty());
    }

    @Test
    void instantiate_fills_in_bindings() {
        var b = PatternMatcher.match(pattern("_a ^ #n"), pow(var("x"), num(2))).orElseThrow();
        assertEquals(mul(num(2), pow(var("x"), num(1))),
                PatternMatcher.instantiate(pattern("#n * _a ^ 1"), b));
    }

    @Test
    void negative_literal_in_pattern_matches_folded_number() {
        var rule = PatternRule.parse("minus-one", "_a ^ -1 -> 1 / _a");
        assertEquals(div(num(1), var("x")), rule.rewrite(pow(var("x"), num(-1))).orElseThrow());
    }

    @Test
    void parsed_rule_keeps_its_parts() {
        var rule = PatternRule.parse("cancel", "_a / _a -> 1", List.of("nonzero _a"));
        assertEquals("_a / _a -> 1", rule.source());
        assertEquals(pattern("_a / _a"), rule.pattern());
        assertEquals(num(1), rule.replacement());
        assertEquals(List.of(SideCondition.parse("nonzero _a")), rule.conditions());
        assertEquals(num(1), rule.rewrite(div(num(3), num(3))).orElseThrow());
        assertTrue(rule.rewrite(div(var("x"), var("x"))).isEmpty());
    }

    @Test
    void side_conditions_only_hold_for_literals() {
        var nonzero = SideCondition.parse("nonzero _b");
        assertTrue(nonzero.test(Bindings.of("_b", num(2))));
        assertFalse(nonzero.test(Bindings.of("_b", num(0))));
        assertFalse(nonzero.test(Bindings.of("_b", var("y"))));

        assertTrue(SideCondition.parse("integer #n").test(Bindings.of("#n", num(4))));
        assertTrue(SideCondition.parse("positive #n").test(Bindings.of("#n", num(4))));
        assertFalse(SideCondition.parse("positive #n").test(Bindings.of("#n", num(-4))));
        assertTrue(SideCondition.parse("odd #n").test(Bindings.of("#n", num(-3))));
        assertTrue(SideCondition.parse("even #n").test(Bindings.of("#n", num(0))));
    }

    @Test
    void fold_constants_only_switches_the_folding_step() {
        assertTrue(BuiltinRule.FOLD_CONSTANTS.matches(pow(num(2), num(3))).isEmpty());
        assertThrows(IllegalStateException.class, () -> BuiltinRule.FOLD_CONSTANTS.apply(Bindings.EMPTY));
        assertFalse(RuleRegistry.defaults().rules().contains(BuiltinRule.FOLD_CONSTANTS));
        assertFalse(RuleRegistry.builder().deny("fold_constants").build().foldsConstants());
    }
}
