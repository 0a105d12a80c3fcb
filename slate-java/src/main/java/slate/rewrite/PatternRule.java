package slate.rewrite;

import com.google.common.collect.ImmutableList;
import slate.ast.expr.Expr;
import slate.ast.expr.Exprs;
import slate.ast.expr.Num;
import slate.ast.expr.UnaryExpr;
import slate.diag.Diagnostic;
import slate.diag.Diagnostics;
import slate.parser.Parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A rule written as text, e.g. {@code _a / _a -> 1} guarded by {@code nonzero _a}.
 */
public final class PatternRule implements RewriteRule {

    private final String name;
    private final String source;
    private final Expr pattern;
    private final Expr replacement;
    private final List<SideCondition> conditions;

    private PatternRule(String name, String source, Expr pattern, Expr replacement, List<SideCondition> conditions) {
        this.name = name;
        this.source = source;
        this.pattern = pattern;
        this.replacement = replacement;
        this.conditions = ImmutableList.copyOf(conditions);
    }

    public static PatternRule parse(String name, String rule) {
        return parse(name, rule, List.of());
    }

    /**
     * Parses and validates a rule. Every problem found is collected into one
     * {@link RuleConfigurationException}.
     */
    public static PatternRule parse(String name, String rule, List<String> when) {
        List<String> problems = new ArrayList<>();
        String[] sides = rule.split("->", -1);
        if (sides.length != 2) {
            throw new RuleConfigurationException("Rule \"" + name + "\": expected \"<pattern> -> <replacement>\", got \"" + rule + "\"");
        }

        Expr lhs = template(name, "pattern", sides[0], problems);
        Expr rhs = template(name, "replacement", sides[1], problems);

        List<SideCondition> conditions = new ArrayList<>();
        for (String w : when) {
            try {
                conditions.add(SideCondition.parse(w));
            } catch (RuleConfigurationException e) {
                problems.add("Rule \"" + name + "\": " + e.problems().get(0));
            }
        }

        if (lhs != null) {
            Set<String> bound = Exprs.patternVariables(lhs);
            if (rhs != null) {
                for (String used : Exprs.patternVariables(rhs)) {
                    if (!bound.contains(used)) {
                        problems.add("Rule \"" + name + "\": replacement uses " + used + ", which the pattern does not bind");
                    }
                }
            }
            for (SideCondition c : conditions) {
                if (!bound.contains(c.pattern())) {
                    problems.add("Rule \"" + name + "\": condition \"" + c + "\" refers to " + c.pattern()
                            + ", which the pattern does not bind");
                }
            }
        }

        if (!problems.isEmpty()) throw new RuleConfigurationException(problems);
        return new PatternRule(name, rule.trim(), lhs, rhs, conditions);
    }

    private static Expr template(String name, String side, String text, List<String> problems) {
        Diagnostics diags = new Diagnostics();
        Optional<Expr> parsed = Parser.parsePattern(text, diags);
        for (Diagnostic d : diags.all()) {
            problems.add("Rule \"" + name + "\": " + side + " \"" + text.trim() + "\": " + d.title() + " (" + d.message() + ")");
        }
        if (parsed.isEmpty()) {
            if (diags.isEmpty()) problems.add("Rule \"" + name + "\": empty " + side);
            return null;
        }
        return normalize(Exprs.stripParens(parsed.get()));
    }

    /** Negated literals in a template match the folded literal. */
    private static Expr normalize(Expr e) {
        Expr mapped = Exprs.mapChildren(e, PatternRule::normalize);
        if (mapped instanceof UnaryExpr u && u.operand() instanceof Num n) {
            return new Num(n.value().negate());
        }
        return mapped;
    }

    @Override
    public String name() {
        return name;
    }

    public String source() {
        return source;
    }

    public Expr pattern() {
        return pattern;
    }

    public Expr replacement() {
        return replacement;
    }

    public List<SideCondition> conditions() {
        return conditions;
    }

    @Override
    public Optional<Bindings> matches(Expr node) {
        return PatternMatcher.match(pattern, node)
                .filter(b -> conditions.stream().allMatch(c -> c.test(b)));
    }

    @Override
    public Expr apply(Bindings bindings) {
        return PatternMatcher.instantiate(replacement, bindings);
    }

    @Override
    public String toString() {
        return name + ": " + source + (conditions.isEmpty() ? "" : " when " + conditions);
    }
}
