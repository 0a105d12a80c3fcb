package slate.rewrite;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import slate.ast.expr.Expr;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * The ordered, immutable set of rules one engine applies. Built-in rules come first, in
 * declaration order, followed by user rules in the order they were added.
 */
public final class RuleRegistry {
    private static final Logger log = LoggerFactory.getLogger(RuleRegistry.class);

    private final ImmutableList<RewriteRule> rules;
    private final boolean foldConstants;

    private RuleRegistry(List<RewriteRule> rules, boolean foldConstants) {
        this.rules = ImmutableList.copyOf(rules);
        this.foldConstants = foldConstants;
    }

    public static RuleRegistry defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Rules tried at each node after canonicalization and folding. */
    public List<RewriteRule> rules() {
        return rules;
    }

    public boolean foldsConstants() {
        return foldConstants;
    }

    /** The replacement produced by the first rule that applies to {@code node}, if any. */
    public Optional<Expr> applyFirst(Expr node) {
        for (RewriteRule rule : rules) {
            Optional<Bindings> match = rule.matches(node);
            if (match.isPresent()) {
                Expr out = rule.apply(match.get());
                if (log.isTraceEnabled()) log.trace("{}: {} -> {}", rule.name(), node, out);
                return Optional.of(out);
            }
        }
        return Optional.empty();
    }

    public static final class Builder {
        private final Set<BuiltinRule> denied = EnumSet.noneOf(BuiltinRule.class);
        private final List<PendingRule> custom = new ArrayList<>();
        private final List<String> problems = new ArrayList<>();

        private record PendingRule(String name, String rule, List<String> when) {}

        private Builder() {}

        /** Removes a built-in rule, named as in {@link BuiltinRule}; case-insensitive. */
        public Builder deny(String builtin) {
            try {
                denied.add(BuiltinRule.valueOf(builtin.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                problems.add("Unknown built-in rule \"" + builtin + "\" in denylist");
            }
            return this;
        }

        public Builder deny(BuiltinRule builtin) {
            denied.add(builtin);
            return this;
        }

        public Builder add(String name, String rule, List<String> when) {
            custom.add(new PendingRule(name, rule, List.copyOf(when)));
            return this;
        }

        public Builder add(String name, String rule) {
            return add(name, rule, List.of());
        }

        /** Validates every rule; all problems are reported together. */
        public RuleRegistry build() {
            List<String> errors = new ArrayList<>(problems);
            List<RewriteRule> rules = new ArrayList<>();
            Set<String> names = new HashSet<>();

            for (BuiltinRule b : BuiltinRule.values()) {
                if (b == BuiltinRule.FOLD_CONSTANTS || denied.contains(b)) continue;
                rules.add(b);
                names.add(b.name());
            }
            for (PendingRule p : custom) {
                if (!names.add(p.name())) {
                    errors.add("Duplicate rule name \"" + p.name() + "\"");
                    continue;
                }
                try {
                    rules.add(PatternRule.parse(p.name(), p.rule(), p.when()));
                } catch (RuleConfigurationException e) {
                    errors.addAll(e.problems());
                }
            }
            if (!errors.isEmpty()) throw new RuleConfigurationException(errors);

            boolean fold = !denied.contains(BuiltinRule.FOLD_CONSTANTS);
            log.debug("Built rule registry: {} rules ({} custom), constant folding {}",
                    rules.size(), custom.size(), fold ? "on" : "off");
            return new RuleRegistry(rules, fold);
        }
    }
}
