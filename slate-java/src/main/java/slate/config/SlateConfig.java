package slate.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import slate.emit.EmitConfig;
import slate.rewrite.EngineLimits;
import slate.rewrite.RuleRegistry;

import java.util.List;

/**
 * Everything a run can be configured with. Read by {@link ConfigLoader}; missing keys take the
 * values of {@code slate-defaults.json}.
 */
public record SlateConfig(
        @JsonProperty("minPasses") int minPasses,
        @JsonProperty("maxPassesPerNode") int maxPassesPerNode,
        @JsonProperty("maxExponent") int maxExponent,
        @JsonProperty("maxResultBits") int maxResultBits,
        @JsonProperty("typeset") Toggle typeset,
        @JsonProperty("lint") Toggle lint,
        @JsonProperty("rules") Rules rules
) {

    public record Toggle(@JsonProperty("enabled") boolean enabled) {}

    public record Rules(
            @JsonProperty("denylist") List<String> denylist,
            @JsonProperty("custom") List<RuleSpec> custom
    ) {
        public Rules {
            denylist = denylist == null ? List.of() : List.copyOf(denylist);
            custom = custom == null ? List.of() : List.copyOf(custom);
        }
    }

    public SlateConfig {
        if (typeset == null) typeset = new Toggle(true);
        if (lint == null) lint = new Toggle(true);
        if (rules == null) rules = new Rules(List.of(), List.of());
    }

    public EngineLimits limits() {
        try {
            return new EngineLimits(minPasses, maxPassesPerNode, maxExponent, maxResultBits);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid engine limits: " + e.getMessage(), e);
        }
    }

    public EmitConfig emitConfig() {
        return new EmitConfig(false, typeset.enabled());
    }

    /** Builds the registry: built-ins minus the denylist, then custom rules in order. */
    public RuleRegistry registry() {
        RuleRegistry.Builder b = RuleRegistry.builder();
        rules.denylist().forEach(b::deny);
        for (RuleSpec r : rules.custom()) b.add(r.name(), r.rule(), r.when());
        return b.build();
    }

    /** A copy with {@code extra} appended to the custom rules. */
    public SlateConfig withCustomRules(List<RuleSpec> extra) {
        List<RuleSpec> all = ImmutableList.<RuleSpec>builder().addAll(rules.custom()).addAll(extra).build();
        return new SlateConfig(minPasses, maxPassesPerNode, maxExponent, maxResultBits, typeset, lint,
                new Rules(rules.denylist(), all));
    }
}
