package slate.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One user rule as written in configuration:
 * <pre>
 * { "name": "cancel", "rule": "_a / _a -> 1", "when": ["nonzero _a"] }
 * </pre>
 */
public record RuleSpec(
        @JsonProperty("name") String name,
        @JsonProperty("rule") String rule,
        @JsonProperty("when") List<String> when
) {

    public RuleSpec {
        if (name == null || name.isBlank()) throw new ConfigurationException("Rule without a name: " + rule);
        if (rule == null || rule.isBlank()) throw new ConfigurationException("Rule \"" + name + "\" has no \"rule\"");
        when = when == null ? List.of() : List.copyOf(when);
    }
}
