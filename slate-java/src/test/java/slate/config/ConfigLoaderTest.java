package slate.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import slate.rewrite.BuiltinRule;
import slate.rewrite.RuleConfigurationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigLoaderTest {

    private final ConfigLoader loader = new ConfigLoader();

    @Test
    void defaults_come_from_the_bundled_resource() {
        SlateConfig c = loader.defaults();
        assertEquals(16, c.minPasses());
        assertEquals(4, c.maxPassesPerNode());
        assertEquals(65536, c.limits().maxResultBits());
        assertTrue(c.typeset().enabled());
        assertTrue(c.lint().enabled());
        assertTrue(c.rules().custom().isEmpty());
        assertEquals(16, c.limits().minPasses());
    }

    @Test
    void overrides_merge_over_defaults() {
        SlateConfig c = loader.parse("""
                { "maxPassesPerNode": 8, "lint": { "enabled": false },
                  "rules": { "denylist": ["one_base"] } }
                """);
        assertEquals(8, c.maxPassesPerNode());
        assertEquals(16, c.minPasses());
        assertFalse(c.lint().enabled());
        assertTrue(c.typeset().enabled());
        assertFalse(c.registry().rules().contains(BuiltinRule.ONE_BASE));
    }

    @Test
    void custom_rules_build_into_the_registry() {
        SlateConfig c = loader.parse("""
                { "rules": { "custom": [
                    { "name": "cancel", "rule": "_a / _a -> 1", "when": ["nonzero _a"] }
                ] } }
                """);
        var last = c.registry().rules().get(c.registry().rules().size() - 1);
        assertEquals("cancel", last.name());
    }

    @Test
    void invalid_custom_rule_fails_when_the_registry_is_built() {
        SlateConfig c = loader.parse("""
                { "rules": { "custom": [ { "name": "bad", "rule": "_a -> _b" } ] } }
                """);
        assertThrows(RuleConfigurationException.class, c::registry);
    }

    @Test
    void malformed_configuration_is_a_configuration_error() {
        assertThrows(ConfigurationException.class, () -> loader.parse("{ not json"));
        assertThrows(ConfigurationException.class, () -> loader.parse("[1, 2]"));
        assertThrows(ConfigurationException.class, () -> loader.parse("{ \"unknownKey\": 1 }"));
        var ex = assertThrows(ConfigurationException.class,
                () -> loader.parse("{ \"rules\": { \"custom\": [ { \"rule\": \"_a -> _a\" } ] } }"));
        assertTrue(ex.getMessage().contains("without a name"), ex.getMessage());
    }

    @Test
    void invalid_limits_are_a_configuration_error() {
        SlateConfig c = loader.parse("{ \"minPasses\": 0 }");
        assertThrows(ConfigurationException.class, c::limits);
        assertThrows(ConfigurationException.class, () -> loader.parse("{ \"maxResultBits\": -1 }").limits());
    }

    @Test
    void load_configuration_and_rules_from_files(@TempDir Path dir) throws IOException {
        Path config = dir.resolve("slate.json");
        Files.writeString(config, "{ \"typeset\": { \"enabled\": false } }");
        assertFalse(loader.load(config).typeset().enabled());

        Path rules = dir.resolve("rules.json");
        Files.writeString(rules, """
                [ { "name": "r1", "rule": "_a - _a -> 0" },
                  { "name": "r2", "rule": "#a * $b -> $b", "when": ["positive #a"] } ]
                """);
        var specs = loader.loadRules(rules);
        assertEquals(2, specs.size());
        assertEquals(List.of("positive #a"), specs.get(1).when());
        assertTrue(specs.get(0).when().isEmpty());

        SlateConfig merged = loader.defaults().withCustomRules(specs);
        assertEquals(2, merged.rules().custom().size());
    }

    @Test
    void missing_file_is_a_configuration_error(@TempDir Path dir) {
        assertThrows(ConfigurationException.class, () -> loader.load(dir.resolve("absent.json")));
    }
}
