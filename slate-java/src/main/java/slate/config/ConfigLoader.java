package slate.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads {@link SlateConfig} and rule files. A configuration document only needs the keys it
 * changes; it is merged over the bundled defaults before binding.
 */
public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    static final String DEFAULTS_RESOURCE = "/slate-defaults.json";

    private final ObjectMapper objectMapper = new ObjectMapper();

    public SlateConfig defaults() {
        return bind(defaultsTree());
    }

    public SlateConfig load(Path path) {
        log.debug("Loading configuration from {}", path);
        return parse(read(path), path.toString());
    }

    public SlateConfig parse(String json) {
        return parse(json, "<inline>");
    }

    /**
     * Reads a rule file: a JSON array of {@code {name, rule, when}} objects.
     */
    public List<RuleSpec> loadRules(Path path) {
        log.debug("Loading rules from {}", path);
        return parseRules(read(path), path.toString());
    }

    public List<RuleSpec> parseRules(String json, String origin) {
        try {
            return objectMapper.readValue(json,
                    objectMapper.getTypeFactory().constructCollectionType(List.class, RuleSpec.class));
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid rule file " + origin + ": " + rootMessage(e), e);
        }
    }

    // ================= helpers =================

    private SlateConfig parse(String json, String origin) {
        JsonNode overrides;
        try {
            overrides = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid configuration " + origin + ": " + rootMessage(e), e);
        }
        if (overrides == null || overrides.isMissingNode()) return defaults();
        if (!overrides.isObject()) {
            throw new ConfigurationException("Configuration " + origin + " must be a JSON object");
        }
        ObjectNode merged = defaultsTree();
        merge(merged, (ObjectNode) overrides);
        return bind(merged);
    }

    private SlateConfig bind(JsonNode tree) {
        try {
            return objectMapper.treeToValue(tree, SlateConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid configuration: " + rootMessage(e), e);
        }
    }

    private ObjectNode defaultsTree() {
        try (InputStream in = ConfigLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) throw new ConfigurationException("Missing resource " + DEFAULTS_RESOURCE);
            return (ObjectNode) objectMapper.readTree(in);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + DEFAULTS_RESOURCE, e);
        }
    }

    /** Objects merge key by key; any other value replaces the default. */
    private static void merge(ObjectNode target, ObjectNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            JsonNode existing = target.get(f.getKey());
            if (existing instanceof ObjectNode t && f.getValue() instanceof ObjectNode s) {
                merge(t, s);
            } else {
                target.set(f.getKey(), f.getValue());
            }
        }
    }

    private static String read(Path path) {
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    private static String rootMessage(Throwable e) {
        Throwable t = e;
        while (t.getCause() != null && t.getCause() != t) t = t.getCause();
        if (t instanceof ConfigurationException) return t.getMessage();
        return e instanceof JsonProcessingException j ? j.getOriginalMessage() : e.getMessage();
    }
}
