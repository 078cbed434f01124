package com.rulewise.core.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rulewise.core.config.ConfigurationException;
import com.rulewise.core.model.Maturity;
import com.rulewise.core.model.RuleCategory;
import com.rulewise.core.model.RuleDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads the rule catalog JSON into a {@link RuleCatalog}.
 * <p>
 * Layout:
 * <pre>
 * {
 *   "base":       [ {rule}, ... ],
 *   "languages":  { "python": { "rules": [ {rule}, ... ] } },
 *   "frameworks": { "fastapi": { "language": "python", "rules": [ ... ] } },
 *   "cloud":      { "aws": { "rules": [ ... ] } }
 * }
 * </pre>
 * A rule is {@code {"name", "file", "topics"?, "maturity"?, "estimatedTokens"?}}.
 */
public class RuleCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleCatalogLoader.class);

    public static final String DEFAULT_RESOURCE = "rules-catalog.json";

    private static final String CONFIG_KEY = "rulewise.catalog.location";

    /** Name fragment → topic, used when a rule declares no topics. */
    private static final List<String> NAME_TOPICS = List.of(
            "security", "testing", "quality", "standards", "architecture", "performance", "api");

    private final ObjectMapper objectMapper;

    public RuleCatalogLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads from a filesystem path, or from the bundled classpath catalog when
     * {@code location} is blank.
     */
    public RuleCatalog load(String location) {
        if (location == null || location.isBlank()) {
            return loadResource(DEFAULT_RESOURCE);
        }
        Path file = Path.of(location);
        if (!Files.isReadable(file)) {
            throw new ConfigurationException("Rule catalog not readable: " + file, CONFIG_KEY);
        }
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in, file.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read rule catalog " + file + ": " + e.getMessage(), CONFIG_KEY, e);
        }
    }

    public RuleCatalog loadResource(String resource) {
        try (InputStream in = RuleCatalogLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Rule catalog resource not found: " + resource, CONFIG_KEY);
            }
            return parse(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read rule catalog " + resource + ": " + e.getMessage(), CONFIG_KEY, e);
        }
    }

    RuleCatalog parse(InputStream in, String source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed rule catalog " + source + ": " + e.getOriginalMessage(), CONFIG_KEY, e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read rule catalog " + source + ": " + e.getMessage(), CONFIG_KEY, e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Rule catalog " + source + " must be a JSON object", CONFIG_KEY);
        }

        var descriptors = new ArrayList<RuleDescriptor>();
        var seen = new HashSet<String>();

        for (JsonNode rule : array(root.get("base"), "base")) {
            add(descriptors, seen, toDescriptor(rule, RuleCategory.BASE, null, null, null));
        }
        forEachGroup(root.get("languages"), "languages", (key, group) -> {
            for (JsonNode rule : array(group.get("rules"), "languages." + key + ".rules")) {
                add(descriptors, seen, toDescriptor(rule, RuleCategory.LANGUAGE, key, null, null));
            }
        });
        forEachGroup(root.get("frameworks"), "frameworks", (key, group) -> {
            String language = text(group, "language");
            for (JsonNode rule : array(group.get("rules"), "frameworks." + key + ".rules")) {
                add(descriptors, seen, toDescriptor(rule, RuleCategory.FRAMEWORK, language, key, null));
            }
        });
        forEachGroup(root.get("cloud"), "cloud", (key, group) -> {
            for (JsonNode rule : array(group.get("rules"), "cloud." + key + ".rules")) {
                add(descriptors, seen, toDescriptor(rule, RuleCategory.CLOUD, null, null, key));
            }
        });

        log.info("Loaded {} rules from {}", descriptors.size(), source);
        return new RuleCatalog(descriptors);
    }

    private RuleDescriptor toDescriptor(JsonNode rule, RuleCategory category,
                                        String language, String framework, String cloud) {
        if (rule == null || !rule.isObject()) {
            throw new ConfigurationException("Rule entry must be an object in " + category + " rules", CONFIG_KEY);
        }
        String name = text(rule, "name");
        String file = text(rule, "file");
        if (file == null || file.isBlank()) {
            throw new ConfigurationException("Rule '" + name + "' has no file", CONFIG_KEY);
        }
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Rule " + file + " has no name", CONFIG_KEY);
        }

        Set<String> topics = new LinkedHashSet<>();
        JsonNode topicsNode = rule.get("topics");
        if (topicsNode != null && topicsNode.isArray() && !topicsNode.isEmpty()) {
            topicsNode.forEach(t -> topics.add(t.asText().trim().toLowerCase(Locale.ROOT)));
        } else {
            topics.addAll(topicsFromName(name));
        }

        int tokens;
        JsonNode tokensNode = rule.get("estimatedTokens");
        if (tokensNode != null && !tokensNode.isNull()) {
            if (!tokensNode.canConvertToInt()) {
                throw new ConfigurationException("Rule " + file + " has non-integer estimatedTokens", CONFIG_KEY);
            }
            tokens = tokensNode.asInt();
            if (tokens < 0) {
                throw new ConfigurationException("Rule " + file + " has negative estimatedTokens: " + tokens, CONFIG_KEY);
            }
        } else {
            tokens = estimateTokens(file);
        }

        return new RuleDescriptor(file, name, category, language, framework, cloud,
                topics, maturity(rule.get("maturity"), file), tokens);
    }

    private static void add(List<RuleDescriptor> descriptors, Set<String> seen, RuleDescriptor d) {
        if (!seen.add(d.path())) {
            throw new ConfigurationException("Duplicate rule path in catalog: " + d.path(), CONFIG_KEY);
        }
        descriptors.add(d);
    }

    private static Set<Maturity> maturity(JsonNode node, String file) {
        if (node == null || !node.isArray() || node.isEmpty()) {
            return EnumSet.allOf(Maturity.class);
        }
        var levels = EnumSet.noneOf(Maturity.class);
        for (JsonNode level : node) {
            try {
                levels.add(Maturity.fromId(level.asText().trim().toLowerCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Rule " + file + " has unknown maturity '" + level.asText() + "'", CONFIG_KEY, e);
            }
        }
        return levels;
    }

    static List<String> topicsFromName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        var topics = NAME_TOPICS.stream().filter(lower::contains).toList();
        return topics.isEmpty() ? List.of("general") : topics;
    }

    static int estimateTokens(String file) {
        if (file.contains("base/")) return 1000;
        if (file.contains("languages/")) return 1200;
        if (file.contains("frameworks/")) return 1500;
        if (file.contains("cloud/")) return 1600;
        return 800;
    }

    private static Iterable<JsonNode> array(JsonNode node, String where) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ConfigurationException("Catalog section '" + where + "' must be an array", CONFIG_KEY);
        }
        return node;
    }

    private static void forEachGroup(JsonNode node, String section, GroupVisitor visitor) {
        if (node == null || node.isNull()) {
            return;
        }
        if (!node.isObject()) {
            throw new ConfigurationException("Catalog section '" + section + "' must be an object", CONFIG_KEY);
        }
        var fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!entry.getValue().isObject()) {
                throw new ConfigurationException("Catalog group '" + section + "." + entry.getKey() + "' must be an object", CONFIG_KEY);
            }
            visitor.visit(entry.getKey(), entry.getValue());
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText().trim();
    }

    @FunctionalInterface
    private interface GroupVisitor {
        void visit(String key, JsonNode group);
    }
}
