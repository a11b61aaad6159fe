package com.document.classification.config;

import com.document.classification.core.model.Category;
import com.document.classification.core.model.CategorySet;
import com.document.classification.core.model.Decision;
import com.document.classification.decision.DecisionPolicy;
import com.document.classification.decision.InconclusivePolicy;
import com.document.classification.exception.ConfigurationException;
import com.document.classification.rules.Rule;
import com.document.classification.rules.RuleField;
import com.document.classification.rules.RuleType;
import com.document.classification.similarity.Vectors;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Loads and validates a category configuration file.
 *
 * <p>Validation is eager: every category, rule, centroid and policy value is
 * checked before the configuration is returned, and the first problem found
 * is reported as a {@link ConfigurationException} naming the offending
 * category or rule.</p>
 *
 * <pre>{@code
 * ClassifierConfiguration config = new CategoryConfigLoader().load(Path.of("categories.json"));
 * }</pre>
 */
public class CategoryConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(CategoryConfigLoader.class);

    private static final Pattern ILLEGAL_FOLDER_CHARS = Pattern.compile("[\\\\/:*?\"<>|\\p{Cntrl}]");

    private final ObjectMapper objectMapper;

    public CategoryConfigLoader() {
        this.objectMapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    /**
     * Reads the configuration at {@code configFile}. Relative {@code centroidPath}
     * entries resolve against the file's directory.
     *
     * @throws ConfigurationException if the file cannot be read or is invalid
     */
    public ClassifierConfiguration load(Path configFile) {
        if (configFile == null || !Files.isRegularFile(configFile)) {
            throw new ConfigurationException("Configuration file not found: " + configFile);
        }
        ConfigFile parsed;
        try {
            parsed = objectMapper.readValue(configFile.toFile(), ConfigFile.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid configuration " + configFile + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration " + configFile, e);
        }
        Path baseDir = configFile.toAbsolutePath().getParent();
        ClassifierConfiguration configuration = build(parsed, baseDir);
        log.info("config.loaded file={} categories={} centroids={}",
                configFile, configuration.categories().size(), configuration.categories().hasCentroids());
        return configuration;
    }

    /**
     * Parses configuration from a JSON string. Relative centroid paths resolve
     * against {@code baseDir}.
     */
    public ClassifierConfiguration parse(String json, Path baseDir) {
        ConfigFile parsed;
        try {
            parsed = objectMapper.readValue(json, ConfigFile.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getOriginalMessage(), e);
        }
        return build(parsed, baseDir);
    }

    private ClassifierConfiguration build(ConfigFile parsed, Path baseDir) {
        if (parsed == null || parsed.categories() == null || parsed.categories().isEmpty()) {
            throw new ConfigurationException("Configuration must declare at least one category");
        }

        Set<String> seen = new HashSet<>();
        List<Category> categories = new ArrayList<>();
        for (CategoryEntry entry : parsed.categories()) {
            String name = validateName(entry);
            if (!seen.add(name.toLowerCase(Locale.ROOT))) {
                throw new ConfigurationException("Duplicate category name (case-insensitive): " + name);
            }
            List<Rule> rules = buildRules(name, entry.rules());
            float[] centroid = resolveCentroid(name, entry, baseDir);
            categories.add(new Category(name, entry.description(), rules, centroid));
        }

        CategorySet categorySet;
        try {
            categorySet = CategorySet.of(categories);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
        return new ClassifierConfiguration(categorySet, buildPolicy(parsed.policy()));
    }

    private String validateName(CategoryEntry entry) {
        String name = entry.name();
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Category name is required");
        }
        name = name.strip();
        if (Decision.isSentinel(name)) {
            throw new ConfigurationException("Category name '" + name + "' is reserved");
        }
        if (name.equals(".") || name.equals("..") || ILLEGAL_FOLDER_CHARS.matcher(name).find()) {
            throw new ConfigurationException("Category name '" + name + "' cannot be used as a folder name");
        }
        return name;
    }

    private List<Rule> buildRules(String category, List<RuleEntry> entries) {
        List<Rule> rules = new ArrayList<>();
        if (entries == null) {
            return rules;
        }
        for (int i = 0; i < entries.size(); i++) {
            RuleEntry entry = entries.get(i);
            String baseId = entry.id() != null && !entry.id().isBlank() ? entry.id() : category + "#" + (i + 1);
            RuleType type = parseEnum(RuleType.class, entry.type(), RuleType.KEYWORD,
                    "type", ruleContext(category, baseId));
            RuleField field = parseEnum(RuleField.class, entry.field(), RuleField.TEXT,
                    "field", ruleContext(category, baseId));
            if (entry.weight() == null) {
                throw new ConfigurationException("Rule '" + baseId + "' in category '" + category + "' has no weight");
            }

            List<String> patterns = new ArrayList<>();
            if (entry.pattern() != null) {
                patterns.add(entry.pattern());
            }
            if (entry.keywords() != null) {
                if (type != RuleType.KEYWORD) {
                    throw new ConfigurationException("Rule '" + baseId + "' in category '" + category
                            + "' uses keywords with a non-keyword type");
                }
                patterns.addAll(entry.keywords());
            }
            if (patterns.isEmpty()) {
                throw new ConfigurationException("Rule '" + baseId + "' in category '" + category + "' has no pattern");
            }

            for (int k = 0; k < patterns.size(); k++) {
                String id = patterns.size() == 1 ? baseId : baseId + "." + (k + 1);
                try {
                    rules.add(Rule.builder()
                            .id(id)
                            .type(type)
                            .field(field)
                            .pattern(patterns.get(k))
                            .weight(entry.weight())
                            .build());
                } catch (IllegalArgumentException e) {
                    throw new ConfigurationException("Invalid rule in category '" + category + "': " + e.getMessage(), e);
                }
            }
        }
        rejectConflictingDuplicates(category, rules);
        return rules;
    }

    private static void rejectConflictingDuplicates(String category, List<Rule> rules) {
        Map<String, Rule> seen = new HashMap<>();
        for (Rule rule : rules) {
            Rule previous = seen.putIfAbsent(rule.identityKey(), rule);
            if (previous != null && Double.compare(previous.getWeight(), rule.getWeight()) != 0) {
                throw new ConfigurationException("Rules '" + previous.getId() + "' and '" + rule.getId()
                        + "' in category '" + category + "' match the same pattern with different weights");
            }
        }
    }

    private float[] resolveCentroid(String category, CategoryEntry entry, Path baseDir) {
        if (entry.centroid() != null && entry.centroidPath() != null) {
            throw new ConfigurationException("Category '" + category + "' declares both centroid and centroidPath");
        }
        float[] centroid = entry.centroid();
        if (entry.centroidPath() != null) {
            Path path = baseDir != null ? baseDir.resolve(entry.centroidPath()) : Path.of(entry.centroidPath());
            try {
                centroid = objectMapper.readValue(path.toFile(), float[].class);
            } catch (IOException e) {
                throw new ConfigurationException("Cannot read centroid for category '" + category + "' from " + path, e);
            }
        }
        if (centroid == null) {
            return null;
        }
        if (centroid.length == 0) {
            throw new ConfigurationException("Category '" + category + "' has an empty centroid");
        }
        for (float value : centroid) {
            if (!Float.isFinite(value)) {
                throw new ConfigurationException("Category '" + category + "' has a non-finite centroid value");
            }
        }
        if (Vectors.defect(centroid) != null) {
            throw new ConfigurationException("Category '" + category + "' has a zero-norm centroid");
        }
        return centroid;
    }

    private DecisionPolicy buildPolicy(PolicyEntry entry) {
        if (entry == null) {
            return DecisionPolicy.defaults();
        }
        DecisionPolicy.Builder builder = DecisionPolicy.builder();
        try {
            if (entry.alpha() != null) builder.alpha(entry.alpha());
            if (entry.highConfidenceThreshold() != null) builder.highConfidenceThreshold(entry.highConfidenceThreshold());
            if (entry.minimumMargin() != null) builder.minimumMargin(entry.minimumMargin());
            if (entry.confidenceFloor() != null) builder.confidenceFloor(entry.confidenceFloor());
            if (entry.tieEpsilon() != null) builder.tieEpsilon(entry.tieEpsilon());
            if (entry.inconclusivePolicy() != null) {
                builder.inconclusivePolicy(parseEnum(InconclusivePolicy.class, entry.inconclusivePolicy(),
                        InconclusivePolicy.ABSOLUTE_AND_MARGIN, "inconclusivePolicy", "policy"));
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid policy: " + e.getMessage(), e);
        }
    }

    private static String ruleContext(String category, String ruleId) {
        return "rule '" + ruleId + "' in category '" + category + "'";
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, E defaultValue,
                                                   String property, String context) {
        if (value == null) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown " + property + " '" + value + "' for " + context, e);
        }
    }

    record ConfigFile(List<CategoryEntry> categories, PolicyEntry policy) {}

    record CategoryEntry(String name, String description, float[] centroid, String centroidPath,
                         List<RuleEntry> rules) {}

    record RuleEntry(String id, String type, String field, String pattern, List<String> keywords, Double weight) {}

    record PolicyEntry(Double alpha, Double highConfidenceThreshold, Double minimumMargin,
                       String inconclusivePolicy, Double confidenceFloor, Double tieEpsilon) {}
}
