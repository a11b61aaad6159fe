package com.document.classification.rules;

import com.document.classification.core.model.Category;
import com.document.classification.core.model.CategorySet;
import com.document.classification.core.model.Document;
import com.document.classification.core.model.RuleMatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Evaluates every category's rules against a document.
 *
 * <p>Within a category each distinct rule (see {@link Rule#equals}) contributes its
 * weight once when it matches; the sum is capped at 1.0. Of duplicates with different
 * weights the heaviest is kept, whatever the configured order. Every configured category
 * appears in the result, with {@link RuleMatchResult#none} when nothing matched.</p>
 *
 * <p>The engine holds no mutable state and may be shared across worker threads.</p>
 */
public class RuleEngine {
    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final CategorySet categories;
    private final Map<String, List<Rule>> distinctRules;

    public RuleEngine(CategorySet categories) {
        this.categories = categories;
        Map<String, List<Rule>> rules = new LinkedHashMap<>();
        for (Category category : categories.categories()) {
            Map<String, Rule> unique = new LinkedHashMap<>();
            for (Rule rule : category.rules()) {
                unique.merge(rule.identityKey(), rule, RuleEngine::preferred);
            }
            if (unique.size() < category.rules().size()) {
                log.debug("rules.deduplicated category={} configured={} distinct={}",
                        category.name(), category.rules().size(), unique.size());
            }
            rules.put(category.name(), List.copyOf(unique.values()));
        }
        this.distinctRules = Collections.unmodifiableMap(rules);
    }

    /**
     * Picks one of two rules with the same identity: the higher weight, then the smaller id.
     */
    static Rule preferred(Rule current, Rule candidate) {
        int byWeight = Double.compare(candidate.getWeight(), current.getWeight());
        if (byWeight != 0) {
            return byWeight > 0 ? candidate : current;
        }
        return candidate.getId().compareTo(current.getId()) < 0 ? candidate : current;
    }

    /**
     * Evaluates all categories against the document.
     *
     * @return one result per configured category, keyed by name in ascending order
     */
    public Map<String, RuleMatchResult> evaluate(Document document) {
        Map<String, RuleMatchResult> results = new TreeMap<>();
        for (String name : categories.names()) {
            results.put(name, evaluate(name, distinctRules.get(name), document));
        }
        return Collections.unmodifiableMap(results);
    }

    private RuleMatchResult evaluate(String category, List<Rule> rules, Document document) {
        // Matched rules are summed in identity order so the floating-point sum
        // does not depend on configuration order.
        TreeMap<String, Rule> matched = new TreeMap<>();
        for (Rule rule : rules) {
            if (rule.matches(rule.getField().select(document))) {
                matched.put(rule.identityKey(), rule);
            }
        }
        if (matched.isEmpty()) {
            return RuleMatchResult.none(category);
        }
        Set<String> triggered = new TreeSet<>();
        double sum = 0.0;
        for (Rule rule : matched.values()) {
            triggered.add(rule.getId());
            sum += rule.getWeight();
        }
        log.debug("rules.matched document={} category={} rules={} sum={}",
                document.metadata().fileName(), category, triggered, sum);
        return RuleMatchResult.of(category, triggered, sum);
    }

    /**
     * Distinct rules evaluated for a category, in configuration order.
     */
    public List<Rule> getRules(String category) {
        return distinctRules.getOrDefault(category, List.of());
    }
}
