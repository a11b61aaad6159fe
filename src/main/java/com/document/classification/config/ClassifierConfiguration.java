package com.document.classification.config;

import com.document.classification.core.model.CategorySet;
import com.document.classification.decision.DecisionPolicy;

import java.util.Objects;

/**
 * Validated, immutable result of loading a category configuration file.
 */
public record ClassifierConfiguration(CategorySet categories, DecisionPolicy policy) {

    public ClassifierConfiguration {
        Objects.requireNonNull(categories, "categories is required");
        policy = policy != null ? policy : DecisionPolicy.defaults();
    }
}
