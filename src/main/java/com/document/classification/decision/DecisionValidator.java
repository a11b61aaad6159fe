package com.document.classification.decision;

import com.document.classification.core.model.CategorySet;
import com.document.classification.core.model.Decision;
import com.document.classification.core.model.DecisionStage;
import com.document.classification.exception.DecisionValidationException;

/**
 * Checks a decision against the data-model invariants before it is reported:
 * the category is configured or a sentinel, the stage agrees with the category,
 * and a named category is never assigned below the confidence floor.
 */
public class DecisionValidator {

    private final CategorySet categories;
    private final DecisionPolicy policy;

    public DecisionValidator(CategorySet categories, DecisionPolicy policy) {
        this.categories = categories;
        this.policy = policy;
    }

    /**
     * @return the decision, unchanged
     * @throws DecisionValidationException when an invariant is violated
     */
    public Decision validate(Decision decision) {
        String category = decision.category();
        DecisionStage stage = decision.stage();

        if (stage == DecisionStage.FAILED) {
            require(Decision.FAILED.equals(category), decision, "failed stage must use the failed marker");
            return decision;
        }
        if (stage == DecisionStage.UNCLASSIFIED) {
            require(Decision.UNCLASSIFIED.equals(category), decision, "unclassified stage must use the unclassified sentinel");
            return decision;
        }

        require(categories.contains(category), decision, "category is not in the configured set");
        require(decision.confidence() >= policy.getConfidenceFloor() - policy.getTieEpsilon(), decision,
                "confidence is below the floor");
        require(decision.trace().stage() == stage, decision, "trace stage does not match decision stage");
        return decision;
    }

    private static void require(boolean condition, Decision decision, String message) {
        if (!condition) {
            throw new DecisionValidationException("Invalid decision for " + decision.sourcePath()
                    + " (category='" + decision.category() + "', stage=" + decision.stage().label() + "): " + message);
        }
    }
}
