package com.document.classification.decision;

import com.document.classification.core.model.CategoryScore;
import com.document.classification.core.model.CategorySet;
import com.document.classification.core.model.Decision;
import com.document.classification.core.model.DecisionError;
import com.document.classification.core.model.DecisionStage;
import com.document.classification.core.model.DecisionTrace;
import com.document.classification.core.model.ErrorKind;
import com.document.classification.core.model.RuleMatchResult;
import com.document.classification.core.model.SemanticScores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Merges rule and semantic evidence into one {@link Decision}.
 *
 * <p>Policy, in order:</p>
 * <ol>
 *   <li>Conclusive rules (per {@link InconclusivePolicy}): the top rule category wins with
 *       confidence equal to its rule score; semantic scoring is not needed.</li>
 *   <li>Otherwise: {@code combined = alpha * rule + (1 - alpha) * semantic} per category,
 *       a missing centroid contributing 0.</li>
 *   <li>Scores within {@code tieEpsilon} of the best are ties; the lexicographically
 *       smallest category name wins.</li>
 *   <li>A best score below the confidence floor yields {@link Decision#UNCLASSIFIED}.</li>
 *   <li>When semantic scoring failed, the rule result is used if any rule matched;
 *       otherwise the document is unclassified with an embedding error.</li>
 * </ol>
 *
 * <p>Pure computation over immutable inputs; safe to share between threads.</p>
 */
public class DecisionResolver {
    private static final Logger log = LoggerFactory.getLogger(DecisionResolver.class);

    public static final String REASON_RULE_CONCLUSIVE = "rule threshold met";
    public static final String REASON_BLENDED = "highest blended score";
    public static final String REASON_RULE_FALLBACK = "semantic unavailable, rule fallback";
    public static final String REASON_BELOW_FLOOR = "below floor";
    public static final String REASON_NO_EVIDENCE = "semantic failed, no rule match";
    public static final String TIE_BREAK_SUFFIX = "; tie-break";

    private final CategorySet categories;
    private final DecisionPolicy policy;

    public DecisionResolver(CategorySet categories, DecisionPolicy policy) {
        this.categories = categories;
        this.policy = policy;
    }

    public DecisionPolicy getPolicy() {
        return policy;
    }

    /**
     * Returns true when the rule scores alone decide the document and semantic scoring can be skipped.
     */
    public boolean isConclusive(Map<String, RuleMatchResult> ruleResults) {
        Ranking ranking = rank(ruleScores(ruleResults));
        if (ranking.bestScore() <= 0.0) {
            return false;
        }
        boolean absolute = ranking.bestScore() >= policy.getHighConfidenceThreshold();
        boolean margin = ranking.margin() >= policy.getMinimumMargin();
        switch (policy.getInconclusivePolicy()) {
            case ABSOLUTE:
                return absolute;
            case MARGIN:
                return margin;
            case ABSOLUTE_AND_MARGIN:
            default:
                return absolute && margin;
        }
    }

    /**
     * Resolves the decision for one document.
     *
     * @param sourcePath     the document's source path
     * @param ruleResults    rule results for every configured category
     * @param semanticScores semantic scores, or {@code null} when they were not computed
     */
    public Decision resolve(Path sourcePath, Map<String, RuleMatchResult> ruleResults, SemanticScores semanticScores) {
        Map<String, Double> ruleScores = ruleScores(ruleResults);

        if (semanticScores == null) {
            if (isConclusive(ruleResults)) {
                return ruleOnly(sourcePath, ruleResults, ruleScores, REASON_RULE_CONCLUSIVE, true, null);
            }
            semanticScores = SemanticScores.failed("semantic scores not computed");
        }

        if (semanticScores.isFailure()) {
            return fallback(sourcePath, ruleResults, ruleScores, semanticScores.failureReason());
        }
        return blended(sourcePath, ruleResults, ruleScores, semanticScores);
    }

    private Decision ruleOnly(Path sourcePath, Map<String, RuleMatchResult> ruleResults, Map<String, Double> ruleScores,
                              String reason, boolean semanticSkipped, String semanticError) {
        SortedMap<String, CategoryScore> trace = new TreeMap<>();
        for (String name : categories.names()) {
            RuleMatchResult result = ruleResults.get(name);
            double score = ruleScores.get(name);
            trace.put(name, new CategoryScore(score, null, score, result != null ? result.triggeredRules() : null));
        }
        return select(sourcePath, ruleScores, trace, DecisionStage.RULE_ONLY, reason, semanticSkipped, semanticError);
    }

    private Decision fallback(Path sourcePath, Map<String, RuleMatchResult> ruleResults, Map<String, Double> ruleScores,
                              String semanticError) {
        boolean anyRule = ruleScores.values().stream().anyMatch(score -> score > 0.0);
        if (anyRule) {
            log.debug("decision.fallback document={} semanticError={}", sourcePath, semanticError);
            return ruleOnly(sourcePath, ruleResults, ruleScores, REASON_RULE_FALLBACK, false, semanticError);
        }

        SortedMap<String, CategoryScore> trace = new TreeMap<>();
        for (String name : categories.names()) {
            trace.put(name, new CategoryScore(0.0, null, 0.0, null));
        }
        DecisionTrace decisionTrace = DecisionTrace.of(DecisionStage.UNCLASSIFIED, trace, 0.0, null,
                REASON_NO_EVIDENCE, false, semanticError);
        return new Decision(sourcePath, Decision.UNCLASSIFIED, 0.0, DecisionStage.UNCLASSIFIED, decisionTrace,
                new DecisionError(ErrorKind.EMBEDDING, semanticError));
    }

    private Decision blended(Path sourcePath, Map<String, RuleMatchResult> ruleResults, Map<String, Double> ruleScores,
                             SemanticScores semanticScores) {
        double alpha = policy.getAlpha();
        Map<String, Double> combined = new TreeMap<>();
        SortedMap<String, CategoryScore> trace = new TreeMap<>();
        for (String name : categories.names()) {
            double rule = ruleScores.get(name);
            Double semantic = semanticScores.similarity(name).orElse(null);
            double score = alpha * rule + (1.0 - alpha) * (semantic != null ? semantic : 0.0);
            combined.put(name, score);
            RuleMatchResult result = ruleResults.get(name);
            trace.put(name, new CategoryScore(rule, semantic, score, result != null ? result.triggeredRules() : null));
        }
        return select(sourcePath, combined, trace, DecisionStage.BLENDED, REASON_BLENDED, false, null);
    }

    private Decision select(Path sourcePath, Map<String, Double> scores, SortedMap<String, CategoryScore> trace,
                            DecisionStage stage, String reason, boolean semanticSkipped, String semanticError) {
        Ranking ranking = rank(scores);

        if (ranking.bestScore() < policy.getConfidenceFloor()) {
            DecisionTrace decisionTrace = DecisionTrace.of(DecisionStage.UNCLASSIFIED, trace, ranking.margin(),
                    ranking.runnerUp(), REASON_BELOW_FLOOR, semanticSkipped, semanticError);
            log.debug("decision.unclassified document={} best={} floor={}",
                    sourcePath, ranking.bestScore(), policy.getConfidenceFloor());
            return new Decision(sourcePath, Decision.UNCLASSIFIED, clampUnit(ranking.bestScore()),
                    DecisionStage.UNCLASSIFIED, decisionTrace, null);
        }

        String finalReason = ranking.tie() ? reason + TIE_BREAK_SUFFIX : reason;
        DecisionTrace decisionTrace = DecisionTrace.of(stage, trace, ranking.margin(), ranking.runnerUp(),
                finalReason, semanticSkipped, semanticError);
        return new Decision(sourcePath, ranking.winner(), clampUnit(ranking.winnerScore()), stage, decisionTrace, null);
    }

    /**
     * Ranks categories by score. Categories within {@code tieEpsilon} of the best score
     * are tied; among them the smallest name wins. Iteration is over category names in
     * ascending order, so the result never depends on map iteration order.
     */
    Ranking rank(Map<String, Double> scores) {
        double best = Double.NEGATIVE_INFINITY;
        for (String name : categories.names()) {
            best = Math.max(best, scores.getOrDefault(name, 0.0));
        }

        String winner = null;
        int tied = 0;
        for (String name : categories.names()) {
            if (scores.getOrDefault(name, 0.0) >= best - policy.getTieEpsilon()) {
                if (winner == null) {
                    winner = name;
                }
                tied++;
            }
        }
        double winnerScore = scores.getOrDefault(winner, 0.0);

        String runnerUp = null;
        double runnerUpScore = 0.0;
        for (String name : categories.names()) {
            if (name.equals(winner)) {
                continue;
            }
            double score = scores.getOrDefault(name, 0.0);
            if (runnerUp == null || score > runnerUpScore) {
                runnerUp = name;
                runnerUpScore = score;
            }
        }
        double margin = runnerUp != null ? Math.max(0.0, winnerScore - runnerUpScore) : Math.max(0.0, winnerScore);
        return new Ranking(winner, winnerScore, best, runnerUp, margin, tied > 1);
    }

    private Map<String, Double> ruleScores(Map<String, RuleMatchResult> ruleResults) {
        Map<String, Double> scores = new TreeMap<>();
        for (String name : categories.names()) {
            RuleMatchResult result = ruleResults != null ? ruleResults.get(name) : null;
            scores.put(name, result != null ? result.score() : 0.0);
        }
        return scores;
    }

    private static double clampUnit(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    record Ranking(String winner, double winnerScore, double bestScore, String runnerUp, double margin, boolean tie) {}
}
