package com.document.classification.report;

import com.document.classification.core.model.Decision;
import com.document.classification.core.model.DecisionOutcome;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Totals per outcome and the number of documents per category.
 *
 * @param total        number of decisions
 * @param classified   decisions assigned to a configured category
 * @param unclassified decisions below the confidence floor or without evidence
 * @param failed       documents that could not be processed
 * @param distribution document count per category (sentinels included),
 *                     by descending count then name
 */
public record ReportSummary(long total, long classified, long unclassified, long failed,
                            List<CategoryCount> distribution) {

    public ReportSummary {
        distribution = distribution != null ? List.copyOf(distribution) : List.of();
    }

    public record CategoryCount(String category, long count) {}

    public static ReportSummary of(List<Decision> decisions) {
        long classified = 0;
        long unclassified = 0;
        long failed = 0;
        Map<String, Long> counts = new TreeMap<>();
        for (Decision decision : decisions) {
            DecisionOutcome outcome = decision.outcome();
            if (outcome == DecisionOutcome.CLASSIFIED) {
                classified++;
            } else if (outcome == DecisionOutcome.UNCLASSIFIED) {
                unclassified++;
            } else {
                failed++;
            }
            counts.merge(decision.category(), 1L, Long::sum);
        }

        List<CategoryCount> distribution = new ArrayList<>();
        counts.forEach((category, count) -> distribution.add(new CategoryCount(category, count)));
        distribution.sort(Comparator.comparingLong(CategoryCount::count).reversed()
                .thenComparing(CategoryCount::category));
        return new ReportSummary(decisions.size(), classified, unclassified, failed, distribution);
    }

    /**
     * Plain-text rendering for the console.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Documents: ").append(total)
                .append(" (classified ").append(classified)
                .append(", unclassified ").append(unclassified)
                .append(", failed ").append(failed).append(")\n");
        if (distribution.isEmpty()) {
            return sb.toString();
        }
        sb.append("Distribution:\n");
        int width = distribution.stream().mapToInt(c -> c.category().length()).max().orElse(0);
        for (CategoryCount entry : distribution) {
            double percent = total == 0 ? 0.0 : 100.0 * entry.count() / total;
            sb.append(String.format(Locale.ROOT, "  %-" + width + "s %5d  %5.1f%%%n",
                    entry.category(), entry.count(), percent));
        }
        return sb.toString();
    }
}
