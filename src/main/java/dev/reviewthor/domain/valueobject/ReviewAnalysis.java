package dev.reviewthor.domain.valueobject;

import java.util.List;
import java.util.Map;

/**
 * Validated structured answer of the review service.
 */
public record ReviewAnalysis(List<Finding> findings, String summary, Stats stats) {
    public ReviewAnalysis {
        findings = List.copyOf(findings);
    }

    public record Stats(int total, Map<String, Integer> byCategory, Map<String, Integer> bySeverity) {
        public Stats {
            byCategory = byCategory == null ? Map.of() : Map.copyOf(byCategory);
            bySeverity = bySeverity == null ? Map.of() : Map.copyOf(bySeverity);
        }
    }
}
