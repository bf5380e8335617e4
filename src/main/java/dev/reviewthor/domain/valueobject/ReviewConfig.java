package dev.reviewthor.domain.valueobject;

import dev.reviewthor.domain.enums.Severity;

import java.util.List;

/**
 * Effective review policy for one repository and one pull-request run.
 */
public record ReviewConfig(List<String> focusAreas, List<String> customRules, List<String> ignorePatterns,
                           Severity severityFloor, int maxCommentsPerPr, List<String> enabledChecks) {
    public ReviewConfig {
        focusAreas = List.copyOf(focusAreas);
        customRules = List.copyOf(customRules);
        ignorePatterns = List.copyOf(ignorePatterns);
        enabledChecks = List.copyOf(enabledChecks);
        if (severityFloor == null) throw new IllegalArgumentException("severityFloor must not be null");
        if (maxCommentsPerPr < 0) throw new IllegalArgumentException("maxCommentsPerPr must be >= 0");
    }
}
