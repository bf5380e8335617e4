package dev.reviewthor.domain.valueobject;

import dev.reviewthor.domain.enums.Severity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Review preferences parsed from a repository's instruction document. Severity is empty when the
 * document does not declare a valid one.
 */
public record CustomInstructions(List<String> focusAreas, List<String> customRules, List<String> ignorePatterns,
                                 Optional<Severity> severity, String rawContent) {
    public CustomInstructions {
        focusAreas = focusAreas == null ? List.of() : List.copyOf(focusAreas);
        customRules = customRules == null ? List.of() : List.copyOf(customRules);
        // null entries are kept so validation can report them
        ignorePatterns = ignorePatterns == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(ignorePatterns));
        if (severity == null) severity = Optional.empty();
        if (rawContent == null) rawContent = "";
    }

    public static CustomInstructions empty() {
        return new CustomInstructions(List.of(), List.of(), List.of(), Optional.empty(), "");
    }
}
