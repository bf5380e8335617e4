package dev.reviewthor.domain.valueobject;

import dev.reviewthor.domain.enums.Severity;

/**
 * One problem reported by the review service. Built only from a validated response.
 */
public record Finding(String file, int line, Severity severity, String message, String category, String suggestion) {
    public Finding {
        if (file == null || file.isEmpty()) throw new IllegalArgumentException("file must not be empty");
        if (line < 1) throw new IllegalArgumentException("line must be >= 1");
        if (severity == null) throw new IllegalArgumentException("severity must not be null");
        if (message == null || message.isEmpty()) throw new IllegalArgumentException("message must not be empty");
        if (category == null) category = "";
    }

    public boolean hasSuggestion() {
        return suggestion != null && !suggestion.isEmpty();
    }
}
