package dev.reviewthor.domain.valueobject;

import java.util.List;

public record ValidationResult(List<String> errors) {
    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
