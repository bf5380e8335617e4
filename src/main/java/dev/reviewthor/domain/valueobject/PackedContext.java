package dev.reviewthor.domain.valueobject;

import java.util.List;

/**
 * Result of fitting file contexts into a token budget. When {@code truncated} is true the
 * token count is reported as the budget itself, not recounted.
 */
public record PackedContext(List<FileContext> files, PrContext pr, boolean truncated, int tokenCount) {
    public PackedContext {
        files = List.copyOf(files);
    }
}
