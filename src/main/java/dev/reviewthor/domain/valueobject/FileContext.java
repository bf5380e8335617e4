package dev.reviewthor.domain.valueobject;

/**
 * One changed file prepared for review. Content and diff are never null.
 */
public record FileContext(String path, String content, String diff, String language) {
    public FileContext {
        if (path == null || path.isEmpty()) throw new IllegalArgumentException("path must not be empty");
        if (content == null) content = "";
        if (diff == null) diff = "";
        if (language == null) language = "unknown";
    }

    public FileContext withContent(String newContent) {
        return new FileContext(path, newContent, diff, language);
    }

    public FileContext withDiff(String newDiff) {
        return new FileContext(path, content, newDiff, language);
    }
}
