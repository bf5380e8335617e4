package dev.reviewthor.domain.valueobject;

/**
 * Pull-request metadata that travels with the file contexts.
 */
public record PrContext(String title, String description, String author, String targetBranch, String sourceBranch) {
    public PrContext {
        if (title == null) title = "";
        if (description == null) description = "";
    }
}
