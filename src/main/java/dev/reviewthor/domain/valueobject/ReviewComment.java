package dev.reviewthor.domain.valueobject;

/**
 * An inline pull-request comment as sent to the host.
 */
public record ReviewComment(String path, int line, String body) {}
