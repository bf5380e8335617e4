package dev.reviewthor.domain.enums;

/**
 * The closed set of webhook events the classifier recognises.
 */
public enum EventKind {
    PULL_REQUEST_OPENED("pull_request.opened"),
    PULL_REQUEST_SYNCHRONIZE("pull_request.synchronize"),
    PULL_REQUEST_REOPENED("pull_request.reopened"),
    PULL_REQUEST_REVIEW_SUBMITTED("pull_request_review.submitted");

    private final String wireName;

    EventKind(String wireName) { this.wireName = wireName; }

    public String wireName() { return wireName; }

    public static EventKind forPullRequestAction(String action) {
        return switch (action) {
            case "opened" -> PULL_REQUEST_OPENED;
            case "synchronize" -> PULL_REQUEST_SYNCHRONIZE;
            case "reopened" -> PULL_REQUEST_REOPENED;
            default -> null;
        };
    }

    @Override
    public String toString() { return wireName; }
}
