package dev.reviewthor.domain.valueobject;

import com.fasterxml.jackson.databind.JsonNode;
import dev.reviewthor.domain.enums.EventKind;

/**
 * A classified inbound webhook delivery. Immutable; discarded after routing.
 */
public record WebhookEvent(EventKind kind, RepositoryRef repository, long installationId, JsonNode payload) {
    public WebhookEvent {
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        if (repository == null) throw new IllegalArgumentException("repository must not be null");
        if (installationId <= 0) throw new IllegalArgumentException("installationId must be positive");
    }

    public JsonNode pullRequest() {
        return payload.path("pull_request");
    }
}
