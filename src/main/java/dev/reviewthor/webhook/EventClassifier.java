package dev.reviewthor.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import dev.reviewthor.domain.enums.EventKind;
import dev.reviewthor.domain.valueobject.RepositoryRef;
import dev.reviewthor.domain.valueobject.WebhookEvent;
import dev.reviewthor.exception.MissingFieldException;
import dev.reviewthor.exception.UnsupportedEventException;
import org.springframework.stereotype.Component;

/**
 * Maps a raw webhook payload onto exactly one {@link EventKind} or fails with
 * {@link MissingFieldException} / {@link UnsupportedEventException}. Nothing is dropped silently.
 */
@Component
public class EventClassifier {

    public WebhookEvent classify(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new MissingFieldException("installation ID");
        }

        JsonNode installationId = payload.path("installation").path("id");
        if (!installationId.canConvertToLong() || installationId.asLong() <= 0) {
            throw new MissingFieldException("installation ID");
        }

        JsonNode repository = payload.path("repository");
        String name = textOrNull(repository.path("name"));
        String owner = textOrNull(repository.path("owner").path("login"));
        if (name == null || owner == null) {
            throw new MissingFieldException("repository information");
        }

        return new WebhookEvent(determineKind(payload), new RepositoryRef(owner, name),
                installationId.asLong(), payload);
    }

    private EventKind determineKind(JsonNode payload) {
        String action = textOrNull(payload.path("action"));

        if (payload.path("pull_request").isObject() && action != null) {
            EventKind kind = EventKind.forPullRequestAction(action);
            if (kind != null) return kind;
        }
        if (payload.path("review").isObject() && "submitted".equals(action)) {
            return EventKind.PULL_REQUEST_REVIEW_SUBMITTED;
        }
        throw new UnsupportedEventException(action != null ? action : "unknown");
    }

    private static String textOrNull(JsonNode node) {
        return node.isTextual() && !node.asText().isBlank() ? node.asText() : null;
    }
}
