package dev.reviewthor.webhook;

import dev.reviewthor.domain.valueobject.WebhookEvent;
import dev.reviewthor.service.PullRequestReviewService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Dispatches classified events. Only the three pull-request kinds have a handler;
 * submitted reviews are recognised but deliberately left unhandled.
 */
@Component
public class WebhookEventRouter {
    private static final Logger log = LoggerFactory.getLogger(WebhookEventRouter.class);

    private final PullRequestReviewService pullRequestReviewService;

    public WebhookEventRouter(PullRequestReviewService pullRequestReviewService) {
        this.pullRequestReviewService = pullRequestReviewService;
    }

    /** @return true when a handler ran for the event */
    public boolean route(WebhookEvent event, String correlationId) {
        return switch (event.kind()) {
            case PULL_REQUEST_OPENED, PULL_REQUEST_SYNCHRONIZE, PULL_REQUEST_REOPENED -> {
                pullRequestReviewService.handle(event, correlationId);
                yield true;
            }
            case PULL_REQUEST_REVIEW_SUBMITTED -> {
                log.debug("No handler for {} on {}", event.kind(), event.repository());
                yield false;
            }
        };
    }
}
