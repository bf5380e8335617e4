package dev.reviewthor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * ReviewThor: AI pull-request reviewer driven by GitHub webhooks.
 *
 * <p>Request flow:
 * <pre>
 * GitHub Webhook → WebhookController (HMAC check) → EventClassifier → WebhookEventRouter
 *   → PullRequestReviewService → [files, .reviewthor.md] → ContextAssembler
 *   → ReviewOrchestrator (review service) → ReviewCommentSink (batched inline comments)
 * </pre>
 *
 * <p>Each delivery is processed synchronously and in isolation. Failures after the signature
 * has been accepted are logged and swallowed so GitHub does not redeliver.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ReviewThorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReviewThorApplication.class, args);
    }
}
