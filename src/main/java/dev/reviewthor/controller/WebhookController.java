package dev.reviewthor.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.reviewthor.domain.valueobject.WebhookEvent;
import dev.reviewthor.infrastructure.github.WebhookSignatureVerifier;
import dev.reviewthor.logging.MdcContext;
import dev.reviewthor.webhook.EventClassifier;
import dev.reviewthor.webhook.WebhookEventRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.Map;
import java.util.Set;

/**
 * GitHub webhook receiver. Verifies the HMAC signature over the raw bytes, classifies the
 * payload and runs the pull-request pipeline synchronously before answering.
 *
 * <p>Classification failures propagate to {@code GlobalExceptionHandler} (400); failures inside
 * the pipeline never reach here.
 */
@RestController
@RequestMapping("/webhooks")
public class WebhookController {
    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    private static final Set<String> REVIEWABLE_EVENTS = Set.of("pull_request", "pull_request_review");

    private final WebhookSignatureVerifier signatureVerifier;
    private final EventClassifier eventClassifier;
    private final WebhookEventRouter eventRouter;
    private final ObjectMapper objectMapper;

    public WebhookController(WebhookSignatureVerifier signatureVerifier,
                             EventClassifier eventClassifier,
                             WebhookEventRouter eventRouter,
                             ObjectMapper objectMapper) {
        this.signatureVerifier = signatureVerifier;
        this.eventClassifier = eventClassifier;
        this.eventRouter = eventRouter;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/github")
    public ResponseEntity<Map<String, Object>> handleWebhook(
            @RequestHeader(value = "X-GitHub-Event", required = false) String eventType,
            @RequestHeader(value = "X-GitHub-Delivery", required = false) String deliveryId,
            @RequestHeader(value = "X-Hub-Signature-256", required = false) String signature,
            @RequestBody(required = false) byte[] rawBody) {

        String correlationId = MdcContext.correlationIdFor(deliveryId);
        MdcContext.setCorrelationId(correlationId);
        try {
            log.info("Webhook received: event={}, correlationId={}", eventType, correlationId);

            if (rawBody == null || rawBody.length == 0) {
                log.warn("Missing request body");
                return reply(HttpStatus.BAD_REQUEST, "rejected", "Missing request body");
            }
            if (signature == null || signature.isEmpty()) {
                log.warn("Missing signature header");
                return reply(HttpStatus.UNAUTHORIZED, "rejected", "Invalid signature");
            }
            if (eventType == null || eventType.isEmpty()) {
                log.warn("Missing event type header");
                return reply(HttpStatus.BAD_REQUEST, "rejected", "Missing event type");
            }
            if (!signatureVerifier.isValid(rawBody, signature)) {
                log.warn("Invalid webhook signature");
                return reply(HttpStatus.UNAUTHORIZED, "rejected", "Invalid signature");
            }
            if (!REVIEWABLE_EVENTS.contains(eventType)) {
                log.info("Ignoring non-pull request event {}", eventType);
                return reply(HttpStatus.OK, "ignored", "Event ignored");
            }

            JsonNode payload;
            try {
                payload = objectMapper.readTree(rawBody);
            } catch (IOException e) {
                log.warn("Failed to parse webhook payload: {}", e.getMessage());
                return reply(HttpStatus.BAD_REQUEST, "rejected", "Invalid payload");
            }

            WebhookEvent event = eventClassifier.classify(payload);
            boolean handled = eventRouter.route(event, correlationId);

            log.info("Webhook processed successfully: eventType={}, repository={}, handled={}",
                    event.kind(), event.repository(), handled);
            return reply(HttpStatus.OK, "processed", "OK");
        } finally {
            MdcContext.clear();
        }
    }

    private static ResponseEntity<Map<String, Object>> reply(HttpStatus status, String outcome, String message) {
        return ResponseEntity.status(status).body(Map.of("status", outcome, "message", message));
    }
}
