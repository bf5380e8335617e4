package dev.reviewthor.logging;

import org.slf4j.MDC;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Utility for the ReviewThor MDC keys printed by the log pattern.
 */
public final class MdcContext {

    public static final String CORRELATION_ID = "correlationId";
    public static final String REPOSITORY = "repository";
    public static final String PULL_REQUEST = "pr";

    private MdcContext() {}

    public static void setCorrelationId(String correlationId) {
        MDC.put(CORRELATION_ID, correlationId);
    }

    public static void setPullRequest(String repository, int prNumber) {
        MDC.put(REPOSITORY, repository);
        MDC.put(PULL_REQUEST, String.valueOf(prNumber));
    }

    /** Uses the GitHub delivery id when present, otherwise {@code rev-<millis>-<9 base36 chars>}. */
    public static String correlationIdFor(String deliveryId) {
        if (deliveryId != null && !deliveryId.isBlank()) return deliveryId;
        StringBuilder suffix = new StringBuilder(9);
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < 9; i++) {
            suffix.append(Character.forDigit(random.nextInt(36), 36));
        }
        return "rev-" + System.currentTimeMillis() + "-" + suffix;
    }

    public static void clear() {
        MDC.remove(CORRELATION_ID);
        MDC.remove(REPOSITORY);
        MDC.remove(PULL_REQUEST);
    }
}
