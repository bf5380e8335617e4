package dev.reviewthor.exception;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.springframework.web.reactive.function.client.WebClientException;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Normalized view of anything caught while processing a pull request. Created immediately
 * on catch so logging never has to inspect raw throwables.
 */
public record ReviewFailure(ErrorKind kind, String message) {

    public static final String UNKNOWN_ERROR = "Unknown error";

    public static ReviewFailure of(Throwable thrown) {
        if (thrown == null) {
            return new ReviewFailure(ErrorKind.UNKNOWN, UNKNOWN_ERROR);
        }
        String message = thrown.getMessage() != null && !thrown.getMessage().isBlank()
                ? thrown.getMessage() : UNKNOWN_ERROR;
        return new ReviewFailure(classify(thrown), message);
    }

    private static ErrorKind classify(Throwable thrown) {
        if (thrown instanceof ReviewThorException rte) return rte.kind();
        if (thrown instanceof WebClientException
                || thrown instanceof IOException
                || thrown instanceof UncheckedIOException
                || thrown instanceof CallNotPermittedException
                || thrown instanceof RequestNotPermitted) {
            return ErrorKind.TRANSPORT;
        }
        return ErrorKind.UNKNOWN;
    }
}
