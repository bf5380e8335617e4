package dev.reviewthor.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.time.Instant;

/**
 * Maps failures that escape the webhook controller to RFC 7807 Problem Details.
 *
 * <p>Validation failures (unsupported event, missing payload fields) are the caller's fault and
 * answer 400 with the message. Everything else is 500 with a generic detail; internals are
 * logged server-side only.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ReviewThorException.class)
    public ProblemDetail handleReviewThor(ReviewThorException ex) {
        if (ex.kind() != ErrorKind.VALIDATION) {
            return handleUnexpected(ex);
        }
        log.warn("Rejected webhook payload: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setType(URI.create("https://reviewthor.dev/errors/invalid-event"));
        problem.setTitle("Invalid Event");
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        log.error("Error processing webhook", ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
        problem.setType(URI.create("https://reviewthor.dev/errors/internal"));
        problem.setTitle("Internal Server Error");
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }
}
