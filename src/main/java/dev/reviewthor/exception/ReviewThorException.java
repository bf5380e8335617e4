package dev.reviewthor.exception;

/**
 * Base exception for all ReviewThor failures. Carries the {@link ErrorKind} it belongs to.
 */
public class ReviewThorException extends RuntimeException {

    private final ErrorKind kind;

    public ReviewThorException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ReviewThorException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
