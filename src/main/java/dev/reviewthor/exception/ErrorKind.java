package dev.reviewthor.exception;

/**
 * Coarse failure classes used when logging and when deciding the webhook response.
 */
public enum ErrorKind {
    /** Bad input at the boundary: unsupported event, missing payload fields. */
    VALIDATION,
    /** The review service answered, but not in the agreed shape. */
    CONTRACT,
    /** A network call to GitHub or the review service failed. */
    TRANSPORT,
    UNKNOWN
}
