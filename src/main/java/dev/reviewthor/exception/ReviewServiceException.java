package dev.reviewthor.exception;

/**
 * The language-model backend could not be reached or rejected the request.
 */
public class ReviewServiceException extends ReviewThorException {

    public ReviewServiceException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT, message, cause);
    }
}
