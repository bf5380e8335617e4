package dev.reviewthor.exception;

/**
 * The review service response could not be parsed or did not match the finding schema.
 */
public class InvalidResponseFormatException extends ReviewThorException {

    static final String PREFIX = "Invalid AI response format: ";

    public InvalidResponseFormatException(String detail) {
        super(ErrorKind.CONTRACT, PREFIX + detail);
    }

    public InvalidResponseFormatException(String detail, Throwable cause) {
        super(ErrorKind.CONTRACT, PREFIX + detail, cause);
    }
}
