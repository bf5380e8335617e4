package dev.reviewthor.exception;

/**
 * A webhook payload lacks a field every supported event needs.
 */
public class MissingFieldException extends ReviewThorException {

    private final String field;

    public MissingFieldException(String field) {
        super(ErrorKind.VALIDATION, "Missing " + field);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
