package dev.reviewthor.exception;

/**
 * A webhook payload that is none of the recognised event kinds.
 */
public class UnsupportedEventException extends ReviewThorException {

    private final String action;

    public UnsupportedEventException(String action) {
        super(ErrorKind.VALIDATION, "Unsupported event type: " + action);
        this.action = action;
    }

    public String action() {
        return action;
    }
}
