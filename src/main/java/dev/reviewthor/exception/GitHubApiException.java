package dev.reviewthor.exception;

/**
 * A GitHub REST or authentication call failed.
 */
public class GitHubApiException extends ReviewThorException {

    public GitHubApiException(String message) {
        super(ErrorKind.TRANSPORT, message);
    }

    public GitHubApiException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT, message, cause);
    }
}
