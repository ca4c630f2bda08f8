package in.epicast.domain.common;

/**
 * Missing or contradictory request parameters. Raised before any query executes.
 */
public class ValidationFailedException extends RuntimeException {

    public ValidationFailedException(String message) {
        super(message);
    }

    public ValidationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
