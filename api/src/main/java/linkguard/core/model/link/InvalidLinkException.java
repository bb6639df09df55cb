package linkguard.core.model.link;

/**
 * Thrown when a URL cannot be shortened.
 */
public class InvalidLinkException extends RuntimeException {

    public InvalidLinkException(String message) {
        super(message);
    }
}
