package linkguard.core.model.link;

/**
 * Thrown when the durable link store fails.
 *
 * <p>Distinct from a missing link: the store could not answer at all.
 */
public class LinkLookupException extends RuntimeException {

    private final String shortCode;

    public LinkLookupException(String shortCode, Throwable cause) {
        super("Link lookup failed for short code: " + shortCode, cause);
        this.shortCode = shortCode;
    }

    public String getShortCode() {
        return shortCode;
    }
}
