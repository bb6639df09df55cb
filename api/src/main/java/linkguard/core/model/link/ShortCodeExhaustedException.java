package linkguard.core.model.link;

/**
 * Thrown when no unused short code could be generated within the retry budget.
 */
public class ShortCodeExhaustedException extends RuntimeException {

    public ShortCodeExhaustedException(int attempts) {
        super("Failed to generate a unique short code after " + attempts + " attempts");
    }
}
