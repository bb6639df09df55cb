package linkguard.core.model.link;

/**
 * Lifecycle status of a short link.
 */
public enum LinkStatus {
    ACTIVE,
    DISABLED
}
