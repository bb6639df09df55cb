package linkguard.core.model.ratelimit;

/**
 * Configurable identity key strategies.
 */
public enum IdentityKeyType {

    /** One bucket per caller address, shared across paths. */
    CALLER,

    /** One bucket per path, shared by all callers. */
    TARGET,

    /** One bucket per caller and path (default). */
    CALLER_AND_TARGET;

    /**
     * Build the strategy for this type.
     *
     * @param prefix key prefix, e.g. {@code linkguard:ratelimit:}
     * @return the strategy
     */
    public IdentityKeyStrategy strategy(String prefix) {
        return switch (this) {
            case CALLER -> request -> prefix + "ip:" + request.callerAddress();
            case TARGET -> request -> prefix + "path:" + request.path();
            case CALLER_AND_TARGET -> request -> prefix + request.callerAddress() + ":" + request.path();
        };
    }
}
