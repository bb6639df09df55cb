package linkguard.core.model.ratelimit;

/**
 * Derives the identity key that scopes rate limit state.
 *
 * <p>Built-in strategies are obtained from {@link IdentityKeyType#strategy(String)}.
 */
@FunctionalInterface
public interface IdentityKeyStrategy {

    /**
     * Compute the identity key for a request.
     *
     * @param request the request
     * @return a deterministic key, distinct for distinct subjects
     */
    String identityFor(AdmissionRequest request);
}
