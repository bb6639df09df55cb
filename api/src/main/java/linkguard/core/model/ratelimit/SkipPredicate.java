package linkguard.core.model.ratelimit;

import java.util.List;

/**
 * Decides whether a request bypasses rate limiting entirely.
 *
 * <p>Skipped requests never touch limiter state.
 */
@FunctionalInterface
public interface SkipPredicate {

    boolean shouldSkip(AdmissionRequest request);

    /**
     * A predicate that never skips.
     *
     * @return the predicate
     */
    static SkipPredicate never() {
        return request -> false;
    }

    /**
     * Skip requests whose path equals or starts with one of the given prefixes.
     *
     * @param prefixes path prefixes, e.g. {@code /health}
     * @return the predicate
     */
    static SkipPredicate pathPrefixes(List<String> prefixes) {
        final var copy = List.copyOf(prefixes);
        if (copy.isEmpty()) {
            return never();
        }
        return request -> copy.stream().anyMatch(prefix -> request.path().startsWith(prefix));
    }
}
