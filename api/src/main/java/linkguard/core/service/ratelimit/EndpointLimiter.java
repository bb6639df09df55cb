package linkguard.core.service.ratelimit;

import java.util.Optional;

import linkguard.core.model.ratelimit.AdmissionRequest;

/**
 * An admission service bound to one endpoint.
 *
 * @param name the configured limiter name
 * @param method the HTTP method, or empty for any method
 * @param pathPattern an exact path, or a prefix ending in {@code *}
 * @param admission the admission service
 */
public record EndpointLimiter(String name, Optional<String> method, String pathPattern, AdmissionService admission) {

    public boolean matches(AdmissionRequest request) {
        if (method.isPresent() && !method.get().equalsIgnoreCase(request.method())) {
            return false;
        }
        if (pathPattern.endsWith("*")) {
            return request.path().startsWith(pathPattern.substring(0, pathPattern.length() - 1));
        }
        return pathPattern.equals(request.path());
    }

    /**
     * Ranks patterns so that exact paths beat wildcards and longer prefixes beat shorter ones.
     *
     * @return specificity score
     */
    int specificity() {
        final var exactBonus = pathPattern.endsWith("*") ? 0 : 10_000;
        final var methodBonus = method.isPresent() ? 1 : 0;
        return exactBonus + pathPattern.length() * 2 + methodBonus;
    }
}
