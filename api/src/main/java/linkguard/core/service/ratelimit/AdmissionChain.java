package linkguard.core.service.ratelimit;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import linkguard.core.model.ratelimit.AdmissionOutcome;
import linkguard.core.model.ratelimit.AdmissionRequest;

/**
 * Runs the global limiter and then the most specific matching endpoint limiter.
 *
 * <p>The endpoint limiter is consulted only when the global one admits. The
 * outcome reported is the first denial, or else the endpoint outcome when it
 * carries quota metadata, or else the global outcome.
 */
public class AdmissionChain {

    private final Optional<AdmissionService> global;
    private final List<EndpointLimiter> endpoints;

    public AdmissionChain(Optional<AdmissionService> global, List<EndpointLimiter> endpoints) {
        this.global = global;
        this.endpoints = endpoints.stream()
                .sorted(Comparator.comparingInt(EndpointLimiter::specificity).reversed())
                .toList();
    }

    /**
     * A chain that admits everything.
     *
     * @return the chain
     */
    public static AdmissionChain disabled() {
        return new AdmissionChain(Optional.empty(), List.of());
    }

    public Uni<AdmissionOutcome> admit(AdmissionRequest request) {
        final var globalOutcome = global.map(service -> service.admit(request))
                .orElseGet(() -> Uni.createFrom().item(AdmissionOutcome.skipped()));

        return globalOutcome.flatMap(outcome -> {
            if (!outcome.admitted()) {
                return Uni.createFrom().item(outcome);
            }
            final var endpoint = endpointFor(request);
            if (endpoint.isEmpty()) {
                return Uni.createFrom().item(outcome);
            }
            return endpoint.get()
                    .admission()
                    .admit(request)
                    .map(endpointOutcome -> endpointOutcome.headers().isPresent() ? endpointOutcome : outcome);
        });
    }

    Optional<EndpointLimiter> endpointFor(AdmissionRequest request) {
        return endpoints.stream().filter(endpoint -> endpoint.matches(request)).findFirst();
    }

    public boolean isEnabled() {
        return global.isPresent() || !endpoints.isEmpty();
    }
}
