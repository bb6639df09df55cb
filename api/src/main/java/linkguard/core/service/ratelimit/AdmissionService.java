package linkguard.core.service.ratelimit;

import java.time.Clock;
import java.util.OptionalLong;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import linkguard.core.model.ratelimit.AdmissionOutcome;
import linkguard.core.model.ratelimit.AdmissionRequest;
import linkguard.core.model.ratelimit.IdentityKeyStrategy;
import linkguard.core.model.ratelimit.RateLimitDecision;
import linkguard.core.model.ratelimit.RateLimitHeaders;
import linkguard.core.model.ratelimit.SkipPredicate;
import linkguard.core.port.out.Metrics;
import linkguard.core.port.out.RateLimiter;

/**
 * Admission controller in front of protected operations.
 *
 * <p>Applies the skip predicate, derives the identity key, consults the limiter
 * and turns the decision into quota metadata. A limiter failure admits the
 * request so that a store outage never becomes a service outage.
 */
public class AdmissionService {

    private static final Logger LOG = Logger.getLogger(AdmissionService.class);

    private final String name;
    private final RateLimiter limiter;
    private final IdentityKeyStrategy keyStrategy;
    private final SkipPredicate skipPredicate;
    private final Metrics metrics;
    private final Clock clock;

    public AdmissionService(
            String name,
            RateLimiter limiter,
            IdentityKeyStrategy keyStrategy,
            SkipPredicate skipPredicate,
            Metrics metrics,
            Clock clock) {
        this.name = name;
        this.limiter = limiter;
        this.keyStrategy = keyStrategy;
        this.skipPredicate = skipPredicate != null ? skipPredicate : SkipPredicate.never();
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Run a request through admission.
     *
     * <p>The returned Uni never fails on a limiter error.
     *
     * @param request the request
     * @return the outcome
     */
    public Uni<AdmissionOutcome> admit(AdmissionRequest request) {
        if (skipPredicate.shouldSkip(request)) {
            return Uni.createFrom().item(AdmissionOutcome.skipped());
        }

        final var identity = keyStrategy.identityFor(request);
        final var algorithm = limiter.algorithm();

        return Uni.createFrom()
                .deferred(() -> limiter.check(identity))
                .map(decision -> toOutcome(identity, decision))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Rate limit check failed open for identity {0} (limiter {1}, algorithm {2}): {3}",
                            identity, name, algorithm, error.getMessage());
                    if (metrics != null) {
                        metrics.recordRateLimitFailOpen(algorithm);
                    }
                    return AdmissionOutcome.failedOpen(identity);
                });
    }

    private AdmissionOutcome toOutcome(String identity, RateLimitDecision decision) {
        final var retryAfter = decision.allowed()
                ? OptionalLong.empty()
                : OptionalLong.of(decision.retryAfterSeconds(clock.instant()));
        final var headers = new RateLimitHeaders(
                decision.limit(), decision.remaining(), decision.resetAtEpochSeconds(), retryAfter);

        if (metrics != null) {
            metrics.recordRateLimitDecision(limiter.algorithm(), decision.allowed());
        }
        if (!decision.allowed()) {
            LOG.debugf("Rate limit exceeded for %s by limiter %s", identity, name);
        }
        return AdmissionOutcome.checked(identity, decision, headers);
    }

    public String name() {
        return name;
    }
}
