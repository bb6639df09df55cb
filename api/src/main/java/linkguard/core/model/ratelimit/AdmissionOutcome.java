package linkguard.core.model.ratelimit;

import java.util.Optional;

/**
 * Result of running a request through the admission controller.
 *
 * @param status what happened
 * @param identity the identity key, absent for skipped requests
 * @param decision the limiter decision, absent when skipped or failed open
 * @param headers quota metadata, absent when skipped or failed open
 */
public record AdmissionOutcome(
        Status status, Optional<String> identity, Optional<RateLimitDecision> decision, Optional<RateLimitHeaders> headers) {

    /**
     * Admission status.
     */
    public enum Status {
        /** The skip predicate matched; no limiter state was touched. */
        SKIPPED,
        /** The limiter admitted the request. */
        ALLOWED,
        /** The limiter rejected the request. */
        DENIED,
        /** The store failed; the request is admitted without quota metadata. */
        FAILED_OPEN
    }

    public static AdmissionOutcome skipped() {
        return new AdmissionOutcome(Status.SKIPPED, Optional.empty(), Optional.empty(), Optional.empty());
    }

    public static AdmissionOutcome failedOpen(String identity) {
        return new AdmissionOutcome(Status.FAILED_OPEN, Optional.of(identity), Optional.empty(), Optional.empty());
    }

    public static AdmissionOutcome checked(String identity, RateLimitDecision decision, RateLimitHeaders headers) {
        return new AdmissionOutcome(
                decision.allowed() ? Status.ALLOWED : Status.DENIED,
                Optional.of(identity),
                Optional.of(decision),
                Optional.of(headers));
    }

    /**
     * Whether the request may proceed.
     *
     * @return true unless the limiter denied it
     */
    public boolean admitted() {
        return status != Status.DENIED;
    }
}
