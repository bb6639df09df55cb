package linkguard.system.filter;

import jakarta.ws.rs.core.Response;

import linkguard.core.model.ratelimit.AdmissionOutcome;
import linkguard.core.model.ratelimit.AdmissionRequest;

/**
 * Builds the response for a request the rate limiter denied.
 *
 * <p>Provide a CDI bean implementing this interface to replace the default
 * 429 problem response. Quota headers and {@code Retry-After} are added to
 * whatever response is returned.
 */
@FunctionalInterface
public interface DenialHandler {

    Response onDenied(AdmissionRequest request, AdmissionOutcome outcome);
}
