package linkguard.system.filter;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkus.arc.DefaultBean;

import linkguard.adapter.in.problem.LinkProblem;
import linkguard.core.model.ratelimit.AdmissionOutcome;
import linkguard.core.model.ratelimit.AdmissionRequest;

/**
 * Default denial: 429 with a problem body.
 */
@DefaultBean
@ApplicationScoped
public class DefaultDenialHandler implements DenialHandler {

    static final String DETAIL = "Rate limit exceeded. Please try again later.";

    @Override
    public Response onDenied(AdmissionRequest request, AdmissionOutcome outcome) {
        final var headers = outcome.headers().orElseThrow();
        return LinkProblem.toResponse(LinkProblem.tooManyRequests(
                DETAIL,
                headers.retryAfterSeconds().orElse(0),
                headers.limit(),
                headers.remaining(),
                headers.resetEpochSeconds()));
    }
}
