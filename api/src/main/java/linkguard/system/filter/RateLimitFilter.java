package linkguard.system.filter;

import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;
import org.jboss.resteasy.reactive.server.ServerResponseFilter;

import linkguard.adapter.in.http.CallerAddressResolver;
import linkguard.config.RateLimitingConfig;
import linkguard.core.model.ratelimit.AdmissionOutcome;
import linkguard.core.model.ratelimit.AdmissionRequest;
import linkguard.core.model.ratelimit.RateLimitHeaders;
import linkguard.core.service.ratelimit.AdmissionChain;

/**
 * Reactive filter that enforces rate limits on incoming requests.
 *
 * <p>Runs the {@link AdmissionChain} before the resource method. A denied
 * request is answered by the {@link DenialHandler} with quota headers and
 * {@code Retry-After}; an admitted one gets the quota headers on its response.
 * Requests that were skipped or failed open carry no quota headers.
 */
public class RateLimitFilter {

    static final String ADMISSION_OUTCOME_ATTR = "linkguard.ratelimit.outcome";

    private final AdmissionChain admissionChain;
    private final DenialHandler denialHandler;
    private final RateLimitingConfig config;
    private final CallerAddressResolver callerAddresses;

    @Inject
    public RateLimitFilter(
            AdmissionChain admissionChain,
            DenialHandler denialHandler,
            RateLimitingConfig config,
            CallerAddressResolver callerAddresses) {
        this.admissionChain = admissionChain;
        this.denialHandler = denialHandler;
        this.config = config;
        this.callerAddresses = callerAddresses;
    }

    /**
     * Reactive filter method for rate limiting.
     *
     * @param requestContext the request context
     * @param request the underlying HTTP request
     * @return Uni with null to continue, or Response to abort
     */
    @ServerRequestFilter(priority = Priorities.AUTHENTICATION - 50)
    public Uni<Response> filter(ContainerRequestContext requestContext, HttpServerRequest request) {
        if (!admissionChain.isEnabled()) {
            return Uni.createFrom().nullItem();
        }

        final var remote = request != null && request.remoteAddress() != null
                ? request.remoteAddress().hostAddress()
                : null;
        final var callerAddress = callerAddresses.resolve(
                requestContext.getHeaderString("Forwarded"),
                requestContext.getHeaderString("X-Forwarded-For"),
                remote);
        final var admissionRequest = new AdmissionRequest(
                callerAddress, requestContext.getMethod(), requestContext.getUriInfo().getPath());

        return admissionChain.admit(admissionRequest).map(outcome -> {
            requestContext.setProperty(ADMISSION_OUTCOME_ATTR, outcome);
            if (outcome.admitted()) {
                return null;
            }
            return withDenialHeaders(denialHandler.onDenied(admissionRequest, outcome), outcome);
        });
    }

    private Response withDenialHeaders(Response response, AdmissionOutcome outcome) {
        final var builder = Response.fromResponse(response);
        outcome.headers().ifPresent(headers -> headers.asMap().forEach((name, value) -> {
            if (config.includeHeaders() || RateLimitHeaders.RETRY_AFTER.equals(name)) {
                builder.header(name, null).header(name, value);
            }
        }));
        return builder.build();
    }

    /**
     * Attach quota headers to admitted responses.
     */
    @ServerResponseFilter
    public void addRateLimitHeaders(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        if (!config.includeHeaders()) {
            return;
        }
        final var property = requestContext.getProperty(ADMISSION_OUTCOME_ATTR);
        if (!(property instanceof AdmissionOutcome outcome) || !outcome.admitted()) {
            return;
        }
        outcome.headers().ifPresent(headers -> headers.asMap()
                .forEach((name, value) -> responseContext.getHeaders().putSingle(name, value)));
    }
}
