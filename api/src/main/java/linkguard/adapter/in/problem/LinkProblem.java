package linkguard.adapter.in.problem;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details for short link errors.
 *
 * <p>Problems may be thrown from resources (resteasy-problem renders them) or
 * wrapped with {@link #toResponse(HttpProblem)} where a {@link Response} is required,
 * as in exception mappers and the rate limit filter.
 */
public final class LinkProblem {

    public static final String PROBLEM_JSON = "application/problem+json";

    private LinkProblem() {
        // Utility class - prevent instantiation
    }

    public static HttpProblem linkNotFound(String detail) {
        return HttpProblem.builder()
                .withTitle("Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem serviceUnavailable(String detail) {
        return HttpProblem.builder()
                .withTitle("Service Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail(detail)
                .build();
    }

    /**
     * Rate limit denial with the quota as extension members.
     *
     * @param detail human-readable detail
     * @param retryAfterSeconds seconds until a retry may succeed
     * @param limit the limit that was exceeded
     * @param remaining remaining quota
     * @param resetAtEpochSeconds when the quota resets
     * @return a 429 problem
     */
    public static HttpProblem tooManyRequests(
            String detail, long retryAfterSeconds, long limit, long remaining, long resetAtEpochSeconds) {
        return HttpProblem.builder()
                .withTitle("Too Many Requests")
                .withStatus(Status.TOO_MANY_REQUESTS)
                .withDetail(detail)
                .withHeader("Retry-After", retryAfterSeconds)
                .with("retryAfter", retryAfterSeconds)
                .with("limit", limit)
                .with("remaining", remaining)
                .with("resetAt", resetAtEpochSeconds)
                .build();
    }

    /**
     * Wrap a problem as a response, carrying over its status and headers.
     */
    public static Response toResponse(HttpProblem problem) {
        final var builder = Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem);
        problem.getHeaders().forEach(builder::header);
        return builder.build();
    }
}
