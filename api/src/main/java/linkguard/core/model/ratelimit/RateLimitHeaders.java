package linkguard.core.model.ratelimit;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Quota metadata attached to every gated response.
 *
 * @param limit the configured limit
 * @param remaining remaining requests, floored at zero
 * @param resetEpochSeconds reset time in Unix seconds
 * @param retryAfterSeconds seconds to wait, present only on denial
 */
public record RateLimitHeaders(long limit, long remaining, long resetEpochSeconds, OptionalLong retryAfterSeconds) {

    public static final String LIMIT = "X-RateLimit-Limit";
    public static final String REMAINING = "X-RateLimit-Remaining";
    public static final String RESET = "X-RateLimit-Reset";
    public static final String RETRY_AFTER = "Retry-After";

    /**
     * Render as HTTP header name/value pairs in a stable order.
     *
     * @return the headers
     */
    public Map<String, String> asMap() {
        final var headers = new LinkedHashMap<String, String>();
        headers.put(LIMIT, String.valueOf(limit));
        headers.put(REMAINING, String.valueOf(Math.max(0, remaining)));
        headers.put(RESET, String.valueOf(resetEpochSeconds));
        retryAfterSeconds.ifPresent(seconds -> headers.put(RETRY_AFTER, String.valueOf(Math.max(0, seconds))));
        return headers;
    }
}
