package linkguard.core.model.link;

import java.time.Instant;

/**
 * A single followed redirect.
 *
 * @param shortCode the visited short code
 * @param visitedAt when the redirect was served
 * @param callerAddress the client address
 * @param userAgent the client user agent, may be null
 */
public record VisitRecord(String shortCode, Instant visitedAt, String callerAddress, String userAgent) {}
