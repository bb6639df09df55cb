package linkguard.adapter.in.rest.dto;

import java.time.Instant;

/**
 * Body of {@code POST /api/v1/shorten}.
 *
 * @param url the URL to shorten
 * @param expiresAt optional expiry
 */
public record ShortenRequest(String url, Instant expiresAt) {}
