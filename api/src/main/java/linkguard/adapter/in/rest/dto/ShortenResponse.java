package linkguard.adapter.in.rest.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

import linkguard.core.model.link.LinkRecord;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ShortenResponse(String shortCode, String shortUrl, String originalUrl, Instant expiresAt) {

    public static ShortenResponse from(LinkRecord link, String baseUrl) {
        final var base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return new ShortenResponse(
                link.shortCode(),
                base + "/" + link.shortCode(),
                link.originalUrl(),
                link.expiresAt().orElse(null));
    }
}
