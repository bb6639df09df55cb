package linkguard.adapter.in.rest.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

import linkguard.core.model.link.LinkRecord;
import linkguard.core.model.link.LinkStatus;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LinkInfoResponse(
        String shortCode,
        String originalUrl,
        long visitCount,
        Instant createdAt,
        Instant expiresAt,
        LinkStatus status) {

    public static LinkInfoResponse from(LinkRecord link) {
        return new LinkInfoResponse(
                link.shortCode(),
                link.originalUrl(),
                link.visitCount(),
                link.createdAt(),
                link.expiresAt().orElse(null),
                link.status());
    }
}
