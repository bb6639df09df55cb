package linkguard.core.model.link;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A short code mapped to its original URL.
 *
 * @param shortCode the Base62 short code
 * @param originalUrl the target URL
 * @param createdAt creation time
 * @param expiresAt optional expiry; a link without one never expires
 * @param visitCount number of recorded visits
 * @param status lifecycle status
 */
public record LinkRecord(
        String shortCode,
        String originalUrl,
        Instant createdAt,
        Optional<Instant> expiresAt,
        long visitCount,
        LinkStatus status) {

    public LinkRecord {
        Objects.requireNonNull(shortCode, "shortCode must not be null");
        Objects.requireNonNull(originalUrl, "originalUrl must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        expiresAt = expiresAt != null ? expiresAt : Optional.empty();
        status = status != null ? status : LinkStatus.ACTIVE;
    }

    /**
     * Create a new active link with no visits.
     */
    public static LinkRecord create(String shortCode, String originalUrl, Instant createdAt, Instant expiresAt) {
        return new LinkRecord(shortCode, originalUrl, createdAt, Optional.ofNullable(expiresAt), 0, LinkStatus.ACTIVE);
    }

    /**
     * Whether the link may be followed at the given time.
     *
     * @param now the current time
     * @return true if active and not expired
     */
    public boolean isResolvable(Instant now) {
        return status == LinkStatus.ACTIVE
                && expiresAt.map(expiry -> expiry.isAfter(now)).orElse(true);
    }

    public LinkRecord withVisitCount(long count) {
        return new LinkRecord(shortCode, originalUrl, createdAt, expiresAt, count, status);
    }
}
