package linkguard.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import linkguard.core.model.link.LinkRecord;
import linkguard.core.model.link.VisitRecord;

/**
 * Port interface for the durable short link store.
 */
public interface LinkRepository {

    /**
     * Find a link by short code.
     *
     * @param shortCode the short code
     * @return the link if present
     */
    Uni<Optional<LinkRecord>> findByShortCode(String shortCode);

    /**
     * Find the most recent link for an original URL.
     *
     * @param originalUrl the original URL
     * @return the link if present
     */
    Uni<Optional<LinkRecord>> findByOriginalUrl(String originalUrl);

    /**
     * Stream every known short code. Used to rebuild the existence filter.
     *
     * @return all short codes
     */
    Multi<String> streamAllShortCodes();

    /**
     * Persist a link, replacing any record with the same short code.
     *
     * @param link the link
     * @return the saved link
     */
    Uni<LinkRecord> save(LinkRecord link);

    /**
     * Atomically increment a link's visit count.
     *
     * @param shortCode the short code
     * @return completion
     */
    Uni<Void> incrementVisitCount(String shortCode);

    /**
     * Append a visit to the visit log.
     *
     * @param visit the visit
     * @return completion
     */
    Uni<Void> saveVisit(VisitRecord visit);
}
