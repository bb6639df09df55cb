package linkguard.core.service.link;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import linkguard.core.model.link.InvalidLinkException;
import linkguard.core.model.link.LinkLookupException;
import linkguard.core.model.link.LinkRecord;
import linkguard.core.model.link.ShortCodeExhaustedException;
import linkguard.core.model.link.VisitRecord;
import linkguard.core.port.out.LinkRepository;
import linkguard.core.service.resolution.ResolutionCascade;
import linkguard.core.service.visit.VisitRecorder;

/**
 * Creates, resolves and describes short links.
 */
public class ShortLinkService {

    private static final Logger LOG = Logger.getLogger(ShortLinkService.class);

    private final LinkRepository repository;
    private final ResolutionCascade cascade;
    private final ShortCodeGenerator codeGenerator;
    private final VisitRecorder visitRecorder;
    private final int collisionRetries;
    private final Clock clock;

    public ShortLinkService(
            LinkRepository repository,
            ResolutionCascade cascade,
            ShortCodeGenerator codeGenerator,
            VisitRecorder visitRecorder,
            int collisionRetries,
            Clock clock) {
        this.repository = repository;
        this.cascade = cascade;
        this.codeGenerator = codeGenerator;
        this.visitRecorder = visitRecorder;
        this.collisionRetries = collisionRetries;
        this.clock = clock;
    }

    /**
     * Shorten a URL.
     *
     * <p>An active link for the same URL is reused. Otherwise a new code is
     * generated, saved and registered with the filter and cache before the Uni
     * completes.
     *
     * @param originalUrl an absolute http or https URL
     * @param expiresAt optional expiry, must lie in the future
     * @return the created or reused link
     * @throws InvalidLinkException (as a failed Uni) if the URL or expiry is invalid
     */
    public Uni<CreatedLink> shorten(String originalUrl, Instant expiresAt) {
        final String url;
        try {
            url = normalizeUrl(originalUrl);
        } catch (InvalidLinkException e) {
            return Uni.createFrom().failure(e);
        }
        final var now = clock.instant();
        if (expiresAt != null && !expiresAt.isAfter(now)) {
            return Uni.createFrom().failure(new InvalidLinkException("Expiry must be in the future"));
        }

        return repository.findByOriginalUrl(url).flatMap(existing -> {
            if (existing.isPresent() && existing.get().isResolvable(now)) {
                LOG.debugf("Reusing short code %s for %s", existing.get().shortCode(), url);
                return Uni.createFrom().item(new CreatedLink(existing.get(), true));
            }
            return createNew(url, expiresAt, now, 0).map(link -> new CreatedLink(link, false));
        });
    }

    private Uni<LinkRecord> createNew(String originalUrl, Instant expiresAt, Instant now, int attempt) {
        final var code = codeGenerator.nextCode();
        return repository.findByShortCode(code).flatMap(clash -> {
            if (clash.isPresent()) {
                if (attempt >= collisionRetries) {
                    return Uni.createFrom().failure(new ShortCodeExhaustedException(attempt + 1));
                }
                LOG.warnv("Short code collision on {0}, retrying (attempt {1})", code, attempt + 1);
                return createNew(originalUrl, expiresAt, now, attempt + 1);
            }
            return repository
                    .save(LinkRecord.create(code, originalUrl, now, expiresAt))
                    .call(cascade::register)
                    .invoke(saved -> LOG.infov("Created short code {0} for {1}", saved.shortCode(), originalUrl));
        });
    }

    /**
     * Resolve a code for redirection and queue a visit when it resolves.
     *
     * @param shortCode the short code
     * @param callerAddress the client address
     * @param userAgent the client user agent
     * @return the target URL, or empty if not resolvable
     * @throws LinkLookupException (as a failed Uni) if the durable store fails
     */
    public Uni<Optional<String>> resolve(String shortCode, String callerAddress, String userAgent) {
        return cascade.resolve(shortCode).invoke(url -> {
            if (url.isPresent()) {
                visitRecorder.submit(new VisitRecord(shortCode, clock.instant(), callerAddress, userAgent));
            }
        });
    }

    /**
     * Look up link details.
     *
     * @param shortCode the short code
     * @return the link, or empty if unknown
     */
    public Uni<Optional<LinkRecord>> info(String shortCode) {
        return cascade.lookupRecord(shortCode);
    }

    /**
     * Validate a URL and return the trimmed form that is stored and redirected to.
     */
    static String normalizeUrl(String originalUrl) {
        if (originalUrl == null || originalUrl.isBlank()) {
            throw new InvalidLinkException("URL is required");
        }
        final var url = originalUrl.trim();
        final URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new InvalidLinkException("Invalid URL format: " + e.getMessage());
        }
        final var scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new InvalidLinkException("URL must use http or https scheme");
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new InvalidLinkException("URL must have a valid host");
        }
        return url;
    }
}
