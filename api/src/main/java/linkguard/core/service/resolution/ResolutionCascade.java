package linkguard.core.service.resolution;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.stream.Collectors;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import linkguard.core.model.link.LinkLookupException;
import linkguard.core.model.link.LinkRecord;
import linkguard.core.port.out.LinkRepository;
import linkguard.core.port.out.Metrics;
import linkguard.core.port.out.ResolutionCache;
import linkguard.core.service.filter.ExistenceFilter;

/**
 * Resolves short codes through filter, cache and durable store, in that order.
 *
 * <p>A code the filter has never seen resolves to empty without touching the
 * cache or the store. Cache errors degrade to a store lookup. Store errors fail
 * with {@link LinkLookupException}. Every kind of miss looks the same to the
 * caller.
 */
public class ResolutionCascade {

    private static final Logger LOG = Logger.getLogger(ResolutionCascade.class);

    private static final int REBUILD_BATCH_SIZE = 1000;

    private final ExistenceFilter filter;
    private final ResolutionCache cache;
    private final LinkRepository repository;
    private final Metrics metrics;
    private final Duration cacheTtl;
    private final Clock clock;

    public ResolutionCascade(
            ExistenceFilter filter,
            ResolutionCache cache,
            LinkRepository repository,
            Metrics metrics,
            Duration cacheTtl,
            Clock clock) {
        this.filter = filter;
        this.cache = cache;
        this.repository = repository;
        this.metrics = metrics;
        this.cacheTtl = cacheTtl;
        this.clock = clock;
    }

    /**
     * Resolve a short code to its original URL.
     *
     * @param shortCode the short code
     * @return the URL, or empty if the code is unknown, expired or disabled
     */
    public Uni<Optional<String>> resolve(String shortCode) {
        if (!filter.mightContain(shortCode)) {
            record("filter", false);
            return Uni.createFrom().item(Optional.empty());
        }

        return cacheLookup(shortCode).flatMap(cached -> {
            if (cached.isPresent()) {
                record("cache", true);
                return Uni.createFrom().item(cached);
            }
            return storeLookup(shortCode);
        });
    }

    /**
     * Load the full record for a short code, gated by the filter only.
     *
     * @param shortCode the short code
     * @return the record, or empty if unknown
     */
    public Uni<Optional<LinkRecord>> lookupRecord(String shortCode) {
        if (!filter.mightContain(shortCode)) {
            return Uni.createFrom().item(Optional.empty());
        }
        return findInStore(shortCode);
    }

    /**
     * Make a newly created link visible to the filter and the cache.
     *
     * @param link the saved link
     * @return completion; a cache failure does not fail it
     */
    public Uni<Void> register(LinkRecord link) {
        filter.add(link.shortCode());
        return cacheWrite(link, clock.instant());
    }

    /**
     * Reload the filter from every short code in the durable store.
     *
     * <p>Codes are added on top of the current contents, so codes registered while
     * the rebuild runs are kept.
     *
     * @return the number of codes loaded
     */
    public Uni<Long> rebuildFilter() {
        return repository
                .streamAllShortCodes()
                .group()
                .intoLists()
                .of(REBUILD_BATCH_SIZE)
                .onItem()
                .invoke(batch -> filter.addBatch(batch))
                .collect()
                .with(Collectors.summingLong(batch -> (long) batch.size()))
                .invoke(count -> {
                    filter.markInitialized();
                    LOG.infov("Existence filter loaded with {0} short codes", count);
                });
    }

    private Uni<Optional<String>> cacheLookup(String shortCode) {
        return Uni.createFrom().deferred(() -> cache.get(shortCode)).onFailure().recoverWithItem(error -> {
            LOG.warnv("Cache lookup failed for {0}, falling through to store: {1}", shortCode, error.getMessage());
            if (metrics != null) {
                metrics.recordCacheFailure("get");
            }
            return Optional.empty();
        });
    }

    private Uni<Optional<String>> storeLookup(String shortCode) {
        return findInStore(shortCode).flatMap(found -> {
            final var now = clock.instant();
            if (found.isEmpty() || !found.get().isResolvable(now)) {
                record("store", false);
                return Uni.createFrom().item(Optional.<String>empty());
            }
            final var url = found.get().originalUrl();
            record("store", true);
            return cacheWrite(found.get(), now).replaceWith(Optional.of(url));
        });
    }

    private Uni<Optional<LinkRecord>> findInStore(String shortCode) {
        return Uni.createFrom()
                .deferred(() -> repository.findByShortCode(shortCode))
                .onFailure()
                .transform(error -> new LinkLookupException(shortCode, error));
    }

    /**
     * Cache entries never outlive the link: the TTL is capped at the time left
     * before expiry, and nothing is written once that is used up.
     */
    Duration cacheTtlFor(LinkRecord link, Instant now) {
        return link.expiresAt()
                .map(expiry -> Duration.between(now, expiry))
                .filter(untilExpiry -> untilExpiry.compareTo(cacheTtl) < 0)
                .orElse(cacheTtl);
    }

    private Uni<Void> cacheWrite(LinkRecord link, Instant now) {
        final var shortCode = link.shortCode();
        final var ttl = cacheTtlFor(link, now);
        if (ttl.isZero() || ttl.isNegative()) {
            return Uni.createFrom().voidItem();
        }
        return Uni.createFrom()
                .deferred(() -> cache.put(shortCode, link.originalUrl(), ttl))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Cache write failed for {0}: {1}", shortCode, error.getMessage());
                    if (metrics != null) {
                        metrics.recordCacheFailure("put");
                    }
                    return null;
                });
    }

    private void record(String layer, boolean found) {
        if (metrics != null) {
            metrics.recordResolution(layer, found);
        }
    }
}
