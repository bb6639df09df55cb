package linkguard.config;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import linkguard.core.model.ratelimit.RateLimitPolicy;
import linkguard.core.model.ratelimit.SkipPredicate;
import linkguard.core.port.out.LinkRepository;
import linkguard.core.port.out.Metrics;
import linkguard.core.port.out.RateLimitStore;
import linkguard.core.port.out.ResolutionCache;
import linkguard.core.service.filter.ExistenceFilter;
import linkguard.core.service.link.ShortLinkService;
import linkguard.core.service.link.SnowflakeIdGenerator;
import linkguard.core.service.ratelimit.AdmissionChain;
import linkguard.core.service.ratelimit.AdmissionService;
import linkguard.core.service.ratelimit.EndpointLimiter;
import linkguard.core.service.ratelimit.RateLimiterFactory;
import linkguard.core.service.resolution.ResolutionCascade;
import linkguard.core.service.visit.VisitRecorder;

/**
 * Produces the core services from configuration.
 *
 * <p>Every component is constructed once here and injected; none of them holds
 * static state. Invalid settings throw {@link IllegalArgumentException} while
 * the beans are created, which stops startup.
 */
@ApplicationScoped
public class ServiceProducer {

    private static final Logger LOG = Logger.getLogger(ServiceProducer.class);

    private final RateLimitingConfig rateLimitingConfig;
    private final ExistenceFilterConfig filterConfig;
    private final CacheConfig cacheConfig;
    private final LinkConfig linkConfig;
    private final VisitConfig visitConfig;

    @Inject
    public ServiceProducer(
            RateLimitingConfig rateLimitingConfig,
            ExistenceFilterConfig filterConfig,
            CacheConfig cacheConfig,
            LinkConfig linkConfig,
            VisitConfig visitConfig) {
        this.rateLimitingConfig = rateLimitingConfig;
        this.filterConfig = filterConfig;
        this.cacheConfig = cacheConfig;
        this.linkConfig = linkConfig;
        this.visitConfig = visitConfig;
    }

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @ApplicationScoped
    public ExistenceFilter existenceFilter() {
        return new ExistenceFilter(filterConfig.capacity(), filterConfig.falsePositiveRate());
    }

    @Produces
    @ApplicationScoped
    public ResolutionCascade resolutionCascade(
            ExistenceFilter filter, ResolutionCache cache, LinkRepository repository, Metrics metrics, Clock clock) {
        return new ResolutionCascade(filter, cache, repository, metrics, cacheConfig.ttl(), clock);
    }

    @Produces
    @ApplicationScoped
    public VisitRecorder visitRecorder(LinkRepository repository, Metrics metrics) {
        return new VisitRecorder(
                repository,
                metrics,
                visitConfig.workers(),
                visitConfig.queueCapacity(),
                visitConfig.writeTimeout());
    }

    void disposeVisitRecorder(@Disposes VisitRecorder recorder) {
        recorder.shutdown(visitConfig.shutdownTimeout());
    }

    @Produces
    @ApplicationScoped
    public ShortLinkService shortLinkService(
            LinkRepository repository, ResolutionCascade cascade, VisitRecorder visitRecorder, Clock clock) {
        final var generator = new SnowflakeIdGenerator(linkConfig.datacenterId(), linkConfig.workerId(), clock);
        LOG.infov("Short code generator node ID: {0}", generator.nodeId());
        return new ShortLinkService(
                repository, cascade, generator, visitRecorder, linkConfig.collisionRetries(), clock);
    }

    /**
     * Produces the admission chain: the global limiter plus one limiter per
     * configured endpoint.
     */
    @Produces
    @ApplicationScoped
    public AdmissionChain admissionChain(RateLimitStore store, Metrics metrics, Clock clock) {
        if (!rateLimitingConfig.enabled()) {
            LOG.info("Rate limiting is disabled");
            return AdmissionChain.disabled();
        }

        final var factory = new RateLimiterFactory(store, clock);
        final var skip = SkipPredicate.pathPrefixes(rateLimitingConfig.skipPaths());
        final var prefix = rateLimitingConfig.keyPrefix();
        final var keyType = rateLimitingConfig.keyStrategy();

        final var globalPolicy = new RateLimitPolicy(rateLimitingConfig.limit(), rateLimitingConfig.window());
        final var global = new AdmissionService(
                "global",
                factory.create(rateLimitingConfig.algorithm(), globalPolicy),
                keyType.strategy(prefix),
                skip,
                metrics,
                clock);
        LOG.infov(
                "Rate limiting enabled with algorithm={0}, limit={1}/{2}, keyStrategy={3}",
                rateLimitingConfig.algorithm(), globalPolicy.limit(), globalPolicy.window(), keyType);

        final var endpoints = new ArrayList<EndpointLimiter>();
        rateLimitingConfig.endpoints().forEach((name, endpoint) -> {
            final var policy = new RateLimitPolicy(endpoint.limit(), endpoint.window());
            final var admission = new AdmissionService(
                    name,
                    factory.create(endpoint.algorithm(), policy),
                    keyType.strategy(prefix + name + ":"),
                    skip,
                    metrics,
                    clock);
            endpoints.add(new EndpointLimiter(name, endpoint.method(), endpoint.path(), admission));
            LOG.infov(
                    "Endpoint limiter {0} on {1} with algorithm={2}, limit={3}/{4}",
                    name, endpoint.path(), endpoint.algorithm(), policy.limit(), policy.window());
        });

        return new AdmissionChain(Optional.of(global), endpoints);
    }
}
