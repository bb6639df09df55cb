package linkguard.adapter.out.storage;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import org.jboss.logging.Logger;

import linkguard.core.port.out.LinkRepository;
import linkguard.spi.LinkStorageProvider;

/**
 * Discovers link storage providers via ServiceLoader and produces the repository
 * of the highest priority available one.
 */
@ApplicationScoped
public class LinkStorageProviderLoader {

    private static final Logger LOG = Logger.getLogger(LinkStorageProviderLoader.class);

    @Produces
    @ApplicationScoped
    public LinkRepository linkRepository() {
        final List<LinkStorageProvider> providers = new ArrayList<>();
        ServiceLoader.load(LinkStorageProvider.class).forEach(providers::add);

        final var provider = select(providers);
        LOG.infof("Creating link repository from provider: %s", provider.name());
        return provider.createRepository();
    }

    static LinkStorageProvider select(List<LinkStorageProvider> providers) {
        if (providers.isEmpty()) {
            throw new IllegalStateException(
                    "No link storage providers found. Ensure a provider JAR is on the classpath.");
        }
        LOG.infof(
                "Found %d link storage provider(s): %s",
                providers.size(),
                providers.stream().map(LinkStorageProvider::name).toList());

        return providers.stream()
                .filter(LinkStorageProvider::isAvailable)
                .max(Comparator.comparingInt(LinkStorageProvider::priority))
                .orElseThrow(() -> new IllegalStateException("No available link storage provider"));
    }
}
