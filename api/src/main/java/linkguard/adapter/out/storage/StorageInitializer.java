package linkguard.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import linkguard.core.service.resolution.ResolutionCascade;

/**
 * Loads the existence filter from the durable store on application startup.
 *
 * <p>Until the load finishes the filter only knows codes created since startup,
 * and the readiness check reports DOWN.
 */
@ApplicationScoped
public class StorageInitializer {

    private static final Logger LOG = Logger.getLogger(StorageInitializer.class);

    private final ResolutionCascade cascade;

    @Inject
    public StorageInitializer(ResolutionCascade cascade) {
        this.cascade = cascade;
    }

    void onStart(@Observes StartupEvent event) {
        LOG.info("Loading existence filter from link storage...");
        cascade.rebuildFilter()
                .subscribe()
                .with(
                        count -> LOG.infof("Existence filter ready with %d short codes", count),
                        e -> LOG.errorf(e, "Failed to load existence filter"));
    }
}
