package linkguard.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import linkguard.core.service.filter.ExistenceFilter;

/**
 * Readiness check reporting whether the existence filter has been loaded.
 */
@Readiness
@ApplicationScoped
public class ExistenceFilterHealthCheck implements HealthCheck {

    private final ExistenceFilter filter;

    @Inject
    public ExistenceFilterHealthCheck(ExistenceFilter filter) {
        this.filter = filter;
    }

    @Override
    public HealthCheckResponse call() {
        return HealthCheckResponse.named("existence-filter")
                .status(filter.isInitialized())
                .withData("approximateElementCount", filter.approximateElementCount())
                .withData("expectedFpp", String.format("%.6f", filter.expectedFpp()))
                .withData("capacity", filter.capacity())
                .build();
    }
}
