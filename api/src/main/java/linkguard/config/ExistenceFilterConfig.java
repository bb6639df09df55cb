package linkguard.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the short code existence filter.
 *
 * <p>Configuration prefix: {@code linkguard.existence-filter}
 */
@ConfigMapping(prefix = "linkguard.existence-filter")
public interface ExistenceFilterConfig {

    /**
     * Expected number of short codes.
     *
     * <p>Exceeding it raises the false positive rate, nothing more.
     *
     * @return capacity (default: 1000000)
     */
    @WithDefault("1000000")
    long capacity();

    /**
     * Target false positive probability at capacity.
     *
     * @return the rate (default: 0.01)
     */
    @WithDefault("0.01")
    double falsePositiveRate();
}
