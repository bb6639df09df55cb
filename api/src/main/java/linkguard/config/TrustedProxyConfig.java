package linkguard.config;

import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Which peers may supply the caller address through forwarding headers.
 *
 * <p>Configuration prefix: {@code linkguard.trusted-proxy}
 *
 * <p>While enabled, {@code Forwarded} and {@code X-Forwarded-For} are read only
 * on connections from a listed proxy; every other caller is identified by its
 * socket address. Disabling the check trusts the headers from anyone.
 */
@ConfigMapping(prefix = "linkguard.trusted-proxy")
public interface TrustedProxyConfig {

    @WithDefault("true")
    boolean enabled();

    /**
     * @return proxy IP literals or CIDR ranges, e.g. {@code 10.0.0.0/8}
     */
    Optional<List<String>> proxies();
}
