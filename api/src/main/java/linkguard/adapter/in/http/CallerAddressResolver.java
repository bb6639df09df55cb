package linkguard.adapter.in.http;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import linkguard.config.TrustedProxyConfig;

/**
 * Decides the caller address used for rate limit identities and visit logs.
 *
 * <p>Forwarding headers are honored only when the socket peer is a trusted proxy,
 * so a direct client cannot pick a fresh identity per request by rewriting them.
 * Proxy entries are parsed once; an unparseable entry fails startup.
 */
@ApplicationScoped
public class CallerAddressResolver {

    private static final Logger LOG = Logger.getLogger(CallerAddressResolver.class);

    private final boolean checkPeers;
    private final List<ProxyRange> proxies;

    @Inject
    public CallerAddressResolver(TrustedProxyConfig config) {
        this.checkPeers = config.enabled();
        this.proxies = config.proxies().orElse(List.of()).stream()
                .map(String::trim)
                .filter(entry -> !entry.isEmpty())
                .map(ProxyRange::parse)
                .toList();
        if (checkPeers && proxies.isEmpty()) {
            LOG.info("No trusted proxies configured, forwarding headers are ignored");
        }
    }

    /**
     * Resolve the caller address of a request.
     *
     * @param forwarded the Forwarded header, may be null
     * @param xForwardedFor the X-Forwarded-For header, may be null
     * @param socketAddress the peer address of the connection, may be null
     * @return the address, or {@code unknown}
     */
    public String resolve(String forwarded, String xForwardedFor, String socketAddress) {
        if (isTrustedPeer(socketAddress)) {
            return ClientAddresses.resolve(forwarded, xForwardedFor, socketAddress);
        }
        return ClientAddresses.resolve(null, null, socketAddress);
    }

    boolean isTrustedPeer(String socketAddress) {
        if (!checkPeers) {
            return true;
        }
        final var peer = ipLiteralBytes(socketAddress);
        if (peer == null) {
            return false;
        }
        return proxies.stream().anyMatch(range -> range.contains(peer));
    }

    /**
     * Bytes of an IP literal, or null for anything else. Hostnames are never resolved.
     */
    static byte[] ipLiteralBytes(String address) {
        if (address == null || address.isEmpty()) {
            return null;
        }
        final var ipv6 = address.contains(":");
        for (var i = 0; i < address.length(); i++) {
            final var c = address.charAt(i);
            final var allowed = c == '.' || Character.isDigit(c) || (ipv6 && (c == ':' || Character.digit(c, 16) >= 0));
            if (!allowed) {
                return null;
            }
        }
        try {
            return InetAddress.getByName(address).getAddress();
        } catch (UnknownHostException e) {
            return null;
        }
    }

    record ProxyRange(byte[] network, int prefixLength) {

        static ProxyRange parse(String entry) {
            final var slash = entry.indexOf('/');
            final var address = ipLiteralBytes(slash < 0 ? entry : entry.substring(0, slash));
            if (address == null) {
                throw new IllegalArgumentException("Invalid trusted proxy address: " + entry);
            }
            if (slash < 0) {
                return new ProxyRange(address, address.length * 8);
            }
            final int prefix;
            try {
                prefix = Integer.parseInt(entry.substring(slash + 1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid prefix length in trusted proxy range: " + entry, e);
            }
            if (prefix < 0 || prefix > address.length * 8) {
                throw new IllegalArgumentException("Prefix length out of range in trusted proxy range: " + entry);
            }
            return new ProxyRange(address, prefix);
        }

        boolean contains(byte[] address) {
            if (address.length != network.length) {
                return false;
            }
            final var fullBytes = prefixLength / 8;
            for (var i = 0; i < fullBytes; i++) {
                if (address[i] != network[i]) {
                    return false;
                }
            }
            final var remainingBits = prefixLength % 8;
            if (remainingBits == 0) {
                return true;
            }
            final var mask = (byte) (0xFF << (8 - remainingBits));
            return (address[fullBytes] & mask) == (network[fullBytes] & mask);
        }
    }
}
