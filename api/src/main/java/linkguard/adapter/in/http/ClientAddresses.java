package linkguard.adapter.in.http;

import java.util.Locale;

/**
 * Resolves the client address of a request.
 *
 * <p>Priority: RFC 7239 {@code Forwarded}, then {@code X-Forwarded-For}, then
 * the socket's remote address. Headers are taken at face value here;
 * {@link CallerAddressResolver} decides whether they may be passed in.
 */
public final class ClientAddresses {

    static final String UNKNOWN = "unknown";

    private ClientAddresses() {}

    /**
     * Resolve the client address.
     *
     * @param forwarded the Forwarded header, may be null
     * @param xForwardedFor the X-Forwarded-For header, may be null
     * @param remoteAddress the socket peer address, may be null
     * @return the address, or {@code unknown}
     */
    public static String resolve(String forwarded, String xForwardedFor, String remoteAddress) {
        if (forwarded != null) {
            final var ip = parseForwardedFor(forwarded);
            if (ip != null && !ip.isBlank()) {
                return ip;
            }
        }

        if (xForwardedFor != null) {
            final var first = xForwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }

        return remoteAddress != null && !remoteAddress.isBlank() ? remoteAddress : UNKNOWN;
    }

    /**
     * Parse the client IP from an RFC 7239 Forwarded header.
     *
     * @param forwarded the Forwarded header value
     * @return the client IP, or null if not found
     */
    static String parseForwardedFor(String forwarded) {
        // First entry is the one closest to the client
        final var firstEntry = forwarded.split(",")[0].trim();

        for (final var part : firstEntry.split(";")) {
            final var trimmed = part.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("for=")) {
                var value = trimmed.substring(4);
                if (value.startsWith("\"") && value.endsWith("\"") && value.length() >= 2) {
                    value = value.substring(1, value.length() - 1);
                }
                // IPv6: address sits inside brackets, port after them
                if (value.startsWith("[")) {
                    final var bracketEnd = value.indexOf(']');
                    if (bracketEnd > 0) {
                        return value.substring(1, bracketEnd);
                    }
                }
                // IPv4 with port has exactly one colon
                final var colonCount = value.length() - value.replace(":", "").length();
                if (colonCount == 1) {
                    value = value.substring(0, value.indexOf(':'));
                }
                return value;
            }
        }
        return null;
    }
}
