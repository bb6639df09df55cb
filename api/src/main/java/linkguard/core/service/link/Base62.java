package linkguard.core.service.link;

/**
 * Base62 codec over the alphabet {@code 0-9a-zA-Z}.
 */
public final class Base62 {

    static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private static final int BASE = ALPHABET.length();

    private Base62() {}

    /**
     * Encode a non-negative number, most significant digit first.
     *
     * @param value the number
     * @return the encoded string
     */
    public static String encode(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("value must not be negative, got: " + value);
        }
        if (value == 0) {
            return String.valueOf(ALPHABET.charAt(0));
        }
        final var builder = new StringBuilder();
        var remaining = value;
        while (remaining > 0) {
            builder.append(ALPHABET.charAt((int) (remaining % BASE)));
            remaining /= BASE;
        }
        return builder.reverse().toString();
    }

    /**
     * Decode a Base62 string.
     *
     * @param encoded the encoded string
     * @return the number
     * @throws IllegalArgumentException on a character outside the alphabet
     */
    public static long decode(String encoded) {
        var value = 0L;
        for (var i = 0; i < encoded.length(); i++) {
            final var digit = ALPHABET.indexOf(encoded.charAt(i));
            if (digit < 0) {
                throw new IllegalArgumentException("Invalid Base62 character: " + encoded.charAt(i));
            }
            value = value * BASE + digit;
        }
        return value;
    }
}
