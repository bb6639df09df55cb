package linkguard.adapter.in.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ClientAddresses")
class ClientAddressesTest {

    @Nested
    @DisplayName("resolve()")
    class ResolveTests {

        @Test
        @DisplayName("should prefer Forwarded over X-Forwarded-For and the socket")
        void shouldPreferForwarded() {
            assertEquals("203.0.113.7", ClientAddresses.resolve("for=203.0.113.7", "198.51.100.1", "10.0.0.1"));
        }

        @Test
        @DisplayName("should use the first X-Forwarded-For entry")
        void shouldUseFirstForwardedForEntry() {
            assertEquals("198.51.100.1", ClientAddresses.resolve(null, " 198.51.100.1 , 10.0.0.2", "10.0.0.1"));
        }

        @Test
        @DisplayName("should fall back to the socket address and then to unknown")
        void shouldFallBack() {
            assertEquals("10.0.0.1", ClientAddresses.resolve(null, "", "10.0.0.1"));
            assertEquals(ClientAddresses.UNKNOWN, ClientAddresses.resolve(null, null, null));
            assertEquals(ClientAddresses.UNKNOWN, ClientAddresses.resolve("proto=https", null, " "));
        }
    }

    @Nested
    @DisplayName("parseForwardedFor()")
    class ParseTests {

        @Test
        @DisplayName("should strip quotes and ports")
        void shouldStripQuotesAndPorts() {
            assertEquals("192.0.2.60", ClientAddresses.parseForwardedFor("for=\"192.0.2.60:4711\";proto=http"));
            assertEquals("2001:db8:cafe::17", ClientAddresses.parseForwardedFor("For=\"[2001:db8:cafe::17]:4711\""));
        }

        @Test
        @DisplayName("should read only the first hop")
        void shouldReadFirstHop() {
            assertEquals("192.0.2.43", ClientAddresses.parseForwardedFor("for=192.0.2.43, for=198.51.100.17"));
        }

        @Test
        @DisplayName("should return null without a for parameter")
        void shouldReturnNullWithoutFor() {
            assertNull(ClientAddresses.parseForwardedFor("proto=https;by=203.0.113.43"));
        }
    }
}
