package io.socketstate.core.connection;

import io.socketstate.core.exception.StoreConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiscoveryEndpointTest {

    @Test
    @DisplayName("Should parse host and port")
    void testParse() {
        DiscoveryEndpoint endpoint = DiscoveryEndpoint.parse("sentinel-1:26379");
        assertEquals(new DiscoveryEndpoint("sentinel-1", 26379), endpoint);
        assertEquals("redis://sentinel-1:26379", endpoint.toAddress(6379));
    }

    @Test
    @DisplayName("Should fall back to the locator port for a bare host")
    void testBareHost() {
        DiscoveryEndpoint endpoint = DiscoveryEndpoint.parse("sentinel-2");
        assertEquals(0, endpoint.getPort());
        assertEquals("redis://sentinel-2:7000", endpoint.toAddress(7000));
    }

    @Test
    @DisplayName("Should handle bracketed IPv6")
    void testIpv6() {
        DiscoveryEndpoint endpoint = DiscoveryEndpoint.parse("[fe80::1]:26379");
        assertEquals("fe80::1", endpoint.getHost());
        assertEquals("redis://[fe80::1]:26379", endpoint.toAddress(6379));
    }

    @Test
    @DisplayName("Should reject unbracketed IPv6 and empty hosts")
    void testUnbracketedIpv6() {
        assertThrows(StoreConfigurationException.class, () -> DiscoveryEndpoint.parse("::1"));
        assertThrows(StoreConfigurationException.class, () -> DiscoveryEndpoint.parse("fe80::1:26379"));
        assertThrows(StoreConfigurationException.class, () -> DiscoveryEndpoint.parse(":26379"));
        assertEquals("::1", DiscoveryEndpoint.parse("[::1]").getHost());
    }

    @Test
    @DisplayName("Should reject malformed endpoints")
    void testInvalid() {
        assertThrows(StoreConfigurationException.class, () -> DiscoveryEndpoint.parse("host:port"));
        assertThrows(StoreConfigurationException.class, () -> DiscoveryEndpoint.parse("host:99999"));
        assertThrows(StoreConfigurationException.class, () -> DiscoveryEndpoint.parse(" "));
        assertThrows(IllegalArgumentException.class, () -> new DiscoveryEndpoint("", 26379));
    }
}
