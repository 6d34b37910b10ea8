package io.socketstate.core.connection;

import io.socketstate.core.exception.StoreConfigurationException;

import java.util.Objects;

/**
 * Host/port of one Sentinel node.
 */
public final class DiscoveryEndpoint {
    
    private final String host;
    private final int port;
    
    public DiscoveryEndpoint(String host, int port) {
        if (host == null || host.trim().isEmpty()) {
            throw new IllegalArgumentException("Sentinel host cannot be empty");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Sentinel port out of range: " + port);
        }
        this.host = host.trim();
        this.port = port;
    }
    
    /**
     * Parses {@code host:port} or a bare {@code host}. A bare host gets port 0,
     * which {@link #toAddress(int)} replaces with the locator's port.
     */
    public static DiscoveryEndpoint parse(String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new StoreConfigurationException("Sentinel endpoint cannot be empty");
        }
        String text = value.trim();
        int colon = text.lastIndexOf(':');
        if (colon < 0 || text.endsWith("]")) {
            return new DiscoveryEndpoint(stripBrackets(text), 0);
        }
        String host = text.substring(0, colon);
        if (host.isEmpty() || (!host.startsWith("[") && host.indexOf(':') >= 0)) {
            throw new StoreConfigurationException("Invalid Sentinel endpoint (bracket IPv6 hosts): " + value);
        }
        try {
            return new DiscoveryEndpoint(stripBrackets(host), Integer.parseInt(text.substring(colon + 1)));
        } catch (IllegalArgumentException e) {
            throw new StoreConfigurationException("Invalid Sentinel endpoint: " + value, e);
        }
    }
    
    private static String stripBrackets(String host) {
        if (host.startsWith("[") && host.endsWith("]")) {
            return host.substring(1, host.length() - 1);
        }
        return host;
    }
    
    public String toAddress(int defaultPort) {
        String h = host.indexOf(':') >= 0 ? "[" + host + "]" : host;
        return "redis://" + h + ":" + (port > 0 ? port : defaultPort);
    }
    
    public String getHost() { return host; }
    public int getPort() { return port; }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiscoveryEndpoint)) return false;
        DiscoveryEndpoint that = (DiscoveryEndpoint) o;
        return port == that.port && host.equals(that.host);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(host, port);
    }
    
    @Override
    public String toString() {
        return host + ":" + port;
    }
}
