package io.socketstate.core.connection;

import java.util.List;

public interface ConnectionResolver {
    
    /**
     * Connects to the current primary Redis instance.
     *
     * @param address            direct Redis URL, or a Sentinel locator URL when
     *                           {@code discoveryEndpoints} is non-empty
     * @param discoveryEndpoints Sentinel nodes; {@code null} or empty for a direct connection
     * @param decodeText         decode replies to UTF-8 strings instead of raw bytes
     */
    StoreHandle resolve(String address, List<DiscoveryEndpoint> discoveryEndpoints, boolean decodeText);
    
    default StoreHandle resolve(String address, List<DiscoveryEndpoint> discoveryEndpoints) {
        return resolve(address, discoveryEndpoints, true);
    }
}
