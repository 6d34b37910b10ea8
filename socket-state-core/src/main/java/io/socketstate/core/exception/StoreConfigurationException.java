package io.socketstate.core.exception;

/**
 * Thrown when a Redis URL or locator URL cannot be turned into a connection.
 * Raised at resolve time and never retried.
 */
public class StoreConfigurationException extends RuntimeException {
    public StoreConfigurationException(String message) {
        super(message);
    }
    
    public StoreConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
