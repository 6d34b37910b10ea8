package io.socketstate.core.exception;

/**
 * Stored value is not valid JSON for the expected type.
 * Only happens when something other than this library wrote to the hash.
 */
public class StoreDecodeException extends RuntimeException {
    
    private final String key;
    
    public StoreDecodeException(String message, String key, Throwable cause) {
        super(message, cause);
        this.key = key;
    }
    
    public String getKey() {
        return key;
    }
    
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(super.toString());
        if (key != null) {
            sb.append(" [key=").append(key).append("]");
        }
        return sb.toString();
    }
}
