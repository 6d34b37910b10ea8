package io.socketstate.core.exception;

public class KeyNotFoundException extends RuntimeException {
    
    private final String key;
    
    public KeyNotFoundException(String key) {
        super("Key not found: " + key);
        this.key = key;
    }
    
    public String getKey() {
        return key;
    }
}
