package io.socketstate.core;

/**
 * How composite operations that need more than one round trip are executed.
 */
public enum ConsistencyMode {
    /**
     * Separate commands. A concurrent writer can interleave between them.
     */
    RELAXED,
    /**
     * Single atomic command or Lua script per operation.
     */
    STRICT
}
