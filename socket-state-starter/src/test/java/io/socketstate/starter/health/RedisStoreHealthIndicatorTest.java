package io.socketstate.starter.health;

import io.socketstate.core.connection.StoreHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisConnectionException;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RedisStoreHealthIndicatorTest {

    private RedissonClient client;
    private RedisStoreHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        client = mock(RedissonClient.class, RETURNS_DEEP_STUBS);
        when(client.isShutdown()).thenReturn(false);
        when(client.isShuttingDown()).thenReturn(false);
        indicator = new RedisStoreHealthIndicator(
                new StoreHandle(client, true, StoreHandle.Mode.SENTINEL, "mymaster/0 via s1:26379"));
    }

    @Test
    @DisplayName("Should report UP when all nodes answer")
    void testUp() {
        when(client.getNodesGroup().pingAll()).thenReturn(true);

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("PONG", health.getDetails().get("redis"));
        assertEquals("SENTINEL", health.getDetails().get("mode"));
        assertEquals("mymaster/0 via s1:26379", health.getDetails().get("target"));
    }

    @Test
    @DisplayName("Should report DOWN when a node does not answer")
    void testPingFailed() {
        when(client.getNodesGroup().pingAll()).thenReturn(false);
        assertEquals(Status.DOWN, indicator.health().getStatus());
    }

    @Test
    @DisplayName("Should report DOWN with the error when the store is unreachable")
    void testUnreachable() {
        when(client.getNodesGroup().pingAll()).thenThrow(new RedisConnectionException("Unable to connect"));

        Health health = indicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("Unable to connect", health.getDetails().get("error"));
    }

    @Test
    @DisplayName("Should report DOWN after the client was shut down")
    void testShutDown() {
        when(client.isShutdown()).thenReturn(true);
        assertEquals(Status.DOWN, indicator.health().getStatus());
    }
}
