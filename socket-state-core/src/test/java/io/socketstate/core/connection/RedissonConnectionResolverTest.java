package io.socketstate.core.connection;

import io.socketstate.core.exception.StoreConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.ByteArrayCodec;
import org.redisson.client.codec.StringCodec;
import org.redisson.config.Config;
import org.redisson.config.ReadMode;
import org.redisson.config.SentinelServersConfig;
import org.redisson.config.SingleServerConfig;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RedissonConnectionResolverTest {

    private final List<Config> createdConfigs = new ArrayList<>();
    private RedissonClient client;
    private RedissonConnectionResolver resolver;

    @BeforeEach
    void setUp() {
        client = mock(RedissonClient.class);
        resolver = new RedissonConnectionResolver(ConnectionOptions.defaults(), config -> {
            createdConfigs.add(config);
            return client;
        });
    }

    @Nested
    @DisplayName("Direct connection")
    class DirectTests {

        @Test
        @DisplayName("Should connect in single-server mode when no sentinels are given")
        void testSingleServer() {
            StoreHandle handle = resolver.resolve("redis://localhost:6379/0", Collections.emptyList(), true);

            assertSame(client, handle.getClient());
            assertEquals(StoreHandle.Mode.SINGLE, handle.getMode());
            assertTrue(handle.isDecodeText());
            assertEquals(1, createdConfigs.size());
            assertSame(StringCodec.INSTANCE, createdConfigs.get(0).getCodec());
        }

        @Test
        @DisplayName("Should treat null sentinel list as direct")
        void testNullSentinels() {
            StoreHandle handle = resolver.resolve("redis://localhost", null, true);
            assertEquals(StoreHandle.Mode.SINGLE, handle.getMode());
        }

        @Test
        @DisplayName("Should use raw byte codec when text decoding is off")
        void testRawBytes() {
            StoreHandle handle = resolver.resolve("redis://localhost", null, false);
            assertFalse(handle.isDecodeText());
            assertSame(ByteArrayCodec.INSTANCE, createdConfigs.get(0).getCodec());
        }

        @Test
        @DisplayName("Should carry credentials, database and options into server config")
        void testServerConfig() {
            SingleServerConfig server = new Config().useSingleServer();
            resolver.configureSingle(server, RedisUrl.parse("rediss://app:pw@cache:6380/3"));

            assertEquals("rediss://cache:6380", server.getAddress());
            assertEquals(3, server.getDatabase());
            assertEquals("app", server.getUsername());
            assertEquals("pw", server.getPassword());
            assertEquals(64, server.getConnectionPoolSize());
            assertEquals(3000, server.getTimeout());
        }

        @Test
        @DisplayName("Should default host and port like redis://localhost:6379")
        void testDefaultHost() {
            SingleServerConfig server = new Config().useSingleServer();
            resolver.configureSingle(server, RedisUrl.parse("redis:///5"));
            assertEquals("redis://localhost:6379", server.getAddress());
            assertEquals(5, server.getDatabase());
        }

        @Test
        @DisplayName("Should reject unsupported schemes without connecting")
        void testUnsupportedScheme() {
            assertThrows(StoreConfigurationException.class,
                () -> resolver.resolve("unix:///var/run/redis.sock", null, true));
            assertTrue(createdConfigs.isEmpty());
        }

        @Test
        @DisplayName("Should reject malformed URLs without connecting")
        void testMalformed() {
            assertThrows(StoreConfigurationException.class,
                () -> resolver.resolve("redis://localhost:port", null, true));
            assertTrue(createdConfigs.isEmpty());
        }
    }

    @Nested
    @DisplayName("Sentinel discovery")
    class SentinelTests {

        @Test
        @DisplayName("Should connect through sentinels when endpoints are given")
        void testSentinelMode() {
            StoreHandle handle = resolver.resolve("redis://user:pw@mynode:7000/2",
                Arrays.asList(new DiscoveryEndpoint("s1", 26379), new DiscoveryEndpoint("s2", 26380)), true);

            assertEquals(StoreHandle.Mode.SENTINEL, handle.getMode());
            assertTrue(handle.getDescription().startsWith("mynode/2 via "));
            assertFalse(handle.getDescription().contains("pw"));
        }

        @Test
        @DisplayName("Should point sentinel config at the named master")
        void testSentinelConfig() {
            SentinelServersConfig sentinel = new Config().useSentinelServers();
            resolver.configureSentinel(sentinel, SentinelLocator.parse("redis://user:pw@mynode:7000/2"),
                Arrays.asList(new DiscoveryEndpoint("s1", 26379), DiscoveryEndpoint.parse("s2")));

            assertEquals("mynode", sentinel.getMasterName());
            assertEquals(2, sentinel.getDatabase());
            assertEquals("user", sentinel.getUsername());
            assertEquals("pw", sentinel.getPassword());
            assertEquals(ReadMode.MASTER, sentinel.getReadMode());
            assertEquals(Arrays.asList("redis://s1:26379", "redis://s2:7000"), sentinel.getSentinelAddresses());
        }

        @Test
        @DisplayName("Should reject locator with non-redis scheme")
        void testInvalidScheme() {
            StoreConfigurationException ex = assertThrows(StoreConfigurationException.class,
                () -> resolver.resolve("rediss://mymaster", Collections.singletonList(new DiscoveryEndpoint("s1", 26379)), true));
            assertEquals("Invalid Redis URL scheme. Must be 'redis'.", ex.getMessage());
            assertTrue(createdConfigs.isEmpty());
        }
    }

    @Nested
    @DisplayName("StoreHandle lifecycle")
    class HandleTests {

        @Test
        @DisplayName("Should shut the client down once")
        void testClose() {
            StoreHandle handle = resolver.resolve("redis://localhost", null, true);
            when(client.isShutdown()).thenReturn(false, true);

            handle.close();
            handle.close();

            verify(client, times(1)).shutdown();
        }

        @Test
        @DisplayName("Should reject null client")
        void testNullClient() {
            assertThrows(IllegalArgumentException.class,
                () -> new StoreHandle(null, true, StoreHandle.Mode.SINGLE, "x"));
        }
    }

    @Test
    @DisplayName("Should propagate connection failures unchanged")
    void testConnectionFailurePropagates() {
        IllegalStateException failure = new IllegalStateException("connection refused");
        RedissonConnectionResolver failing = new RedissonConnectionResolver(ConnectionOptions.defaults(), config -> {
            throw failure;
        });

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
            () -> failing.resolve("redis://localhost", null, true));
        assertSame(failure, thrown);
    }
}
