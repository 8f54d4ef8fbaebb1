/*
 * Copyright (c) 2015, Haiyang Li. All rights reserved.
 */

package com.landawn.abacus.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisClientConfig;

public class ConnectionResolverTest {

    static final Map<String, String> NO_ENV = Collections.emptyMap();

    @Test
    public void test_resolve_defaults() {
        final CacheConfig config = ConnectionResolver.resolve(NO_ENV, null);

        assertEquals("127.0.0.1", config.getHost());
        assertEquals(6379, config.getPort());
        assertNull(config.getPassword());
        assertFalse(config.getCluster());
        assertEquals(1000L, config.getTimeout());
    }

    @Test
    public void test_resolve_explicit_over_defaults() {
        final CacheConfig explicit = CacheConfig.builder().host("10.0.0.5").password("secret").build();
        final CacheConfig config = ConnectionResolver.resolve(NO_ENV, explicit);

        assertEquals("10.0.0.5", config.getHost());
        assertEquals(6379, config.getPort());
        assertEquals("secret", config.getPassword());
    }

    @Test
    public void test_resolve_environment_over_explicit() {
        final Map<String, String> env = new HashMap<>();
        env.put(ConnectionResolver.ENV_HOST, "redis.internal");
        env.put(ConnectionResolver.ENV_PORT, "7000");
        env.put(ConnectionResolver.ENV_PASSWORD, "from-env");
        env.put(ConnectionResolver.ENV_CLUSTER, "true");
        env.put(ConnectionResolver.ENV_TIMEOUT, "2500");

        final CacheConfig explicit = CacheConfig.builder().host("10.0.0.5").port(6380).password("secret").cluster(false).timeout(300L).build();
        final CacheConfig config = ConnectionResolver.resolve(env, explicit);

        assertEquals("redis.internal", config.getHost());
        assertEquals(7000, config.getPort());
        assertEquals("from-env", config.getPassword());
        assertTrue(config.getCluster());
        assertEquals(2500L, config.getTimeout());
    }

    @Test
    public void test_resolve_ignores_empty_and_bad_environment_values() {
        final Map<String, String> env = new HashMap<>();
        env.put(ConnectionResolver.ENV_HOST, "");
        env.put(ConnectionResolver.ENV_PORT, "not-a-port");
        env.put(ConnectionResolver.ENV_TIMEOUT, "soon");

        final CacheConfig explicit = CacheConfig.builder().host("10.0.0.5").port(6380).build();
        CacheConfig config = ConnectionResolver.resolve(env, explicit);

        assertEquals("10.0.0.5", config.getHost());
        assertEquals(6380, config.getPort());
        assertEquals(1000L, config.getTimeout());

        env.put(ConnectionResolver.ENV_PORT, "70000");
        config = ConnectionResolver.resolve(env, null);
        assertEquals(6379, config.getPort());
    }

    @Test
    public void test_resolve_cluster_flag() {
        final Map<String, String> env = new HashMap<>();
        final CacheConfig explicit = CacheConfig.builder().cluster(true).build();

        env.put(ConnectionResolver.ENV_CLUSTER, "banana");
        assertTrue(ConnectionResolver.resolve(env, explicit).getCluster());

        env.put(ConnectionResolver.ENV_CLUSTER, "no");
        assertFalse(ConnectionResolver.resolve(env, explicit).getCluster());

        env.put(ConnectionResolver.ENV_CLUSTER, "0");
        assertFalse(ConnectionResolver.resolve(env, explicit).getCluster());

        env.put(ConnectionResolver.ENV_CLUSTER, " YES ");
        assertTrue(ConnectionResolver.resolve(env, null).getCluster());
    }

    @Test
    public void test_addresses_of() {
        assertEquals(Arrays.asList(new HostAndPort("10.0.0.1", 6379)), ConnectionResolver.addressesOf("10.0.0.1", 6379));

        final List<HostAndPort> nodes = ConnectionResolver.addressesOf(" redis-1:7001, redis-2 ,,redis-3:7003", 7000);
        assertEquals(Arrays.asList(new HostAndPort("redis-1", 7001), new HostAndPort("redis-2", 7000), new HostAndPort("redis-3", 7003)), nodes);

        assertThrows(IllegalArgumentException.class, () -> ConnectionResolver.addressesOf(" , ", 6379));
        assertThrows(IllegalArgumentException.class, () -> ConnectionResolver.addressesOf(null, 6379));
    }

    @Test
    public void test_ipv6_addresses() {
        assertEquals(Arrays.asList(new HostAndPort("::1", 6379)), ConnectionResolver.addressesOf("::1", 6379));
        assertEquals(Arrays.asList(new HostAndPort("fe80::1", 6379)), ConnectionResolver.addressesOf("fe80::1", 6379));
        assertEquals(Arrays.asList(new HostAndPort("::1", 7001), new HostAndPort("fe80::2", 7000)),
                ConnectionResolver.addressesOf("[::1]:7001,[fe80::2]", 7000));

        assertThrows(IllegalArgumentException.class, () -> ConnectionResolver.addressesOf("[::1", 6379));
        assertThrows(IllegalArgumentException.class, () -> ConnectionResolver.addressesOf("[::1]:port", 6379));
        assertThrows(IllegalArgumentException.class, () -> ConnectionResolver.addressesOf("[]:7000", 6379));
    }

    @Test
    public void test_cluster_topology() {
        assertFalse(ConnectionResolver.isClusterTopology(ConnectionResolver.resolve(NO_ENV, null)));
        assertTrue(ConnectionResolver.isClusterTopology(ConnectionResolver.resolve(NO_ENV, CacheConfig.builder().host("a,b").build())));
        assertTrue(ConnectionResolver.isClusterTopology(ConnectionResolver.resolve(NO_ENV, CacheConfig.builder().host("a").cluster(true).build())));
    }

    @Test
    public void test_client_config() {
        final JedisClientConfig clientConfig = ConnectionResolver
                .clientConfigOf(ConnectionResolver.resolve(NO_ENV, CacheConfig.builder().password("secret").timeout(1500L).build()));

        assertEquals(1500, clientConfig.getConnectionTimeoutMillis());
        assertEquals(1500, clientConfig.getSocketTimeoutMillis());
        assertEquals("secret", clientConfig.getPassword());
    }

    @Test
    public void test_connect_single_node_is_lazy() {
        final ConnectionResolver resolver = new ConnectionResolver(NO_ENV, new LoggingConnectionEventObserver(), new BackgroundTasks());

        try (StoreConnection conn = resolver.connect(resolver.configure(CacheConfig.builder().host("10.255.255.1").port(6390).build()))) {
            assertTrue(conn instanceof JedisStoreConnection);
            assertEquals("10.255.255.1:6390", conn.serverUrl());
            assertEquals(ConnectionState.CONNECTING, ((JedisStoreConnection) conn).state());
        }
    }

    @Test
    public void test_connect_cluster_is_lazy() {
        final ConnectionResolver resolver = new ConnectionResolver(NO_ENV, new LoggingConnectionEventObserver(), new BackgroundTasks());

        try (StoreConnection conn = resolver.connect(resolver.configure(CacheConfig.builder().host("10.255.255.1:7001,10.255.255.2").port(7000).build()))) {
            assertEquals("10.255.255.1:7001,10.255.255.2:7000", conn.serverUrl());
            assertEquals(ConnectionState.CONNECTING, ((JedisStoreConnection) conn).state());
        }
    }

    @Test
    public void test_run_is_idempotent_and_pings() throws Exception {
        final BackgroundTasks backgroundTasks = new BackgroundTasks();
        final InMemoryStoreConnection memory = new InMemoryStoreConnection();
        final AtomicInteger connects = new AtomicInteger();

        final ConnectionResolver resolver = new ConnectionResolver(NO_ENV, new LoggingConnectionEventObserver(), backgroundTasks) {
            @Override
            protected StoreConnection connect(final CacheConfig resolved) {
                connects.incrementAndGet();
                return memory;
            }
        };

        resolver.configure(CacheConfig.builder().host("10.0.0.5").build());

        assertSame(memory, resolver.run());
        assertSame(memory, resolver.run());
        assertEquals(1, connects.get());

        assertTrue(backgroundTasks.awaitIdle(5000));
        assertEquals(Arrays.asList("PING"), memory.commands());
    }

    @Test
    public void test_configure_after_run_is_ignored() throws Exception {
        final BackgroundTasks backgroundTasks = new BackgroundTasks();
        final ConnectionResolver resolver = new ConnectionResolver(NO_ENV, new LoggingConnectionEventObserver(), backgroundTasks) {
            @Override
            protected StoreConnection connect(final CacheConfig resolved) {
                return new InMemoryStoreConnection();
            }
        };

        resolver.configure(CacheConfig.builder().host("10.0.0.5").build());
        resolver.run();

        final CacheConfig config = resolver.configure(CacheConfig.builder().host("10.0.0.6").build());

        assertEquals("10.0.0.5", config.getHost());
        assertEquals("10.0.0.5", resolver.config().getHost());
        assertTrue(backgroundTasks.awaitIdle(5000));
    }

    @Test
    public void test_failed_ping_does_not_escape_run() throws Exception {
        final BackgroundTasks backgroundTasks = new BackgroundTasks();
        final InMemoryStoreConnection memory = new InMemoryStoreConnection();
        memory.failOn("PING");

        final ConnectionResolver resolver = new ConnectionResolver(NO_ENV, new LoggingConnectionEventObserver(), backgroundTasks) {
            @Override
            protected StoreConnection connect(final CacheConfig resolved) {
                return memory;
            }
        };

        assertSame(memory, resolver.run());
        assertTrue(backgroundTasks.awaitIdle(5000));
        assertEquals(1, backgroundTasks.droppedCount());
    }
}
