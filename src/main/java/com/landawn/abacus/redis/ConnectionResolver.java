/*
 * Copyright (C) 2015 HaiYang Li
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */

package com.landawn.abacus.redis;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.N;
import com.landawn.abacus.util.Strings;

import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisClientConfig;
import redis.clients.jedis.JedisCluster;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.UnifiedJedis;

/**
 * Resolves the connection settings and builds the single long-lived {@link StoreConnection}.
 *
 * <p><b>Precedence</b> (highest first), applied per field:</p>
 * <ol>
 *   <li>environment variables {@code cacheHost}, {@code cachePort}, {@code cachePassword},
 *       {@code cacheCluster}, {@code cacheTimeout}</li>
 *   <li>the {@link CacheConfig} passed to {@link #configure(CacheConfig)}</li>
 *   <li>defaults: {@code 127.0.0.1:6379}, no password, single node, 1000 ms timeout</li>
 * </ol>
 *
 * <p><b>Topology:</b> a host listing more than one address (comma separated) or an explicit
 * {@code cluster=true} selects a {@link JedisCluster}; otherwise a {@link JedisPooled} is used.
 * Each address may carry its own port ({@code host:port} or {@code [ipv6]:port}); otherwise the configured
 * port applies.</p>
 *
 * <p><b>Lifecycle:</b> {@link #configure(CacheConfig)} only records settings. {@link #run()} builds
 * the connection once and returns the same instance on every later call; configuring after that is
 * ignored with a warning. Connection failures never escape {@code run()}: they are reported to the
 * {@link ConnectionEventObserver} by the background readiness ping.</p>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * ConnectionResolver resolver = new ConnectionResolver();
 * resolver.configure(CacheConfig.builder().host("10.0.0.5").password("secret").build());
 * SemanticCache cache = new RedisSemanticCache(resolver.run());
 * }</pre>
 */
public class ConnectionResolver {

    static final Logger logger = LoggerFactory.getLogger(ConnectionResolver.class);

    public static final String ENV_HOST = "cacheHost";

    public static final String ENV_PORT = "cachePort";

    public static final String ENV_PASSWORD = "cachePassword";

    public static final String ENV_CLUSTER = "cacheCluster";

    public static final String ENV_TIMEOUT = "cacheTimeout";

    public static final String DEFAULT_HOST = "127.0.0.1";

    public static final int DEFAULT_PORT = 6379;

    /**
     * Default connect and socket timeout in milliseconds.
     */
    public static final long DEFAULT_TIMEOUT = 1000;

    static final String ADDRESS_SEPARATOR = ",";

    private final Map<String, String> environment;

    private final ConnectionEventObserver observer;

    private final BackgroundTasks backgroundTasks;

    private CacheConfig config;

    private StoreConnection connection;

    /**
     * Constructs a resolver reading the process environment and logging lifecycle events.
     */
    public ConnectionResolver() {
        this(System.getenv(), new LoggingConnectionEventObserver(), new BackgroundTasks());
    }

    /**
     * Constructs a resolver.
     *
     * @param environment the environment snapshot to read {@code cache*} variables from
     * @param observer receives the lifecycle signals of the connection built by {@link #run()}
     * @param backgroundTasks runs the readiness ping
     */
    public ConnectionResolver(final Map<String, String> environment, final ConnectionEventObserver observer, final BackgroundTasks backgroundTasks) {
        N.checkArgNotNull(environment, "environment");
        N.checkArgNotNull(observer, "observer");
        N.checkArgNotNull(backgroundTasks, "backgroundTasks");

        this.environment = environment;
        this.observer = observer;
        this.backgroundTasks = backgroundTasks;
        this.config = resolve(environment, null);
    }

    /**
     * Merges the specified config under the environment and over the defaults, and records the result.
     * Does not touch the network. Ignored once {@link #run()} has been called.
     *
     * @param explicitConfig the application's settings, may be {@code null}
     * @return the merged config now in effect
     */
    public synchronized CacheConfig configure(final CacheConfig explicitConfig) {
        if (connection != null) {
            logger.warn("Connection to " + connection.serverUrl() + " is already established, new configuration is ignored");
            return config;
        }

        config = resolve(environment, explicitConfig);

        return config;
    }

    /**
     * Returns the merged config currently in effect.
     *
     * @return the config
     */
    public synchronized CacheConfig config() {
        return config;
    }

    /**
     * Builds the connection for the merged config on the first call, and returns it on every call.
     *
     * @return the connection
     */
    public synchronized StoreConnection run() {
        if (connection == null) {
            connection = connect(config);

            final StoreConnection conn = connection;
            backgroundTasks.fireAndForget("PING " + conn.serverUrl(), conn::ping);
        }

        return connection;
    }

    /**
     * Builds a connection for the specified resolved config.
     *
     * @param resolved a config returned by {@link #resolve(Map, CacheConfig)}
     * @return a new connection; the client behind it is built on first use
     */
    protected StoreConnection connect(final CacheConfig resolved) {
        final List<HostAndPort> nodes = addressesOf(resolved.getHost(), resolved.getPort());
        final JedisClientConfig clientConfig = clientConfigOf(resolved);
        final String serverUrl = nodes.stream().map(HostAndPort::toString).collect(Collectors.joining(ADDRESS_SEPARATOR));
        final Supplier<UnifiedJedis> clientFactory;

        if (isClusterTopology(resolved)) {
            logger.info("Using Redis cluster topology: " + serverUrl);
            clientFactory = () -> new JedisCluster(new LinkedHashSet<>(nodes), clientConfig);
        } else {
            logger.info("Using single Redis node: " + serverUrl);
            clientFactory = () -> new JedisPooled(nodes.get(0), clientConfig);
        }

        return new JedisStoreConnection(serverUrl, clientFactory, observer);
    }

    /**
     * Merges configuration sources with precedence environment &gt; explicit &gt; defaults.
     * Empty environment values count as unset; unparsable numeric ones are ignored with a warning.
     *
     * @param environment the environment snapshot
     * @param explicitConfig the application's settings, may be {@code null}
     * @return a config with every field set except {@code password}
     */
    public static CacheConfig resolve(final Map<String, String> environment, final CacheConfig explicitConfig) {
        final CacheConfig explicit = explicitConfig == null ? CacheConfig.empty() : explicitConfig;

        return CacheConfig.builder()
                .host(firstNonEmpty(environment.get(ENV_HOST), explicit.getHost(), DEFAULT_HOST))
                .port(firstNonNull(parseInt(ENV_PORT, environment.get(ENV_PORT)), explicit.getPort(), DEFAULT_PORT))
                .password(firstNonEmpty(environment.get(ENV_PASSWORD), explicit.getPassword(), null))
                .cluster(firstNonNull(parseBoolean(ENV_CLUSTER, environment.get(ENV_CLUSTER)), explicit.getCluster(), false))
                .timeout(firstNonNull(parseLong(ENV_TIMEOUT, environment.get(ENV_TIMEOUT)), explicit.getTimeout(), DEFAULT_TIMEOUT))
                .build();
    }

    /**
     * Checks whether the resolved config addresses a cluster.
     *
     * @param resolved the resolved config
     * @return {@code true} for cluster topology
     */
    public static boolean isClusterTopology(final CacheConfig resolved) {
        return Boolean.TRUE.equals(resolved.getCluster()) || addressesOf(resolved.getHost(), resolved.getPort()).size() > 1;
    }

    /**
     * Splits a comma separated host list into addresses.
     *
     * @param host one host, or {@code host[:port]} entries separated by commas
     * @param defaultPort the port for entries without one
     * @return the addresses in order, never empty
     * @throws IllegalArgumentException if {@code host} contains no address, or a malformed bracketed one
     */
    public static List<HostAndPort> addressesOf(final String host, final int defaultPort) {
        final List<HostAndPort> result = new ArrayList<>();

        if (Strings.isNotEmpty(host)) {
            for (final String entry : host.split(ADDRESS_SEPARATOR)) {
                final String addr = entry.trim();

                if (addr.isEmpty()) {
                    continue;
                }

                result.add(addressOf(addr, defaultPort));
            }
        }

        if (result.isEmpty()) {
            throw new IllegalArgumentException("No valid server address found in: " + host);
        }

        return result;
    }

    /**
     * Parses one address: {@code host}, {@code host:port}, {@code [ipv6]} or {@code [ipv6]:port}.
     * An unbracketed IPv6 literal such as {@code ::1} is taken whole as the host.
     */
    static HostAndPort addressOf(final String addr, final int defaultPort) {
        if (addr.startsWith("[")) {
            final int end = addr.indexOf(']');

            if (end < 2) {
                throw new IllegalArgumentException("Malformed IPv6 address: " + addr);
            }

            final String host = addr.substring(1, end);
            final String rest = addr.substring(end + 1);

            if (rest.isEmpty()) {
                return new HostAndPort(host, defaultPort);
            } else if (rest.length() > 1 && rest.charAt(0) == ':' && isDigits(rest.substring(1))) {
                return new HostAndPort(host, Integer.parseInt(rest.substring(1)));
            }

            throw new IllegalArgumentException("Malformed IPv6 address: " + addr);
        }

        final int idx = addr.lastIndexOf(':');

        // only a single colon separates a port; more mean an unbracketed IPv6 literal.
        if (idx > 0 && idx == addr.indexOf(':') && idx < addr.length() - 1 && isDigits(addr.substring(idx + 1))) {
            return new HostAndPort(addr.substring(0, idx), Integer.parseInt(addr.substring(idx + 1)));
        }

        return new HostAndPort(addr, defaultPort);
    }

    static JedisClientConfig clientConfigOf(final CacheConfig resolved) {
        final int timeout = (int) Math.min(Integer.MAX_VALUE, resolved.getTimeout());

        return DefaultJedisClientConfig.builder()
                .connectionTimeoutMillis(timeout)
                .socketTimeoutMillis(timeout)
                .password(resolved.getPassword())
                .build();
    }

    private static String firstNonEmpty(final String a, final String b, final String c) {
        return Strings.isNotEmpty(a) ? a : (Strings.isNotEmpty(b) ? b : c);
    }

    private static <T> T firstNonNull(final T a, final T b, final T c) {
        return a != null ? a : (b != null ? b : c);
    }

    private static Integer parseInt(final String name, final String value) {
        final Long result = parseLong(name, value);

        if (result == null) {
            return null;
        } else if (result <= 0 || result > 65535) {
            logger.warn("Ignoring out of range environment value " + name + "=" + value);
            return null;
        }

        return result.intValue();
    }

    private static Long parseLong(final String name, final String value) {
        if (Strings.isEmpty(value)) {
            return null;
        }

        try {
            return Long.parseLong(value.trim());
        } catch (final NumberFormatException e) {
            logger.warn("Ignoring unparsable environment value " + name + "=" + value);
            return null;
        }
    }

    private static Boolean parseBoolean(final String name, final String value) {
        if (Strings.isEmpty(value)) {
            return null;
        }

        final String str = value.trim();

        if ("true".equalsIgnoreCase(str) || "1".equals(str) || "yes".equalsIgnoreCase(str)) {
            return Boolean.TRUE;
        } else if ("false".equalsIgnoreCase(str) || "0".equals(str) || "no".equalsIgnoreCase(str)) {
            return Boolean.FALSE;
        }

        logger.warn("Ignoring unparsable environment value " + name + "=" + value);
        return null;
    }

    private static boolean isDigits(final String str) {
        for (int i = 0, len = str.length(); i < len; i++) {
            if (!Character.isDigit(str.charAt(i))) {
                return false;
            }
        }

        return true;
    }
}
