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

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.N;

import redis.clients.jedis.UnifiedJedis;
import redis.clients.jedis.exceptions.JedisAccessControlException;
import redis.clients.jedis.exceptions.JedisClusterOperationException;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.exceptions.JedisDataException;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.SetParams;

/**
 * A {@link StoreConnection} backed by a Jedis {@link UnifiedJedis} client, either a
 * {@code JedisPooled} for a single node or a {@code JedisCluster} for a cluster.
 *
 * <p><b>Lifecycle:</b> the client is built lazily on the first command, because building a
 * cluster client already talks to the seed nodes. Connection-level failures (refused or dropped
 * sockets, unreachable cluster, rejected AUTH) are reported to the {@link ConnectionEventObserver}
 * and rethrown to the caller. Reconnection is left to Jedis: the pool opens a new socket on the
 * next command, and a cluster client that could not be built is built again on the next command.</p>
 *
 * <pre>
 * CONNECTING --success--> READY --failure--> RECONNECTING --success--> READY
 *      |                                         ^
 *      +-----------------failure-----------------+
 * </pre>
 *
 * <p><b>Redis-Specific Behaviors:</b></p>
 * <ul>
 *   <li>{@link #getAndDelete(String)} uses GETDEL and falls back to GET + DEL on servers older than 6.2</li>
 *   <li>{@link #setIfAbsent(String, String, Long)} uses SET NX with an optional EX in one command</li>
 * </ul>
 *
 * @see ConnectionResolver#run()
 */
public class JedisStoreConnection extends AbstractStoreConnection {

    static final Logger logger = LoggerFactory.getLogger(JedisStoreConnection.class);

    static final String OK = "OK";

    private final Supplier<? extends UnifiedJedis> clientFactory;

    private final ConnectionEventObserver observer;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);

    private volatile UnifiedJedis jedis;

    private volatile boolean getDelSupported = true;

    /**
     * Constructs a connection that builds its client with the specified factory on first use.
     *
     * @param serverUrl the address(es) of the store, used in lifecycle reports
     * @param clientFactory builds the Jedis client, may throw a {@link JedisException}
     * @param observer receives lifecycle signals
     */
    public JedisStoreConnection(final String serverUrl, final Supplier<? extends UnifiedJedis> clientFactory, final ConnectionEventObserver observer) {
        super(serverUrl);

        N.checkArgNotNull(clientFactory, "clientFactory");
        N.checkArgNotNull(observer, "observer");

        this.clientFactory = clientFactory;
        this.observer = observer;
    }

    @Override
    public String get(final String key) {
        return execute(jedis -> jedis.get(key));
    }

    @Override
    public boolean set(final String key, final String value, final Long ttlSeconds) {
        if (ttlSeconds == null) {
            return OK.equals(execute(jedis -> jedis.set(key, value)));
        }

        return OK.equals(execute(jedis -> jedis.set(key, value, SetParams.setParams().ex(ttlSeconds))));
    }

    @Override
    public boolean setIfAbsent(final String key, final String value, final Long ttlSeconds) {
        final SetParams params = ttlSeconds == null ? SetParams.setParams().nx() : SetParams.setParams().nx().ex(ttlSeconds);

        return OK.equals(execute(jedis -> jedis.set(key, value, params)));
    }

    @Override
    public String getAndDelete(final String key) {
        if (getDelSupported) {
            try {
                return execute(jedis -> jedis.getDel(key));
            } catch (final JedisDataException e) {
                if (!isUnknownCommand(e)) {
                    throw e;
                }

                logger.warn("GETDEL is not supported by " + serverUrl() + ", falling back to GET + DEL");
                getDelSupported = false;
            }
        }

        final String value = get(key);

        if (value != null) {
            delete(key);
        }

        return value;
    }

    @Override
    public boolean delete(final String key) {
        return execute(jedis -> jedis.del(key)) > 0;
    }

    @Override
    public boolean exists(final String key) {
        return execute(jedis -> jedis.exists(key));
    }

    @Override
    public List<String> hmget(final String key, final String... fields) {
        return execute(jedis -> jedis.hmget(key, fields));
    }

    @Override
    public boolean hmset(final String key, final Map<String, String> fields) {
        return OK.equals(execute(jedis -> jedis.hmset(key, fields)));
    }

    @Override
    public boolean expire(final String key, final long seconds) {
        return execute(jedis -> jedis.expire(key, seconds)) == 1;
    }

    @Override
    public long ttl(final String key) {
        return execute(jedis -> jedis.ttl(key));
    }

    @Override
    public String ping() {
        return execute(UnifiedJedis::ping);
    }

    /**
     * Returns the current lifecycle state.
     *
     * @return the state
     */
    public ConnectionState state() {
        return state.get();
    }

    @Override
    protected void doClose() {
        state.set(ConnectionState.CLOSED);

        final UnifiedJedis client = jedis;

        if (client != null) {
            client.close();
        }

        logger.info("Closed connection to " + serverUrl());
    }

    protected <R> R execute(final Function<UnifiedJedis, R> command) {
        assertNotClosed();

        final R result;

        try {
            result = command.apply(client());
        } catch (final JedisConnectionException | JedisClusterOperationException | JedisAccessControlException e) {
            onConnectionFailure(e);
            throw e;
        }

        onCommandSuccess();

        return result;
    }

    private UnifiedJedis client() {
        UnifiedJedis result = jedis;

        if (result == null) {
            synchronized (this) {
                result = jedis;

                if (result == null) {
                    result = clientFactory.get();
                    jedis = result;

                    if (state.get() == ConnectionState.CONNECTING) {
                        fire(o -> o.onConnect(serverUrl()));
                    }
                }
            }
        }

        return result;
    }

    private void onCommandSuccess() {
        final ConnectionState prev = state.getAndUpdate(s -> s == ConnectionState.CLOSED ? s : ConnectionState.READY);

        if (prev == ConnectionState.CONNECTING) {
            fire(o -> o.onReady(serverUrl()));
        } else if (prev == ConnectionState.RECONNECTING) {
            fire(o -> o.onConnect(serverUrl()));
            fire(o -> o.onReady(serverUrl()));
        }
    }

    private void onConnectionFailure(final JedisException e) {
        fire(o -> o.onError(serverUrl(), e));

        final ConnectionState prev = state.getAndUpdate(s -> s == ConnectionState.CLOSED ? s : ConnectionState.RECONNECTING);

        if (prev == ConnectionState.CONNECTING || prev == ConnectionState.READY) {
            fire(o -> o.onReconnecting(serverUrl()));
        }
    }

    private void fire(final Consumer<ConnectionEventObserver> event) {
        try {
            event.accept(observer);
        } catch (final RuntimeException e) {
            logger.warn("Connection event observer failed", e);
        }
    }

    static boolean isUnknownCommand(final JedisDataException e) {
        final String msg = e.getMessage();

        return msg != null && msg.toLowerCase().contains("unknown command");
    }
}
