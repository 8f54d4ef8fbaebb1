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

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.N;

/**
 * The {@link SemanticCache} implementation over a {@link StoreConnection}.
 *
 * <p>Every operation validates its key with {@link KeyValidator} first and returns its failure
 * value without contacting the store if the key is invalid. Store failures are caught, logged at
 * debug level, and turned into the same failure values.</p>
 *
 * <p><b>Failure circuit:</b> after more than {@code maxFailedNumForRetry} consecutive store
 * failures, operations return their failure value immediately until {@code retryDelay}
 * milliseconds have passed since the last failure. The first success resets the circuit.</p>
 *
 * <p>The connection is owned by this cache and closed by {@link #close()}.</p>
 *
 * @see CacheFactory#createSemanticCache(StoreConnection)
 */
public class RedisSemanticCache extends AbstractSemanticCache {

    static final Logger logger = LoggerFactory.getLogger(RedisSemanticCache.class);

    protected static final int DEFAULT_MAX_FAILED_NUMBER = 100;

    protected static final long DEFAULT_RETRY_DELAY = 1000;

    private final StoreConnection conn;

    private final ValueCodec codec;

    private final BackgroundTasks backgroundTasks;

    private final int maxFailedNumForRetry;

    private final long retryDelay;

    private final AtomicInteger failedCounter = new AtomicInteger();

    private final AtomicLong lastFailedTime = new AtomicLong(0);

    private volatile boolean isClosed = false;

    /**
     * Constructs a cache over the specified connection with default settings.
     *
     * @param conn the store connection, owned by the cache from now on
     */
    public RedisSemanticCache(final StoreConnection conn) {
        this(conn, new BackgroundTasks());
    }

    /**
     * Constructs a cache over the specified connection.
     *
     * @param conn the store connection, owned by the cache from now on
     * @param backgroundTasks runs the best-effort commands
     */
    public RedisSemanticCache(final StoreConnection conn, final BackgroundTasks backgroundTasks) {
        this(conn, new ValueCodec(), backgroundTasks, DEFAULT_MAX_FAILED_NUMBER, DEFAULT_RETRY_DELAY);
    }

    /**
     * Constructs a cache over the specified connection.
     *
     * @param conn the store connection, owned by the cache from now on
     * @param codec encodes and decodes scalar values
     * @param backgroundTasks runs the best-effort commands
     * @param maxFailedNumForRetry consecutive failures after which the circuit opens
     * @param retryDelay milliseconds the circuit stays open after the last failure
     */
    public RedisSemanticCache(final StoreConnection conn, final ValueCodec codec, final BackgroundTasks backgroundTasks, final int maxFailedNumForRetry,
            final long retryDelay) {
        if (conn == null) {
            throw new IllegalArgumentException("StoreConnection cannot be null");
        }

        N.checkArgNotNull(codec, "codec");
        N.checkArgNotNull(backgroundTasks, "backgroundTasks");

        this.conn = conn;
        this.codec = codec;
        this.backgroundTasks = backgroundTasks;
        this.maxFailedNumForRetry = maxFailedNumForRetry;
        this.retryDelay = retryDelay;
    }

    @Override
    public <T> T gett(final String key, final Class<T> type) {
        assertNotClosed();
        N.checkArgNotNull(type, "type");

        if (!KeyValidator.isValid(key)) {
            return null;
        }

        return codec.decode(execute("GET", c -> c.get(key), null), type);
    }

    @Override
    protected boolean store(final String key, final Object value, final Long ttlSeconds, final boolean onlyIfAbsent) {
        assertNotClosed();

        if (!KeyValidator.isValid(key)) {
            return false;
        }

        final String text;

        try {
            text = codec.encode(value);
        } catch (final RuntimeException e) {
            logger.debug("Failed to encode value for key " + key + ": " + e);
            return false;
        }

        if (onlyIfAbsent) {
            return execute("SET NX", c -> c.setIfAbsent(key, text, ttlSeconds), false);
        } else {
            return execute("SET", c -> c.set(key, text, ttlSeconds), false);
        }
    }

    @Override
    public void forget(final String key) {
        assertNotClosed();

        if (!KeyValidator.isValid(key)) {
            return;
        }

        // sent on the caller's thread so a later command on this connection sees the delete.
        execute("DEL", c -> c.delete(key), false);
    }

    @Override
    public boolean has(final String key) {
        assertNotClosed();

        if (!KeyValidator.isValid(key)) {
            return false;
        }

        return execute("EXISTS", c -> c.exists(key), false);
    }

    @Override
    public long ttl(final String key) {
        assertNotClosed();

        if (!KeyValidator.isValid(key)) {
            return StoreConnection.TTL_KEY_ABSENT;
        }

        return execute("TTL", c -> c.ttl(key), StoreConnection.TTL_KEY_ABSENT);
    }

    @Override
    public <T> T pull(final String key, final Class<T> type) {
        assertNotClosed();
        N.checkArgNotNull(type, "type");

        if (!KeyValidator.isValid(key)) {
            return null;
        }

        if (codec.decode(execute("GET", c -> c.get(key), null), type) == null) {
            // absent or undecodable: the key stays.
            return null;
        }

        // null if a concurrent pull or delete won the race.
        return codec.decode(execute("GETDEL", c -> c.getAndDelete(key), null), type);
    }

    @Override
    public <T> T remember(final String key, final long ttlSeconds, final Class<T> type, final Callable<? extends T> producer) {
        assertNotClosed();

        if (!KeyValidator.isValid(key)) {
            return null;
        }

        final T cached = gett(key, type);

        if (cached != null) {
            return cached;
        }

        if (producer == null) {
            return null;
        }

        T result = null;

        try {
            result = producer.call();
        } catch (final Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }

            logger.debug("Producer for key " + key + " failed, nothing is cached: " + e);
            return null;
        }

        if (result != null && ttlSeconds > 0) {
            final T valueToWrite = result;

            backgroundTasks.fireAndForget("SET " + key, () -> {
                if (!store(key, valueToWrite, ttlSeconds, false)) {
                    throw new IllegalStateException("Write-back of key " + key + " was not acknowledged");
                }

                return null;
            });
        }

        return result;
    }

    @Override
    public List<String> multiget(final String key, final Collection<String> fields) {
        assertNotClosed();

        if (!KeyValidator.isValid(key) || N.isEmpty(fields)) {
            return N.emptyList();
        }

        final String[] fieldNames = fields.toArray(new String[0]);
        final List<String> result = execute("HMGET", c -> c.hmget(key, fieldNames), null);

        return result == null ? N.emptyList() : result;
    }

    @Override
    protected boolean storeFields(final String key, final Map<String, String> fields, final Long ttlSeconds) {
        assertNotClosed();

        if (!KeyValidator.isValid(key) || N.isEmpty(fields)) {
            return false;
        }

        if (!execute("HMSET", c -> c.hmset(key, fields), false)) {
            return false;
        }

        if (ttlSeconds != null) {
            backgroundTasks.fireAndForget("EXPIRE " + key, () -> conn.expire(key, ttlSeconds));
        }

        return true;
    }

    /**
     * Returns the runner of best-effort commands used by this cache.
     *
     * @return the background tasks
     */
    public BackgroundTasks backgroundTasks() {
        return backgroundTasks;
    }

    @Override
    public synchronized void close() {
        if (isClosed()) {
            return;
        }

        conn.close();

        isClosed = true;
    }

    @Override
    public boolean isClosed() {
        return isClosed;
    }

    /**
     * Runs a store command through the failure circuit.
     *
     * @param <R> the result type
     * @param commandName used in the debug log line on failure
     * @param command the command
     * @param failureValue returned if the circuit is open or the command fails
     * @return the command result, or {@code failureValue}
     */
    protected <R> R execute(final String commandName, final Function<StoreConnection, R> command, final R failureValue) {
        if ((failedCounter.get() > maxFailedNumForRetry) && ((System.currentTimeMillis() - lastFailedTime.get()) < retryDelay)) {
            return failureValue;
        }

        R result = failureValue;
        boolean isOK = false;

        try {
            result = command.apply(conn);
            isOK = true;
        } catch (final RuntimeException e) {
            logger.debug(commandName + " failed on " + conn.serverUrl() + ": " + e);
        } finally {
            if (isOK) {
                failedCounter.set(0);
                lastFailedTime.set(0);
            } else {
                lastFailedTime.set(System.currentTimeMillis());
                failedCounter.incrementAndGet();
            }
        }

        return result;
    }

    protected void assertNotClosed() {
        if (isClosed) {
            throw new IllegalStateException("This cache has been closed");
        }
    }
}
