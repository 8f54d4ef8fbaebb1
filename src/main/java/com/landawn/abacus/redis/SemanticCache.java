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
import java.util.concurrent.Future;

import com.landawn.abacus.util.ContinuableFuture;
import com.landawn.abacus.util.u.Optional;

/**
 * A small, uniform cache vocabulary over a remote key-value store.
 *
 * <p>Scalar values are stored as JSON text and read back into the class the caller asks for.
 * Hash entries ({@link #multiput(String, Map)} / {@link #multiget(String, Collection)}) hold raw
 * strings. TTLs are in seconds.</p>
 *
 * <p><b>Failure contract:</b> no operation throws because of an invalid key, a store failure, a
 * serialization failure, or a failing producer. Failures are reported through the return value:
 * {@code false}, {@code null}/empty {@code Optional}, an empty list, or {@code -2} for
 * {@link #ttl(String)}. {@link #forget(String)} and the background write of {@code remember} are
 * best-effort and report nothing. A {@code null} target class is a programming error and throws
 * {@link IllegalArgumentException}.</p>
 *
 * <p><b>Concurrency:</b> all operations may be called from any number of threads.
 * {@link #add(String, Object)} is a single atomic store command, and {@link #pull(String, Class)}
 * removes the key with one, so each value is pulled at most once.
 * The write-back of {@code remember} is not awaited, so an immediate {@code get} of the same key
 * may still miss.</p>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * try (SemanticCache cache = CacheFactory.createSemanticCache()) {
 *     cache.put("test", "123456");
 *     String value = cache.gett("test", String.class);   // "123456"
 *
 *     User user = cache.remember("user:123", 600, User.class, () -> userDao.load(123));
 *
 *     cache.multiput("profile:123", Map.of("name", "John", "city", "Oslo"), 3600);
 *     List<String> fields = cache.multiget("profile:123", "name", "city");   // ["John", "Oslo"]
 * }
 * }</pre>
 *
 * @see RedisSemanticCache
 * @see CacheFactory
 */
public interface SemanticCache extends AutoCloseable {

    /**
     * Retrieves the value stored under the key.
     *
     * @param <T> the value type
     * @param key the key
     * @param type the class to decode the stored JSON into
     * @return the value, or empty if the key is invalid or absent, or the stored text cannot be decoded
     */
    <T> Optional<T> get(String key, Class<T> type);

    /**
     * Retrieves the value stored under the key, or {@code null}.
     *
     * @param <T> the value type
     * @param key the key
     * @param type the class to decode the stored JSON into
     * @return the value, or {@code null} if the key is invalid or absent, or the stored text cannot be decoded
     */
    <T> T gett(String key, Class<T> type);

    /**
     * Stores the value without expiration.
     *
     * @param key the key
     * @param value the value, encoded as JSON
     * @return {@code true} if stored
     */
    boolean put(String key, Object value);

    /**
     * Stores the value for {@code ttlSeconds} seconds.
     *
     * @param key the key
     * @param value the value, encoded as JSON
     * @param ttlSeconds the time-to-live in seconds, must be positive
     * @return {@code true} if stored; {@code false} for an invalid key, a non-positive ttl, or a store failure
     */
    boolean put(String key, Object value, long ttlSeconds);

    /**
     * Stores the value permanently. Same as {@link #put(String, Object)}.
     *
     * @param key the key
     * @param value the value
     * @return {@code true} if stored
     */
    boolean forever(String key, Object value);

    /**
     * Removes the key without reporting the outcome. Errors are dropped, but the delete is sent
     * before this method returns, so a following command sees the key removed.
     *
     * @param key the key
     */
    void forget(String key);

    /**
     * Checks whether the key exists.
     *
     * @param key the key
     * @return {@code true} if the store reports the key, {@code false} otherwise or on failure
     */
    boolean has(String key);

    /**
     * Returns the remaining time-to-live of the key.
     *
     * @param key the key
     * @return remaining seconds, {@code -1} if stored without expiration, {@code -2} if absent, invalid or on failure
     */
    long ttl(String key);

    /**
     * Retrieves the value and removes the key. The key is removed only if the stored value decodes
     * into {@code type}; an absent, malformed or mismatched value returns {@code null} and leaves the
     * key untouched. The removal itself is one atomic GETDEL, so of two concurrent pulls only one
     * gets the value.
     *
     * @param <T> the value type
     * @param key the key
     * @param type the class to decode the stored JSON into
     * @return the value, or {@code null} if the key was absent or did not decode
     */
    <T> T pull(String key, Class<T> type);

    /**
     * Stores the value without expiration only if the key does not exist.
     *
     * @param key the key
     * @param value the value
     * @return {@code true} if stored, {@code false} if the key existed or on failure
     */
    boolean add(String key, Object value);

    /**
     * Stores the value for {@code ttlSeconds} seconds only if the key does not exist.
     *
     * @param key the key
     * @param value the value
     * @param ttlSeconds the time-to-live in seconds, must be positive
     * @return {@code true} if stored, {@code false} if the key existed or on failure
     */
    boolean add(String key, Object value, long ttlSeconds);

    /**
     * Returns the cached value, or {@code defaultValue} on a miss, writing it back in the
     * background if {@code ttlSeconds} is positive.
     *
     * @param <T> the value type
     * @param key the key
     * @param ttlSeconds the time-to-live of the write-back; {@code <= 0} skips the write-back
     * @param type the class to decode the stored JSON into
     * @param defaultValue the value to use on a miss, may be {@code null}
     * @return the cached value, or {@code defaultValue}; {@code null} for an invalid key
     */
    <T> T rememberValue(String key, long ttlSeconds, Class<T> type, T defaultValue);

    /**
     * Returns the cached value, or on a miss the value computed by {@code producer},
     * writing it back in the background if {@code ttlSeconds} is positive and the value is not {@code null}.
     * A producer that throws yields {@code null} and nothing is written.
     *
     * @param <T> the value type
     * @param key the key
     * @param ttlSeconds the time-to-live of the write-back; {@code <= 0} skips the write-back
     * @param type the class to decode the stored JSON into
     * @param producer computes the value on a miss; not called on a hit
     * @return the cached or produced value, or {@code null}
     */
    <T> T remember(String key, long ttlSeconds, Class<T> type, Callable<? extends T> producer);

    /**
     * Like {@link #remember(String, long, Class, Callable)} for a producer that returns a future.
     * The future is awaited; if it completes exceptionally the result is {@code null} and nothing is written.
     *
     * @param <T> the value type
     * @param key the key
     * @param ttlSeconds the time-to-live of the write-back; {@code <= 0} skips the write-back
     * @param type the class to decode the stored JSON into
     * @param producer starts the computation on a miss
     * @return the cached or produced value, or {@code null}
     */
    <T> T rememberFuture(String key, long ttlSeconds, Class<T> type, Callable<? extends Future<? extends T>> producer);

    /**
     * Reads hash fields ({@code HMGET}).
     *
     * @param key the hash key
     * @param fields the field names
     * @return the raw field values aligned with {@code fields}, {@code null} for missing fields;
     *         an empty list for an invalid key, no fields, or a store failure
     */
    List<String> multiget(String key, Collection<String> fields);

    /**
     * Reads hash fields ({@code HMGET}).
     *
     * @param key the hash key
     * @param fields the field names
     * @return see {@link #multiget(String, Collection)}
     */
    List<String> multiget(String key, String... fields);

    /**
     * Writes hash fields ({@code HMSET}) without touching the key's expiration.
     *
     * @param key the hash key
     * @param fields field names to raw values
     * @return {@code true} if written
     */
    boolean multiput(String key, Map<String, String> fields);

    /**
     * Writes hash fields ({@code HMSET}), then sets the key's expiration in the background if
     * {@code ttlSeconds} is positive. A failure of the expiration is dropped.
     *
     * @param key the hash key
     * @param fields field names to raw values
     * @param ttlSeconds the time-to-live in seconds; {@code <= 0} leaves the expiration untouched
     * @return {@code true} if the fields were written
     */
    boolean multiput(String key, Map<String, String> fields, long ttlSeconds);

    /**
     * Asynchronous {@link #get(String, Class)}.
     *
     * @param <T> the value type
     * @param key the key
     * @param type the class to decode into
     * @return a future of the result
     */
    <T> ContinuableFuture<Optional<T>> asyncGet(String key, Class<T> type);

    /**
     * Asynchronous {@link #put(String, Object)}.
     *
     * @param key the key
     * @param value the value
     * @return a future of the result
     */
    ContinuableFuture<Boolean> asyncPut(String key, Object value);

    /**
     * Asynchronous {@link #put(String, Object, long)}.
     *
     * @param key the key
     * @param value the value
     * @param ttlSeconds the time-to-live in seconds
     * @return a future of the result
     */
    ContinuableFuture<Boolean> asyncPut(String key, Object value, long ttlSeconds);

    /**
     * Asynchronous {@link #has(String)}.
     *
     * @param key the key
     * @return a future of the result
     */
    ContinuableFuture<Boolean> asyncHas(String key);

    /**
     * Asynchronous {@link #remember(String, long, Class, Callable)}.
     *
     * @param <T> the value type
     * @param key the key
     * @param ttlSeconds the time-to-live of the write-back
     * @param type the class to decode into
     * @param producer computes the value on a miss
     * @return a future of the result
     */
    <T> ContinuableFuture<T> asyncRemember(String key, long ttlSeconds, Class<T> type, Callable<? extends T> producer);

    /**
     * Closes the underlying store connection. Using the cache afterwards throws {@link IllegalStateException}.
     */
    @Override
    void close();

    /**
     * Checks whether the cache has been closed.
     *
     * @return {@code true} if closed
     */
    boolean isClosed();
}
