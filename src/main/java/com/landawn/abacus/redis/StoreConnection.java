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

/**
 * The minimal Redis command set a {@link SemanticCache} needs from its store.
 * This interface is the seam between the cache semantics and the network client: the production
 * implementation is {@link JedisStoreConnection}, and tests can hand the cache any other
 * implementation.
 *
 * <br><br>
 * Contract for implementations:
 * <ul>
 * <li>Each method maps to a single Redis command and is atomic on the server.</li>
 * <li>Failures are thrown as unchecked exceptions; the cache decides how to recover.</li>
 * <li>Implementations must be safe for concurrent use from multiple threads.</li>
 * </ul>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * StoreConnection conn = new ConnectionResolver().run();
 * conn.set("user:123", "{\"name\":\"John\"}", 3600L);
 * String json = conn.get("user:123");
 * long ttl = conn.ttl("user:123");   // <= 3600
 * }</pre>
 *
 * @see JedisStoreConnection
 * @see RedisSemanticCache
 */
public interface StoreConnection extends AutoCloseable {

    /**
     * Value returned by {@link #ttl(String)} for a key stored without expiration.
     */
    long TTL_NO_EXPIRATION = -1;

    /**
     * Value returned by {@link #ttl(String)} for a key that does not exist.
     */
    long TTL_KEY_ABSENT = -2;

    /**
     * Returns the address (or comma separated addresses) this connection talks to.
     *
     * @return the server URL
     */
    String serverUrl();

    /**
     * {@code GET key}.
     *
     * @param key the key
     * @return the stored text, or {@code null} if the key does not exist
     */
    String get(String key);

    /**
     * {@code SET key value [EX ttlSeconds]}.
     *
     * @param key the key
     * @param value the text to store
     * @param ttlSeconds the expiration in seconds, {@code null} to store without expiration
     * @return {@code true} if the server acknowledged the write
     */
    boolean set(String key, String value, Long ttlSeconds);

    /**
     * {@code SET key value NX [EX ttlSeconds]}: writes only if the key does not exist.
     *
     * @param key the key
     * @param value the text to store
     * @param ttlSeconds the expiration in seconds, {@code null} to store without expiration
     * @return {@code true} if the value was written, {@code false} if the key already existed
     */
    boolean setIfAbsent(String key, String value, Long ttlSeconds);

    /**
     * {@code GETDEL key}: reads and removes the key in one step.
     *
     * @param key the key
     * @return the stored text, or {@code null} if the key did not exist
     */
    String getAndDelete(String key);

    /**
     * {@code DEL key}.
     *
     * @param key the key
     * @return {@code true} if a key was removed
     */
    boolean delete(String key);

    /**
     * {@code EXISTS key}.
     *
     * @param key the key
     * @return {@code true} if the key exists
     */
    boolean exists(String key);

    /**
     * {@code HMGET key field...}.
     *
     * @param key the hash key
     * @param fields the field names, at least one
     * @return the field values in the order of {@code fields}, {@code null} for missing fields
     */
    List<String> hmget(String key, String... fields);

    /**
     * {@code HMSET key field value...}.
     *
     * @param key the hash key
     * @param fields the field names and values, at least one
     * @return {@code true} if the server acknowledged the write
     */
    boolean hmset(String key, Map<String, String> fields);

    /**
     * {@code EXPIRE key seconds}.
     *
     * @param key the key
     * @param seconds the expiration in seconds
     * @return {@code true} if the timeout was set, {@code false} if the key does not exist
     */
    boolean expire(String key, long seconds);

    /**
     * {@code TTL key}.
     *
     * @param key the key
     * @return remaining seconds, {@link #TTL_NO_EXPIRATION} or {@link #TTL_KEY_ABSENT}
     */
    long ttl(String key);

    /**
     * {@code PING}.
     *
     * @return the server reply, normally {@code "PONG"}
     */
    String ping();

    /**
     * Releases the client and all pooled sockets. Later commands fail.
     */
    @Override
    void close();
}
