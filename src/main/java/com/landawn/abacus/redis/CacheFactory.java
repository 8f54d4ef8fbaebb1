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

/**
 * Factory methods for {@link SemanticCache} instances.
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * // settings from cacheHost/cachePort/... or the defaults
 * SemanticCache cache = CacheFactory.createSemanticCache();
 *
 * // explicit settings, still overridden by the environment
 * SemanticCache cache2 = CacheFactory.createSemanticCache(CacheConfig.builder().host("redis-1,redis-2").port(7000).build());
 *
 * // an existing connection, e.g. a test double
 * SemanticCache cache3 = CacheFactory.createSemanticCache(myConnection);
 * }</pre>
 */
public final class CacheFactory {

    private CacheFactory() {
    }

    /**
     * Creates a cache connected with the settings from the environment, or the defaults.
     *
     * @return a new cache
     */
    public static SemanticCache createSemanticCache() {
        return createSemanticCache(CacheConfig.empty());
    }

    /**
     * Creates a cache connected with the specified settings layered under the environment.
     *
     * @param config the application's settings, may be {@code null}
     * @return a new cache
     */
    public static SemanticCache createSemanticCache(final CacheConfig config) {
        final ConnectionResolver resolver = new ConnectionResolver();
        resolver.configure(config);

        return new RedisSemanticCache(resolver.run());
    }

    /**
     * Creates a cache over an existing connection, which the cache takes ownership of.
     *
     * @param conn the connection
     * @return a new cache
     */
    public static SemanticCache createSemanticCache(final StoreConnection conn) {
        return new RedisSemanticCache(conn);
    }

    /**
     * Creates a cache over an existing connection, which the cache takes ownership of.
     *
     * @param conn the connection
     * @param backgroundTasks runs the best-effort commands
     * @return a new cache
     */
    public static SemanticCache createSemanticCache(final StoreConnection conn, final BackgroundTasks backgroundTasks) {
        return new RedisSemanticCache(conn, backgroundTasks);
    }
}
