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

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.landawn.abacus.util.AsyncExecutor;
import com.landawn.abacus.util.ContinuableFuture;
import com.landawn.abacus.util.IOUtil;
import com.landawn.abacus.util.N;
import com.landawn.abacus.util.u.Optional;

/**
 * Base class for {@link SemanticCache} implementations. It derives the overloads, the
 * {@code Optional} view and the asynchronous variants from a handful of primitives.
 *
 * @see RedisSemanticCache
 */
public abstract class AbstractSemanticCache implements SemanticCache {

    protected static final AsyncExecutor asyncExecutor = new AsyncExecutor(//
            N.max(64, IOUtil.CPU_CORES * 8), // coreThreadPoolSize
            N.max(128, IOUtil.CPU_CORES * 16), // maxThreadPoolSize
            180L, TimeUnit.SECONDS);

    protected AbstractSemanticCache() {
    }

    /**
     * Writes the encoded value.
     *
     * @param key the key, not yet validated
     * @param value the value
     * @param ttlSeconds a positive time-to-live, or {@code null} for none
     * @param onlyIfAbsent {@code true} to write only if the key does not exist
     * @return {@code true} if written
     */
    protected abstract boolean store(String key, Object value, Long ttlSeconds, boolean onlyIfAbsent);

    /**
     * Writes hash fields and optionally schedules the expiration.
     *
     * @param key the hash key, not yet validated
     * @param fields the fields
     * @param ttlSeconds a positive time-to-live, or {@code null} for none
     * @return {@code true} if the fields were written
     */
    protected abstract boolean storeFields(String key, Map<String, String> fields, Long ttlSeconds);

    @Override
    public <T> Optional<T> get(final String key, final Class<T> type) {
        return Optional.ofNullable(gett(key, type));
    }

    @Override
    public boolean put(final String key, final Object value) {
        return store(key, value, null, false);
    }

    @Override
    public boolean put(final String key, final Object value, final long ttlSeconds) {
        return ttlSeconds > 0 && store(key, value, ttlSeconds, false);
    }

    @Override
    public boolean forever(final String key, final Object value) {
        return put(key, value);
    }

    @Override
    public boolean add(final String key, final Object value) {
        return store(key, value, null, true);
    }

    @Override
    public boolean add(final String key, final Object value, final long ttlSeconds) {
        return ttlSeconds > 0 && store(key, value, ttlSeconds, true);
    }

    @Override
    public <T> T rememberValue(final String key, final long ttlSeconds, final Class<T> type, final T defaultValue) {
        final Callable<T> constant = () -> defaultValue;

        return remember(key, ttlSeconds, type, constant);
    }

    @Override
    public <T> T rememberFuture(final String key, final long ttlSeconds, final Class<T> type, final Callable<? extends Future<? extends T>> producer) {
        if (producer == null) {
            return rememberValue(key, ttlSeconds, type, null);
        }

        final Callable<T> awaiting = () -> await(producer.call());

        return remember(key, ttlSeconds, type, awaiting);
    }

    @Override
    public List<String> multiget(final String key, final String... fields) {
        return multiget(key, fields == null ? N.emptyList() : Arrays.asList(fields));
    }

    @Override
    public boolean multiput(final String key, final Map<String, String> fields) {
        return storeFields(key, fields, null);
    }

    @Override
    public boolean multiput(final String key, final Map<String, String> fields, final long ttlSeconds) {
        return storeFields(key, fields, ttlSeconds > 0 ? ttlSeconds : null);
    }

    @Override
    public <T> ContinuableFuture<Optional<T>> asyncGet(final String key, final Class<T> type) {
        return asyncExecutor.execute(() -> get(key, type));
    }

    @Override
    public ContinuableFuture<Boolean> asyncPut(final String key, final Object value) {
        return asyncExecutor.execute(() -> put(key, value));
    }

    @Override
    public ContinuableFuture<Boolean> asyncPut(final String key, final Object value, final long ttlSeconds) {
        return asyncExecutor.execute(() -> put(key, value, ttlSeconds));
    }

    @Override
    public ContinuableFuture<Boolean> asyncHas(final String key) {
        return asyncExecutor.execute(() -> has(key));
    }

    @Override
    public <T> ContinuableFuture<T> asyncRemember(final String key, final long ttlSeconds, final Class<T> type, final Callable<? extends T> producer) {
        return asyncExecutor.execute(() -> remember(key, ttlSeconds, type, producer));
    }

    static <T> T await(final Future<? extends T> future) throws Exception {
        if (future == null) {
            return null;
        }

        try {
            return future.get();
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            throw cause instanceof Exception ? (Exception) cause : e;
        }
    }
}
