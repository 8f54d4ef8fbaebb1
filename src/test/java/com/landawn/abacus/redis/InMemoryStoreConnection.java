/*
 * Copyright (c) 2015, Haiyang Li. All rights reserved.
 */

package com.landawn.abacus.redis;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A thread-safe {@link StoreConnection} keeping data in memory, with a clock the test moves
 * forward and switches to make commands fail.
 */
public class InMemoryStoreConnection extends AbstractStoreConnection {

    private final Map<String, Object> data = new HashMap<>();
    private final Map<String, Long> expireAt = new HashMap<>();
    private final List<String> commands = new ArrayList<>();
    private final Set<String> failingCommands = new HashSet<>();
    private final AtomicLong now = new AtomicLong(1_000_000L);
    private volatile RuntimeException failure;

    public InMemoryStoreConnection() {
        super("memory:6379");
    }

    public void advanceMillis(final long millis) {
        now.addAndGet(millis);
    }

    /**
     * Makes every command throw the specified exception, or none if {@code null}.
     */
    public void failWith(final RuntimeException e) {
        this.failure = e;
    }

    /**
     * Makes only the named command fail.
     */
    public synchronized void failOn(final String command) {
        failingCommands.add(command);
    }

    public synchronized List<String> commands() {
        return new ArrayList<>(commands);
    }

    public synchronized void clearCommands() {
        commands.clear();
    }

    /**
     * Reads the raw text behind a key without logging a command.
     */
    public synchronized String raw(final String key) {
        evictIfExpired(key);
        final Object value = data.get(key);
        return value instanceof String ? (String) value : null;
    }

    /**
     * Writes raw text without logging a command.
     */
    public synchronized void putRaw(final String key, final String text) {
        data.put(key, text);
        expireAt.remove(key);
    }

    @Override
    public synchronized String get(final String key) {
        record("GET");
        evictIfExpired(key);
        return (String) data.get(key);
    }

    @Override
    public synchronized boolean set(final String key, final String value, final Long ttlSeconds) {
        record("SET");
        data.put(key, value);
        applyTtl(key, ttlSeconds);
        return true;
    }

    @Override
    public synchronized boolean setIfAbsent(final String key, final String value, final Long ttlSeconds) {
        record("SETNX");
        evictIfExpired(key);

        if (data.containsKey(key)) {
            return false;
        }

        data.put(key, value);
        applyTtl(key, ttlSeconds);
        return true;
    }

    @Override
    public synchronized String getAndDelete(final String key) {
        record("GETDEL");
        evictIfExpired(key);
        expireAt.remove(key);
        return (String) data.remove(key);
    }

    @Override
    public synchronized boolean delete(final String key) {
        record("DEL");
        evictIfExpired(key);
        expireAt.remove(key);
        return data.remove(key) != null;
    }

    @Override
    public synchronized boolean exists(final String key) {
        record("EXISTS");
        evictIfExpired(key);
        return data.containsKey(key);
    }

    @SuppressWarnings("unchecked")
    @Override
    public synchronized List<String> hmget(final String key, final String... fields) {
        record("HMGET");
        evictIfExpired(key);

        final Map<String, String> hash = (Map<String, String>) data.get(key);
        final List<String> result = new ArrayList<>();

        for (final String field : fields) {
            result.add(hash == null ? null : hash.get(field));
        }

        return result;
    }

    @SuppressWarnings("unchecked")
    @Override
    public synchronized boolean hmset(final String key, final Map<String, String> fields) {
        record("HMSET");
        evictIfExpired(key);

        ((Map<String, String>) data.computeIfAbsent(key, k -> new LinkedHashMap<String, String>())).putAll(fields);
        return true;
    }

    @Override
    public synchronized boolean expire(final String key, final long seconds) {
        record("EXPIRE");
        evictIfExpired(key);

        if (!data.containsKey(key)) {
            return false;
        }

        applyTtl(key, seconds);
        return true;
    }

    @Override
    public synchronized long ttl(final String key) {
        record("TTL");
        evictIfExpired(key);

        if (!data.containsKey(key)) {
            return TTL_KEY_ABSENT;
        }

        final Long at = expireAt.get(key);

        if (at == null) {
            return TTL_NO_EXPIRATION;
        }

        return (at - now.get() + 999) / 1000;
    }

    @Override
    public synchronized String ping() {
        record("PING");
        return "PONG";
    }

    @Override
    protected void doClose() {
        // nothing to release.
    }

    private void record(final String command) {
        assertNotClosed();
        commands.add(command);

        if (failure != null) {
            throw failure;
        }

        if (failingCommands.contains(command)) {
            throw new IllegalStateException(command + " failed");
        }
    }

    private void applyTtl(final String key, final Long ttlSeconds) {
        if (ttlSeconds == null) {
            expireAt.remove(key);
        } else {
            expireAt.put(key, now.get() + ttlSeconds * 1000);
        }
    }

    private void evictIfExpired(final String key) {
        final Long at = expireAt.get(key);

        if (at != null && at <= now.get()) {
            data.remove(key);
            expireAt.remove(key);
        }
    }
}
