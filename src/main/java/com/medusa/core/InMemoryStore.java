package com.medusa.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory key-value store guarded by a single lock.
 * <p>
 * Every operation holds the lock for its whole duration, so operations are totally
 * ordered. Expiration is lazy: an expired entry stays in the map until an operation
 * touching its key, or a key enumeration, observes it and removes it.
 */
public class InMemoryStore implements KVStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryStore.class);

    public static final String VERSION = "0.1.0";

    private static final int ENTRY_OVERHEAD_BYTES = 48; // Estimated object overhead

    private final Map<String, Entry> store;
    private final ReentrantLock lock;
    private final Clock clock;

    // guarded by lock
    private long commandsProcessed;
    private long expiredKeys;

    /**
     * Create a store using the system clock.
     */
    public InMemoryStore() {
        this(Clock.systemUTC());
    }

    /**
     * Create a store with a custom clock.
     *
     * @param clock source of the current time for expiration checks
     */
    public InMemoryStore(Clock clock) {
        this.store = new HashMap<>();
        this.lock = new ReentrantLock();
        this.clock = clock;
    }

    // String family

    @Override
    public void set(String key, String value) {
        validateKey(key);
        validateValue(value);
        acquire();
        try {
            store.put(key, new Entry(new StringValue(value)));
            logger.trace("SET key={}, valueLength={}", key, value.length());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setWithTtl(String key, String value, long ttlSeconds) {
        validateKey(key);
        validateValue(value);
        validateTtl(ttlSeconds);
        acquire();
        try {
            long expiresAt = expirationFromNow(ttlSeconds);
            store.put(key, new Entry(new StringValue(value), expiresAt));
            logger.trace("SET key={}, valueLength={}, ttl={}s", key, value.length(), ttlSeconds);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<String> get(String key) {
        validateKey(key);
        acquire();
        try {
            Entry entry = liveEntry(key);
            if (entry == null) {
                logger.trace("GET key={} -> NOT_FOUND", key);
                return Optional.empty();
            }
            StringValue value = entry.getValue().as(key, ValueType.STRING, StringValue.class);
            logger.trace("GET key={} -> FOUND", key);
            return Optional.of(value.getText());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Value> delete(String key) {
        validateKey(key);
        acquire();
        try {
            Entry removed = store.remove(key);
            if (removed == null) {
                logger.trace("DELETE key={} -> NOT_FOUND", key);
                return Optional.empty();
            }
            if (removed.isExpired(now())) {
                expiredKeys++;
                logger.trace("DELETE key={} -> EXPIRED", key);
                return Optional.empty();
            }
            logger.trace("DELETE key={} -> DELETED", key);
            return Optional.of(removed.getValue());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean exists(String key) {
        validateKey(key);
        acquire();
        try {
            return liveEntry(key) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public OptionalLong ttl(String key) {
        validateKey(key);
        acquire();
        try {
            Entry entry = store.get(key);
            if (entry == null) {
                return OptionalLong.empty();
            }
            long now = now();
            if (entry.isExpired(now)) {
                // Report the expiry once, then forget the key
                store.remove(key);
                expiredKeys++;
                logger.trace("TTL key={} -> EXPIRED", key);
                return OptionalLong.of(Entry.EXPIRED);
            }
            return entry.remainingTtl(now);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean expire(String key, long ttlSeconds) {
        validateKey(key);
        validateTtl(ttlSeconds);
        acquire();
        try {
            Entry entry = liveEntry(key);
            if (entry == null) {
                return false;
            }
            entry.setExpiresAt(expirationFromNow(ttlSeconds));
            logger.trace("EXPIRE key={}, ttl={}s", key, ttlSeconds);
            return true;
        } finally {
            lock.unlock();
        }
    }

    // Enumeration

    @Override
    public Set<String> listKeys() {
        acquire();
        try {
            sweepExpired();
            return Collections.unmodifiableSet(new HashSet<>(store.keySet()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Set<String> keys(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("Pattern cannot be null or empty");
        }
        acquire();
        try {
            sweepExpired();
            Set<String> matching = new HashSet<>();
            for (String key : store.keySet()) {
                if (KeyPattern.matches(key, pattern)) {
                    matching.add(key);
                }
            }
            return Collections.unmodifiableSet(matching);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int count() {
        acquire();
        try {
            sweepExpired();
            return store.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        acquire();
        try {
            store.clear();
            logger.debug("Store cleared");
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String info() {
        acquire();
        try {
            long now = now();
            Map<ValueType, Integer> byType = new EnumMap<>(ValueType.class);
            for (ValueType type : ValueType.values()) {
                byType.put(type, 0);
            }
            int liveKeys = 0;
            int keysWithTtl = 0;
            long memory = 0;
            for (Map.Entry<String, Entry> e : store.entrySet()) {
                Entry entry = e.getValue();
                memory += estimateSize(e.getKey(), entry);
                if (entry.isExpired(now)) {
                    continue;
                }
                liveKeys++;
                byType.merge(entry.getValue().getType(), 1, Integer::sum);
                if (entry.hasExpiration()) {
                    keysWithTtl++;
                }
            }

            StringBuilder sb = new StringBuilder();
            sb.append("# Server\n");
            sb.append("medusa_version:").append(VERSION).append('\n');
            sb.append("# Memory\n");
            sb.append("used_memory_estimate:").append(memory).append('\n');
            sb.append("# Stats\n");
            sb.append("total_commands_processed:").append(commandsProcessed).append('\n');
            sb.append("expired_keys:").append(expiredKeys).append('\n');
            sb.append("# Keyspace\n");
            sb.append("total_keys:").append(liveKeys).append('\n');
            sb.append("string_keys:").append(byType.get(ValueType.STRING)).append('\n');
            sb.append("hash_keys:").append(byType.get(ValueType.HASH)).append('\n');
            sb.append("list_keys:").append(byType.get(ValueType.LIST)).append('\n');
            sb.append("keys_with_ttl:").append(keysWithTtl);
            return sb.toString();
        } finally {
            lock.unlock();
        }
    }

    // Hash family

    @Override
    public boolean hset(String key, String field, String value) {
        validateKey(key);
        validateField(field);
        validateValue(value);
        acquire();
        try {
            boolean created = hashForWrite(key).put(field, value);
            logger.trace("HSET key={}, field={} -> {}", key, field, created ? "CREATED" : "UPDATED");
            return created;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<String> hget(String key, String field) {
        validateKey(key);
        validateField(field);
        acquire();
        try {
            HashValue hash = hashForRead(key);
            return hash == null ? Optional.empty() : Optional.ofNullable(hash.get(field));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, String> hgetall(String key) {
        validateKey(key);
        acquire();
        try {
            HashValue hash = hashForRead(key);
            return hash == null ? Collections.emptyMap() : hash.snapshot();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean hdel(String key, String field) {
        validateKey(key);
        validateField(field);
        acquire();
        try {
            HashValue hash = hashForRead(key);
            return hash != null && hash.remove(field);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean hexists(String key, String field) {
        validateKey(key);
        validateField(field);
        acquire();
        try {
            HashValue hash = hashForRead(key);
            return hash != null && hash.contains(field);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int hlen(String key) {
        validateKey(key);
        acquire();
        try {
            HashValue hash = hashForRead(key);
            return hash == null ? 0 : hash.size();
        } finally {
            lock.unlock();
        }
    }

    // List family

    @Override
    public int lpush(String key, String value) {
        validateKey(key);
        validateValue(value);
        acquire();
        try {
            return listForWrite(key).pushHead(value);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int rpush(String key, String value) {
        validateKey(key);
        validateValue(value);
        acquire();
        try {
            return listForWrite(key).pushTail(value);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<String> lpop(String key) {
        validateKey(key);
        acquire();
        try {
            ListValue list = listForRead(key);
            return list == null ? Optional.empty() : Optional.ofNullable(list.popHead());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<String> rpop(String key) {
        validateKey(key);
        acquire();
        try {
            ListValue list = listForRead(key);
            return list == null ? Optional.empty() : Optional.ofNullable(list.popTail());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int llen(String key) {
        validateKey(key);
        acquire();
        try {
            ListValue list = listForRead(key);
            return list == null ? 0 : list.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> lrange(String key, long start, long stop) {
        validateKey(key);
        acquire();
        try {
            ListValue list = listForRead(key);
            return list == null ? Collections.emptyList() : list.range(start, stop);
        } finally {
            lock.unlock();
        }
    }

    // Internals, all called with the lock held

    /**
     * Acquire the store lock and count the operation.
     *
     * @throws StoreException if the thread is interrupted while waiting
     */
    private void acquire() {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("Interrupted while acquiring store lock", e);
        }
        commandsProcessed++;
    }

    /**
     * Look up a key, removing it if it has expired.
     *
     * @return the live entry, or null
     */
    private Entry liveEntry(String key) {
        Entry entry = store.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(now())) {
            store.remove(key);
            expiredKeys++;
            logger.trace("Lazily removed expired key={}", key);
            return null;
        }
        return entry;
    }

    private HashValue hashForRead(String key) {
        Entry entry = liveEntry(key);
        return entry == null ? null : entry.getValue().as(key, ValueType.HASH, HashValue.class);
    }

    private HashValue hashForWrite(String key) {
        Entry entry = liveEntry(key);
        if (entry == null) {
            HashValue hash = new HashValue();
            store.put(key, new Entry(hash));
            return hash;
        }
        return entry.getValue().as(key, ValueType.HASH, HashValue.class);
    }

    private ListValue listForRead(String key) {
        Entry entry = liveEntry(key);
        return entry == null ? null : entry.getValue().as(key, ValueType.LIST, ListValue.class);
    }

    private ListValue listForWrite(String key) {
        Entry entry = liveEntry(key);
        if (entry == null) {
            ListValue list = new ListValue();
            store.put(key, new Entry(list));
            return list;
        }
        return entry.getValue().as(key, ValueType.LIST, ListValue.class);
    }

    /**
     * Remove every expired entry.
     */
    private void sweepExpired() {
        long now = now();
        int removed = 0;
        Iterator<Map.Entry<String, Entry>> it = store.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            expiredKeys += removed;
            logger.trace("Swept {} expired entries", removed);
        }
    }

    /**
     * Absolute expiry for a TTL, saturating at {@code Long.MAX_VALUE} when the
     * TTL is too large to represent in epoch millis.
     */
    private long expirationFromNow(long ttlSeconds) {
        long now = now();
        if (ttlSeconds > (Long.MAX_VALUE - now) / 1000) {
            return Long.MAX_VALUE;
        }
        return now + ttlSeconds * 1000;
    }

    private long now() {
        return clock.millis();
    }

    private long estimateSize(String key, Entry entry) {
        return key.length() * 2L + entry.getValue().estimateSize() + ENTRY_OVERHEAD_BYTES;
    }

    private void validateKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key cannot be null or empty");
        }
    }

    private void validateField(String field) {
        if (field == null || field.isEmpty()) {
            throw new IllegalArgumentException("Field cannot be null or empty");
        }
    }

    private void validateValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
    }

    private void validateTtl(long ttlSeconds) {
        if (ttlSeconds < 0) {
            throw new IllegalArgumentException("TTL cannot be negative: " + ttlSeconds);
        }
    }
}
