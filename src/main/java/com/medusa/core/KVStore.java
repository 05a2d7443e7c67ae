package com.medusa.core;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Core storage interface for the key-value store.
 * All implementations must be thread-safe and linearizable.
 * <p>
 * A missing key or field is never an error: it yields an empty result.
 * Operations of one value family against a key holding another family
 * throw {@link TypeMismatchException}. Hash and list writes against an
 * absent key create the empty container first.
 */
public interface KVStore {

    // String family

    /**
     * Store a string value with no expiration, replacing whatever the key held.
     *
     * @param key   the key to store
     * @param value the value to store
     */
    void set(String key, String value);

    /**
     * Store a string value that expires after the given number of seconds.
     *
     * @param key        the key to store
     * @param value      the value to store
     * @param ttlSeconds time-to-live in seconds; 0 stores an already expired entry
     */
    void setWithTtl(String key, String value, long ttlSeconds);

    /**
     * Retrieve the string value for a key.
     *
     * @param key the key to look up
     * @return the value if present and not expired, empty otherwise
     * @throws TypeMismatchException if the key holds a hash or a list
     */
    Optional<String> get(String key);

    /**
     * Delete a key of any type.
     *
     * @param key the key to delete
     * @return the removed value, empty if the key was absent
     */
    Optional<Value> delete(String key);

    /**
     * Check if a key exists and is not expired.
     *
     * @param key the key to check
     * @return true if the key is live
     */
    boolean exists(String key);

    /**
     * Remaining time to live of a key, in whole seconds rounded up.
     *
     * @param key the key to check
     * @return empty if the key is absent or has no expiration, {@link Entry#EXPIRED}
     *         if it is present but expired, otherwise the seconds left (at least 1)
     */
    OptionalLong ttl(String key);

    /**
     * Set or refresh the expiration of an existing key of any type.
     *
     * @param key        the key
     * @param ttlSeconds time-to-live in seconds from now
     * @return false if the key is absent
     */
    boolean expire(String key, long ttlSeconds);

    // Enumeration

    /**
     * Get all live keys. Expired entries are removed on the way.
     *
     * @return set of non-expired keys
     */
    Set<String> listKeys();

    /**
     * Get all live keys matching a pattern. See {@link KeyPattern}.
     *
     * @param pattern the key pattern
     * @return set of matching non-expired keys
     */
    Set<String> keys(String pattern);

    /**
     * Get the number of live keys. Expired entries are removed on the way.
     *
     * @return the number of non-expired entries
     */
    int count();

    /**
     * Remove all entries.
     */
    void clear();

    /**
     * Diagnostic summary of the store.
     *
     * @return multi-line report
     */
    String info();

    // Hash family

    /**
     * Set a hash field.
     *
     * @return true if the field was created, false if it was overwritten
     */
    boolean hset(String key, String field, String value);

    Optional<String> hget(String key, String field);

    /**
     * Get all fields of a hash.
     *
     * @return snapshot of the fields, empty if the key is absent
     */
    Map<String, String> hgetall(String key);

    /**
     * Remove a hash field.
     *
     * @return true if the field was removed
     */
    boolean hdel(String key, String field);

    boolean hexists(String key, String field);

    int hlen(String key);

    // List family

    /**
     * Push a value onto the head of a list.
     *
     * @return the new length of the list
     */
    int lpush(String key, String value);

    /**
     * Push a value onto the tail of a list.
     *
     * @return the new length of the list
     */
    int rpush(String key, String value);

    Optional<String> lpop(String key);

    Optional<String> rpop(String key);

    int llen(String key);

    /**
     * Get an inclusive range of a list. Negative indices count from the tail.
     *
     * @param key   the key
     * @param start first index
     * @param stop  last index, inclusive
     * @return elements in head-to-tail order, empty if the key is absent
     */
    List<String> lrange(String key, long start, long stop);
}
