package com.medusa.core;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Field to text mapping. Field names are unique; order is not significant.
 * Not thread-safe, callers hold the store lock.
 */
public final class HashValue extends Value {

    private static final int FIELD_OVERHEAD_BYTES = 32;

    private final Map<String, String> fields = new HashMap<>();

    /**
     * Set a field.
     *
     * @return true if the field did not exist before
     */
    boolean put(String field, String value) {
        return fields.put(field, value) == null;
    }

    String get(String field) {
        return fields.get(field);
    }

    boolean remove(String field) {
        return fields.remove(field) != null;
    }

    boolean contains(String field) {
        return fields.containsKey(field);
    }

    public int size() {
        return fields.size();
    }

    /**
     * Get a copy of all fields.
     *
     * @return unmodifiable snapshot of the fields
     */
    public Map<String, String> snapshot() {
        return Collections.unmodifiableMap(new HashMap<>(fields));
    }

    @Override
    public ValueType getType() {
        return ValueType.HASH;
    }

    @Override
    public String describe() {
        return new TreeMap<>(fields).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }

    @Override
    long estimateSize() {
        long size = 0;
        for (Map.Entry<String, String> e : fields.entrySet()) {
            size += (e.getKey().length() + e.getValue().length()) * 2L + FIELD_OVERHEAD_BYTES;
        }
        return size;
    }
}
