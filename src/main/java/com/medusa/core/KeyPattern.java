package com.medusa.core;

/**
 * Key filter supporting a single {@code *} wildcard.
 * <p>
 * {@code "*"} matches every key. A pattern with a wildcard is split at its first {@code *};
 * a key matches if it starts with the part before and ends with the part after. Any further
 * {@code *} is taken literally. Prefix and suffix may overlap on short keys. A pattern without
 * a wildcard matches only the identical key.
 */
public final class KeyPattern {

    private static final char WILDCARD = '*';

    private KeyPattern() {
    }

    /**
     * Check whether a key matches a pattern.
     *
     * @param key     the key to test
     * @param pattern the pattern
     * @return true if the key matches
     */
    public static boolean matches(String key, String pattern) {
        int star = pattern.indexOf(WILDCARD);
        if (star < 0) {
            return key.equals(pattern);
        }
        String prefix = pattern.substring(0, star);
        String suffix = pattern.substring(star + 1);
        return key.startsWith(prefix) && key.endsWith(suffix);
    }
}
