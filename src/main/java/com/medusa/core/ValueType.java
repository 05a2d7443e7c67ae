package com.medusa.core;

/**
 * The kinds of value a key can hold.
 */
public enum ValueType {
    STRING("string"),
    HASH("hash"),
    LIST("list");

    private final String displayName;

    ValueType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
