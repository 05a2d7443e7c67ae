package com.medusa.core;

/**
 * Thrown when an operation expects one kind of value but the key holds another.
 */
public class TypeMismatchException extends StoreException {

    private final String key;
    private final ValueType expected;
    private final ValueType actual;

    public TypeMismatchException(String key, ValueType expected, ValueType actual) {
        super("Key '" + key + "' holds a " + actual.getDisplayName()
                + " value, not a " + expected.getDisplayName());
        this.key = key;
        this.expected = expected;
        this.actual = actual;
    }

    public String getKey() {
        return key;
    }

    public ValueType getExpected() {
        return expected;
    }

    public ValueType getActual() {
        return actual;
    }
}
