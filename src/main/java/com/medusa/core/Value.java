package com.medusa.core;

/**
 * Payload stored under a key.
 * The set of variants is closed: {@link StringValue}, {@link HashValue} and {@link ListValue}.
 */
public abstract class Value {

    Value() {
        // only the variants in this package
    }

    /**
     * Get the variant of this value.
     *
     * @return the value type
     */
    public abstract ValueType getType();

    /**
     * Render this value as text, in a form appropriate to its type.
     *
     * @return printable representation
     */
    public abstract String describe();

    /**
     * Rough estimate of the heap used by the payload, in bytes.
     */
    abstract long estimateSize();

    /**
     * Cast this value to the requested variant.
     *
     * @param key      the key holding this value, for the error message
     * @param expected the variant the caller needs
     * @param type     the class of that variant
     * @return this value as the requested variant
     * @throws TypeMismatchException if this value is of another variant
     */
    <T extends Value> T as(String key, ValueType expected, Class<T> type) {
        if (getType() != expected) {
            throw new TypeMismatchException(key, expected, getType());
        }
        return type.cast(this);
    }

    @Override
    public String toString() {
        return getType().name() + "(" + describe() + ")";
    }
}
