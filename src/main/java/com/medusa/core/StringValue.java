package com.medusa.core;

import java.util.Objects;

/**
 * Plain text value.
 */
public final class StringValue extends Value {

    private final String text;

    public StringValue(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public String getText() {
        return text;
    }

    @Override
    public ValueType getType() {
        return ValueType.STRING;
    }

    @Override
    public String describe() {
        return text;
    }

    @Override
    long estimateSize() {
        return text.length() * 2L;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return text.equals(((StringValue) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }
}
