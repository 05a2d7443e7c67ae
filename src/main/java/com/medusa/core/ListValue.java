package com.medusa.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered sequence of text with push/pop at both ends.
 * Not thread-safe, callers hold the store lock.
 */
public final class ListValue extends Value {

    private static final int ELEMENT_OVERHEAD_BYTES = 16;

    private final Deque<String> elements = new ArrayDeque<>();

    int pushHead(String element) {
        elements.addFirst(element);
        return elements.size();
    }

    int pushTail(String element) {
        elements.addLast(element);
        return elements.size();
    }

    String popHead() {
        return elements.pollFirst();
    }

    String popTail() {
        return elements.pollLast();
    }

    public int size() {
        return elements.size();
    }

    /**
     * Inclusive range with negative indices counting from the tail ({@code -1} is the last element).
     * Out-of-range indices are clamped; an inverted range is empty.
     *
     * @param start first index
     * @param stop  last index, inclusive
     * @return the elements in head-to-tail order
     */
    List<String> range(long start, long stop) {
        int len = elements.size();
        if (len == 0) {
            return Collections.emptyList();
        }
        long from = start < 0 ? Math.max(0, len + start) : Math.min(start, len);
        long to = stop < 0 ? Math.max(0, len + stop) : Math.min(stop, len - 1);
        if (from > to) {
            return Collections.emptyList();
        }

        List<String> result = new ArrayList<>((int) (to - from + 1));
        Iterator<String> it = elements.iterator();
        for (int i = 0; i <= to && it.hasNext(); i++) {
            String element = it.next();
            if (i >= from) {
                result.add(element);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Get a copy of all elements, head first.
     */
    public List<String> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(elements));
    }

    @Override
    public ValueType getType() {
        return ValueType.LIST;
    }

    @Override
    public String describe() {
        return elements.toString();
    }

    @Override
    long estimateSize() {
        long size = 0;
        for (String element : elements) {
            size += element.length() * 2L + ELEMENT_OVERHEAD_BYTES;
        }
        return size;
    }
}
