package com.medusa.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class HashValueTest {

    private HashValue hash;

    @BeforeEach
    void setUp() {
        hash = new HashValue();
    }

    @Test
    void put_reportsWhetherFieldIsNew() {
        assertThat(hash.put("f", "1")).isTrue();
        assertThat(hash.put("f", "2")).isFalse();
        assertThat(hash.get("f")).isEqualTo("2");
        assertThat(hash.size()).isEqualTo(1);
    }

    @Test
    void remove_missingField_returnsFalse() {
        hash.put("f", "1");

        assertThat(hash.remove("f")).isTrue();
        assertThat(hash.remove("f")).isFalse();
        assertThat(hash.contains("f")).isFalse();
    }

    @Test
    void describe_sortsFields() {
        hash.put("b", "2");
        hash.put("a", "1");

        assertThat(hash.describe()).isEqualTo("{a=1, b=2}");
    }

    @Test
    void snapshot_isDetachedFromHash() {
        hash.put("a", "1");
        Map<String, String> snapshot = hash.snapshot();
        hash.put("b", "2");

        assertThat(snapshot).containsOnlyKeys("a");
        assertThatThrownBy(() -> snapshot.put("c", "3"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void as_wrongVariant_throwsTypeMismatch() {
        assertThatThrownBy(() -> hash.as("myhash", ValueType.LIST, ListValue.class))
                .isInstanceOf(TypeMismatchException.class)
                .hasMessage("Key 'myhash' holds a hash value, not a list");
    }
}
