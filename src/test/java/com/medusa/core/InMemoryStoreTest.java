package com.medusa.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class InMemoryStoreTest {

    private MutableClock clock;
    private InMemoryStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        store = new InMemoryStore(clock);
    }

    // String family

    @Test
    void setAndGet_basicOperation() {
        store.set("key1", "hello");

        assertThat(store.get("key1")).contains("hello");
    }

    @Test
    void setAndGet_preservesValueExactly() {
        String value = "  spaces, ünïcödé and\ttabs  ";
        store.set("key1", value);

        assertThat(store.get("key1")).contains(value);
    }

    @Test
    void set_emptyValueIsAllowed() {
        store.set("key1", "");

        assertThat(store.get("key1")).contains("");
    }

    @Test
    void set_overwritesExistingValue() {
        store.set("key1", "value1");
        store.set("key1", "value2");

        assertThat(store.get("key1")).contains("value2");
        assertThat(store.count()).isEqualTo(1);
    }

    @Test
    void set_clearsPreviousExpiration() {
        store.setWithTtl("key1", "value1", 10);
        store.set("key1", "value2");

        clock.advanceSeconds(20);

        assertThat(store.get("key1")).contains("value2");
        assertThat(store.ttl("key1")).isEmpty();
    }

    @Test
    void get_nonExistentKey_returnsEmpty() {
        assertThat(store.get("nonexistent")).isEmpty();
    }

    @Test
    void delete_isIdempotent() {
        store.set("key1", "toDelete");

        Optional<Value> first = store.delete("key1");
        Optional<Value> second = store.delete("key1");

        assertThat(first).isPresent();
        assertThat(first.get().describe()).isEqualTo("toDelete");
        assertThat(second).isEmpty();
        assertThat(store.get("key1")).isEmpty();
    }

    @Test
    void delete_removesAnyType() {
        store.hset("hash", "f", "v");
        store.rpush("list", "a");

        assertThat(store.delete("hash")).map(Value::getType).contains(ValueType.HASH);
        assertThat(store.delete("list")).map(Value::getType).contains(ValueType.LIST);
        assertThat(store.count()).isZero();
    }

    @Test
    void delete_expiredKey_returnsEmpty() {
        store.setWithTtl("key1", "value", 1);
        clock.advanceSeconds(2);

        assertThat(store.delete("key1")).isEmpty();
    }

    @Test
    void exists_reflectsLiveness() {
        store.set("key1", "value");

        assertThat(store.exists("key1")).isTrue();
        assertThat(store.exists("nonexistent")).isFalse();
    }

    @Test
    void exists_removesExpiredEntry() {
        store.setWithTtl("key1", "value", 5);
        clock.advanceSeconds(5);

        assertThat(store.exists("key1")).isFalse();
        assertThat(store.ttl("key1")).isEmpty();
    }

    @Test
    void operations_rejectInvalidKey() {
        assertThatThrownBy(() -> store.set(null, "v"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.get(""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Key cannot be null or empty");
        assertThatThrownBy(() -> store.hset("h", "", "v"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Field cannot be null or empty");
        assertThatThrownBy(() -> store.set("k", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // Expiration

    @Test
    void setWithTtl_ttlIsWithinRange() {
        store.setWithTtl("key1", "value", 10);

        OptionalLong ttl = store.ttl("key1");

        assertThat(ttl).isPresent();
        assertThat(ttl.getAsLong()).isBetween(1L, 10L);
    }

    @Test
    void ttl_roundsUpPartialSeconds() {
        store.setWithTtl("key1", "value", 10);
        clock.advance(Duration.ofMillis(9_500));

        assertThat(store.ttl("key1")).hasValue(1);
    }

    @Test
    void ttl_keyWithoutExpiration_returnsEmpty() {
        store.set("key1", "value");

        assertThat(store.ttl("key1")).isEmpty();
    }

    @Test
    void ttl_absentKey_returnsEmpty() {
        assertThat(store.ttl("nonexistent")).isEmpty();
    }

    @Test
    void ttl_expiredKey_reportsExpiredOnceThenEmpty() {
        store.setWithTtl("key1", "value", 3);
        clock.advanceSeconds(4);

        assertThat(store.ttl("key1")).hasValue(Entry.EXPIRED);
        assertThat(store.ttl("key1")).isEmpty();
    }

    @Test
    void get_expiredKey_returnsEmptyAndRemovesIt() {
        store.setWithTtl("key1", "value", 3);
        clock.advanceSeconds(4);

        assertThat(store.get("key1")).isEmpty();
        assertThat(store.ttl("key1")).isEmpty();
        assertThat(store.info()).contains("expired_keys:1");
    }

    @Test
    void setWithTtl_zeroTtlIsImmediatelyExpired() {
        store.setWithTtl("key1", "value", 0);

        assertThat(store.get("key1")).isEmpty();
        assertThat(store.count()).isZero();
    }

    @Test
    void setWithTtl_negativeTtl_throwsException() {
        assertThatThrownBy(() -> store.setWithTtl("key1", "value", -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("TTL cannot be negative");
    }

    @Test
    void setWithTtl_hugeTtlKeepsKeyAlive() {
        long ttl = 10_000_000_000_000_000L;
        store.setWithTtl("key1", "value", ttl);

        assertThat(store.get("key1")).contains("value");
        assertThat(store.exists("key1")).isTrue();
        assertThat(store.ttl("key1").getAsLong()).isBetween(1L, ttl);
    }

    @Test
    void expire_maximumTtlKeepsKeyAlive() {
        store.set("key1", "value");
        store.set("key2", "value");

        assertThat(store.expire("key1", Long.MAX_VALUE)).isTrue();
        assertThat(store.expire("key2", Long.MAX_VALUE / 1000)).isTrue();

        assertThat(store.get("key1")).contains("value");
        assertThat(store.get("key2")).contains("value");
        assertThat(store.ttl("key1").getAsLong()).isPositive();
        assertThat(store.count()).isEqualTo(2);
    }

    @Test
    void expiration_withRealClock() throws InterruptedException {
        InMemoryStore realStore = new InMemoryStore();
        realStore.setWithTtl("key1", "value", 1);
        assertThat(realStore.ttl("key1")).hasValue(1);
        realStore.setWithTtl("key2", "value", 1);

        Thread.sleep(1100);

        assertThat(realStore.get("key1")).isEmpty();
        assertThat(realStore.ttl("key2")).hasValue(Entry.EXPIRED);
        assertThat(realStore.ttl("key2")).isEmpty();
    }

    @Test
    void expire_setsExpirationOnAnyType() {
        store.set("string", "v");
        store.hset("hash", "f", "v");
        store.lpush("list", "a");

        assertThat(store.expire("string", 5)).isTrue();
        assertThat(store.expire("hash", 5)).isTrue();
        assertThat(store.expire("list", 5)).isTrue();
        assertThat(store.ttl("hash")).hasValue(5);

        clock.advanceSeconds(5);

        assertThat(store.count()).isZero();
    }

    @Test
    void expire_refreshesExistingExpiration() {
        store.setWithTtl("key1", "value", 2);
        clock.advanceSeconds(1);

        assertThat(store.expire("key1", 10)).isTrue();
        clock.advanceSeconds(5);

        assertThat(store.get("key1")).contains("value");
        assertThat(store.ttl("key1")).hasValue(5);
    }

    @Test
    void expire_absentKey_returnsFalse() {
        assertThat(store.expire("nonexistent", 5)).isFalse();
        assertThat(store.exists("nonexistent")).isFalse();
    }

    // Enumeration

    @Test
    void listKeys_returnsOnlyLiveKeys() {
        store.set("a", "1");
        store.setWithTtl("b", "2", 1);
        store.hset("c", "f", "v");
        clock.advanceSeconds(2);

        assertThat(store.listKeys()).containsExactlyInAnyOrder("a", "c");
    }

    @Test
    void keys_filtersByPattern() {
        store.set("user:1", "a");
        store.set("user:2", "b");
        store.set("session:1", "c");

        assertThat(store.keys("user:*")).containsExactlyInAnyOrder("user:1", "user:2");
        assertThat(store.keys("*:1")).containsExactlyInAnyOrder("user:1", "session:1");
        assertThat(store.keys("*")).hasSize(3);
        assertThat(store.keys("session:1")).containsExactly("session:1");
        assertThat(store.keys("nothing*")).isEmpty();
    }

    @Test
    void keys_skipsExpiredEntries() {
        store.setWithTtl("user:1", "a", 1);
        store.set("user:2", "b");
        clock.advanceSeconds(1);

        assertThat(store.keys("user:*")).containsExactly("user:2");
    }

    @Test
    void keys_emptyPattern_throwsException() {
        assertThatThrownBy(() -> store.keys(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void count_sweepsExpiredEntries() {
        for (int i = 0; i < 5; i++) {
            store.setWithTtl("temp" + i, "v", 1);
        }
        store.set("permanent", "v");
        clock.advanceSeconds(2);

        assertThat(store.count()).isEqualTo(1);
        assertThat(store.info()).contains("expired_keys:5");
    }

    @Test
    void clear_removesAllEntries() {
        store.set("a", "1");
        store.hset("b", "f", "v");
        store.rpush("c", "x");

        store.clear();

        assertThat(store.count()).isZero();
        assertThat(store.listKeys()).isEmpty();
    }

    @Test
    void info_reportsKeyspace() {
        store.set("a", "1");
        store.setWithTtl("b", "2", 100);
        store.hset("h", "f", "v");
        store.rpush("l", "x");

        String info = store.info();

        assertThat(info).startsWith("# Server");
        assertThat(info).contains("medusa_version:" + InMemoryStore.VERSION);
        assertThat(info).contains("total_keys:4");
        assertThat(info).contains("string_keys:2");
        assertThat(info).contains("hash_keys:1");
        assertThat(info).contains("list_keys:1");
        assertThat(info).contains("keys_with_ttl:1");
        assertThat(info).doesNotContain("\n\n");
    }

    @Test
    void info_countsCommandsProcessed() {
        store.set("a", "1");
        store.get("a");

        // the info call itself is the third operation
        assertThat(store.info()).contains("total_commands_processed:3");
    }

    // Hash family

    @Test
    void hset_reportsCreatedOrUpdated() {
        assertThat(store.hset("user", "name", "alice")).isTrue();
        assertThat(store.hset("user", "name", "bob")).isFalse();

        assertThat(store.hget("user", "name")).contains("bob");
    }

    @Test
    void hashOperations_basicFlow() {
        store.hset("user", "name", "alice");
        store.hset("user", "age", "30");

        assertThat(store.hlen("user")).isEqualTo(2);
        assertThat(store.hexists("user", "age")).isTrue();
        assertThat(store.hgetall("user")).containsOnly(
                Map.entry("name", "alice"), Map.entry("age", "30"));

        assertThat(store.hdel("user", "age")).isTrue();
        assertThat(store.hdel("user", "age")).isFalse();
        assertThat(store.hexists("user", "age")).isFalse();
        assertThat(store.hget("user", "age")).isEmpty();
    }

    @Test
    void hashReads_absentKey_returnEmptyWithoutCreating() {
        assertThat(store.hget("nohash", "f")).isEmpty();
        assertThat(store.hgetall("nohash")).isEmpty();
        assertThat(store.hexists("nohash", "f")).isFalse();
        assertThat(store.hlen("nohash")).isZero();
        assertThat(store.hdel("nohash", "f")).isFalse();

        assertThat(store.exists("nohash")).isFalse();
    }

    @Test
    void hdel_lastField_keepsEmptyHash() {
        store.hset("user", "name", "alice");
        store.hdel("user", "name");

        assertThat(store.exists("user")).isTrue();
        assertThat(store.hlen("user")).isZero();
    }

    @Test
    void hgetall_returnsSnapshot() {
        store.hset("user", "name", "alice");
        Map<String, String> snapshot = store.hgetall("user");

        store.hset("user", "name", "bob");

        assertThat(snapshot).containsEntry("name", "alice");
        assertThatThrownBy(() -> snapshot.put("x", "y"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    // List family

    @Test
    void push_returnsNewLength() {
        assertThat(store.rpush("list", "a")).isEqualTo(1);
        assertThat(store.rpush("list", "b")).isEqualTo(2);
        assertThat(store.lpush("list", "z")).isEqualTo(3);

        assertThat(store.lrange("list", 0, -1)).containsExactly("z", "a", "b");
    }

    @Test
    void pop_removesFromEachEnd() {
        store.rpush("list", "a");
        store.rpush("list", "b");
        store.rpush("list", "c");

        assertThat(store.lpop("list")).contains("a");
        assertThat(store.rpop("list")).contains("c");
        assertThat(store.llen("list")).isEqualTo(1);
        assertThat(store.lpop("list")).contains("b");
        assertThat(store.lpop("list")).isEmpty();
        assertThat(store.rpop("list")).isEmpty();
    }

    @Test
    void pop_lastElement_keepsEmptyList() {
        store.rpush("list", "a");
        store.rpop("list");

        assertThat(store.exists("list")).isTrue();
        assertThat(store.llen("list")).isZero();
    }

    @Test
    void listReads_absentKey_returnEmptyWithoutCreating() {
        assertThat(store.lpop("nolist")).isEmpty();
        assertThat(store.rpop("nolist")).isEmpty();
        assertThat(store.llen("nolist")).isZero();
        assertThat(store.lrange("nolist", 0, -1)).isEmpty();

        assertThat(store.exists("nolist")).isFalse();
    }

    @Test
    void lrange_fullRangeInOrder() {
        for (String s : List.of("a", "b", "c", "d", "e")) {
            store.rpush("list", s);
        }

        assertThat(store.lrange("list", 0, -1)).containsExactly("a", "b", "c", "d", "e");
        assertThat(store.lrange("list", 1, 3)).containsExactly("b", "c", "d");
        assertThat(store.lrange("list", -2, -1)).containsExactly("d", "e");
        assertThat(store.lrange("list", 3, 100)).containsExactly("d", "e");
        assertThat(store.lrange("list", 3, 1)).isEmpty();
        assertThat(store.lrange("list", 10, 20)).isEmpty();
    }

    // Type isolation

    @Test
    void typeIsolation_hashKeyRejectsStringAndListOps() {
        store.hset("hash", "f", "v");

        assertThatThrownBy(() -> store.get("hash"))
                .isInstanceOf(TypeMismatchException.class)
                .hasMessageContaining("hash");
        assertThatThrownBy(() -> store.lpush("hash", "x"))
                .isInstanceOf(TypeMismatchException.class);

        assertThat(store.hget("hash", "f")).contains("v");
    }

    @Test
    void typeIsolation_stringKeyRejectsHashAndListOps() {
        store.set("string", "v");

        assertThatThrownBy(() -> store.hset("string", "f", "v"))
                .isInstanceOf(TypeMismatchException.class)
                .satisfies(e -> {
                    TypeMismatchException tme = (TypeMismatchException) e;
                    assertThat(tme.getKey()).isEqualTo("string");
                    assertThat(tme.getExpected()).isEqualTo(ValueType.HASH);
                    assertThat(tme.getActual()).isEqualTo(ValueType.STRING);
                });
        assertThatThrownBy(() -> store.rpush("string", "x"))
                .isInstanceOf(TypeMismatchException.class);
        assertThatThrownBy(() -> store.llen("string"))
                .isInstanceOf(TypeMismatchException.class);

        assertThat(store.get("string")).contains("v");
    }

    @Test
    void typeIsolation_listKeyRejectsStringAndHashOps() {
        store.rpush("list", "a");

        assertThatThrownBy(() -> store.get("list"))
                .isInstanceOf(TypeMismatchException.class);
        assertThatThrownBy(() -> store.hgetall("list"))
                .isInstanceOf(TypeMismatchException.class);
        assertThatThrownBy(() -> store.hdel("list", "f"))
                .isInstanceOf(TypeMismatchException.class);

        assertThat(store.llen("list")).isEqualTo(1);
    }

    @Test
    void set_replacesKeyOfAnotherType() {
        store.hset("key", "f", "v");
        store.set("key", "now a string");

        assertThat(store.get("key")).contains("now a string");
    }

    @Test
    void expiredKeyOfAnotherType_canBeReusedByAnyFamily() {
        store.hset("key", "f", "v");
        store.expire("key", 1);
        clock.advanceSeconds(1);

        assertThat(store.rpush("key", "x")).isEqualTo(1);
    }

    // Locking

    @Test
    void interruptedCaller_getsStoreExceptionAndStoreStaysUsable() {
        store.set("key1", "value");

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> store.get("key1"))
                    .isInstanceOf(StoreException.class)
                    .isNotInstanceOf(TypeMismatchException.class)
                    .hasCauseInstanceOf(InterruptedException.class);
        } finally {
            assertThat(Thread.interrupted()).isTrue();
        }

        assertThat(store.get("key1")).contains("value");
        store.set("key2", "value2");
        assertThat(store.count()).isEqualTo(2);
    }

    @Test
    void concurrentWriters_noLostUpdates() throws InterruptedException {
        InMemoryStore shared = new InMemoryStore();
        int threadCount = 16;
        int keysPerThread = 200;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        List<Throwable> failures = new ArrayList<>();
        Map<String, Boolean> mismatches = new ConcurrentHashMap<>();

        for (int t = 0; t < threadCount; t++) {
            final int threadId = t;
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < keysPerThread; i++) {
                        String key = "key-" + threadId + "-" + i;
                        String value = "value-" + threadId + "-" + i;
                        shared.set(key, value);
                        if (!shared.get(key).map(value::equals).orElse(false)) {
                            mismatches.put(key, true);
                        }
                    }
                } catch (Throwable e) {
                    synchronized (failures) {
                        failures.add(e);
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(failures).isEmpty();
        assertThat(mismatches).isEmpty();
        assertThat(shared.count()).isEqualTo(threadCount * keysPerThread);
        for (int t = 0; t < threadCount; t++) {
            assertThat(shared.get("key-" + t + "-0")).contains("value-" + t + "-0");
        }
    }

    @Test
    void concurrentPushes_allElementsKept() throws InterruptedException {
        InMemoryStore shared = new InMemoryStore();
        int threadCount = 8;
        int pushesPerThread = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch done = new CountDownLatch(threadCount);

        for (int t = 0; t < threadCount; t++) {
            executor.submit(() -> {
                try {
                    for (int i = 0; i < pushesPerThread; i++) {
                        shared.rpush("list", "x");
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(shared.llen("list")).isEqualTo(threadCount * pushesPerThread);
    }
}
