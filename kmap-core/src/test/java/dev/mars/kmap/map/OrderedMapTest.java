/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.kmap.map;

import dev.mars.kmap.KMapConfig;
import dev.mars.kmap.codec.Codecs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link OrderedMap}: ordering, updates, eviction, traversal and
 * concurrent access.
 */
class OrderedMapTest {

    private OrderedMap<String, Long> map;

    @BeforeEach
    void setUp() {
        map = new OrderedMap<>(Codecs.STRING, Codecs.LONG);
    }

    /** Index and list agree: same keys, same values, same count. */
    private static <K, V> void assertConsistent(OrderedMap<K, V> map) {
        List<K> traversed = new ArrayList<>();
        List<V> traversedValues = new ArrayList<>();
        for (int h = map.front(); h != OrderedList.NIL; h = map.next(h)) {
            Map.Entry<K, V> entry = map.entryAt(h).orElseThrow();
            traversed.add(entry.getKey());
            traversedValues.add(entry.getValue());
        }
        assertEquals(map.keys(), traversed);
        assertEquals(map.values(), traversedValues);
        assertEquals(map.size(), traversed.size());
        for (int i = 0; i < traversed.size(); i++) {
            assertEquals(Optional.of(traversedValues.get(i)), map.get(traversed.get(i)));
        }
    }

    // ========================================================================
    // Ordering and Updates
    // ========================================================================

    @Nested
    @DisplayName("Ordering")
    class OrderingTests {

        @Test
        @DisplayName("Keys iterate in insertion order")
        void testInsertionOrder() {
            for (String key : List.of("delta", "alpha", "charlie", "bravo")) {
                map.set(key, 1L);
            }

            assertEquals(List.of("delta", "alpha", "charlie", "bravo"), map.keys());
            assertConsistent(map);
        }

        @Test
        @DisplayName("Updating a key keeps its position")
        void testUpdatePreservesPosition() {
            map.set("a", 1L);
            map.set("b", 2L);
            map.set("a", 3L);

            assertEquals(List.of("a", "b"), map.keys());
            assertEquals(Optional.of(3L), map.get("a"));
            assertEquals(List.of(3L, 2L), map.values());
        }

        @Test
        @DisplayName("Deleted key re-enters at the back")
        void testDeleteThenReinsert() {
            map.set("a", 1L);
            map.set("b", 2L);
            map.delete("a");
            map.set("a", 4L);

            assertEquals(List.of("b", "a"), map.keys());
        }

        @Test
        @DisplayName("front/back/prev expose both ends")
        void testHandles() {
            map.set("a", 1L);
            map.set("b", 2L);
            map.set("c", 3L);

            assertEquals("a", map.entryAt(map.front()).orElseThrow().getKey());
            assertEquals("c", map.entryAt(map.back()).orElseThrow().getKey());
            assertEquals("b", map.entryAt(map.prev(map.back())).orElseThrow().getKey());
            assertEquals(map.front(), map.handleOf("a"));
            assertEquals(OrderedList.NIL, map.handleOf("missing"));
        }

        @Test
        @DisplayName("Empty map has no handles")
        void testEmptyHandles() {
            assertEquals(OrderedList.NIL, map.front());
            assertEquals(OrderedList.NIL, map.back());
            assertTrue(map.entryAt(0).isEmpty());
        }
    }

    // ========================================================================
    // Lookup and Deletion
    // ========================================================================

    @Nested
    @DisplayName("Lookup and Deletion")
    class LookupTests {

        @Test
        void testGet_Missing() {
            assertTrue(map.get("nope").isEmpty());
            assertEquals(7L, map.getOrDefault("nope", 7L));
            assertFalse(map.containsKey("nope"));
        }

        @Test
        void testGetAny_ReturnsFirstPresent() {
            map.set("b", 2L);
            map.set("c", 3L);

            assertEquals(Optional.of(3L), map.getAny(List.of("a", "c", "b")));
            assertTrue(map.getAny(List.of("x", "y")).isEmpty());
        }

        @Test
        void testDelete() {
            map.set("a", 1L);
            map.set("b", 2L);

            assertTrue(map.delete("a"));
            assertFalse(map.delete("a"));
            assertEquals(List.of("b"), map.keys());
            assertEquals(8L, map.totalSize());
            assertConsistent(map);
        }

        @Test
        void testClear() {
            map.set("a", 1L);
            map.set("b", 2L);

            map.clear();

            assertEquals(0, map.size());
            assertEquals(0L, map.totalSize());
            assertTrue(map.keys().isEmpty());
            map.set("c", 3L);
            assertEquals(List.of("c"), map.keys());
        }

        @Test
        void testNullsRejected() {
            assertThrows(NullPointerException.class, () -> map.set(null, 1L));
            assertThrows(NullPointerException.class, () -> map.set("a", null));
        }

        @Test
        @DisplayName("Random set/delete/clear sequence keeps index and list in sync")
        void testBijectionUnderRandomOperations() {
            Random random = new Random(42);
            for (int i = 0; i < 5_000; i++) {
                String key = "k" + random.nextInt(200);
                int op = random.nextInt(100);
                if (op < 60) {
                    map.set(key, (long) i);
                } else if (op < 99) {
                    map.delete(key);
                } else {
                    map.clear();
                }
            }

            assertConsistent(map);
            assertEquals(map.size() * (long) Long.BYTES, map.totalSize());
        }
    }

    // ========================================================================
    // Size Limit and Eviction
    // ========================================================================

    @Nested
    @DisplayName("Size Limit")
    class SizeLimitTests {

        private OrderedMap<String, String> bounded;

        @BeforeEach
        void setUp() {
            bounded = OrderedMap.builder(Codecs.STRING, Codecs.STRING)
                    .limitBytes(100)
                    .build();
        }

        @Test
        @DisplayName("Text is sized by its UTF-8 length")
        void testTextSizing() {
            bounded.set("a", "0123456789");
            bounded.set("b", "éé");

            assertEquals(14, bounded.totalSize());
        }

        @Test
        @DisplayName("Cumulative overflow evicts everything before inserting")
        void testEvictionTrigger() {
            bounded.set("a", "x".repeat(40));
            bounded.set("b", "x".repeat(40));
            assertEquals(2, bounded.size());

            bounded.set("c", "x".repeat(40));

            assertEquals(1, bounded.size());
            assertEquals(List.of("c"), bounded.keys());
            assertEquals(40, bounded.totalSize());
            assertEquals(1, bounded.evictionCount());
            assertConsistent(bounded);
        }

        @Test
        @DisplayName("Filling exactly to the limit does not evict")
        void testExactFitDoesNotEvict() {
            bounded.set("a", "x".repeat(60));
            bounded.set("b", "x".repeat(40));

            assertEquals(2, bounded.size());
            assertEquals(100, bounded.totalSize());
            assertEquals(0, bounded.evictionCount());
        }

        @Test
        @DisplayName("Oversized single value is rejected without mutation")
        void testOversizedValue() {
            bounded.set("a", "x".repeat(30));

            SizeExceededException e = assertThrows(SizeExceededException.class,
                    () -> bounded.set("b", "x".repeat(101)));

            assertEquals(101, e.size());
            assertEquals(100, e.limit());
            assertEquals(1, bounded.size());
            assertEquals(30, bounded.totalSize());
        }

        @Test
        @DisplayName("Update subtracts the previous size before checking")
        void testUpdateSubtractsPreviousSize() {
            bounded.set("a", "x".repeat(50));
            bounded.set("b", "x".repeat(40));

            bounded.set("a", "x".repeat(60));

            assertEquals(List.of("a", "b"), bounded.keys());
            assertEquals(100, bounded.totalSize());
            assertEquals(0, bounded.evictionCount());
        }

        @Test
        @DisplayName("Update that overflows evicts and leaves only that key")
        void testUpdateThatOverflows() {
            bounded.set("a", "x".repeat(30));
            bounded.set("b", "x".repeat(40));

            bounded.set("a", "x".repeat(70));

            assertEquals(List.of("a"), bounded.keys());
            assertEquals(70, bounded.totalSize());
        }

        @Test
        @DisplayName("Delete gives budget back")
        void testDeleteReleasesBudget() {
            bounded.set("a", "x".repeat(60));
            bounded.delete("a");
            bounded.set("b", "x".repeat(60));
            bounded.set("c", "x".repeat(40));

            assertEquals(List.of("b", "c"), bounded.keys());
            assertEquals(0, bounded.evictionCount());
        }

        @Test
        @DisplayName("Unbounded map never evicts")
        void testUnbounded() {
            OrderedMap<String, String> unbounded = new OrderedMap<>(Codecs.STRING, Codecs.STRING, 0);
            for (int i = 0; i < 1000; i++) {
                unbounded.set("k" + i, "x".repeat(1000));
            }

            assertEquals(1000, unbounded.size());
            assertEquals(-1, unbounded.limit());
            assertEquals(1_000_000, unbounded.totalSize());
        }

        @Test
        @DisplayName("Limit given in mebibytes")
        void testLimitMb() {
            OrderedMap<String, String> mb = new OrderedMap<>(Codecs.STRING, Codecs.STRING, 1);
            assertEquals(1024 * 1024, mb.limit());

            String chunk = "x".repeat(400_000);
            mb.set("a", chunk);
            mb.set("b", chunk);
            mb.set("c", chunk);

            assertEquals(List.of("c"), mb.keys());
        }

        @Test
        @DisplayName("Limit taken from configuration")
        void testLimitFromConfig() {
            KMapConfig config = KMapConfig.builder().limitMb(2).syncEnabled(false).build();

            OrderedMap<String, String> configured = new OrderedMap<>(Codecs.STRING, Codecs.STRING, config);

            assertEquals(2L * 1024 * 1024, configured.limit());
        }

        @Test
        @DisplayName("Custom sizer drives eviction")
        void testCustomSizer() {
            OrderedMap<String, Long> fixed = OrderedMap.builder(Codecs.STRING, Codecs.LONG)
                    .limitBytes(100)
                    .sizer(Sizer.fixed(25))
                    .build();
            for (long i = 0; i < 4; i++) {
                fixed.set("k" + i, i);
            }
            assertEquals(4, fixed.size());

            fixed.set("k4", 4L);

            assertEquals(List.of("k4"), fixed.keys());
        }
    }

    // ========================================================================
    // Range and Copy
    // ========================================================================

    @Nested
    @DisplayName("Range and Copy")
    class RangeTests {

        @Test
        void testRange_VisitsInOrder() {
            map.set("a", 1L);
            map.set("b", 2L);
            map.set("c", 3L);
            List<String> seen = new ArrayList<>();

            map.range((key, value) -> {
                seen.add(key + "=" + value);
                return true;
            });

            assertEquals(List.of("a=1", "b=2", "c=3"), seen);
        }

        @Test
        void testRange_StopsEarly() {
            map.set("a", 1L);
            map.set("b", 2L);
            map.set("c", 3L);
            List<String> seen = new ArrayList<>();

            map.range((key, value) -> {
                seen.add(key);
                return !key.equals("b");
            });

            assertEquals(List.of("a", "b"), seen);
        }

        @Test
        void testCopy_IsIndependent() {
            OrderedMap<String, Long> bounded = OrderedMap.builder(Codecs.STRING, Codecs.LONG)
                    .limitBytes(1000)
                    .build();
            bounded.set("a", 1L);
            bounded.set("b", 2L);

            OrderedMap<String, Long> copy = bounded.copy();
            bounded.set("c", 3L);
            copy.delete("a");

            assertEquals(List.of("a", "b", "c"), bounded.keys());
            assertEquals(List.of("b"), copy.keys());
            assertEquals(1000, copy.limit());
            assertEquals(8, copy.totalSize());
            assertConsistent(copy);
        }
    }

    // ========================================================================
    // Concurrency
    // ========================================================================

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("Disjoint writers leave exactly the undeleted keys")
        void testConcurrentDisjointWriters() throws Exception {
            int threads = 8;
            int opsPerThread = 1000;
            ExecutorService pool = Executors.newFixedThreadPool(threads + 1);
            CountDownLatch start = new CountDownLatch(1);
            AtomicBoolean writing = new AtomicBoolean(true);
            List<Future<?>> futures = new ArrayList<>();

            try {
                for (int t = 0; t < threads; t++) {
                    int thread = t;
                    futures.add(pool.submit(() -> {
                        start.await();
                        for (int i = 0; i < opsPerThread; i++) {
                            String key = "t" + thread + "-" + i;
                            map.set(key, (long) i);
                            assertEquals(Optional.of((long) i), map.get(key));
                            if (i % 3 == 0) {
                                assertTrue(map.delete(key));
                            }
                        }
                        return null;
                    }));
                }
                Future<?> reader = pool.submit(() -> {
                    start.await();
                    while (writing.get()) {
                        int[] counted = {0};
                        map.range((key, value) -> {
                            counted[0]++;
                            return true;
                        });
                        assertTrue(counted[0] >= 0);
                    }
                    return null;
                });

                start.countDown();
                for (Future<?> future : futures) {
                    future.get(30, TimeUnit.SECONDS);
                }
                writing.set(false);
                reader.get(30, TimeUnit.SECONDS);
            } finally {
                pool.shutdownNow();
            }

            int survivorsPerThread = opsPerThread - (opsPerThread + 2) / 3;
            assertEquals(threads * survivorsPerThread, map.size());
            assertEquals(threads * survivorsPerThread * (long) Long.BYTES, map.totalSize());
            assertConsistent(map);
        }
    }
}
