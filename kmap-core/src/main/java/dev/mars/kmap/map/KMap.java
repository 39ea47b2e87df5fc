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

import dev.mars.kmap.persist.PersistenceTask;
import dev.mars.kmap.persist.SaveOptions;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Thread-safe key-value map with a byte budget and a binary snapshot format.
 * <p>
 * <b>Size budget:</b> every value is sized when it is stored. When the map is
 * bounded and a {@link #set} would push the running total over the limit, the
 * whole map is cleared first and the new entry becomes its only entry. This is
 * a capacity valve, not a cache policy: there is no per-entry recency tracking.
 * <p>
 * <b>Concurrency:</b> a single reader/writer lock guards the whole map. Reads
 * run concurrently with each other; mutations and snapshot loads are exclusive.
 * <p>
 * Keys and values must not be {@code null}.
 *
 * @param <K> key type
 * @param <V> value type
 * @see OrderedMap
 */
public interface KMap<K, V> {

    // ========================================================================
    // Lookup
    // ========================================================================

    Optional<V> get(K key);

    V getOrDefault(K key, V defaultValue);

    /** Value of the first key in {@code keys} that is present. */
    Optional<V> getAny(Iterable<? extends K> keys);

    boolean containsKey(K key);

    // ========================================================================
    // Mutation
    // ========================================================================

    /**
     * Inserts or updates an entry.
     *
     * @throws SizeExceededException if the map is bounded and the value alone is larger than the limit
     */
    void set(K key, V value);

    /**
     * @return true if an entry was removed
     */
    boolean delete(K key);

    /** Removes every entry and resets the running total. */
    void clear();

    // ========================================================================
    // Inspection
    // ========================================================================

    /** Number of entries. */
    int size();

    /** Sum of the recorded sizes of all entries, in bytes. */
    long totalSize();

    /** Byte ceiling, or {@code -1} when unbounded. */
    long limit();

    List<K> keys();

    List<V> values();

    /**
     * Visits entries in iteration order while holding the read lock.
     * Stops early when the visitor returns {@code false}.
     */
    void range(EntryVisitor<? super K, ? super V> visitor);

    /** Independent map with the same entries, in the same order, and the same limit. */
    KMap<K, V> copy();

    // ========================================================================
    // Snapshots
    // ========================================================================

    /** Uncompressed {@link #save(Path, SaveOptions)}. */
    default void save(Path path) throws IOException {
        save(path, SaveOptions.DEFAULT);
    }

    /**
     * Writes a snapshot to {@code path}, creating parent directories.
     *
     * @throws IOException on filesystem failure
     */
    void save(Path path, SaveOptions options) throws IOException;

    /**
     * Replaces the contents of this map, including its limit, with the snapshot at {@code path}.
     *
     * @throws dev.mars.kmap.codec.FormatException if the file is not a valid snapshot
     * @throws IOException                         on filesystem failure
     */
    void load(Path path) throws IOException;

    default PersistenceTask saveAsync(Path path) {
        return saveAsync(path, SaveOptions.DEFAULT);
    }

    PersistenceTask saveAsync(Path path, SaveOptions options);

    PersistenceTask loadAsync(Path path);
}
