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
import dev.mars.kmap.codec.BinaryReader;
import dev.mars.kmap.codec.BinaryWriter;
import dev.mars.kmap.codec.FormatException;
import dev.mars.kmap.codec.ImageCodec;
import dev.mars.kmap.codec.ImageCodec.Header;
import dev.mars.kmap.codec.ValueCodec;
import dev.mars.kmap.persist.Persistable;
import dev.mars.kmap.persist.PersistenceTask;
import dev.mars.kmap.persist.Persister;
import dev.mars.kmap.persist.SaveOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link KMap} that iterates in insertion order.
 * <p>
 * A {@link HashMap} from key to handle gives O(1) lookup, an
 * {@link OrderedList} gives O(1) append, removal and ordered traversal. Both
 * are only mutated together under the write lock, so every index entry has
 * exactly one list node and vice versa.
 * <p>
 * Updating a present key keeps its position. If the update triggers an
 * eviction the key re-enters as the only entry.
 * <p>
 * <b>Sizing:</b> values are sized by a {@link Sizer}, by default the value
 * codec's payload length: UTF-8 length for text, array length for bytes, the
 * natural width for numerics, the JSON length for structured values.
 * <p>
 * <b>Handles:</b> {@link #front()}, {@link #back()}, {@link #next(int)} and
 * {@link #prev(int)} expose list handles for external traversal. Each call
 * takes the read lock on its own; a handle kept across a concurrent removal
 * may refer to a freed or reused slot. Prefer {@link #range} when consistency
 * matters.
 *
 * <pre>{@code
 * OrderedMap<String, Long> map = OrderedMap.builder(Codecs.STRING, Codecs.LONG)
 *         .limitMb(64)
 *         .build();
 * map.set("a", 1L);
 * map.save(Path.of("data/a.kmap"), SaveOptions.compressed());
 * }</pre>
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class OrderedMap<K, V> implements KMap<K, V>, Persistable {

    private static final Logger LOG = LoggerFactory.getLogger(OrderedMap.class);

    /** Upper bound on pre-sizing from an untrusted snapshot count. */
    private static final int MAX_PRESIZE = 1 << 16;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ImageCodec<K, V> imageCodec;
    private final Sizer<? super V> sizer;
    private final Persister persister;

    private Map<K, Integer> index = new HashMap<>();
    private OrderedList<K, V> list = new OrderedList<>();
    private final SizeAccountant accountant;
    private long evictions;

    /** Unbounded map. */
    public OrderedMap(ValueCodec<K> keyCodec, ValueCodec<V> valueCodec) {
        this(builder(keyCodec, valueCodec));
    }

    /**
     * @param limitMb size ceiling in mebibytes; zero or negative means unbounded
     */
    public OrderedMap(ValueCodec<K> keyCodec, ValueCodec<V> valueCodec, int limitMb) {
        this(builder(keyCodec, valueCodec).limitMb(limitMb));
    }

    /** Limit and fsync setting taken from {@code config}. */
    public OrderedMap(ValueCodec<K> keyCodec, ValueCodec<V> valueCodec, KMapConfig config) {
        this(builder(keyCodec, valueCodec).config(config));
    }

    private OrderedMap(Builder<K, V> builder) {
        this.imageCodec = new ImageCodec<>(builder.keyCodec, builder.valueCodec);
        this.sizer = builder.sizer != null ? builder.sizer : Sizer.of(builder.valueCodec);
        this.persister = builder.persister != null ? builder.persister : new Persister();
        this.accountant = new SizeAccountant(builder.limitBytes);

        LOG.debug("OrderedMap created: limit={} bytes, keyCodec={}, valueCodec={}",
                accountant.limit(), builder.keyCodec, builder.valueCodec);
    }

    public static <K, V> Builder<K, V> builder(ValueCodec<K> keyCodec, ValueCodec<V> valueCodec) {
        return new Builder<>(keyCodec, valueCodec);
    }

    // ========================================================================
    // Lookup
    // ========================================================================

    @Override
    public Optional<V> get(K key) {
        lock.readLock().lock();
        try {
            Integer handle = index.get(key);
            return handle == null ? Optional.empty() : Optional.of(list.value(handle));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public V getOrDefault(K key, V defaultValue) {
        lock.readLock().lock();
        try {
            Integer handle = index.get(key);
            return handle == null ? defaultValue : list.value(handle);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<V> getAny(Iterable<? extends K> keys) {
        lock.readLock().lock();
        try {
            for (K key : keys) {
                Integer handle = index.get(key);
                if (handle != null) {
                    return Optional.of(list.value(handle));
                }
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean containsKey(K key) {
        lock.readLock().lock();
        try {
            return index.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ========================================================================
    // Mutation
    // ========================================================================

    @Override
    public void set(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        long candidate = sizer.sizeOf(value);

        lock.writeLock().lock();
        try {
            if (accountant.exceedsLimit(candidate)) {
                LOG.debug("Rejecting value of {} bytes, limit is {} bytes", candidate, accountant.limit());
                throw new SizeExceededException(candidate, accountant.limit());
            }

            Integer handle = index.get(key);
            long replaced = handle != null ? list.size(handle) : 0L;

            if (accountant.wouldOverflow(candidate, replaced)) {
                evictAll(candidate);
                handle = null;
            }

            if (handle != null) {
                list.setValue(handle, value);
                list.setSize(handle, candidate);
                accountant.replace(replaced, candidate);
            } else {
                int slot = list.pushBack(key, value);
                list.setSize(slot, candidate);
                index.put(key, slot);
                accountant.add(candidate);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean delete(K key) {
        lock.writeLock().lock();
        try {
            Integer handle = index.remove(key);
            if (handle == null) {
                return false;
            }
            accountant.subtract(list.size(handle));
            list.remove(handle);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            index = new HashMap<>();
            list.clear();
            accountant.reset();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Whole-map reset. Caller holds the write lock. */
    private void evictAll(long incoming) {
        LOG.debug("Size limit reached ({} + {} > {} bytes), evicting all {} entries",
                accountant.total(), incoming, accountant.limit(), list.count());
        index = new HashMap<>();
        list.clear();
        accountant.reset();
        evictions++;
    }

    // ========================================================================
    // Inspection
    // ========================================================================

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return index.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long totalSize() {
        lock.readLock().lock();
        try {
            return accountant.total();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long limit() {
        lock.readLock().lock();
        try {
            return accountant.limit();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Number of whole-map evictions since construction. */
    public long evictionCount() {
        lock.readLock().lock();
        try {
            return evictions;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<K> keys() {
        lock.readLock().lock();
        try {
            List<K> keys = new ArrayList<>(list.count());
            for (int h = list.front(); h != OrderedList.NIL; h = list.next(h)) {
                keys.add(list.key(h));
            }
            return keys;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<V> values() {
        lock.readLock().lock();
        try {
            List<V> values = new ArrayList<>(list.count());
            for (int h = list.front(); h != OrderedList.NIL; h = list.next(h)) {
                values.add(list.value(h));
            }
            return values;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void range(EntryVisitor<? super K, ? super V> visitor) {
        lock.readLock().lock();
        try {
            for (int h = list.front(); h != OrderedList.NIL; h = list.next(h)) {
                if (!visitor.visit(list.key(h), list.value(h))) {
                    break;
                }
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Copies entries with their recorded sizes; no value is re-sized and no
     * eviction can happen while copying.
     */
    @Override
    public OrderedMap<K, V> copy() {
        lock.readLock().lock();
        try {
            OrderedMap<K, V> copy = builder(imageCodec.keyCodec(), imageCodec.valueCodec())
                    .limitBytes(accountant.limit())
                    .sizer(sizer)
                    .persister(persister)
                    .build();
            for (int h = list.front(); h != OrderedList.NIL; h = list.next(h)) {
                int slot = copy.list.pushBack(list.key(h), list.value(h));
                copy.list.setSize(slot, list.size(h));
                copy.index.put(list.key(h), slot);
            }
            copy.accountant.restore(accountant.total(), accountant.limit());
            return copy;
        } finally {
            lock.readLock().unlock();
        }
    }

    // ========================================================================
    // Handles
    // ========================================================================

    /** Handle of the first entry, or {@link OrderedList#NIL}. */
    public int front() {
        lock.readLock().lock();
        try {
            return list.front();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Handle of the last entry, or {@link OrderedList#NIL}. */
    public int back() {
        lock.readLock().lock();
        try {
            return list.back();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @throws IllegalArgumentException if the handle is stale
     */
    public int next(int handle) {
        lock.readLock().lock();
        try {
            return list.next(handle);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @throws IllegalArgumentException if the handle is stale
     */
    public int prev(int handle) {
        lock.readLock().lock();
        try {
            return list.prev(handle);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Handle of {@code key}, or {@link OrderedList#NIL} if absent. */
    public int handleOf(K key) {
        lock.readLock().lock();
        try {
            Integer handle = index.get(key);
            return handle == null ? OrderedList.NIL : handle;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Key and value at {@code handle}, or empty if the slot is free. */
    public Optional<Map.Entry<K, V>> entryAt(int handle) {
        lock.readLock().lock();
        try {
            if (!list.isLive(handle)) {
                return Optional.empty();
            }
            return Optional.of(new AbstractMap.SimpleImmutableEntry<>(list.key(handle), list.value(handle)));
        } finally {
            lock.readLock().unlock();
        }
    }

    // ========================================================================
    // Snapshots
    // ========================================================================

    @Override
    public void save(Path path, SaveOptions options) throws IOException {
        persister.save(this, path, options);
    }

    @Override
    public void load(Path path) throws IOException {
        persister.load(this, path);
    }

    @Override
    public PersistenceTask saveAsync(Path path, SaveOptions options) {
        return persister.saveAsync(this, path, options);
    }

    @Override
    public PersistenceTask loadAsync(Path path) {
        return persister.loadAsync(this, path);
    }

    /** Encodes the map under the read lock, held until the last entry is written. */
    @Override
    public long writeImage(BinaryWriter out) throws IOException {
        lock.readLock().lock();
        try {
            Header header = new Header(accountant.total(), accountant.limit(), list.count());
            imageCodec.write(out, header, sink -> {
                for (int h = list.front(); h != OrderedList.NIL; h = list.next(h)) {
                    sink.accept(list.key(h), list.value(h), list.size(h));
                }
            });
            return header.count();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Decodes the image into a fresh list and index without holding the lock,
     * then swaps them in under the write lock. A decoding failure leaves the
     * current contents untouched.
     */
    @Override
    public long readImage(BinaryReader in) throws IOException {
        Header header = imageCodec.readHeader(in);
        int presize = (int) Math.min(header.count(), MAX_PRESIZE);
        OrderedList<K, V> stagedList = new OrderedList<>(presize);
        Map<K, Integer> stagedIndex = new HashMap<>(presize * 2);
        long[] total = {0};

        imageCodec.readEntries(in, header, (key, value, size) -> {
            if (key == null || value == null) {
                throw new FormatException("Null key or value at position " + stagedList.count());
            }
            if (stagedIndex.containsKey(key)) {
                throw new FormatException("Duplicate key in snapshot: " + key);
            }
            int slot = stagedList.pushBack(key, value);
            stagedList.setSize(slot, size);
            stagedIndex.put(key, slot);
            total[0] += size;
            LOG.trace("Loaded entry #{}: size={}", stagedList.count(), size);
        });

        if (!in.atEnd()) {
            LOG.warn("Snapshot has trailing bytes after {} entries, ignoring them", header.count());
        }
        if (total[0] != header.totalSize()) {
            LOG.warn("Snapshot total size {} does not match the sum of entry sizes {}, using the sum",
                    header.totalSize(), total[0]);
        }

        lock.writeLock().lock();
        try {
            list = stagedList;
            index = stagedIndex;
            accountant.restore(total[0], header.limit());
        } finally {
            lock.writeLock().unlock();
        }
        return header.count();
    }

    @Override
    public String toString() {
        lock.readLock().lock();
        try {
            return "OrderedMap{" +
                    "size=" + index.size() +
                    ", totalSize=" + accountant.total() +
                    ", limit=" + accountant.limit() +
                    '}';
        } finally {
            lock.readLock().unlock();
        }
    }

    // ========================================================================
    // Builder
    // ========================================================================

    /**
     * Builder for {@link OrderedMap}. Unbounded, codec-based sizing and fsync
     * enabled unless told otherwise.
     */
    public static final class Builder<K, V> {
        private final ValueCodec<K> keyCodec;
        private final ValueCodec<V> valueCodec;
        private long limitBytes = SizeAccountant.UNBOUNDED;
        private Sizer<? super V> sizer;
        private Persister persister;

        private Builder(ValueCodec<K> keyCodec, ValueCodec<V> valueCodec) {
            this.keyCodec = Objects.requireNonNull(keyCodec, "keyCodec");
            this.valueCodec = Objects.requireNonNull(valueCodec, "valueCodec");
        }

        /** Size ceiling in mebibytes; zero or negative means unbounded. */
        public Builder<K, V> limitMb(int limitMb) {
            this.limitBytes = SizeAccountant.limitFromMb(limitMb);
            return this;
        }

        /** Exact size ceiling in bytes; zero or negative means unbounded. */
        public Builder<K, V> limitBytes(long limitBytes) {
            this.limitBytes = SizeAccountant.normalize(limitBytes);
            return this;
        }

        /** Replaces the codec-based sizing. */
        public Builder<K, V> sizer(Sizer<? super V> sizer) {
            this.sizer = sizer;
            return this;
        }

        public Builder<K, V> persister(Persister persister) {
            this.persister = persister;
            return this;
        }

        /** Applies the limit and fsync setting of {@code config}. */
        public Builder<K, V> config(KMapConfig config) {
            this.limitBytes = config.limitBytes();
            this.persister = new Persister(config.syncEnabled());
            return this;
        }

        public OrderedMap<K, V> build() {
            return new OrderedMap<>(this);
        }
    }
}
