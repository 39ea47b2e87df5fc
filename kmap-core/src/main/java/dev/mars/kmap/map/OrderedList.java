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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Doubly-linked sequence of (key, value, size) nodes stored in a slot arena.
 * <p>
 * A handle is the integer index of a slot. Links between nodes are slot
 * indices, so there are no object references between nodes and removal
 * cannot leave a cycle behind. Freed slots go onto a free list and are reused
 * by later pushes.
 * <p>
 * All operations are O(1); pushes are amortized O(1) because the arena grows
 * by doubling.
 * <p>
 * <b>Handles:</b> using a handle after {@link #remove} is a caller error. A
 * handle whose slot is still free is rejected, but once the slot is reused the
 * old handle silently refers to the new node. Callers must not keep handles
 * across removals.
 * <p>
 * Not thread-safe; {@link OrderedMap} guards it with its lock.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class OrderedList<K, V> {

    /** Absent handle. */
    public static final int NIL = -1;

    /** {@code prev} marker of a slot on the free list. */
    private static final int FREE = -2;

    private static final int INITIAL_CAPACITY = 16;

    /** Key and value slots, one per slot handed out so far. */
    private List<K> keys;
    private List<V> values;
    private long[] sizes;
    private int[] prev;
    private int[] next;

    private int head;
    private int tail;
    private int count;
    /** First slot never handed out. */
    private int highWater;
    /** Free list, chained through {@code next}. */
    private int freeHead;

    public OrderedList() {
        this(INITIAL_CAPACITY);
    }

    public OrderedList(int initialCapacity) {
        allocate(Math.max(1, initialCapacity));
    }

    public int pushFront(K key, V value) {
        int slot = acquire(key, value);
        prev[slot] = NIL;
        next[slot] = head;
        if (head == NIL) {
            tail = slot;
        } else {
            prev[head] = slot;
        }
        head = slot;
        return slot;
    }

    public int pushBack(K key, V value) {
        int slot = acquire(key, value);
        next[slot] = NIL;
        prev[slot] = tail;
        if (tail == NIL) {
            head = slot;
        } else {
            next[tail] = slot;
        }
        tail = slot;
        return slot;
    }

    /**
     * Unlinks the node and returns its slot to the free list.
     *
     * @throws IllegalArgumentException if the handle is not live
     */
    public void remove(int handle) {
        checkLive(handle);
        int p = prev[handle];
        int n = next[handle];
        if (p == NIL) {
            head = n;
        } else {
            next[p] = n;
        }
        if (n == NIL) {
            tail = p;
        } else {
            prev[n] = p;
        }

        keys.set(handle, null);
        values.set(handle, null);
        sizes[handle] = 0;
        prev[handle] = FREE;
        next[handle] = freeHead;
        freeHead = handle;
        count--;
    }

    public int front() {
        return head;
    }

    public int back() {
        return tail;
    }

    public int next(int handle) {
        checkLive(handle);
        return next[handle];
    }

    public int prev(int handle) {
        checkLive(handle);
        return prev[handle];
    }

    public K key(int handle) {
        checkLive(handle);
        return keys.get(handle);
    }

    public V value(int handle) {
        checkLive(handle);
        return values.get(handle);
    }

    public void setValue(int handle, V value) {
        checkLive(handle);
        values.set(handle, value);
    }

    /** Approximate byte size recorded for the node. */
    public long size(int handle) {
        checkLive(handle);
        return sizes[handle];
    }

    public void setSize(int handle, long size) {
        checkLive(handle);
        sizes[handle] = size;
    }

    /** True if {@code handle} currently refers to a node. */
    public boolean isLive(int handle) {
        return handle >= 0 && handle < highWater && prev[handle] != FREE;
    }

    public int count() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    /** Drops every node and shrinks the arena back to its initial capacity. */
    public void clear() {
        allocate(INITIAL_CAPACITY);
    }

    private int acquire(K key, V value) {
        int slot;
        if (freeHead != NIL) {
            slot = freeHead;
            freeHead = next[slot];
            keys.set(slot, key);
            values.set(slot, value);
        } else {
            if (highWater == prev.length) {
                grow();
            }
            slot = highWater++;
            keys.add(key);
            values.add(value);
        }
        sizes[slot] = 0;
        count++;
        return slot;
    }

    private void grow() {
        int capacity = prev.length * 2;
        sizes = Arrays.copyOf(sizes, capacity);
        prev = Arrays.copyOf(prev, capacity);
        next = Arrays.copyOf(next, capacity);
    }

    private void allocate(int capacity) {
        keys = new ArrayList<>(capacity);
        values = new ArrayList<>(capacity);
        sizes = new long[capacity];
        prev = new int[capacity];
        next = new int[capacity];
        head = NIL;
        tail = NIL;
        count = 0;
        highWater = 0;
        freeHead = NIL;
    }

    private void checkLive(int handle) {
        if (!isLive(handle)) {
            throw new IllegalArgumentException("Stale or invalid handle: " + handle);
        }
    }
}
