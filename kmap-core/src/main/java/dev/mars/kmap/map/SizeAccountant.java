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

/**
 * Running byte total checked against a ceiling.
 * <p>
 * A non-positive limit means unbounded and is normalized to {@code -1}.
 * Not thread-safe; callers hold the map's lock.
 */
public final class SizeAccountant {

    public static final long UNBOUNDED = -1L;

    private long total;
    private long limit;

    public SizeAccountant(long limit) {
        this.limit = normalize(limit);
    }

    public static long normalize(long limit) {
        return limit > 0 ? limit : UNBOUNDED;
    }

    /** Mebibytes to bytes; non-positive values mean unbounded. */
    public static long limitFromMb(int limitMb) {
        return limitMb > 0 ? (long) limitMb * 1024 * 1024 : UNBOUNDED;
    }

    public boolean isBounded() {
        return limit > 0;
    }

    public long limit() {
        return limit;
    }

    public long total() {
        return total;
    }

    /** True if a value of {@code size} bytes can never fit. */
    public boolean exceedsLimit(long size) {
        return isBounded() && size > limit;
    }

    /**
     * True if storing a value of {@code candidate} bytes in place of one of
     * {@code replaced} bytes would push the total over the limit.
     */
    public boolean wouldOverflow(long candidate, long replaced) {
        return isBounded() && total - replaced + candidate > limit;
    }

    public void add(long size) {
        total += size;
    }

    public void subtract(long size) {
        total -= size;
    }

    public void replace(long oldSize, long newSize) {
        total += newSize - oldSize;
    }

    public void reset() {
        total = 0;
    }

    /** Installs the state recorded in a snapshot. */
    public void restore(long total, long limit) {
        this.total = total;
        this.limit = normalize(limit);
    }
}
