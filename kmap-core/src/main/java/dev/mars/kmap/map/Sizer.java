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

import dev.mars.kmap.codec.ValueCodec;

/**
 * Approximate in-memory size of a value, in bytes.
 *
 * @param <T> the measured type
 */
@FunctionalInterface
public interface Sizer<T> {

    long sizeOf(T value);

    /** Sizes values by the length of their codec payload. */
    static <T> Sizer<T> of(ValueCodec<T> codec) {
        return codec::sizeOf;
    }

    /** Every value counts as {@code bytes}. */
    static <T> Sizer<T> fixed(long bytes) {
        return value -> bytes;
    }
}
