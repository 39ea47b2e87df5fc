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
package dev.mars.kmap.codec;

import java.io.IOException;

/**
 * Explicit encoding capability for keys and values stored in a snapshot.
 * <p>
 * Implementations decide the wire shape of their type (fixed-width numeric,
 * length-prefixed text, or length-prefixed structured blob) and report the
 * approximate in-memory size used for the map's byte budget.
 *
 * @param <T> the encoded type
 * @see Codecs
 */
public interface ValueCodec<T> {

    /**
     * Writes one value.
     *
     * @param out   the destination
     * @param value the value, never {@code null}
     */
    void write(BinaryWriter out, T value) throws IOException;

    /**
     * Reads one value written by {@link #write}.
     *
     * @throws FormatException if the bytes do not describe a valid value
     */
    T read(BinaryReader in) throws IOException;

    /**
     * Approximate size of {@code value} in bytes. The default strategy for all
     * built-in codecs is the length of the encoded payload, excluding any length prefix.
     */
    long sizeOf(T value);
}
