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
package dev.mars.kmap.persist;

import dev.mars.kmap.codec.BinaryReader;
import dev.mars.kmap.codec.BinaryWriter;

import java.io.IOException;

/**
 * A structure that can write itself as a snapshot image and rebuild itself from one.
 * <p>
 * Implementations own their locking: {@link #writeImage} runs under a shared
 * lock for its whole duration, {@link #readImage} replaces the contents under
 * an exclusive lock. {@link Persister} only supplies the bytes.
 */
public interface Persistable {

    /**
     * Writes the full image.
     *
     * @return the number of entries written
     */
    long writeImage(BinaryWriter out) throws IOException;

    /**
     * Replaces the current contents with the image read from {@code in}.
     *
     * @return the number of entries loaded
     * @throws dev.mars.kmap.codec.FormatException if the image is invalid
     */
    long readImage(BinaryReader in) throws IOException;
}
