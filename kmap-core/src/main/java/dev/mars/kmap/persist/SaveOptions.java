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

import java.util.zip.Deflater;

/**
 * Options for writing a snapshot.
 *
 * @param compress      gzip the whole image
 * @param compressLevel gzip level {@code 1..9}; {@code 0} (or {@code -1}) selects the default level.
 *                      Ignored when {@code compress} is false.
 */
public record SaveOptions(boolean compress, int compressLevel) {

    public static final SaveOptions DEFAULT = new SaveOptions(false, 0);

    public SaveOptions {
        if (compressLevel < Deflater.DEFAULT_COMPRESSION || compressLevel > Deflater.BEST_COMPRESSION) {
            throw new IllegalArgumentException("Invalid compression level: " + compressLevel);
        }
    }

    /** Compressed with the default level. */
    public static SaveOptions compressed() {
        return new SaveOptions(true, 0);
    }

    /** Compressed with an explicit level. */
    public static SaveOptions compressed(int level) {
        return new SaveOptions(true, level);
    }

    /** The level handed to the deflater. */
    public int effectiveLevel() {
        return compressLevel == 0 ? Deflater.DEFAULT_COMPRESSION : compressLevel;
    }
}
