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
 * Reads and writes the snapshot image of a map.
 * <p>
 * <b>Layout</b> (all integers little-endian):
 * <pre>
 * [4] magic        0x4B4D4150 ("KMAP")
 * [4] version      1
 * [8] totalSize    int64
 * [8] limit        int64
 * [8] count        int64
 * count times:
 *     key          per key codec
 *     value        per value codec
 *     size         int64
 * </pre>
 * The codec only knows the layout. Locking, buffering and compression belong
 * to the caller.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class ImageCodec<K, V> {

    /** Magic number: 'KMAP' in ASCII */
    public static final int MAGIC = 0x4B4D4150;

    /** Image format version */
    public static final int VERSION = 1;

    private final ValueCodec<K> keyCodec;
    private final ValueCodec<V> valueCodec;

    public ImageCodec(ValueCodec<K> keyCodec, ValueCodec<V> valueCodec) {
        this.keyCodec = keyCodec;
        this.valueCodec = valueCodec;
    }

    public ValueCodec<K> keyCodec() {
        return keyCodec;
    }

    public ValueCodec<V> valueCodec() {
        return valueCodec;
    }

    /**
     * Summary fields that precede the entries.
     *
     * @param totalSize running byte total of the map at save time
     * @param limit     byte ceiling at save time, {@code -1} when unbounded
     * @param count     number of entries that follow
     */
    public record Header(long totalSize, long limit, long count) {
    }

    /** Receives entries in image order. */
    @FunctionalInterface
    public interface EntrySink<K, V> {
        void accept(K key, V value, long size) throws IOException;
    }

    /** Pushes the entries to be written, in iteration order, into a sink. */
    @FunctionalInterface
    public interface EntrySource<K, V> {
        void forEach(EntrySink<K, V> sink) throws IOException;
    }

    /**
     * Writes a full image. The source must produce exactly {@code header.count()} entries.
     */
    public void write(BinaryWriter out, Header header, EntrySource<K, V> entries) throws IOException {
        out.writeInt(MAGIC);
        out.writeInt(VERSION);
        out.writeLong(header.totalSize());
        out.writeLong(header.limit());
        out.writeLong(header.count());

        long[] produced = {0};
        entries.forEach((key, value, size) -> {
            keyCodec.write(out, key);
            valueCodec.write(out, value);
            out.writeLong(size);
            produced[0]++;
        });
        if (produced[0] != header.count()) {
            throw new IllegalStateException("Header announced " + header.count() +
                    " entries but " + produced[0] + " were written");
        }
    }

    /**
     * Verifies magic and version, then reads the summary fields.
     *
     * @throws FormatException on a foreign or unsupported image
     */
    public Header readHeader(BinaryReader in) throws IOException {
        int magic = in.readInt();
        if (magic != MAGIC) {
            throw new FormatException("Invalid file format: magic=0x" + Integer.toHexString(magic));
        }
        int version = in.readInt();
        if (version != VERSION) {
            throw new FormatException("Unsupported file version: " + version);
        }
        long totalSize = in.readLong();
        long limit = in.readLong();
        long count = in.readLong();
        if (count < 0) {
            throw new FormatException("Invalid entry count: " + count);
        }
        return new Header(totalSize, limit, count);
    }

    /**
     * Reads {@code header.count()} entries and hands them to {@code sink} in file order.
     */
    public void readEntries(BinaryReader in, Header header, EntrySink<K, V> sink) throws IOException {
        for (long i = 0; i < header.count(); i++) {
            K key = keyCodec.read(in);
            V value = valueCodec.read(in);
            long size = in.readLong();
            if (size < 0) {
                throw new FormatException("Invalid size " + size + " for entry " + i);
            }
            sink.accept(key, value, size);
        }
    }
}
