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

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ImageCodec} header validation and entry framing.
 */
class ImageCodecTest {

    private final ImageCodec<String, Long> codec = new ImageCodec<>(Codecs.STRING, Codecs.LONG);

    private static ByteBuffer header(int magic, int version, long totalSize, long limit, long count) {
        ByteBuffer buf = ByteBuffer.allocate(256).order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt(magic).putInt(version).putLong(totalSize).putLong(limit).putLong(count);
        return buf;
    }

    private static BinaryReader readerOf(ByteBuffer buf) {
        byte[] bytes = new byte[buf.position()];
        buf.flip().get(bytes);
        return new BinaryReader(new ByteArrayInputStream(bytes));
    }

    @Test
    void testWriteThenRead_PreservesEntriesInOrder() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        BinaryWriter writer = new BinaryWriter(out);
        codec.write(writer, new ImageCodec.Header(16, 100, 2), sink -> {
            sink.accept("z", 1L, 8);
            sink.accept("a", 2L, 8);
        });
        writer.flush();

        BinaryReader reader = new BinaryReader(new ByteArrayInputStream(out.toByteArray()));
        ImageCodec.Header header = codec.readHeader(reader);
        List<String> keys = new ArrayList<>();
        codec.readEntries(reader, header, (key, value, size) -> keys.add(key + "=" + value + "/" + size));

        assertEquals(new ImageCodec.Header(16, 100, 2), header);
        assertEquals(List.of("z=1/8", "a=2/8"), keys);
        assertTrue(reader.atEnd());
    }

    @Test
    void testWrite_CountMismatch() {
        BinaryWriter writer = new BinaryWriter(new ByteArrayOutputStream());

        assertThrows(IllegalStateException.class, () ->
                codec.write(writer, new ImageCodec.Header(0, -1, 2), sink -> sink.accept("a", 1L, 8)));
    }

    @Test
    void testReadHeader_BadMagic() {
        BinaryReader reader = readerOf(header(0x12345678, ImageCodec.VERSION, 0, -1, 0));

        FormatException e = assertThrows(FormatException.class, () -> codec.readHeader(reader));
        assertTrue(e.getMessage().startsWith("Invalid file format"));
    }

    @Test
    void testReadHeader_UnsupportedVersion() {
        BinaryReader reader = readerOf(header(ImageCodec.MAGIC, 2, 0, -1, 0));

        FormatException e = assertThrows(FormatException.class, () -> codec.readHeader(reader));
        assertTrue(e.getMessage().startsWith("Unsupported file version"));
    }

    @Test
    void testReadHeader_NegativeCount() {
        BinaryReader reader = readerOf(header(ImageCodec.MAGIC, ImageCodec.VERSION, 0, -1, -5));

        assertThrows(FormatException.class, () -> codec.readHeader(reader));
    }

    @Test
    void testReadHeader_Truncated() {
        ByteBuffer buf = ByteBuffer.allocate(16).order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt(ImageCodec.MAGIC).putInt(ImageCodec.VERSION).putInt(0);

        assertThrows(FormatException.class, () -> codec.readHeader(readerOf(buf)));
    }

    @Test
    void testReadEntries_NegativeSize() throws IOException {
        ByteBuffer buf = header(ImageCodec.MAGIC, ImageCodec.VERSION, 8, -1, 1);
        buf.putInt(1).put((byte) 'k').putLong(7L).putLong(-8L);
        BinaryReader reader = readerOf(buf);
        ImageCodec.Header header = codec.readHeader(reader);

        assertThrows(FormatException.class, () -> codec.readEntries(reader, header, (k, v, s) -> { }));
    }

    @Test
    void testReadEntries_FewerEntriesThanAnnounced() throws IOException {
        ByteBuffer buf = header(ImageCodec.MAGIC, ImageCodec.VERSION, 16, -1, 2);
        buf.putInt(1).put((byte) 'k').putLong(7L).putLong(8L);
        BinaryReader reader = readerOf(buf);
        ImageCodec.Header header = codec.readHeader(reader);
        List<String> seen = new ArrayList<>();

        assertThrows(FormatException.class, () -> codec.readEntries(reader, header, (k, v, s) -> seen.add(k)));
        assertEquals(List.of("k"), seen);
    }
}
