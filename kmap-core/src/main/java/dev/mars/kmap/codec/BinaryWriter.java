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
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Little-endian primitive writer used by the snapshot format.
 * <p>
 * Fixed-width values are written at their natural width. Text and byte
 * blobs are written as a signed 32-bit length followed by the raw bytes.
 * <p>
 * Not thread-safe.
 */
public final class BinaryWriter {

    private final OutputStream out;
    private final ByteBuffer scratch = ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    private long written;

    public BinaryWriter(OutputStream out) {
        this.out = out;
    }

    public void writeByte(int value) throws IOException {
        out.write(value);
        written++;
    }

    public void writeInt(int value) throws IOException {
        scratch.clear();
        scratch.putInt(value);
        emitScratch();
    }

    public void writeLong(long value) throws IOException {
        scratch.clear();
        scratch.putLong(value);
        emitScratch();
    }

    public void writeDouble(double value) throws IOException {
        writeLong(Double.doubleToRawLongBits(value));
    }

    /** Writes {@code int32 length} followed by the bytes. */
    public void writeBytes(byte[] bytes) throws IOException {
        if (bytes.length > BinaryReader.MAX_LENGTH) {
            throw new IllegalArgumentException("Blob too large: " + bytes.length +
                    " bytes (max: " + BinaryReader.MAX_LENGTH + ")");
        }
        writeInt(bytes.length);
        out.write(bytes);
        written += bytes.length;
    }

    /** Writes a string as a length-prefixed UTF-8 blob. */
    public void writeString(String value) throws IOException {
        writeBytes(value.getBytes(StandardCharsets.UTF_8));
    }

    /** Number of bytes handed to the underlying stream so far. */
    public long bytesWritten() {
        return written;
    }

    public void flush() throws IOException {
        out.flush();
    }

    private void emitScratch() throws IOException {
        out.write(scratch.array(), 0, scratch.position());
        written += scratch.position();
    }
}
