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

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Little-endian counterpart of {@link BinaryWriter}.
 * <p>
 * Length prefixes are validated against {@code [0, MAX_LENGTH]} before any
 * buffer is allocated, so a corrupt prefix can never trigger a huge allocation.
 * A stream that ends in the middle of a value is reported as a {@link FormatException}.
 */
public final class BinaryReader {

    /** Upper bound for any length-prefixed payload (1 GiB). */
    public static final int MAX_LENGTH = 1 << 30;

    private final DataInputStream in;
    private final byte[] scratch = new byte[Long.BYTES];
    private final ByteBuffer view = ByteBuffer.wrap(scratch).order(ByteOrder.LITTLE_ENDIAN);

    public BinaryReader(InputStream in) {
        this.in = new DataInputStream(in.markSupported() ? in : new BufferedInputStream(in));
    }

    public int readByte() throws IOException {
        fill(1);
        return scratch[0] & 0xFF;
    }

    public int readInt() throws IOException {
        fill(Integer.BYTES);
        return view.getInt(0);
    }

    public long readLong() throws IOException {
        fill(Long.BYTES);
        return view.getLong(0);
    }

    public double readDouble() throws IOException {
        return Double.longBitsToDouble(readLong());
    }

    public byte[] readBytes() throws IOException {
        int length = readInt();
        if (length < 0 || length > MAX_LENGTH) {
            throw new FormatException("Invalid length prefix: " + length);
        }
        byte[] bytes = new byte[length];
        try {
            in.readFully(bytes);
        } catch (EOFException e) {
            throw new FormatException("Truncated payload: expected " + length + " bytes", e);
        }
        return bytes;
    }

    public String readString() throws IOException {
        return new String(readBytes(), StandardCharsets.UTF_8);
    }

    /** True when no further byte can be read. */
    public boolean atEnd() throws IOException {
        in.mark(1);
        int next = in.read();
        if (next < 0) {
            return true;
        }
        in.reset();
        return false;
    }

    private void fill(int count) throws IOException {
        try {
            in.readFully(scratch, 0, count);
        } catch (EOFException e) {
            throw new FormatException("Truncated stream: expected " + count + " more bytes", e);
        }
    }
}
