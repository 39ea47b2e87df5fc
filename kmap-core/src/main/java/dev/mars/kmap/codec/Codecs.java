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

import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Built-in {@link ValueCodec}s.
 * <p>
 * Numerics are written at their natural little-endian width, text and byte
 * arrays as length-prefixed blobs, and anything else through {@link JsonCodec}.
 */
public final class Codecs {

    /** UTF-8 text, sized by its encoded byte length. */
    public static final ValueCodec<String> STRING = new ValueCodec<>() {
        @Override
        public void write(BinaryWriter out, String value) throws IOException {
            out.writeString(value);
        }

        @Override
        public String read(BinaryReader in) throws IOException {
            return in.readString();
        }

        @Override
        public long sizeOf(String value) {
            return utf8Length(value);
        }
    };

    /** Raw byte sequences. */
    public static final ValueCodec<byte[]> BYTES = new ValueCodec<>() {
        @Override
        public void write(BinaryWriter out, byte[] value) throws IOException {
            out.writeBytes(value);
        }

        @Override
        public byte[] read(BinaryReader in) throws IOException {
            return in.readBytes();
        }

        @Override
        public long sizeOf(byte[] value) {
            return value.length;
        }
    };

    public static final ValueCodec<Long> LONG = new ValueCodec<>() {
        @Override
        public void write(BinaryWriter out, Long value) throws IOException {
            out.writeLong(value);
        }

        @Override
        public Long read(BinaryReader in) throws IOException {
            return in.readLong();
        }

        @Override
        public long sizeOf(Long value) {
            return Long.BYTES;
        }
    };

    public static final ValueCodec<Integer> INTEGER = new ValueCodec<>() {
        @Override
        public void write(BinaryWriter out, Integer value) throws IOException {
            out.writeInt(value);
        }

        @Override
        public Integer read(BinaryReader in) throws IOException {
            return in.readInt();
        }

        @Override
        public long sizeOf(Integer value) {
            return Integer.BYTES;
        }
    };

    public static final ValueCodec<Double> DOUBLE = new ValueCodec<>() {
        @Override
        public void write(BinaryWriter out, Double value) throws IOException {
            out.writeDouble(value);
        }

        @Override
        public Double read(BinaryReader in) throws IOException {
            return in.readDouble();
        }

        @Override
        public long sizeOf(Double value) {
            return Double.BYTES;
        }
    };

    public static final ValueCodec<Boolean> BOOLEAN = new ValueCodec<>() {
        @Override
        public void write(BinaryWriter out, Boolean value) throws IOException {
            out.writeByte(value ? 1 : 0);
        }

        @Override
        public Boolean read(BinaryReader in) throws IOException {
            int b = in.readByte();
            if (b > 1) {
                throw new FormatException("Invalid boolean byte: " + b);
            }
            return b == 1;
        }

        @Override
        public long sizeOf(Boolean value) {
            return 1;
        }
    };

    private Codecs() {
    }

    /** Structured values as length-prefixed JSON, for non-generic types. */
    public static <T> ValueCodec<T> json(Class<T> type) {
        return new JsonCodec<>(JsonCodec.MAPPER.constructType(type));
    }

    /** Structured values as length-prefixed JSON, for generic types such as {@code List<String>}. */
    public static <T> ValueCodec<T> json(TypeReference<T> type) {
        return new JsonCodec<>(JsonCodec.MAPPER.constructType(type));
    }

    static long utf8Length(String value) {
        long length = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < 0x80) {
                length += 1;
            } else if (c < 0x800) {
                length += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < value.length()
                    && Character.isLowSurrogate(value.charAt(i + 1))) {
                length += 4;
                i++;
            } else {
                length += 3;
            }
        }
        return length;
    }
}
