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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.IOException;

/**
 * Encodes structured values as a length-prefixed JSON document.
 * <p>
 * JSON keeps the blob self-describing, so a snapshot can be inspected
 * without the Java classes that produced it. Readers and writers are
 * immutable and shared across threads.
 *
 * @param <T> the value type
 */
final class JsonCodec<T> implements ValueCodec<T> {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private final JavaType type;
    private final ObjectReader reader;
    private final ObjectWriter writer;

    JsonCodec(JavaType type) {
        this.type = type;
        this.reader = MAPPER.readerFor(type);
        this.writer = MAPPER.writerFor(type);
    }

    @Override
    public void write(BinaryWriter out, T value) throws IOException {
        out.writeBytes(writer.writeValueAsBytes(value));
    }

    @Override
    public T read(BinaryReader in) throws IOException {
        byte[] blob = in.readBytes();
        try {
            return reader.readValue(blob);
        } catch (JsonProcessingException e) {
            throw new FormatException("Corrupt JSON payload for " + type.toCanonical(), e);
        }
    }

    /**
     * Length of the encoded JSON document.
     *
     * @throws IllegalArgumentException if the value cannot be serialized
     */
    @Override
    public long sizeOf(T value) {
        try {
            return writer.writeValueAsBytes(value).length;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value of " + value.getClass().getName() +
                    " cannot be encoded as JSON", e);
        }
    }

    @Override
    public String toString() {
        return "JsonCodec{" + type.toCanonical() + '}';
    }
}
