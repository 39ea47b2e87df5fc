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
/**
 * Little-endian binary snapshot format.
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * magic(4) version(4) totalSize(8) limit(8) count(8)
 * count x [ key | value | size(8) ]
 * </pre>
 * Keys and values are encoded by a {@link dev.mars.kmap.codec.ValueCodec}.
 *
 * @see dev.mars.kmap.codec.ImageCodec
 */
package dev.mars.kmap.codec;
