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
package dev.mars.kmap.map;

import dev.mars.kmap.KMapException;

/**
 * Thrown by {@link KMap#set} when a single value is larger than the map's
 * whole byte ceiling. The map is left unchanged.
 */
public class SizeExceededException extends KMapException {

    private final long size;
    private final long limit;

    public SizeExceededException(long size, long limit) {
        super("Value of " + size + " bytes exceeds the size limit of " + limit + " bytes");
        this.size = size;
        this.limit = limit;
    }

    public long size() {
        return size;
    }

    public long limit() {
        return limit;
    }
}
