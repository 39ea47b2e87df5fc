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
 * Ordered, size-bounded key-value map.
 * <p>
 * <ul>
 *   <li>{@link dev.mars.kmap.map.KMap} - The map interface</li>
 *   <li>{@link dev.mars.kmap.map.OrderedMap} - Insertion-ordered implementation</li>
 *   <li>{@link dev.mars.kmap.map.OrderedList} - Slot-arena doubly-linked list behind it</li>
 *   <li>{@link dev.mars.kmap.map.SizeAccountant} - Running byte total against the ceiling</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>One lock:</b> a single reader/writer lock guards index, list and total together</li>
 *   <li><b>Bijection:</b> every index entry has exactly one list node after each mutation</li>
 *   <li><b>Blunt eviction:</b> overflowing the ceiling clears the whole map, never single entries</li>
 * </ul>
 *
 * @see dev.mars.kmap.map.KMap
 */
package dev.mars.kmap.map;
