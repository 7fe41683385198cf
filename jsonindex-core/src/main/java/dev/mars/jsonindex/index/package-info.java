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
 * Lazy index over large JSON bundle files.
 * <p>
 * A bundle is a JSON array of objects written by an ingestion run. The index
 * maps each object's key to where its bytes live, without parsing the bundle:
 * <ul>
 *   <li>{@link dev.mars.jsonindex.index.JsonIndex} - build, lookup and add</li>
 *   <li>{@link dev.mars.jsonindex.index.ObjectScanner} - finds top-level objects in raw bytes</li>
 *   <li>{@link dev.mars.jsonindex.index.RangeBuffer} - one cached window of the bundle file</li>
 *   <li>{@link dev.mars.jsonindex.index.AppendLog} - in-memory storage for items added during the run</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Bounded memory:</b> only key locations and one buffer window are held</li>
 *   <li><b>Explicit regions:</b> a {@link dev.mars.jsonindex.index.Location} names the file or the log it points into</li>
 *   <li><b>Best-effort build:</b> objects without a usable key are logged and skipped</li>
 * </ul>
 *
 * @see dev.mars.jsonindex.index.JsonIndex
 */
package dev.mars.jsonindex.index;
