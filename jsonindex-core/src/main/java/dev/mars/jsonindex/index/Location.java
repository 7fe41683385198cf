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
package dev.mars.jsonindex.index;

/**
 * Where a record's raw bytes live.
 * <p>
 * A location is a half-open byte range {@code [start, end)} tagged with the region
 * it belongs to. The region is part of the type, so a range can never be read from
 * the wrong address space and can never span both.
 * <ul>
 *   <li>{@link Backing} - bytes inside the backing bundle file, discovered by the initial scan</li>
 *   <li>{@link Appended} - bytes inside the in-memory {@link AppendLog}, added during the run</li>
 * </ul>
 */
public interface Location {

    /** Inclusive start offset within the region. */
    long start();

    /** Exclusive end offset within the region. */
    long end();

    /** Number of bytes covered by this location. */
    default long length() {
        return end() - start();
    }

    /**
     * A range of the backing file.
     *
     * @param start inclusive file offset
     * @param end   exclusive file offset
     */
    record Backing(long start, long end) implements Location {
        public Backing {
            if (start < 0 || end < start) {
                throw new IllegalArgumentException("Invalid file range [" + start + ", " + end + ")");
            }
        }
    }

    /**
     * A range of the append log. Offset 0 is the log's sentinel byte and never
     * starts a record.
     *
     * @param start inclusive log offset (at least 1)
     * @param end   exclusive log offset
     */
    record Appended(long start, long end) implements Location {
        public Appended {
            if (start < AppendLog.FIRST_OFFSET || end < start) {
                throw new IllegalArgumentException("Invalid append log range [" + start + ", " + end + ")");
            }
        }
    }
}
