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

import java.util.Arrays;
import java.util.Objects;

/**
 * In-memory log of records created during the current run.
 * <p>
 * The log only grows. Byte 0 is a reserved sentinel, so the first record starts
 * at {@link #FIRST_OFFSET} and offset 0 never denotes data.
 * <p>
 * Not thread-safe; {@link JsonIndex} serializes access.
 */
public final class AppendLog {

    /** Offset of the first byte that can hold data. */
    public static final int FIRST_OFFSET = 1;

    private static final byte SENTINEL = 'N';
    private static final int INITIAL_CAPACITY = 1024;

    private byte[] data;
    private int length;

    public AppendLog() {
        this.data = new byte[INITIAL_CAPACITY];
        this.data[0] = SENTINEL;
        this.length = FIRST_OFFSET;
    }

    /**
     * Appends a record.
     *
     * @return where the record was written
     * @throws IndexException if the log would outgrow a Java array
     */
    public Location.Appended append(byte[] record) {
        Objects.requireNonNull(record, "record");
        long required = (long) length + record.length;
        if (required > Integer.MAX_VALUE - 8) {
            throw new IndexException("Append log full: " + length + " bytes used, " + record.length + " requested");
        }
        if (required > data.length) {
            long grown = Math.max(required, (long) data.length * 2);
            data = Arrays.copyOf(data, (int) Math.min(grown, Integer.MAX_VALUE - 8));
        }
        int start = length;
        System.arraycopy(record, 0, data, start, record.length);
        length = (int) required;
        return new Location.Appended(start, length);
    }

    /**
     * Returns a copy of the bytes at {@code location}.
     */
    public byte[] read(Location.Appended location) {
        if (location.end() > length) {
            throw new IndexException("Append log range [" + location.start() + ", " + location.end() +
                    ") beyond log length " + length);
        }
        return Arrays.copyOfRange(data, (int) location.start(), (int) location.end());
    }

    /** Bytes used, sentinel included. */
    public int length() {
        return length;
    }
}
