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
 * Streaming classifier that finds top-level JSON objects in raw bytes.
 * <p>
 * Bytes are fed chunk by chunk in file order. The scanner never parses: it only
 * tracks whether it is inside a string literal and how deep the brace nesting is,
 * and reports the byte range of every object whose braces balance back to the
 * starting depth.
 * <p>
 * <b>Transition table:</b>
 * <pre>
 * state          byte   action
 * ------------------------------------------------------------------
 * STRUCTURE      "      enter STRING
 * STRUCTURE      {      depth++, depth 0 marks a span start
 * STRUCTURE      }      depth-- (if depth &gt;= 0), depth -1 closes the span
 * STRING         \      enter STRING_ESCAPE
 * STRING         "      back to STRUCTURE
 * STRING_ESCAPE  any    back to STRING
 * </pre>
 * Depth starts at -1 so the first opening brace brings it to 0. The escape state
 * consumes exactly one byte, which keeps {@code "a\\"} (an even run of
 * backslashes) from being read as an escaped quote.
 * <p>
 * <b>Chunk boundaries:</b> state, cumulative offset and the bytes of a span that
 * is still open are all carried into the next {@link #scan} call. The carried
 * bytes are bounded by {@code maxPendingBytes}; a span that outgrows it is
 * reported through {@link SpanConsumer#oversized} instead of {@link SpanConsumer#span}.
 * <p>
 * Not thread-safe.
 */
public final class ObjectScanner {

    private static final byte OPENING_BRACE = '{';
    private static final byte CLOSING_BRACE = '}';
    private static final byte DOUBLE_QUOTE = '"';
    private static final byte BACKSLASH = '\\';

    /** Scanner states. */
    enum State {
        STRUCTURE,
        STRING,
        STRING_ESCAPE
    }

    /**
     * Receives candidate spans.
     */
    public interface SpanConsumer {

        /**
         * Called for every complete top-level object.
         * <p>
         * The bytes are only valid for the duration of the call.
         *
         * @param start  absolute offset of the opening brace
         * @param end    absolute offset just past the closing brace
         * @param bytes  array holding the span
         * @param offset position of the span within {@code bytes}
         * @param length span length, equal to {@code end - start}
         */
        void span(long start, long end, byte[] bytes, int offset, int length);

        /**
         * Called instead of {@link #span} when an object crossed chunk boundaries
         * and grew beyond the pending buffer.
         */
        default void oversized(long start, long end) {
        }
    }

    private final SpanConsumer consumer;
    private final int maxPendingBytes;

    private State state = State.STRUCTURE;
    private int depth = -1;
    private long offset = 0;
    private long spanStart = -1;

    /** Bytes of the open span seen in earlier chunks. */
    private byte[] pending = new byte[0];
    private int pendingLength = 0;
    private boolean pendingOverflow = false;

    /**
     * @param consumer        receives the spans found
     * @param maxPendingBytes how many bytes of one open span may be carried across chunks
     */
    public ObjectScanner(SpanConsumer consumer, int maxPendingBytes) {
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        if (maxPendingBytes <= 0) {
            throw new IllegalArgumentException("maxPendingBytes must be positive: " + maxPendingBytes);
        }
        this.maxPendingBytes = maxPendingBytes;
    }

    /**
     * Feeds the next chunk of the file.
     *
     * @param chunk  source array
     * @param from   first byte to scan
     * @param length number of bytes to scan
     */
    public void scan(byte[] chunk, int from, int length) {
        Objects.checkFromIndexSize(from, length, chunk.length);
        // a span still open from an earlier chunk has its head in pending
        boolean carried = spanStart >= 0;
        int chunkSpanStart = carried ? from : -1;

        int end = from + length;
        for (int i = from; i < end; i++) {
            byte b = chunk[i];
            switch (state) {
                case STRING_ESCAPE:
                    state = State.STRING;
                    break;
                case STRING:
                    if (b == BACKSLASH) {
                        state = State.STRING_ESCAPE;
                    } else if (b == DOUBLE_QUOTE) {
                        state = State.STRUCTURE;
                    }
                    break;
                case STRUCTURE:
                default:
                    if (b == DOUBLE_QUOTE) {
                        state = State.STRING;
                    } else if (b == OPENING_BRACE) {
                        depth++;
                        if (depth == 0) {
                            spanStart = offset + (i - from);
                            chunkSpanStart = i;
                            carried = false;
                        }
                    } else if (b == CLOSING_BRACE && depth >= 0) {
                        depth--;
                        if (depth == -1) {
                            closeSpan(chunk, chunkSpanStart, i + 1, carried, offset + (i - from) + 1);
                            chunkSpanStart = -1;
                            carried = false;
                        }
                    }
                    break;
            }
        }

        if (spanStart >= 0) {
            carry(chunk, chunkSpanStart, end);
        }
        offset += length;
    }

    /**
     * Signals end of input.
     *
     * @return the start offset of an object left unterminated, or -1 if every
     *         object was closed
     */
    public long finish() {
        long unterminated = spanStart;
        resetPending();
        spanStart = -1;
        return unterminated;
    }

    /** Total bytes scanned so far. */
    public long offset() {
        return offset;
    }

    /** Current nesting depth, -1 outside any object. */
    public int depth() {
        return depth;
    }

    State state() {
        return state;
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private void closeSpan(byte[] chunk, int from, int to, boolean carried, long absoluteEnd) {
        long start = spanStart;
        spanStart = -1;
        if (!carried) {
            consumer.span(start, absoluteEnd, chunk, from, to - from);
            return;
        }
        if (pendingOverflow || (long) pendingLength + (to - from) > maxPendingBytes) {
            consumer.oversized(start, absoluteEnd);
        } else {
            append(chunk, from, to - from);
            consumer.span(start, absoluteEnd, pending, 0, pendingLength);
        }
        resetPending();
    }

    private void carry(byte[] chunk, int from, int to) {
        if (pendingOverflow) {
            return;
        }
        if ((long) pendingLength + (to - from) > maxPendingBytes) {
            pendingOverflow = true;
            pending = new byte[0];
            pendingLength = 0;
            return;
        }
        append(chunk, from, to - from);
    }

    private void append(byte[] src, int from, int length) {
        int required = pendingLength + length;
        if (required > pending.length) {
            int grown = Math.max(required, Math.min(maxPendingBytes, Math.max(256, pending.length * 2)));
            pending = Arrays.copyOf(pending, grown);
        }
        System.arraycopy(src, from, pending, pendingLength, length);
        pendingLength = required;
    }

    private void resetPending() {
        pending = new byte[0];
        pendingLength = 0;
        pendingOverflow = false;
    }
}
