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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.Objects;

/**
 * Read-through cache holding a single window of the backing file.
 * <p>
 * A request is served from the window when {@code [start, end)} lies entirely
 * inside it. Otherwise the window is moved: one positioned read of up to
 * {@code budget} bytes starting at {@code start}. Sequential access in file order
 * therefore amortizes to few refills; scattered access costs one refill per request.
 * <p>
 * The window is a cache only. Every read returns a fresh copy, so no caller can
 * hold a reference into it.
 * <p>
 * Not thread-safe; {@link JsonIndex} serializes access.
 */
public final class RangeBuffer {

    private static final Logger LOG = LoggerFactory.getLogger(RangeBuffer.class);

    private final FileChannel channel;
    private final int budget;
    private final long fileSize;
    private final byte[] window;

    private long windowStart = 0;
    private int windowLength = 0;
    private long refills = 0;

    /**
     * @param channel  open channel on the backing file, owned by the caller
     * @param budget   window size in bytes, the largest range a single read may request
     * @param fileSize size of the backing file
     */
    public RangeBuffer(FileChannel channel, int budget, long fileSize) {
        this.channel = Objects.requireNonNull(channel, "channel");
        if (budget <= 0) {
            throw new IllegalArgumentException("budget must be positive: " + budget);
        }
        if (fileSize < 0) {
            throw new IllegalArgumentException("fileSize must not be negative: " + fileSize);
        }
        this.budget = budget;
        this.fileSize = fileSize;
        this.window = new byte[(int) Math.min(budget, Math.max(fileSize, 1))];
    }

    /**
     * Returns a copy of the bytes in {@code [start, end)}.
     *
     * @throws BudgetExceededException if the range is wider than the budget; the window is left untouched
     * @throws IndexException          if the range lies outside the file or the file cannot be read
     */
    public byte[] read(long start, long end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ")");
        }
        if (end - start > budget) {
            LOG.error("Read of {} bytes at {} exceeds buffer size of {} bytes", end - start, start, budget);
            throw new BudgetExceededException(start, end, budget);
        }
        if (end > fileSize) {
            throw new IndexException("Range [" + start + ", " + end + ") lies beyond end of file (" + fileSize + " bytes)");
        }

        if (!covers(start, end)) {
            refill(start);
            if (!covers(start, end)) {
                throw new IndexException("Short read: window [" + windowStart + ", " + windowEnd() +
                        ") does not cover [" + start + ", " + end + ")");
            }
        }

        int length = (int) (end - start);
        byte[] copy = new byte[length];
        System.arraycopy(window, (int) (start - windowStart), copy, 0, length);
        return copy;
    }

    /**
     * Moves the window so it starts at {@code start}.
     */
    public void load(long start) {
        if (start < 0 || start > fileSize) {
            throw new IllegalArgumentException("Offset outside file: " + start);
        }
        refill(start);
    }

    /** Whether {@code [start, end)} can be served without touching the file. */
    public boolean covers(long start, long end) {
        // start beyond windowEnd and end beyond windowEnd are both misses; the
        // second catches a range that starts inside the window but runs past it
        return windowLength > 0 && start >= windowStart && end <= windowEnd();
    }

    /** Inclusive start of the current window. */
    public long windowStart() {
        return windowStart;
    }

    /** Exclusive end of the bytes currently cached. */
    public long windowEnd() {
        return windowStart + windowLength;
    }

    /** Number of positioned reads performed so far. */
    public long refills() {
        return refills;
    }

    public int budget() {
        return budget;
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private void refill(long start) {
        int wanted = (int) Math.min(window.length, fileSize - start);
        ByteBuffer buf = ByteBuffer.wrap(window, 0, wanted);
        try {
            long pos = start;
            while (buf.hasRemaining()) {
                int n = channel.read(buf, pos);
                if (n < 0) {
                    break;
                }
                pos += n;
            }
        } catch (IOException e) {
            windowLength = 0;
            LOG.error("Failed to read backing file at {}: {}", start, e.getMessage(), e);
            throw new IndexException("Failed to read backing file at offset " + start, e);
        }
        windowStart = start;
        windowLength = buf.position();
        refills++;
        LOG.debug("Buffering new range: [{}, {})", windowStart, windowEnd());
    }
}
