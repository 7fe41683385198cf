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
package dev.mars.jsonindex.history;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps changelog records in memory.
 * <p>
 * Only counts records unless created with {@code keepData}. Useful for dry runs
 * and tests. Like {@link FileSystemSink}, a closed sink rejects further records
 * with a failed future; closing twice is harmless.
 */
public final class InMemorySink implements RecordSink {

    private final boolean keepData;
    private final ConcurrentLinkedQueue<DeltaRecord> records = new ConcurrentLinkedQueue<>();
    private final AtomicLong count = new AtomicLong();

    private volatile boolean closed = false;

    /** A sink that only counts. */
    public InMemorySink() {
        this(false);
    }

    /**
     * @param keepData whether records are kept, or only counted
     */
    public InMemorySink(boolean keepData) {
        this.keepData = keepData;
    }

    @Override
    public CompletableFuture<Void> store(String id, DeltaRecord record) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(record, "record");
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Sink already closed"));
        }
        if (keepData) {
            records.add(record);
        }
        count.incrementAndGet();
        return CompletableFuture.completedFuture(null);
    }

    /** Number of records stored so far. */
    public long count() {
        return count.get();
    }

    /** Records kept, in store order; empty unless {@code keepData}. */
    public List<DeltaRecord> records() {
        return List.copyOf(records);
    }

    @Override
    public void close() {
        closed = true;
        if (!keepData) {
            records.clear();
        }
    }
}
