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

import java.io.Closeable;
import java.util.concurrent.CompletableFuture;

/**
 * Destination for changelog records.
 * <p>
 * Implementations may write asynchronously; the returned future completes when
 * the record has been accepted.
 *
 * @see FileSystemSink
 * @see InMemorySink
 */
public interface RecordSink extends Closeable {

    /**
     * Persists one record.
     *
     * @param id     key of the entity the record belongs to
     * @param record the record
     * @return a future that completes when the record is stored, or fails with the cause
     */
    CompletableFuture<Void> store(String id, DeltaRecord record);

    /**
     * Flushes pending records and releases resources.
     */
    @Override
    void close();
}
