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

import com.fasterxml.jackson.databind.JsonNode;

import java.io.Closeable;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * History store used by the ingestion driver.
 * <p>
 * Classifies every ingested item against the previous bundle and records what
 * changed. The driver registers it next to its regular storers and calls
 * {@link #store} once per item.
 * <p>
 * <b>Ordering contract:</b> calls for the same key must not overlap. Calls for
 * different keys may run concurrently.
 *
 * @see ChangelogGenerator
 */
public interface ChangelogStore extends Closeable {

    /**
     * Indexes the previous bundle. Must complete before {@link #store} is used.
     *
     * @return a future that completes when the index is ready
     */
    CompletableFuture<Void> load();

    /**
     * Classifies an incoming item and emits its changelog record, if any.
     *
     * @param key  the item's key
     * @param item the item as ingested in this run
     * @return a future with the emitted record, empty if the item is unchanged;
     *         fails if the item could not be diffed or the record not stored
     */
    CompletableFuture<Optional<DeltaRecord>> store(String key, JsonNode item);

    /**
     * Estimated memory held by the index, in bytes.
     */
    long size();

    /**
     * Releases the bundle file and closes the sink.
     */
    @Override
    void close();
}
