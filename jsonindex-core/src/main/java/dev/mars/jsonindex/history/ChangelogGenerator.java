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
import dev.mars.jsonindex.index.JsonIndex;
import dev.mars.jsonindex.index.JsonIndexConfig;
import dev.mars.jsonindex.index.UnchangedPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds the changelog of an ingestion run against the previous bundle.
 * <p>
 * Every incoming item goes through one classification:
 * <ul>
 *   <li><b>Unknown key</b> - an {@link DeltaRecord.Add} is emitted and the item
 *       is added to the index</li>
 *   <li><b>Known key, unchanged</b> - nothing is emitted; the {@link UnchangedPolicy}
 *       decides whether the item still becomes the key's latest value</li>
 *   <li><b>Known key, changed</b> - the latest recorded value is diffed against the
 *       item, a {@link DeltaRecord.Change} carrying the old value and the patch is
 *       emitted, and the item becomes the key's latest value</li>
 * </ul>
 * <p>
 * <b>Usage Pattern:</b>
 * <pre>{@code
 * try (ChangelogGenerator history = new ChangelogGenerator(bundleFile,
 *         new FileSystemSink(deltaFile), ChangeDetector.byContent())) {
 *     history.load().join();
 *     for (JsonNode item : incoming) {
 *         history.store(item.path("key").asText(), item).join();
 *     }
 * }
 * }</pre>
 * <p>
 * <b>Thread Safety:</b>
 * No locking is applied across the classification steps; calls for the same key
 * must be serialized by the caller, and the next call for a key must wait for the
 * previous future: an emitted item only becomes the key's latest value once the
 * sink has stored its record. Failures are reported through the returned future
 * and never retried; a failed item leaves the index untouched.
 */
public final class ChangelogGenerator implements ChangelogStore {

    private static final Logger LOG = LoggerFactory.getLogger(ChangelogGenerator.class);

    private final JsonIndex index;
    private final RecordSink sink;
    private final ChangeDetector detector;
    private final StructuralDiff structuralDiff;
    private final UnchangedPolicy unchangedPolicy;
    private final ExecutorService loader;

    private final AtomicLong added = new AtomicLong();
    private final AtomicLong changed = new AtomicLong();
    private final AtomicLong unchanged = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private volatile boolean closed = false;

    /**
     * Creates a generator with configuration loaded from system properties,
     * environment variables, properties file, or defaults.
     */
    public ChangelogGenerator(Path bundleFile, RecordSink sink, ChangeDetector detector) {
        this(bundleFile, sink, detector, JsonIndexConfig.load());
    }

    public ChangelogGenerator(Path bundleFile, RecordSink sink, ChangeDetector detector, JsonIndexConfig config) {
        this(new JsonIndex(bundleFile, config), sink, detector, JsonDiff.INSTANCE, config.unchangedPolicy());
    }

    /**
     * @param index           index over the previous bundle, not yet built; owned by the generator
     * @param sink            destination of the emitted records; owned by the generator
     * @param detector        change predicate for the entity type
     * @param structuralDiff  patch function used for changes
     * @param unchangedPolicy handling of known, unchanged items
     */
    public ChangelogGenerator(JsonIndex index, RecordSink sink, ChangeDetector detector,
                              StructuralDiff structuralDiff, UnchangedPolicy unchangedPolicy) {
        this.index = Objects.requireNonNull(index, "index");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.structuralDiff = Objects.requireNonNull(structuralDiff, "structuralDiff");
        this.unchangedPolicy = Objects.requireNonNull(unchangedPolicy, "unchangedPolicy");
        this.loader = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "index-loader");
            t.setDaemon(true);
            return t;
        });
    }

    // ========================================================================
    // ChangelogStore
    // ========================================================================

    @Override
    public CompletableFuture<Void> load() {
        LOG.info("Initializing history from {}", index.dataFile());
        return CompletableFuture.runAsync(index::build, loader);
    }

    @Override
    public CompletableFuture<Optional<DeltaRecord>> store(String key, JsonNode item) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(item, "item");
        try {
            return classify(key, item);
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            LOG.warn("Cannot record item {}: {}", key, e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public long size() {
        return index.size();
    }

    /** Counters of this run so far. */
    public ChangelogStats stats() {
        return new ChangelogStats(added.get(), changed.get(), unchanged.get(), failed.get());
    }

    /** The index over the previous bundle. */
    public JsonIndex index() {
        return index;
    }

    /**
     * Closes the index, then the sink.
     *
     * @throws IllegalStateException if already closed
     */
    @Override
    public void close() {
        if (closed) {
            throw new IllegalStateException("History already closed: " + index.dataFile());
        }
        closed = true;
        loader.shutdown();
        try {
            index.close();
        } finally {
            sink.close();
            LOG.info("History closed: {}", stats());
        }
    }

    // ========================================================================
    // Classification
    // ========================================================================

    private CompletableFuture<Optional<DeltaRecord>> classify(String key, JsonNode item) {
        if (!index.has(key)) {
            LOG.debug("New item: {}", key);
            return emit(new DeltaRecord.Add(key, item), item, added);
        }

        List<JsonNode> existing = detector.ordering()
                .map(order -> index.get(key, order))
                .orElseGet(() -> index.get(key))
                .orElseThrow(() -> new IllegalStateException("Key vanished from index: " + key));

        if (!detector.changed(existing, item)) {
            unchanged.incrementAndGet();
            if (unchangedPolicy == UnchangedPolicy.RECORD) {
                index.add(key, item);
            }
            LOG.trace("Item unchanged: {}", key);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        JsonNode previous = existing.get(existing.size() - 1);
        JsonNode delta = diff(key, previous, item);
        LOG.debug("Item changed: {}", key);
        return emit(new DeltaRecord.Change(key, previous, delta), item, changed);
    }

    private JsonNode diff(String key, JsonNode previous, JsonNode item) {
        try {
            JsonNode delta = structuralDiff.diff(previous, item);
            if (delta == null) {
                throw new DiffException("Structural diff returned no patch for " + key);
            }
            return delta;
        } catch (DiffException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DiffException("Cannot diff item " + key, e);
        }
    }

    /**
     * Stores the record, then makes {@code item} the key's latest value. A record
     * the sink rejects leaves the index as it was, so the item can be retried.
     */
    private CompletableFuture<Optional<DeltaRecord>> emit(DeltaRecord record, JsonNode item, AtomicLong counter) {
        return sink.store(record.id(), record).handle((ignored, error) -> {
            if (error != null) {
                failed.incrementAndGet();
                LOG.warn("Sink rejected {} record for {}: {}", record.type(), record.id(), error.getMessage());
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                throw new DeltaSinkException("Cannot store " + record.type() + " record for " + record.id(), cause);
            }
            try {
                index.add(record.id(), item);
            } catch (RuntimeException e) {
                failed.incrementAndGet();
                LOG.warn("Stored {} record for {} but cannot index the item: {}", record.type(), record.id(), e.getMessage());
                throw e;
            }
            counter.incrementAndGet();
            return Optional.of(record);
        });
    }
}
