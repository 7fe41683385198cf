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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lazy index over a large JSON bundle file.
 * <p>
 * The bundle is a JSON array of objects. {@link #build()} walks it once with an
 * {@link ObjectScanner} and remembers, per key, where each object lives. Objects
 * are only read and parsed when {@link #get} asks for them, through a
 * {@link RangeBuffer} holding one window of the file. Items added during the run
 * go to an {@link AppendLog} and are addressed the same way.
 * <p>
 * <b>Lifecycle:</b>
 * <pre>
 * NEW --build()--&gt; READY --close()--&gt; CLOSED
 *  |                  
 *  +--build() fails--&gt; FAILED --close()--&gt; CLOSED
 * </pre>
 * The backing file handle is held from {@code build()} until {@code close()}.
 * Closing twice, or using the index after close, is rejected.
 * <p>
 * <b>Thread Safety:</b>
 * {@link #has} is lock-free. Reads and appends share one lock because they move
 * the window or grow the log. Callers must still serialize the
 * {@code has -> get/add} sequence for any single key.
 */
public final class JsonIndex implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(JsonIndex.class);

    /** Estimated size of a single index entry in memory. */
    public static final int ESTIMATED_ENTRY_SIZE = 20;

    enum Status {
        NEW,
        READY,
        FAILED,
        CLOSED
    }

    private final Path dataFile;
    private final JsonIndexConfig config;
    private final KeyExtractor keyExtractor;
    private final ObjectMapper mapper;

    private final Map<String, List<Location>> entries = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final AppendLog appendLog = new AppendLog();

    private volatile Status status = Status.NEW;
    private FileChannel channel;
    private RangeBuffer rangeBuffer;
    private long entryCount = 0;
    private long scanAnomalies = 0;

    /**
     * Creates an index with configuration loaded from system properties,
     * environment variables, properties file, or defaults.
     */
    public JsonIndex(Path dataFile) {
        this(dataFile, JsonIndexConfig.load());
    }

    public JsonIndex(Path dataFile, JsonIndexConfig config) {
        this(dataFile, config, new ObjectMapper());
    }

    /**
     * @param dataFile bundle file to index
     * @param config   key and buffer configuration
     * @param mapper   mapper used to parse stored records and serialize added ones
     */
    public JsonIndex(Path dataFile, JsonIndexConfig config, ObjectMapper mapper) {
        this.dataFile = Objects.requireNonNull(dataFile, "dataFile");
        this.config = Objects.requireNonNull(config, "config");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.keyExtractor = config.keyExtractor();
    }

    // ========================================================================
    // Build
    // ========================================================================

    /**
     * Scans the whole backing file and populates the index.
     * <p>
     * Runs to completion or fails; a failed build leaves the index empty and
     * unusable. Objects whose key cannot be extracted are logged and skipped.
     *
     * @throws IndexException        if the file cannot be opened or read
     * @throws IllegalStateException if the index was already built or closed
     */
    public void build() {
        lock.lock();
        try {
            if (status != Status.NEW) {
                throw new IllegalStateException("Index already " + status.name().toLowerCase(Locale.ROOT) + ": " + dataFile);
            }
            long startTime = System.currentTimeMillis();
            LOG.info("Creating index for {} (keyField={})", dataFile, config.keyField());
            try {
                channel = FileChannel.open(dataFile, StandardOpenOption.READ);
                long fileSize = channel.size();
                scan(fileSize);
                rangeBuffer = new RangeBuffer(channel, config.bufferSize(), fileSize);
                if (fileSize > 0) {
                    rangeBuffer.load(0);
                }
            } catch (IOException | IndexException e) {
                status = Status.FAILED;
                entries.clear();
                entryCount = 0;
                closeChannel();
                LOG.error("Failed to index {}: {}", dataFile, e.getMessage(), e);
                if (e instanceof IndexException) {
                    throw (IndexException) e;
                }
                throw new IndexException("Failed to index " + dataFile, e);
            }
            status = Status.READY;
            LOG.info("Index ready: {} keys, {} entries, {} anomalies, ~{} KB, took {} ms",
                    entries.size(), entryCount, scanAnomalies, size() / 1024,
                    System.currentTimeMillis() - startTime);
        } finally {
            lock.unlock();
        }
    }

    private void scan(long fileSize) throws IOException {
        int chunkSize = (int) Math.min(config.scanChunkSize(), Math.max(fileSize, 1));
        ByteBuffer chunk = ByteBuffer.allocate(chunkSize);
        ObjectScanner scanner = new ObjectScanner(new Indexer(), config.scanChunkSize());

        long position = 0;
        while (position < fileSize) {
            chunk.clear();
            int n = channel.read(chunk, position);
            if (n < 0) {
                break;
            }
            scanner.scan(chunk.array(), 0, n);
            position += n;
            LOG.trace("Scanned {} of {} bytes", position, fileSize);
        }

        long unterminated = scanner.finish();
        if (unterminated >= 0) {
            scanAnomalies++;
            LOG.warn("Scan anomaly: object at offset {} is never closed", unterminated);
        }
    }

    /** Registers scanned spans; runs on the build thread under the lock. */
    private final class Indexer implements ObjectScanner.SpanConsumer {

        @Override
        public void span(long start, long end, byte[] bytes, int offset, int length) {
            String text = new String(bytes, offset, length, StandardCharsets.UTF_8);
            Optional<String> key = keyExtractor.extract(text);
            if (key.isPresent()) {
                register(key.get(), new Location.Backing(start, end));
            } else if (keyExtractor.mentionsKeyField(text)) {
                scanAnomalies++;
                LOG.warn("Scan anomaly: key matcher '{}' does not match object at [{}, {})",
                        keyExtractor.keyMatcher(), start, end);
            }
        }

        @Override
        public void oversized(long start, long end) {
            scanAnomalies++;
            LOG.warn("Scan anomaly: object at [{}, {}) spans more than {} bytes across chunks, skipped",
                    start, end, config.scanChunkSize());
        }
    }

    // ========================================================================
    // Lookup
    // ========================================================================

    /**
     * @return whether any record is known for {@code key}
     */
    public boolean has(String key) {
        checkReady();
        return entries.containsKey(key);
    }

    /**
     * Reads every record known for {@code key}, in discovery order: file order
     * first, then the order items were added. The last element is the key's
     * latest value. Each call parses fresh copies.
     *
     * @return the records, or empty if the key is unknown
     * @throws BudgetExceededException if a stored record is wider than the buffer
     * @throws IndexException          if a record cannot be read or parsed
     */
    public Optional<List<JsonNode>> get(String key) {
        checkReady();
        List<byte[]> raw;
        lock.lock();
        try {
            checkReady();
            List<Location> locations = entries.get(key);
            if (locations == null) {
                return Optional.empty();
            }
            raw = new ArrayList<>(locations.size());
            for (Location location : locations) {
                raw.add(readRaw(location));
            }
        } finally {
            lock.unlock();
        }

        List<JsonNode> items = new ArrayList<>(raw.size());
        for (byte[] bytes : raw) {
            items.add(parse(key, bytes));
        }
        return Optional.of(items);
    }

    /**
     * Reads every record for {@code key} sorted by a caller-supplied canonical order.
     * The sort is stable, so ties keep discovery order.
     */
    public Optional<List<JsonNode>> get(String key, Comparator<? super JsonNode> order) {
        Objects.requireNonNull(order, "order");
        return get(key).map(items -> {
            items.sort(order);
            return items;
        });
    }

    /**
     * @return a snapshot of the locations registered for {@code key}, in discovery order
     */
    public List<Location> locations(String key) {
        checkReady();
        lock.lock();
        try {
            List<Location> locations = entries.get(key);
            return locations == null ? List.of() : List.copyOf(locations);
        } finally {
            lock.unlock();
        }
    }

    /** Keys currently known. */
    public Set<String> keys() {
        checkReady();
        return Collections.unmodifiableSet(entries.keySet());
    }

    // ========================================================================
    // Mutation
    // ========================================================================

    /**
     * Serializes {@code item} into the append log and registers it as the
     * latest record for {@code key}.
     *
     * @return where the item was stored
     */
    public Location add(String key, JsonNode item) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(item, "item");
        checkReady();
        byte[] bytes;
        try {
            bytes = mapper.writeValueAsBytes(item);
        } catch (JsonProcessingException e) {
            throw new IndexException("Cannot serialize item for key " + key, e);
        }

        lock.lock();
        try {
            checkReady();
            Location location = appendLog.append(bytes);
            register(key, location);
            LOG.debug("New item: {} at {}", key, location);
            return location;
        } finally {
            lock.unlock();
        }
    }

    // ========================================================================
    // Stats / Close
    // ========================================================================

    /**
     * Estimated memory used by the index: entry count times
     * {@link #ESTIMATED_ENTRY_SIZE}. Not exact.
     */
    public long size() {
        lock.lock();
        try {
            return entryCount * ESTIMATED_ENTRY_SIZE;
        } finally {
            lock.unlock();
        }
    }

    /** Number of registered locations across all keys. */
    public long entryCount() {
        lock.lock();
        try {
            return entryCount;
        } finally {
            lock.unlock();
        }
    }

    /** Candidate objects skipped during build. */
    public long scanAnomalies() {
        lock.lock();
        try {
            return scanAnomalies;
        } finally {
            lock.unlock();
        }
    }

    public Path dataFile() {
        return dataFile;
    }

    public JsonIndexConfig config() {
        return config;
    }

    /**
     * Releases the backing file handle.
     *
     * @throws IllegalStateException if the index is already closed
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (status == Status.CLOSED) {
                throw new IllegalStateException("Index already closed: " + dataFile);
            }
            status = Status.CLOSED;
            rangeBuffer = null;
            closeChannel();
            LOG.info("Index closed: {}", dataFile);
        } finally {
            lock.unlock();
        }
    }

    Status status() {
        return status;
    }

    RangeBuffer rangeBuffer() {
        return rangeBuffer;
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private void register(String key, Location location) {
        entries.computeIfAbsent(key, k -> new ArrayList<>()).add(location);
        entryCount++;
    }

    private byte[] readRaw(Location location) {
        if (location instanceof Location.Appended) {
            return appendLog.read((Location.Appended) location);
        }
        if (location instanceof Location.Backing) {
            return rangeBuffer.read(location.start(), location.end());
        }
        throw new IllegalArgumentException("Unknown location: " + location);
    }

    private JsonNode parse(String key, byte[] bytes) {
        try {
            return mapper.readTree(bytes);
        } catch (IOException e) {
            throw new IndexException("Cannot parse stored record for key " + key, e);
        }
    }

    private void checkReady() {
        Status current = status;
        if (current != Status.READY) {
            throw new IllegalStateException("Index is " + current.name().toLowerCase(Locale.ROOT) + ", not ready: " + dataFile);
        }
    }

    private void closeChannel() {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
            LOG.debug("Backing file closed: {}", dataFile);
        } catch (IOException e) {
            LOG.warn("Error closing backing file {}: {}", dataFile, e.getMessage());
        }
        channel = null;
    }
}
