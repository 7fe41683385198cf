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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Writes changelog records to a file as one JSON array.
 * <p>
 * <b>File format:</b> the same shape as a bundle file, so a changelog can itself
 * be indexed (with {@code keyField=id}):
 * <pre>
 * [{"id":"A","type":"change","item":{...},"delta":[...]},
 * {"id":"C","type":"add","item":{...}},
 * {"done":true}]
 * </pre>
 * The trailing {@code {"done":true}} sentinel and the closing bracket are written
 * by {@link #close()}; a file without them was not closed cleanly.
 * <p>
 * <b>Thread Safety:</b>
 * All writes are serialized through a single-threaded executor, so records from
 * concurrent callers never interleave.
 */
public final class FileSystemSink implements RecordSink {

    private static final Logger LOG = LoggerFactory.getLogger(FileSystemSink.class);

    private static final byte[] OPEN = "[".getBytes(StandardCharsets.UTF_8);
    private static final byte[] SEPARATOR = ",\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] DONE = "{\"done\":true}]".getBytes(StandardCharsets.UTF_8);

    private static final long CLOSE_TIMEOUT_SECONDS = 30;

    private final Path file;
    private final ObjectMapper mapper;
    private final ExecutorService writer;
    private final FileChannel channel;

    private long written = 0;
    private volatile boolean closed = false;

    public FileSystemSink(Path file) {
        this(file, new ObjectMapper());
    }

    /**
     * Creates (or truncates) {@code file} and writes the opening bracket.
     *
     * @throws DeltaSinkException if the file cannot be created
     */
    public FileSystemSink(Path file, ObjectMapper mapper) {
        this.file = Objects.requireNonNull(file, "file");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            this.channel = FileChannel.open(file,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
            write(OPEN);
        } catch (IOException e) {
            LOG.error("Failed to open changelog {}: {}", file, e.getMessage(), e);
            throw new DeltaSinkException("Failed to open changelog " + file, e);
        }
        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "changelog-writer");
            t.setDaemon(true);
            return t;
        });
        LOG.info("Writing changelog to: {}", file);
    }

    @Override
    public CompletableFuture<Void> store(String id, DeltaRecord record) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(record, "record");
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Changelog already closed: " + file));
        }

        byte[] bytes;
        try {
            bytes = mapper.writeValueAsBytes(record.toJson(mapper));
        } catch (IOException e) {
            return CompletableFuture.failedFuture(new DeltaSinkException("Cannot serialize record " + id, e));
        }

        try {
            return CompletableFuture.runAsync(() -> writeRecord(id, record, bytes), writer);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("Changelog already closed: " + file, e));
        }
    }

    /** Runs on the writer thread. */
    private void writeRecord(String id, DeltaRecord record, byte[] bytes) {
        try {
            write(bytes);
            write(SEPARATOR);
            written++;
            LOG.trace("Stored {} record for {}", record.type(), id);
        } catch (IOException e) {
            LOG.error("Failed to store record {}: {}", id, e.getMessage(), e);
            throw new DeltaSinkException("Failed to store record " + id, e);
        }
    }

    /**
     * Writes the sentinel, flushes and closes the file. Waits for pending writes.
     * Calling it again has no effect.
     */
    @Override
    public void close() {
        if (closed) {
            LOG.debug("Changelog already closed, ignoring duplicate close()");
            return;
        }
        closed = true;

        writer.execute(() -> {
            try {
                write(DONE);
                channel.force(true);
                LOG.info("Changelog closed: {} records written to {}", written, file);
            } catch (IOException e) {
                LOG.error("Failed to finish changelog {}: {}", file, e.getMessage(), e);
            } finally {
                try {
                    channel.close();
                } catch (IOException e) {
                    LOG.warn("Error closing changelog channel: {}", e.getMessage());
                }
            }
        });
        writer.shutdown();
        try {
            if (!writer.awaitTermination(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Changelog writer did not finish within {} s", CLOSE_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while closing changelog {}", file);
        }
    }

    public Path file() {
        return file;
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private void write(byte[] bytes) throws IOException {
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        while (buf.hasRemaining()) {
            channel.write(buf);
        }
    }
}
