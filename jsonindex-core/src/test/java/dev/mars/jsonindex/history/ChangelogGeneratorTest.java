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
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.jsonindex.index.IndexException;
import dev.mars.jsonindex.index.JsonIndex;
import dev.mars.jsonindex.index.JsonIndexConfig;
import dev.mars.jsonindex.index.UnchangedPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ChangelogGenerator}.
 * <p>
 * These tests verify:
 * <ul>
 *   <li>Add, change and unchanged classification</li>
 *   <li>Both unchanged-item policies</li>
 *   <li>Failure isolation between items</li>
 *   <li>Lifecycle of the owned index and sink</li>
 * </ul>
 */
class ChangelogGeneratorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String BUNDLE = "[{\"key\":\"A\",\"v\":1},{\"key\":\"B\",\"v\":2}]";

    @TempDir
    Path tempDir;

    private ChangelogGenerator history;
    private InMemorySink sink;

    @AfterEach
    void tearDown() {
        if (history != null) {
            try {
                history.close();
            } catch (IllegalStateException ignored) {
                // already closed by the test
            }
        }
    }

    // ========================================================================
    // Classification
    // ========================================================================

    @Nested
    @DisplayName("Classification")
    class ClassificationTests {

        @Test
        @DisplayName("Previous bundle is indexed by load()")
        void testLoad() throws Exception {
            history = open(BUNDLE, UnchangedPolicy.SKIP);

            assertTrue(history.index().has("A"));
            assertFalse(history.index().has("C"));
            assertEquals(List.of(json("{\"key\":\"A\",\"v\":1}")), history.index().get("A").orElseThrow());
        }

        @Test
        @DisplayName("Unknown key emits one Add and becomes known")
        void testStore_UnknownKey() throws Exception {
            history = open(BUNDLE, UnchangedPolicy.SKIP);
            JsonNode item = json("{\"key\":\"C\",\"v\":9}");

            Optional<DeltaRecord> record = history.store("C", item).get(5, TimeUnit.SECONDS);

            assertEquals(Optional.of(new DeltaRecord.Add("C", item)), record);
            assertEquals(List.of(record.get()), sink.records());
            assertTrue(history.index().has("C"));
            assertEquals(new ChangelogStats(1, 0, 0, 0), history.stats());
        }

        @Test
        @DisplayName("Changed item emits one Change whose delta rebuilds the new value")
        void testStore_ChangedItem() throws Exception {
            history = open(BUNDLE, UnchangedPolicy.SKIP);
            JsonNode item = json("{\"key\":\"A\",\"v\":5}");

            DeltaRecord record = history.store("A", item).get(5, TimeUnit.SECONDS).orElseThrow();

            assertTrue(record instanceof DeltaRecord.Change);
            DeltaRecord.Change change = (DeltaRecord.Change) record;
            assertEquals("A", change.id());
            assertEquals(json("{\"key\":\"A\",\"v\":1}"), change.item());
            assertEquals(json("[{\"op\":\"replace\",\"path\":\"/v\",\"value\":5}]"), change.delta());
            assertEquals(item, JsonDiff.apply(change.item(), change.delta()));
            assertEquals(1, sink.count());
        }

        @Test
        @DisplayName("Identical item emits nothing")
        void testStore_UnchangedItem() throws Exception {
            history = open(BUNDLE, UnchangedPolicy.SKIP);

            Optional<DeltaRecord> record = history.store("A", json("{\"key\":\"A\",\"v\":1}")).get(5, TimeUnit.SECONDS);

            assertTrue(record.isEmpty());
            assertEquals(0, sink.count());
            assertEquals(new ChangelogStats(0, 0, 1, 0), history.stats());
        }

        @Test
        @DisplayName("Changed item becomes the value later items are compared with")
        void testStore_ChangeAdvancesLatest() throws Exception {
            history = open(BUNDLE, UnchangedPolicy.SKIP);

            history.store("A", json("{\"key\":\"A\",\"v\":5}")).get(5, TimeUnit.SECONDS);
            Optional<DeltaRecord> repeat = history.store("A", json("{\"key\":\"A\",\"v\":5}")).get(5, TimeUnit.SECONDS);
            DeltaRecord next = history.store("A", json("{\"key\":\"A\",\"v\":7}")).get(5, TimeUnit.SECONDS).orElseThrow();

            assertTrue(repeat.isEmpty());
            assertEquals(json("{\"key\":\"A\",\"v\":5}"), next.item());
            assertEquals(new ChangelogStats(0, 2, 1, 0), history.stats());
        }

        @Test
        @DisplayName("Detector ordering decides which record is the latest")
        void testStore_DetectorOrdering() throws Exception {
            String bundle = "[{\"key\":\"A\",\"t\":\"2024-03\",\"v\":3},{\"key\":\"A\",\"t\":\"2024-01\",\"v\":1}]";
            ChangeDetector detector = ChangeDetector.byContent().withOrdering(ChangeDetector.orderingByField("t"));
            history = open(bundle, detector, UnchangedPolicy.SKIP);

            Optional<DeltaRecord> same = history.store("A", json("{\"key\":\"A\",\"t\":\"2024-03\",\"v\":3}"))
                    .get(5, TimeUnit.SECONDS);

            assertTrue(same.isEmpty());
        }
    }

    // ========================================================================
    // Unchanged Policy
    // ========================================================================

    @Nested
    @DisplayName("Unchanged policy")
    class PolicyTests {

        @Test
        @DisplayName("SKIP leaves the index untouched")
        void testSkip() throws Exception {
            history = open(BUNDLE, UnchangedPolicy.SKIP);

            history.store("A", json("{\"key\":\"A\",\"v\":1}")).get(5, TimeUnit.SECONDS);

            assertEquals(1, history.index().locations("A").size());
        }

        @Test
        @DisplayName("RECORD appends the unchanged item as the latest value")
        void testRecord() throws Exception {
            history = open(BUNDLE, UnchangedPolicy.RECORD);

            Optional<DeltaRecord> record = history.store("A", json("{\"key\":\"A\",\"v\":1}")).get(5, TimeUnit.SECONDS);

            assertTrue(record.isEmpty());
            assertEquals(0, sink.count());
            assertEquals(2, history.index().locations("A").size());
        }

        @Test
        @DisplayName("RECORD lets a field-based detector move its reference point")
        void testRecord_FieldDetector() throws Exception {
            String bundle = "[{\"key\":\"A\",\"creationTime\":\"t1\",\"v\":1}]";
            history = open(bundle, ChangeDetector.byField("creationTime"), UnchangedPolicy.RECORD);

            history.store("A", json("{\"key\":\"A\",\"creationTime\":\"t1\",\"v\":2}")).get(5, TimeUnit.SECONDS);
            DeltaRecord change = history.store("A", json("{\"key\":\"A\",\"creationTime\":\"t2\",\"v\":2}"))
                    .get(5, TimeUnit.SECONDS).orElseThrow();

            // diffed against the recorded v=2 item, so only creationTime differs
            assertEquals(json("[{\"op\":\"replace\",\"path\":\"/creationTime\",\"value\":\"t2\"}]"),
                    ((DeltaRecord.Change) change).delta());
        }
    }

    // ========================================================================
    // Failures
    // ========================================================================

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Diff failure fails only that item")
        void testDiffFailure() throws Exception {
            StructuralDiff failing = (from, to) -> {
                if (to.path("v").asInt() == 13) {
                    throw new IllegalArgumentException("unlucky");
                }
                return JsonDiff.between(from, to);
            };
            sink = new InMemorySink(true);
            history = new ChangelogGenerator(new JsonIndex(bundle(BUNDLE), config()), sink,
                    ChangeDetector.byContent(), failing, UnchangedPolicy.SKIP);
            history.load().get(5, TimeUnit.SECONDS);

            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> history.store("A", json("{\"key\":\"A\",\"v\":13}")).get(5, TimeUnit.SECONDS));
            assertTrue(ex.getCause() instanceof DiffException);

            assertTrue(history.store("B", json("{\"key\":\"B\",\"v\":3}")).get(5, TimeUnit.SECONDS).isPresent());
            assertTrue(history.store("C", json("{\"key\":\"C\"}")).get(5, TimeUnit.SECONDS).isPresent());
            assertEquals(new ChangelogStats(1, 1, 0, 1), history.stats());
            // the failed item did not become the latest value
            assertEquals(1, history.index().locations("A").size());
        }

        @Test
        @DisplayName("Diff returning no patch is a failure")
        void testDiffReturnsNull() throws Exception {
            sink = new InMemorySink(true);
            history = new ChangelogGenerator(new JsonIndex(bundle(BUNDLE), config()), sink,
                    ChangeDetector.byContent(), (from, to) -> null, UnchangedPolicy.SKIP);
            history.load().get(5, TimeUnit.SECONDS);

            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> history.store("A", json("{\"key\":\"A\",\"v\":2}")).get(5, TimeUnit.SECONDS));
            assertTrue(ex.getCause() instanceof DiffException);
        }

        @Test
        @DisplayName("Sink failure is reported through the future")
        void testSinkFailure() throws Exception {
            RecordSink broken = new RecordSink() {
                @Override
                public CompletableFuture<Void> store(String id, DeltaRecord record) {
                    return CompletableFuture.failedFuture(new IllegalStateException("disk full"));
                }

                @Override
                public void close() {
                }
            };
            history = new ChangelogGenerator(new JsonIndex(bundle(BUNDLE), config()), broken,
                    ChangeDetector.byContent(), JsonDiff.INSTANCE, UnchangedPolicy.SKIP);
            history.load().get(5, TimeUnit.SECONDS);

            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> history.store("C", json("{\"key\":\"C\"}")).get(5, TimeUnit.SECONDS));

            assertTrue(ex.getCause() instanceof DeltaSinkException);
            assertTrue(ex.getCause().getCause() instanceof IllegalStateException);
            assertEquals(new ChangelogStats(0, 0, 0, 1), history.stats());
            assertFalse(history.index().has("C"));
        }

        @Test
        @DisplayName("Add rejected by the sink is emitted when the item is stored again")
        void testSinkFailure_RetryEmitsAdd() throws Exception {
            sink = new InMemorySink(true);
            history = new ChangelogGenerator(new JsonIndex(bundle(BUNDLE), config()), new FailingOnceSink(sink),
                    ChangeDetector.byContent(), JsonDiff.INSTANCE, UnchangedPolicy.SKIP);
            history.load().get(5, TimeUnit.SECONDS);
            JsonNode item = json("{\"key\":\"C\",\"v\":9}");

            assertThrows(ExecutionException.class, () -> history.store("C", item).get(5, TimeUnit.SECONDS));
            Optional<DeltaRecord> retry = history.store("C", item).get(5, TimeUnit.SECONDS);

            assertEquals(Optional.of(new DeltaRecord.Add("C", item)), retry);
            assertTrue(history.index().has("C"));
            assertEquals(List.of(retry.get()), sink.records());
            assertEquals(new ChangelogStats(1, 0, 0, 1), history.stats());
        }

        @Test
        @DisplayName("Change rejected by the sink keeps the previous latest value")
        void testSinkFailure_RetryEmitsChange() throws Exception {
            sink = new InMemorySink(true);
            history = new ChangelogGenerator(new JsonIndex(bundle(BUNDLE), config()), new FailingOnceSink(sink),
                    ChangeDetector.byContent(), JsonDiff.INSTANCE, UnchangedPolicy.SKIP);
            history.load().get(5, TimeUnit.SECONDS);
            JsonNode item = json("{\"key\":\"A\",\"v\":5}");

            assertThrows(ExecutionException.class, () -> history.store("A", item).get(5, TimeUnit.SECONDS));
            assertEquals(1, history.index().locations("A").size());

            DeltaRecord retry = history.store("A", item).get(5, TimeUnit.SECONDS).orElseThrow();

            assertTrue(retry instanceof DeltaRecord.Change);
            assertEquals(json("{\"key\":\"A\",\"v\":1}"), retry.item());
            assertEquals(2, history.index().locations("A").size());
            assertEquals(new ChangelogStats(0, 1, 0, 1), history.stats());
        }

        @Test
        @DisplayName("Store before load fails the future")
        void testStoreBeforeLoad() throws Exception {
            sink = new InMemorySink(true);
            history = new ChangelogGenerator(bundle(BUNDLE), sink, ChangeDetector.byContent(), config());

            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> history.store("A", json("{}")).get(5, TimeUnit.SECONDS));
            assertTrue(ex.getCause() instanceof IllegalStateException);
        }

        @Test
        @DisplayName("Missing previous bundle fails load()")
        void testLoadMissingBundle() {
            sink = new InMemorySink(true);
            history = new ChangelogGenerator(tempDir.resolve("missing.json"), sink,
                    ChangeDetector.byContent(), config());

            ExecutionException ex = assertThrows(ExecutionException.class,
                    () -> history.load().get(5, TimeUnit.SECONDS));
            assertTrue(ex.getCause() instanceof IndexException);
        }
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("Close releases index and sink, and only once")
        void testClose() throws Exception {
            AtomicBoolean sinkClosed = new AtomicBoolean();
            RecordSink tracking = new RecordSink() {
                @Override
                public CompletableFuture<Void> store(String id, DeltaRecord record) {
                    return CompletableFuture.completedFuture(null);
                }

                @Override
                public void close() {
                    sinkClosed.set(true);
                }
            };
            history = new ChangelogGenerator(new JsonIndex(bundle(BUNDLE), config()), tracking,
                    ChangeDetector.byContent(), JsonDiff.INSTANCE, UnchangedPolicy.SKIP);
            history.load().get(5, TimeUnit.SECONDS);

            history.close();

            assertTrue(sinkClosed.get());
            assertThrows(IllegalStateException.class, () -> history.index().has("A"));
            assertThrows(IllegalStateException.class, history::close);
        }

        @Test
        @DisplayName("Size reports the index estimate")
        void testSize() throws Exception {
            history = open(BUNDLE, UnchangedPolicy.SKIP);

            assertEquals(2L * JsonIndex.ESTIMATED_ENTRY_SIZE, history.size());
            history.store("C", json("{\"key\":\"C\"}")).get(5, TimeUnit.SECONDS);
            assertEquals(3L * JsonIndex.ESTIMATED_ENTRY_SIZE, history.size());
        }
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    /** Rejects the first record, then delegates. */
    private static final class FailingOnceSink implements RecordSink {
        private final RecordSink delegate;
        private boolean failed = false;

        FailingOnceSink(RecordSink delegate) {
            this.delegate = delegate;
        }

        @Override
        public CompletableFuture<Void> store(String id, DeltaRecord record) {
            if (!failed) {
                failed = true;
                return CompletableFuture.failedFuture(new IllegalStateException("transient write failure"));
            }
            return delegate.store(id, record);
        }

        @Override
        public void close() {
            delegate.close();
        }
    }

    private ChangelogGenerator open(String bundle, UnchangedPolicy policy) throws Exception {
        return open(bundle, ChangeDetector.byContent(), policy);
    }

    private ChangelogGenerator open(String bundle, ChangeDetector detector, UnchangedPolicy policy) throws Exception {
        sink = new InMemorySink(true);
        JsonIndexConfig config = JsonIndexConfig.builder().keyField("key").unchangedPolicy(policy).build();
        ChangelogGenerator generator = new ChangelogGenerator(bundle(bundle), sink, detector, config);
        generator.load().get(5, TimeUnit.SECONDS);
        return generator;
    }

    private Path bundle(String content) throws Exception {
        Path file = Files.createTempFile(tempDir, "bundle", ".json");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static JsonIndexConfig config() {
        return JsonIndexConfig.builder().keyField("key").build();
    }

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }
}
