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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link JsonIndex}.
 * <p>
 * These tests verify:
 * <ul>
 *   <li>Key discovery during build</li>
 *   <li>Lookup of backing and appended records</li>
 *   <li>Buffer budget enforcement</li>
 *   <li>Lifecycle rules</li>
 * </ul>
 */
class JsonIndexTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private JsonIndex index;

    @AfterEach
    void tearDown() {
        if (index != null && index.status() != JsonIndex.Status.CLOSED) {
            index.close();
        }
    }

    // ========================================================================
    // Build
    // ========================================================================

    @Nested
    @DisplayName("Build")
    class BuildTests {

        @Test
        @DisplayName("Keys of the backing file are known after build")
        void testBuild_KnownKeys() throws Exception {
            index = open("[{\"key\":\"A\",\"v\":1},{\"key\":\"B\",\"v\":2}]", defaults());

            assertTrue(index.has("A"));
            assertTrue(index.has("B"));
            assertFalse(index.has("C"));
            assertEquals(List.of(json("{\"key\":\"A\",\"v\":1}")), index.get("A").orElseThrow());
            assertEquals(2, index.entryCount());
            assertEquals(0, index.scanAnomalies());
        }

        @Test
        @DisplayName("Objects without a matching key are skipped")
        void testBuild_SkipsUnkeyedObjects() throws Exception {
            index = open("[{\"key\":\"A\"},{\"id\":\"X\"},{\"key\":42},{\"key\":\"B\"}]", defaults());

            assertEquals(2, index.keys().size());
            assertTrue(index.has("A"));
            assertTrue(index.has("B"));
            assertFalse(index.has("X"));
            // {"key":42} names the key field but does not match
            assertEquals(1, index.scanAnomalies());
        }

        @Test
        @DisplayName("Empty key is skipped as an anomaly")
        void testBuild_EmptyKey() throws Exception {
            index = open("[{\"key\":\"\",\"v\":\"x\"},{\"key\":\"B\"}]", defaults());

            assertEquals(Set.of("B"), index.keys());
            assertEquals(1, index.scanAnomalies());
        }

        @Test
        @DisplayName("Repeated keys keep every record in file order")
        void testBuild_RepeatedKeys() throws Exception {
            index = open("[{\"key\":\"A\",\"v\":1},{\"key\":\"B\"},{\"key\":\"A\",\"v\":2}]", defaults());

            List<JsonNode> records = index.get("A").orElseThrow();
            assertEquals(2, records.size());
            assertEquals(1, records.get(0).get("v").asInt());
            assertEquals(2, records.get(1).get("v").asInt());
            assertEquals(3, index.entryCount());
        }

        @Test
        @DisplayName("Scanning in chunks smaller than the file yields the same index")
        void testBuild_ChunkedScan() throws Exception {
            StringBuilder json = new StringBuilder("[");
            for (int i = 0; i < 50; i++) {
                if (i > 0) {
                    json.append(',');
                }
                json.append("{\"key\":\"k").append(i).append("\",\"s\":\"{\\\"").append(i).append("}\"}");
            }
            json.append(']');

            JsonIndex whole = open(json.toString(), defaults());
            index = open(json.toString(), JsonIndexConfig.builder().scanChunkSize(64).build());
            try {
                assertEquals(whole.keys(), index.keys());
                assertEquals(50, index.keys().size());
                for (String key : whole.keys()) {
                    assertEquals(whole.locations(key), index.locations(key));
                }
                assertEquals(0, index.scanAnomalies());
            } finally {
                whole.close();
            }
        }

        @Test
        @DisplayName("Custom key field and matcher")
        void testBuild_CustomKeyField() throws Exception {
            JsonIndexConfig config = JsonIndexConfig.builder().keyField("file").build();
            index = open("[{\"file\":\"/a.pdf\",\"key\":\"ignored\"}]", config);

            assertTrue(index.has("/a.pdf"));
            assertFalse(index.has("ignored"));
        }

        @Test
        @DisplayName("Empty file builds an empty index")
        void testBuild_EmptyFile() throws Exception {
            index = open("", defaults());

            assertTrue(index.keys().isEmpty());
            assertEquals(0, index.size());
        }

        @Test
        @DisplayName("Unterminated trailing object counts as an anomaly")
        void testBuild_Truncated() throws Exception {
            index = open("[{\"key\":\"A\"},{\"key\":\"B\",\"v\":", defaults());

            assertTrue(index.has("A"));
            assertFalse(index.has("B"));
            assertEquals(1, index.scanAnomalies());
        }

        @Test
        @DisplayName("Missing file fails the build and leaves the index unusable")
        void testBuild_MissingFile() {
            index = new JsonIndex(tempDir.resolve("missing.json"), defaults());

            assertThrows(IndexException.class, index::build);
            assertEquals(JsonIndex.Status.FAILED, index.status());
            assertThrows(IllegalStateException.class, () -> index.has("A"));
        }

        @Test
        @DisplayName("Build runs only once")
        void testBuild_Twice() throws Exception {
            index = open("[]", defaults());

            assertThrows(IllegalStateException.class, index::build);
        }
    }

    // ========================================================================
    // Lookup and Add
    // ========================================================================

    @Nested
    @DisplayName("Lookup and add")
    class LookupTests {

        @Test
        @DisplayName("Unknown key yields empty")
        void testGet_Unknown() throws Exception {
            index = open("[{\"key\":\"A\"}]", defaults());

            assertEquals(Optional.empty(), index.get("Z"));
            assertTrue(index.locations("Z").isEmpty());
        }

        @Test
        @DisplayName("Added item is the last record returned")
        void testAdd_RoundTrip() throws Exception {
            index = open("[{\"key\":\"A\",\"v\":1}]", defaults());
            JsonNode item = json("{\"key\":\"A\",\"v\":5,\"tags\":[\"x\",{\"y\":null}]}");

            Location location = index.add("A", item);

            assertTrue(location instanceof Location.Appended);
            List<JsonNode> records = index.get("A").orElseThrow();
            assertEquals(2, records.size());
            assertEquals(item, records.get(records.size() - 1));
            assertTrue(index.locations("A").get(0) instanceof Location.Backing);
        }

        @Test
        @DisplayName("Adding a new key makes it known")
        void testAdd_NewKey() throws Exception {
            index = open("[]", defaults());

            index.add("C", json("{\"key\":\"C\",\"v\":9}"));

            assertTrue(index.has("C"));
            assertEquals(List.of(json("{\"key\":\"C\",\"v\":9}")), index.get("C").orElseThrow());
        }

        @Test
        @DisplayName("Repeated reads return equal results")
        void testGet_Idempotent() throws Exception {
            index = open("[{\"key\":\"A\",\"v\":1},{\"key\":\"B\"},{\"key\":\"A\",\"v\":2}]", defaults());
            index.add("A", json("{\"key\":\"A\",\"v\":3}"));

            List<JsonNode> first = index.get("A").orElseThrow();
            List<JsonNode> second = index.get("A").orElseThrow();

            assertEquals(first, second);
            assertNotSame(first.get(0), second.get(0));
        }

        @Test
        @DisplayName("Sorted lookup is stable")
        void testGet_Sorted() throws Exception {
            index = open("[{\"key\":\"A\",\"t\":\"2024-03\",\"n\":1},{\"key\":\"A\",\"t\":\"2024-01\",\"n\":2}," +
                    "{\"key\":\"A\",\"t\":\"2024-03\",\"n\":3}]", defaults());

            List<JsonNode> sorted = index.get("A", Comparator.comparing((JsonNode n) -> n.get("t").asText())).orElseThrow();

            List<Integer> order = new ArrayList<>();
            sorted.forEach(n -> order.add(n.get("n").asInt()));
            assertEquals(List.of(2, 1, 3), order);
        }

        @Test
        @DisplayName("Size is the entry count times the entry estimate")
        void testSize() throws Exception {
            index = open("[{\"key\":\"A\"},{\"key\":\"B\"}]", defaults());
            assertEquals(2L * JsonIndex.ESTIMATED_ENTRY_SIZE, index.size());

            index.add("C", json("{}"));
            assertEquals(3L * JsonIndex.ESTIMATED_ENTRY_SIZE, index.size());
        }

        @Test
        @DisplayName("Concurrent adds on distinct keys are all recorded")
        void testAdd_Concurrent() throws Exception {
            index = open("[]", defaults());
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int t = 0; t < 4; t++) {
                    String key = "T" + t;
                    futures.add(pool.submit(() -> {
                        for (int i = 0; i < 100; i++) {
                            index.add(key, MAPPER.createObjectNode().put("i", i));
                            index.get(key);
                        }
                    }));
                }
                for (Future<?> f : futures) {
                    f.get(5, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(400, index.entryCount());
            List<JsonNode> records = index.get("T2").orElseThrow();
            assertEquals(100, records.size());
            assertEquals(99, records.get(99).get("i").asInt());
        }
    }

    // ========================================================================
    // Buffer Budget
    // ========================================================================

    @Nested
    @DisplayName("Buffer budget")
    class BudgetTests {

        @Test
        @DisplayName("Record wider than the buffer fails and leaves the buffer as it was")
        void testGet_RecordWiderThanBuffer() throws Exception {
            String big = "{\"key\":\"big\",\"pad\":\"" + "x".repeat(1500) + "\"}";
            JsonIndexConfig config = JsonIndexConfig.builder().bufferSize(1024).build();
            index = open("[{\"key\":\"small\",\"v\":1}," + big + "]", config);

            assertTrue(index.has("big"));
            RangeBuffer buffer = index.rangeBuffer();
            long start = buffer.windowStart();
            long end = buffer.windowEnd();
            long refills = buffer.refills();

            assertThrows(BudgetExceededException.class, () -> index.get("big"));

            assertEquals(start, buffer.windowStart());
            assertEquals(end, buffer.windowEnd());
            assertEquals(refills, buffer.refills());
            assertEquals(1, index.get("small").orElseThrow().get(0).get("v").asInt());
        }

        @Test
        @DisplayName("Records read in file order share one window")
        void testGet_SequentialLocality() throws Exception {
            index = open("[{\"key\":\"A\"},{\"key\":\"B\"},{\"key\":\"C\"}]", defaults());
            long refills = index.rangeBuffer().refills();

            index.get("A");
            index.get("B");
            index.get("C");

            assertEquals(refills, index.rangeBuffer().refills());
        }
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("Use before build is rejected")
        void testUseBeforeBuild() {
            index = new JsonIndex(tempDir.resolve("x.json"), defaults());

            assertThrows(IllegalStateException.class, () -> index.has("A"));
            assertThrows(IllegalStateException.class, () -> index.get("A"));
        }

        @Test
        @DisplayName("Use after close is rejected")
        void testUseAfterClose() throws Exception {
            index = open("[{\"key\":\"A\"}]", defaults());
            index.close();

            assertThrows(IllegalStateException.class, () -> index.has("A"));
            assertThrows(IllegalStateException.class, () -> index.get("A"));
            assertThrows(IllegalStateException.class, () -> index.add("A", json("{}")));
        }

        @Test
        @DisplayName("Closing twice is rejected")
        void testCloseTwice() throws Exception {
            index = open("[]", defaults());
            index.close();

            assertThrows(IllegalStateException.class, index::close);
        }

        @Test
        @DisplayName("Failed index can still be closed")
        void testCloseAfterFailure() {
            index = new JsonIndex(tempDir.resolve("missing.json"), defaults());
            assertThrows(IndexException.class, index::build);

            index.close();
            assertEquals(JsonIndex.Status.CLOSED, index.status());
        }
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static JsonIndexConfig defaults() {
        return JsonIndexConfig.builder().keyField("key").build();
    }

    private JsonIndex open(String content, JsonIndexConfig config) throws Exception {
        Path file = Files.createTempFile(tempDir, "bundle", ".json");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        JsonIndex built = new JsonIndex(file, config);
        built.build();
        return built;
    }

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }
}
