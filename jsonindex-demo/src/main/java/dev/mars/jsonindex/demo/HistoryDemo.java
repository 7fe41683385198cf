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
package dev.mars.jsonindex.demo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.jsonindex.history.BundleFiles;
import dev.mars.jsonindex.history.ChangeDetector;
import dev.mars.jsonindex.history.ChangelogGenerator;
import dev.mars.jsonindex.history.ChangelogStats;
import dev.mars.jsonindex.history.FileSystemSink;
import dev.mars.jsonindex.index.JsonIndexConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Demo entry point for the bundle changelog.
 * <p>
 * One ingestion run:
 * <ul>
 *   <li>Finding the previous bundle in the data directory</li>
 *   <li>Indexing it</li>
 *   <li>Streaming the incoming bundle through the changelog generator</li>
 *   <li>Writing today's changelog and storing the incoming bundle as today's snapshot</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link JsonIndexConfig} with the following priority:
 * <ol>
 *   <li>System properties: {@code -Djsonindex.keyField=file -Djsonindex.bufferSize=8388608 ...}</li>
 *   <li>Environment variables: {@code JSONINDEX_KEY_FIELD, JSONINDEX_BUFFER_SIZE, ...}</li>
 *   <li>Properties file: {@code jsonindex.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl jsonindex-demo -am
 *
 * # Compare an incoming bundle against the newest snapshot of "bills" in ./data
 * java -jar jsonindex-demo/target/jsonindex-demo-1.0-SNAPSHOT.jar ./data bills incoming.json
 *
 * # Items keyed by a different field
 * java -Djsonindex.keyField=file -jar jsonindex-demo/target/jsonindex-demo-1.0-SNAPSHOT.jar ./data files incoming.json
 * </pre>
 *
 * @see JsonIndexConfig
 */
public class HistoryDemo {

    public static void main(String[] args) throws Exception {
        System.out.println("+---------------------------------------+");
        System.out.println("|         Bundle Changelog Demo         |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        if (args.length < 3) {
            System.out.println("Usage: HistoryDemo <dataDir> <name> <incoming.json>");
            System.exit(1);
        }
        Path dataDir = Path.of(args[0]);
        String name = args[1];
        Path incoming = Path.of(args[2]);

        JsonIndexConfig config = JsonIndexConfig.load();
        System.out.println("Configuration: " + config);
        System.out.println();

        Clock clock = Clock.systemUTC();
        LocalDate today = LocalDate.now(clock);
        Path snapshot = BundleFiles.snapshotFile(dataDir, name, today);

        Optional<Path> previous = BundleFiles.resolvePrevious(dataDir, name, clock);
        if (previous.isEmpty()) {
            System.out.println("[--] No previous bundle for '" + name + "' in " + dataDir.toAbsolutePath()
                    + ", history disabled for this run");
        } else {
            Path deltaFile = BundleFiles.deltaFile(dataDir, name, today);
            System.out.println("[OK] Previous bundle: " + previous.get());

            ObjectMapper mapper = new ObjectMapper();
            try (ChangelogGenerator history = new ChangelogGenerator(previous.get(),
                    new FileSystemSink(deltaFile, mapper), ChangeDetector.byContent(), config)) {

                history.load().join();
                System.out.println("[OK] Indexed " + history.index().keys().size() + " keys, ~"
                        + history.size() / 1024 + " KB, " + history.index().scanAnomalies() + " anomalies");

                long skipped = 0;
                try (MappingIterator<JsonNode> items = mapper.readerFor(JsonNode.class).readValues(incoming.toFile())) {
                    while (items.hasNext()) {
                        JsonNode item = items.next();
                        JsonNode key = item.get(config.keyField());
                        if (key == null || !key.isTextual()) {
                            skipped++;
                            continue;
                        }
                        try {
                            history.store(key.asText(), item).join();
                        } catch (CompletionException e) {
                            System.out.println("[!!] " + key.asText() + ": " + e.getCause().getMessage());
                        }
                    }
                }

                ChangelogStats stats = history.stats();
                System.out.println("[OK] Processed " + stats.total() + " items, skipped " + skipped + " without '"
                        + config.keyField() + "'");
                System.out.printf("    added=%d changed=%d unchanged=%d failed=%d%n",
                        stats.added(), stats.changed(), stats.unchanged(), stats.failed());
            }
            System.out.println("[OK] Changelog written to: " + deltaFile.toAbsolutePath());
        }

        Files.createDirectories(dataDir);
        Files.copy(incoming, snapshot, StandardCopyOption.REPLACE_EXISTING);
        System.out.println("[OK] Snapshot stored at: " + snapshot.toAbsolutePath());
        System.out.println();
        System.out.println("Demo complete!");
    }
}
