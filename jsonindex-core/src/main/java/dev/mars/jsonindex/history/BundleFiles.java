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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Naming of bundle and changelog files in a data directory.
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * data/
 *  ├─ 2026-10-17-bills.json         // bundle written by the run of that day
 *  ├─ 2026-10-18-bills.json
 *  └─ 2026-10-18-bills-delta.json   // changelog of that run against the previous bundle
 * </pre>
 */
public final class BundleFiles {

    private static final Logger LOG = LoggerFactory.getLogger(BundleFiles.class);

    private static final Pattern DATED_FILE = Pattern.compile("(\\d{4}-\\d{2}-\\d{2})-(.+)\\.json");
    private static final String DELTA_SUFFIX = "-delta";

    /** A bundle must be at least this old to serve as the previous one. */
    static final Duration MIN_AGE = Duration.ofDays(1);

    private BundleFiles() {
    }

    /** {@code <dir>/<yyyy-MM-dd>-<name>.json} */
    public static Path snapshotFile(Path dataDir, String name, LocalDate date) {
        return dataDir.resolve(date + "-" + name + ".json");
    }

    /** {@code <dir>/<yyyy-MM-dd>-<name>-delta.json} */
    public static Path deltaFile(Path dataDir, String name, LocalDate date) {
        return dataDir.resolve(date + "-" + name + DELTA_SUFFIX + ".json");
    }

    /**
     * Finds the newest bundle for {@code name} that is at least a day old.
     * Changelog files are never candidates.
     *
     * @return the bundle, or empty if history cannot be computed for this run
     * @throws IOException if the directory cannot be listed
     */
    public static Optional<Path> resolvePrevious(Path dataDir, String name, Clock clock) throws IOException {
        Objects.requireNonNull(dataDir, "dataDir");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(clock, "clock");
        if (!Files.isDirectory(dataDir)) {
            LOG.debug("No data directory at {}", dataDir);
            return Optional.empty();
        }

        try (Stream<Path> files = Files.list(dataDir)) {
            Optional<Dated> newest = files
                    .map(file -> dated(file, name))
                    .flatMap(Optional::stream)
                    .filter(dated -> oldEnough(dated.date(), clock))
                    .max(Comparator.comparing(Dated::date));
            newest.ifPresentOrElse(
                    dated -> LOG.info("Previous bundle for {}: {}", name, dated.file()),
                    () -> LOG.info("No previous bundle for {} in {}", name, dataDir));
            return newest.map(Dated::file);
        }
    }

    private static Optional<Dated> dated(Path file, String name) {
        Matcher m = DATED_FILE.matcher(file.getFileName().toString());
        if (!m.matches() || !m.group(2).equals(name) || !Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(new Dated(file, LocalDate.parse(m.group(1))));
        } catch (DateTimeParseException e) {
            LOG.debug("Skipping {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean oldEnough(LocalDate date, Clock clock) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant().plus(MIN_AGE).isBefore(clock.instant());
    }

    private record Dated(Path file, LocalDate date) {
    }
}
