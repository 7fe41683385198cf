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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

/**
 * Configuration for the bundle index and the changelog built on it.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Djsonindex.keyField=id})</li>
 *   <li>Environment variables (e.g., {@code JSONINDEX_KEY_FIELD})</li>
 *   <li>Properties file ({@code jsonindex.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>keyField</td><td>jsonindex.keyField</td><td>JSONINDEX_KEY_FIELD</td><td>key</td></tr>
 *   <tr><td>keyMatcher</td><td>jsonindex.keyMatcher</td><td>JSONINDEX_KEY_MATCHER</td><td>{@code "<keyField>"\s*:\s*"((?:[^"\\]|\\.)*)"}</td></tr>
 *   <tr><td>bufferSize</td><td>jsonindex.bufferSize</td><td>JSONINDEX_BUFFER_SIZE</td><td>52428800 (50 MB)</td></tr>
 *   <tr><td>scanChunkSize</td><td>jsonindex.scanChunkSize</td><td>JSONINDEX_SCAN_CHUNK_SIZE</td><td>104857600 (100 MB)</td></tr>
 *   <tr><td>unchangedPolicy</td><td>jsonindex.unchangedPolicy</td><td>JSONINDEX_UNCHANGED_POLICY</td><td>SKIP</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # jsonindex.properties
 * jsonindex.keyField=file
 * jsonindex.bufferSize=52428800
 * jsonindex.unchangedPolicy=RECORD
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * JsonIndexConfig config = JsonIndexConfig.builder()
 *     .keyField("file")
 *     .bufferSize(8 * 1024 * 1024)
 *     .build();
 *
 * JsonIndex index = new JsonIndex(bundleFile, config);
 * index.build();
 * </pre>
 */
public final class JsonIndexConfig {

    private static final Logger LOG = LoggerFactory.getLogger(JsonIndexConfig.class);

    private static final String PROPERTIES_FILE = "jsonindex.properties";

    // Property keys
    private static final String PROP_KEY_FIELD = "jsonindex.keyField";
    private static final String PROP_KEY_MATCHER = "jsonindex.keyMatcher";
    private static final String PROP_BUFFER_SIZE = "jsonindex.bufferSize";
    private static final String PROP_SCAN_CHUNK_SIZE = "jsonindex.scanChunkSize";
    private static final String PROP_UNCHANGED_POLICY = "jsonindex.unchangedPolicy";

    // Environment variable keys
    private static final String ENV_KEY_FIELD = "JSONINDEX_KEY_FIELD";
    private static final String ENV_KEY_MATCHER = "JSONINDEX_KEY_MATCHER";
    private static final String ENV_BUFFER_SIZE = "JSONINDEX_BUFFER_SIZE";
    private static final String ENV_SCAN_CHUNK_SIZE = "JSONINDEX_SCAN_CHUNK_SIZE";
    private static final String ENV_UNCHANGED_POLICY = "JSONINDEX_UNCHANGED_POLICY";

    // Defaults
    private static final String DEFAULT_KEY_FIELD = "key";
    private static final int DEFAULT_BUFFER_SIZE = 50 * 1024 * 1024;
    private static final int DEFAULT_SCAN_CHUNK_SIZE = 100 * 1024 * 1024;
    private static final UnchangedPolicy DEFAULT_UNCHANGED_POLICY = UnchangedPolicy.SKIP;

    private final String keyField;
    private final String keyMatcher;
    private final int bufferSize;
    private final int scanChunkSize;
    private final UnchangedPolicy unchangedPolicy;

    private JsonIndexConfig(Builder builder) {
        this.keyField = builder.keyField;
        this.keyMatcher = builder.keyMatcher;
        this.bufferSize = builder.bufferSize;
        this.scanChunkSize = builder.scanChunkSize;
        this.unchangedPolicy = builder.unchangedPolicy;
    }

    /** Name of the attribute used as the index key. */
    public String keyField() {
        return keyField;
    }

    /** Pattern extracting the key literal from a candidate object's raw text. */
    public String keyMatcher() {
        return keyMatcher;
    }

    /** Range buffer window size in bytes; no single record read may exceed it. */
    public int bufferSize() {
        return bufferSize;
    }

    /** Bytes read per step while scanning the backing file. */
    public int scanChunkSize() {
        return scanChunkSize;
    }

    /** Handling of known keys whose incoming item is unchanged. */
    public UnchangedPolicy unchangedPolicy() {
        return unchangedPolicy;
    }

    /** Creates the extractor described by {@link #keyField()} and {@link #keyMatcher()}. */
    public KeyExtractor keyExtractor() {
        return new KeyExtractor(keyField, keyMatcher);
    }

    @Override
    public String toString() {
        return "JsonIndexConfig{" +
                "keyField='" + keyField + '\'' +
                ", keyMatcher='" + keyMatcher + '\'' +
                ", bufferSize=" + bufferSize +
                ", scanChunkSize=" + scanChunkSize +
                ", unchangedPolicy=" + unchangedPolicy +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code JsonIndexConfig.builder().build()}.
     */
    public static JsonIndexConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link JsonIndexConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private String keyField;
        private String keyMatcher;
        private Integer bufferSize;
        private Integer scanChunkSize;
        private UnchangedPolicy unchangedPolicy;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the key attribute name (default: key). */
        public Builder keyField(String keyField) {
            this.keyField = keyField;
            return this;
        }

        /** Sets the key pattern; its last capturing group is the key. */
        public Builder keyMatcher(String keyMatcher) {
            this.keyMatcher = keyMatcher;
            return this;
        }

        /** Sets the range buffer size in bytes (default: 50 MB). */
        public Builder bufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
            return this;
        }

        /** Sets the scan chunk size in bytes (default: 100 MB). */
        public Builder scanChunkSize(int scanChunkSize) {
            this.scanChunkSize = scanChunkSize;
            return this;
        }

        /** Sets the unchanged-item policy (default: SKIP). */
        public Builder unchangedPolicy(UnchangedPolicy unchangedPolicy) {
            this.unchangedPolicy = unchangedPolicy;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalArgumentException if a size is not positive or the key matcher is invalid
         */
        public JsonIndexConfig build() {
            if (keyField == null) {
                keyField = resolve(PROP_KEY_FIELD, ENV_KEY_FIELD);
                if (keyField == null) {
                    keyField = DEFAULT_KEY_FIELD;
                }
            }
            if (keyMatcher == null) {
                keyMatcher = resolve(PROP_KEY_MATCHER, ENV_KEY_MATCHER);
                if (keyMatcher == null) {
                    keyMatcher = KeyExtractor.defaultMatcher(keyField);
                }
            }
            if (bufferSize == null) {
                bufferSize = resolveInt(PROP_BUFFER_SIZE, ENV_BUFFER_SIZE, DEFAULT_BUFFER_SIZE);
            }
            if (scanChunkSize == null) {
                scanChunkSize = resolveInt(PROP_SCAN_CHUNK_SIZE, ENV_SCAN_CHUNK_SIZE, DEFAULT_SCAN_CHUNK_SIZE);
            }
            if (unchangedPolicy == null) {
                unchangedPolicy = resolvePolicy(PROP_UNCHANGED_POLICY, ENV_UNCHANGED_POLICY, DEFAULT_UNCHANGED_POLICY);
            }

            if (keyField.isBlank()) {
                throw new IllegalArgumentException("keyField must not be blank");
            }
            if (bufferSize <= 0) {
                throw new IllegalArgumentException("bufferSize must be positive: " + bufferSize);
            }
            if (scanChunkSize <= 0) {
                throw new IllegalArgumentException("scanChunkSize must be positive: " + scanChunkSize);
            }
            // fail fast on a bad pattern
            new KeyExtractor(keyField, keyMatcher);

            return new JsonIndexConfig(this);
        }

        private String resolve(String sysProp, String envVar) {
            // 1. System property
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value;
            }

            // 2. Environment variable
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value;
            }

            // 3. Properties file
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value;
            }

            return null;
        }

        private int resolveInt(String sysProp, String envVar, int defaultValue) {
            String value = resolve(sysProp, envVar);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring {}={}: not an integer, using {}", sysProp, value, defaultValue);
                return defaultValue;
            }
        }

        private UnchangedPolicy resolvePolicy(String sysProp, String envVar, UnchangedPolicy defaultValue) {
            String value = resolve(sysProp, envVar);
            if (value == null) {
                return defaultValue;
            }
            try {
                return UnchangedPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                LOG.warn("Ignoring {}={}: unknown policy, using {}", sysProp, value, defaultValue);
                return defaultValue;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = JsonIndexConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
