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
package dev.mars.raftkv.storage;

import dev.mars.raftkv.config.ConfigSource;

import java.nio.file.Path;

/**
 * Configuration for the key-value storage engine.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Draftkv.dataDir=/path})</li>
 *   <li>Environment variables (e.g., {@code RAFTKV_DATA_DIR})</li>
 *   <li>Properties file ({@code raftkv.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>dataDir</td><td>raftkv.dataDir</td><td>RAFTKV_DATA_DIR</td><td>~/.raftkv/data</td></tr>
 *   <tr><td>syncEnabled</td><td>raftkv.syncEnabled</td><td>RAFTKV_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>minFreeSpaceMb</td><td>raftkv.minFreeSpaceMb</td><td>RAFTKV_MIN_FREE_SPACE_MB</td><td>64</td></tr>
 *   <tr><td>maxValueSizeMb</td><td>raftkv.maxValueSizeMb</td><td>RAFTKV_MAX_VALUE_SIZE_MB</td><td>16</td></tr>
 * </table>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * KvStorageConfig config = KvStorageConfig.builder()
 *     .dataDir(Path.of("/var/lib/raftkv/data_1"))
 *     .syncEnabled(true)
 *     .build();
 *
 * KvStorage storage = new FileKvStorage(config);
 * storage.open(config.dataDir());
 * </pre>
 */
public final class KvStorageConfig {

    // Property keys
    static final String PROP_DATA_DIR = "raftkv.dataDir";
    static final String PROP_SYNC_ENABLED = "raftkv.syncEnabled";
    static final String PROP_MIN_FREE_SPACE_MB = "raftkv.minFreeSpaceMb";
    static final String PROP_MAX_VALUE_SIZE_MB = "raftkv.maxValueSizeMb";

    // Environment variable keys
    private static final String ENV_DATA_DIR = "RAFTKV_DATA_DIR";
    private static final String ENV_SYNC_ENABLED = "RAFTKV_SYNC_ENABLED";
    private static final String ENV_MIN_FREE_SPACE_MB = "RAFTKV_MIN_FREE_SPACE_MB";
    private static final String ENV_MAX_VALUE_SIZE_MB = "RAFTKV_MAX_VALUE_SIZE_MB";

    // Defaults
    private static final Path DEFAULT_DATA_DIR = Path.of(System.getProperty("user.home"), ".raftkv", "data");
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final int DEFAULT_MIN_FREE_SPACE_MB = 64;
    private static final int DEFAULT_MAX_VALUE_SIZE_MB = 16;
    /** Keeps {@link #maxValueSizeBytes()} within an int. */
    static final int MAX_VALUE_SIZE_MB_LIMIT = 1024;

    private final Path dataDir;
    private final boolean syncEnabled;
    private final int minFreeSpaceMb;
    private final int maxValueSizeMb;

    private KvStorageConfig(Builder builder) {
        this.dataDir = builder.dataDir;
        this.syncEnabled = builder.syncEnabled;
        this.minFreeSpaceMb = builder.minFreeSpaceMb;
        this.maxValueSizeMb = builder.maxValueSizeMb;
    }

    /** Data directory for the WAL, snapshot and lock files. */
    public Path dataDir() {
        return dataDir;
    }

    /** Whether fsync is enabled (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Minimum free disk space in MB required before writes. */
    public int minFreeSpaceMb() {
        return minFreeSpaceMb;
    }

    /** Maximum size of a single value in MB. */
    public int maxValueSizeMb() {
        return maxValueSizeMb;
    }

    public long minFreeSpaceBytes() {
        return (long) minFreeSpaceMb * 1024 * 1024;
    }

    public int maxValueSizeBytes() {
        return maxValueSizeMb * 1024 * 1024;
    }

    /**
     * Returns a copy of this configuration pointing at another data directory.
     */
    public KvStorageConfig withDataDir(Path otherDataDir) {
        return builder()
                .dataDir(otherDataDir)
                .syncEnabled(syncEnabled)
                .minFreeSpaceMb(minFreeSpaceMb)
                .maxValueSizeMb(maxValueSizeMb)
                .build();
    }

    @Override
    public String toString() {
        return "KvStorageConfig{" +
                "dataDir=" + dataDir +
                ", syncEnabled=" + syncEnabled +
                ", minFreeSpaceMb=" + minFreeSpaceMb +
                ", maxValueSizeMb=" + maxValueSizeMb +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder(ConfigSource.load());
    }

    /**
     * Creates a new builder resolving unset values from the given source.
     */
    public static Builder builder(ConfigSource source) {
        return new Builder(source);
    }

    /**
     * Loads configuration from all sources with default priority.
     */
    public static KvStorageConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link KvStorageConfig}.
     * <p>
     * Values not explicitly set are resolved through the {@link ConfigSource}.
     */
    public static final class Builder {
        private final ConfigSource source;

        private Path dataDir;
        private Boolean syncEnabled;
        private Integer minFreeSpaceMb;
        private Integer maxValueSizeMb;

        private Builder(ConfigSource source) {
            this.source = source;
        }

        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        public Builder dataDir(String dataDir) {
            this.dataDir = Path.of(dataDir);
            return this;
        }

        /** Enables or disables fsync (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        public Builder minFreeSpaceMb(int minFreeSpaceMb) {
            this.minFreeSpaceMb = minFreeSpaceMb;
            return this;
        }

        public Builder maxValueSizeMb(int maxValueSizeMb) {
            this.maxValueSizeMb = maxValueSizeMb;
            return this;
        }

        public KvStorageConfig build() {
            if (dataDir == null) {
                dataDir = source.resolvePath(PROP_DATA_DIR, ENV_DATA_DIR, DEFAULT_DATA_DIR);
            }
            if (syncEnabled == null) {
                syncEnabled = source.resolveBoolean(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, DEFAULT_SYNC_ENABLED);
            }
            if (minFreeSpaceMb == null) {
                minFreeSpaceMb = source.resolveInt(PROP_MIN_FREE_SPACE_MB, ENV_MIN_FREE_SPACE_MB, DEFAULT_MIN_FREE_SPACE_MB);
            }
            if (maxValueSizeMb == null) {
                maxValueSizeMb = source.resolveInt(PROP_MAX_VALUE_SIZE_MB, ENV_MAX_VALUE_SIZE_MB, DEFAULT_MAX_VALUE_SIZE_MB);
            }
            if (minFreeSpaceMb < 0) {
                throw new IllegalArgumentException("minFreeSpaceMb must be >= 0: " + minFreeSpaceMb);
            }
            if (maxValueSizeMb <= 0 || maxValueSizeMb > MAX_VALUE_SIZE_MB_LIMIT) {
                throw new IllegalArgumentException("maxValueSizeMb must be in 1.." + MAX_VALUE_SIZE_MB_LIMIT
                        + ": " + maxValueSizeMb);
            }
            return new KvStorageConfig(this);
        }
    }
}
