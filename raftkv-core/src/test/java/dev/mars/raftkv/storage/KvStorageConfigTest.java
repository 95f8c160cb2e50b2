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
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link KvStorageConfig} resolution and validation.
 */
class KvStorageConfigTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty(KvStorageConfig.PROP_DATA_DIR);
        System.clearProperty(KvStorageConfig.PROP_SYNC_ENABLED);
        System.clearProperty(KvStorageConfig.PROP_MIN_FREE_SPACE_MB);
        System.clearProperty(KvStorageConfig.PROP_MAX_VALUE_SIZE_MB);
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Empty sources give the documented defaults")
        void testDefaults() {
            KvStorageConfig config = KvStorageConfig.builder(ConfigSource.of(new Properties())).build();

            assertEquals(Path.of(System.getProperty("user.home"), ".raftkv", "data"), config.dataDir());
            assertTrue(config.syncEnabled());
            assertEquals(64, config.minFreeSpaceMb());
            assertEquals(16, config.maxValueSizeMb());
            assertEquals(64L * 1024 * 1024, config.minFreeSpaceBytes());
            assertEquals(16 * 1024 * 1024, config.maxValueSizeBytes());
        }
    }

    @Nested
    @DisplayName("Layered resolution")
    class Layering {

        @Test
        @DisplayName("Properties file values are used when nothing overrides them")
        void testFileLayer() {
            Properties file = new Properties();
            file.setProperty("raftkv.dataDir", tempDir.toString());
            file.setProperty("raftkv.syncEnabled", "false");
            file.setProperty("raftkv.maxValueSizeMb", "4");

            KvStorageConfig config = KvStorageConfig.builder(ConfigSource.of(file)).build();

            assertEquals(tempDir, config.dataDir());
            assertFalse(config.syncEnabled());
            assertEquals(4, config.maxValueSizeMb());
        }

        @Test
        @DisplayName("System property beats the properties file")
        void testSystemPropertyBeatsFile() {
            Properties file = new Properties();
            file.setProperty("raftkv.minFreeSpaceMb", "10");
            System.setProperty(KvStorageConfig.PROP_MIN_FREE_SPACE_MB, "20");

            KvStorageConfig config = KvStorageConfig.builder(ConfigSource.of(file)).build();

            assertEquals(20, config.minFreeSpaceMb());
        }

        @Test
        @DisplayName("Builder value beats every other source")
        void testBuilderBeatsSystemProperty() {
            System.setProperty(KvStorageConfig.PROP_DATA_DIR, "/somewhere/else");

            KvStorageConfig config = KvStorageConfig.builder().dataDir(tempDir).build();

            assertEquals(tempDir, config.dataDir());
        }

        @Test
        @DisplayName("Non-numeric value falls back to default")
        void testInvalidNumberFallsBack() {
            System.setProperty(KvStorageConfig.PROP_MAX_VALUE_SIZE_MB, "lots");

            KvStorageConfig config = KvStorageConfig.builder(ConfigSource.of(new Properties())).build();

            assertEquals(16, config.maxValueSizeMb());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        void testNegativeMinFreeSpace_Rejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> KvStorageConfig.builder().minFreeSpaceMb(-1).build());
        }

        @Test
        void testZeroMaxValueSize_Rejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> KvStorageConfig.builder().maxValueSizeMb(0).build());
        }

        @Test
        void testMaxValueSizeOverflowingInt_Rejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> KvStorageConfig.builder().maxValueSizeMb(4096).build());
            assertEquals(1024L * 1024 * 1024, KvStorageConfig.builder().maxValueSizeMb(1024).build().maxValueSizeBytes());
        }

        @Test
        void testWithDataDir_KeepsOtherSettings() {
            KvStorageConfig config = KvStorageConfig.builder()
                    .dataDir(tempDir)
                    .syncEnabled(false)
                    .minFreeSpaceMb(1)
                    .maxValueSizeMb(2)
                    .build();

            KvStorageConfig moved = config.withDataDir(tempDir.resolve("data_3"));

            assertEquals(tempDir.resolve("data_3"), moved.dataDir());
            assertFalse(moved.syncEnabled());
            assertEquals(1, moved.minFreeSpaceMb());
            assertEquals(2, moved.maxValueSizeMb());
        }
    }
}
