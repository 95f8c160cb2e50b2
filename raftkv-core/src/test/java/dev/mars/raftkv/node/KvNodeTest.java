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
package dev.mars.raftkv.node;

import dev.mars.raftkv.config.ConfigSource;
import dev.mars.raftkv.storage.FileKvStorage;
import dev.mars.raftkv.storage.KvStorageConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class KvNodeTest {

    @TempDir
    Path tempDir;

    private static NodeConfig nodeConfig(String peers) {
        return NodeConfig.builder(ConfigSource.of(new Properties()))
                .nodeId(1)
                .peers(peers)
                .build();
    }

    private KvStorageConfig storageConfig(int maxValueSizeMb) {
        return KvStorageConfig.builder(ConfigSource.of(new Properties()))
                .dataDir(tempDir)
                .syncEnabled(false)
                .minFreeSpaceMb(0)
                .maxValueSizeMb(maxValueSizeMb)
                .build();
    }

    @Test
    void testMalformedPeerAddress_ReleasesStorage() {
        KvStorageConfig storageConfig = storageConfig(16);

        assertThrows(IllegalArgumentException.class,
                () -> new KvNode(nodeConfig("127.0.0.1:17101,no-port-here"), storageConfig));

        // The directory lock was given back, so the same directory opens again
        try (FileKvStorage reopened = new FileKvStorage(storageConfig)) {
            reopened.open(tempDir);
            assertEquals(0, reopened.lastAppliedIndex());
        }
    }

    @Test
    void testValueLimitTooLargeToReplicate_RejectedBeforeOpen() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new KvNode(nodeConfig("127.0.0.1:17101"), storageConfig(64)));

        assertTrue(e.getMessage().contains("maxValueSizeMb 64"));
        assertFalse(Files.exists(tempDir.resolve("kv.lock")));
    }
}
