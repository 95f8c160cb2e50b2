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

import dev.mars.raftkv.command.Command;
import dev.mars.raftkv.command.CommandCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Replicated state machine properties of the storage engine: identical
 * command sequences give identical state, snapshots carry the whole state,
 * and payloads that are not commands change nothing.
 */
class ReplicatedStateTest {

    @TempDir
    Path tempDir;

    private final List<FileKvStorage> opened = new ArrayList<>();

    @AfterEach
    void tearDown() {
        opened.forEach(FileKvStorage::close);
    }

    private FileKvStorage open(String name) {
        FileKvStorage storage = new FileKvStorage(KvStorageConfig.builder()
                .syncEnabled(false)
                .minFreeSpaceMb(0)
                .build());
        storage.open(tempDir.resolve(name));
        opened.add(storage);
        return storage;
    }

    /** A random mix of sets and deletes over a small key space, so deletes hit. */
    private static List<Command> randomCommands(long seed, int count) {
        Random random = new Random(seed);
        List<Command> commands = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String key = "k" + random.nextInt(20);
            if (random.nextInt(4) == 0) {
                commands.add(new Command.Delete(key));
            } else {
                commands.add(new Command.Set(key, "v" + random.nextInt(1000)));
            }
        }
        return commands;
    }

    private static void applyAll(KvStorage storage, List<Command> commands) {
        long index = 1;
        for (Command command : commands) {
            storage.apply(index++, 1, command);
        }
    }

    @Test
    void testSameCommandSequence_SameState() {
        List<Command> commands = randomCommands(42, 300);
        FileKvStorage a = open("a");
        FileKvStorage b = open("b");

        applyAll(a, commands);
        applyAll(b, commands);

        assertArrayEquals(a.snapshot(), b.snapshot());
        assertEquals(a.size(), b.size());
    }

    @Test
    void testSnapshotRoundTrip_ReproducesEveryLiveKey() {
        List<Command> commands = randomCommands(7, 200);
        FileKvStorage source = open("source");
        applyAll(source, commands);

        Map<String, String> expected = new HashMap<>();
        for (Command command : commands) {
            if (command instanceof Command.Set set) {
                expected.put(set.key(), set.value());
            } else {
                expected.remove(command.key());
            }
        }

        FileKvStorage target = open("target");
        target.loadSnapshot(source.snapshot());

        assertEquals(expected.size(), target.size());
        for (int i = 0; i < 20; i++) {
            String key = "k" + i;
            Optional<String> actual = target.get(key).map(v -> new String(v, StandardCharsets.UTF_8));
            assertEquals(Optional.ofNullable(expected.get(key)), actual, key);
        }
        assertEquals(source.lastAppliedIndex(), target.lastAppliedIndex());
    }

    @Test
    void testDeleteAfterSet_KeyAbsent() {
        FileKvStorage storage = open("s");

        storage.apply(1, 1, new Command.Set("k", "v"));
        storage.apply(2, 1, new Command.Delete("k"));

        assertTrue(storage.get("k").isEmpty());
    }

    @Test
    void testMalformedPayload_NoMutation() {
        FileKvStorage storage = open("s");
        storage.apply(1, 1, new Command.Set("onlytoken", "kept"));
        byte[] before = storage.snapshot();

        Optional<Command> decoded = CommandCodec.decode("SET onlytoken".getBytes(StandardCharsets.UTF_8));
        decoded.ifPresent(c -> storage.apply(2, 1, c));

        assertTrue(decoded.isEmpty());
        assertArrayEquals(before, storage.snapshot());
    }
}
