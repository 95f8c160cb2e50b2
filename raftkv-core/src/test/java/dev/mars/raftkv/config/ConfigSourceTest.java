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
package dev.mars.raftkv.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ConfigSourceTest {

    private static final String KEY = "raftkv.test.configSourceValue";
    private static final String ENV = "RAFTKV_TEST_CONFIG_SOURCE_VALUE_UNSET";

    @AfterEach
    void tearDown() {
        System.clearProperty(KEY);
    }

    private static ConfigSource withFile(String value) {
        Properties file = new Properties();
        if (value != null) {
            file.setProperty(KEY, value);
        }
        return ConfigSource.of(file);
    }

    @Test
    void testResolve_NothingDefined_ReturnsNull() {
        assertNull(withFile(null).resolve(KEY, ENV));
    }

    @Test
    void testResolve_FileValueTrimmed() {
        assertEquals("abc", withFile("  abc ").resolve(KEY, ENV));
    }

    @Test
    void testResolve_BlankValuesIgnored() {
        System.setProperty(KEY, "   ");

        assertEquals("file", withFile("file").resolve(KEY, ENV));
    }

    @Test
    void testResolve_SystemPropertyWins() {
        System.setProperty(KEY, "sys");

        assertEquals("sys", withFile("file").resolve(KEY, ENV));
    }

    @Test
    void testTypedResolvers() {
        assertEquals(42, withFile("42").resolveInt(KEY, ENV, 7));
        assertEquals(7, withFile("x").resolveInt(KEY, ENV, 7));
        assertEquals(5_000_000_000L, withFile("5000000000").resolveLong(KEY, ENV, 1L));
        assertEquals(1L, withFile(null).resolveLong(KEY, ENV, 1L));
        assertFalse(withFile("false").resolveBoolean(KEY, ENV, true));
        assertTrue(withFile(null).resolveBoolean(KEY, ENV, true));
        assertEquals(Path.of("/tmp/x"), withFile("/tmp/x").resolvePath(KEY, ENV, Path.of("/d")));
        assertEquals(Path.of("/d"), withFile(null).resolvePath(KEY, ENV, Path.of("/d")));
    }
}
