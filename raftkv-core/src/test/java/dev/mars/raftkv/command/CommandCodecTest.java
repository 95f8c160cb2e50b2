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
package dev.mars.raftkv.command;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link CommandCodec}.
 */
class CommandCodecTest {

    private static Optional<Command> decode(String text) {
        return CommandCodec.decode(text.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("Decoding")
    class Decoding {

        @Test
        void testDecode_Set() {
            assertEquals(Optional.of(new Command.Set("name", "alice")), decode("SET name alice"));
        }

        @Test
        void testDecode_Delete() {
            assertEquals(Optional.of(new Command.Delete("name")), decode("DELETE name"));
        }

        @Test
        void testDecode_ExtraWhitespaceTolerated() {
            assertEquals(Optional.of(new Command.Set("k", "v")), decode("  SET\tk   v \n"));
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "",
                "   ",
                "SET k",
                "SET k v extra",
                "DELETE",
                "DELETE k v",
                "GET k",
                "set k v",
                "PUT k v"
        })
        void testDecode_NotACommand_ReturnsEmpty(String text) {
            assertEquals(Optional.empty(), decode(text));
        }

        @Test
        void testDecode_NullAndEmptyPayload_ReturnEmpty() {
            assertEquals(Optional.empty(), CommandCodec.decode(null));
            assertEquals(Optional.empty(), CommandCodec.decode(new byte[0]));
        }

        @Test
        void testDecode_InvalidUtf8_ReturnsEmpty() {
            byte[] payload = {'S', 'E', 'T', ' ', 'k', ' ', (byte) 0xC3, (byte) 0x28};

            assertEquals(Optional.empty(), CommandCodec.decode(payload));
        }

        @Test
        void testDecode_UnicodeSpaceSeparatesTokens() {
            // EM SPACE and NO-BREAK SPACE count as separators, so these carry too many tokens
            assertEquals(Optional.empty(), decode("SET k\u2003x v"));
            assertEquals(Optional.empty(), decode("DELETE a\u00A0b"));
            assertEquals(Optional.of(new Command.Set("k", "v")), decode("\u00A0SET\u2003k\u3000v\u2028"));
        }

        @Test
        void testDecode_MultibyteUtf8() {
            assertEquals(Optional.of(new Command.Set("città", "日本")), decode("SET città 日本"));
        }
    }

    @Nested
    @DisplayName("Encoding")
    class Encoding {

        @Test
        void testEncode_CanonicalForm() {
            assertEquals("SET k v",
                    new String(CommandCodec.encode(new Command.Set("k", "v")), StandardCharsets.UTF_8));
            assertEquals("DELETE k",
                    new String(CommandCodec.encode(new Command.Delete("k")), StandardCharsets.UTF_8));
        }

        @Test
        void testEncode_ThenDecode_YieldsSameCommand() {
            Command command = new Command.Set("user:42", "{\"a\":1}");

            assertEquals(Optional.of(command), CommandCodec.decode(CommandCodec.encode(command)));
        }

        @Test
        void testEncode_WhitespaceInToken_Rejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> CommandCodec.encode(new Command.Set("k", "two words")));
            assertThrows(IllegalArgumentException.class,
                    () -> CommandCodec.encode(new Command.Delete("a\tb")));
            assertThrows(IllegalArgumentException.class,
                    () -> CommandCodec.encode(new Command.Set("k", "no\u00A0break")));
        }

        @Test
        void testEncode_OtherCommandImplementation_Rejected() {
            Command touch = () -> "k";

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> CommandCodec.encode(touch));
            assertTrue(e.getMessage().startsWith("Unknown command type"));
        }

        @Test
        void testEncode_EmptyToken_Rejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> CommandCodec.encode(new Command.Set("", "v")));
            assertThrows(IllegalArgumentException.class,
                    () -> CommandCodec.encode(new Command.Set("k", "")));
        }

        @Test
        void testCommand_NullFields_Rejected() {
            assertThrows(NullPointerException.class, () -> new Command.Set(null, "v"));
            assertThrows(NullPointerException.class, () -> new Command.Delete(null));
        }
    }
}
