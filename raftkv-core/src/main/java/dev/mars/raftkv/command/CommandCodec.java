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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Textual encoding of {@link Command}s inside log entry payloads.
 * <p>
 * <b>Grammar:</b>
 * <pre>
 * SET &lt;key&gt; &lt;value&gt;
 * DELETE &lt;key&gt;
 * </pre>
 * Tokens are separated by whitespace, so neither keys nor values may contain
 * whitespace. {@link #encode(Command)} refuses such input rather than producing
 * bytes that would decode to something else.
 * <p>
 * {@link #decode(byte[])} is total: it never throws, and anything that is not
 * one of the two shapes (wrong verb, wrong token count, invalid UTF-8, empty
 * payload) decodes to {@link Optional#empty()}. Callers treat that as a no-op.
 */
public final class CommandCodec {

    private static final Logger LOG = LoggerFactory.getLogger(CommandCodec.class);

    static final String VERB_SET = "SET";
    static final String VERB_DELETE = "DELETE";

    /** Unicode White_Space; {@link #encode} refuses tokens containing it, so decode splits them back. */
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private CommandCodec() {
    }

    /**
     * Produces the canonical textual form of a command.
     *
     * @throws IllegalArgumentException if the key or value is empty or contains whitespace
     */
    public static byte[] encode(Command command) {
        String text;
        if (command instanceof Command.Set set) {
            requireToken("key", set.key());
            requireToken("value", set.value());
            text = VERB_SET + ' ' + set.key() + ' ' + set.value();
        } else if (command instanceof Command.Delete delete) {
            requireToken("key", delete.key());
            text = VERB_DELETE + ' ' + delete.key();
        } else {
            throw new IllegalArgumentException("Unknown command type: " + command);
        }
        return text.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Parses a payload back into a command.
     *
     * @param payload the raw entry payload, may be null
     * @return the command, or empty if the payload is not a recognised command
     */
    public static Optional<Command> decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return Optional.empty();
        }

        String text;
        try {
            CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT);
            text = decoder.decode(ByteBuffer.wrap(payload)).toString();
        } catch (CharacterCodingException e) {
            LOG.trace("Payload of {} bytes is not valid UTF-8, ignoring", payload.length);
            return Optional.empty();
        }

        String[] tokens = Arrays.stream(WHITESPACE.split(text))
                .filter(t -> !t.isEmpty())
                .toArray(String[]::new);
        if (tokens.length == 0) {
            return Optional.empty();
        }

        if (tokens.length == 3 && VERB_SET.equals(tokens[0])) {
            return Optional.of(new Command.Set(tokens[1], tokens[2]));
        }
        if (tokens.length == 2 && VERB_DELETE.equals(tokens[0])) {
            return Optional.of(new Command.Delete(tokens[1]));
        }

        LOG.trace("Unrecognised command '{}' ({} tokens), ignoring", tokens[0], tokens.length);
        return Optional.empty();
    }

    private static void requireToken(String what, String token) {
        if (token.isEmpty()) {
            throw new IllegalArgumentException(what + " must not be empty");
        }
        if (WHITESPACE.matcher(token).find()) {
            throw new IllegalArgumentException(what + " must not contain whitespace: '" + token + "'");
        }
    }
}
