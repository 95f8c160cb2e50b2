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

import java.util.Objects;

/**
 * A key-value mutation carried inside a committed log entry.
 * <p>
 * Two shapes exist: {@link Set} and {@link Delete}. Anything else a log
 * entry might contain is not a command and decodes to absence.
 *
 * @see CommandCodec
 */
public interface Command {

    /** The key the command mutates. */
    String key();

    /**
     * Maps {@code key} to {@code value}, replacing any previous mapping.
     */
    record Set(String key, String value) implements Command {
        public Set {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * Removes the mapping for {@code key}. Deleting an absent key is not an error.
     */
    record Delete(String key) implements Command {
        public Delete {
            Objects.requireNonNull(key, "key");
        }
    }
}
