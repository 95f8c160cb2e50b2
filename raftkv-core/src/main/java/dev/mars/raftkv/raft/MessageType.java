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
package dev.mars.raftkv.raft;

/**
 * Protocol message kinds exchanged between consensus cores.
 */
public enum MessageType {
    REQUEST_VOTE((byte) 1),
    REQUEST_VOTE_RESPONSE((byte) 2),
    APPEND_ENTRIES((byte) 3),
    APPEND_ENTRIES_RESPONSE((byte) 4),
    INSTALL_SNAPSHOT((byte) 5);

    private final byte code;

    MessageType(byte code) {
        this.code = code;
    }

    /** Wire code of this type. */
    public byte code() {
        return code;
    }

    public static MessageType fromCode(byte code) {
        for (MessageType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown message type code: " + code);
    }
}
