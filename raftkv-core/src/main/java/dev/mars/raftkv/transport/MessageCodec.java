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
package dev.mars.raftkv.transport;

import dev.mars.raftkv.raft.EntryType;
import dev.mars.raftkv.raft.LogEntry;
import dev.mars.raftkv.raft.Message;
import dev.mars.raftkv.raft.MessageType;
import dev.mars.raftkv.raft.SnapshotData;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32C;

/**
 * Binary framing of protocol {@link Message}s on a byte stream.
 * <p>
 * <b>Frame:</b>
 * <pre>
 * MAGIC(4) + VERSION(2) + BODY_LEN(4) + BODY + CRC32C(4)
 * </pre>
 * The CRC covers header and body.
 * <p>
 * <b>Body:</b>
 * <pre>
 * TYPE(1) FROM(8) TO(8) TERM(8) LOG_TERM(8) INDEX(8) COMMIT(8) REJECT(1) REJECT_HINT(8)
 * ENTRY_COUNT(4) { INDEX(8) TERM(8) ENTRY_TYPE(1) DATA_LEN(4) DATA }*
 * HAS_SNAPSHOT(1) [ INDEX(8) TERM(8) VOTER_COUNT(4) VOTER(8)* DATA_LEN(4) DATA ]
 * </pre>
 */
public final class MessageCodec {

    /** Magic number: 'RKVM' in ASCII */
    static final int MAGIC = 0x524B564D;

    static final short VERSION = 1;

    /** Header size: MAGIC(4) + VERSION(2) + BODY_LEN(4) */
    static final int HEADER_SIZE = 4 + 2 + 4;

    static final int CRC_SIZE = 4;

    /** Upper bound on a body; snapshots travel in one frame. */
    public static final int MAX_BODY_BYTES = 128 * 1024 * 1024;

    private static final int FIXED_BODY_SIZE = 1 + 8 + 8 + 8 + 8 + 8 + 8 + 1 + 8 + 4 + 1;
    private static final int ENTRY_OVERHEAD = 8 + 8 + 1 + 4;

    private MessageCodec() {
    }

    // ========================================================================
    // Encode
    // ========================================================================

    public static byte[] encode(Message m) {
        long bodySize = FIXED_BODY_SIZE;
        for (LogEntry e : m.entries()) {
            bodySize += ENTRY_OVERHEAD + e.data().length;
        }
        SnapshotData snapshot = m.snapshot();
        if (snapshot != null) {
            bodySize += 8 + 8 + 4 + 8L * snapshot.voters().size() + 4 + snapshot.data().length;
        }
        if (bodySize > MAX_BODY_BYTES) {
            throw new IllegalArgumentException("Message body too large: " + bodySize + " bytes (max " + MAX_BODY_BYTES + ")");
        }

        ByteBuffer buf = ByteBuffer.allocate(HEADER_SIZE + (int) bodySize + CRC_SIZE);
        buf.putInt(MAGIC);
        buf.putShort(VERSION);
        buf.putInt((int) bodySize);

        buf.put(m.type().code());
        buf.putLong(m.from());
        buf.putLong(m.to());
        buf.putLong(m.term());
        buf.putLong(m.logTerm());
        buf.putLong(m.index());
        buf.putLong(m.commit());
        buf.put((byte) (m.reject() ? 1 : 0));
        buf.putLong(m.rejectHint());

        buf.putInt(m.entries().size());
        for (LogEntry e : m.entries()) {
            buf.putLong(e.index());
            buf.putLong(e.term());
            buf.put(e.type().code());
            buf.putInt(e.data().length);
            buf.put(e.data());
        }

        if (snapshot == null) {
            buf.put((byte) 0);
        } else {
            buf.put((byte) 1);
            buf.putLong(snapshot.index());
            buf.putLong(snapshot.term());
            buf.putInt(snapshot.voters().size());
            for (long voter : snapshot.voters()) {
                buf.putLong(voter);
            }
            buf.putInt(snapshot.data().length);
            buf.put(snapshot.data());
        }

        CRC32C crc = new CRC32C();
        crc.update(buf.array(), 0, buf.position());
        buf.putInt((int) crc.getValue());
        return buf.array();
    }

    // ========================================================================
    // Decode
    // ========================================================================

    /**
     * Decodes one complete frame.
     *
     * @throws MessageFormatException if the frame is malformed
     */
    public static Message decode(byte[] frame) {
        if (frame == null || frame.length < HEADER_SIZE + CRC_SIZE) {
            throw new MessageFormatException("Frame too short: " + (frame == null ? "null" : frame.length + " bytes"));
        }
        ByteBuffer header = ByteBuffer.wrap(frame, 0, HEADER_SIZE);
        int bodyLen = validateHeader(header.getInt(), header.getShort(), header.getInt());
        if (frame.length != HEADER_SIZE + bodyLen + CRC_SIZE) {
            throw new MessageFormatException("Frame length " + frame.length + " does not match body length " + bodyLen);
        }
        verifyCrc(frame);
        return decodeBody(ByteBuffer.wrap(frame, HEADER_SIZE, bodyLen));
    }

    /**
     * Reads the next frame from a stream.
     *
     * @return the message, or null on a clean end of stream before any byte of a new frame
     * @throws MessageFormatException if the frame is malformed
     * @throws IOException            on I/O failure or a stream that ends mid-frame
     */
    public static Message read(InputStream in) throws IOException {
        DataInputStream data = in instanceof DataInputStream d ? d : new DataInputStream(in);

        int first = data.read();
        if (first < 0) {
            return null;
        }
        byte[] headerBytes = new byte[HEADER_SIZE];
        headerBytes[0] = (byte) first;
        data.readFully(headerBytes, 1, HEADER_SIZE - 1);

        ByteBuffer header = ByteBuffer.wrap(headerBytes);
        int bodyLen = validateHeader(header.getInt(), header.getShort(), header.getInt());

        byte[] frame = new byte[HEADER_SIZE + bodyLen + CRC_SIZE];
        System.arraycopy(headerBytes, 0, frame, 0, HEADER_SIZE);
        try {
            data.readFully(frame, HEADER_SIZE, bodyLen + CRC_SIZE);
        } catch (EOFException e) {
            throw new EOFException("Stream ended inside a " + bodyLen + " byte frame");
        }
        verifyCrc(frame);
        return decodeBody(ByteBuffer.wrap(frame, HEADER_SIZE, bodyLen));
    }

    private static int validateHeader(int magic, short version, int bodyLen) {
        if (magic != MAGIC) {
            throw new MessageFormatException("Bad magic: 0x" + Integer.toHexString(magic));
        }
        if (version != VERSION) {
            throw new MessageFormatException("Unsupported version: " + version);
        }
        if (bodyLen < FIXED_BODY_SIZE || bodyLen > MAX_BODY_BYTES) {
            throw new MessageFormatException("Body length out of range: " + bodyLen);
        }
        return bodyLen;
    }

    private static void verifyCrc(byte[] frame) {
        int crcOffset = frame.length - CRC_SIZE;
        CRC32C crc = new CRC32C();
        crc.update(frame, 0, crcOffset);
        int stored = ByteBuffer.wrap(frame).getInt(crcOffset);
        if ((int) crc.getValue() != stored) {
            throw new MessageFormatException("CRC mismatch: stored=" + stored + ", computed=" + (int) crc.getValue());
        }
    }

    private static Message decodeBody(ByteBuffer buf) {
        try {
            MessageType type = MessageType.fromCode(buf.get());
            long from = buf.getLong();
            long to = buf.getLong();
            long term = buf.getLong();
            long logTerm = buf.getLong();
            long index = buf.getLong();
            long commit = buf.getLong();
            boolean reject = buf.get() != 0;
            long rejectHint = buf.getLong();

            int entryCount = buf.getInt();
            if (entryCount < 0 || (long) entryCount * ENTRY_OVERHEAD > buf.remaining()) {
                throw new MessageFormatException("Invalid entry count: " + entryCount);
            }
            List<LogEntry> entries = new ArrayList<>(entryCount);
            for (int i = 0; i < entryCount; i++) {
                long entryIndex = buf.getLong();
                long entryTerm = buf.getLong();
                EntryType entryType = EntryType.fromCode(buf.get());
                entries.add(new LogEntry(entryIndex, entryTerm, entryType, readBytes(buf)));
            }

            SnapshotData snapshot = null;
            if (buf.get() != 0) {
                long snapIndex = buf.getLong();
                long snapTerm = buf.getLong();
                int voterCount = buf.getInt();
                if (voterCount < 0 || (long) voterCount * 8 > buf.remaining()) {
                    throw new MessageFormatException("Invalid voter count: " + voterCount);
                }
                List<Long> voters = new ArrayList<>(voterCount);
                for (int i = 0; i < voterCount; i++) {
                    voters.add(buf.getLong());
                }
                snapshot = new SnapshotData(snapIndex, snapTerm, voters, readBytes(buf));
            }

            if (buf.hasRemaining()) {
                throw new MessageFormatException(buf.remaining() + " trailing bytes after message body");
            }
            return new Message(type, from, to, term, logTerm, index, entries, commit, reject, rejectHint, snapshot);

        } catch (BufferUnderflowException e) {
            throw new MessageFormatException("Truncated message body", e);
        } catch (IllegalArgumentException e) {
            throw new MessageFormatException("Invalid message body: " + e.getMessage(), e);
        }
    }

    private static byte[] readBytes(ByteBuffer buf) {
        int len = buf.getInt();
        if (len < 0 || len > buf.remaining()) {
            throw new MessageFormatException("Invalid data length: " + len);
        }
        byte[] bytes = new byte[len];
        buf.get(bytes);
        return bytes;
    }
}
