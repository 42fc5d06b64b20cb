// file: src/main/java/io/leafsync/core/doc/DocumentCodec.java
package io.leafsync.core.doc;

import io.leafsync.core.VersionVector;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Binary form of exported document updates (snapshots and deltas).
 * <p>
 * Layout (big-endian):
 * <p>
 *   [HEADER]
 *     - magic   (2B)  = 0x1EAF
 *     - version (1B)  = 1
 *     - mode    (1B)  = 0 snapshot, 1 delta
 *     - from    version vector (see {@link VersionVector#encode()})
 *     - end     version vector
 * <p>
 *   [CHANGES]
 *     - count:  int32
 *       repeated 'count' times:
 *         - peerId:    int32 len + UTF-8 bytes
 *         - counter:   int64
 *         - lamport:   int64
 *         - container: int32 len + UTF-8 bytes
 *         - tag:       byte (1 map put, 2 map delete, 3 counter add, 4 list push, 5 list delete)
 *         - payload:   tag specific
 * <p>
 *   [TRAILER]
 *     - crc32 (4B) over everything before it
 * <p>
 * Changes are written in the order given; callers pass them sorted by (peer, counter)
 * so equal change sets produce equal bytes.
 */
public final class DocumentCodec {
    static final short MAGIC = (short) 0x1EAF;
    static final byte VERSION = 1;

    private static final byte TAG_MAP_PUT = 1;
    private static final byte TAG_MAP_DELETE = 2;
    private static final byte TAG_COUNTER_ADD = 3;
    private static final byte TAG_LIST_PUSH = 4;
    private static final byte TAG_LIST_DELETE = 5;

    /** A fully decoded update. */
    public record DecodedUpdate(UpdateHeader header, List<Change> changes) {}

    private DocumentCodec() {
        // utility
    }

    public static byte[] encode(UpdateHeader header, List<Change> changes) {
        var bytes = new ByteArrayOutputStream();
        try (var out = new DataOutputStream(bytes)) {
            out.writeShort(MAGIC);
            out.writeByte(VERSION);
            out.writeByte(header.mode() == UpdateHeader.Mode.SNAPSHOT ? 0 : 1);
            header.from().writeTo(out);
            header.end().writeTo(out);
            out.writeInt(changes.size());
            for (Change c : changes) {
                writeString(out, c.id().peerId());
                out.writeLong(c.id().counter());
                out.writeLong(c.lamport());
                writeString(out, c.container());
                writeOp(out, c.op());
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        byte[] body = bytes.toByteArray();
        return ByteBuffer.allocate(body.length + 4).put(body).putInt(crc32(body, body.length)).array();
    }

    /** Decode only the header; the CRC is still verified. */
    public static UpdateHeader readHeader(byte[] update) {
        return readHeader(verified(update));
    }

    public static DecodedUpdate decode(byte[] update) {
        ByteBuffer b = verified(update);
        UpdateHeader header = readHeader(b);
        try {
            int count = b.getInt();
            if (count < 0 || count > b.remaining()) throw new DocumentFormatException("bad change count: " + count);
            List<Change> changes = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                String peer = readString(b);
                long counter = b.getLong();
                long lamport = b.getLong();
                String container = readString(b);
                Op op = readOp(b);
                changes.add(new Change(new ChangeId(peer, counter), lamport, container, op));
            }
            if (b.remaining() != 4) throw new DocumentFormatException("trailing bytes in update");
            return new DecodedUpdate(header, List.copyOf(changes));
        } catch (BufferUnderflowException e) {
            throw new DocumentFormatException("truncated update", e);
        } catch (DocumentFormatException e) {
            throw e;
        } catch (IllegalArgumentException | NullPointerException e) {
            // record invariants (counter > 0, lamport > 0, ...) violated by the payload
            throw new DocumentFormatException("invalid change in update: " + e.getMessage(), e);
        }
    }

    // ----------------- helpers -----------------

    private static ByteBuffer verified(byte[] update) {
        if (update == null || update.length < 2 + 1 + 1 + 4 + 4 + 4 + 4) {
            throw new DocumentFormatException("update too short");
        }
        int expected = ByteBuffer.wrap(update, update.length - 4, 4).getInt();
        if (expected != crc32(update, update.length - 4)) {
            throw new DocumentFormatException("update checksum mismatch");
        }
        return ByteBuffer.wrap(update);
    }

    private static UpdateHeader readHeader(ByteBuffer b) {
        try {
            if (b.getShort() != MAGIC) throw new DocumentFormatException("bad magic");
            byte version = b.get();
            if (version != VERSION) throw new DocumentFormatException("unsupported update version " + version);
            UpdateHeader.Mode mode = switch (b.get()) {
                case 0 -> UpdateHeader.Mode.SNAPSHOT;
                case 1 -> UpdateHeader.Mode.DELTA;
                default -> throw new DocumentFormatException("unknown update mode");
            };
            VersionVector from = VersionVector.readFrom(b);
            VersionVector end = VersionVector.readFrom(b);
            return new UpdateHeader(mode, from, end);
        } catch (BufferUnderflowException e) {
            throw new DocumentFormatException("truncated update header", e);
        } catch (DocumentFormatException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new DocumentFormatException("invalid version vector in update: " + e.getMessage(), e);
        }
    }

    private static void writeOp(DataOutputStream out, Op op) throws IOException {
        if (op instanceof Op.MapPut put) {
            out.writeByte(TAG_MAP_PUT);
            writeString(out, put.key());
            writeString(out, put.value());
        } else if (op instanceof Op.MapDelete del) {
            out.writeByte(TAG_MAP_DELETE);
            writeString(out, del.key());
        } else if (op instanceof Op.CounterAdd add) {
            out.writeByte(TAG_COUNTER_ADD);
            out.writeLong(add.amount());
        } else if (op instanceof Op.ListPush push) {
            out.writeByte(TAG_LIST_PUSH);
            writeString(out, push.value());
        } else if (op instanceof Op.ListDelete del) {
            out.writeByte(TAG_LIST_DELETE);
            writeString(out, del.target().peerId());
            out.writeLong(del.target().counter());
        } else {
            throw new IllegalStateException("unhandled op " + op);
        }
    }

    private static Op readOp(ByteBuffer b) {
        byte tag = b.get();
        return switch (tag) {
            case TAG_MAP_PUT -> new Op.MapPut(readString(b), readString(b));
            case TAG_MAP_DELETE -> new Op.MapDelete(readString(b));
            case TAG_COUNTER_ADD -> new Op.CounterAdd(b.getLong());
            case TAG_LIST_PUSH -> new Op.ListPush(readString(b));
            case TAG_LIST_DELETE -> new Op.ListDelete(new ChangeId(readString(b), b.getLong()));
            default -> throw new DocumentFormatException("unknown op tag " + tag);
        };
    }

    private static void writeString(DataOutputStream out, String s) throws IOException {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(bytes.length);
        out.write(bytes);
    }

    private static String readString(ByteBuffer b) {
        int len = b.getInt();
        if (len < 0 || len > b.remaining()) throw new DocumentFormatException("bad string length: " + len);
        byte[] bytes = new byte[len];
        b.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    static int crc32(byte[] bytes, int length) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, length);
        return (int) crc.getValue();
    }
}
