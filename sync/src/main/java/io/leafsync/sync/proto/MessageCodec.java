// file: sync/src/main/java/io/leafsync/sync/proto/MessageCodec.java
package io.leafsync.sync.proto;

import io.leafsync.core.EntityId;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.zip.CRC32;

/**
 * Binary framing for {@link SyncMessage}s. One frame per transport message.
 * <p>
 * Layout:
 * <p>
 *   [HEADER (12 bytes, little-endian)]
 *     - magic   (2B)  = 0x1EA5
 *     - version (1B)  = 1
 *     - tag     (1B)  = 1 subscribe, 2 unsubscribe, 3 send update, 4 handle update
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD]
 *     - entityId: 32 raw bytes
 *     - body:     int32 len + bytes (len == -1 => null), absent for unsubscribe
 * <p>
 * Decoding checks everything above and rejects trailing bytes.
 */
public final class MessageCodec {
    static final short MAGIC = (short) 0x1EA5;
    static final byte VERSION = 1;
    static final int HEADER_SIZE = 2 + 1 + 1 + 4 + 4;

    private MessageCodec() {
        // utility
    }

    public static byte[] encode(SyncMessage message) {
        byte[] body = body(message);
        boolean hasBody = !(message instanceof SyncMessage.Unsubscribe);
        int length = EntityId.LENGTH + (hasBody ? 4 + (body == null ? 0 : body.length) : 0);

        ByteBuffer payload = ByteBuffer.allocate(length).order(ByteOrder.LITTLE_ENDIAN);
        payload.put(message.entityId().bytes());
        if (hasBody) {
            if (body == null) {
                payload.putInt(-1);
            } else {
                payload.putInt(body.length).put(body);
            }
        }
        byte[] p = payload.array();

        ByteBuffer out = ByteBuffer.allocate(HEADER_SIZE + p.length).order(ByteOrder.LITTLE_ENDIAN);
        out.putShort(MAGIC).put(VERSION).put(message.tag()).putInt(p.length).putInt(crc32(p)).put(p);
        return out.array();
    }

    /**
     * @throws MalformedMessageException if the frame is truncated, corrupt or unknown.
     */
    public static SyncMessage decode(byte[] frame) {
        if (frame == null || frame.length < HEADER_SIZE) {
            throw new MalformedMessageException("frame too short");
        }
        ByteBuffer b = ByteBuffer.wrap(frame).order(ByteOrder.LITTLE_ENDIAN);
        short magic = b.getShort();
        if (magic != MAGIC) throw new MalformedMessageException("bad magic");
        byte version = b.get();
        if (version != VERSION) throw new MalformedMessageException("unsupported version " + version);
        byte tag = b.get();
        int length = b.getInt();
        int crc = b.getInt();
        if (length != b.remaining()) {
            throw new MalformedMessageException("length " + length + " does not match frame (" + b.remaining() + ")");
        }
        byte[] payload = new byte[length];
        b.get(payload);
        if (crc32(payload) != crc) throw new MalformedMessageException("checksum mismatch");

        try {
            ByteBuffer p = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
            byte[] idBytes = new byte[EntityId.LENGTH];
            p.get(idBytes);
            EntityId id = EntityId.of(idBytes);
            SyncMessage msg;
            switch (tag) {
                case 1 -> msg = new SyncMessage.Subscribe(id, readBytes(p));
                case 2 -> msg = new SyncMessage.Unsubscribe(id);
                case 3 -> msg = new SyncMessage.SendUpdate(id, requireBody(readBytes(p)));
                case 4 -> msg = new SyncMessage.HandleUpdate(id, requireBody(readBytes(p)));
                default -> throw new MalformedMessageException("unknown message tag " + tag);
            }
            if (p.hasRemaining()) throw new MalformedMessageException("trailing bytes after message");
            return msg;
        } catch (BufferUnderflowException | IllegalArgumentException e) {
            throw new MalformedMessageException("truncated payload", e);
        }
    }

    private static byte[] body(SyncMessage m) {
        if (m instanceof SyncMessage.Subscribe s) return s.version();
        if (m instanceof SyncMessage.SendUpdate s) return s.update();
        if (m instanceof SyncMessage.HandleUpdate h) return h.update();
        return null;
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        if (len == -1) return null;
        if (len < 0 || len > b.remaining()) throw new MalformedMessageException("bad body length " + len);
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }

    private static byte[] requireBody(byte[] body) {
        if (body == null) throw new MalformedMessageException("update body missing");
        return body;
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }
}
