// file: storage/src/main/java/io/revlite/storage/RecordCodec.java
package io.revlite.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.revlite.core.CanonicalJson;
import io.revlite.core.ContentHash;
import io.revlite.core.Revision;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records and snapshot entries.
 * <p>
 * Full on-disk layout of a WAL record:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xAE71
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes, little-endian)]
 *     - the:   int32 len + UTF-8 bytes
 *     - of:    int32 len + UTF-8 bytes
 *     - since: int64
 *     - cause: int32 len + UTF-8 bytes (len == -1 => none)
 *     - is:    int32 len + JSON bytes  (len == -1 => none)
 * <p>
 * Snapshots store the bare payloads, length-prefixed.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0xAE71;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    private RecordCodec() {
    }

    /** Encode a revision into header+payload bytes ready for append. */
    static byte[] encode(Revision revision) {
        byte[] payload = encodePayload(revision);
        ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        header.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));

        byte[] out = new byte[HEADER_BYTES + payload.length];
        System.arraycopy(header.array(), 0, out, 0, HEADER_BYTES);
        System.arraycopy(payload, 0, out, HEADER_BYTES, payload.length);
        return out;
    }

    static byte[] encodePayload(Revision r) {
        byte[] the = r.the().getBytes(StandardCharsets.UTF_8);
        byte[] of = r.of().getBytes(StandardCharsets.UTF_8);
        byte[] cause = r.cause() == null ? null : r.cause().value().getBytes(StandardCharsets.UTF_8);
        byte[] is = r.is() == null ? null : CanonicalJson.bytes(r.is());

        int size = 4 + the.length
                + 4 + of.length
                + 8
                + 4 + (cause == null ? 0 : cause.length)
                + 4 + (is == null ? 0 : is.length);

        ByteBuffer b = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        writeBytes(b, the);
        writeBytes(b, of);
        b.putLong(r.since());
        writeBytes(b, cause);
        writeBytes(b, is);
        return b.array();
    }

    /** Decode a full payload (not including header). */
    static Revision decode(byte[] payload) {
        ByteBuffer b = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
        String the = readString(b);
        String of = readString(b);
        long since = b.getLong();
        byte[] cause = readBytes(b);
        byte[] is = readBytes(b);
        return new Revision(
                the,
                of,
                is == null ? null : parse(is),
                cause == null ? null : ContentHash.parse(new String(cause, StandardCharsets.UTF_8)),
                since);
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    // ----------------- helpers -----------------

    private static JsonNode parse(byte[] json) {
        try {
            return CanonicalJson.MAPPER.readTree(json);
        } catch (IOException e) {
            throw new IllegalStateException("Corrupt value in record", e);
        }
    }

    private static void writeBytes(ByteBuffer b, byte[] data) {
        if (data == null) {
            b.putInt(-1);
            return;
        }
        b.putInt(data.length).put(data);
    }

    private static byte[] readBytes(ByteBuffer b) {
        int len = b.getInt();
        if (len == -1) return null;
        byte[] out = new byte[len];
        b.get(out);
        return out;
    }

    private static String readString(ByteBuffer b) {
        byte[] s = readBytes(b);
        if (s == null) throw new IllegalStateException("Missing string field in record");
        return new String(s, StandardCharsets.UTF_8);
    }
}
