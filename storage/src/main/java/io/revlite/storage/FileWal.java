// file: storage/src/main/java/io/revlite/storage/FileWal.java
package io.revlite.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL that appends header+payload records to segment files
 * ("00000001.log", "00000002.log", ...).
 * <p>
 * Properties:
 *  - On construction, creates the directory if needed and opens the newest
 *    segment for append (or creates the first one).
 *  - append() writes the bytes and calls force(true) before returning.
 *  - rotateIfNeeded() starts the next segment once the current one holds
 *    at least rotateBytes.
 *  - reset() deletes every segment and reopens an empty first segment.
 *  - The reader walks all segments in order and stops at the first truncated
 *    header/payload or bad CRC.
 */
public class FileWal implements Wal {
    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;

    public FileWal(Path dir, long rotateBytes) {
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new RuntimeException(e); }
        openNewestOrCreate();
    }

    @Override
    public synchronized void append(byte[] serializedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            throw new RuntimeException("WAL append failed", e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        try {
            ch.close();
            current = dir.resolve(segmentName(segmentIndex(current) + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) {
            throw new RuntimeException("WAL rotation failed", e);
        }
    }

    @Override
    public synchronized void reset() {
        try {
            ch.close();
            for (Path seg : segments(dir)) {
                Files.deleteIfExists(seg);
            }
            current = dir.resolve(segmentName(1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = 0;
        } catch (IOException e) {
            throw new RuntimeException("WAL reset failed", e);
        }
    }

    @Override
    public WalReader openReader() {
        return new Reader(segments(dir));
    }

    @Override
    public synchronized void close() {
        try {
            if (ch != null) ch.close();
        } catch (IOException e) {
            throw new RuntimeException("WAL close failed", e);
        }
    }

    private void openNewestOrCreate() {
        try {
            List<Path> existing = segments(dir);
            current = existing.isEmpty()
                    ? dir.resolve(segmentName(1))
                    : existing.get(existing.size() - 1);
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            writtenInSegment = ch.size();
            ch.position(writtenInSegment);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    // ---------- helpers ----------

    private static List<Path> segments(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    private static String segmentName(int index) {
        return String.format("%08d.log", index);
    }

    private static int segmentIndex(Path segment) {
        return Integer.parseInt(segment.getFileName().toString().replace(".log", ""));
    }

    /** Sequential reader over every segment, used during recovery. */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segment = -1;
        private FileChannel ch;
        private long pos;
        private boolean stopped;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            try {
                while (!stopped) {
                    if (ch == null && !openNextSegment()) {
                        return null;
                    }
                    ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
                    int read = ch.read(hdr, pos);
                    if (read <= 0) {
                        // clean end of this segment
                        ch.close();
                        ch = null;
                        continue;
                    }
                    if (read < RecordCodec.HEADER_BYTES) return stop();
                    hdr.flip();
                    short magic = hdr.getShort();
                    byte ver = hdr.get();
                    int len = hdr.getInt();
                    int crc = hdr.getInt();
                    if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return stop();
                    ByteBuffer payload = ByteBuffer.allocate(len);
                    int r2 = ch.read(payload, pos + RecordCodec.HEADER_BYTES);
                    if (r2 < len) return stop();
                    byte[] bytes = payload.array();
                    if (RecordCodec.crc32(bytes) != crc) return stop();
                    pos += RecordCodec.HEADER_BYTES + len;
                    return bytes;
                }
                return null;
            } catch (IOException e) {
                throw new RuntimeException(e);
            }
        }

        private boolean openNextSegment() throws IOException {
            segment++;
            if (segment >= segments.size()) {
                stopped = true;
                return false;
            }
            ch = FileChannel.open(segments.get(segment), READ);
            pos = 0;
            return true;
        }

        private byte[] stop() {
            stopped = true;
            return null;
        }

        @Override
        public void close() {
            try {
                if (ch != null) ch.close();
            } catch (IOException e) {
                throw new RuntimeException(e);
            }
        }
    }
}
