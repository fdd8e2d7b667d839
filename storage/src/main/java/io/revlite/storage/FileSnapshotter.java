// file: storage/src/main/java/io/revlite/storage/FileSnapshotter.java
package io.revlite.storage;

import io.revlite.core.Revision;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Binary snapshot implementation backed by a single file per snapshot.
 * <p>
 * Format:
 *   int32 count
 *   repeated 'count' times:
 *     - key:      int32 len + UTF-8 bytes
 *     - revision: int32 len + RecordCodec payload
 * <p>
 * Atomicity:
 *   - written to "snapshot-&lt;id&gt;.bin.tmp" first,
 *   - then moved to "snapshot-&lt;id&gt;.bin" using ATOMIC_MOVE,
 *   - older snapshots are deleted afterwards.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final String PREFIX = "snapshot-";
    private static final String SUFFIX = ".bin";

    private final Path dir;
    private long lastId;

    public FileSnapshotter(Path dir) {
        this.dir = dir;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new RuntimeException(e); }
        List<Path> existing = snapshots();
        lastId = existing.isEmpty() ? 0 : idOf(existing.get(existing.size() - 1));
    }

    @Override
    public synchronized String writeSnapshot(Map<String, Revision> current) {
        // ids must sort after every earlier snapshot even within one millisecond
        long id = Math.max(lastId + 1, System.currentTimeMillis());
        String name = String.format("%s%020d%s", PREFIX, id, SUFFIX);
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (var out = new DataOutputStream(Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING))) {
            out.writeInt(current.size());
            for (Map.Entry<String, Revision> e : current.entrySet()) {
                writeBytes(out, e.getKey().getBytes(StandardCharsets.UTF_8));
                writeBytes(out, RecordCodec.encodePayload(e.getValue()));
            }
        } catch (IOException ex) {
            throw new RuntimeException(ex);
        }

        try {
            Files.move(tmp, dst, ATOMIC_MOVE);
            for (Path old : snapshots()) {
                if (!old.equals(dst)) Files.deleteIfExists(old);
            }
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
        lastId = id;
        return name;
    }

    @Override
    public LoadedSnapshot loadLatest() {
        List<Path> all = snapshots();
        if (all.isEmpty()) return null;
        Path snap = all.get(all.size() - 1);

        try (var in = new DataInputStream(Files.newInputStream(snap))) {
            int count = in.readInt();
            Map<String, Revision> map = new HashMap<>(count * 2);
            for (int i = 0; i < count; i++) {
                String key = new String(readBytes(in), StandardCharsets.UTF_8);
                map.put(key, RecordCodec.decode(readBytes(in)));
            }
            return new LoadedSnapshot(snap.getFileName().toString(), map);
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    // ---------- helpers ----------

    private List<Path> snapshots() {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith(PREFIX) && n.endsWith(SUFFIX);
                    })
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }

    private static long idOf(Path snapshot) {
        String n = snapshot.getFileName().toString();
        return Long.parseLong(n.substring(PREFIX.length(), n.length() - SUFFIX.length()));
    }

    private static void writeBytes(DataOutputStream out, byte[] v) throws IOException {
        out.writeInt(v.length);
        out.write(v);
    }

    private static byte[] readBytes(DataInputStream in) throws IOException {
        int len = in.readInt();
        byte[] b = in.readNBytes(len);
        if (b.length != len) throw new IOException("truncated snapshot");
        return b;
    }
}
