// file: src/main/java/io/leafsync/storage/FileStorage.java
package io.leafsync.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * {@link StorageBackend} that stores each record in its own file.
 * <p>
 * Layout: key {@code [a, b, c]} lives at {@code <root>/a/b/c}.
 * <p>
 * Atomicity:
 *   - We write to "{@code <name>.tmp}" first, fsync it,
 *   - then move it over the final name using ATOMIC_MOVE.
 * Leftover ".tmp" files from a crash are ignored by reads.
 */
public final class FileStorage implements StorageBackend {
    private static final String TMP_SUFFIX = ".tmp";

    private final Path root;

    public FileStorage(Path root) {
        this.root = root;
        try { Files.createDirectories(root); } catch (IOException e) { throw new StorageException("cannot create " + root, e); }
    }

    @Override
    public Optional<byte[]> load(StorageKey key) {
        Path p = pathOf(key);
        try {
            return Optional.of(Files.readAllBytes(p));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("load failed for " + key, e);
        }
    }

    @Override
    public void save(StorageKey key, byte[] data) {
        Path dst = pathOf(key);
        Path tmp = dst.resolveSibling(dst.getFileName() + TMP_SUFFIX);
        try {
            Files.createDirectories(dst.getParent());
            try (var ch = java.nio.channels.FileChannel.open(tmp,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                var buf = java.nio.ByteBuffer.wrap(data);
                while (buf.hasRemaining()) ch.write(buf);
                ch.force(true);
            }
            Files.move(tmp, dst, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("save failed for " + key, e);
        }
    }

    @Override
    public void remove(StorageKey key) {
        try {
            Files.deleteIfExists(pathOf(key));
        } catch (IOException e) {
            throw new StorageException("remove failed for " + key, e);
        }
    }

    @Override
    public List<StoredEntry> loadRange(StorageKey prefix) {
        Path base = pathOf(prefix);
        if (!Files.exists(base)) return List.of();

        var out = new ArrayList<StoredEntry>();
        try (Stream<Path> files = Files.walk(base)) {
            List<Path> sorted = files
                    .filter(Files::isRegularFile)
                    .filter(p -> !p.getFileName().toString().endsWith(TMP_SUFFIX))
                    .toList();
            for (Path p : sorted) {
                out.add(new StoredEntry(keyOf(p), Files.readAllBytes(p)));
            }
        } catch (IOException e) {
            throw new StorageException("loadRange failed for " + prefix, e);
        }
        out.sort(Comparator.comparing(StoredEntry::key));
        return out;
    }

    @Override
    public void removeRange(StorageKey prefix) {
        Path base = pathOf(prefix);
        if (!Files.exists(base)) return;
        try (Stream<Path> files = Files.walk(base)) {
            // children before parents
            for (Path p : files.sorted(Comparator.reverseOrder()).toList()) {
                if (!p.equals(root)) Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            throw new StorageException("removeRange failed for " + prefix, e);
        }
    }

    private Path pathOf(StorageKey key) {
        Path p = root;
        for (String segment : key.segments()) {
            if (segment.equals(".") || segment.equals("..") || segment.contains("/") || segment.contains("\\")
                    || segment.endsWith(TMP_SUFFIX)) {
                throw new IllegalArgumentException("key segment not allowed in file storage: " + segment);
            }
            p = p.resolve(segment);
        }
        return p;
    }

    private StorageKey keyOf(Path file) {
        Path rel = root.relativize(file);
        var segments = new ArrayList<String>(rel.getNameCount());
        for (Path part : rel) segments.add(part.toString());
        return new StorageKey(segments);
    }
}
