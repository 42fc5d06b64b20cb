// file: src/main/java/io/leafsync/storage/StorageManager.java
package io.leafsync.storage;

import io.leafsync.core.CausalOrder;
import io.leafsync.core.Entity;
import io.leafsync.core.EntityId;
import io.leafsync.core.VersionVector;
import io.leafsync.core.doc.Document;
import io.leafsync.core.doc.DocumentFormatException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persists entity documents to a {@link StorageBackend} as content-addressed chunks.
 * <p>
 * Key layout: {@code [data, <entityId>, snapshot|incremental, <sha256 base32>]}.
 * <p>
 * Save protocol:
 *   1) skip if the document version equals the version last loaded or written
 *      (empty for an entity this manager has never seen),
 *   2) write the new snapshot chunk,
 *   3) delete the previously recorded chunks (failures are logged, the chunks just linger),
 *   4) replace the index entry.
 * A crash between 2) and 3) leaves old and new chunks side by side; loading merges
 * both, which is harmless because merge is idempotent.
 * <p>
 * Not thread-safe per entity: callers serialize saves of the same entity (the peer
 * does this by running them on its task queue).
 */
public final class StorageManager {
    private static final Logger log = Logger.getLogger(StorageManager.class.getName());

    static final String DATA = "data";

    private final StorageBackend backend;
    private final ChunkIndex index = new ChunkIndex();

    public StorageManager(StorageBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend");
    }

    /**
     * Merge every stored chunk of the entity into its document.
     *
     * Entries the backend reports without bytes are ignored.
     *
     * @return false if nothing readable was stored for the entity (it is left untouched).
     */
    public boolean load(Entity entity) {
        var snapshots = new ArrayList<StorageChunk>();
        var incrementals = new ArrayList<StorageChunk>();
        for (StoredEntry e : backend.loadRange(prefixOf(entity.id()))) {
            Optional<StorageChunk> chunk = toChunk(e);
            if (chunk.isEmpty()) continue;
            (chunk.get().kind() == ChunkKind.SNAPSHOT ? snapshots : incrementals).add(chunk.get());
        }
        if (snapshots.isEmpty() && incrementals.isEmpty()) return false;

        Document doc = entity.doc();
        var descriptors = new ArrayList<ChunkDescriptor>(snapshots.size() + incrementals.size());
        for (StorageChunk chunk : concat(snapshots, incrementals)) {
            descriptors.add(chunk.descriptor());
            try {
                doc.merge(chunk.data());
            } catch (DocumentFormatException ex) {
                // Still recorded, so the next save collects it.
                log.log(Level.WARNING, "skipping unreadable chunk " + chunk.descriptor().hash()
                        + " of entity " + entity.id(), ex);
            }
        }
        index.put(entity.id(), new ChunkIndex.Entry(descriptors, doc.version()));
        log.fine(() -> "loaded entity " + entity.id() + " from " + descriptors.size() + " chunk(s)");
        return true;
    }

    /**
     * Write the entity's current state as one snapshot chunk and drop the chunks it supersedes.
     *
     * @throws StorageException if writing the new chunk fails; the index is left untouched.
     */
    public void save(Entity entity) {
        EntityId id = entity.id();
        Optional<ChunkIndex.Entry> previous = index.get(id);
        List<ChunkDescriptor> oldChunks = previous.map(ChunkIndex.Entry::chunks).orElse(List.of());
        VersionVector persisted = previous.map(ChunkIndex.Entry::version).orElse(VersionVector.empty());

        Document doc = entity.doc();
        VersionVector version = doc.version();
        if (Document.compareVersions(version, persisted) == CausalOrder.EQUAL) {
            return;
        }

        byte[] snapshot = doc.exportSnapshot();
        String hash = ContentHashes.sha256Base32(snapshot);
        var descriptor = new ChunkDescriptor(ChunkKind.SNAPSHOT, hash, snapshot.length);
        backend.save(chunkKey(id, descriptor), snapshot);

        for (ChunkDescriptor old : oldChunks) {
            if (old.hash().equals(hash)) continue;
            try {
                backend.remove(chunkKey(id, old));
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "could not remove superseded chunk " + old.hash() + " of entity " + id, e);
            }
        }

        index.put(id, new ChunkIndex.Entry(List.of(descriptor), version));
        log.fine(() -> "saved entity " + id + " as " + hash + " (" + snapshot.length + " bytes)");
    }

    /** Remove every stored chunk of the entity and forget it. */
    public void delete(EntityId id) {
        backend.removeRange(prefixOf(id));
        index.remove(id);
        log.fine(() -> "deleted entity " + id);
    }

    /** What this manager last loaded or wrote for the entity. */
    public Optional<ChunkIndex.Entry> indexed(EntityId id) {
        return index.get(id);
    }

    static StorageKey prefixOf(EntityId id) {
        return StorageKey.of(DATA, id.toString());
    }

    static StorageKey chunkKey(EntityId id, ChunkDescriptor d) {
        return StorageKey.of(DATA, id.toString(), d.kind().keySegment(), d.hash());
    }

    private static Optional<StorageChunk> toChunk(StoredEntry e) {
        StorageKey key = e.key();
        if (key.size() != 4) {
            log.warning("ignoring unexpected key " + key);
            return Optional.empty();
        }
        Optional<byte[]> bytes = e.bytes();
        if (bytes.isEmpty()) {
            log.warning("ignoring chunk without data " + key);
            return Optional.empty();
        }
        byte[] data = bytes.get();
        var descriptor = new ChunkDescriptor(ChunkKind.fromKeySegment(key.get(2)), key.get(3), data.length);
        return Optional.of(new StorageChunk(descriptor, data));
    }

    private static List<StorageChunk> concat(List<StorageChunk> a, List<StorageChunk> b) {
        var out = new ArrayList<StorageChunk>(a.size() + b.size());
        out.addAll(a);
        out.addAll(b);
        return out;
    }
}
