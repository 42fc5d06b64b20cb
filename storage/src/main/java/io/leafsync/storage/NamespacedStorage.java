// file: src/main/java/io/leafsync/storage/NamespacedStorage.java
package io.leafsync.storage;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * View of another {@link StorageBackend} with every key prefixed by a fixed namespace.
 * Keys returned from {@link #loadRange} have the namespace stripped again.
 */
public final class NamespacedStorage implements StorageBackend {
    private final StorageBackend inner;
    private final StorageKey namespace;

    public NamespacedStorage(StorageBackend inner, String... namespace) {
        this.inner = Objects.requireNonNull(inner, "inner");
        this.namespace = StorageKey.of(namespace);
    }

    @Override
    public Optional<byte[]> load(StorageKey key) {
        return inner.load(key.prepend(namespace));
    }

    @Override
    public void save(StorageKey key, byte[] data) {
        inner.save(key.prepend(namespace), data);
    }

    @Override
    public void remove(StorageKey key) {
        inner.remove(key.prepend(namespace));
    }

    @Override
    public List<StoredEntry> loadRange(StorageKey prefix) {
        return inner.loadRange(prefix.prepend(namespace)).stream()
                .map(e -> new StoredEntry(e.key().drop(namespace.size()), e.data()))
                .toList();
    }

    @Override
    public void removeRange(StorageKey prefix) {
        inner.removeRange(prefix.prepend(namespace));
    }
}
