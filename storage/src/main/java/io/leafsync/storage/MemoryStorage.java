// file: src/main/java/io/leafsync/storage/MemoryStorage.java
package io.leafsync.storage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/** In-memory {@link StorageBackend}, ordered by key. Values are copied in and out. */
public final class MemoryStorage implements StorageBackend {
    private final ConcurrentSkipListMap<StorageKey, byte[]> data = new ConcurrentSkipListMap<>();

    @Override
    public Optional<byte[]> load(StorageKey key) {
        byte[] v = data.get(key);
        return v == null ? Optional.empty() : Optional.of(Arrays.copyOf(v, v.length));
    }

    @Override
    public void save(StorageKey key, byte[] value) {
        data.put(key, Arrays.copyOf(value, value.length));
    }

    @Override
    public void remove(StorageKey key) {
        data.remove(key);
    }

    @Override
    public List<StoredEntry> loadRange(StorageKey prefix) {
        var out = new ArrayList<StoredEntry>();
        for (Map.Entry<StorageKey, byte[]> e : data.tailMap(prefix, true).entrySet()) {
            if (!e.getKey().startsWith(prefix)) break;
            out.add(new StoredEntry(e.getKey(), Arrays.copyOf(e.getValue(), e.getValue().length)));
        }
        return out;
    }

    @Override
    public void removeRange(StorageKey prefix) {
        for (StorageKey k : data.tailMap(prefix, true).keySet()) {
            if (!k.startsWith(prefix)) break;
            data.remove(k);
        }
    }

    /** Number of stored records. */
    public int size() { return data.size(); }
}
