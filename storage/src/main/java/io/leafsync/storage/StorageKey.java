// file: src/main/java/io/leafsync/storage/StorageKey.java
package io.leafsync.storage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Key of a record in a {@link StorageBackend}: an ordered sequence of string segments.
 * Keys sort segment by segment, so all keys sharing a prefix are adjacent.
 */
public record StorageKey(List<String> segments) implements Comparable<StorageKey> {

    public StorageKey {
        Objects.requireNonNull(segments, "segments");
        segments = List.copyOf(segments);
        for (String s : segments) {
            if (s.isEmpty()) throw new IllegalArgumentException("key segments must not be empty");
        }
    }

    public static StorageKey of(String... segments) {
        return new StorageKey(Arrays.asList(segments));
    }

    public int size() { return segments.size(); }

    public String get(int index) { return segments.get(index); }

    public boolean startsWith(StorageKey prefix) {
        return segments.size() >= prefix.size() && segments.subList(0, prefix.size()).equals(prefix.segments);
    }

    public StorageKey append(String... more) {
        var all = new ArrayList<>(segments);
        all.addAll(Arrays.asList(more));
        return new StorageKey(all);
    }

    public StorageKey prepend(StorageKey namespace) {
        var all = new ArrayList<>(namespace.segments);
        all.addAll(segments);
        return new StorageKey(all);
    }

    /** This key with the first {@code n} segments removed. */
    public StorageKey drop(int n) {
        return new StorageKey(segments.subList(n, segments.size()));
    }

    @Override
    public int compareTo(StorageKey o) {
        int n = Math.min(segments.size(), o.segments.size());
        for (int i = 0; i < n; i++) {
            int c = segments.get(i).compareTo(o.segments.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(segments.size(), o.segments.size());
    }

    @Override public String toString() { return String.join("/", segments); }
}
