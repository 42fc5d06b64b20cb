// file: src/main/java/io/leafsync/core/VersionVector.java
package io.leafsync.core;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable version vector: a mapping from document peerId -> highest change counter seen.
 * <p>
 * This is the causal summary of a document used to:
 *  - decide whether one replica has seen everything another has, and
 *  - compute which changes a remote replica is missing.
 * <p>
 * Design:
 *  - Immutable: internal map is copied into a sorted, unmodifiable map.
 *  - Value object: equals/hashCode based purely on contents.
 *  - Entries with counter 0 are dropped, so {} and {p:0} are the same version.
 */
public final class VersionVector {

    private static final VersionVector EMPTY = new VersionVector(Map.of());

    // Sorted so the binary encoding is deterministic.
    private final Map<String, Long> vv;

    /**
     * Create a new version vector from the provided entries.
     * The input map is defensively copied.
     */
    public VersionVector(Map<String, Long> vv) {
        var sorted = new TreeMap<String, Long>();
        for (var e : vv.entrySet()) {
            long counter = e.getValue();
            if (counter < 0) throw new IllegalArgumentException("counter must be >= 0 for peer " + e.getKey());
            if (counter > 0) sorted.put(e.getKey(), counter);
        }
        this.vv = Collections.unmodifiableMap(sorted);
    }

    /** Empty version: a document that has seen nothing. */
    public static VersionVector empty() { return EMPTY; }

    /** Current entries (read-only, sorted by peer id). */
    public Map<String, Long> entries() { return vv; }

    public boolean isEmpty() { return vv.isEmpty(); }

    /** Highest contiguous counter seen for the peer, 0 if none. */
    public long get(String peerId) { return vv.getOrDefault(peerId, 0L); }

    /** True if the change {@code (peerId, counter)} is covered by this version. */
    public boolean includes(String peerId, long counter) { return counter <= get(peerId); }

    /** Return a new vector with {@code peerId} set to {@code counter}. */
    public VersionVector with(String peerId, long counter) {
        var m = new HashMap<>(vv);
        m.put(peerId, counter);
        return new VersionVector(m);
    }

    /** Elementwise maximum of this and {@code other}. */
    public VersionVector merge(VersionVector other) {
        var m = new HashMap<>(vv);
        other.vv.forEach((peer, counter) -> m.merge(peer, counter, Math::max));
        return new VersionVector(m);
    }

    /**
     * Compare this vector (A) to another vector (B).
     * <p>
     * Missing entries are treated as 0. If A >= B elementwise and A != B, A is AFTER B.
     * If both are strictly greater somewhere, the versions are CONCURRENT.
     */
    public CausalOrder compare(VersionVector other) {
        boolean aGreater = false;
        boolean bGreater = false;

        var ids = new HashSet<String>(vv.keySet());
        ids.addAll(other.vv.keySet());

        for (var id : ids) {
            long a = get(id);
            long b = other.get(id);
            if (a > b) aGreater = true;
            if (a < b) bGreater = true;
            if (aGreater && bGreater) return CausalOrder.CONCURRENT;
        }

        if (!aGreater && !bGreater) return CausalOrder.EQUAL;
        if (aGreater) return CausalOrder.AFTER;
        return CausalOrder.BEFORE;
    }

    /**
     * Binary form:
     *   int32 count
     *   repeated 'count' times:
     *     - peerId:  int32 len + UTF-8 bytes
     *     - counter: int64
     */
    public byte[] encode() {
        var bytes = new ByteArrayOutputStream();
        try (var out = new DataOutputStream(bytes)) {
            writeTo(out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    /** Write the binary form onto an open stream. */
    public void writeTo(DataOutputStream out) throws IOException {
        out.writeInt(vv.size());
        for (var e : vv.entrySet()) {
            byte[] peer = e.getKey().getBytes(StandardCharsets.UTF_8);
            out.writeInt(peer.length);
            out.write(peer);
            out.writeLong(e.getValue());
        }
    }

    /**
     * Decode the form produced by {@link #encode()}.
     *
     * @throws IllegalArgumentException if the bytes are truncated, have trailing data or bad counts.
     */
    public static VersionVector decode(byte[] bytes) {
        var b = ByteBuffer.wrap(bytes);
        VersionVector v = readFrom(b);
        if (b.hasRemaining()) throw new IllegalArgumentException("trailing bytes after version vector");
        return v;
    }

    /** Read a vector from the buffer's current position. */
    public static VersionVector readFrom(ByteBuffer b) {
        try {
            int n = b.getInt();
            if (n < 0 || n > b.remaining()) throw new IllegalArgumentException("bad version vector size: " + n);
            var m = new HashMap<String, Long>(n * 2);
            for (int i = 0; i < n; i++) {
                int len = b.getInt();
                if (len < 0 || len > b.remaining()) throw new IllegalArgumentException("bad peer id length: " + len);
                byte[] peer = new byte[len];
                b.get(peer);
                m.put(new String(peer, StandardCharsets.UTF_8), b.getLong());
            }
            return new VersionVector(m);
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("truncated version vector", e);
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VersionVector other)) return false;
        return vv.equals(other.vv);
    }

    @Override public int hashCode() { return vv.hashCode(); }

    @Override public String toString() { return vv.toString(); }
}
