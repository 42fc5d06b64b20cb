// file: src/main/java/io/leafsync/core/EntityId.java
package io.leafsync.core;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

/**
 * The ID of an {@link Entity}.
 * <p>
 * In text form an entity ID looks like this:
 * <pre>
 *     leaf:ey02v80j9x376qgcczy8sq0pwvdbx01kbx0n7nbj90f87fnj5c50
 * </pre>
 * It always starts with {@code leaf:} and ends with 32 bytes encoded as lower-case
 * Crockford base32. Currently the bytes are random.
 */
public final class EntityId implements Comparable<EntityId> {
    public static final String PREFIX = "leaf:";
    public static final int LENGTH = 32;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final byte[] bytes;
    private final String text;

    private EntityId(byte[] bytes) {
        this.bytes = bytes;
        this.text = PREFIX + CrockfordBase32.encode(bytes).toLowerCase(java.util.Locale.ROOT);
    }

    /** A fresh random ID. */
    public static EntityId random() {
        byte[] b = new byte[LENGTH];
        RANDOM.nextBytes(b);
        return new EntityId(b);
    }

    /** Wrap exactly 32 raw bytes (copied). */
    public static EntityId of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("Invalid byte length for entity ID (" + bytes.length + "), expected " + LENGTH);
        }
        return new EntityId(Arrays.copyOf(bytes, LENGTH));
    }

    /**
     * Parse the text form.
     *
     * @throws IllegalArgumentException if the prefix is missing, the body is not base32,
     *                                  or it does not decode to exactly 32 bytes.
     */
    public static EntityId parse(String text) {
        Objects.requireNonNull(text, "text");
        if (!text.startsWith(PREFIX)) {
            throw new IllegalArgumentException("Entity ID must start with `" + PREFIX + "`: " + text);
        }
        byte[] data = CrockfordBase32.decode(text.substring(PREFIX.length()));
        if (data.length != LENGTH) {
            throw new IllegalArgumentException("Invalid byte length for entity ID (" + data.length + "), expected " + LENGTH);
        }
        return new EntityId(data);
    }

    public byte[] bytes() { return Arrays.copyOf(bytes, bytes.length); }

    @Override public String toString() { return text; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntityId other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override public int hashCode() { return Arrays.hashCode(bytes); }

    @Override public int compareTo(EntityId o) { return Arrays.compareUnsigned(bytes, o.bytes); }
}
