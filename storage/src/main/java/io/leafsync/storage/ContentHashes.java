// file: src/main/java/io/leafsync/storage/ContentHashes.java
package io.leafsync.storage;

import io.leafsync.core.CrockfordBase32;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/** Content addressing for chunks: SHA-256, Crockford base32 encoded. */
public final class ContentHashes {

    private ContentHashes() {
        // utility
    }

    public static String sha256Base32(byte[] data) {
        try {
            return CrockfordBase32.encode(MessageDigest.getInstance("SHA-256").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
