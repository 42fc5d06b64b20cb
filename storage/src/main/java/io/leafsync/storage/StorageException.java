// file: src/main/java/io/leafsync/storage/StorageException.java
package io.leafsync.storage;

/** Unchecked wrapper for I/O failures in a storage backend. */
public class StorageException extends RuntimeException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
