// file: sync/src/main/java/io/leafsync/sync/proto/MalformedMessageException.java
package io.leafsync.sync.proto;

/** A frame that is not a valid {@link SyncMessage}. */
public class MalformedMessageException extends RuntimeException {
    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
