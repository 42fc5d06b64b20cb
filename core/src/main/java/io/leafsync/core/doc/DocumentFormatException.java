// file: src/main/java/io/leafsync/core/doc/DocumentFormatException.java
package io.leafsync.core.doc;

/** Raised when update bytes cannot be decoded. Nothing has been applied when this is thrown. */
public class DocumentFormatException extends IllegalArgumentException {
    public DocumentFormatException(String message) {
        super(message);
    }

    public DocumentFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
