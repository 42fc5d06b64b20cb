// file: src/main/java/io/leafsync/core/doc/DocumentEvent.java
package io.leafsync.core.doc;

import io.leafsync.core.VersionVector;

/**
 * Fired after a document changed.
 *
 * @param origin  LOCAL for a commit of local edits, IMPORT for a merge of remote bytes
 * @param version the document version after the change
 */
public record DocumentEvent(Origin origin, VersionVector version) {
    public enum Origin { LOCAL, IMPORT }
}
