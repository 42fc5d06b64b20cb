// file: src/main/java/io/leafsync/core/doc/UpdateHeader.java
package io.leafsync.core.doc;

import io.leafsync.core.VersionVector;

/**
 * Metadata at the front of every exported update.
 *
 * @param mode whether the update is a full snapshot or a delta
 * @param from the version the delta was computed against (empty for snapshots)
 * @param end  the exporter's version at export time
 */
public record UpdateHeader(Mode mode, VersionVector from, VersionVector end) {
    public enum Mode { SNAPSHOT, DELTA }
}
