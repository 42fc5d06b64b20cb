// file: src/main/java/io/leafsync/core/doc/Container.java
package io.leafsync.core.doc;

/**
 * A named, typed sub-container of a document. One case per {@link ContainerKind}.
 */
public sealed interface Container permits MapContainer, CounterContainer, ListContainer {

    String name();

    ContainerKind kind();

    boolean isEmpty();

    /** Remove all visible content by emitting the kind-specific delete ops. */
    void clear();
}
