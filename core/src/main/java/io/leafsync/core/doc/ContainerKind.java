// file: src/main/java/io/leafsync/core/doc/ContainerKind.java
package io.leafsync.core.doc;

/** The closed set of container kinds a document can hold. */
public enum ContainerKind {
    MAP, COUNTER, LIST
}
