// file: src/main/java/io/leafsync/core/Entity.java
package io.leafsync.core;

import io.leafsync.core.doc.CounterContainer;
import io.leafsync.core.doc.Document;
import io.leafsync.core.doc.ListContainer;
import io.leafsync.core.doc.MapContainer;
import io.leafsync.core.doc.OpLogDocument;

import java.util.Objects;

/**
 * An entity: one {@link EntityId} paired with the {@link Document} holding its data.
 * <p>
 * Ownership:
 *  - an Entity is the single owner of its document; no two entities wrap the same document,
 *  - {@link #free()} releases the document, after which any document access throws.
 * <p>
 * Example:
 * <pre>
 *   var ent = new Entity();
 *   ent.map("name").put("first", "John");
 *   ent.commit();
 * </pre>
 */
public final class Entity {
    private final EntityId id;
    private final Document doc;

    /** New entity with a random id and an empty document. */
    public Entity() {
        this(EntityId.random());
    }

    public Entity(EntityId id) {
        this(id, new OpLogDocument());
    }

    public Entity(EntityId id, Document doc) {
        this.id = Objects.requireNonNull(id, "id");
        this.doc = Objects.requireNonNull(doc, "doc");
    }

    public EntityId id() { return id; }

    /**
     * @throws IllegalStateException if the entity has been freed.
     */
    public Document doc() {
        if (doc.isFreed()) throw new IllegalStateException("entity " + id + " has been freed");
        return doc;
    }

    public MapContainer map(String name) { return doc().map(name); }

    public CounterContainer counter(String name) { return doc().counter(name); }

    public ListContainer list(String name) { return doc().list(name); }

    public void commit() { doc().commit(); }

    /** Release the document. Idempotent. */
    public void free() {
        if (!doc.isFreed()) doc.free();
    }

    public boolean isFreed() { return doc.isFreed(); }

    @Override public String toString() { return "Entity(" + id + ")"; }
}
