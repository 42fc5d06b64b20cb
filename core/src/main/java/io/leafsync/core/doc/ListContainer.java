// file: src/main/java/io/leafsync/core/doc/ListContainer.java
package io.leafsync.core.doc;

import java.util.List;

/**
 * Append-only list. Elements are ordered by the lamport timestamp of their push, ties broken
 * by peer id; deletes tombstone a single element.
 */
public final class ListContainer implements Container {
    private final OpLogDocument doc;
    private final String name;

    ListContainer(OpLogDocument doc, String name) {
        this.doc = doc;
        this.name = name;
    }

    @Override public String name() { return name; }

    @Override public ContainerKind kind() { return ContainerKind.LIST; }

    public List<String> values() {
        return doc.listView(name).stream().map(OpLogDocument.ListEntry::value).toList();
    }

    public int size() { return doc.listView(name).size(); }

    public String get(int index) { return doc.listView(name).get(index).value(); }

    public void push(String value) { doc.stage(name, new Op.ListPush(value)); }

    public void delete(int index) {
        var entry = doc.listView(name).get(index);
        doc.stage(name, new Op.ListDelete(entry.id()));
    }

    @Override public boolean isEmpty() { return doc.listView(name).isEmpty(); }

    @Override public void clear() {
        for (var entry : doc.listView(name)) {
            doc.stage(name, new Op.ListDelete(entry.id()));
        }
    }
}
