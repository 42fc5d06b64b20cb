// file: src/main/java/io/leafsync/core/doc/MapContainer.java
package io.leafsync.core.doc;

import java.util.Map;
import java.util.Optional;

/** Last-writer-wins map from string keys to string values. */
public final class MapContainer implements Container {
    private final OpLogDocument doc;
    private final String name;

    MapContainer(OpLogDocument doc, String name) {
        this.doc = doc;
        this.name = name;
    }

    @Override public String name() { return name; }

    @Override public ContainerKind kind() { return ContainerKind.MAP; }

    public Optional<String> get(String key) {
        return Optional.ofNullable(doc.mapView(name).get(key));
    }

    public Map<String, String> asMap() { return doc.mapView(name); }

    public void put(String key, String value) { doc.stage(name, new Op.MapPut(key, value)); }

    public void delete(String key) {
        if (doc.mapView(name).containsKey(key)) doc.stage(name, new Op.MapDelete(key));
    }

    @Override public boolean isEmpty() { return doc.mapView(name).isEmpty(); }

    @Override public void clear() {
        for (String key : doc.mapView(name).keySet()) {
            doc.stage(name, new Op.MapDelete(key));
        }
    }
}
