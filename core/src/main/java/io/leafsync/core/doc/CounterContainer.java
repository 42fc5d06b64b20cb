// file: src/main/java/io/leafsync/core/doc/CounterContainer.java
package io.leafsync.core.doc;

/** Counter whose value is the sum of every increment from every peer. */
public final class CounterContainer implements Container {
    private final OpLogDocument doc;
    private final String name;

    CounterContainer(OpLogDocument doc, String name) {
        this.doc = doc;
        this.name = name;
    }

    @Override public String name() { return name; }

    @Override public ContainerKind kind() { return ContainerKind.COUNTER; }

    public long value() { return doc.counterValue(name); }

    public void increment(long amount) {
        if (amount != 0) doc.stage(name, new Op.CounterAdd(amount));
    }

    public void decrement(long amount) { increment(-amount); }

    @Override public boolean isEmpty() { return value() == 0; }

    @Override public void clear() { increment(-value()); }
}
