// file: src/main/java/io/leafsync/core/doc/Op.java
package io.leafsync.core.doc;

import java.util.Objects;

/**
 * A single edit to one container. The op family is closed: adding a container kind means
 * adding cases here and in {@link DocumentCodec}, not branching on names.
 */
public sealed interface Op permits Op.MapPut, Op.MapDelete, Op.CounterAdd, Op.ListPush, Op.ListDelete {

    ContainerKind kind();

    record MapPut(String key, String value) implements Op {
        public MapPut {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }
        @Override public ContainerKind kind() { return ContainerKind.MAP; }
    }

    record MapDelete(String key) implements Op {
        public MapDelete {
            Objects.requireNonNull(key, "key");
        }
        @Override public ContainerKind kind() { return ContainerKind.MAP; }
    }

    record CounterAdd(long amount) implements Op {
        @Override public ContainerKind kind() { return ContainerKind.COUNTER; }
    }

    record ListPush(String value) implements Op {
        public ListPush {
            Objects.requireNonNull(value, "value");
        }
        @Override public ContainerKind kind() { return ContainerKind.LIST; }
    }

    record ListDelete(ChangeId target) implements Op {
        public ListDelete {
            Objects.requireNonNull(target, "target");
        }
        @Override public ContainerKind kind() { return ContainerKind.LIST; }
    }
}
