// file: sync/src/main/java/io/leafsync/sync/proto/BinaryChannel.java
package io.leafsync.sync.proto;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Bidirectional message pipe: whole binary messages in both directions.
 * Seen from the side that calls {@link #send}.
 */
public interface BinaryChannel {

    /** Send one message to the other side. */
    CompletableFuture<Void> send(byte[] message);

    /** Where messages from the other side are delivered. Replaces any earlier receiver. */
    void setReceiver(Consumer<byte[]> receiver);
}
