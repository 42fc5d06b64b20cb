// file: src/main/java/io/leafsync/core/doc/OpLogDocument.java
package io.leafsync.core.doc;

import io.leafsync.core.Subscription;
import io.leafsync.core.VersionVector;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operation-log CRDT used as the document engine.
 * <p>
 * State:
 *  - every applied {@link Change}, keyed and exported in (peer, counter) order,
 *  - a per-peer contiguous counter which is the document {@link #version()},
 *  - changes that arrived ahead of a gap, parked until the gap is filled,
 *  - materialized container state derived from the applied changes.
 * <p>
 * Merge is a set union of changes, so it is commutative, associative and idempotent.
 * Concurrent map writes resolve by (lamport, peerId); counters sum; list elements are
 * ordered by (lamport, peerId, counter).
 * <p>
 * Local edits are applied immediately and become visible to exports right away;
 * {@link #commit()} groups them into one delta for listeners.
 * <p>
 * Thread safety: state is guarded by the instance monitor. Listeners are invoked outside
 * the monitor on the committing/merging thread, and must not call mutating methods.
 */
public final class OpLogDocument implements Document {
    private static final Logger log = Logger.getLogger(OpLogDocument.class.getName());
    private static final SecureRandom RANDOM = new SecureRandom();

    private final String peerId;

    private final TreeMap<ChangeId, Change> applied = new TreeMap<>();
    private final Map<String, Long> clock = new HashMap<>();
    private final Map<String, TreeMap<Long, Change>> parked = new HashMap<>();
    private long maxLamport;
    private VersionVector version = VersionVector.empty();

    private final Map<String, Map<String, Register>> maps = new HashMap<>();
    private final Map<String, Long> counters = new HashMap<>();
    private final Map<String, ListState> lists = new HashMap<>();

    private final List<Change> uncommitted = new ArrayList<>();
    private boolean freed;

    private final List<Consumer<DocumentEvent>> listeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<byte[]>> localListeners = new CopyOnWriteArrayList<>();
    private final ThreadLocal<Boolean> dispatching = ThreadLocal.withInitial(() -> false);

    /** New empty document with a random peer id. */
    public OpLogDocument() {
        this(randomPeerId());
    }

    public OpLogDocument(String peerId) {
        this.peerId = Objects.requireNonNull(peerId, "peerId");
        if (peerId.isBlank()) throw new IllegalArgumentException("peerId must not be blank");
    }

    private static String randomPeerId() {
        byte[] b = new byte[8];
        RANDOM.nextBytes(b);
        return HexFormat.of().formatHex(b);
    }

    @Override public String peerId() { return peerId; }

    @Override
    public synchronized VersionVector version() {
        checkLive();
        return version;
    }

    @Override
    public void merge(byte[] update) {
        checkNotDispatching("merge");
        // Decode fully before touching state so malformed input is never partially applied.
        DocumentCodec.DecodedUpdate decoded = DocumentCodec.decode(update);

        VersionVector after;
        synchronized (this) {
            checkLive();
            VersionVector before = version;
            for (Change c : decoded.changes()) {
                offer(c);
            }
            refreshVersion();
            after = version;
            if (after.equals(before)) return;
        }
        dispatch(null, new DocumentEvent(DocumentEvent.Origin.IMPORT, after));
    }

    @Override
    public synchronized byte[] exportSnapshot() {
        checkLive();
        var header = new UpdateHeader(UpdateHeader.Mode.SNAPSHOT, VersionVector.empty(), version);
        return DocumentCodec.encode(header, List.copyOf(applied.values()));
    }

    @Override
    public synchronized byte[] exportDelta(VersionVector from) {
        checkLive();
        Objects.requireNonNull(from, "from");
        var missing = new ArrayList<Change>();
        for (Change c : applied.values()) {
            if (!from.includes(c.id().peerId(), c.id().counter())) missing.add(c);
        }
        return DocumentCodec.encode(new UpdateHeader(UpdateHeader.Mode.DELTA, from, version), missing);
    }

    @Override
    public void commit() {
        checkNotDispatching("commit");
        byte[] delta;
        VersionVector after;
        synchronized (this) {
            checkLive();
            if (uncommitted.isEmpty()) return;
            List<Change> batch = List.copyOf(uncommitted);
            uncommitted.clear();
            after = version;
            VersionVector from = after.with(peerId, batch.get(0).id().counter() - 1);
            delta = DocumentCodec.encode(new UpdateHeader(UpdateHeader.Mode.DELTA, from, after), batch);
        }
        dispatch(delta, new DocumentEvent(DocumentEvent.Origin.LOCAL, after));
    }

    @Override public MapContainer map(String name) { return new MapContainer(this, name); }

    @Override public CounterContainer counter(String name) { return new CounterContainer(this, name); }

    @Override public ListContainer list(String name) { return new ListContainer(this, name); }

    @Override
    public Subscription subscribe(Consumer<DocumentEvent> listener) {
        listeners.add(listener);
        return Subscription.once(() -> listeners.remove(listener));
    }

    @Override
    public Subscription subscribeLocalUpdates(Consumer<byte[]> listener) {
        localListeners.add(listener);
        return Subscription.once(() -> localListeners.remove(listener));
    }

    @Override
    public synchronized void free() {
        freed = true;
        applied.clear();
        parked.clear();
        maps.clear();
        counters.clear();
        lists.clear();
        uncommitted.clear();
        listeners.clear();
        localListeners.clear();
    }

    @Override
    public synchronized boolean isFreed() { return freed; }

    /** Number of changes waiting for an earlier change from the same peer. */
    public synchronized int parkedCount() {
        return parked.values().stream().mapToInt(Map::size).sum();
    }

    // ---------- local edits (called by container views) ----------

    void stage(String container, Op op) {
        checkNotDispatching("edit");
        synchronized (this) {
            checkLive();
            long counter = clock.getOrDefault(peerId, 0L) + 1;
            var change = new Change(new ChangeId(peerId, counter), maxLamport + 1, container, op);
            applyReady(change);
            refreshVersion();
            uncommitted.add(change);
        }
    }

    synchronized Map<String, String> mapView(String name) {
        checkLive();
        var out = new LinkedHashMap<String, String>();
        var registers = maps.getOrDefault(name, Map.of());
        new TreeMap<>(registers).forEach((k, r) -> {
            if (r.value() != null) out.put(k, r.value());
        });
        return Collections.unmodifiableMap(out);
    }

    synchronized long counterValue(String name) {
        checkLive();
        return counters.getOrDefault(name, 0L);
    }

    synchronized List<ListEntry> listView(String name) {
        checkLive();
        ListState state = lists.get(name);
        return state == null ? List.of() : state.visible();
    }

    // ---------- merge internals ----------

    private void offer(Change c) {
        String peer = c.id().peerId();
        long have = clock.getOrDefault(peer, 0L);
        long counter = c.id().counter();
        if (counter <= have) return; // duplicate
        if (counter > have + 1) {
            parked.computeIfAbsent(peer, p -> new TreeMap<>()).putIfAbsent(counter, c);
            return;
        }
        applyReady(c);
        drainParked(peer);
    }

    private void drainParked(String peer) {
        TreeMap<Long, Change> waiting = parked.get(peer);
        if (waiting == null) return;
        long next = clock.getOrDefault(peer, 0L) + 1;
        while (!waiting.isEmpty() && waiting.firstKey() <= next) {
            Change c = waiting.pollFirstEntry().getValue();
            if (c.id().counter() == next) {
                applyReady(c);
                next++;
            }
        }
        if (waiting.isEmpty()) parked.remove(peer);
    }

    private void applyReady(Change c) {
        applied.put(c.id(), c);
        clock.put(c.id().peerId(), c.id().counter());
        maxLamport = Math.max(maxLamport, c.lamport());

        Op op = c.op();
        if (op instanceof Op.MapPut put) {
            writeRegister(c, put.key(), put.value());
        } else if (op instanceof Op.MapDelete del) {
            writeRegister(c, del.key(), null);
        } else if (op instanceof Op.CounterAdd add) {
            counters.merge(c.container(), add.amount(), Long::sum);
        } else if (op instanceof Op.ListPush push) {
            lists.computeIfAbsent(c.container(), n -> new ListState()).push(c, push.value());
        } else if (op instanceof Op.ListDelete del) {
            lists.computeIfAbsent(c.container(), n -> new ListState()).tombstone(del.target());
        }
    }

    private void writeRegister(Change c, String key, String value) {
        var registers = maps.computeIfAbsent(c.container(), n -> new HashMap<>());
        var incoming = new Register(c.lamport(), c.id().peerId(), value);
        registers.merge(key, incoming, (cur, in) -> in.beats(cur) ? in : cur);
    }

    private void refreshVersion() {
        var current = new VersionVector(clock);
        if (!current.equals(version)) version = current;
    }

    private void dispatch(byte[] localDelta, DocumentEvent event) {
        dispatching.set(true);
        try {
            if (localDelta != null) {
                for (var l : localListeners) {
                    try {
                        l.accept(localDelta);
                    } catch (RuntimeException e) {
                        log.log(Level.WARNING, "local update listener failed", e);
                    }
                }
            }
            for (var l : listeners) {
                try {
                    l.accept(event);
                } catch (RuntimeException e) {
                    log.log(Level.WARNING, "document listener failed", e);
                }
            }
        } finally {
            dispatching.set(false);
        }
    }

    private void checkNotDispatching(String what) {
        if (dispatching.get()) {
            throw new IllegalStateException("document is not reentrant: " + what + " called from a document listener");
        }
    }

    private void checkLive() {
        if (freed) throw new IllegalStateException("document has been freed");
    }

    // ---------- container state ----------

    private record Register(long lamport, String peerId, String value) {
        boolean beats(Register other) {
            if (lamport != other.lamport) return lamport > other.lamport;
            return peerId.compareTo(other.peerId) > 0;
        }
    }

    /** One visible list element. */
    public record ListEntry(ChangeId id, String value) {}

    private static final class ListState {
        private final TreeMap<ListKey, ListEntry> entries = new TreeMap<>();
        private final Set<ChangeId> tombstones = new HashSet<>();

        void push(Change c, String value) {
            entries.put(new ListKey(c.lamport(), c.id()), new ListEntry(c.id(), value));
        }

        void tombstone(ChangeId target) {
            tombstones.add(target);
        }

        List<ListEntry> visible() {
            var out = new ArrayList<ListEntry>(entries.size());
            for (ListEntry e : entries.values()) {
                if (!tombstones.contains(e.id())) out.add(e);
            }
            return List.copyOf(out);
        }
    }

    private record ListKey(long lamport, ChangeId id) implements Comparable<ListKey> {
        @Override
        public int compareTo(ListKey o) {
            int byLamport = Long.compare(lamport, o.lamport);
            return byLamport != 0 ? byLamport : id.compareTo(o.id);
        }
    }
}
