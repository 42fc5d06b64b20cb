// file: client/src/main/java/io/leafsync/client/Cli.java
package io.leafsync.client;

import io.leafsync.core.Entity;
import io.leafsync.core.EntityId;
import io.leafsync.core.task.EventLoop;
import io.leafsync.peer.EntityHandle;
import io.leafsync.peer.LocalPeer;
import io.leafsync.peer.OpenOptions;
import io.leafsync.peer.PeerConfig;
import io.leafsync.storage.FileStorage;
import io.leafsync.sync.proto.SyncBinaryClient;

import java.io.PrintStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Simple CLI for working with entities, locally and/or through a hub.
 *
 * Usage:
 *   leafsync-cli [--hub ws://host:port/sync] [--data-dir dir] new
 *   leafsync-cli [--hub ws://host:port/sync] [--data-dir dir] get  <id> <map>
 *   leafsync-cli [--hub ws://host:port/sync] [--data-dir dir] set  <id> <map> <key> <value>
 *   leafsync-cli [--hub ws://host:port/sync] [--data-dir dir] incr <id> <counter> <n>
 *
 * At least one of --hub and --data-dir is required, otherwise nothing would outlive the command.
 *
 * Examples:
 *   leafsync-cli --hub ws://localhost:8095/sync new
 *   leafsync-cli --hub ws://localhost:8095/sync set leaf:... profile name Ada
 */
public final class Cli {

    static final Duration REMOTE_WAIT = Duration.ofSeconds(3);
    private static final long TIMEOUT_SECONDS = 15;

    private final PrintStream out;
    private final LocalPeer peer;
    private final EventLoop loop;
    private final WebSocketChannel channel; // null without --hub

    private Cli(PrintStream out, LocalPeer peer, EventLoop loop, WebSocketChannel channel) {
        this.out = out;
        this.peer = peer;
        this.loop = loop;
        this.channel = channel;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Run one command.
     *
     * @return process exit code: 0 ok, 1 usage or user error, 2 unexpected failure
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        String hub = null;
        String dataDir = null;
        List<String> rest = new ArrayList<>(Arrays.asList(args));
        try {
            while (!rest.isEmpty() && rest.get(0).startsWith("--")) {
                String flag = rest.remove(0);
                if (rest.isEmpty()) throw new CliException(flag + " requires a value");
                switch (flag) {
                    case "--hub" -> hub = rest.remove(0);
                    case "--data-dir" -> dataDir = rest.remove(0);
                    default -> throw new CliException("unknown option: " + flag);
                }
            }
            if (rest.isEmpty()) throw new CliException("missing command");
            if (hub == null && dataDir == null) throw new CliException("need --hub and/or --data-dir");

            Cli cli = open(out, hub, dataDir);
            try {
                cli.dispatch(rest);
            } finally {
                cli.shutdown();
            }
            return 0;
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            err.println(usage());
            return 1;
        } catch (Exception e) {
            e.printStackTrace(err);
            return 2;
        }
    }

    private static Cli open(PrintStream out, String hub, String dataDir) throws Exception {
        var loop = new EventLoop("leafsync-cli");
        var config = PeerConfig.builder();
        WebSocketChannel channel = null;
        if (dataDir != null) {
            config.storage(new FileStorage(Path.of(dataDir)));
        }
        if (hub != null) {
            channel = WebSocketChannel.connect(HttpClient.newHttpClient(), URI.create(hub))
                    .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            config.sync(new SyncBinaryClient(channel));
        }
        return new Cli(out, new LocalPeer(loop, config.build()), loop, channel);
    }

    private void dispatch(List<String> rest) throws Exception {
        String cmd = rest.get(0);
        switch (cmd) {
            case "new" -> {
                expectArgs(rest, 1, "new takes no arguments");
                cmdNew();
            }
            case "get" -> {
                expectArgs(rest, 3, "get requires <id> <map>");
                cmdGet(parseId(rest.get(1)), rest.get(2));
            }
            case "set" -> {
                expectArgs(rest, 5, "set requires <id> <map> <key> <value>");
                cmdSet(parseId(rest.get(1)), rest.get(2), rest.get(3), rest.get(4));
            }
            case "incr" -> {
                expectArgs(rest, 4, "incr requires <id> <counter> <n>");
                long n;
                try {
                    n = Long.parseLong(rest.get(3));
                } catch (NumberFormatException e) {
                    throw new CliException("not a number: " + rest.get(3));
                }
                cmdIncr(parseId(rest.get(1)), rest.get(2), n);
            }
            default -> throw new CliException("unknown command: " + cmd);
        }
    }

    private void cmdNew() throws Exception {
        EntityHandle h = await(peer.create());
        out.println(h.id());
        await(peer.close(h.id()));
    }

    private void cmdGet(EntityId id, String map) throws Exception {
        EntityHandle h = await(peer.open(id, OpenOptions.createAfter(REMOTE_WAIT)));
        Map<String, String> values = h.entity().map(map).asMap();
        if (values.isEmpty()) {
            out.println("(empty)");
        } else {
            values.forEach((k, v) -> out.println(k + "=" + v));
        }
        await(peer.close(id));
    }

    private void cmdSet(EntityId id, String map, String key, String value) throws Exception {
        EntityHandle h = await(peer.open(id, OpenOptions.createAfter(REMOTE_WAIT)));
        Entity ent = h.entity();
        ent.map(map).put(key, value);
        ent.commit();
        await(peer.close(id));
        out.println("OK");
    }

    private void cmdIncr(EntityId id, String counter, long n) throws Exception {
        EntityHandle h = await(peer.open(id, OpenOptions.createAfter(REMOTE_WAIT)));
        Entity ent = h.entity();
        ent.counter(counter).increment(n);
        ent.commit();
        long value = ent.counter(counter).value();
        await(peer.close(id));
        out.println(value);
    }

    private void shutdown() {
        try {
            if (channel != null) channel.close();
        } finally {
            loop.close();
        }
    }

    private static <T> T await(CompletableFuture<T> f) throws Exception {
        try {
            return f.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            throw new CliException("timed out after " + TIMEOUT_SECONDS + "s");
        } catch (ExecutionException e) {
            throw e.getCause() instanceof Exception cause ? cause : e;
        }
    }

    private static EntityId parseId(String s) {
        try {
            return EntityId.parse(s);
        } catch (IllegalArgumentException e) {
            throw new CliException(e.getMessage());
        }
    }

    private static void expectArgs(List<String> rest, int n, String message) {
        if (rest.size() != n) throw new CliException(message);
    }

    private static String usage() {
        return """
                Usage:
                  leafsync-cli [--hub ws://host:port/sync] [--data-dir dir] new
                  leafsync-cli [--hub ws://host:port/sync] [--data-dir dir] get  <id> <map>
                  leafsync-cli [--hub ws://host:port/sync] [--data-dir dir] set  <id> <map> <key> <value>
                  leafsync-cli [--hub ws://host:port/sync] [--data-dir dir] incr <id> <counter> <n>
                """;
    }

    private static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
