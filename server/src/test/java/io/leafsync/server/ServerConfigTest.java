// file: server/src/test/java/io/leafsync/server/ServerConfigTest.java
package io.leafsync.server;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    @TempDir
    Path tmp;

    @Test
    void defaults_apply_when_no_flags_are_given() {
        var cfg = ServerConfig.parse(new String[0]);

        assertEquals(ServerConfig.DEFAULT_HOST, cfg.host());
        assertEquals(ServerConfig.DEFAULT_PORT, cfg.port());
        assertEquals(ServerConfig.StorageKind.FILE, cfg.storage());
        assertEquals(ServerConfig.DEFAULT_DATA_DIR, cfg.dataDir());
        assertNull(cfg.configPath());
    }

    @Test
    void long_and_short_flags_are_parsed() {
        var cfg = ServerConfig.parse(new String[]{"--port", "9001", "-H", "127.0.0.1", "-s", "Memory", "--data-dir", "/tmp/x"});

        assertEquals(9001, cfg.port());
        assertEquals("127.0.0.1", cfg.host());
        assertEquals(ServerConfig.StorageKind.MEMORY, cfg.storage());
        assertEquals("/tmp/x", cfg.dataDir());
    }

    @Test
    void bad_input_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.parse(new String[]{"--port", "abc"}));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.parse(new String[]{"--port", "70000"}));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.parse(new String[]{"--storage", "s3"}));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.parse(new String[]{"--port"}));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.parse(new String[]{"--bogus"}));
    }

    @Test
    void json_file_supplies_values_and_flags_override_them() throws Exception {
        String json = """
                {
                  "host": "10.0.0.5",
                  "port": 7000,
                  "storage": "memory",
                  "dataDir": "/srv/leaf",
                  "comment": "unknown fields are ignored"
                }
                """;
        Path file = tmp.resolve("hub.json");
        Files.writeString(file, json);

        var fromFile = ServerConfig.parse(new String[]{"--config", file.toString()});
        assertEquals("10.0.0.5", fromFile.host());
        assertEquals(7000, fromFile.port());
        assertEquals(ServerConfig.StorageKind.MEMORY, fromFile.storage());
        assertEquals("/srv/leaf", fromFile.dataDir());

        var overridden = ServerConfig.parse(new String[]{"-c", file.toString(), "--port", "7100"});
        assertEquals(7100, overridden.port());
        assertEquals("10.0.0.5", overridden.host());
    }

    @Test
    void unreadable_json_file_is_reported() throws Exception {
        Path file = tmp.resolve("broken.json");
        Files.writeString(file, "{ not json");

        var e = assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.parse(new String[]{"--config", file.toString()}));
        assertTrue(e.getMessage().contains("broken.json"));
    }
}
