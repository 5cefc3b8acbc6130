package io.dripline.server;

import io.dripline.core.Address;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    private static final String OWNER = Address.ofLong(0x0A11).toHex();

    @TempDir
    Path dir;

    @Test
    void defaults_apply_when_only_owner_is_given() {
        var cfg = ServerConfig.parse(new String[]{"--owner", OWNER});

        assertEquals(8080, cfg.httpPort());
        assertEquals(Path.of("./data").resolve("wal"), cfg.walDir());
        assertEquals(Path.of("./data").resolve("snap"), cfg.snapDir());
        assertEquals(Address.fromHex(OWNER), cfg.owner());
        assertEquals(ServerConfig.DEFAULT_CUSTODY, cfg.custody());
        assertNull(cfg.ledger());
        assertEquals(0, cfg.ledgerPort());
        assertEquals(50_000, cfg.snapshotEvery());
        assertEquals(64L * 1024 * 1024, cfg.walRotateBytes());
        assertTrue(cfg.fund().isEmpty());
    }

    @Test
    void owner_is_required() {
        var ex = assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.parse(new String[]{"--http-port", "9000"}));
        assertTrue(ex.getMessage().contains("--owner"));
    }

    @Test
    void bad_values_are_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.parse(new String[]{"--owner", OWNER, "--http-port", "abc"}));
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.parse(new String[]{"--owner", OWNER, "--bogus"}));
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.parse(new String[]{"--owner", OWNER, "--ledger", "nohost"}));
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.parse(new String[]{"--owner", "0x1234"}));
        assertThrows(IllegalArgumentException.class,
                () -> ServerConfig.parse(new String[]{"--owner"}));
    }

    @Test
    void fund_and_remote_ledger_are_parsed() {
        String alice = Address.ofLong(0xA1).toHex();
        var cfg = ServerConfig.parse(new String[]{
                "--owner", OWNER, "--fund", alice + "=1000", "--fund", OWNER + "=5"});

        assertEquals(List.of(
                new ServerConfig.Funding(Address.fromHex(alice), BigInteger.valueOf(1000)),
                new ServerConfig.Funding(Address.fromHex(OWNER), BigInteger.valueOf(5))), cfg.fund());

        var remote = ServerConfig.parse(new String[]{"--owner", OWNER, "--ledger", "ledger.local:7000"});
        assertEquals("ledger.local", remote.ledgerHost());
        assertEquals(7000, remote.ledgerHostPort());

        assertThrows(IllegalArgumentException.class, () -> ServerConfig.parse(new String[]{
                "--owner", OWNER, "--ledger", "ledger.local:7000", "--fund", alice + "=1"}));
    }

    @Test
    void json_file_supplies_defaults_and_flags_override() throws IOException {
        Path file = dir.resolve("dripline.json");
        Files.writeString(file, """
                {
                  "httpPort": 9090,
                  "dataDir": "/var/lib/dripline",
                  "owner": "%s",
                  "snapshotEvery": 10,
                  "fund": ["%s=42"]
                }
                """.formatted(OWNER, OWNER));

        var cfg = ServerConfig.parse(new String[]{"--config", file.toString(), "--http-port", "9191"});

        assertEquals(9191, cfg.httpPort());
        assertEquals(Path.of("/var/lib/dripline"), cfg.dataDir());
        assertEquals(Address.fromHex(OWNER), cfg.owner());
        assertEquals(10, cfg.snapshotEvery());
        assertEquals(BigInteger.valueOf(42), cfg.fund().get(0).amount());
    }

    @Test
    void unknown_json_field_fails() throws IOException {
        Path file = dir.resolve("bad.json");
        Files.writeString(file, "{\"owner\": \"" + OWNER + "\", \"nodeId\": \"x\"}");

        assertThrows(RuntimeException.class,
                () -> ServerConfig.parse(new String[]{"--config", file.toString()}));
    }
}
