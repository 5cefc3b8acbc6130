// file: server/src/main/java/io/dripline/server/ServerConfig.java
package io.dripline.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.dripline.core.Address;
import io.dripline.core.Uint256;
import io.dripline.server.dto.JsonConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Server configuration parsed from CLI args, optionally layered over a JSON file.
 *
 * Supports:
 *  - httpPort:       external HTTP API port
 *  - dataDir:        data directory; WAL segments go to dataDir/wal, snapshots to dataDir/snap
 *  - owner:          initial administrator address (required)
 *  - custody:        the distributor's own ledger address
 *  - ledger:         host:port of a remote gRPC ledger, or null for the built-in in-memory token
 *  - ledgerPort:     when using the in-memory token, also serve it over gRPC on this port (0 = off)
 *  - snapshotEvery:  commits between automatic snapshots
 *  - walRotateBytes: WAL segment size before rotation
 *  - fund:           in-memory token only: accounts minted at startup, with custody approved to pull the amount
 */
public record ServerConfig(
        int httpPort,
        Path dataDir,
        Address owner,
        Address custody,
        String ledger,
        int ledgerPort,
        int snapshotEvery,
        long walRotateBytes,
        List<Funding> fund
) {
    public static final Address DEFAULT_CUSTODY = Address.ofLong(1);

    /** Startup grant for the in-memory token. */
    public record Funding(Address account, BigInteger amount) {
        /** Parse {@code 0xabc..=1000}. */
        static Funding parse(String raw) {
            int eq = raw.indexOf('=');
            if (eq <= 0) throw new IllegalArgumentException("fund must look like <address>=<amount>, got " + raw);
            return new Funding(
                    Address.fromHex(raw.substring(0, eq).trim()),
                    Uint256.parse(raw.substring(eq + 1).trim(), "fund amount"));
        }
    }

    public Path walDir() {
        return dataDir.resolve("wal");
    }

    public Path snapDir() {
        return dataDir.resolve("snap");
    }

    /** Host part of {@link #ledger()}. */
    public String ledgerHost() {
        return ledger.substring(0, ledger.lastIndexOf(':'));
    }

    /** Port part of {@link #ledger()}. */
    public int ledgerHostPort() {
        return Integer.parseInt(ledger.substring(ledger.lastIndexOf(':') + 1));
    }

    /**
     * CLI entry: prints usage and exits on --help or invalid input.
     *
     * Supported flags:
     *   --http-port,  -p  <port>
     *   --data-dir,   -d  <path>
     *   --owner,      -o  <address>
     *   --custody         <address>
     *   --ledger          <host:port>
     *   --ledger-port     <port>
     *   --snapshot-every  <commits>
     *   --wal-rotate-bytes <bytes>
     *   --fund            <address>=<amount>   (repeatable)
     *   --config,     -c  <path.json>
     *   --help,       -h
     */
    public static ServerConfig fromArgs(String[] args) {
        for (String a : args) {
            if ("--help".equals(a) || "-h".equals(a)) printHelpAndExit(0);
        }
        try {
            return parse(args);
        } catch (IllegalArgumentException | UncheckedIOException e) {
            System.err.println(e.getMessage());
            printHelpAndExit(1);
            return null; // unreachable
        }
    }

    /** Parse without exiting; invalid input raises IllegalArgumentException. */
    public static ServerConfig parse(String[] args) {
        // Defaults
        int httpPort = 8080;
        String dataDir = "./data";
        String owner = null;
        String custody = null;
        String ledger = null;
        int ledgerPort = 0;
        int snapshotEvery = 50_000;
        long walRotateBytes = 64L * 1024 * 1024;
        List<String> fund = new ArrayList<>();

        // The file supplies defaults; flags below override it.
        String configPath = findConfigPath(args);
        if (configPath != null) {
            JsonConfig file = readJson(Path.of(configPath));
            if (file.httpPort != null) httpPort = file.httpPort;
            if (file.dataDir != null) dataDir = file.dataDir;
            if (file.owner != null) owner = file.owner;
            if (file.custody != null) custody = file.custody;
            if (file.ledger != null) ledger = file.ledger;
            if (file.ledgerPort != null) ledgerPort = file.ledgerPort;
            if (file.snapshotEvery != null) snapshotEvery = file.snapshotEvery;
            if (file.walRotateBytes != null) walRotateBytes = file.walRotateBytes;
            if (file.fund != null) fund.addAll(file.fund);
        }

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--http-port", "-p" -> httpPort = parseInt(value(args, i++), "http-port");
                case "--data-dir", "-d" -> dataDir = value(args, i++);
                case "--owner", "-o" -> owner = value(args, i++);
                case "--custody" -> custody = value(args, i++);
                case "--ledger" -> ledger = value(args, i++);
                case "--ledger-port" -> ledgerPort = parseInt(value(args, i++), "ledger-port");
                case "--snapshot-every" -> snapshotEvery = parseInt(value(args, i++), "snapshot-every");
                case "--wal-rotate-bytes" -> walRotateBytes = parseLong(value(args, i++), "wal-rotate-bytes");
                case "--fund" -> fund.add(value(args, i++));
                case "--config", "-c" -> i++; // already applied
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        if (owner == null) throw new IllegalArgumentException("--owner is required");
        if (httpPort <= 0 || httpPort > 65535) throw new IllegalArgumentException("http-port out of range: " + httpPort);
        if (ledgerPort < 0 || ledgerPort > 65535) throw new IllegalArgumentException("ledger-port out of range: " + ledgerPort);
        if (snapshotEvery <= 0) throw new IllegalArgumentException("snapshot-every must be > 0");
        if (walRotateBytes <= 0) throw new IllegalArgumentException("wal-rotate-bytes must be > 0");
        if (ledger != null) {
            int colon = ledger.lastIndexOf(':');
            if (colon <= 0) throw new IllegalArgumentException("ledger must be host:port, got " + ledger);
            parseInt(ledger.substring(colon + 1), "ledger port");
            if (!fund.isEmpty()) throw new IllegalArgumentException("--fund only applies to the in-memory ledger");
            if (ledgerPort != 0) throw new IllegalArgumentException("--ledger-port only applies to the in-memory ledger");
        }

        return new ServerConfig(
                httpPort,
                Path.of(dataDir),
                Address.fromHex(owner),
                custody == null ? DEFAULT_CUSTODY : Address.fromHex(custody),
                ledger,
                ledgerPort,
                snapshotEvery,
                walRotateBytes,
                fund.stream().map(Funding::parse).toList()
        );
    }

    private static String findConfigPath(String[] args) {
        String path = null;
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i]) || "-c".equals(args[i])) {
                path = value(args, i);
            }
        }
        return path;
    }

    private static JsonConfig readJson(Path path) {
        try {
            return new ObjectMapper().readValue(path.toFile(), JsonConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read config " + path + ": " + e.getMessage(), e);
        }
    }

    private static String value(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
        return args[i + 1];
    }

    private static int parseInt(String s, String name) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + s);
        }
    }

    private static long parseLong(String s, String name) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + s);
        }
    }

    private static void printHelpAndExit(int code) {
        System.out.println("""
            Usage: server --owner <address> [options]

            Options:
              --http-port,  -p    HTTP port (default: 8080)
              --data-dir,   -d    Data directory holding wal/ and snap/ (default: ./data)
              --owner,      -o    Administrator address, 0x-prefixed (required)
              --custody           Distributor ledger address (default: 0x00..01)
              --ledger            host:port of a gRPC ledger (default: built-in in-memory token)
              --ledger-port       Serve the in-memory token over gRPC on this port (default: off)
              --snapshot-every    Commits between snapshots (default: 50000)
              --wal-rotate-bytes  WAL segment size in bytes (default: 67108864)
              --fund              <address>=<amount>, mint and approve custody (in-memory token, repeatable)
              --config,     -c    JSON config file; flags override its values
              --help,       -h    Show this help message
            """);
        System.exit(code);
    }
}
