// file: server/src/main/java/io/dripline/server/Main.java
package io.dripline.server;

import io.dripline.core.access.OwnerAccessControl;
import io.dripline.core.ledger.InMemoryToken;
import io.dripline.core.ledger.TokenLedger;
import io.dripline.server.events.ClaimFeed;
import io.dripline.server.ledger.GrpcLedgerService;
import io.dripline.server.ledger.GrpcTokenLedger;
import io.dripline.storage.DurableDistributorStore;
import io.dripline.storage.FileSnapshotter;
import io.dripline.storage.FileWal;
import io.dripline.storage.SnapshotPolicy;
import io.grpc.Server;
import io.grpc.ServerBuilder;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a distributor node.
 *
 * Responsibilities:
 *  - Parse configuration from CLI (and the optional JSON file).
 *  - Wire storage (WAL, snapshots, durable store with recovery).
 *  - Pick the token ledger: remote gRPC, or a built-in in-memory token that
 *    can itself be served over gRPC.
 *  - Create DistributorService, the claim feed and the HTTP server.
 *  - Snapshot and close storage on shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());
    private static final int FEED_CAPACITY = 10_000;

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        configureLogging();
        var cfg = ServerConfig.fromArgs(args);

        // ------ Storage Layer -------
        var wal = new FileWal(cfg.walDir(), cfg.walRotateBytes());
        var snaps = new FileSnapshotter(cfg.snapDir());
        var store = new DurableDistributorStore(wal, snaps, new SnapshotPolicy(cfg.snapshotEvery()));
        log.info(() -> "recovered store at sequence " + store.lastSequence() + " from " + cfg.dataDir());

        // ------ Ledger -------
        TokenLedger ledger;
        GrpcTokenLedger remote = null;
        Server ledgerServer = null;
        if (cfg.ledger() != null) {
            remote = new GrpcTokenLedger(cfg.ledgerHost(), cfg.ledgerHostPort(), cfg.custody());
            ledger = remote;
            log.info(() -> "using remote ledger at " + cfg.ledger());
        } else {
            var token = new InMemoryToken();
            for (ServerConfig.Funding f : cfg.fund()) {
                token.mint(f.account(), f.amount());
                token.approve(f.account(), cfg.custody(), f.amount());
            }
            ledger = token.ledgerFor(cfg.custody());
            log.info("using in-memory ledger (balances are not persisted)");
            if (cfg.ledgerPort() > 0) {
                ledgerServer = ServerBuilder
                        .forPort(cfg.ledgerPort())
                        .addService(new GrpcLedgerService(token))
                        .build()
                        .start();
            }
        }

        // ------ Distributor + HTTP ------
        var access = new OwnerAccessControl(cfg.owner());
        var distributor = new DistributorService(store, ledger, access, cfg.custody());
        var feed = new ClaimFeed(FEED_CAPACITY);
        distributor.addListener(feed);

        var web = new WebServer(cfg.httpPort(), distributor, feed);
        web.start();

        System.out.printf(
                "Distributor listening on http://%s:%d (owner %s, custody %s)%s%n",
                "localhost", cfg.httpPort(),
                cfg.owner(), cfg.custody(),
                ledgerServer != null ? ", ledger on grpc://localhost:" + cfg.ledgerPort() : ""
        );

        // Shutdown hook
        final GrpcTokenLedger remoteLedger = remote;
        final Server grpcServer = ledgerServer;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
                if (grpcServer != null) grpcServer.shutdown();
                if (remoteLedger != null) remoteLedger.shutdown();
                store.snapshotNow();
                wal.close();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "error during shutdown", e);
            }
        }));
    }

    /** Load logging.properties from the classpath unless a config file was given explicitly. */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) return;
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("could not load logging.properties: " + e.getMessage());
        }
    }
}
