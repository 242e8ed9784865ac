// file: server/src/main/java/io/cardfed/server/Main.java
package io.cardfed.server;

import io.cardfed.core.normalize.ProfileNormalizer;
import io.cardfed.server.federation.FederationConfig;
import io.cardfed.server.federation.FederationMetrics;
import io.cardfed.server.federation.IdentityMapper;
import io.cardfed.server.federation.ProfileReconciler;
import io.cardfed.server.federation.RemoteFetchOrchestrator;
import io.cardfed.server.peer.HttpPeerClient;
import io.cardfed.server.peer.PeerClient;
import io.cardfed.server.peer.PeerProfileService;
import io.cardfed.storage.InMemoryUserStore;
import io.cardfed.storage.StoreSeed;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a single CardFed server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Build the local store and apply the optional seed.
 *  - Build FederationConfig, peer clients, orchestrator and reconciler.
 *  - Start the HTTP server (client API + peer endpoint).
 */
public final class Main {

    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        configureLogging();
        var cfg = ServerConfig.fromArgs(args);

        // ------ Local store -------
        var normalizer = new ProfileNormalizer();
        var store = new InMemoryUserStore(normalizer, new Random());
        if (cfg.seedPath() != null && !cfg.seedPath().isBlank()) {
            int users = StoreSeed.fromJsonFile(Path.of(cfg.seedPath())).applyTo(store);
            log.info("seeded " + users + " users from " + cfg.seedPath());
        }

        // ------ Federation -------
        FederationConfig federation = buildFederationConfig(cfg);
        var metrics = new FederationMetrics();
        var orchestrator = new RemoteFetchOrchestrator(
                buildPeerClients(federation),
                federation.failurePolicy(),
                metrics
        );
        var reconciler = new ProfileReconciler(
                store,
                new IdentityMapper(store),
                orchestrator,
                normalizer
        );

        // ------ HTTP layer ------
        var web = new WebServer(cfg.httpPort(), reconciler, new PeerProfileService(store), metrics);

        System.out.printf(
                "Server %s listening on http://%s:%d with %d peer(s), policy=%s%n",
                federation.localServerId(),
                "localhost", cfg.httpPort(),
                federation.peers().size(),
                federation.failurePolicy()
        );

        web.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
                orchestrator.close();
            } catch (Exception e) {
                log.log(Level.WARNING, "shutdown failed", e);
            }
        }));
    }

    /** Bundled logging.properties, unless -Djava.util.logging.config.file points elsewhere. */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            log.log(Level.WARNING, "could not load bundled logging.properties", e);
        }
    }

    private static FederationConfig buildFederationConfig(ServerConfig cfg) {
        if (cfg.federationConfigPath() != null && !cfg.federationConfigPath().isBlank()) {
            return FederationConfig.fromJsonFile(Path.of(cfg.federationConfigPath()), cfg.serverId());
        }
        return FederationConfig.standalone(cfg.serverId() != null ? cfg.serverId() : ServerConfig.DEFAULT_SERVER_ID);
    }

    private static List<PeerClient> buildPeerClients(FederationConfig federation) {
        List<PeerClient> clients = new ArrayList<>();
        for (FederationConfig.Peer p : federation.peers()) {
            clients.add(new HttpPeerClient(p.peerId(), p.baseUri(), p.timeout()));
        }
        return clients;
    }
}
