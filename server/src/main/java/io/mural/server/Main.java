// file: server/src/main/java/io/mural/server/Main.java
package io.mural.server;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.mural.server.cluster.ClusterConfig;
import io.mural.server.peer.GrpcPeerClient;
import io.mural.server.replica.GrpcMessageReplicaService;
import io.mural.server.replication.ReconciliationReport;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a single board node.
 *
 * Responsibilities:
 *  - Parse configuration from CLI (and the optional cluster file).
 *  - Build the node: log, store, clock, peers, replication, reconciliation,
 *    failure simulator and auth gate (BoardNode).
 *  - Start the gRPC server for replica traffic and the HTTP server for clients.
 *  - Catch up with peers once at startup, then keep reconciling in the background.
 *  - Stop everything and close the log on shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    /** Users for clusters started without a config file. */
    private static final Map<String, String> DEFAULT_USERS = Map.of(
            "alice", "password1",
            "bob", "password2",
            "carol", "password3"
    );

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        configureLogging();
        var cfg = ServerConfig.fromArgs(args);
        ClusterConfig cluster = buildClusterConfig(cfg);
        ClusterConfig.Node local = cluster.localNode();

        var node = new BoardNode(
                cluster,
                Path.of(cfg.dataDir()),
                (peer, localId) -> new GrpcPeerClient(peer.nodeId(), localId, peer.host(), peer.grpcPort())
        );

        // ------ gRPC replica server ------
        Server grpcServer = ServerBuilder
                .forPort(local.grpcPort())
                .addService(new GrpcMessageReplicaService(node.board()))
                .build();
        grpcServer.start();

        // ------ HTTP layer ------
        var web = new WebServer(local.httpPort(), node);
        web.start();

        log.log(Level.INFO, "Node {0} listening on http://{1}:{2} (HTTP) and grpc://{1}:{3} (replica), peers={4}",
                new Object[]{
                        node.nodeId(), local.host(),
                        String.valueOf(local.httpPort()), String.valueOf(local.grpcPort()),
                        cluster.peers().size()
                });

        // Initial catch-up; never blocks startup
        node.reconciliation().reconcileAllAsync().thenAccept(Main::logStartupRound);
        node.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            web.stop();
            grpcServer.shutdown();
            try {
                if (!grpcServer.awaitTermination(5, TimeUnit.SECONDS)) {
                    grpcServer.shutdownNow();
                }
            } catch (InterruptedException e) {
                grpcServer.shutdownNow();
                Thread.currentThread().interrupt();
            }
            node.close();
        }, "shutdown"));
    }

    private static void logStartupRound(ReconciliationReport report) {
        log.log(Level.INFO, "Startup reconciliation: pulled={0} pushedBack={1} failedPeers={2}",
                new Object[]{report.pulled(), report.pushedBack(), report.failedPeers()});
    }

    private static ClusterConfig buildClusterConfig(ServerConfig cfg) {
        if (cfg.clusterConfigPath() != null && !cfg.clusterConfigPath().isBlank()) {
            return ClusterConfig.fromJsonFile(Path.of(cfg.clusterConfigPath()), cfg.nodeId());
        }
        return ClusterConfig.singleNode(cfg.nodeIdOrDefault(), cfg.httpPort(), cfg.grpcPort(), DEFAULT_USERS);
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging.properties: " + e.getMessage());
        }
    }
}
