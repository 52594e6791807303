// file: server/src/main/java/io/mural/server/cluster/ClusterConfig.java
package io.mural.server.cluster;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mural.server.dto.JsonConfig;
import io.mural.server.replication.RetryPolicy;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static membership and replication settings of a board cluster.
 * <p>
 * Every node lists every node, itself included; peers() is the same list with
 * the local node removed. Membership does not change at runtime.
 */
public final class ClusterConfig {

    public record Node(
            String nodeId,
            String host,
            int httpPort,
            int grpcPort
    ) {
        public Node {
            Objects.requireNonNull(nodeId, "nodeId");
            Objects.requireNonNull(host, "host");
            if (nodeId.isBlank()) throw new IllegalArgumentException("nodeId must not be blank");
            if (httpPort <= 0 || httpPort > 65535) throw new IllegalArgumentException("httpPort out of range");
            if (grpcPort <= 0 || grpcPort > 65535) throw new IllegalArgumentException("grpcPort out of range");
        }
    }

    /**
     * Timing and sizing knobs for replication and reconciliation.
     * A zero anti-entropy interval disables periodic reconciliation.
     */
    public record ReplicationSettings(
            Duration retryBase,
            Duration retryMax,
            int maxPushAttempts,
            int failureThreshold,
            Duration pullTimeout,
            Duration pushTimeout,
            Duration antiEntropyInterval,
            int workerThreads
    ) {
        public ReplicationSettings {
            if (failureThreshold <= 0) throw new IllegalArgumentException("failureThreshold must be > 0");
            if (pullTimeout.isNegative() || pullTimeout.isZero()) throw new IllegalArgumentException("pullTimeout must be > 0");
            if (pushTimeout.isNegative() || pushTimeout.isZero()) throw new IllegalArgumentException("pushTimeout must be > 0");
            if (antiEntropyInterval.isNegative()) throw new IllegalArgumentException("antiEntropyInterval must be >= 0");
            if (workerThreads <= 0) throw new IllegalArgumentException("workerThreads must be > 0");
            // validates retry fields
            new RetryPolicy(retryBase, retryMax, maxPushAttempts);
        }

        public static ReplicationSettings defaults() {
            return from(new JsonConfig.JsonReplication());
        }

        public RetryPolicy retryPolicy() {
            return new RetryPolicy(retryBase, retryMax, maxPushAttempts);
        }

        static ReplicationSettings from(JsonConfig.JsonReplication r) {
            return new ReplicationSettings(
                    Duration.ofMillis(r.retryBaseMillis),
                    Duration.ofMillis(r.retryMaxMillis),
                    r.maxPushAttempts,
                    r.failureThreshold,
                    Duration.ofMillis(r.pullTimeoutMillis),
                    Duration.ofMillis(r.pushTimeoutMillis),
                    Duration.ofSeconds(r.antiEntropyIntervalSeconds),
                    r.workerThreads
            );
        }
    }

    private final String localNodeId;
    private final List<Node> nodes;
    private final Map<String, String> users;
    private final String adminToken;
    private final ReplicationSettings replication;

    public ClusterConfig(
            String localNodeId,
            List<Node> nodes,
            Map<String, String> users,
            String adminToken,
            ReplicationSettings replication
    ) {
        if (nodes == null || nodes.isEmpty()) throw new IllegalArgumentException("nodes must not be empty");
        Set<String> seen = new HashSet<>();
        for (Node n : nodes) {
            if (!seen.add(n.nodeId())) throw new IllegalArgumentException("duplicate nodeId " + n.nodeId());
        }
        this.localNodeId = Objects.requireNonNull(localNodeId, "localNodeId");
        if (!seen.contains(localNodeId)) {
            throw new IllegalArgumentException(
                    "localNodeId %s not present in cluster nodes".formatted(localNodeId));
        }
        this.nodes = List.copyOf(nodes);
        this.users = users == null ? Map.of() : Map.copyOf(users);
        this.adminToken = (adminToken == null || adminToken.isBlank()) ? null : adminToken;
        this.replication = Objects.requireNonNull(replication, "replication");
    }

    /** Single-node cluster built from CLI flags alone. */
    public static ClusterConfig singleNode(String nodeId, int httpPort, int grpcPort, Map<String, String> users) {
        return new ClusterConfig(
                nodeId,
                List.of(new Node(nodeId, "localhost", httpPort, grpcPort)),
                users,
                null,
                ReplicationSettings.defaults()
        );
    }

    // Lets Main override localNodeId with the CLI --node-id
    public static ClusterConfig fromJsonFile(Path path, String overrideLocalNodeId) {
        ObjectMapper mapper = new ObjectMapper();
        JsonConfig cfg;
        try {
            cfg = mapper.readValue(path.toFile(), JsonConfig.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load ClusterConfig from " + path, e);
        }
        if (cfg.nodes == null) throw new IllegalArgumentException("nodes must not be empty");

        List<Node> nodeList = cfg.nodes.stream()
                .map(n -> new Node(n.nodeId, n.host, n.httpPort, n.grpcPort))
                .toList();

        String localId = (overrideLocalNodeId != null && !overrideLocalNodeId.isBlank())
                ? overrideLocalNodeId
                : cfg.localNodeId;

        return new ClusterConfig(
                localId,
                nodeList,
                cfg.users,
                cfg.adminToken,
                ReplicationSettings.from(cfg.replication == null ? new JsonConfig.JsonReplication() : cfg.replication)
        );
    }

    public String localNodeId() {
        return localNodeId;
    }

    public List<Node> nodes() {
        return nodes;
    }

    public List<Node> peers() {
        return nodes.stream()
                .filter(n -> !n.nodeId().equals(localNodeId))
                .toList();
    }

    public Map<String, String> users() {
        return users;
    }

    /** Shared secret for admin routes, or null when they are open. */
    public String adminToken() {
        return adminToken;
    }

    public ReplicationSettings replication() {
        return replication;
    }

    public Node localNode() {
        return nodes.stream()
                .filter(n -> n.nodeId().equals(localNodeId))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "localNodeId %s not present in cluster nodes".formatted(localNodeId)
                ));
    }
}
