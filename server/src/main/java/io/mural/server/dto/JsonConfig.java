package io.mural.server.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * On-disk shape of the cluster configuration file. Missing replication fields
 * keep their defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class JsonConfig {
    public String localNodeId;
    public List<JsonNode> nodes;
    public Map<String, String> users;
    public String adminToken;
    public JsonReplication replication;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JsonNode {
        public String nodeId;
        public String host = "localhost";
        public int httpPort;
        public int grpcPort;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JsonReplication {
        public long retryBaseMillis = 200;
        public long retryMaxMillis = 5000;
        public int maxPushAttempts = 5;
        public int failureThreshold = 3;
        public long pullTimeoutMillis = 4000;
        public long pushTimeoutMillis = 3000;
        public long antiEntropyIntervalSeconds = 30;
        public int workerThreads = 4;
    }
}
