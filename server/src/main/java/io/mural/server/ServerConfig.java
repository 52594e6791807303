// file: server/src/main/java/io/mural/server/ServerConfig.java
package io.mural.server;

/**
 * Per-node server configuration parsed from CLI args.
 *
 * Supports:
 *  - nodeId:            logical node identity (message ids, Lamport timestamps)
 *  - httpPort:          external HTTP API port
 *  - grpcPort:          internal gRPC replica port
 *  - dataDir:           root directory; the log lives in dataDir/nodeId/wal
 *  - clusterConfigPath: optional JSON cluster config for multi-node setups
 *
 * With a cluster config the ports of the local node come from the file and
 * only nodeId is taken from the command line (when given).
 */
public record ServerConfig(
        String nodeId,
        int httpPort,
        int grpcPort,
        String dataDir,
        String clusterConfigPath
) {

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --node-id,        -n <id>
     *   --http-port,      -p <port>
     *   --grpc-port,      -g <port>
     *   --data-dir,       -d <path>
     *   --cluster-config, -c <path>
     *   --help,           -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        // Defaults
        String nodeId = null;
        int httpPort = 8080;
        int grpcPort = 50051;
        String dataDir = "./data";
        String clusterConfigPath = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--node-id", "-n" -> {
                    ensureValue(args, i);
                    nodeId = args[++i];
                }

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = parsePort("http-port", args[++i]);
                }

                case "--grpc-port", "-g" -> {
                    ensureValue(args, i);
                    grpcPort = parsePort("grpc-port", args[++i]);
                }

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--cluster-config", "-c" -> {
                    ensureValue(args, i);
                    clusterConfigPath = args[++i];
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(
                nodeId,
                httpPort,
                grpcPort,
                dataDir,
                clusterConfigPath
        );
    }

    /** nodeId from the command line, or "node-a" when neither flag nor file names one. */
    public String nodeIdOrDefault() {
        return nodeId == null || nodeId.isBlank() ? "node-a" : nodeId;
    }

    private static int parsePort(String flag, String raw) {
        try {
            int port = Integer.parseInt(raw);
            if (port <= 0 || port > 65535) {
                System.err.println("Invalid " + flag + ": " + raw);
                System.exit(1);
            }
            return port;
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + flag + ": " + raw);
            System.exit(1);
            return -1;
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: mural-server [options]

            Options:
              --node-id,        -n   Node identifier (default: node-a, or localNodeId from the cluster file)
              --http-port,      -p   HTTP port (default: 8080; ignored with --cluster-config)
              --grpc-port,      -g   gRPC replica port (default: 50051; ignored with --cluster-config)
              --data-dir,       -d   Data directory (default: ./data)
              --cluster-config, -c   Path to JSON cluster config (optional)
              --help,           -h   Show this help message
            """);
        System.exit(0);
    }
}
