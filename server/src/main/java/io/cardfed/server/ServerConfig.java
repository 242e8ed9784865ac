// file: server/src/main/java/io/cardfed/server/ServerConfig.java
package io.cardfed.server;

/**
 * Per-server configuration parsed from CLI args.
 *
 * Supports:
 *  - serverId:             identity of this server within the federation
 *  - httpPort:             HTTP API port (client API and peer endpoint)
 *  - federationConfigPath: optional JSON federation config listing peers
 *  - seedPath:             optional JSON seed for the local store
 */
public record ServerConfig(
        String serverId,
        int httpPort,
        String federationConfigPath,
        String seedPath
) {

    public static final String DEFAULT_SERVER_ID = "server-a";

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --server-id,         -n   <id>
     *   --http-port,         -p   <port>
     *   --federation-config, -c   <path>
     *   --seed,              -s   <path>
     *   --help,              -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        // Defaults; a null serverId defers to the federation config file.
        String serverId = null;
        int httpPort = 8080;
        String federationConfigPath = null;
        String seedPath = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--server-id", "-n" -> {
                    ensureValue(args, i);
                    serverId = args[++i];
                }

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    try {
                        httpPort = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid http-port: " + args[i]);
                        System.exit(1);
                    }
                }

                case "--federation-config", "-c" -> {
                    ensureValue(args, i);
                    federationConfigPath = args[++i];
                }

                case "--seed", "-s" -> {
                    ensureValue(args, i);
                    seedPath = args[++i];
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(serverId, httpPort, federationConfigPath, seedPath);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: server [options]

            Options:
              --server-id,         -n   Server identifier (default: from config, else server-a)
              --http-port,         -p   HTTP port (default: 8080)
              --federation-config, -c   Path to JSON federation config (optional)
              --seed,              -s   Path to JSON store seed (optional)
              --help,              -h   Show this help message
            """);
        System.exit(0);
    }
}
