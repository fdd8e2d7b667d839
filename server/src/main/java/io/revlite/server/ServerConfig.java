// file: server/src/main/java/io/revlite/server/ServerConfig.java
package io.revlite.server;

/**
 * Development provider configuration parsed from CLI args.
 *
 * Supports:
 *  - host: interface to bind
 *  - port: HTTP / WebSocket port
 *  - path: WebSocket endpoint path clients connect to
 */
public record ServerConfig(
        String host,
        int port,
        String path
) {

    public static final String DEFAULT_PATH = "/api/storage/memory";

    public ServerConfig {
        if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        if (path == null || !path.startsWith("/")) throw new IllegalArgumentException("path must start with '/': " + path);
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --host, -H   <host>
     *   --port, -p   <port>
     *   --path       <path>
     *   --help, -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        // Defaults
        String host = "0.0.0.0";
        int port = 8080;
        String path = DEFAULT_PATH;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--host", "-H" -> {
                    ensureValue(args, i);
                    host = args[++i];
                }

                case "--port", "-p" -> {
                    ensureValue(args, i);
                    try {
                        port = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid port: " + args[i]);
                        System.exit(1);
                    }
                }

                case "--path" -> {
                    ensureValue(args, i);
                    path = args[++i];
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(host, port, path);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: revlite-server [options]

            Options:
              --host, -H   Interface to bind (default: 0.0.0.0)
              --port, -p   HTTP / WebSocket port (default: 8080)
              --path       WebSocket endpoint path (default: /api/storage/memory)
              --help, -h   Show this help message
            """);
        System.exit(0);
    }
}
