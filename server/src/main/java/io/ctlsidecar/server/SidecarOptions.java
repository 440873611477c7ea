// file: server/src/main/java/io/ctlsidecar/server/SidecarOptions.java
package io.ctlsidecar.server;

/**
 * Sidecar process options parsed from CLI args.
 *
 * Supports:
 *  - bindAddr: host:port to listen on
 *  - ldbPath:  path to the local SQLite replica of the control store
 *  - maxRows:  ceiling on rows per prefix-scan response (0 = unbounded)
 */
public record SidecarOptions(
        String bindAddr,
        String ldbPath,
        int maxRows
) {
    static final String DEFAULT_BIND_ADDR = "localhost:1331";
    static final String DEFAULT_LDB_PATH = "/var/spool/ctlstore/ldb.db";

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --bind-addr, -b   <host:port>
     *   --ldb-path,  -l   <path>
     *   --max-rows,  -m   <n>
     *   --help,      -h
     *
     * Invalid input raises IllegalArgumentException; --help returns null after printing usage.
     */
    public static SidecarOptions fromArgs(String[] args) {
        String bindAddr = DEFAULT_BIND_ADDR;
        String ldbPath = DEFAULT_LDB_PATH;
        int maxRows = 0;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> {
                    printHelp();
                    return null;
                }

                case "--bind-addr", "-b" -> {
                    ensureValue(args, i);
                    bindAddr = args[++i];
                    BindAddress.parse(bindAddr);
                }

                case "--ldb-path", "-l" -> {
                    ensureValue(args, i);
                    ldbPath = args[++i];
                }

                case "--max-rows", "-m" -> {
                    ensureValue(args, i);
                    try {
                        maxRows = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid max-rows: " + args[i], e);
                    }
                    if (maxRows < 0) {
                        throw new IllegalArgumentException("max-rows must be >= 0");
                    }
                }

                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return new SidecarOptions(bindAddr, ldbPath, maxRows);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
    }

    static void printHelp() {
        System.out.println("""
            Usage: ctlsidecar [options]

            Options:
              --bind-addr, -b   Address to listen on (default: localhost:1331)
              --ldb-path,  -l   Path to the local LDB (default: /var/spool/ctlstore/ldb.db)
              --max-rows,  -m   Max rows per prefix scan, 0 = unbounded (default: 0)
              --help,      -h   Show this help message
            """);
    }
}
