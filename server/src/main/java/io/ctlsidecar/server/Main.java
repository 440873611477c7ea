// file: server/src/main/java/io/ctlsidecar/server/Main.java
package io.ctlsidecar.server;

import io.ctlsidecar.storage.LdbReader;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.logging.LoggingMeterRegistry;
import io.micrometer.core.instrument.logging.LoggingRegistryConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for the sidecar process.
 *
 * Responsibilities:
 *  - Load logging configuration.
 *  - Parse options from CLI.
 *  - Wire the LDB reader, a logging metrics registry and Sidecar.
 *  - Start serving and stop cleanly on shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());
    private static final Logger metricsLog = Logger.getLogger("io.ctlsidecar.metrics");

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        configureLogging();

        SidecarOptions opts;
        try {
            opts = SidecarOptions.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            SidecarOptions.printHelp();
            System.exit(1);
            return;
        }
        if (opts == null) {
            return; // --help
        }

        var reader = new LdbReader(Path.of(opts.ldbPath()));
        var registry = meterRegistry(metricsLog::info);
        var sidecar = new Sidecar(new SidecarConfig(opts.bindAddr(), reader, opts.maxRows()), registry);

        try {
            sidecar.start();
        } catch (StartupException e) {
            log.severe(e.getMessage() + ": " + e.getCause());
            registry.close();
            System.exit(1);
            return;
        }
        log.info("serving LDB " + opts.ldbPath() + " (max rows " + opts.maxRows() + ")");

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            sidecar.stop();
            registry.close();
        }, "sidecar-shutdown"));
    }

    /** Registry that publishes a summary of every meter to 'sink' once per step (one minute by default). */
    static MeterRegistry meterRegistry(Consumer<String> sink) {
        return LoggingMeterRegistry.builder(LoggingRegistryConfig.DEFAULT)
                .loggingSink(sink)
                .build();
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("failed to load logging.properties: " + e.getMessage());
        }
    }
}
