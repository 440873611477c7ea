// file: server/src/main/java/io/ctlsidecar/server/Sidecar.java
package io.ctlsidecar.server;

import io.ctlsidecar.server.handler.GetRowByKeyHandler;
import io.ctlsidecar.server.handler.GetRowsByKeyPrefixHandler;
import io.ctlsidecar.server.handler.HealthcheckHandler;
import io.ctlsidecar.server.handler.LedgerLatencyHandler;
import io.ctlsidecar.server.handler.PingHandler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.handlers.BlockingHandler;
import org.xnio.Options;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Read-only HTTP front for a control-store {@link io.ctlsidecar.core.Reader}.
 *
 * Responsibilities:
 *  - Route the five sidecar endpoints to their handlers.
 *  - Run handlers on worker threads with a per-request read context.
 *  - Instrument every handler and translate failures into 500s.
 *  - Bound every connection with fixed read/write deadlines.
 *
 * Path layout:
 *   - POST /get-row-by-key/{family}/{table}            point lookup
 *   - POST /get-rows-by-key-prefix/{family}/{table}    prefix scan
 *   - GET  /get-ledger-latency                         replica lag in seconds
 *   - GET  /healthcheck                                 200 iff the reader answers
 *   - GET  /ping                                        same as /healthcheck
 */
public final class Sidecar {
    private static final Logger log = Logger.getLogger(Sidecar.class.getName());

    static final Duration READ_TIMEOUT = Duration.ofSeconds(5);
    static final Duration WRITE_TIMEOUT = Duration.ofSeconds(5);

    private final BindAddress bindAddr;
    private final HttpHandler handler;
    private final Undertow server;
    private volatile boolean started;

    public Sidecar(SidecarConfig config) {
        this(config, new SimpleMeterRegistry());
    }

    public Sidecar(SidecarConfig config, MeterRegistry registry) {
        Objects.requireNonNull(config, "config");
        this.bindAddr = BindAddress.parse(config.bindAddr());

        var healthcheck = new HealthcheckHandler(config.reader());
        Router router = new Router(new LatencyInstrumentation(registry))
                .post("/get-row-by-key/{family}/{table}", "get-row-by-key",
                        new GetRowByKeyHandler(config.reader()))
                .post("/get-rows-by-key-prefix/{family}/{table}", "get-rows-by-key-prefix",
                        new GetRowsByKeyPrefixHandler(config.reader(), config.maxRows()))
                .get("/get-ledger-latency", "get-ledger-latency",
                        new LedgerLatencyHandler(config.reader()))
                .get("/healthcheck", "healthcheck", healthcheck)
                .get("/ping", "ping", new PingHandler(healthcheck));

        HttpHandler routed = RequestContexts.attaching(WRITE_TIMEOUT, router.handler());
        this.handler = new BlockingHandler(exchange -> {
            RequestLogger.track(exchange);
            routed.handleRequest(exchange);
        });

        this.server = Undertow.builder()
                .addHttpListener(bindAddr.port(), bindAddr.host())
                .setSocketOption(Options.READ_TIMEOUT, (int) READ_TIMEOUT.toMillis())
                .setSocketOption(Options.WRITE_TIMEOUT, (int) WRITE_TIMEOUT.toMillis())
                .setHandler(handler)
                .build();
    }

    /** Bind and start serving. Throws {@link StartupException} if the address cannot be bound. */
    public void start() {
        try {
            server.start();
        } catch (RuntimeException e) {
            throw new StartupException("listen and serve on " + bindAddr, e);
        }
        started = true;
        log.info("sidecar listening on " + bindAddr.host() + ":" + port());
    }

    public void stop() {
        if (started) {
            started = false;
            server.stop();
        }
    }

    /** Actual bound port; differs from the configured one when that was 0. */
    public int port() {
        if (!started) {
            throw new IllegalStateException("sidecar not started");
        }
        var address = (InetSocketAddress) server.getListenerInfo().get(0).getAddress();
        return address.getPort();
    }

    /** Root handler, for embedding the sidecar routes in another Undertow server. */
    public HttpHandler handler() {
        return handler;
    }
}
