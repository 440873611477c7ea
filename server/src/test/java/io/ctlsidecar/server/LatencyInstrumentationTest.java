package io.ctlsidecar.server;

import io.ctlsidecar.server.handler.SidecarHandler;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LatencyInstrumentationTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final LatencyInstrumentation instrumentation = new LatencyInstrumentation(registry);

    @Test
    void recordsSuccessfulInvocationTaggedByCaller() throws Exception {
        HttpServerExchange exchange = new HttpServerExchange(null);
        exchange.getRequestHeaders().put(Headers.USER_AGENT, "billing-svc/1.2");

        instrumentation.wrap("healthcheck", ex -> { }).handle(exchange);

        Timer t = registry.find(LatencyInstrumentation.METRIC)
                .tag("op", "healthcheck")
                .tag("user-agent", "billing-svc/1.2")
                .timer();
        assertNotNull(t);
        assertEquals(1, t.count());
    }

    @Test
    void failureStillRecordedAndRethrownUnchanged() {
        HttpServerExchange exchange = new HttpServerExchange(null);
        IllegalStateException boom = new IllegalStateException("boom");
        SidecarHandler failing = ex -> {
            throw boom;
        };

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> instrumentation.wrap("ping", failing).handle(exchange));

        assertSame(boom, thrown);
        Timer t = registry.find(LatencyInstrumentation.METRIC)
                .tag("op", "ping")
                .tag("user-agent", LatencyInstrumentation.UNKNOWN_AGENT)
                .timer();
        assertNotNull(t);
        assertEquals(1, t.count());
    }
}
