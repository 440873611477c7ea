package io.ctlsidecar.server;

import io.ctlsidecar.core.ReadContext;
import io.ctlsidecar.core.Reader;
import io.ctlsidecar.core.ReaderException;
import io.ctlsidecar.core.Row;
import io.ctlsidecar.core.RowCursor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A client that hangs up while its request is still inside the reader cancels
 * the request context; a client that waits does not.
 */
class ClientDisconnectTest {

    private Sidecar sidecar;

    @AfterEach
    void stopServer() {
        if (sidecar != null) {
            sidecar.stop();
        }
    }

    private void start(Reader reader) {
        sidecar = new Sidecar(new SidecarConfig("127.0.0.1:0", reader, 0), new SimpleMeterRegistry());
        sidecar.start();
    }

    @Test
    void closing_the_socket_cancels_healthcheck_in_flight() throws Exception {
        WaitingReader reader = new WaitingReader(Duration.ofSeconds(4));
        start(reader);

        try (Socket socket = new Socket("127.0.0.1", sidecar.port())) {
            send(socket, "GET /healthcheck HTTP/1.1\r\nHost: localhost\r\n\r\n");
            assertTrue(reader.entered.await(2, TimeUnit.SECONDS), "reader was never called");
        }

        assertTrue(reader.cancelled.await(2, TimeUnit.SECONDS),
                "context was not cancelled after the client disconnected");
        assertTrue(reader.seenContext.isCancelled());
    }

    @Test
    void closing_the_socket_cancels_lookup_after_body_was_read() throws Exception {
        WaitingReader reader = new WaitingReader(Duration.ofSeconds(4));
        start(reader);

        String body = "{\"key\":[{\"value\":1}]}";
        try (Socket socket = new Socket("127.0.0.1", sidecar.port())) {
            send(socket, "POST /get-row-by-key/accounts/users HTTP/1.1\r\n"
                    + "Host: localhost\r\n"
                    + "Content-Type: application/json\r\n"
                    + "Content-Length: " + body.length() + "\r\n"
                    + "\r\n"
                    + body);
            assertTrue(reader.entered.await(2, TimeUnit.SECONDS), "reader was never called");
        }

        assertTrue(reader.cancelled.await(2, TimeUnit.SECONDS),
                "context was not cancelled after the client disconnected");
    }

    @Test
    void connected_client_is_not_cancelled_while_reader_is_slow() throws Exception {
        WaitingReader reader = new WaitingReader(Duration.ofMillis(700));
        start(reader);

        try (Socket socket = new Socket("127.0.0.1", sidecar.port())) {
            socket.setSoTimeout(5_000);
            send(socket, "GET /healthcheck HTTP/1.1\r\nHost: localhost\r\n\r\n");

            BufferedReader in = new BufferedReader(
                    new InputStreamReader(socket.getInputStream(), StandardCharsets.US_ASCII));
            String statusLine = in.readLine();

            assertEquals("HTTP/1.1 200 OK", statusLine);
        }
        assertEquals(1, reader.cancelled.getCount());
        assertFalse(reader.seenContext.isCancelled());
    }

    private static void send(Socket socket, String request) throws Exception {
        OutputStream out = socket.getOutputStream();
        out.write(request.getBytes(StandardCharsets.US_ASCII));
        out.flush();
    }

    /** Blocks each call until its context is cancelled or 'wait' elapses, whichever comes first. */
    private static final class WaitingReader implements Reader {
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch cancelled = new CountDownLatch(1);
        final Duration wait;
        volatile ReadContext seenContext;

        WaitingReader(Duration wait) {
            this.wait = wait;
        }

        private void block(ReadContext ctx) throws ReaderException {
            seenContext = ctx;
            ctx.onCancel(cancelled::countDown);
            entered.countDown();
            try {
                cancelled.await(wait.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            ctx.checkActive();
        }

        @Override
        public Optional<Row> lookupByKey(ReadContext ctx, String family, String table, List<Object> key)
                throws ReaderException {
            block(ctx);
            return Optional.empty();
        }

        @Override
        public RowCursor scanByKeyPrefix(ReadContext ctx, String family, String table, List<Object> keyPrefix)
                throws ReaderException {
            throw new ReaderException("scans are not used here");
        }

        @Override
        public Duration ledgerLatency(ReadContext ctx) throws ReaderException {
            block(ctx);
            return Duration.ZERO;
        }
    }
}
