package io.ctlsidecar.client;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class CliTest {

    private HttpServer stub;
    private Cli cli;

    @BeforeEach
    void startStub() throws Exception {
        stub = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        stub.createContext("/get-row-by-key/accounts/users", ex -> {
            String body = new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            if (body.contains("42")) {
                reply(ex, 200, "{\"id\":42,\"name\":\"Bob\"}");
            } else {
                ex.getResponseHeaders().add("X-Ctlstore", "Not Found");
                ex.sendResponseHeaders(404, -1);
                ex.close();
            }
        });
        stub.createContext("/healthcheck", ex -> reply(ex, 500, "healthcheck: replica unreachable\n"));
        stub.start();
        cli = new Cli("http://127.0.0.1:" + stub.getAddress().getPort() + "/");
    }

    @AfterEach
    void stopStub() {
        stub.stop(0);
    }

    private static void reply(com.sun.net.httpserver.HttpExchange ex, int status, String body) throws java.io.IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = ex.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Test
    void keysAreEncodedByShape() {
        String body = Cli.readRequest(new String[]{"acme", "42", "b64:AQI="});
        assertEquals("{\"key\":[{\"value\":\"acme\"},{\"value\":42},{\"binary\":\"AQI=\"}]}", body);
    }

    @Test
    void invalidBase64KeyRejected() {
        assertThrows(Cli.CliException.class, () -> Cli.readRequest(new String[]{"b64:%%%"}));
    }

    @Test
    void getPrintsRowOrNotFound() throws Exception {
        assertEquals("{\"id\":42,\"name\":\"Bob\"}", cli.get("accounts", "users", new String[]{"42"}));
        assertEquals("(not found)", cli.get("accounts", "users", new String[]{"7"}));
    }

    @Test
    void serverFailureSurfacesBody() {
        Cli.CliException ex = assertThrows(Cli.CliException.class, () -> cli.call("GET", "/healthcheck", null));
        assertTrue(ex.getMessage().contains("(500): healthcheck: replica unreachable"));
    }
}
