// file: client/src/main/java/io/ctlsidecar/client/Cli.java
package io.ctlsidecar.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Arrays;
import java.util.Base64;
import java.util.Map;

/**
 * Simple CLI for querying a running sidecar over HTTP.
 *
 * Usage:
 *   ctlsidecar-cli [--base-url http://host:port] get  <family> <table> <key...>
 *   ctlsidecar-cli [--base-url http://host:port] scan <family> <table> [key...]
 *   ctlsidecar-cli [--base-url http://host:port] latency
 *   ctlsidecar-cli [--base-url http://host:port] health
 *   ctlsidecar-cli [--base-url http://host:port] ping
 *
 * Key arguments that look like integers are sent as JSON numbers; "b64:<base64>"
 * is sent as a binary segment; anything else is sent as a string.
 *
 * Examples:
 *   ctlsidecar-cli get accounts users acme 42
 *   ctlsidecar-cli scan accounts users acme
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:1331";
    private static final String BINARY_PREFIX = "b64:";
    private static final ObjectMapper JSON = new ObjectMapper();

    private final HttpClient http;
    private final String baseUrl;

    Cli(String baseUrl) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static void main(String[] args) {
        try {
            if (args.length == 0) {
                usageAndExit("missing command");
            }

            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String[] rest = parsed.getValue();
            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            Cli cli = new Cli(parsed.getKey());
            String cmd = rest[0];
            switch (cmd) {
                case "get" -> {
                    if (rest.length < 4) {
                        usageAndExit("get requires <family> <table> <key...>");
                    }
                    System.out.println(cli.get(rest[1], rest[2], Arrays.copyOfRange(rest, 3, rest.length)));
                }
                case "scan" -> {
                    if (rest.length < 3) {
                        usageAndExit("scan requires <family> <table> [key...]");
                    }
                    System.out.println(cli.scan(rest[1], rest[2], Arrays.copyOfRange(rest, 3, rest.length)));
                }
                case "latency" -> System.out.println(cli.call("GET", "/get-ledger-latency", null));
                case "health" -> {
                    cli.call("GET", "/healthcheck", null);
                    System.out.println("OK");
                }
                case "ping" -> {
                    cli.call("GET", "/ping", null);
                    System.out.println("OK");
                }
                default -> usageAndExit("unknown command: " + cmd);
            }
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    private static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 2 && "--base-url".equals(args[0])) {
            if (args.length < 3) {
                usageAndExit("--base-url requires a value");
            }
            return Map.entry(args[1], Arrays.copyOfRange(args, 2, args.length));
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    /** Row as JSON, or "(not found)" when the sidecar reports no matching row. */
    String get(String family, String table, String[] keys) throws Exception {
        HttpResponse<String> resp = send("POST", "/get-row-by-key/" + family + "/" + table, readRequest(keys));
        if (resp.statusCode() == 404 && resp.headers().firstValue("X-Ctlstore").isPresent()) {
            return "(not found)";
        }
        return check(resp);
    }

    String scan(String family, String table, String[] keys) throws Exception {
        return call("POST", "/get-rows-by-key-prefix/" + family + "/" + table, readRequest(keys));
    }

    String call(String method, String path, String body) throws Exception {
        return check(send(method, path, body));
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("User-Agent", "ctlsidecar-cli");
        if (body == null) {
            req.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            req.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(body));
        }
        return http.send(req.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static String check(HttpResponse<String> resp) {
        if (resp.statusCode() / 100 != 2) {
            throw new CliException(resp.request().method() + " " + resp.request().uri().getPath()
                    + " failed (" + resp.statusCode() + "): " + resp.body().strip());
        }
        return resp.body();
    }

    /** Build the {"key":[...]} body for the given key arguments. */
    static String readRequest(String[] keys) {
        ObjectNode root = JSON.createObjectNode();
        ArrayNode segments = root.putArray("key");
        for (String k : keys) {
            ObjectNode seg = segments.addObject();
            if (k.startsWith(BINARY_PREFIX)) {
                String b64 = k.substring(BINARY_PREFIX.length());
                try {
                    Base64.getDecoder().decode(b64);
                } catch (IllegalArgumentException e) {
                    throw new CliException("invalid base64 key: " + k);
                }
                seg.put("binary", b64);
            } else if (k.matches("-?\\d{1,18}")) {
                seg.put("value", Long.parseLong(k));
            } else {
                seg.put("value", k);
            }
        }
        return root.toString();
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  ctlsidecar-cli [--base-url http://host:port] get  <family> <table> <key...>
                  ctlsidecar-cli [--base-url http://host:port] scan <family> <table> [key...]
                  ctlsidecar-cli [--base-url http://host:port] latency
                  ctlsidecar-cli [--base-url http://host:port] health
                  ctlsidecar-cli [--base-url http://host:port] ping
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
