package io.ctlsidecar.server.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.ctlsidecar.server.dto.ReadRequest;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Request/response plumbing shared by the handlers.
 * All methods assume the exchange is already in blocking mode.
 */
final class Exchanges {

    static final ObjectMapper JSON = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private Exchanges() {
        // utility
    }

    /** Value of a {name} segment from the matched route template. */
    static String pathParam(HttpServerExchange ex, String name) {
        PathTemplateMatch match = ex.getAttachment(PathTemplateMatch.ATTACHMENT_KEY);
        return match == null ? null : match.getParameters().get(name);
    }

    /** Decode the body as a {@link ReadRequest}. A literal {@code null} body counts as an empty request. */
    static ReadRequest readRequest(HttpServerExchange ex) throws DecodeException {
        try {
            ReadRequest req = JSON.readValue(ex.getInputStream(), ReadRequest.class);
            return req != null ? req : new ReadRequest();
        } catch (IOException e) {
            throw new DecodeException(e);
        }
    }

    /** Serialize 'body' as JSON and write it with the exchange's current status code. */
    static void sendJson(HttpServerExchange ex, Object body) throws JsonProcessingException {
        byte[] bytes = JSON.writeValueAsBytes(body);
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        ex.getResponseSender().send(ByteBuffer.wrap(bytes));
    }
}
