package work.signbox.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import work.signbox.api.ErrorKind;

/**
 * Small helpers around {@link HttpExchange} for JSON request and response bodies.
 */
final class JsonExchange {
    static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int MAX_BODY_BYTES = 4 * 1024 * 1024;

    private JsonExchange() {}

    static String readBody(HttpExchange exchange) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            byte[] bytes = in.readNBytes(MAX_BODY_BYTES + 1);
            if (bytes.length > MAX_BODY_BYTES) {
                throw new BadRequest("Request body exceeds " + MAX_BODY_BYTES + " bytes");
            }
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    /** Parses the body as a JSON object; malformed or non-object bodies raise {@link BadRequest}. */
    static Map<String, Object> readObject(HttpExchange exchange) throws IOException {
        String body = readBody(exchange);
        if (body.isBlank()) {
            throw new BadRequest("Request body must be a JSON object");
        }
        Object parsed;
        try {
            parsed = MAPPER.readValue(body, Object.class);
        } catch (JsonProcessingException ex) {
            throw new BadRequest("Malformed JSON: " + ex.getOriginalMessage());
        }
        if (!(parsed instanceof Map<?, ?> map)) {
            throw new BadRequest("Request body must be a JSON object");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((key, value) -> result.put(String.valueOf(key), value));
        return result;
    }

    static void send(HttpExchange exchange, int status, Object payload) throws IOException {
        byte[] bytes = MAPPER.writeValueAsBytes(payload);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    static void sendError(HttpExchange exchange, ErrorKind kind, String message) throws IOException {
        sendError(exchange, kind.httpStatus(), kind, message);
    }

    static void sendError(HttpExchange exchange, int status, ErrorKind kind, String message) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", false);
        payload.put("error_kind", kind.wireName());
        payload.put("message", message);
        payload.put("retryable", kind.retryable());
        send(exchange, status, payload);
    }

    /** Raised by handlers for client errors that map to 400. */
    static final class BadRequest extends RuntimeException {
        BadRequest(String message) {
            super(message);
        }
    }
}
