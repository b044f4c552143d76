package work.signbox.server;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import work.signbox.api.SigningRequest;

/**
 * Maps the snake_case JSON body of {@code POST /sign} onto a {@link SigningRequest}.
 * Presence checks are left to the signing service; this class only rejects wrong types.
 */
final class RequestMapper {
    private RequestMapper() {}

    static SigningRequest fromJson(Map<String, Object> body, String pathPlatform) {
        SigningRequest.Builder builder = SigningRequest.builder()
            .targetUri(text(body, "target_uri"))
            .platform(pathPlatform != null ? pathPlatform : text(body, "platform"))
            .parameters(parameters(body.get("parameters")))
            .clientUserAgent(text(body, "client_user_agent"));
        Object timeout = body.get("acquire_timeout_ms");
        if (timeout != null) {
            if (!(timeout instanceof Number millis)) {
                throw new JsonExchange.BadRequest("acquire_timeout_ms must be a number");
            }
            builder.acquireTimeout(Duration.ofMillis(millis.longValue()));
        }
        return builder.build();
    }

    private static String text(Map<String, Object> body, String key) {
        Object value = body.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String str)) {
            throw new JsonExchange.BadRequest(key + " must be a string");
        }
        return str;
    }

    private static Object parameters(Object raw) {
        if (raw == null || raw instanceof String || raw instanceof Map<?, ?> || raw instanceof List<?>) {
            return raw;
        }
        throw new JsonExchange.BadRequest("parameters must be a string, object or array");
    }
}
