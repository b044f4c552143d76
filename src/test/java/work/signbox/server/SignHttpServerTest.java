package work.signbox.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import work.signbox.api.SigningService;
import work.signbox.support.SignboxTestSupport;

class SignHttpServerTest {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final HttpClient HTTP = HttpClient.newBuilder()
        .version(HttpClient.Version.HTTP_1_1)
        .connectTimeout(Duration.ofSeconds(5))
        .build();
    private static final String TOKEN = "let-me-in";

    private static SigningService service;
    private static SignHttpServer server;

    @BeforeAll
    static void startServer() throws Exception {
        service = SignboxTestSupport.serviceBuilder(SignboxTestSupport.script("douyin.js"), 2).start();
        server = SignHttpServer.start(service, "127.0.0.1", 0, Optional.of(TOKEN), 4);
    }

    @AfterAll
    static void stopServer() {
        server.close();
        service.close();
    }

    private static HttpResponse<String> send(HttpRequest.Builder request) throws Exception {
        return HTTP.send(request.timeout(Duration.ofSeconds(30)).build(), HttpResponse.BodyHandlers.ofString());
    }

    private static HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + path));
    }

    private static Map<String, Object> body(HttpResponse<String> response) throws Exception {
        return JSON.readValue(response.body(), MAP_TYPE);
    }

    private static HttpRequest.BodyPublisher json(Object payload) throws Exception {
        return HttpRequest.BodyPublishers.ofString(JSON.writeValueAsString(payload));
    }

    @Test
    void signsPostedRequest() throws Exception {
        HttpResponse<String> response = send(request("/sign").POST(json(Map.of(
            "target_uri", SignboxTestSupport.REPLY_URI,
            "platform", "dy",
            "parameters", "item_id=7",
            "client_user_agent", SignboxTestSupport.USER_AGENT
        ))));

        assertEquals(200, response.statusCode(), response.body());
        Map<String, Object> payload = body(response);
        assertEquals(true, payload.get("success"));
        assertEquals("sign_reply", payload.get("entry_point"));
        assertTrue(String.valueOf(payload.get("token")).startsWith("reply-"));
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
    }

    @Test
    void platformMayComeFromThePath() throws Exception {
        HttpResponse<String> response = send(request("/sign/DY").POST(json(Map.of(
            "target_uri", SignboxTestSupport.DETAIL_URI,
            "parameters", Map.of("aweme_id", 7),
            "client_user_agent", SignboxTestSupport.USER_AGENT,
            "acquire_timeout_ms", 1000
        ))));

        assertEquals(200, response.statusCode(), response.body());
        assertEquals("sign_detail", body(response).get("entry_point"));
    }

    @Test
    void failuresCarryKindAndStatus() throws Exception {
        HttpResponse<String> missingAgent = send(request("/sign").POST(json(Map.of(
            "target_uri", SignboxTestSupport.DETAIL_URI, "platform", "dy"))));
        assertEquals(400, missingAgent.statusCode());
        assertEquals("invalid_request", body(missingAgent).get("error_kind"));
        assertEquals(false, body(missingAgent).get("retryable"));

        HttpResponse<String> noRule = send(request("/sign/xhs").POST(json(Map.of(
            "target_uri", "https://edith.xiaohongshu.com/api/sns", "client_user_agent", "ua"))));
        assertEquals(422, noRule.statusCode());
        assertEquals("no_rule_matched", body(noRule).get("error_kind"));

        HttpResponse<String> malformed = send(request("/sign").POST(HttpRequest.BodyPublishers.ofString("{oops")));
        assertEquals(400, malformed.statusCode());
        assertEquals("invalid_request", body(malformed).get("error_kind"));

        HttpResponse<String> wrongType = send(request("/sign").POST(json(Map.of("target_uri", 5))));
        assertEquals(400, wrongType.statusCode());
    }

    @Test
    void routingErrors() throws Exception {
        assertEquals(404, send(request("/nowhere").GET()).statusCode());
        assertEquals(404, send(request("/sign/dy/extra").POST(json(Map.of()))).statusCode());
        HttpResponse<String> wrongMethod = send(request("/sign").GET());
        assertEquals(405, wrongMethod.statusCode());
        assertEquals("POST", wrongMethod.headers().firstValue("Allow").orElse(""));
    }

    @Test
    void healthStatusAndRoot() throws Exception {
        HttpResponse<String> health = send(request("/health").GET());
        assertEquals(200, health.statusCode());
        assertEquals("ok", body(health).get("status"));

        HttpResponse<String> status = send(request("/sign/status").GET());
        assertEquals(200, status.statusCode());
        Map<String, Object> pool = body(status);
        assertEquals(2, pool.get("size"));
        assertEquals(service.currentScript().hash(), pool.get("script_hash"));
        assertTrue(pool.get("contexts") instanceof List<?>);

        HttpResponse<String> root = send(request("/").GET());
        Map<String, Object> info = body(root);
        assertEquals("signbox", info.get("service"));
        assertEquals("running", info.get("status"));
        assertTrue(((List<?>) info.get("platforms")).contains("dy"));
    }

    @Test
    void adminRoutesRequireTheToken() throws Exception {
        assertEquals(401, send(request("/admin/rules").GET()).statusCode());
        assertEquals(401, send(request("/admin/rules").header(SignHttpServer.ADMIN_TOKEN_HEADER, "wrong").GET()).statusCode());

        HttpResponse<String> rules = send(request("/admin/rules").header(SignHttpServer.ADMIN_TOKEN_HEADER, TOKEN).GET());
        assertEquals(200, rules.statusCode());
        assertEquals(2, ((List<?>) body(rules).get("rules")).size());
    }

    @Test
    void adminRejectsScriptsMissingEntryPoints() throws Exception {
        String before = service.currentScript().hash();

        HttpResponse<String> response = send(request("/admin/script")
            .header(SignHttpServer.ADMIN_TOKEN_HEADER, TOKEN)
            .PUT(HttpRequest.BodyPublishers.ofString(SignboxTestSupport.script("detail-only.js"))));

        assertEquals(422, response.statusCode(), response.body());
        assertEquals("script_invalid", body(response).get("error_kind"));
        assertEquals(before, service.currentScript().hash());
    }

    @Test
    void adminRejectsRulesTheScriptCannotServe() throws Exception {
        HttpResponse<String> response = send(request("/admin/rules")
            .header(SignHttpServer.ADMIN_TOKEN_HEADER, TOKEN)
            .PUT(json(List.of(Map.of("platform", "dy", "pattern", ".*", "mode", "regex", "entry_point", "sign_missing")))));

        assertEquals(400, response.statusCode(), response.body());
        assertEquals(2, service.rules().size());

        HttpResponse<String> malformed = send(request("/admin/rules")
            .header(SignHttpServer.ADMIN_TOKEN_HEADER, TOKEN)
            .PUT(HttpRequest.BodyPublishers.ofString("[{\"pattern\":\"x\"}]")));
        assertEquals(400, malformed.statusCode());
    }

    @Test
    void adminScriptInfoListsTheActiveVersion() throws Exception {
        HttpResponse<String> response = send(request("/admin/script").header(SignHttpServer.ADMIN_TOKEN_HEADER, TOKEN).GET());

        assertEquals(200, response.statusCode());
        assertEquals(service.currentScript().hash(), body(response).get("hash"));
        assertEquals(405, send(request("/admin/script/rollback").header(SignHttpServer.ADMIN_TOKEN_HEADER, TOKEN).GET()).statusCode());
    }
}
