package work.signbox.server;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.signbox.api.ErrorKind;
import work.signbox.api.SigningException;
import work.signbox.api.SigningRequest;
import work.signbox.api.SigningResponse;
import work.signbox.api.SigningService;
import work.signbox.dispatch.DispatchRule;
import work.signbox.dispatch.RuleLoader;
import work.signbox.script.AlgorithmScript;

/**
 * HTTP front of a {@link SigningService}.
 *
 * <pre>
 * POST /sign                    sign, platform from the body
 * POST /sign/{platform}         sign, platform from the path
 * GET  /sign/status             pool status
 * GET  /health                  200 while a sandbox is live, else 503
 * GET  /                        service info
 * GET  /admin/script            active script and history
 * PUT  /admin/script            load a new script (raw body)
 * POST /admin/script/rollback   restore the previous script
 * GET  /admin/rules             current dispatch rules
 * PUT  /admin/rules             replace dispatch rules (JSON array)
 * </pre>
 *
 * Admin routes require {@code X-Admin-Token} when a token is configured.
 */
public final class SignHttpServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SignHttpServer.class);
    static final String ADMIN_TOKEN_HEADER = "X-Admin-Token";

    private final SigningService service;
    private final Optional<String> adminToken;
    private final HttpServer server;
    private final ExecutorService workers;
    private final AtomicLong requestCount = new AtomicLong();

    private SignHttpServer(SigningService service, Optional<String> adminToken, HttpServer server, ExecutorService workers) {
        this.service = service;
        this.adminToken = adminToken;
        this.server = server;
        this.workers = workers;
    }

    /**
     * Binds and starts the server. Port {@code 0} picks an ephemeral port, see {@link #port()}.
     */
    public static SignHttpServer start(SigningService service, String host, int port, Optional<String> adminToken,
                                       int workerThreads) throws IOException {
        Objects.requireNonNull(service, "service");
        HttpServer http = HttpServer.create(new InetSocketAddress(host, port), 0);
        AtomicInteger threads = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(Math.max(1, workerThreads), runnable -> {
            Thread thread = new Thread(runnable, "http-worker-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        SignHttpServer front = new SignHttpServer(service, adminToken, http, workers);
        http.createContext("/", exchange -> front.handle(exchange, front::root));
        http.createContext("/health", exchange -> front.handle(exchange, front::health));
        http.createContext("/sign", exchange -> front.handle(exchange, front::sign));
        http.createContext("/admin", exchange -> front.handle(exchange, front::admin));
        http.setExecutor(workers);
        http.start();
        log.info("Sign server listening on http://{}:{}", host, front.port());
        return front;
    }

    public int port() {
        return server.getAddress().getPort();
    }

    public long requestCount() {
        return requestCount.get();
    }

    @Override
    public void close() {
        server.stop(0);
        workers.shutdownNow();
        log.info("Sign server stopped after {} requests", requestCount.get());
    }

    private void root(HttpExchange exchange, String path) throws IOException {
        if (!"/".equals(path)) {
            notFound(exchange, path);
            return;
        }
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("service", "signbox");
        payload.put("version", version());
        payload.put("status", service.isLive() ? "running" : "degraded");
        payload.put("platforms", List.copyOf(service.platforms()));
        payload.put("request_count", requestCount.get());
        payload.put("script_hash", service.currentScript().hash());
        JsonExchange.send(exchange, 200, payload);
    }

    private void health(HttpExchange exchange, String path) throws IOException {
        if (!"/health".equals(path)) {
            notFound(exchange, path);
            return;
        }
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        boolean live = service.isLive();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", live ? "ok" : "unavailable");
        payload.put("ready", service.status().ready());
        JsonExchange.send(exchange, live ? 200 : 503, payload);
    }

    private void sign(HttpExchange exchange, String path) throws IOException {
        if ("/sign/status".equals(path)) {
            if (!requireMethod(exchange, "GET")) {
                return;
            }
            Map<String, Object> payload = new LinkedHashMap<>(service.status().toSerializableMap());
            payload.put("request_count", requestCount.get());
            JsonExchange.send(exchange, 200, payload);
            return;
        }
        String pathPlatform;
        if ("/sign".equals(path) || "/sign/".equals(path)) {
            pathPlatform = null;
        } else if (path.startsWith("/sign/") && path.indexOf('/', "/sign/".length()) < 0) {
            pathPlatform = path.substring("/sign/".length()).toLowerCase(Locale.ROOT);
        } else {
            notFound(exchange, path);
            return;
        }
        if (!requireMethod(exchange, "POST")) {
            return;
        }
        requestCount.incrementAndGet();
        SigningRequest request = RequestMapper.fromJson(JsonExchange.readObject(exchange), pathPlatform);
        SigningResponse response = service.sign(request);
        JsonExchange.send(exchange, response.httpStatus(), response.toSerializableMap());
    }

    private void admin(HttpExchange exchange, String path) throws IOException {
        if (!authorized(exchange)) {
            JsonExchange.sendError(exchange, 401, ErrorKind.INVALID_REQUEST, "Missing or invalid " + ADMIN_TOKEN_HEADER);
            return;
        }
        switch (path) {
            case "/admin/script" -> {
                String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
                if ("GET".equals(method)) {
                    JsonExchange.send(exchange, 200, scriptInfo());
                } else if ("PUT".equals(method) || "POST".equals(method)) {
                    AlgorithmScript script = service.updateScript(JsonExchange.readBody(exchange));
                    JsonExchange.send(exchange, 200, scriptResult(script));
                } else {
                    methodNotAllowed(exchange, "GET, PUT");
                }
            }
            case "/admin/script/rollback" -> {
                if (requireMethod(exchange, "POST")) {
                    JsonExchange.send(exchange, 200, scriptResult(service.rollbackScript()));
                }
            }
            case "/admin/rules" -> {
                String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
                if ("GET".equals(method)) {
                    JsonExchange.send(exchange, 200, Map.of("rules", rulesPayload(service.rules())));
                } else if ("PUT".equals(method)) {
                    List<DispatchRule> rules;
                    try {
                        rules = RuleLoader.parseJson(JsonExchange.readBody(exchange));
                    } catch (IllegalArgumentException ex) {
                        throw new JsonExchange.BadRequest(ex.getMessage());
                    }
                    service.reloadRules(rules);
                    log.info("Dispatch rules replaced ({} rules)", rules.size());
                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("success", true);
                    payload.put("rules", rulesPayload(service.rules()));
                    JsonExchange.send(exchange, 200, payload);
                } else {
                    methodNotAllowed(exchange, "GET, PUT");
                }
            }
            default -> notFound(exchange, path);
        }
    }

    private void handle(HttpExchange exchange, Route route) {
        String path = Optional.ofNullable(exchange.getRequestURI()).map(URI::getPath).orElse("/");
        try {
            try {
                route.serve(exchange, path);
            } catch (JsonExchange.BadRequest ex) {
                JsonExchange.sendError(exchange, ErrorKind.INVALID_REQUEST, ex.getMessage());
            } catch (SigningException ex) {
                log.warn("{} {} failed: {}", exchange.getRequestMethod(), path, ex.getMessage());
                JsonExchange.sendError(exchange, ex.kind(), ex.getMessage());
            } catch (RuntimeException ex) {
                log.error("{} {} failed", exchange.getRequestMethod(), path, ex);
                JsonExchange.sendError(exchange, ErrorKind.INTERNAL, "Internal error: " + ex.getMessage());
            }
        } catch (IOException ex) {
            log.debug("Could not write response for {}: {}", path, ex.toString());
        } finally {
            exchange.close();
        }
    }

    private boolean authorized(HttpExchange exchange) {
        if (adminToken.isEmpty()) {
            return true;
        }
        String supplied = exchange.getRequestHeaders().getFirst(ADMIN_TOKEN_HEADER);
        return supplied != null && MessageDigest.isEqual(
            supplied.getBytes(StandardCharsets.UTF_8),
            adminToken.get().getBytes(StandardCharsets.UTF_8));
    }

    private Map<String, Object> scriptInfo() {
        AlgorithmScript current = service.currentScript();
        Map<String, Object> payload = new LinkedHashMap<>(scriptResult(current));
        payload.put("loaded_at", current.loadedAt().toString());
        payload.put("history", service.scriptHistory().stream()
            .map(script -> Map.<String, Object>of("hash", script.hash(), "version", script.version()))
            .toList());
        return payload;
    }

    private static Map<String, Object> scriptResult(AlgorithmScript script) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", true);
        payload.put("hash", script.hash());
        payload.put("version", script.version());
        return payload;
    }

    private static List<Map<String, Object>> rulesPayload(List<DispatchRule> rules) {
        return rules.stream().map(DispatchRule::toSerializableMap).toList();
    }

    private static boolean requireMethod(HttpExchange exchange, String method) throws IOException {
        if (method.equalsIgnoreCase(exchange.getRequestMethod())) {
            return true;
        }
        methodNotAllowed(exchange, method);
        return false;
    }

    private static void methodNotAllowed(HttpExchange exchange, String allowed) throws IOException {
        exchange.getResponseHeaders().set("Allow", allowed);
        JsonExchange.sendError(exchange, 405, ErrorKind.INVALID_REQUEST,
            "Method " + exchange.getRequestMethod() + " not allowed");
    }

    private static void notFound(HttpExchange exchange, String path) throws IOException {
        JsonExchange.sendError(exchange, 404, ErrorKind.INVALID_REQUEST, "No route for " + path);
    }

    private static String version() {
        String implementationVersion = SignHttpServer.class.getPackage().getImplementationVersion();
        return implementationVersion != null ? implementationVersion : "development";
    }

    @FunctionalInterface
    private interface Route {
        void serve(HttpExchange exchange, String path) throws IOException;
    }
}
