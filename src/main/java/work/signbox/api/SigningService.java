package work.signbox.api;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.signbox.dispatch.DispatchRouter;
import work.signbox.dispatch.DispatchRule;
import work.signbox.logging.SigningMdc;
import work.signbox.pool.ContextPool;
import work.signbox.pool.LeasedContext;
import work.signbox.pool.Outcome;
import work.signbox.pool.PoolStatus;
import work.signbox.sandbox.GraalSandboxFactory;
import work.signbox.sandbox.SandboxContext;
import work.signbox.sandbox.SandboxFactory;
import work.signbox.sandbox.SandboxSettings;
import work.signbox.script.AlgorithmScript;
import work.signbox.script.ScriptStore;
import work.signbox.shared.Durations;

/**
 * Public entry point of the signing kernel: validates a request, resolves its entry point,
 * leases a sandbox and runs the vendor function. Every failure comes back as a typed
 * {@link SigningResponse}; nothing is thrown across this boundary.
 */
public final class SigningService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SigningService.class);

    private final ScriptStore store;
    private final DispatchRouter router;
    private final ContextPool pool;
    private final SandboxFactory factory;
    private final Set<String> platforms;
    private final Duration acquireTimeout;
    private final Duration invocationTimeout;
    // store and pool move to a new script together
    private final Object scriptLock = new Object();

    private SigningService(ScriptStore store, DispatchRouter router, ContextPool pool, SandboxFactory factory,
                           Set<String> platforms, Duration acquireTimeout, Duration invocationTimeout) {
        this.store = store;
        this.router = router;
        this.pool = pool;
        this.factory = factory;
        this.platforms = platforms;
        this.acquireTimeout = acquireTimeout;
        this.invocationTimeout = invocationTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public SigningResponse sign(SigningRequest request) {
        long started = System.nanoTime();
        try {
            validate(request);
            String entryPoint = router.resolve(request);
            Duration wait = request.acquireTimeout().orElse(acquireTimeout);
            LeasedContext lease = pool.acquire(wait);
            SigningMdc.set(request.platform(), entryPoint, lease.contextId());
            Outcome outcome = Outcome.FAULTED;
            try {
                SigningResult result = lease.invoke(
                    entryPoint, List.of(request.parameters(), request.clientUserAgent()), invocationTimeout);
                outcome = Outcome.HEALTHY;
                Duration total = Duration.ofNanos(System.nanoTime() - started);
                log.info("Signed {} {} via {} -> {} ({}ms)",
                    request.platform(), request.targetUri(), entryPoint, preview(result.token()), total.toMillis());
                return SigningResponse.success(result.withElapsed(total));
            } catch (SigningException ex) {
                if (ex.kind() == ErrorKind.ENTRY_POINT_NOT_FOUND) {
                    outcome = Outcome.HEALTHY;
                }
                throw ex;
            } finally {
                lease.release(outcome);
                SigningMdc.clear();
            }
        } catch (SigningException ex) {
            report(request, ex);
            return SigningResponse.failure(ex);
        } catch (RuntimeException ex) {
            log.error("Unexpected failure while signing {}", request, ex);
            return SigningResponse.failure(ErrorKind.INTERNAL, "Internal error: " + ex.getMessage());
        }
    }

    /**
     * Loads a new algorithm script and rotates the pool onto it. A rejected script leaves the
     * previous one active.
     *
     * @throws SigningException {@code SCRIPT_INVALID}
     */
    public AlgorithmScript updateScript(String source) {
        synchronized (scriptLock) {
            AlgorithmScript script = store.load(source);
            if (!script.hash().equals(pool.activeScript().hash())) {
                pool.onScriptUpdated(script);
            }
            return script;
        }
    }

    public AlgorithmScript rollbackScript() {
        synchronized (scriptLock) {
            AlgorithmScript script = store.rollback();
            pool.onScriptUpdated(script);
            return script;
        }
    }

    /**
     * Swaps the dispatch rules after checking that the active script defines every entry point
     * they name, so that replacement sandboxes keep building.
     *
     * @throws SigningException {@code INVALID_REQUEST} when the rules do not fit the active script
     */
    public void reloadRules(List<DispatchRule> rules) {
        Set<String> required = rules.stream()
            .map(DispatchRule::entryPoint)
            .collect(Collectors.toCollection(TreeSet::new));
        synchronized (scriptLock) {
            AlgorithmScript active = pool.activeScript();
            try (SandboxContext probe = factory.build(active, required)) {
                log.debug("Probe {} accepted rules {}", probe.id(), required);
            } catch (SigningException ex) {
                throw new SigningException(ErrorKind.INVALID_REQUEST,
                    "Rules do not fit active script " + active.shortHash() + ": " + ex.getMessage(), ex);
            }
            router.reload(rules);
        }
    }

    /** True while at least one context built from the active script is ready or serving. */
    public boolean isLive() {
        PoolStatus status = pool.status();
        return status.ready() > 0 || status.contexts().stream().anyMatch(info -> "busy".equals(info.state()) && !info.stale());
    }

    public PoolStatus status() {
        return pool.status();
    }

    public AlgorithmScript currentScript() {
        return store.current();
    }

    public List<AlgorithmScript> scriptHistory() {
        return store.history();
    }

    public List<DispatchRule> rules() {
        return router.rules();
    }

    public Set<String> platforms() {
        return platforms;
    }

    ContextPool pool() {
        return pool;
    }

    @Override
    public void close() {
        pool.close();
        factory.close();
    }

    private void validate(SigningRequest request) {
        if (request == null) {
            throw new SigningException(ErrorKind.INVALID_REQUEST, "Request is required");
        }
        if (isBlank(request.targetUri())) {
            throw new SigningException(ErrorKind.INVALID_REQUEST, "target_uri is required");
        }
        if (isBlank(request.platform())) {
            throw new SigningException(ErrorKind.INVALID_REQUEST, "platform is required");
        }
        if (!platforms.contains(request.platform().toLowerCase(Locale.ROOT))) {
            throw new SigningException(ErrorKind.INVALID_REQUEST,
                "Platform '" + request.platform() + "' is not supported. Supported: " + String.join(", ", platforms));
        }
        if (isBlank(request.clientUserAgent())) {
            throw new SigningException(ErrorKind.INVALID_REQUEST, "client_user_agent is required");
        }
        request.acquireTimeout().ifPresent(timeout -> {
            if (timeout.isZero() || timeout.isNegative()) {
                throw new SigningException(ErrorKind.INVALID_REQUEST, "acquire timeout must be positive");
            }
        });
    }

    private static void report(SigningRequest request, SigningException ex) {
        switch (ex.kind()) {
            case INVALID_REQUEST, CANCELLED -> log.debug("Rejected {}: {}", request, ex.getMessage());
            case SERVICE_UNAVAILABLE, INVOCATION_TIMEOUT -> log.warn("{} for {}: {}", ex.kind(), request, ex.getMessage());
            case NO_RULE_MATCHED -> log.debug("Unrouted {}: {}", request, ex.getMessage());
            case ENTRY_POINT_NOT_FOUND -> log.warn("Configuration gap for {}: {}", request, ex.getMessage());
            default -> log.error("{} for {}: {}", ex.kind(), request, ex.getMessage());
        }
    }

    private static String preview(String token) {
        return token.length() <= 10 ? token : token.substring(0, 10) + "...";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static final class Builder {
        private String scriptSource;
        private List<DispatchRule> rules = DispatchRouter.defaultRules();
        private Set<String> platforms = Set.of("xhs", "dy", "bili", "wb", "ks");
        private int poolSize = 4;
        private Duration acquireTimeout = Duration.ofSeconds(2);
        private Duration invocationTimeout = Duration.ofSeconds(1);
        private SandboxSettings sandboxSettings = SandboxSettings.DEFAULT;
        private long rotationThreshold = 10_000L;
        private int historyLimit = 5;
        private Duration rebuildBackoff = Duration.ofSeconds(1);

        public Builder scriptSource(String scriptSource) {
            this.scriptSource = scriptSource;
            return this;
        }

        public Builder rules(List<DispatchRule> rules) {
            this.rules = List.copyOf(rules);
            return this;
        }

        public Builder platforms(Set<String> platforms) {
            this.platforms = platforms;
            return this;
        }

        public Builder poolSize(int poolSize) {
            this.poolSize = poolSize;
            return this;
        }

        public Builder acquireTimeout(Duration acquireTimeout) {
            this.acquireTimeout = acquireTimeout;
            return this;
        }

        public Builder invocationTimeout(Duration invocationTimeout) {
            this.invocationTimeout = invocationTimeout;
            return this;
        }

        public Builder sandboxSettings(SandboxSettings sandboxSettings) {
            this.sandboxSettings = sandboxSettings;
            return this;
        }

        public Builder rotationThreshold(long rotationThreshold) {
            this.rotationThreshold = rotationThreshold;
            return this;
        }

        public Builder historyLimit(int historyLimit) {
            this.historyLimit = historyLimit;
            return this;
        }

        public Builder rebuildBackoff(Duration rebuildBackoff) {
            this.rebuildBackoff = rebuildBackoff;
            return this;
        }

        /**
         * Loads the initial script and builds the pool. Fails with {@code SCRIPT_INVALID} if the
         * script cannot be evaluated or lacks an entry point named by the rules.
         */
        public SigningService start() {
            Objects.requireNonNull(scriptSource, "scriptSource");
            Durations.requirePositive(acquireTimeout, "acquireTimeout");
            Durations.requirePositive(invocationTimeout, "invocationTimeout");
            Set<String> normalizedPlatforms = platforms.stream()
                .map(value -> value.trim().toLowerCase(Locale.ROOT))
                .filter(value -> !value.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
            if (normalizedPlatforms.isEmpty()) {
                throw new IllegalArgumentException("At least one platform must be configured");
            }

            DispatchRouter router = new DispatchRouter(rules);
            SandboxFactory factory = new GraalSandboxFactory(sandboxSettings, router::entryPoints);
            try {
                ScriptStore store = new ScriptStore(candidate -> {
                    try (SandboxContext probe = factory.build(candidate)) {
                        log.debug("Probe {} accepted {}", probe.id(), candidate);
                    }
                }, historyLimit);
                AlgorithmScript initial = store.load(scriptSource);
                ContextPool pool = new ContextPool(poolSize, factory, initial, rotationThreshold, rebuildBackoff);
                pool.start();
                log.info("Signing service ready: pool={}, platforms={}, rules={}", poolSize, normalizedPlatforms, rules.size());
                return new SigningService(store, router, pool, factory,
                    Collections.unmodifiableSet(normalizedPlatforms), acquireTimeout, invocationTimeout);
            } catch (RuntimeException ex) {
                factory.close();
                throw ex;
            }
        }
    }
}
