package work.signbox.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import work.signbox.api.SigningService;
import work.signbox.dispatch.DispatchRouter;
import work.signbox.dispatch.DispatchRule;
import work.signbox.logging.LogLevel;
import work.signbox.sandbox.SandboxSettings;

/**
 * Immutable settings for one signing server process.
 */
public record ServiceConfiguration(
    String host,
    int port,
    Optional<Path> scriptPath,
    List<DispatchRule> rules,
    Set<String> platforms,
    int poolSize,
    Duration acquireTimeout,
    Duration invocationTimeout,
    Duration buildTimeout,
    int maxTimerCallbacks,
    long rotationThreshold,
    int historyLimit,
    Duration rebuildBackoff,
    Optional<String> adminToken,
    LogLevel logLevel
) {
    public static final int DEFAULT_PORT = 8045;

    public ServiceConfiguration {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(scriptPath, "scriptPath");
        Objects.requireNonNull(acquireTimeout, "acquireTimeout");
        Objects.requireNonNull(invocationTimeout, "invocationTimeout");
        Objects.requireNonNull(buildTimeout, "buildTimeout");
        Objects.requireNonNull(rebuildBackoff, "rebuildBackoff");
        Objects.requireNonNull(adminToken, "adminToken");
        Objects.requireNonNull(logLevel, "logLevel");
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (poolSize < 1) {
            throw new IllegalArgumentException("pool size must be >= 1");
        }
        rules = List.copyOf(rules);
        platforms = Set.copyOf(platforms);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .host(host)
            .port(port)
            .scriptPath(scriptPath.orElse(null))
            .rules(rules)
            .platforms(platforms)
            .poolSize(poolSize)
            .acquireTimeout(acquireTimeout)
            .invocationTimeout(invocationTimeout)
            .buildTimeout(buildTimeout)
            .maxTimerCallbacks(maxTimerCallbacks)
            .rotationThreshold(rotationThreshold)
            .historyLimit(historyLimit)
            .rebuildBackoff(rebuildBackoff)
            .adminToken(adminToken.orElse(null))
            .logLevel(logLevel);
    }

    /** Copies the kernel-facing settings onto a service builder; the script source is left to the caller. */
    public SigningService.Builder applyTo(SigningService.Builder builder) {
        return builder
            .rules(rules)
            .platforms(platforms)
            .poolSize(poolSize)
            .acquireTimeout(acquireTimeout)
            .invocationTimeout(invocationTimeout)
            .sandboxSettings(new SandboxSettings(buildTimeout, maxTimerCallbacks))
            .rotationThreshold(rotationThreshold)
            .historyLimit(historyLimit)
            .rebuildBackoff(rebuildBackoff);
    }

    public static final class Builder {
        private String host = "127.0.0.1";
        private int port = DEFAULT_PORT;
        private Optional<Path> scriptPath = Optional.empty();
        private List<DispatchRule> rules = DispatchRouter.defaultRules();
        private Set<String> platforms = new LinkedHashSet<>(List.of("xhs", "dy", "bili", "wb", "ks"));
        private int poolSize = 4;
        private Duration acquireTimeout = Duration.ofSeconds(2);
        private Duration invocationTimeout = Duration.ofSeconds(1);
        private Duration buildTimeout = SandboxSettings.DEFAULT.buildTimeout();
        private int maxTimerCallbacks = SandboxSettings.DEFAULT.maxTimerCallbacks();
        private long rotationThreshold = 10_000L;
        private int historyLimit = 5;
        private Duration rebuildBackoff = Duration.ofSeconds(1);
        private Optional<String> adminToken = Optional.empty();
        private LogLevel logLevel = LogLevel.INFO;

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder scriptPath(Path scriptPath) {
            this.scriptPath = Optional.ofNullable(scriptPath);
            return this;
        }

        public Builder rules(List<DispatchRule> rules) {
            this.rules = rules;
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

        public Builder buildTimeout(Duration buildTimeout) {
            this.buildTimeout = buildTimeout;
            return this;
        }

        public Builder maxTimerCallbacks(int maxTimerCallbacks) {
            this.maxTimerCallbacks = maxTimerCallbacks;
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

        public Builder adminToken(String adminToken) {
            this.adminToken = Optional.ofNullable(adminToken).filter(token -> !token.isBlank());
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public ServiceConfiguration build() {
            return new ServiceConfiguration(
                host,
                port,
                scriptPath,
                rules,
                platforms,
                poolSize,
                acquireTimeout,
                invocationTimeout,
                buildTimeout,
                maxTimerCallbacks,
                rotationThreshold,
                historyLimit,
                rebuildBackoff,
                adminToken,
                logLevel
            );
        }
    }
}
