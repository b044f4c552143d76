package work.signbox.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.signbox.dispatch.RuleLoader;
import work.signbox.logging.LogLevel;
import work.signbox.shared.Durations;

/**
 * Reads a {@code signbox.toml} file on top of the built-in defaults. Relative paths
 * ({@code script.path}, {@code api.rules-file}) resolve against the file's directory.
 *
 * <pre>
 * [server]   host, port, log-level, admin-token
 * [pool]     size, acquire-timeout, rotation, rebuild-backoff
 * [script]   path, history
 * [sandbox]  invoke-timeout, build-timeout, max-timer-callbacks
 * [api]      platforms, rules-file
 * [[rules]]  platform, pattern, mode, entry-point, priority
 * </pre>
 */
public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {}

    public static ServiceConfiguration load(Path path) {
        return apply(path, ServiceConfiguration.builder()).build();
    }

    /**
     * Applies the file onto {@code base} and returns the same builder, so that CLI options
     * can still override it.
     */
    public static ServiceConfiguration.Builder apply(Path path, ServiceConfiguration.Builder base) {
        TomlParseResult toml = parse(path);
        Path baseDir = path.toAbsolutePath().getParent();

        TomlTable server = toml.getTable("server");
        if (server != null) {
            stringValue(server, "host").ifPresent(base::host);
            Long port = server.getLong("port");
            if (port != null) {
                base.port(Math.toIntExact(port));
            }
            stringValue(server, "log-level").ifPresent(value -> base.logLevel(LogLevel.from(value)));
            stringValue(server, "admin-token").ifPresent(base::adminToken);
        }

        TomlTable pool = toml.getTable("pool");
        if (pool != null) {
            Long size = pool.getLong("size");
            if (size != null) {
                base.poolSize(Math.toIntExact(size));
            }
            duration(pool, "acquire-timeout").ifPresent(base::acquireTimeout);
            Long rotation = pool.getLong("rotation");
            if (rotation != null) {
                base.rotationThreshold(rotation);
            }
            duration(pool, "rebuild-backoff").ifPresent(base::rebuildBackoff);
        }

        TomlTable script = toml.getTable("script");
        if (script != null) {
            stringValue(script, "path").ifPresent(value -> base.scriptPath(baseDir.resolve(value).normalize()));
            Long history = script.getLong("history");
            if (history != null) {
                base.historyLimit(Math.toIntExact(history));
            }
        }

        TomlTable sandbox = toml.getTable("sandbox");
        if (sandbox != null) {
            duration(sandbox, "invoke-timeout").ifPresent(base::invocationTimeout);
            duration(sandbox, "build-timeout").ifPresent(base::buildTimeout);
            Long callbacks = sandbox.getLong("max-timer-callbacks");
            if (callbacks != null) {
                base.maxTimerCallbacks(Math.toIntExact(callbacks));
            }
        }

        TomlTable api = toml.getTable("api");
        if (api != null) {
            TomlArray platforms = api.getArray("platforms");
            if (platforms != null) {
                Set<String> values = new LinkedHashSet<>();
                for (int i = 0; i < platforms.size(); i++) {
                    values.add(platforms.getString(i).trim().toLowerCase(Locale.ROOT));
                }
                base.platforms(values);
            }
            stringValue(api, "rules-file").ifPresent(value -> base.rules(RuleLoader.loadYaml(baseDir.resolve(value))));
        }

        TomlArray rules = toml.getArray("rules");
        if (rules != null && !rules.isEmpty()) {
            List<Object> maps = new ArrayList<>();
            for (int i = 0; i < rules.size(); i++) {
                maps.add(rules.getTable(i).toMap());
            }
            base.rules(RuleLoader.fromMaps(maps));
        }
        log.debug("Loaded configuration from {}", path);
        return base;
    }

    private static TomlParseResult parse(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Configuration file not found: " + path);
        }
        TomlParseResult result;
        try {
            result = Toml.parse(Files.readString(path));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read configuration " + path, ex);
        }
        if (result.hasErrors()) {
            String errors = result.errors().stream()
                .map(Object::toString)
                .collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid configuration " + path + ": " + errors);
        }
        return result;
    }

    private static Optional<String> stringValue(TomlTable table, String key) {
        String value = table.getString(key);
        return Optional.ofNullable(value).map(String::trim).filter(text -> !text.isEmpty());
    }

    /** Durations may be written as strings ({@code "2s"}) or as integer milliseconds. */
    private static Optional<Duration> duration(TomlTable table, String key) {
        Object raw = table.get(key);
        if (raw == null) {
            return Optional.empty();
        }
        if (raw instanceof Long millis) {
            if (millis < 0) {
                throw new IllegalArgumentException(key + " must not be negative");
            }
            return Optional.of(Duration.ofMillis(millis));
        }
        return Optional.ofNullable(Durations.parse(String.valueOf(raw), null));
    }
}
