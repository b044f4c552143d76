package work.signbox.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.signbox.dispatch.DispatchRouter;
import work.signbox.dispatch.DispatchRule;
import work.signbox.dispatch.MatchMode;
import work.signbox.logging.LogLevel;
import work.signbox.support.SignboxTestSupport;

class ConfigLoaderTest {
    @Test
    void readsEveryTable() {
        Path file = SignboxTestSupport.resource("config/signbox.toml");

        ServiceConfiguration config = ConfigLoader.load(file);

        assertEquals("0.0.0.0", config.host());
        assertEquals(9090, config.port());
        assertEquals(LogLevel.DEBUG, config.logLevel());
        assertEquals(Optional.of("secret"), config.adminToken());
        assertEquals(3, config.poolSize());
        assertEquals(Duration.ofMillis(750), config.acquireTimeout());
        assertEquals(500, config.rotationThreshold());
        assertEquals(Duration.ofMillis(250), config.rebuildBackoff());
        assertEquals(file.getParent().resolve("../scripts/douyin.js").normalize(), config.scriptPath().orElseThrow());
        assertTrue(Files.isRegularFile(config.scriptPath().orElseThrow()));
        assertEquals(2, config.historyLimit());
        assertEquals(Duration.ofSeconds(3), config.invocationTimeout());
        assertEquals(Duration.ofSeconds(20), config.buildTimeout());
        assertEquals(50, config.maxTimerCallbacks());
        assertEquals(Set.of("dy", "xhs"), config.platforms());
        assertEquals(List.of(
            DispatchRule.contains("dy", "/comment/", "sign_reply", 5),
            new DispatchRule("^https://www\\.douyin\\.com/", MatchMode.REGEX, "sign_detail", 0, Optional.of("dy"))
        ), config.rules());
    }

    @Test
    void rulesFileIsResolvedNextToTheConfig() {
        ServiceConfiguration config = ConfigLoader.load(SignboxTestSupport.resource("config/with-rules-file.toml"));

        assertEquals(2, config.rules().size());
        assertEquals("sign_reply", config.rules().get(0).entryPoint());
        assertEquals(ServiceConfiguration.DEFAULT_PORT, config.port());
    }

    @Test
    void emptyFileKeepsDefaults() throws Exception {
        Path file = Files.createTempDirectory("signbox-config").resolve("empty.toml");
        Files.writeString(file, "# nothing here\n");

        ServiceConfiguration config = ConfigLoader.load(file);

        assertEquals("127.0.0.1", config.host());
        assertEquals(8045, config.port());
        assertEquals(4, config.poolSize());
        assertEquals(Duration.ofSeconds(2), config.acquireTimeout());
        assertEquals(Duration.ofSeconds(1), config.invocationTimeout());
        assertEquals(10_000, config.rotationThreshold());
        assertEquals(DispatchRouter.defaultRules(), config.rules());
        assertEquals(Set.of("xhs", "dy", "bili", "wb", "ks"), config.platforms());
        assertTrue(config.scriptPath().isEmpty());
        assertTrue(config.adminToken().isEmpty());
    }

    @Test
    void reportsSyntaxErrors() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> ConfigLoader.load(SignboxTestSupport.resource("config/broken.toml")));
        assertTrue(ex.getMessage().startsWith("Invalid configuration"), ex.getMessage());
    }

    @Test
    void rejectsMissingFileAndBadValues() throws Exception {
        Path dir = Files.createTempDirectory("signbox-config");
        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(dir.resolve("absent.toml")));

        Path badPool = dir.resolve("bad.toml");
        Files.writeString(badPool, "[pool]\nsize = 0\n");
        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(badPool));

        Path badDuration = dir.resolve("duration.toml");
        Files.writeString(badDuration, "[sandbox]\ninvoke-timeout = \"soon\"\n");
        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(badDuration));
    }

    @Test
    void toBuilderRoundTripsOverrides() {
        ServiceConfiguration base = ServiceConfiguration.builder().port(1234).adminToken(" ").build();
        ServiceConfiguration changed = base.toBuilder().poolSize(7).build();

        assertEquals(1234, changed.port());
        assertEquals(7, changed.poolSize());
        assertTrue(changed.adminToken().isEmpty());
    }
}
