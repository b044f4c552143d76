package work.signbox.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.signbox.api.SigningService;
import work.signbox.config.ConfigLoader;
import work.signbox.config.ServiceConfiguration;
import work.signbox.dispatch.DispatchRule;
import work.signbox.logging.LogLevel;
import work.signbox.logging.LogSetup;
import work.signbox.server.SignHttpServer;
import work.signbox.shared.Durations;

@CommandLine.Command(
    name = "signbox",
    description = "Serve request signatures computed by a sandboxed vendor script.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ServeCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);

    @CommandLine.Option(names = {"-c", "--config"}, description = "TOML configuration file.")
    private Path config;

    @CommandLine.Option(names = {"-s", "--script"}, description = "Algorithm script (overrides script.path).")
    private Path script;

    @CommandLine.Option(names = "--host", description = "Bind address (overrides server.host).")
    private String host;

    @CommandLine.Option(names = {"-p", "--port"}, description = "Listen port, 0 for ephemeral (overrides server.port).")
    private Integer port;

    @CommandLine.Option(names = "--pool-size", description = "Number of warm sandboxes (overrides pool.size).")
    private Integer poolSize;

    @CommandLine.Option(names = "--acquire-timeout", description = "Maximum wait for a sandbox, e.g. 2s or 500ms.")
    private String acquireTimeout;

    @CommandLine.Option(names = "--invoke-timeout", description = "Deadline of one signing call, e.g. 1s.")
    private String invokeTimeout;

    @CommandLine.Option(names = "--log-level", description = "trace, debug, info, warn, error or off.")
    private String logLevel;

    @CommandLine.Option(names = "--check", description = "Build the sandbox pool once, report and exit.")
    private boolean check;

    @Override
    public Integer call() throws Exception {
        ServiceConfiguration configuration = resolveConfiguration();
        LogSetup.apply(configuration.logLevel());
        Path scriptPath = configuration.scriptPath()
            .orElseThrow(() -> new IllegalArgumentException("No algorithm script configured (use --script or script.path)"));
        String source = readScript(scriptPath);

        SigningService service = configuration.applyTo(SigningService.builder())
            .scriptSource(source)
            .start();
        if (check) {
            try (service) {
                System.out.println("OK " + service.currentScript() + " with " + service.status().size()
                    + " sandboxes, entry points " + service.rules().stream().map(DispatchRule::entryPoint).distinct().toList());
            }
            return 0;
        }

        SignHttpServer server;
        try {
            server = SignHttpServer.start(service, configuration.host(), configuration.port(),
                configuration.adminToken(), Math.max(8, configuration.poolSize() * 2));
        } catch (IOException | RuntimeException ex) {
            service.close();
            throw ex;
        }
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            server.close();
            service.close();
            stopped.countDown();
        }, "signbox-shutdown"));
        stopped.await();
        return 0;
    }

    ServiceConfiguration resolveConfiguration() {
        ServiceConfiguration.Builder builder = config != null
            ? ConfigLoader.apply(config, ServiceConfiguration.builder())
            : ServiceConfiguration.builder();
        if (script != null) {
            builder.scriptPath(script);
        }
        if (host != null) {
            builder.host(host);
        }
        if (port != null) {
            builder.port(port);
        }
        if (poolSize != null) {
            builder.poolSize(poolSize);
        }
        if (acquireTimeout != null) {
            builder.acquireTimeout(Durations.requirePositive(Durations.parse(acquireTimeout, null), "--acquire-timeout"));
        }
        if (invokeTimeout != null) {
            builder.invocationTimeout(Durations.requirePositive(Durations.parse(invokeTimeout, null), "--invoke-timeout"));
        }
        if (logLevel != null) {
            builder.logLevel(LogLevel.from(logLevel));
        }
        return builder.build();
    }

    private static String readScript(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Algorithm script not found: " + path);
        }
        return Files.readString(path);
    }
}
