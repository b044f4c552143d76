package work.signbox.sandbox;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.EnvironmentAccess;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.io.IOAccess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.signbox.script.AlgorithmScript;

/**
 * Builds GraalJS sandboxes on a shared {@link Engine} so parsed sources are cached across
 * contexts. Each context gets the JS built-ins plus {@link HostBindings}; host objects, class
 * lookup, IO, threads, processes, native code, environment variables, {@code load},
 * {@code print} and the polyglot builtins are all switched off.
 */
public final class GraalSandboxFactory implements SandboxFactory {
    private static final Logger log = LoggerFactory.getLogger(GraalSandboxFactory.class);

    private final SandboxSettings settings;
    private final Supplier<? extends Collection<String>> requiredEntryPoints;
    private final Engine engine;
    private final ScheduledExecutorService watchdog;

    public GraalSandboxFactory(SandboxSettings settings, Supplier<? extends Collection<String>> requiredEntryPoints) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.requiredEntryPoints = Objects.requireNonNull(requiredEntryPoints, "requiredEntryPoints");
        this.engine = Engine.newBuilder()
            .option("engine.WarnInterpreterOnly", "false")
            .build();
        AtomicInteger threads = new AtomicInteger();
        this.watchdog = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "sandbox-watchdog-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public GraalSandboxFactory(SandboxSettings settings, Collection<String> requiredEntryPoints) {
        this(settings, constant(List.copyOf(requiredEntryPoints)));
    }

    @Override
    public SandboxContext build(AlgorithmScript script) {
        return build(script, requiredEntryPoints.get());
    }

    @Override
    public SandboxContext build(AlgorithmScript script, Collection<String> required) {
        return SandboxContext.build(script, settings, required == null ? List.of() : required, this::newContext, watchdog);
    }

    @Override
    public void close() {
        watchdog.shutdownNow();
        try {
            engine.close(true);
        } catch (RuntimeException ex) {
            log.debug("Engine close raised {}", ex.toString());
        }
    }

    private Context newContext() {
        return Context.newBuilder("js")
            .engine(engine)
            .allowHostAccess(HostAccess.NONE)
            .allowHostClassLookup(className -> false)
            .allowIO(IOAccess.NONE)
            .allowCreateThread(false)
            .allowCreateProcess(false)
            .allowNativeAccess(false)
            .allowEnvironmentAccess(EnvironmentAccess.NONE)
            .allowExperimentalOptions(true)
            .option("js.ecmascript-version", "2022")
            .option("js.load", "false")
            .option("js.print", "false")
            .option("js.console", "false")
            .option("js.polyglot-builtin", "false")
            .option("js.graal-builtin", "false")
            .option("js.java-package-globals", "false")
            .build();
    }

    private static Supplier<Collection<String>> constant(Collection<String> value) {
        return () -> value;
    }
}
