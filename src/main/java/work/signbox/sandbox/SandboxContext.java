package work.signbox.sandbox;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.signbox.api.ErrorKind;
import work.signbox.api.SigningException;
import work.signbox.api.SigningResult;
import work.signbox.script.AlgorithmScript;

/**
 * One warm JS environment in which an {@link AlgorithmScript} has been evaluated exactly once.
 * Its top-level functions are the signing entry points.
 *
 * <p>Script state (closures, counters) is not reentrant, so a context accepts a single
 * invocation at a time. A context whose invocation timed out or threw is FAULTED and must not
 * be used again.
 */
public final class SandboxContext implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SandboxContext.class);
    private static final AtomicLong IDS = new AtomicLong();

    private final String id;
    private final AlgorithmScript script;
    private final Context polyglot;
    private final HostBindings host;
    private final ScheduledExecutorService watchdog;
    private final Instant createdAt = Instant.now();
    private final AtomicReference<SandboxState> state = new AtomicReference<>(SandboxState.BUILDING);
    private final AtomicBoolean executing = new AtomicBoolean();
    private final AtomicLong invocations = new AtomicLong();
    private volatile Instant lastUsedAt;

    private SandboxContext(String id, AlgorithmScript script, Context polyglot, HostBindings host,
                           ScheduledExecutorService watchdog) {
        this.id = id;
        this.script = script;
        this.polyglot = polyglot;
        this.host = host;
        this.watchdog = watchdog;
    }

    /**
     * Evaluates {@code script} in a fresh context obtained from {@code contextSupplier} and
     * verifies that every required entry point is a callable global.
     */
    static SandboxContext build(AlgorithmScript script, SandboxSettings settings, Collection<String> requiredEntryPoints,
                                Supplier<Context> contextSupplier, ScheduledExecutorService watchdog) {
        String id = "ctx-" + IDS.incrementAndGet();
        Context polyglot;
        try {
            polyglot = contextSupplier.get();
        } catch (RuntimeException ex) {
            throw new SigningException(ErrorKind.SANDBOX_BUILD_ERROR, "Unable to create sandbox: " + ex.getMessage(), ex);
        }
        HostBindings host = new HostBindings(id, settings.maxTimerCallbacks());
        SandboxContext sandbox = new SandboxContext(id, script, polyglot, host, watchdog);
        try {
            host.install(polyglot);
            Source source = Source.newBuilder("js", script.source(), "algorithm-" + script.shortHash() + ".js")
                .buildLiteral();
            sandbox.withDeadline(settings.buildTimeout(), () -> {
                polyglot.eval(source);
                host.drainTimers();
                return null;
            });
            sandbox.verifyEntryPoints(requiredEntryPoints);
        } catch (DeadlineExceeded ex) {
            sandbox.close();
            throw new SigningException(ErrorKind.SANDBOX_BUILD_ERROR,
                "Script evaluation exceeded " + settings.buildTimeout().toMillis() + "ms");
        } catch (SigningException ex) {
            sandbox.close();
            throw ex;
        } catch (PolyglotException ex) {
            sandbox.close();
            throw new SigningException(ErrorKind.SANDBOX_BUILD_ERROR, "Script evaluation failed: " + ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            sandbox.close();
            throw new SigningException(ErrorKind.SANDBOX_BUILD_ERROR, "Sandbox build failed: " + ex.getMessage(), ex);
        }
        sandbox.state.set(SandboxState.READY);
        log.debug("Built {} from {}", id, script);
        return sandbox;
    }

    public String id() {
        return id;
    }

    public AlgorithmScript script() {
        return script;
    }

    public String scriptHash() {
        return script.hash();
    }

    public SandboxState state() {
        return state.get();
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant lastUsedAt() {
        return lastUsedAt;
    }

    public long invocationCount() {
        return invocations.get();
    }

    public boolean hasEntryPoint(String name) {
        SandboxState current = state.get();
        if (current == SandboxState.RETIRED || current == SandboxState.FAULTED) {
            return false;
        }
        Value member = polyglot.getBindings("js").getMember(name);
        return member != null && member.canExecute();
    }

    /** READY -> BUSY; false if the context is not available. */
    public boolean tryLease() {
        return state.compareAndSet(SandboxState.READY, SandboxState.BUSY);
    }

    /** BUSY -> READY after a healthy lease. */
    public boolean returnToReady() {
        return state.compareAndSet(SandboxState.BUSY, SandboxState.READY);
    }

    /**
     * Calls {@code entryPoint} with {@code args} under a hard deadline. The polyglot context is
     * cancelled when the deadline passes, aborting even a script that never yields.
     *
     * @throws SigningException {@code ENTRY_POINT_NOT_FOUND} (context stays usable),
     *                          {@code INVOCATION_TIMEOUT} or {@code SCRIPT_RUNTIME_ERROR}
     *                          (context becomes FAULTED)
     */
    public SigningResult invoke(String entryPoint, List<?> args, Duration timeout) {
        Objects.requireNonNull(entryPoint, "entryPoint");
        Objects.requireNonNull(timeout, "timeout");
        SandboxState current = state.get();
        if (current != SandboxState.BUSY && current != SandboxState.READY) {
            throw new IllegalStateException("Context " + id + " is " + current);
        }
        if (!executing.compareAndSet(false, true)) {
            throw new IllegalStateException("Concurrent invocation rejected on context " + id);
        }
        long started = System.nanoTime();
        try {
            Value function = polyglot.getBindings("js").getMember(entryPoint);
            if (function == null || !function.canExecute()) {
                throw new SigningException(ErrorKind.ENTRY_POINT_NOT_FOUND,
                    "Entry point '" + entryPoint + "' is not defined by script " + script.shortHash());
            }
            String token = withDeadline(timeout, () -> {
                Object[] jsArgs = args.stream().map(arg -> JsValues.toJs(polyglot, arg)).toArray();
                Value settled = await(function.execute(jsArgs));
                host.drainTimers();
                return JsValues.toToken(settled);
            });
            if (token == null) {
                fault();
                throw new SigningException(ErrorKind.SCRIPT_RUNTIME_ERROR,
                    "Entry point '" + entryPoint + "' returned no token");
            }
            invocations.incrementAndGet();
            lastUsedAt = Instant.now();
            return new SigningResult(token, entryPoint, Duration.ofNanos(System.nanoTime() - started), id, script.hash());
        } catch (DeadlineExceeded ex) {
            fault();
            throw new SigningException(ErrorKind.INVOCATION_TIMEOUT,
                "Entry point '" + entryPoint + "' exceeded " + timeout.toMillis() + "ms");
        } catch (SigningException ex) {
            throw ex;
        } catch (PolyglotException ex) {
            fault();
            throw new SigningException(ErrorKind.SCRIPT_RUNTIME_ERROR,
                "Entry point '" + entryPoint + "' failed: " + ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            fault();
            throw new SigningException(ErrorKind.SCRIPT_RUNTIME_ERROR,
                "Entry point '" + entryPoint + "' failed: " + ex.getMessage(), ex);
        } finally {
            executing.set(false);
        }
    }

    @Override
    public void close() {
        SandboxState previous = state.getAndSet(SandboxState.RETIRED);
        if (previous == SandboxState.RETIRED) {
            return;
        }
        try {
            polyglot.close(true);
        } catch (RuntimeException ex) {
            log.debug("Closing {} raised {}", id, ex.toString());
        }
        log.debug("Retired {} ({} invocations, was {})", id, invocations.get(), previous);
    }

    @Override
    public String toString() {
        return "SandboxContext[" + id + " " + state.get() + " " + script.shortHash() + "]";
    }

    private void fault() {
        state.updateAndGet(current -> current == SandboxState.RETIRED ? current : SandboxState.FAULTED);
    }

    private void verifyEntryPoints(Collection<String> required) {
        Value bindings = polyglot.getBindings("js");
        List<String> missing = required.stream()
            .filter(name -> {
                Value member = bindings.getMember(name);
                return member == null || !member.canExecute();
            })
            .sorted()
            .toList();
        if (!missing.isEmpty()) {
            throw new SigningException(ErrorKind.SANDBOX_BUILD_ERROR,
                "Script " + script.shortHash() + " is missing entry points " + missing);
        }
    }

    private <T> T withDeadline(Duration timeout, Supplier<T> body) {
        AtomicBoolean expired = new AtomicBoolean();
        ScheduledFuture<?> guard = watchdog.schedule(() -> {
            expired.set(true);
            log.warn("Deadline of {}ms reached on {}, cancelling", timeout.toMillis(), id);
            polyglot.close(true);
        }, timeout.toNanos(), TimeUnit.NANOSECONDS);
        try {
            T value = body.get();
            // a guard that already started may have closed the context after the body returned
            if (!guard.cancel(false) || expired.get()) {
                throw new DeadlineExceeded();
            }
            return value;
        } catch (PolyglotException ex) {
            if (expired.get() || ex.isCancelled()) {
                throw new DeadlineExceeded();
            }
            throw ex;
        } catch (IllegalStateException ex) {
            if (expired.get()) {
                throw new DeadlineExceeded();
            }
            throw ex;
        } finally {
            guard.cancel(false);
        }
    }

    /**
     * Settles a thenable by feeding the timer queue until it resolves or rejects; plain values
     * pass through.
     */
    private Value await(Value value) {
        if (value == null || !value.canInvokeMember("then")) {
            return value;
        }
        AtomicReference<Value> resolved = new AtomicReference<>();
        AtomicReference<String> rejected = new AtomicReference<>();
        AtomicBoolean settled = new AtomicBoolean();
        ProxyExecutable resolve = args -> {
            if (settled.compareAndSet(false, true)) {
                resolved.set(args.length > 0 ? args[0] : null);
            }
            return null;
        };
        ProxyExecutable reject = args -> {
            if (settled.compareAndSet(false, true)) {
                rejected.set(args.length > 0 ? JsValues.render(args) : "Promise rejected");
            }
            return null;
        };
        value.invokeMember("then", resolve, reject);
        while (!settled.get() && host.runNextTimer()) {
            // each timer callback may settle the promise
        }
        if (!settled.get()) {
            throw new IllegalStateException("Promise never settled");
        }
        if (rejected.get() != null) {
            throw new IllegalStateException("Promise rejected: " + rejected.get());
        }
        return resolved.get();
    }

    private static final class DeadlineExceeded extends RuntimeException {
        DeadlineExceeded() {
            super(null, null, false, false);
        }
    }
}
