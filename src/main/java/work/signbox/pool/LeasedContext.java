package work.signbox.pool;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import work.signbox.api.SigningResult;
import work.signbox.sandbox.SandboxContext;

/**
 * Exclusive handle on one pooled {@link SandboxContext}. Must be handed back through
 * {@link ContextPool#release(LeasedContext, Outcome)}; releasing twice is a no-op.
 */
public final class LeasedContext {
    private final ContextPool pool;
    private final SandboxContext context;
    private final AtomicBoolean released = new AtomicBoolean();

    LeasedContext(ContextPool pool, SandboxContext context) {
        this.pool = pool;
        this.context = Objects.requireNonNull(context, "context");
    }

    public SigningResult invoke(String entryPoint, List<?> args, Duration timeout) {
        if (released.get()) {
            throw new IllegalStateException("Lease on " + context.id() + " already released");
        }
        return context.invoke(entryPoint, args, timeout);
    }

    public String contextId() {
        return context.id();
    }

    public String scriptHash() {
        return context.scriptHash();
    }

    public void release(Outcome outcome) {
        pool.release(this, outcome);
    }

    SandboxContext context() {
        return context;
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    ContextPool pool() {
        return pool;
    }
}
