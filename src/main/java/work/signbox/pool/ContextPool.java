package work.signbox.pool;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.signbox.api.ErrorKind;
import work.signbox.api.SigningException;
import work.signbox.sandbox.SandboxContext;
import work.signbox.sandbox.SandboxFactory;
import work.signbox.script.AlgorithmScript;

/**
 * Fixed-size arena of {@link SandboxContext}s. Each context is leased to one caller at a time,
 * so the pool size is the signing concurrency ceiling; callers beyond it wait in
 * {@link #acquire(Duration)} up to their timeout.
 *
 * <p>Only contexts built from the active script are handed out. After
 * {@link #onScriptUpdated(AlgorithmScript)} idle contexts are replaced at once, leased ones on
 * release and in-flight builds for the old script are discarded when they finish. Faulted,
 * stale and rotated contexts are retired and rebuilt in the background, so
 * {@code idle + leased + building} stays equal to the pool size.
 */
public final class ContextPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ContextPool.class);

    private final int size;
    private final SandboxFactory factory;
    private final long rotationThreshold;
    private final Duration rebuildBackoff;
    private final ScheduledExecutorService builders;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final Deque<SandboxContext> idle = new ArrayDeque<>();
    private final Set<SandboxContext> leased = Collections.newSetFromMap(new IdentityHashMap<>());
    private int building;
    private boolean closed;
    private volatile AlgorithmScript active;

    public ContextPool(int size, SandboxFactory factory, AlgorithmScript initialScript,
                       long rotationThreshold, Duration rebuildBackoff) {
        if (size < 1) {
            throw new IllegalArgumentException("Pool size must be >= 1");
        }
        if (rotationThreshold < 1) {
            throw new IllegalArgumentException("rotationThreshold must be >= 1");
        }
        this.size = size;
        this.factory = Objects.requireNonNull(factory, "factory");
        this.active = Objects.requireNonNull(initialScript, "initialScript");
        this.rotationThreshold = rotationThreshold;
        this.rebuildBackoff = Objects.requireNonNull(rebuildBackoff, "rebuildBackoff");
        AtomicInteger threads = new AtomicInteger();
        this.builders = Executors.newScheduledThreadPool(Math.min(size, 4), runnable -> {
            Thread thread = new Thread(runnable, "sandbox-builder-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Builds the initial contexts on the calling thread. Any build failure closes what was
     * built so far and propagates.
     */
    public void start() {
        List<SandboxContext> built = new ArrayList<>();
        try {
            for (int i = 0; i < size; i++) {
                built.add(factory.build(active));
            }
        } catch (RuntimeException ex) {
            built.forEach(SandboxContext::close);
            throw ex;
        }
        lock.lock();
        try {
            idle.addAll(built);
            available.signalAll();
        } finally {
            lock.unlock();
        }
        log.info("Context pool started with {} contexts on {}", size, active);
    }

    /**
     * Blocks until an idle context built from the active script is available.
     *
     * @throws SigningException {@code SERVICE_UNAVAILABLE} when {@code timeout} elapses or the
     *                          pool is closed, {@code CANCELLED} when the caller is interrupted
     */
    public LeasedContext acquire(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        List<SandboxContext> retired = new ArrayList<>();
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new SigningException(ErrorKind.CANCELLED, "Cancelled while waiting for a sandbox", ex);
        }
        try {
            long remaining = timeout.toNanos();
            while (true) {
                if (closed) {
                    throw new SigningException(ErrorKind.SERVICE_UNAVAILABLE, "Context pool is closed");
                }
                SandboxContext candidate;
                while ((candidate = idle.pollFirst()) != null) {
                    if (isStale(candidate) || !candidate.tryLease()) {
                        retired.add(candidate);
                        scheduleReplacementLocked();
                        continue;
                    }
                    leased.add(candidate);
                    return new LeasedContext(this, candidate);
                }
                if (remaining <= 0L) {
                    throw new SigningException(ErrorKind.SERVICE_UNAVAILABLE,
                        "No sandbox available within " + timeout.toMillis() + "ms (pool size " + size + ")");
                }
                remaining = available.awaitNanos(remaining);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new SigningException(ErrorKind.CANCELLED, "Cancelled while waiting for a sandbox", ex);
        } finally {
            lock.unlock();
            retired.forEach(SandboxContext::close);
        }
    }

    /**
     * Returns a leased context. HEALTHY contexts go back to the idle set unless they are stale
     * or reached the rotation threshold; everything else is retired and replaced.
     */
    public void release(LeasedContext lease, Outcome outcome) {
        Objects.requireNonNull(lease, "lease");
        Objects.requireNonNull(outcome, "outcome");
        if (lease.pool() != this) {
            throw new IllegalArgumentException("Lease belongs to another pool");
        }
        if (!lease.markReleased()) {
            return;
        }
        SandboxContext context = lease.context();
        String reason = null;
        lock.lock();
        try {
            leased.remove(context);
            if (closed) {
                reason = "pool closed";
            } else if (outcome == Outcome.FAULTED) {
                reason = "faulted";
            } else if (isStale(context)) {
                reason = "stale";
            } else if (context.invocationCount() >= rotationThreshold) {
                reason = "rotation after " + context.invocationCount() + " invocations";
            } else if (!context.returnToReady()) {
                reason = "state " + context.state();
            }
            if (reason == null) {
                idle.addLast(context);
                available.signalAll();
            } else if (!closed) {
                scheduleReplacementLocked();
            }
        } finally {
            lock.unlock();
        }
        if (reason != null) {
            log.info("Retiring {} ({})", context.id(), reason);
            context.close();
        }
    }

    /**
     * Switches the active script. Idle contexts built from an older script are retired and
     * rebuilt immediately; leased ones are retired when they come back.
     */
    public void onScriptUpdated(AlgorithmScript script) {
        Objects.requireNonNull(script, "script");
        List<SandboxContext> stale = new ArrayList<>();
        lock.lock();
        try {
            active = script;
            idle.removeIf(context -> {
                if (isStale(context)) {
                    stale.add(context);
                    return true;
                }
                return false;
            });
            if (!closed) {
                stale.forEach(context -> scheduleReplacementLocked());
            }
        } finally {
            lock.unlock();
        }
        stale.forEach(SandboxContext::close);
        log.info("Active script is now {}; replaced {} idle contexts", script, stale.size());
    }

    public AlgorithmScript activeScript() {
        return active;
    }

    public int size() {
        return size;
    }

    /** Idle contexts built from the active script. */
    public int readyCount() {
        lock.lock();
        try {
            return (int) idle.stream().filter(context -> !isStale(context)).count();
        } finally {
            lock.unlock();
        }
    }

    /** Waits until at least {@code count} contexts are ready; false on timeout. */
    public boolean awaitReady(int count, Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (readyCount() < count) {
                if (remaining <= 0L || closed) {
                    return false;
                }
                remaining = available.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public PoolStatus status() {
        lock.lock();
        try {
            List<PoolStatus.ContextInfo> contexts = new ArrayList<>();
            int ready = 0;
            for (SandboxContext context : idle) {
                boolean stale = isStale(context);
                if (!stale) {
                    ready++;
                }
                contexts.add(info(context, stale));
            }
            for (SandboxContext context : leased) {
                contexts.add(info(context, isStale(context)));
            }
            return new PoolStatus(size, ready, leased.size(), building, active.hash(), active.version(), contexts);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        List<SandboxContext> toClose;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            toClose = new ArrayList<>(idle);
            idle.clear();
            available.signalAll();
        } finally {
            lock.unlock();
        }
        builders.shutdownNow();
        toClose.forEach(SandboxContext::close);
        log.info("Context pool closed");
    }

    private boolean isStale(SandboxContext context) {
        return !context.scriptHash().equals(active.hash());
    }

    private void scheduleReplacementLocked() {
        building++;
        submitBuild(0L);
    }

    private void submitBuild(long delayMillis) {
        try {
            builders.schedule(this::buildReplacement, delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException ex) {
            lock.lock();
            try {
                building--;
            } finally {
                lock.unlock();
            }
            log.debug("Replacement build rejected, pool is shutting down");
        }
    }

    private void buildReplacement() {
        AlgorithmScript target = active;
        SandboxContext built;
        try {
            built = factory.build(target);
        } catch (RuntimeException ex) {
            boolean retry;
            lock.lock();
            try {
                retry = !closed;
                if (!retry) {
                    building--;
                }
            } finally {
                lock.unlock();
            }
            if (retry) {
                log.error("Replacement build on {} failed, retrying in {}ms", target, rebuildBackoff.toMillis(), ex);
                submitBuild(rebuildBackoff.toMillis());
            }
            return;
        }
        SandboxContext discard = null;
        lock.lock();
        try {
            building--;
            if (closed) {
                discard = built;
            } else if (isStale(built)) {
                discard = built;
                scheduleReplacementLocked();
            } else {
                idle.addLast(built);
                available.signalAll();
            }
        } finally {
            lock.unlock();
        }
        if (discard != null) {
            discard.close();
        } else {
            log.debug("Replacement {} ready", built.id());
        }
    }

    private static PoolStatus.ContextInfo info(SandboxContext context, boolean stale) {
        return new PoolStatus.ContextInfo(
            context.id(),
            context.state().name().toLowerCase(Locale.ROOT),
            context.scriptHash(),
            stale,
            context.invocationCount(),
            context.createdAt(),
            context.lastUsedAt()
        );
    }
}
