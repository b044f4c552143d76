package work.signbox.pool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import work.signbox.api.ErrorKind;
import work.signbox.api.SigningException;
import work.signbox.sandbox.GraalSandboxFactory;
import work.signbox.script.AlgorithmScript;
import work.signbox.support.SignboxTestSupport;

class ContextPoolTest {
    private static final Duration WAIT = Duration.ofSeconds(20);

    private final GraalSandboxFactory factory = SignboxTestSupport.factory("sign_detail");
    private final AlgorithmScript v1 = AlgorithmScript.of(SignboxTestSupport.script("douyin.js"), 1);
    private final ExecutorService callers = Executors.newCachedThreadPool();
    private ContextPool pool;

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
        if (pool != null) {
            pool.close();
        }
        factory.close();
    }

    private ContextPool start(int size, long rotationThreshold) {
        pool = new ContextPool(size, factory, v1, rotationThreshold, Duration.ofMillis(50));
        pool.start();
        return pool;
    }

    private static String sign(LeasedContext lease) {
        return lease.invoke("sign_detail", List.of("aweme_id=7", SignboxTestSupport.USER_AGENT), Duration.ofSeconds(5)).token();
    }

    @Test
    void thirdCallerWaitsForARelease() throws Exception {
        start(2, 10_000);
        LeasedContext first = pool.acquire(Duration.ofMillis(100));
        LeasedContext second = pool.acquire(Duration.ofMillis(100));
        assertNotEquals(first.contextId(), second.contextId());

        Future<LeasedContext> third = callers.submit(() -> pool.acquire(WAIT));
        assertThrows(TimeoutException.class, () -> third.get(300, TimeUnit.MILLISECONDS));

        sign(first);
        first.release(Outcome.HEALTHY);
        LeasedContext reused = third.get(5, TimeUnit.SECONDS);

        assertEquals(first.contextId(), reused.contextId());
        assertTrue(sign(reused).startsWith("detail-"));
        reused.release(Outcome.HEALTHY);
        second.release(Outcome.HEALTHY);
        assertEquals(2, pool.readyCount());
    }

    @Test
    void acquireTimesOutWhenExhausted() {
        start(1, 10_000);
        LeasedContext held = pool.acquire(Duration.ofMillis(100));

        long started = System.nanoTime();
        SigningException ex = assertThrows(SigningException.class, () -> pool.acquire(Duration.ofMillis(200)));
        Duration waited = Duration.ofNanos(System.nanoTime() - started);

        assertEquals(ErrorKind.SERVICE_UNAVAILABLE, ex.kind());
        assertTrue(ex.kind().retryable());
        assertTrue(waited.compareTo(Duration.ofMillis(150)) >= 0, "waited " + waited);
        held.release(Outcome.HEALTHY);
    }

    @Test
    void interruptedWaiterIsCancelled() throws Exception {
        start(1, 10_000);
        LeasedContext held = pool.acquire(Duration.ofMillis(100));
        AtomicReference<SigningException> failure = new AtomicReference<>();
        AtomicBoolean interruptFlag = new AtomicBoolean();
        Thread waiter = new Thread(() -> {
            try {
                pool.acquire(WAIT);
            } catch (SigningException ex) {
                failure.set(ex);
                interruptFlag.set(Thread.currentThread().isInterrupted());
            }
        });
        waiter.start();
        Thread.sleep(200);
        waiter.interrupt();
        waiter.join(5_000);

        assertEquals(ErrorKind.CANCELLED, failure.get().kind());
        assertTrue(interruptFlag.get());
        held.release(Outcome.HEALTHY);
    }

    @Test
    void faultedContextIsReplaced() throws Exception {
        start(2, 10_000);
        LeasedContext lease = pool.acquire(Duration.ofMillis(100));
        String faultedId = lease.contextId();

        lease.release(Outcome.FAULTED);

        assertTrue(pool.awaitReady(2, WAIT));
        Set<String> ids = pool.status().contexts().stream().map(PoolStatus.ContextInfo::id).collect(Collectors.toSet());
        assertEquals(2, ids.size());
        assertFalse(ids.contains(faultedId));
    }

    @Test
    void doubleReleaseIsIgnored() throws Exception {
        start(1, 10_000);
        LeasedContext lease = pool.acquire(Duration.ofMillis(100));
        lease.release(Outcome.HEALTHY);
        lease.release(Outcome.FAULTED);

        assertEquals(1, pool.readyCount());
        assertEquals(0, pool.status().building());
        assertThrows(IllegalStateException.class, () -> sign(lease));
    }

    @Test
    void scriptUpdateRetiresIdleAndReturningContexts() throws Exception {
        start(2, 10_000);
        LeasedContext busy = pool.acquire(Duration.ofMillis(100));
        AlgorithmScript v2 = AlgorithmScript.of(SignboxTestSupport.script("douyin-v2.js"), 2);

        pool.onScriptUpdated(v2);
        assertEquals(v2, pool.activeScript());
        assertTrue(sign(busy).startsWith("detail-"), "in-flight lease keeps its old script");
        busy.release(Outcome.HEALTHY);

        assertTrue(pool.awaitReady(2, WAIT));
        PoolStatus status = pool.status();
        assertEquals(v2.hash(), status.activeScriptHash());
        assertTrue(status.contexts().stream().allMatch(info -> info.scriptHash().equals(v2.hash())));

        LeasedContext fresh = pool.acquire(Duration.ofSeconds(1));
        assertEquals("v2-detail:aweme_id=7", sign(fresh));
        fresh.release(Outcome.HEALTHY);
    }

    @Test
    void contextsRotateAfterThreshold() throws Exception {
        start(1, 2);
        LeasedContext lease = pool.acquire(Duration.ofMillis(100));
        String original = lease.contextId();
        sign(lease);
        sign(lease);
        lease.release(Outcome.HEALTHY);

        assertTrue(pool.awaitReady(1, WAIT));
        LeasedContext next = pool.acquire(Duration.ofSeconds(1));
        assertNotEquals(original, next.contextId());
        next.release(Outcome.HEALTHY);
    }

    @Test
    void statusReportsLeasesAndInvocations() {
        start(2, 10_000);
        LeasedContext lease = pool.acquire(Duration.ofMillis(100));
        sign(lease);

        PoolStatus status = pool.status();
        assertEquals(2, status.size());
        assertEquals(1, status.ready());
        assertEquals(1, status.busy());
        PoolStatus.ContextInfo busy = status.contexts().stream()
            .filter(info -> info.id().equals(lease.contextId()))
            .findFirst()
            .orElseThrow();
        assertEquals("busy", busy.state());
        assertEquals(1, busy.invocations());
        assertEquals(v1.hash(), status.toSerializableMap().get("script_hash"));
        lease.release(Outcome.HEALTHY);
    }

    @Test
    void closedPoolRejectsCallers() throws Exception {
        start(1, 10_000);
        LeasedContext held = pool.acquire(Duration.ofMillis(100));
        CompletableFuture<ErrorKind> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                pool.acquire(WAIT);
                return null;
            } catch (SigningException ex) {
                return ex.kind();
            }
        }, callers);
        Thread.sleep(100);

        pool.close();

        assertEquals(ErrorKind.SERVICE_UNAVAILABLE, waiter.get(5, TimeUnit.SECONDS));
        held.release(Outcome.HEALTHY);
        assertEquals(0, pool.readyCount());
    }

    @Test
    void rejectsInvalidSizes() {
        assertThrows(IllegalArgumentException.class, () -> new ContextPool(0, factory, v1, 10, Duration.ofMillis(10)));
        assertThrows(IllegalArgumentException.class, () -> new ContextPool(1, factory, v1, 0, Duration.ofMillis(10)));
    }
}
