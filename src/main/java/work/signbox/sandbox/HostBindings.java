package work.signbox.sandbox;

import java.util.Arrays;
import java.util.Comparator;
import java.util.PriorityQueue;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The host capabilities a sandbox may observe beyond the JS built-ins ({@code Date},
 * {@code Math}): a {@code console} routed to SLF4J and {@code setTimeout}/{@code clearTimeout}
 * backed by a per-context virtual timer queue.
 *
 * <p>Timers never sleep. Callbacks run after the current host call, ordered by their delay and
 * then by scheduling order, and only ever on the thread that owns the context.
 */
final class HostBindings {
    private static final Logger console = LoggerFactory.getLogger("work.signbox.sandbox.console");

    private final String contextId;
    private final int maxTimerCallbacks;
    private final PriorityQueue<Timer> timers = new PriorityQueue<>(
        Comparator.comparingLong(Timer::dueAt).thenComparingLong(Timer::id));
    private long virtualNow;
    private long nextTimerId = 1;

    HostBindings(String contextId, int maxTimerCallbacks) {
        this.contextId = contextId;
        this.maxTimerCallbacks = maxTimerCallbacks;
    }

    void install(Context context) {
        Value bindings = context.getBindings("js");
        Value consoleObject = context.eval("js", "({})");
        consoleObject.putMember("log", consoleFunction("debug"));
        consoleObject.putMember("debug", consoleFunction("debug"));
        consoleObject.putMember("trace", consoleFunction("debug"));
        consoleObject.putMember("info", consoleFunction("info"));
        consoleObject.putMember("warn", consoleFunction("warn"));
        consoleObject.putMember("error", consoleFunction("warn"));
        bindings.putMember("console", consoleObject);
        bindings.putMember("setTimeout", (ProxyExecutable) this::setTimeout);
        bindings.putMember("clearTimeout", (ProxyExecutable) this::clearTimeout);
    }

    boolean hasPendingTimers() {
        return !timers.isEmpty();
    }

    /** Runs the earliest pending callback; returns false when the queue is empty. */
    boolean runNextTimer() {
        Timer timer = timers.poll();
        if (timer == null) {
            return false;
        }
        virtualNow = Math.max(virtualNow, timer.dueAt());
        timer.callback().execute((Object[]) timer.args());
        return true;
    }

    void drainTimers() {
        int executed = 0;
        while (runNextTimer()) {
            executed++;
            if (executed >= maxTimerCallbacks && hasPendingTimers()) {
                timers.clear();
                throw new IllegalStateException(
                    "Timer drain exceeded " + maxTimerCallbacks + " callbacks in context " + contextId);
            }
        }
    }

    private Object setTimeout(Value... args) {
        if (args.length == 0 || !args[0].canExecute()) {
            throw new IllegalArgumentException("setTimeout requires a callback function");
        }
        long delay = 0;
        if (args.length > 1 && args[1].isNumber()) {
            delay = Math.max(0, (long) args[1].asDouble());
        }
        Value[] extra = args.length > 2 ? Arrays.copyOfRange(args, 2, args.length) : new Value[0];
        long id = nextTimerId++;
        timers.add(new Timer(id, virtualNow + delay, args[0], extra));
        return id;
    }

    private Object clearTimeout(Value... args) {
        if (args.length > 0 && args[0].isNumber()) {
            long id = args[0].asLong();
            timers.removeIf(timer -> timer.id() == id);
        }
        return null;
    }

    private ProxyExecutable consoleFunction(String level) {
        return args -> {
            String rendered = JsValues.render(args);
            switch (level) {
                case "warn" -> console.warn("[{}] {}", contextId, rendered);
                case "info" -> console.info("[{}] {}", contextId, rendered);
                default -> console.debug("[{}] {}", contextId, rendered);
            }
            return null;
        };
    }

    private record Timer(long id, long dueAt, Value callback, Value[] args) {}
}
