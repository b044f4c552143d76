package work.signbox.script;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.signbox.api.ErrorKind;
import work.signbox.api.SigningException;

/**
 * Holds the current algorithm script plus a bounded history of the versions it replaced.
 * Publication goes through a single {@link AtomicReference} swap, so readers see either the
 * old or the new script.
 */
public final class ScriptStore {
    private static final Logger log = LoggerFactory.getLogger(ScriptStore.class);

    private final ScriptValidator validator;
    private final int historyLimit;
    private final AtomicReference<AlgorithmScript> current = new AtomicReference<>();
    private final AtomicLong versions = new AtomicLong();
    private final Deque<AlgorithmScript> history = new ArrayDeque<>();
    private final Object writeLock = new Object();

    public ScriptStore(ScriptValidator validator, int historyLimit) {
        this.validator = Objects.requireNonNull(validator, "validator");
        if (historyLimit < 0) {
            throw new IllegalArgumentException("historyLimit must be >= 0");
        }
        this.historyLimit = historyLimit;
    }

    public AlgorithmScript load(String source) {
        if (source == null || source.isBlank()) {
            throw new SigningException(ErrorKind.SCRIPT_INVALID, "Algorithm script source is empty");
        }
        synchronized (writeLock) {
            AlgorithmScript previous = current.get();
            AlgorithmScript candidate = AlgorithmScript.of(source, versions.get() + 1);
            if (previous != null && previous.hash().equals(candidate.hash())) {
                log.info("Script {} unchanged, keeping {}", candidate.shortHash(), previous);
                return previous;
            }
            validateOrReject(candidate);
            versions.incrementAndGet();
            publish(candidate, previous);
            log.info("Published {} (previous: {})", candidate, previous == null ? "none" : previous);
            return candidate;
        }
    }

    public AlgorithmScript loadFile(Path path) {
        try {
            return load(Files.readString(path));
        } catch (IOException ex) {
            throw new SigningException(ErrorKind.SCRIPT_INVALID, "Failed to read algorithm script: " + path, ex);
        }
    }

    public AlgorithmScript current() {
        AlgorithmScript script = current.get();
        if (script == null) {
            throw new SigningException(ErrorKind.SERVICE_UNAVAILABLE, "No algorithm script loaded");
        }
        return script;
    }

    public boolean hasScript() {
        return current.get() != null;
    }

    /** Prior versions, newest first. */
    public List<AlgorithmScript> history() {
        synchronized (writeLock) {
            return List.copyOf(history);
        }
    }

    /**
     * Re-publishes the version that the current script replaced. The rolled-back version is
     * validated again, since the required entry points may have changed in the meantime.
     */
    public AlgorithmScript rollback() {
        synchronized (writeLock) {
            AlgorithmScript previous = history.peekFirst();
            if (previous == null) {
                throw new SigningException(ErrorKind.SCRIPT_INVALID, "No previous script version to roll back to");
            }
            validateOrReject(previous);
            history.removeFirst();
            AlgorithmScript restored = new AlgorithmScript(
                previous.source(), previous.hash(), Instant.now(), versions.incrementAndGet());
            current.set(restored);
            log.warn("Rolled back to script {} (was v{})", restored, previous.version());
            return restored;
        }
    }

    private void validateOrReject(AlgorithmScript candidate) {
        try {
            validator.validate(candidate);
        } catch (SigningException ex) {
            log.warn("Rejected script {}: {}", candidate.shortHash(), ex.getMessage());
            throw new SigningException(ErrorKind.SCRIPT_INVALID, ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            log.warn("Rejected script {}", candidate.shortHash(), ex);
            throw new SigningException(ErrorKind.SCRIPT_INVALID, "Script validation failed: " + ex.getMessage(), ex);
        }
    }

    private void publish(AlgorithmScript candidate, AlgorithmScript previous) {
        if (previous != null && historyLimit > 0) {
            history.addFirst(previous);
            while (history.size() > historyLimit) {
                history.removeLast();
            }
        }
        current.set(candidate);
    }
}
