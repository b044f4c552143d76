package work.signbox.script;

import java.time.Instant;
import java.util.Objects;
import work.signbox.shared.Hashing;

/**
 * Immutable snapshot of the vendor signing script. Replaced wholesale on update.
 */
public record AlgorithmScript(String source, String hash, Instant loadedAt, long version) {
    public AlgorithmScript {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(loadedAt, "loadedAt");
    }

    public static AlgorithmScript of(String source, long version) {
        return new AlgorithmScript(source, Hashing.sha256Hex(source), Instant.now(), version);
    }

    public String shortHash() {
        return Hashing.shortHash(hash);
    }

    @Override
    public String toString() {
        return "AlgorithmScript[v" + version + " " + shortHash() + "]";
    }
}
