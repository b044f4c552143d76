package work.signbox.sandbox;

import java.util.Collection;
import work.signbox.script.AlgorithmScript;

/**
 * Builds ready-to-use sandboxes for a script. Implementations throw
 * {@link work.signbox.api.SigningException} with {@code SANDBOX_BUILD_ERROR} on failure.
 */
public interface SandboxFactory extends AutoCloseable {
    /** Builds against the entry points currently required by the dispatch rules. */
    SandboxContext build(AlgorithmScript script);

    SandboxContext build(AlgorithmScript script, Collection<String> requiredEntryPoints);

    @Override
    default void close() {}
}
