package work.signbox.script;

/**
 * Checks a candidate script before it is published. Implementations throw
 * {@link work.signbox.api.SigningException} to reject it.
 */
@FunctionalInterface
public interface ScriptValidator {
    ScriptValidator ACCEPT_ALL = script -> {};

    void validate(AlgorithmScript candidate);
}
