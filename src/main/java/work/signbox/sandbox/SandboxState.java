package work.signbox.sandbox;

/**
 * Lifecycle of a {@link SandboxContext}: {@code BUILDING -> READY <-> BUSY -> (READY | FAULTED) -> RETIRED}.
 */
public enum SandboxState {
    BUILDING,
    READY,
    BUSY,
    FAULTED,
    RETIRED
}
