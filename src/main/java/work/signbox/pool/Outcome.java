package work.signbox.pool;

/**
 * How a lease ended. Only {@link #HEALTHY} contexts go back to the idle set.
 */
public enum Outcome {
    HEALTHY,
    FAULTED
}
