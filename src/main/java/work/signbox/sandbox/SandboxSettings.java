package work.signbox.sandbox;

import java.time.Duration;
import java.util.Objects;

/**
 * Limits applied to every sandbox built by a {@link GraalSandboxFactory}.
 *
 * @param buildTimeout      wall-clock budget for evaluating the algorithm script once
 * @param maxTimerCallbacks upper bound on {@code setTimeout} callbacks run in one drain
 */
public record SandboxSettings(Duration buildTimeout, int maxTimerCallbacks) {
    public static final SandboxSettings DEFAULT = new SandboxSettings(Duration.ofSeconds(10), 1000);

    public SandboxSettings {
        Objects.requireNonNull(buildTimeout, "buildTimeout");
        if (buildTimeout.isZero() || buildTimeout.isNegative()) {
            throw new IllegalArgumentException("buildTimeout must be positive");
        }
        if (maxTimerCallbacks < 1) {
            throw new IllegalArgumentException("maxTimerCallbacks must be >= 1");
        }
    }
}
