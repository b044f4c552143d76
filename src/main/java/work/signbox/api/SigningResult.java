package work.signbox.api;

import java.time.Duration;
import java.util.Objects;

public record SigningResult(String token, String entryPoint, Duration elapsed, String contextId, String scriptHash) {
    public SigningResult {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(entryPoint, "entryPoint");
        Objects.requireNonNull(elapsed, "elapsed");
    }

    public SigningResult withElapsed(Duration total) {
        return new SigningResult(token, entryPoint, total, contextId, scriptHash);
    }
}
