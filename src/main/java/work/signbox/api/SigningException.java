package work.signbox.api;

import java.util.Objects;

/**
 * Unchecked failure raised by every layer of the signing pipeline. The {@link ErrorKind}
 * is what the API boundary turns into a structured error.
 */
public class SigningException extends RuntimeException {
    private final ErrorKind kind;

    public SigningException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public SigningException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}
