package work.signbox.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * What {@link SigningService#sign} hands back: either a {@link SigningResult} or a typed
 * error. Exceptions never cross the service boundary.
 */
public final class SigningResponse {
    private final SigningResult result;
    private final ErrorKind errorKind;
    private final String message;

    private SigningResponse(SigningResult result, ErrorKind errorKind, String message) {
        this.result = result;
        this.errorKind = errorKind;
        this.message = message;
    }

    public static SigningResponse success(SigningResult result) {
        return new SigningResponse(Objects.requireNonNull(result, "result"), null, null);
    }

    public static SigningResponse failure(ErrorKind kind, String message) {
        Objects.requireNonNull(kind, "kind");
        String text = message == null || message.isBlank() ? kind.wireName() : message;
        return new SigningResponse(null, kind, text);
    }

    public static SigningResponse failure(SigningException ex) {
        return failure(ex.kind(), ex.getMessage());
    }

    public boolean isSuccess() {
        return result != null;
    }

    public Optional<SigningResult> result() {
        return Optional.ofNullable(result);
    }

    public Optional<ErrorKind> errorKind() {
        return Optional.ofNullable(errorKind);
    }

    public String message() {
        return message;
    }

    public int httpStatus() {
        return isSuccess() ? 200 : errorKind.httpStatus();
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", isSuccess());
        if (isSuccess()) {
            body.put("token", result.token());
            body.put("entry_point", result.entryPoint());
            body.put("elapsed_ms", result.elapsed().toMillis());
        } else {
            body.put("error_kind", errorKind.wireName());
            body.put("message", message);
            body.put("retryable", errorKind.retryable());
        }
        return body;
    }

    @Override
    public String toString() {
        return isSuccess()
            ? "SigningResponse[success entryPoint=" + result.entryPoint() + "]"
            : "SigningResponse[" + errorKind + ": " + message + "]";
    }
}
