package work.signbox.api;

import java.time.Duration;
import java.util.Optional;

/**
 * One signing call: the outbound URI to authenticate, the platform it targets, the request
 * parameters handed to the signing function and the user agent the crawler will send.
 *
 * <p>{@code parameters} is either a {@link String} (usually an encoded query string) or a
 * JSON-like {@code Map}/{@code List} structure.
 */
public record SigningRequest(
    String targetUri,
    String platform,
    Object parameters,
    String clientUserAgent,
    Optional<Duration> acquireTimeout
) {
    public SigningRequest {
        parameters = parameters == null ? "" : parameters;
        acquireTimeout = acquireTimeout == null ? Optional.empty() : acquireTimeout;
    }

    public SigningRequest(String targetUri, String platform, Object parameters, String clientUserAgent) {
        this(targetUri, platform, parameters, clientUserAgent, Optional.empty());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String targetUri;
        private String platform;
        private Object parameters = "";
        private String clientUserAgent;
        private Optional<Duration> acquireTimeout = Optional.empty();

        public Builder targetUri(String targetUri) {
            this.targetUri = targetUri;
            return this;
        }

        public Builder platform(String platform) {
            this.platform = platform;
            return this;
        }

        public Builder parameters(Object parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder clientUserAgent(String clientUserAgent) {
            this.clientUserAgent = clientUserAgent;
            return this;
        }

        public Builder acquireTimeout(Duration acquireTimeout) {
            this.acquireTimeout = Optional.ofNullable(acquireTimeout);
            return this;
        }

        public SigningRequest build() {
            return new SigningRequest(targetUri, platform, parameters, clientUserAgent, acquireTimeout);
        }
    }

    @Override
    public String toString() {
        return "SigningRequest[" + platform + " " + targetUri + "]";
    }
}
