package work.signbox.logging;

import org.slf4j.MDC;

/**
 * MDC keys attached to log lines emitted while a signing call holds a sandbox.
 */
public final class SigningMdc {
    private SigningMdc() {}

    public static void set(String platform, String entryPoint, String contextId) {
        MDC.put("platform", platform);
        MDC.put("entryPoint", entryPoint);
        MDC.put("contextId", contextId);
    }

    public static void clear() {
        MDC.remove("platform");
        MDC.remove("entryPoint");
        MDC.remove("contextId");
    }
}
