package work.signbox.dispatch;

import java.util.Locale;

public enum MatchMode {
    /** Plain substring of the target URI. */
    CONTAINS,
    /** {@link java.util.regex.Matcher#find()} against the target URI. */
    REGEX;

    public static MatchMode from(String value) {
        if (value == null || value.isBlank()) {
            return CONTAINS;
        }
        try {
            return MatchMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported match mode: " + value);
        }
    }
}
