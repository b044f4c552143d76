package work.signbox.dispatch;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Maps a URI shape to the entry point that signs it. Rules without a platform apply to every
 * platform.
 */
public record DispatchRule(String pattern, MatchMode mode, String entryPoint, int priority, Optional<String> platform) {
    public DispatchRule {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(platform, "platform");
        if (entryPoint == null || entryPoint.isBlank()) {
            throw new IllegalArgumentException("Dispatch rule for '" + pattern + "' needs an entry point");
        }
        if (mode == MatchMode.REGEX) {
            try {
                Pattern.compile(pattern);
            } catch (PatternSyntaxException ex) {
                throw new IllegalArgumentException("Invalid dispatch regex '" + pattern + "': " + ex.getDescription(), ex);
            }
        }
        platform = platform.map(value -> value.trim().toLowerCase(Locale.ROOT)).filter(value -> !value.isEmpty());
    }

    public static DispatchRule contains(String platform, String fragment, String entryPoint, int priority) {
        return new DispatchRule(fragment, MatchMode.CONTAINS, entryPoint, priority, Optional.ofNullable(platform));
    }

    public static DispatchRule regex(String platform, String regex, String entryPoint, int priority) {
        return new DispatchRule(regex, MatchMode.REGEX, entryPoint, priority, Optional.ofNullable(platform));
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        platform.ifPresent(value -> map.put("platform", value));
        map.put("pattern", pattern);
        map.put("mode", mode.name().toLowerCase(Locale.ROOT));
        map.put("entry_point", entryPoint);
        map.put("priority", priority);
        return map;
    }
}
