package work.signbox.dispatch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads dispatch rules from YAML files, JSON bodies or already-parsed maps. Every form uses
 * the keys {@code platform}, {@code pattern}, {@code mode}, {@code entry_point} and
 * {@code priority}.
 */
public final class RuleLoader {
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<List<Map<String, Object>>> LIST_OF_MAPS = new TypeReference<>() {};

    private RuleLoader() {}

    /**
     * Accepts either a top-level list or a document with a {@code rules:} list.
     */
    public static List<DispatchRule> loadYaml(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            Object document = YAML.readValue(in, Object.class);
            if (document instanceof Map<?, ?> map && map.get("rules") instanceof List<?> list) {
                return fromMaps(list);
            }
            if (document instanceof List<?> list) {
                return fromMaps(list);
            }
            throw new IllegalArgumentException("Rules file " + path + " must contain a list of rules");
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read dispatch rules: " + path, ex);
        }
    }

    public static List<DispatchRule> parseJson(String body) {
        try {
            return fromMaps(JSON.readValue(body, LIST_OF_MAPS));
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid rules JSON: " + ex.getMessage(), ex);
        }
    }

    public static List<DispatchRule> fromMaps(List<?> raw) {
        List<DispatchRule> rules = new ArrayList<>();
        int index = 0;
        for (Object entry : raw) {
            if (!(entry instanceof Map<?, ?> map)) {
                throw new IllegalArgumentException("Rule #" + index + " is not an object");
            }
            rules.add(fromMap(map, index));
            index++;
        }
        return rules;
    }

    private static DispatchRule fromMap(Map<?, ?> map, int index) {
        String pattern = optionalString(map.get("pattern"));
        if (pattern == null) {
            throw new IllegalArgumentException("Rule #" + index + " has no pattern");
        }
        String entryPoint = optionalString(map.containsKey("entry_point") ? map.get("entry_point") : map.get("entry-point"));
        if (entryPoint == null) {
            throw new IllegalArgumentException("Rule #" + index + " has no entry_point");
        }
        return new DispatchRule(
            pattern,
            MatchMode.from(optionalString(map.get("mode"))),
            entryPoint,
            readPriority(map.get("priority"), index),
            Optional.ofNullable(optionalString(map.get("platform")))
        );
    }

    private static int readPriority(Object raw, int index) {
        if (raw == null) {
            return 0;
        }
        if (raw instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(raw).trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Rule #" + index + " has a non-numeric priority: " + raw, ex);
        }
    }

    private static String optionalString(Object value) {
        if (value == null) return null;
        String str = String.valueOf(value);
        return str.isBlank() ? null : str;
    }
}
