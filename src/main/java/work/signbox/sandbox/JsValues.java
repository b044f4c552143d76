package work.signbox.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Value;

/**
 * Moves plain data across the host/guest boundary. Structured values travel as JSON so the
 * guest never receives a live host object.
 */
final class JsValues {
    static final ObjectMapper JSON = new ObjectMapper();

    private JsValues() {}

    static Value toJs(Context context, Object value) {
        if (value == null) {
            return context.eval("js", "null");
        }
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return context.asValue(value);
        }
        try {
            String serialized = JSON.writeValueAsString(value);
            return context.getBindings("js").getMember("JSON").getMember("parse").execute(serialized);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Parameters are not JSON-serializable: " + ex.getOriginalMessage(), ex);
        }
    }

    static Object toJava(Value value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isNumber()) {
            if (value.fitsInInt()) return value.asInt();
            if (value.fitsInLong()) return value.asLong();
            return value.asDouble();
        }
        if (value.isString()) {
            return value.asString();
        }
        if (value.hasArrayElements()) {
            List<Object> list = new ArrayList<>();
            long size = value.getArraySize();
            for (long i = 0; i < size; i++) {
                list.add(toJava(value.getArrayElement(i)));
            }
            return list;
        }
        if (value.canExecute()) {
            return value.toString();
        }
        if (value.hasMembers()) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (String key : value.getMemberKeys()) {
                map.put(key, toJava(value.getMember(key)));
            }
            return map;
        }
        return value.toString();
    }

    /**
     * Renders the value returned by a signing entry point as a token string, or {@code null}
     * when the function produced nothing.
     */
    static String toToken(Value value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isString()) {
            return value.asString();
        }
        if (value.isNumber() || value.isBoolean()) {
            return String.valueOf(toJava(value));
        }
        try {
            return JSON.writeValueAsString(toJava(value));
        } catch (JsonProcessingException ex) {
            return value.toString();
        }
    }

    static String render(Value[] args) {
        if (args == null || args.length == 0) {
            return "";
        }
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < args.length; i++) {
            if (i > 0) {
                builder.append(' ');
            }
            Object value = toJava(args[i]);
            builder.append(value == null ? "null" : String.valueOf(value));
        }
        return builder.toString();
    }
}
