package work.signbox.pool;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the pool, served by the status endpoint.
 */
public record PoolStatus(
    int size,
    int ready,
    int busy,
    int building,
    String activeScriptHash,
    long activeScriptVersion,
    List<ContextInfo> contexts
) {
    public PoolStatus {
        contexts = List.copyOf(contexts);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("size", size);
        map.put("ready", ready);
        map.put("busy", busy);
        map.put("building", building);
        map.put("script_hash", activeScriptHash);
        map.put("script_version", activeScriptVersion);
        List<Map<String, Object>> entries = new ArrayList<>();
        for (ContextInfo info : contexts) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", info.id());
            entry.put("state", info.state());
            entry.put("script_hash", info.scriptHash());
            entry.put("stale", info.stale());
            entry.put("invocations", info.invocations());
            entry.put("created_at", info.createdAt().toString());
            entry.put("last_used_at", info.lastUsedAt() == null ? null : info.lastUsedAt().toString());
            entries.add(entry);
        }
        map.put("contexts", entries);
        return map;
    }

    public record ContextInfo(
        String id,
        String state,
        String scriptHash,
        boolean stale,
        long invocations,
        Instant createdAt,
        Instant lastUsedAt
    ) {}
}
