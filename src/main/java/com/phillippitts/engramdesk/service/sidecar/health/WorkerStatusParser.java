package com.phillippitts.engramdesk.service.sidecar.health;

import org.json.JSONException;
import org.json.JSONObject;

import java.util.Optional;

/**
 * Parses the worker's status JSON. Safe against malformed input: returns empty.
 *
 * <p>Absent or mistyped fields become {@code null}. The memory count is read from
 * {@code memories}, or from {@code memory.total} when the worker reports nested stats.
 */
final class WorkerStatusParser {

    private WorkerStatusParser() {}

    static Optional<WorkerStatusReport> parse(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JSONObject obj = new JSONObject(json);
            return Optional.of(new WorkerStatusReport(
                    optString(obj, "status"),
                    memoryCount(obj),
                    optUnsigned(obj, "uptime"),
                    optString(obj, "version")));
        } catch (JSONException e) {
            return Optional.empty();
        }
    }

    private static Long memoryCount(JSONObject obj) {
        Long direct = optUnsigned(obj, "memories");
        if (direct != null) {
            return direct;
        }
        JSONObject memory = obj.optJSONObject("memory");
        return memory == null ? null : optUnsigned(memory, "total");
    }

    private static String optString(JSONObject obj, String key) {
        Object value = obj.opt(key);
        return value instanceof String s ? s : null;
    }

    private static Long optUnsigned(JSONObject obj, String key) {
        Object value = obj.opt(key);
        if (value instanceof Number n) {
            long v = n.longValue();
            return v >= 0 ? v : null;
        }
        return null;
    }
}
