package io.autopilot4j.core;

import java.util.Map;

/**
 * What an executor reports back on success. Stored as the job's {@code result}.
 */
public record ActionResult(String summary, Map<String, Object> data) {

    public ActionResult {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static ActionResult of(String summary) {
        return new ActionResult(summary, Map.of());
    }

    public static ActionResult of(String summary, Map<String, Object> data) {
        return new ActionResult(summary, data);
    }
}
