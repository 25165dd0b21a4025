package io.autopilot4j.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What to enqueue. A null {@code id} lets the store assign one.
 */
public record JobSpec(String id, String type, Map<String, Object> payload, int priority) {

    public JobSpec {
        Objects.requireNonNull(type, "type must not be null");
        if (type.isBlank()) {
            throw new IllegalArgumentException("type must not be blank");
        }
        if (id != null && id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static JobSpec of(String type, Map<String, Object> payload) {
        return new JobSpec(null, type, payload, 0);
    }

    public static JobSpec of(JobKind kind, Map<String, Object> payload) {
        Objects.requireNonNull(kind, "kind must not be null");
        return of(kind.type(), payload);
    }

    public JobSpec withId(String newId) {
        return new JobSpec(newId, type, payload, priority);
    }

    public JobSpec withPriority(int newPriority) {
        return new JobSpec(id, type, payload, newPriority);
    }
}
