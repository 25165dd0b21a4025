package io.autopilot4j.schedule;

import io.autopilot4j.core.ActivityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Which catalog activities the generator may place into slots.
 *
 * <p>Built from the flat activity-key map where a value is either a boolean or a 0–100
 * weight (enabled when positive). Legacy task ids are resolved through
 * {@link ActivityType#fromAlias}; when both a legacy id and the catalog key are present the
 * catalog key decides. Unknown keys are ignored; malformed values count as disabled and are logged.
 */
public final class TaskEnablement {
    private static final Logger log = LoggerFactory.getLogger(TaskEnablement.class);

    private final Map<ActivityType, Boolean> flags;

    private TaskEnablement(Map<ActivityType, Boolean> flags) {
        this.flags = flags;
    }

    public static TaskEnablement from(Map<String, ?> configuration) {
        EnumMap<ActivityType, Boolean> flags = new EnumMap<>(ActivityType.class);
        if (configuration == null) {
            return new TaskEnablement(flags);
        }
        Map<ActivityType, Boolean> canonical = new EnumMap<>(ActivityType.class);
        for (var e : configuration.entrySet()) {
            var activity = ActivityType.fromKey(e.getKey());
            if (activity.isPresent()) {
                canonical.put(activity.get(), isTruthy(e.getKey(), e.getValue()));
                continue;
            }
            List<ActivityType> aliased = ActivityType.fromAlias(e.getKey());
            if (aliased.isEmpty()) {
                log.debug("autopilot ignoring unknown activity key={}", e.getKey());
                continue;
            }
            boolean on = isTruthy(e.getKey(), e.getValue());
            for (ActivityType t : aliased) {
                flags.merge(t, on, Boolean::logicalOr);
            }
        }
        // a catalog key wins over any legacy id that maps to the same activity
        flags.putAll(canonical);
        return new TaskEnablement(flags);
    }

    public static TaskEnablement of(ActivityType... enabled) {
        EnumMap<ActivityType, Boolean> flags = new EnumMap<>(ActivityType.class);
        for (ActivityType t : enabled) {
            flags.put(t, Boolean.TRUE);
        }
        return new TaskEnablement(flags);
    }

    public static TaskEnablement none() {
        return new TaskEnablement(new EnumMap<>(ActivityType.class));
    }

    /**
     * Returns a copy where every catalog key present in {@code distribution} is enabled iff its weight is positive.
     */
    public TaskEnablement overlay(Distribution distribution) {
        Objects.requireNonNull(distribution, "distribution must not be null");
        EnumMap<ActivityType, Boolean> merged = new EnumMap<>(ActivityType.class);
        merged.putAll(flags);
        for (String key : distribution.keys()) {
            ActivityType.fromKey(key).ifPresent(t -> merged.put(t, distribution.weight(key) > 0));
        }
        return new TaskEnablement(merged);
    }

    public boolean isEnabled(ActivityType activity) {
        return Boolean.TRUE.equals(flags.get(activity));
    }

    /**
     * Enabled activities in catalog order, never including {@link ActivityType#IDLE}.
     */
    public List<ActivityType> enabledActivities() {
        List<ActivityType> out = new ArrayList<>();
        for (ActivityType t : ActivityType.values()) {
            if (t != ActivityType.IDLE && isEnabled(t)) {
                out.add(t);
            }
        }
        return Collections.unmodifiableList(out);
    }

    static boolean isTruthy(String key, Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return weightEnabled(key, n.doubleValue());
        }
        if (value instanceof String s) {
            String v = s.trim();
            if (v.equalsIgnoreCase("true")) {
                return true;
            }
            if (v.equalsIgnoreCase("false") || v.isEmpty()) {
                return false;
            }
            try {
                return weightEnabled(key, Double.parseDouble(v));
            } catch (NumberFormatException e) {
                log.warn("autopilot malformed weight; treating as disabled key={} value={}", key, value);
                return false;
            }
        }
        log.warn("autopilot unsupported enablement value; treating as disabled key={} type={}",
                key, value.getClass().getName());
        return false;
    }

    private static boolean weightEnabled(String key, double weight) {
        if (Double.isNaN(weight) || weight < 0 || weight > Distribution.TOTAL) {
            log.warn("autopilot weight out of range; treating as disabled key={} value={}", key, weight);
            return false;
        }
        if (weight != Math.rint(weight)) {
            log.warn("autopilot fractional weight; treating as disabled key={} value={}", key, weight);
            return false;
        }
        return weight > 0;
    }

    @Override
    public String toString() {
        return "TaskEnablement" + enabledActivities();
    }
}
