package io.autopilot4j.spi;

import io.autopilot4j.core.Platform;
import io.autopilot4j.schedule.Distribution;

import java.util.Map;
import java.util.Optional;

/**
 * Operator-controlled settings: the task enablement map, per-platform distributions and the
 * global dispatch flag.
 */
public interface SettingsStore {

    Optional<Map<String, Object>> loadTaskConfiguration();

    void saveTaskConfiguration(Map<String, Object> configuration);

    /**
     * Sets a single entry of the stored task configuration.
     */
    void setTaskFlag(String activityKey, Object value);

    /**
     * Sets several entries of the stored task configuration in one write. Keys not in
     * {@code values} are left as they are.
     */
    void setTaskFlags(Map<String, ?> values);

    Optional<Distribution> loadDistribution(Platform platform);

    void saveDistribution(Platform platform, Distribution distribution);

    Optional<Boolean> loadDispatchEnabled();

    void saveDispatchEnabled(boolean enabled);

    /**
     * Last state set through the all-activities switch, if it was ever used.
     */
    Optional<Boolean> loadAllActivitiesEnabled();

    void saveAllActivitiesEnabled(boolean enabled);

    /**
     * Removes the task configuration, all distributions and the all-activities switch.
     * The dispatch flag is kept.
     */
    void clearConfiguration();
}
