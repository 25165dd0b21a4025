package io.autopilot4j.core;

public enum GenerationMode {
    /**
     * Replace the whole day.
     */
    FULL,
    /**
     * Keep completed and in-progress slots, regenerate everything else.
     */
    FILL_MISSING
}
