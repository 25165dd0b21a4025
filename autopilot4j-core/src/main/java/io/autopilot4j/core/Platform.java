package io.autopilot4j.core;

import java.util.Optional;

/**
 * External platform an activity or job runs against.
 */
public enum Platform {
    TWITTER("twitter"),
    LINKEDIN("linkedin"),
    FACEBOOK("facebook"),
    INSTAGRAM("instagram"),
    SYSTEM("system");

    private final String value;

    Platform(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<Platform> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Platform p : values()) {
            if (p.value.equalsIgnoreCase(value.trim())) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }
}
