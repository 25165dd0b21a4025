package io.autopilot4j.core;

public enum Action {
    POST,
    ENGAGE,
    FOLLOW,
    SCAN_NOTIFICATIONS,
    FETCH_ANALYTICS
}
