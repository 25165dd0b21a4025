package io.autopilot4j.core;

import java.util.Optional;

/**
 * Closed set of job types the dispatcher can produce from schedule slots.
 * Every kind is the target of at least one {@link ActivityType}.
 *
 * <p>The wire type ({@link #type()}) is what gets persisted on job records and what
 * {@link io.autopilot4j.ActionExecutor#jobType()} registers against.
 */
public enum JobKind {
    TWITTER_POST("twitter:post", Platform.TWITTER, Action.POST),
    TWITTER_ENGAGE("twitter:engage", Platform.TWITTER, Action.ENGAGE),
    TWITTER_FOLLOW("twitter:follow", Platform.TWITTER, Action.FOLLOW),
    TWITTER_SCAN_NOTIFICATIONS("twitter:scan-mentions", Platform.TWITTER, Action.SCAN_NOTIFICATIONS),
    TWITTER_ANALYTICS("twitter:analytics", Platform.TWITTER, Action.FETCH_ANALYTICS),

    LINKEDIN_POST("linkedin:post", Platform.LINKEDIN, Action.POST),
    LINKEDIN_ENGAGE("linkedin:engage", Platform.LINKEDIN, Action.ENGAGE),
    LINKEDIN_CONNECT("linkedin:connect", Platform.LINKEDIN, Action.FOLLOW),
    LINKEDIN_SCAN_NOTIFICATIONS("linkedin:scan-notifications", Platform.LINKEDIN, Action.SCAN_NOTIFICATIONS),
    LINKEDIN_ANALYTICS("linkedin:analytics", Platform.LINKEDIN, Action.FETCH_ANALYTICS),

    FACEBOOK_POST("facebook:post", Platform.FACEBOOK, Action.POST),
    FACEBOOK_ENGAGE("facebook:engage", Platform.FACEBOOK, Action.ENGAGE),
    FACEBOOK_ANALYTICS("facebook:analytics", Platform.FACEBOOK, Action.FETCH_ANALYTICS),

    INSTAGRAM_POST("instagram:post", Platform.INSTAGRAM, Action.POST),
    INSTAGRAM_ENGAGE("instagram:engage", Platform.INSTAGRAM, Action.ENGAGE);

    private final String type;
    private final Platform platform;
    private final Action action;

    JobKind(String type, Platform platform, Action action) {
        this.type = type;
        this.platform = platform;
        this.action = action;
    }

    public String type() {
        return type;
    }

    public Platform platform() {
        return platform;
    }

    public Action action() {
        return action;
    }

    public static Optional<JobKind> fromType(String type) {
        if (type == null) {
            return Optional.empty();
        }
        for (JobKind k : values()) {
            if (k.type.equals(type)) {
                return Optional.of(k);
            }
        }
        return Optional.empty();
    }
}
