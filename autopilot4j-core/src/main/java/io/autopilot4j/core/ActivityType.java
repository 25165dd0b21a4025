package io.autopilot4j.core;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static catalog of schedulable activities.
 *
 * <p>Each activity carries its job mapping, so every activity the generator can place
 * into a slot resolves to a {@link JobKind} (or deliberately to none, for {@link #IDLE})
 * without a separate lookup table that could drift out of sync.
 */
public enum ActivityType {
    // Twitter / X
    TWEET("tweet", Platform.TWITTER, 4, JobKind.TWITTER_POST, "text"),
    IMAGE_TWEET("image_tweet", Platform.TWITTER, 4, JobKind.TWITTER_POST, "image"),
    VIDEO_TWEET("video_tweet", Platform.TWITTER, 5, JobKind.TWITTER_POST, "video"),
    THREAD("thread", Platform.TWITTER, 5, JobKind.TWITTER_POST, "thread"),
    SCROLL_ENGAGE("scroll_engage", Platform.TWITTER, 3, JobKind.TWITTER_ENGAGE, "scroll"),
    SEARCH_ENGAGE("search_engage", Platform.TWITTER, 3, JobKind.TWITTER_ENGAGE, "search"),
    REPLY("reply", Platform.TWITTER, 3, JobKind.TWITTER_ENGAGE, "reply"),
    CONTENT_CREATION("content_creation", Platform.TWITTER, 3, JobKind.TWITTER_POST, "generated"),
    RADAR_DISCOVERY("radar_discovery", Platform.TWITTER, 2, JobKind.TWITTER_ENGAGE, "discovery"),
    TWITTER_FOLLOW("twitter_follow", Platform.TWITTER, 2, JobKind.TWITTER_FOLLOW, null),
    TWITTER_MONITOR("twitter_monitor", Platform.TWITTER, 2, JobKind.TWITTER_SCAN_NOTIFICATIONS, null),
    PERFORMANCE_ANALYSIS("performance_analysis", Platform.TWITTER, 5, JobKind.TWITTER_ANALYTICS, null),

    // LinkedIn
    LINKEDIN_POST("linkedin_post", Platform.LINKEDIN, 4, JobKind.LINKEDIN_POST, "text"),
    LINKEDIN_IMAGE_POST("linkedin_image_post", Platform.LINKEDIN, 4, JobKind.LINKEDIN_POST, "image"),
    LINKEDIN_VIDEO_POST("linkedin_video_post", Platform.LINKEDIN, 5, JobKind.LINKEDIN_POST, "video"),
    LINKEDIN_THREAD("linkedin_thread", Platform.LINKEDIN, 5, JobKind.LINKEDIN_POST, "article"),
    LINKEDIN_ENGAGE("linkedin_engage", Platform.LINKEDIN, 3, JobKind.LINKEDIN_ENGAGE, "feed"),
    LINKEDIN_SEARCH_ENGAGE("linkedin_search_engage", Platform.LINKEDIN, 3, JobKind.LINKEDIN_ENGAGE, "search"),
    LINKEDIN_CONNECT("linkedin_connect", Platform.LINKEDIN, 2, JobKind.LINKEDIN_CONNECT, null),
    LINKEDIN_REPLY("linkedin_reply", Platform.LINKEDIN, 3, JobKind.LINKEDIN_ENGAGE, "reply"),
    LINKEDIN_CONTENT_CREATION("linkedin_content_creation", Platform.LINKEDIN, 3, JobKind.LINKEDIN_POST, "generated"),
    LINKEDIN_RADAR_DISCOVERY("linkedin_radar_discovery", Platform.LINKEDIN, 2, JobKind.LINKEDIN_ENGAGE, "discovery"),
    LINKEDIN_MONITOR("linkedin_monitor", Platform.LINKEDIN, 2, JobKind.LINKEDIN_SCAN_NOTIFICATIONS, null),
    LINKEDIN_ANALYTICS("linkedin_analytics", Platform.LINKEDIN, 2, JobKind.LINKEDIN_ANALYTICS, null),

    // Meta
    FACEBOOK_POST("facebook_post", Platform.FACEBOOK, 4, JobKind.FACEBOOK_POST, "feed"),
    FACEBOOK_STORY("facebook_story", Platform.FACEBOOK, 3, JobKind.FACEBOOK_POST, "story"),
    FACEBOOK_ENGAGE("facebook_engage", Platform.FACEBOOK, 3, JobKind.FACEBOOK_ENGAGE, null),
    FACEBOOK_VIEW_STORIES("facebook_view_stories", Platform.FACEBOOK, 2, JobKind.FACEBOOK_ENGAGE, "stories"),
    FACEBOOK_VIEW_REELS("facebook_view_reels", Platform.FACEBOOK, 2, JobKind.FACEBOOK_ENGAGE, "reels"),
    FACEBOOK_ANALYTICS("facebook_analytics", Platform.FACEBOOK, 2, JobKind.FACEBOOK_ANALYTICS, null),
    INSTAGRAM_POST("instagram_post", Platform.INSTAGRAM, 4, JobKind.INSTAGRAM_POST, "feed"),
    INSTAGRAM_STORY("instagram_story", Platform.INSTAGRAM, 3, JobKind.INSTAGRAM_POST, "story"),
    INSTAGRAM_REEL("instagram_reel", Platform.INSTAGRAM, 5, JobKind.INSTAGRAM_POST, "reel"),
    INSTAGRAM_ENGAGE("instagram_engage", Platform.INSTAGRAM, 3, JobKind.INSTAGRAM_ENGAGE, null),
    INSTAGRAM_VIEW_STORIES("instagram_view_stories", Platform.INSTAGRAM, 2, JobKind.INSTAGRAM_ENGAGE, "stories"),
    INSTAGRAM_VIEW_REELS("instagram_view_reels", Platform.INSTAGRAM, 2, JobKind.INSTAGRAM_ENGAGE, "reels"),

    // Placeholder used when nothing is enabled; never produces a job.
    IDLE("idle", Platform.SYSTEM, 0, null, null);

    /**
     * Legacy task ids still found in stored configurations, mapped to the activities they stand for.
     * Keys are lower case.
     */
    private static final Map<String, List<ActivityType>> ALIASES = new HashMap<>();

    static {
        alias("twitter_tweet_daily", TWEET);
        alias("twitter_reply_mentions", REPLY);
        alias("twitter_engage_timeline", SCROLL_ENGAGE);
        alias("twitter_retweet_partners", SCROLL_ENGAGE);
        alias("twitter_content_curation", CONTENT_CREATION);
        alias("twitter_follow_targets", TWITTER_FOLLOW);
        alias("twitter_like_keyword", SEARCH_ENGAGE);
        alias("twitter_monitor_trends", TWITTER_MONITOR);
        alias("twitter_performance_check", PERFORMANCE_ANALYSIS);
        alias("meta_facebook_post", FACEBOOK_POST);
        alias("meta_instagram_post", INSTAGRAM_POST);
        alias("meta_engage", FACEBOOK_ENGAGE, INSTAGRAM_ENGAGE);
        alias("meta_analytics", FACEBOOK_ANALYTICS);
        alias("meta_view_stories", FACEBOOK_VIEW_STORIES, INSTAGRAM_VIEW_STORIES);
        alias("meta_view_reels", FACEBOOK_VIEW_REELS, INSTAGRAM_VIEW_REELS);
    }

    private final String key;
    private final Platform platform;
    private final int priority;
    private final JobKind jobKind;
    private final String variant;

    ActivityType(String key, Platform platform, int priority, JobKind jobKind, String variant) {
        this.key = key;
        this.platform = platform;
        this.priority = priority;
        this.jobKind = jobKind;
        this.variant = variant;
    }

    public String key() {
        return key;
    }

    public Platform platform() {
        return platform;
    }

    public int priority() {
        return priority;
    }

    public Optional<JobKind> jobKind() {
        return Optional.ofNullable(jobKind);
    }

    /**
     * Executor hint copied into the job payload (e.g. "image" for an image tweet); may be null.
     */
    public String variant() {
        return variant;
    }

    public static Optional<ActivityType> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String k = key.trim();
        for (ActivityType t : values()) {
            if (t.key.equalsIgnoreCase(k)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    /**
     * Activities a legacy task id stands for; empty when {@code key} is not a known alias.
     * Catalog keys are not aliases, use {@link #fromKey} for those.
     */
    public static List<ActivityType> fromAlias(String key) {
        if (key == null || key.isBlank()) {
            return List.of();
        }
        return ALIASES.getOrDefault(key.trim().toLowerCase(Locale.ROOT), List.of());
    }

    private static void alias(String legacyKey, ActivityType... targets) {
        ALIASES.put(legacyKey, List.of(targets));
    }
}
