package io.autopilot4j.schedule;

import io.autopilot4j.core.Platform;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Initial per-platform weights used until an operator stores their own.
 */
public final class DefaultDistributions {

    private static final Map<Platform, Distribution> DEFAULTS = new LinkedHashMap<>();

    static {
        DEFAULTS.put(Platform.TWITTER, Distribution.of(ordered(
                "tweet", 18,
                "image_tweet", 5,
                "video_tweet", 2,
                "thread", 2,
                "scroll_engage", 30,
                "search_engage", 10,
                "reply", 20,
                "content_creation", 10,
                "radar_discovery", 3,
                "performance_analysis", 0,
                "twitter_follow", 0,
                "twitter_monitor", 0)));
        DEFAULTS.put(Platform.LINKEDIN, Distribution.of(ordered(
                "linkedin_post", 10,
                "linkedin_image_post", 5,
                "linkedin_video_post", 2,
                "linkedin_thread", 3,
                "linkedin_engage", 30,
                "linkedin_search_engage", 15,
                "linkedin_connect", 10,
                "linkedin_reply", 20,
                "linkedin_content_creation", 5,
                "linkedin_radar_discovery", 0,
                "linkedin_monitor", 0,
                "linkedin_analytics", 0)));
        DEFAULTS.put(Platform.FACEBOOK, Distribution.of(ordered(
                "facebook_post", 20,
                "facebook_story", 10,
                "facebook_engage", 70,
                "facebook_view_stories", 0,
                "facebook_view_reels", 0,
                "facebook_analytics", 0)));
        DEFAULTS.put(Platform.INSTAGRAM, Distribution.of(ordered(
                "instagram_post", 20,
                "instagram_story", 20,
                "instagram_reel", 0,
                "instagram_engage", 60,
                "instagram_view_stories", 0,
                "instagram_view_reels", 0)));
    }

    private DefaultDistributions() {
    }

    /**
     * @throws IllegalArgumentException for {@link Platform#SYSTEM}, which has no distribution
     */
    public static Distribution forPlatform(Platform platform) {
        Distribution d = DEFAULTS.get(platform);
        if (d == null) {
            throw new IllegalArgumentException("no distribution for platform: " + platform);
        }
        return d;
    }

    /**
     * Flat enablement map built from all default distributions.
     */
    public static Map<String, Object> taskConfiguration() {
        Map<String, Object> flat = new LinkedHashMap<>();
        for (Distribution d : DEFAULTS.values()) {
            flat.putAll(d.asMap());
        }
        return flat;
    }

    private static Map<String, Integer> ordered(Object... pairs) {
        Map<String, Integer> m = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            m.put((String) pairs[i], (Integer) pairs[i + 1]);
        }
        return m;
    }
}
