package io.autopilot4j.core;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActivityTypeTest {

    @Test
    void everyActivityExceptIdleShouldMapToAJobOnItsOwnPlatform() {
        for (ActivityType t : ActivityType.values()) {
            if (t == ActivityType.IDLE) {
                assertTrue(t.jobKind().isEmpty());
                continue;
            }
            JobKind kind = t.jobKind().orElseThrow();
            assertEquals(t.platform(), kind.platform(), t.key());
        }
    }

    @Test
    void everyJobKindShouldBeReachableFromSomeActivity() {
        Set<JobKind> reachable = EnumSet.noneOf(JobKind.class);
        for (ActivityType t : ActivityType.values()) {
            t.jobKind().ifPresent(reachable::add);
        }

        assertEquals(EnumSet.allOf(JobKind.class), reachable);
    }

    @Test
    void followAndMonitorShouldBeSchedulableOnTwitter() {
        assertEquals(Optional.of(JobKind.TWITTER_FOLLOW), ActivityType.TWITTER_FOLLOW.jobKind());
        assertEquals(Optional.of(JobKind.TWITTER_SCAN_NOTIFICATIONS), ActivityType.TWITTER_MONITOR.jobKind());
        assertEquals(Action.FOLLOW, JobKind.TWITTER_FOLLOW.action());
    }

    @Test
    void legacyTaskIdsShouldResolveToCatalogActivities() {
        assertEquals(List.of(ActivityType.TWITTER_FOLLOW), ActivityType.fromAlias("TWITTER_FOLLOW_TARGETS"));
        assertEquals(List.of(ActivityType.TWITTER_MONITOR), ActivityType.fromAlias("TWITTER_MONITOR_TRENDS"));
        assertEquals(List.of(ActivityType.FACEBOOK_ANALYTICS), ActivityType.fromAlias("meta_analytics"));
        assertEquals(List.of(ActivityType.FACEBOOK_ENGAGE, ActivityType.INSTAGRAM_ENGAGE),
                ActivityType.fromAlias("meta_engage"));
        assertEquals(List.of(ActivityType.FACEBOOK_VIEW_REELS, ActivityType.INSTAGRAM_VIEW_REELS),
                ActivityType.fromAlias(" meta_view_reels "));
    }

    @Test
    void catalogKeysAndSystemTasksShouldNotBeAliases() {
        assertTrue(ActivityType.fromAlias("tweet").isEmpty());
        assertTrue(ActivityType.fromAlias("SYSTEM_BACKUP_DAILY").isEmpty());
        assertTrue(ActivityType.fromAlias(null).isEmpty());
    }

    @Test
    void fromKeyShouldBeLenientAboutCaseAndWhitespace() {
        assertEquals(Optional.of(ActivityType.SCROLL_ENGAGE), ActivityType.fromKey(" Scroll_Engage "));
        assertEquals(Optional.empty(), ActivityType.fromKey("nope"));
        assertEquals(Optional.empty(), ActivityType.fromKey(null));
    }

    @Test
    void linkedinConnectShouldUseFollowAction() {
        JobKind kind = ActivityType.LINKEDIN_CONNECT.jobKind().orElseThrow();

        assertEquals("linkedin:connect", kind.type());
        assertEquals(Action.FOLLOW, kind.action());
        assertEquals(Optional.of(kind), JobKind.fromType("linkedin:connect"));
    }

    @Test
    void slotStatusShouldMirrorTerminalJobStatus() {
        assertEquals(SlotStatus.COMPLETED, SlotStatus.reflecting(JobStatus.COMPLETED));
        assertEquals(SlotStatus.FAILED, SlotStatus.reflecting(JobStatus.FAILED));
        assertEquals(Optional.of(SlotStatus.IN_PROGRESS), SlotStatus.fromValue("in_progress"));
    }
}
