package io.autopilot4j.schedule;

import io.autopilot4j.core.ActivityType;
import io.autopilot4j.core.Platform;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class DistributionBalancerTest {

    @Test
    void rebalanceShouldScaleOthersProportionally() {
        Distribution d = dist("a", 50, "b", 30, "c", 20);

        Distribution next = DistributionBalancer.rebalance(d, "a", 20);

        // others shared 50, now share 80: 30 * 1.6 = 48, 20 * 1.6 = 32
        assertEquals(Map.of("a", 20, "b", 48, "c", 32), next.asMap());
    }

    @Test
    void singleOtherKeyShouldReceiveRemainder() {
        Distribution d = dist("tweet", 70, "scroll_engage", 30);

        assertEquals(65, DistributionBalancer.rebalance(d, "tweet", 35).weight("scroll_engage"));
        assertEquals(0, DistributionBalancer.rebalance(d, "tweet", 100).weight("scroll_engage"));
        assertEquals(100, DistributionBalancer.rebalance(d, "tweet", 0).weight("scroll_engage"));
    }

    @Test
    void zeroOtherSumShouldSplitEvenlyWithRemainderToFirstKeys() {
        Distribution d = dist("a", 100, "b", 0, "c", 0, "d", 0);

        Distribution next = DistributionBalancer.rebalance(d, "a", 0);

        assertThat(next.asMap()).containsExactly(
                Map.entry("a", 0), Map.entry("b", 34), Map.entry("c", 33), Map.entry("d", 33));
    }

    @Test
    void deficitShouldGoToLargestFractionalRemainder() {
        Distribution d = dist("k", 93, "big", 4, "x", 1, "y", 1, "z", 1);

        // shares of 100 over 7 units: 57.14, 14.29, 14.29, 14.29 round to 99 in total
        Distribution next = DistributionBalancer.rebalance(d, "k", 0);

        assertThat(next.asMap()).containsExactly(
                Map.entry("k", 0), Map.entry("big", 57), Map.entry("x", 15), Map.entry("y", 14), Map.entry("z", 14));
    }

    @Test
    void surplusShouldComeOffLargestValueFirstKeyOnTie() {
        Distribution d = dist("k", 0, "x", 50, "y", 50);

        // 99 over 100 weight units: 49.5 each rounds half-up to 50 + 50 = 100, one too many
        Distribution next = DistributionBalancer.rebalance(d, "k", 1);

        assertThat(next.asMap()).containsExactly(
                Map.entry("k", 1), Map.entry("x", 49), Map.entry("y", 50));
    }

    @Test
    void valueShouldBeClamped() {
        Distribution d = dist("a", 50, "b", 50);

        assertEquals(100, DistributionBalancer.rebalance(d, "a", 250).weight("a"));
        assertEquals(0, DistributionBalancer.rebalance(d, "a", -5).weight("a"));
    }

    @Test
    void singleKeyDistributionShouldBeForcedToHundred() {
        Distribution next = DistributionBalancer.rebalance(dist("only", 100), "only", 40);

        assertEquals(Map.of("only", 100), next.asMap());
    }

    @Test
    void unknownKeyShouldBeRejected() {
        assertThatThrownBy(() -> DistributionBalancer.rebalance(dist("a", 100), "missing", 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void keyOrderShouldBePreserved() {
        Distribution d = DefaultDistributions.forPlatform(Platform.TWITTER);

        Distribution next = DistributionBalancer.rebalance(d, "reply", 40);

        assertEquals(List.copyOf(d.keys()), List.copyOf(next.keys()));
    }

    @Test
    void randomizedUpdatesShouldAlwaysSumToHundredWithRequestedValue() {
        Random random = new Random(42);
        for (int round = 0; round < 2_000; round++) {
            int size = 1 + random.nextInt(12);
            Map<String, Integer> weights = new LinkedHashMap<>();
            for (int i = 0; i < size; i++) {
                weights.put("k" + i, random.nextInt(101));
            }
            Distribution d = Distribution.of(weights);
            String key = "k" + random.nextInt(size);
            int value = random.nextInt(141) - 20;

            Distribution next = DistributionBalancer.rebalance(d, key, value);

            assertEquals(100, next.total(), () -> "sum for " + d + " set " + key + "=" + value);
            for (String k : next.keys()) {
                assertThat(next.weight(k)).isBetween(0, 100);
            }
            if (size > 1) {
                assertEquals(Math.max(0, Math.min(100, value)), next.weight(key));
            }
        }
    }

    @Test
    void fractionalWeightsShouldBeRejectedNotTruncated() {
        assertThatThrownBy(() -> Distribution.of(Map.of("a", 33.5, "b", 66.5)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("whole number");
        assertThatThrownBy(() -> Distribution.of(Map.of("a", Double.NaN)))
                .isInstanceOf(IllegalArgumentException.class);

        Distribution d = Distribution.of(Map.of("a", 40.0, "b", 60L));

        assertEquals(Map.of("a", 40, "b", 60), d.asMap());
    }

    @Test
    void defaultDistributionsShouldCoverEveryCatalogActivityOnItsPlatform() {
        for (ActivityType t : ActivityType.values()) {
            if (t == ActivityType.IDLE) {
                continue;
            }
            assertThat(DefaultDistributions.forPlatform(t.platform()).contains(t.key())).as(t.key()).isTrue();
        }
    }

    @Test
    void defaultDistributionsShouldBeBalanced() {
        for (Platform p : List.of(Platform.TWITTER, Platform.LINKEDIN, Platform.FACEBOOK, Platform.INSTAGRAM)) {
            assertThat(DefaultDistributions.forPlatform(p).isBalanced()).as(p.name()).isTrue();
        }
    }

    private static Distribution dist(Object... pairs) {
        Map<String, Integer> m = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            m.put((String) pairs[i], (Integer) pairs[i + 1]);
        }
        return Distribution.of(m);
    }
}
