package io.autopilot4j.schedule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/**
 * Keeps a {@link Distribution} summing to 100 when one weight is moved.
 *
 * <p>The other keys are scaled proportionally to their previous values with half-up rounding,
 * then corrected one unit at a time: a deficit goes to the key with the largest fractional
 * remainder, a surplus comes off the key with the largest current value. Ties resolve to the
 * earliest key. Everything is computed on integers, so results are exact and repeatable.
 */
public final class DistributionBalancer {

    private DistributionBalancer() {
    }

    /**
     * @param previous current distribution
     * @param key      key being set; must exist in {@code previous}
     * @param value    requested weight, clamped to {@code [0, 100]}
     * @return a new distribution where {@code [key] == clamp(value)} and all weights sum to 100
     * @throws IllegalArgumentException when {@code key} is not part of {@code previous}
     */
    public static Distribution rebalance(Distribution previous, String key, int value) {
        Objects.requireNonNull(previous, "previous must not be null");
        Objects.requireNonNull(key, "key must not be null");
        if (!previous.contains(key)) {
            throw new IllegalArgumentException("unknown distribution key: " + key);
        }

        int v = Math.max(0, Math.min(Distribution.TOTAL, value));

        List<String> others = new ArrayList<>(previous.size());
        for (String k : previous.keys()) {
            if (!k.equals(key)) {
                others.add(k);
            }
        }

        LinkedHashMap<String, Integer> next = new LinkedHashMap<>();
        if (others.isEmpty()) {
            // nothing to absorb the remainder
            next.put(key, Distribution.TOTAL);
            return Distribution.of(next);
        }

        int target = Distribution.TOTAL - v;
        int n = others.size();
        long[] assigned = new long[n];

        long previousSum = 0;
        for (String k : others) {
            previousSum += previous.weight(k);
        }

        if (previousSum == 0) {
            int base = target / n;
            int remainder = target % n;
            for (int i = 0; i < n; i++) {
                assigned[i] = base + (i < remainder ? 1 : 0);
            }
        } else {
            // exact share of key i is numerators[i] / previousSum
            long[] numerators = new long[n];
            long total = v;
            for (int i = 0; i < n; i++) {
                numerators[i] = (long) previous.weight(others.get(i)) * target;
                assigned[i] = (2 * numerators[i] + previousSum) / (2 * previousSum);
                total += assigned[i];
            }

            while (total < Distribution.TOTAL) {
                int best = 0;
                long bestRemainder = Long.MIN_VALUE;
                for (int i = 0; i < n; i++) {
                    long remainder = numerators[i] - assigned[i] * previousSum;
                    if (remainder > bestRemainder) {
                        bestRemainder = remainder;
                        best = i;
                    }
                }
                assigned[best]++;
                total++;
            }

            while (total > Distribution.TOTAL) {
                int best = 0;
                for (int i = 1; i < n; i++) {
                    if (assigned[i] > assigned[best]) {
                        best = i;
                    }
                }
                assigned[best]--;
                total--;
            }
        }

        int i = 0;
        for (String k : previous.keys()) {
            if (k.equals(key)) {
                next.put(k, v);
            } else {
                next.put(k, (int) assigned[i++]);
            }
        }
        return Distribution.of(next);
    }
}
