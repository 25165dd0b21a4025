package io.autopilot4j.schedule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered activity-key to weight mapping for one platform.
 *
 * <p>Weights are whole numbers in {@code [0, 100]}; fractional input is rejected, not
 * truncated. A distribution produced by {@link DistributionBalancer} always sums to
 * {@link #TOTAL}; one built through {@link #of(Map)} is only range-checked, so stored or
 * hand-written data can be loaded and then rebalanced.
 */
public final class Distribution {

    public static final int TOTAL = 100;

    private final Map<String, Integer> weights;

    private Distribution(LinkedHashMap<String, Integer> weights) {
        this.weights = Collections.unmodifiableMap(weights);
    }

    public static Distribution of(Map<String, ? extends Number> weights) {
        Objects.requireNonNull(weights, "weights must not be null");
        LinkedHashMap<String, Integer> copy = new LinkedHashMap<>();
        for (var e : weights.entrySet()) {
            String key = e.getKey();
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("distribution key must not be blank");
            }
            Number n = e.getValue();
            if (n == null) {
                throw new IllegalArgumentException("weight for '" + key + "' must not be null");
            }
            double d = n.doubleValue();
            if (d != Math.rint(d)) {
                throw new IllegalArgumentException("weight for '" + key + "' must be a whole number, got " + n);
            }
            if (d < 0 || d > TOTAL) {
                throw new IllegalArgumentException("weight for '" + key + "' must be within 0..100, got " + n);
            }
            copy.put(key, (int) d);
        }
        return new Distribution(copy);
    }

    public int weight(String key) {
        return weights.getOrDefault(key, 0);
    }

    public boolean contains(String key) {
        return weights.containsKey(key);
    }

    public Set<String> keys() {
        return weights.keySet();
    }

    public int size() {
        return weights.size();
    }

    public int total() {
        int sum = 0;
        for (int w : weights.values()) {
            sum += w;
        }
        return sum;
    }

    public boolean isBalanced() {
        return total() == TOTAL;
    }

    public Map<String, Integer> asMap() {
        return weights;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Distribution other)) return false;
        return weights.equals(other.weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return "Distribution" + weights;
    }
}
