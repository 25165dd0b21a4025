package io.autopilot4j.internal.mongo;

import io.autopilot4j.core.Platform;
import io.autopilot4j.schedule.Distribution;
import io.autopilot4j.spi.SettingsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Key/value settings in the {@code settings} collection.
 *
 * <ul>
 *   <li>{@value #TASK_CONFIGURATION}: flat map of activity key to flag or weight</li>
 *   <li>{@code distribution:<platform>}: activity weights of one platform</li>
 *   <li>{@value #DISPATCHER_ACTIVE}: global dispatch flag</li>
 *   <li>{@value #ALL_ACTIVITIES}: last state of the all-activities switch</li>
 * </ul>
 */
public class MongoSettingsStore implements SettingsStore {
    private static final Logger log = LoggerFactory.getLogger(MongoSettingsStore.class);

    public static final String TASK_CONFIGURATION = "task:configuration";
    public static final String DISTRIBUTION_PREFIX = "distribution:";
    public static final String DISPATCHER_ACTIVE = "dispatcher:active";
    public static final String ALL_ACTIVITIES = "afterlife:mode";

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoSettingsStore(MongoTemplate mongoTemplate) {
        this(mongoTemplate, Clock.systemUTC());
    }

    public MongoSettingsStore(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Optional<Map<String, Object>> loadTaskConfiguration() {
        return value(TASK_CONFIGURATION).map(v -> {
            if (v instanceof Map<?, ?> m) {
                Map<String, Object> out = new LinkedHashMap<>();
                m.forEach((k, val) -> out.put(String.valueOf(k), val));
                return out;
            }
            log.warn("autopilot setting {} is not a document, ignoring", TASK_CONFIGURATION);
            return null;
        });
    }

    @Override
    public void saveTaskConfiguration(Map<String, Object> configuration) {
        Objects.requireNonNull(configuration, "configuration must not be null");
        configuration.keySet().forEach(MongoSettingsStore::requireFieldSafe);
        put(TASK_CONFIGURATION, new LinkedHashMap<>(configuration));
    }

    @Override
    public void setTaskFlag(String activityKey, Object value) {
        requireFieldSafe(activityKey);
        Update u = new Update()
                .set("value." + activityKey, value)
                .set("updatedAt", clock.instant());
        mongoTemplate.upsert(byId(TASK_CONFIGURATION), u, SettingDocument.class);
    }

    @Override
    public void setTaskFlags(Map<String, ?> values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.isEmpty()) {
            return;
        }
        Update u = new Update().set("updatedAt", clock.instant());
        for (var e : values.entrySet()) {
            requireFieldSafe(e.getKey());
            u.set("value." + e.getKey(), e.getValue());
        }
        mongoTemplate.upsert(byId(TASK_CONFIGURATION), u, SettingDocument.class);
    }

    @Override
    public Optional<Distribution> loadDistribution(Platform platform) {
        String key = DISTRIBUTION_PREFIX + platform.value();
        return value(key).map(v -> {
            if (!(v instanceof Map<?, ?> m)) {
                log.warn("autopilot setting {} is not a document, ignoring", key);
                return null;
            }
            Map<String, Number> weights = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : m.entrySet()) {
                if (e.getValue() instanceof Number n) {
                    weights.put(String.valueOf(e.getKey()), n);
                }
            }
            try {
                return Distribution.of(weights);
            } catch (IllegalArgumentException e) {
                log.warn("autopilot setting {} is malformed, ignoring: {}", key, e.getMessage());
                return null;
            }
        });
    }

    @Override
    public void saveDistribution(Platform platform, Distribution distribution) {
        Objects.requireNonNull(distribution, "distribution must not be null");
        distribution.keys().forEach(MongoSettingsStore::requireFieldSafe);
        put(DISTRIBUTION_PREFIX + platform.value(), new LinkedHashMap<>(distribution.asMap()));
    }

    @Override
    public Optional<Boolean> loadDispatchEnabled() {
        return value(DISPATCHER_ACTIVE).map(MongoSettingsStore::asBoolean);
    }

    @Override
    public void saveDispatchEnabled(boolean enabled) {
        put(DISPATCHER_ACTIVE, enabled);
    }

    @Override
    public Optional<Boolean> loadAllActivitiesEnabled() {
        return value(ALL_ACTIVITIES).map(MongoSettingsStore::asBoolean);
    }

    @Override
    public void saveAllActivitiesEnabled(boolean enabled) {
        put(ALL_ACTIVITIES, enabled);
    }

    @Override
    public void clearConfiguration() {
        Query q = new Query(new Criteria().orOperator(
                Criteria.where("_id").in(TASK_CONFIGURATION, ALL_ACTIVITIES),
                Criteria.where("_id").regex("^" + DISTRIBUTION_PREFIX)
        ));
        long removed = mongoTemplate.remove(q, SettingDocument.class).getDeletedCount();
        log.debug("autopilot configuration cleared removed={}", removed);
    }

    private Optional<Object> value(String key) {
        SettingDocument doc = mongoTemplate.findById(key, SettingDocument.class);
        return Optional.ofNullable(doc).map(SettingDocument::getValue);
    }

    private void put(String key, Object value) {
        mongoTemplate.save(new SettingDocument(key, value, clock.instant()));
    }

    private static boolean asBoolean(Object v) {
        return v instanceof Boolean b ? b : Boolean.parseBoolean(String.valueOf(v));
    }

    private static Query byId(String key) {
        return new Query(Criteria.where("_id").is(key));
    }

    private static void requireFieldSafe(String key) {
        if (key == null || key.isBlank() || key.contains(".") || key.startsWith("$")) {
            throw new IllegalArgumentException("invalid setting key: " + key);
        }
    }
}
