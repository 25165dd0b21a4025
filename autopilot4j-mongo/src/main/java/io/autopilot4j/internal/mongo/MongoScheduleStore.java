package io.autopilot4j.internal.mongo;

import io.autopilot4j.core.DailySchedule;
import io.autopilot4j.core.ScheduleSlot;
import io.autopilot4j.core.SlotStatus;
import io.autopilot4j.spi.ScheduleStore;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One document per calendar day in {@code daily_schedules}, keyed by the ISO date.
 *
 * <p>Slot transitions use the positional operator on an {@code $elemMatch} so that the check and
 * the write happen in a single document update.
 */
public class MongoScheduleStore implements ScheduleStore {

    private final MongoTemplate mongoTemplate;
    private final ZoneId zone;
    private final Clock clock;

    public MongoScheduleStore(MongoTemplate mongoTemplate, ZoneId zone) {
        this(mongoTemplate, zone, Clock.systemUTC());
    }

    public MongoScheduleStore(MongoTemplate mongoTemplate, ZoneId zone, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Optional<DailySchedule> load(LocalDate date) {
        Objects.requireNonNull(date, "date must not be null");
        return Optional.ofNullable(mongoTemplate.findById(date.toString(), DailyScheduleDocument.class))
                .map(this::toSchedule);
    }

    @Override
    public void save(DailySchedule schedule) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        mongoTemplate.save(toDocument(schedule));
    }

    @Override
    public boolean compareAndSetSlotStatus(LocalDate date, String slotId, SlotStatus expected, SlotStatus next) {
        Objects.requireNonNull(expected, "expected must not be null");
        Query q = new Query(Criteria.where("_id").is(date.toString())
                .and("slots").elemMatch(Criteria.where("slotId").is(slotId).and("status").is(expected.value())));
        return setSlotStatus(q, next);
    }

    @Override
    public boolean overrideSlotStatus(LocalDate date, String slotId, SlotStatus status) {
        Query q = new Query(Criteria.where("_id").is(date.toString())
                .and("slots").elemMatch(Criteria.where("slotId").is(slotId)));
        return setSlotStatus(q, status);
    }

    @Override
    public boolean delete(LocalDate date) {
        Query q = new Query(Criteria.where("_id").is(date.toString()));
        return mongoTemplate.remove(q, DailyScheduleDocument.class).getDeletedCount() > 0;
    }

    private boolean setSlotStatus(Query q, SlotStatus next) {
        Objects.requireNonNull(next, "next must not be null");
        Update u = new Update()
                .set("slots.$.status", next.value())
                .set("slots.$.updatedAt", clock.instant());
        return mongoTemplate.updateFirst(q, u, DailyScheduleDocument.class).getMatchedCount() > 0;
    }

    DailyScheduleDocument toDocument(DailySchedule schedule) {
        DailyScheduleDocument doc = new DailyScheduleDocument();
        doc.setId(schedule.date().toString());
        doc.setTimezone(zone.getId());
        doc.setGeneratedAt(schedule.generatedAt());
        doc.setSlots(schedule.slots().stream().map(s -> {
            DailyScheduleDocument.SlotDocument sd = new DailyScheduleDocument.SlotDocument();
            sd.setSlotId(s.id());
            sd.setActivityType(s.activityType());
            sd.setStartTime(s.startTime());
            sd.setEndTime(s.endTime());
            sd.setStatus(s.status().value());
            sd.setPriority(s.priority());
            return sd;
        }).toList());
        return doc;
    }

    DailySchedule toSchedule(DailyScheduleDocument doc) {
        List<ScheduleSlot> slots = doc.getSlots() == null
                ? List.of()
                : doc.getSlots().stream().map(sd -> new ScheduleSlot(
                        sd.getSlotId(),
                        sd.getActivityType(),
                        sd.getStartTime(),
                        sd.getEndTime(),
                        SlotStatus.fromValue(sd.getStatus()).orElseThrow(() -> new IllegalStateException(
                                "unknown slot status '" + sd.getStatus() + "' in schedule " + doc.getId())),
                        sd.getPriority()
                )).toList();
        return new DailySchedule(LocalDate.parse(doc.getId()), slots, doc.getGeneratedAt());
    }
}
