package io.autopilot4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One document per calendar day; {@code _id} is the ISO date.
 */
@Document(collection = "daily_schedules")
public class DailyScheduleDocument {

    @Id
    private String id;

    private String timezone;
    private Instant generatedAt;
    private List<SlotDocument> slots = new ArrayList<>();

    public DailyScheduleDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public void setGeneratedAt(Instant generatedAt) {
        this.generatedAt = generatedAt;
    }

    public List<SlotDocument> getSlots() {
        return slots;
    }

    public void setSlots(List<SlotDocument> slots) {
        this.slots = slots;
    }

    /**
     * Embedded slot.
     */
    public static class SlotDocument {
        private String slotId;
        private String activityType;
        private Instant startTime;
        private Instant endTime;
        private String status;
        private int priority;
        private Instant updatedAt;

        public SlotDocument() {
        }

        public String getSlotId() {
            return slotId;
        }

        public void setSlotId(String slotId) {
            this.slotId = slotId;
        }

        public String getActivityType() {
            return activityType;
        }

        public void setActivityType(String activityType) {
            this.activityType = activityType;
        }

        public Instant getStartTime() {
            return startTime;
        }

        public void setStartTime(Instant startTime) {
            this.startTime = startTime;
        }

        public Instant getEndTime() {
            return endTime;
        }

        public void setEndTime(Instant endTime) {
            this.endTime = endTime;
        }

        public String getStatus() {
            return status;
        }

        public void setStatus(String status) {
            this.status = status;
        }

        public int getPriority() {
            return priority;
        }

        public void setPriority(int priority) {
            this.priority = priority;
        }

        public Instant getUpdatedAt() {
            return updatedAt;
        }

        public void setUpdatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
        }
    }
}
