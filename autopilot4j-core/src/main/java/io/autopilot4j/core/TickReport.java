package io.autopilot4j.core;

import java.time.LocalDate;

/**
 * Summary of one dispatcher tick.
 *
 * @param paused    dispatch was disabled; nothing was touched
 * @param date      schedule date the tick ran against; null when paused
 * @param enqueued  jobs newly created or requeued from due slots
 * @param reflected slots that took a terminal status from their job
 * @param skipped   due slots without a runnable activity
 * @param missed    pending slots whose window had already closed
 */
public record TickReport(boolean paused, LocalDate date, int enqueued, int reflected, int skipped, int missed) {

    public static TickReport pausedReport() {
        return new TickReport(true, null, 0, 0, 0, 0);
    }

    public static TickReport empty(LocalDate date) {
        return new TickReport(false, date, 0, 0, 0, 0);
    }

    public boolean changedAnything() {
        return enqueued + reflected + skipped + missed > 0;
    }
}
