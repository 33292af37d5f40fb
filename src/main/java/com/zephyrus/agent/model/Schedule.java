package com.zephyrus.agent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Either a fixed period or a cron pattern. Cron patterns are evaluated in UTC.
 */
@Value
@Builder
public class Schedule {
    String scheduleId;
    ScheduleType type;
    long intervalSeconds;
    String cronExpression;
    boolean active;

    public static Schedule interval(String scheduleId, long seconds) {
        return Schedule.builder()
            .scheduleId(scheduleId)
            .type(ScheduleType.INTERVAL)
            .intervalSeconds(seconds)
            .active(true)
            .build();
    }

    public static Schedule cron(String scheduleId, String expression, boolean active) {
        return Schedule.builder()
            .scheduleId(scheduleId)
            .type(ScheduleType.CRON)
            .cronExpression(expression)
            .active(active)
            .build();
    }

    @JsonIgnore
    public boolean isExecutable() {
        if (!active) {
            return false;
        }
        if (type == ScheduleType.INTERVAL) {
            return intervalSeconds > 0;
        }
        return type == ScheduleType.CRON && isValidCron(cronExpression);
    }

    /**
     * Computes the first due time strictly after {@code from}.
     *
     * @throws IllegalStateException if the schedule is not executable
     */
    public Instant nextDueAfter(Instant from) {
        if (!isExecutable()) {
            throw new IllegalStateException("Schedule " + scheduleId + " is not executable");
        }
        if (type == ScheduleType.INTERVAL) {
            return from.plusSeconds(intervalSeconds);
        }
        ZonedDateTime next = CronExpression.parse(normalizeCron(cronExpression))
            .next(from.atZone(ZoneOffset.UTC));
        if (next == null) {
            throw new IllegalStateException("Cron pattern " + cronExpression + " has no future occurrence");
        }
        return next.toInstant();
    }

    /**
     * True when the schedule is executable and has a due time after {@code from}.
     * A cron pattern can parse yet never match, e.g. {@code 0 0 30 2 *}.
     */
    public boolean firesAfter(Instant from) {
        try {
            nextDueAfter(from);
            return true;
        } catch (IllegalStateException e) {
            return false;
        }
    }

    public static boolean isValidCron(String expression) {
        if (expression == null || expression.isBlank()) {
            return false;
        }
        try {
            CronExpression.parse(normalizeCron(expression));
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    // Unix cron has no seconds field
    static String normalizeCron(String expression) {
        String trimmed = expression.trim();
        return trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
    }
}
