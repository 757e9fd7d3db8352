package com.warden.core.routines;

import com.warden.core.jobs.ValidationException;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Cron expression accepting both the classic 5-field form and Spring's 6-field form
 * (leading seconds field).
 */
public final class CronSchedule {

    private final String expression;
    private final CronExpression cron;

    private CronSchedule(String expression, CronExpression cron) {
        this.expression = expression;
        this.cron = cron;
    }

    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ValidationException("schedule is required for cron triggers");
        }
        String trimmed = expression.trim();
        String normalized = trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
        try {
            return new CronSchedule(trimmed, CronExpression.parse(normalized));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid cron expression '" + trimmed + "': " + e.getMessage(), e);
        }
    }

    /** First fire time strictly after {@code after}, or null if the expression never fires again. */
    public Instant nextAfter(Instant after, ZoneId zone) {
        ZonedDateTime next = cron.next(after.atZone(zone));
        return next != null ? next.toInstant() : null;
    }

    public String expression() {
        return expression;
    }
}
