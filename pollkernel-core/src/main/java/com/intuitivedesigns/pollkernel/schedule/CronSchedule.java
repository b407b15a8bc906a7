/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.pollkernel.schedule;

import com.intuitivedesigns.pollkernel.core.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * A parsed 5-field cron schedule bound to a timezone.
 *
 * <p>Fields are {@code minute hour day-of-month month day-of-week}; the
 * {@code @hourly @daily @midnight @weekly @monthly @yearly @annually} macros are
 * accepted too. Matching is delegated to Spring's {@link CronExpression}, which
 * works on a 6-field form with a leading seconds field; 5-field input is lifted
 * to it with seconds fixed at {@code 0}.</p>
 *
 * <p>A malformed expression fails at {@link #parse}. An absent or unknown
 * timezone does not: it falls back to UTC with a warning.</p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public final class CronSchedule {

    private static final Logger log = LoggerFactory.getLogger(CronSchedule.class);

    public static final ZoneId DEFAULT_ZONE = ZoneOffset.UTC;

    private static final int CRON_FIELDS = 5;
    private static final Set<String> MACROS = Set.of(
            "@yearly", "@annually", "@monthly", "@weekly", "@daily", "@midnight", "@hourly");

    private final String expression;
    private final CronExpression cron;
    private final ZoneId zone;

    private CronSchedule(String expression, CronExpression cron, ZoneId zone) {
        this.expression = expression;
        this.cron = cron;
        this.zone = zone;
    }

    /**
     * @param expression 5-field cron expression or macro
     * @param timezone   IANA zone id; {@code null}, blank or unknown means UTC
     * @throws ConfigurationException if the expression is malformed
     */
    public static CronSchedule parse(String expression, String timezone) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigurationException("Cron expression must not be blank");
        }
        final String trimmed = expression.trim();

        final CronExpression cron;
        try {
            cron = CronExpression.parse(toSpringForm(trimmed));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Malformed cron expression '" + trimmed + "': " + e.getMessage(), e);
        }

        return new CronSchedule(trimmed, cron, resolveZone(timezone));
    }

    /**
     * Earliest instant strictly after {@code now} that matches every field,
     * evaluated on the wall clock of {@link #zone()}.
     *
     * @throws ScheduleComputationException if the fields can never match
     */
    public Instant nextFireTime(Instant now) {
        Objects.requireNonNull(now, "now");

        final ZonedDateTime next = cron.next(now.atZone(zone));
        if (next == null) {
            throw new ScheduleComputationException(
                    "Cron expression '" + expression + "' has no fire time after " + now + " in " + zone);
        }
        return next.toInstant();
    }

    public String expression() {
        return expression;
    }

    public ZoneId zone() {
        return zone;
    }

    @Override
    public String toString() {
        return "CronSchedule{'" + expression + "' @ " + zone + '}';
    }

    // --- Helpers ---

    static String toSpringForm(String expression) {
        if (expression.startsWith("@")) {
            final String macro = expression.toLowerCase(Locale.ROOT);
            if (!MACROS.contains(macro)) {
                throw new ConfigurationException("Unknown cron macro '" + expression + "'. Supported: " + MACROS);
            }
            return macro;
        }

        final String[] fields = expression.split("\\s+");
        if (fields.length != CRON_FIELDS) {
            throw new ConfigurationException("Cron expression '" + expression + "' must have " + CRON_FIELDS
                    + " fields (minute hour day-of-month month day-of-week), found " + fields.length);
        }
        return "0 " + String.join(" ", fields);
    }

    static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return DEFAULT_ZONE;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            log.warn("Unrecognized schedule timezone '{}' ({}). Falling back to {}.", timezone, e.getMessage(), DEFAULT_ZONE);
            return DEFAULT_ZONE;
        }
    }
}
