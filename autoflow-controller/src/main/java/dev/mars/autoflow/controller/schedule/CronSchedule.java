/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.autoflow.controller.schedule;

import dev.mars.autoflow.core.exceptions.DefinitionValidationException;
import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * A parsed cron expression bound to a time zone.
 *
 * <p>Accepts the standard 5-field form (minute hour day-of-month month day-of-week),
 * the 6-field form with a leading seconds field, and macros such as {@code @daily}.
 * Occurrences are computed in zoned time, so a 09:00 schedule stays at 09:00 local
 * time across DST changes.
 */
public final class CronSchedule {

    private final String expression;
    private final ZoneId zone;
    private final CronExpression cron;

    private CronSchedule(String expression, ZoneId zone, CronExpression cron) {
        this.expression = expression;
        this.zone = zone;
        this.cron = cron;
    }

    /**
     * @param definitionId reported in the validation error
     * @throws DefinitionValidationException if the expression or the zone is invalid
     */
    public static CronSchedule parse(String definitionId, String expression, String timezone)
            throws DefinitionValidationException {
        if (expression == null || expression.isBlank()) {
            throw new DefinitionValidationException(definitionId, "cron expression is required");
        }
        if (timezone == null || timezone.isBlank()) {
            throw new DefinitionValidationException(definitionId, "time zone is required");
        }
        ZoneId zone;
        try {
            zone = ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new DefinitionValidationException(definitionId, "invalid time zone '" + timezone + "'");
        }
        String normalized = expression.trim();
        try {
            return new CronSchedule(normalized, zone, CronExpression.parse(withSeconds(normalized)));
        } catch (IllegalArgumentException e) {
            throw new DefinitionValidationException(definitionId,
                    "invalid cron expression '" + normalized + "': " + e.getMessage());
        }
    }

    static String withSeconds(String expression) {
        if (expression.startsWith("@")) {
            return expression;
        }
        String[] fields = expression.split("\\s+");
        return fields.length == 5 ? "0 " + expression : expression;
    }

    /**
     * Next occurrence strictly after the given instant, or empty if the expression
     * never fires again.
     */
    public Optional<Instant> nextAfter(Instant after) {
        ZonedDateTime next = cron.next(after.atZone(zone));
        return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
    }

    public String getExpression() {
        return expression;
    }

    public ZoneId getZone() {
        return zone;
    }

    @Override
    public String toString() {
        return expression + " [" + zone + "]";
    }
}
