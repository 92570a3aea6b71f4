package dev.mars.spacetime.api.model;

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

import dev.mars.spacetime.api.error.SpaceTimeErrorCodes;
import dev.mars.spacetime.api.error.TemporalSyntaxException;

import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Time units used for relative time stamps, absolute granularities and increments.
 * Declared from the coarsest to the finest unit.
 */
public enum CalendarUnit {
    YEARS("year", ChronoUnit.YEARS),
    MONTHS("month", ChronoUnit.MONTHS),
    WEEKS("week", ChronoUnit.WEEKS),
    DAYS("day", ChronoUnit.DAYS),
    HOURS("hour", ChronoUnit.HOURS),
    MINUTES("minute", ChronoUnit.MINUTES),
    SECONDS("second", ChronoUnit.SECONDS);

    private final String singular;
    private final ChronoUnit chronoUnit;

    CalendarUnit(String singular, ChronoUnit chronoUnit) {
        this.singular = singular;
        this.chronoUnit = chronoUnit;
    }

    public String getSingular() {
        return singular;
    }

    public String getPlural() {
        return singular + "s";
    }

    public ChronoUnit getChronoUnit() {
        return chronoUnit;
    }

    /**
     * Formats a count with this unit, e.g. {@code 1 month} or {@code 3 days}.
     */
    public String format(long count) {
        return count + " " + (count == 1 ? singular : getPlural());
    }

    public static CalendarUnit fromName(String name) {
        if (name != null) {
            String lower = name.trim().toLowerCase(Locale.ROOT);
            for (CalendarUnit unit : values()) {
                if (unit.singular.equals(lower) || unit.getPlural().equals(lower)) {
                    return unit;
                }
            }
        }
        throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_TIME_UNIT, "Unsupported time unit '" + name + "'");
    }
}
