package dev.mars.spacetime.temporal.registration;

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
import dev.mars.spacetime.api.model.AbsoluteTemporalExtent;
import dev.mars.spacetime.api.model.CalendarUnit;
import dev.mars.spacetime.api.model.Granularity;
import dev.mars.spacetime.api.model.RelativeTemporalExtent;
import dev.mars.spacetime.api.model.TemporalExtent;
import dev.mars.spacetime.api.model.TemporalType;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

/**
 * Time stamps assigned to maps during bulk registration. The i-th map starts at
 * {@code start + i * increment}; with {@code interval} set it ends one increment
 * later, otherwise at {@code end} (or it is an instant when no end is given).
 *
 * @param start     absolute {@code yyyy-MM-dd[ HH:mm:ss]} or relative integer start, null to keep stored times
 * @param end       optional end in the same format
 * @param increment optional increment, {@code "1 month"} for absolute or an integer for relative time
 * @param interval  build intervals from the increment
 * @param unit      relative time unit, null for absolute time
 */
public record TimeStampOptions(String start, String end, String increment, boolean interval, CalendarUnit unit) {

    public static TimeStampOptions keepStored() {
        return new TimeStampOptions(null, null, null, false, null);
    }

    public boolean assignsTime() {
        return start != null;
    }

    public TemporalType temporalType() {
        return unit == null ? TemporalType.ABSOLUTE : TemporalType.RELATIVE;
    }

    /**
     * Time stamp of the {@code index}-th map.
     *
     * @throws TemporalSyntaxException for malformed values or an interval without increment
     */
    public TemporalExtent timeStampFor(int index) {
        if (interval && increment == null) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT,
                "The interval flag requires an increment");
        }
        Granularity step = increment == null ? null : Granularity.parse(increment, temporalType());
        if (temporalType() == TemporalType.ABSOLUTE) {
            LocalDateTime first = parseAbsolute(start);
            LocalDateTime begin = step == null ? first
                : first.plus(step.getCount() * index, step.getUnit().getChronoUnit());
            LocalDateTime finish = interval ? step.addTo(begin) : (end == null ? null : parseAbsolute(end));
            return new AbsoluteTemporalExtent(begin, finish);
        }
        long first = parseRelative(start);
        long begin = step == null ? first : first + step.getCount() * index;
        Long finish = interval ? Long.valueOf(step.addTo(begin)) : (end == null ? null : parseRelative(end));
        return new RelativeTemporalExtent(begin, finish, unit);
    }

    static LocalDateTime parseAbsolute(String text) {
        String value = text.trim();
        try {
            if (value.length() == 10) {
                return LocalDate.parse(value).atStartOfDay();
            }
            return LocalDateTime.parse(value, AbsoluteTemporalExtent.SQL_FORMAT);
        } catch (DateTimeParseException e) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_TIME_STAMP,
                "Unable to parse absolute time '" + text + "'");
        }
    }

    static long parseRelative(String text) {
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_TIME_STAMP,
                "Unable to parse relative time '" + text + "'");
        }
    }
}
