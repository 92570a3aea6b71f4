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

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Sampling step of a dataset. Absolute granularities are a count of a calendar
 * unit ({@code "1 month"}); relative granularities are a plain count in the
 * dataset's unit.
 */
public final class Granularity {

    private final long count;
    private final CalendarUnit unit;

    private Granularity(long count, CalendarUnit unit) {
        if (count <= 0) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_GRANULARITY,
                "Granularity must be positive: " + count);
        }
        this.count = count;
        this.unit = unit;
    }

    public static Granularity absolute(long count, CalendarUnit unit) {
        return new Granularity(count, Objects.requireNonNull(unit, "unit must not be null"));
    }

    public static Granularity relative(long count) {
        return new Granularity(count, null);
    }

    /**
     * Parses {@code "2 days"} style text for absolute time, or an integer for relative time.
     */
    public static Granularity parse(String text, TemporalType type) {
        if (text == null || text.trim().isEmpty()) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_GRANULARITY, "Granularity must not be empty");
        }
        String[] parts = text.trim().split("\\s+");
        try {
            if (type == TemporalType.RELATIVE) {
                return relative(Long.parseLong(parts[0]));
            }
            if (parts.length == 1) {
                return absolute(1, CalendarUnit.fromName(parts[0]));
            }
            return absolute(Long.parseLong(parts[0]), CalendarUnit.fromName(parts[1]));
        } catch (NumberFormatException e) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_GRANULARITY, "Invalid granularity '" + text + "'");
        }
    }

    public long getCount() {
        return count;
    }

    /** Calendar unit, null for relative granularities. */
    public CalendarUnit getUnit() {
        return unit;
    }

    public boolean isRelative() {
        return unit == null;
    }

    public LocalDateTime addTo(LocalDateTime time) {
        if (unit == null) {
            throw new IllegalStateException("Relative granularity cannot step absolute time");
        }
        return time.plus(count, unit.getChronoUnit());
    }

    public long addTo(long time) {
        if (unit != null) {
            throw new IllegalStateException("Absolute granularity cannot step relative time");
        }
        return time + count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Granularity that = (Granularity) o;
        return count == that.count && unit == that.unit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, unit);
    }

    @Override
    public String toString() {
        return unit == null ? Long.toString(count) : unit.format(count);
    }
}
