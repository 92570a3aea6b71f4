package dev.mars.spacetime.temporal.granularity;

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

import dev.mars.spacetime.api.model.AbsoluteTemporalExtent;
import dev.mars.spacetime.api.model.CalendarUnit;
import dev.mars.spacetime.api.model.Granularity;
import dev.mars.spacetime.api.model.TemporalExtent;
import dev.mars.spacetime.api.model.TemporalType;
import dev.mars.spacetime.api.model.TimeStamped;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Computes the coarsest step that divides every interval length, every gap and
 * every distance between consecutive start times of a start-time ordered map list.
 * <p>
 * Absolute time is stepped in calendar units: the unit is the finest calendar
 * field in which any two compared time stamps differ, so a monthly series
 * yields {@code 1 month} although months differ in length.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class GranularityCalculator {

    private static final CalendarUnit[] FINEST_FIRST = {
        CalendarUnit.SECONDS, CalendarUnit.MINUTES, CalendarUnit.HOURS,
        CalendarUnit.DAYS, CalendarUnit.MONTHS, CalendarUnit.YEARS
    };

    private GranularityCalculator() {
    }

    /**
     * @return the granularity, or empty when the list has no temporal distance to measure
     */
    public static Optional<Granularity> compute(List<? extends TimeStamped> maps) {
        if (maps.isEmpty()) {
            return Optional.empty();
        }
        TemporalType type = maps.get(0).getTemporalExtent().getType();
        return type == TemporalType.ABSOLUTE ? computeAbsolute(maps) : computeRelative(maps);
    }

    static Optional<Granularity> computeRelative(List<? extends TimeStamped> maps) {
        long gcd = 0;
        for (long[] pair : distances(maps)) {
            gcd = gcd(gcd, pair[1] - pair[0]);
        }
        return gcd > 0 ? Optional.of(Granularity.relative(gcd)) : Optional.empty();
    }

    static Optional<Granularity> computeAbsolute(List<? extends TimeStamped> maps) {
        List<LocalDateTime[]> pairs = new ArrayList<>();
        for (int i = 0; i < maps.size(); i++) {
            AbsoluteTemporalExtent current = (AbsoluteTemporalExtent) maps.get(i).getTemporalExtent();
            if (current.getEnd() != null) {
                pairs.add(new LocalDateTime[] {current.getStart(), current.getEnd()});
            }
            if (i + 1 < maps.size()) {
                AbsoluteTemporalExtent following = (AbsoluteTemporalExtent) maps.get(i + 1).getTemporalExtent();
                pairs.add(new LocalDateTime[] {current.getStart(), following.getStart()});
                if (current.getEnd() != null) {
                    pairs.add(new LocalDateTime[] {current.getEnd(), following.getStart()});
                }
            }
        }

        int finest = -1;
        for (LocalDateTime[] pair : pairs) {
            int level = finestDifferingField(pair[0], pair[1]);
            if (level >= 0 && (finest < 0 || level < finest)) {
                finest = level;
            }
        }
        if (finest < 0) {
            return Optional.empty();
        }

        CalendarUnit unit = FINEST_FIRST[finest];
        long gcd = 0;
        for (LocalDateTime[] pair : pairs) {
            gcd = gcd(gcd, unit.getChronoUnit().between(pair[0], pair[1]));
        }
        return gcd > 0 ? Optional.of(Granularity.absolute(gcd, unit)) : Optional.empty();
    }

    /**
     * Index into {@link #FINEST_FIRST} of the finest field in which the time
     * stamps differ, or -1 when they are equal.
     */
    static int finestDifferingField(LocalDateTime a, LocalDateTime b) {
        if (a.getSecond() != b.getSecond()) {
            return 0;
        }
        if (a.getMinute() != b.getMinute()) {
            return 1;
        }
        if (a.getHour() != b.getHour()) {
            return 2;
        }
        if (a.getDayOfMonth() != b.getDayOfMonth()) {
            return 3;
        }
        if (a.getMonthValue() != b.getMonthValue()) {
            return 4;
        }
        if (a.getYear() != b.getYear()) {
            return 5;
        }
        return -1;
    }

    private static List<long[]> distances(List<? extends TimeStamped> maps) {
        List<long[]> pairs = new ArrayList<>();
        for (int i = 0; i < maps.size(); i++) {
            TemporalExtent current = maps.get(i).getTemporalExtent();
            Long end = current.endOrdinal();
            if (end != null) {
                pairs.add(new long[] {current.startOrdinal(), end});
            }
            if (i + 1 < maps.size()) {
                long nextStart = maps.get(i + 1).getTemporalExtent().startOrdinal();
                pairs.add(new long[] {current.startOrdinal(), nextStart});
                if (end != null) {
                    pairs.add(new long[] {end, nextStart});
                }
            }
        }
        return pairs;
    }

    static long gcd(long a, long b) {
        a = Math.abs(a);
        b = Math.abs(b);
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }
}
