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
import dev.mars.spacetime.api.model.MapDataset;
import dev.mars.spacetime.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static dev.mars.spacetime.temporal.TemporalTestSupport.date;
import static dev.mars.spacetime.temporal.TemporalTestSupport.interval;
import static dev.mars.spacetime.temporal.TemporalTestSupport.map;
import static dev.mars.spacetime.temporal.TemporalTestSupport.relative;
import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class GranularityCalculatorTest {

    @Test
    void testMonthlyIntervalsGiveOneMonth() {
        List<MapDataset> maps = new ArrayList<>();
        for (int month = 1; month <= 12; month++) {
            LocalDateTime start = date(2001, month, 1);
            maps.add(map("m" + month, interval(start, start.plusMonths(1))));
        }
        assertEquals(Granularity.absolute(1, CalendarUnit.MONTHS), GranularityCalculator.compute(maps).orElseThrow());
    }

    @Test
    void testGapsTakePartInTheDivisor() {
        List<MapDataset> maps = List.of(
            map("a", interval(date(2001, 1, 1), date(2001, 4, 1))),
            map("b", interval(date(2001, 7, 1), date(2001, 10, 1))));
        assertEquals(Granularity.absolute(3, CalendarUnit.MONTHS), GranularityCalculator.compute(maps).orElseThrow());
    }

    @Test
    void testPointsSpacedByMultiplesOfAStep() {
        List<MapDataset> maps = List.of(
            map("a", AbsoluteTemporalExtent.point(date(2001, 1, 1))),
            map("b", AbsoluteTemporalExtent.point(date(2001, 1, 7))),
            map("c", AbsoluteTemporalExtent.point(date(2001, 1, 19))));
        assertEquals(Granularity.absolute(6, CalendarUnit.DAYS), GranularityCalculator.compute(maps).orElseThrow());
    }

    @Test
    void testHourlySteps() {
        LocalDateTime t0 = LocalDateTime.of(2001, 1, 1, 0, 0);
        List<MapDataset> maps = List.of(
            map("a", interval(t0, t0.plusHours(2))),
            map("b", interval(t0.plusHours(2), t0.plusHours(4))),
            map("c", interval(t0.plusHours(4), t0.plusHours(6))));
        assertEquals(Granularity.absolute(2, CalendarUnit.HOURS), GranularityCalculator.compute(maps).orElseThrow());
    }

    @Test
    void testYearlySteps() {
        List<MapDataset> maps = List.of(
            map("a", AbsoluteTemporalExtent.point(date(2000, 1, 1))),
            map("b", AbsoluteTemporalExtent.point(date(2002, 1, 1))),
            map("c", AbsoluteTemporalExtent.point(date(2006, 1, 1))));
        assertEquals(Granularity.absolute(2, CalendarUnit.YEARS), GranularityCalculator.compute(maps).orElseThrow());
    }

    @Test
    void testRelativeGranularityIsTheCommonDivisor() {
        List<MapDataset> maps = List.of(
            map("a", relative(0, 6L, CalendarUnit.DAYS)),
            map("b", relative(6, 12L, CalendarUnit.DAYS)),
            map("c", relative(21, 24L, CalendarUnit.DAYS)));
        assertEquals(Granularity.relative(3), GranularityCalculator.compute(maps).orElseThrow());
    }

    @Test
    void testSinglePointHasNoGranularity() {
        assertTrue(GranularityCalculator.compute(List.of(map("a", AbsoluteTemporalExtent.point(date(2001, 1, 1))))).isEmpty());
        assertTrue(GranularityCalculator.compute(List.of()).isEmpty());
    }

    @Test
    void testGcd() {
        assertEquals(6, GranularityCalculator.gcd(12, 18));
        assertEquals(5, GranularityCalculator.gcd(0, -5));
    }
}
