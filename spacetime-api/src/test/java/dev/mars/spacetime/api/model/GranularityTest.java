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

import dev.mars.spacetime.api.error.TemporalSyntaxException;
import dev.mars.spacetime.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class GranularityTest {

    @Test
    void testAbsoluteFormatting() {
        assertEquals("1 month", Granularity.absolute(1, CalendarUnit.MONTHS).toString());
        assertEquals("3 days", Granularity.absolute(3, CalendarUnit.DAYS).toString());
    }

    @Test
    void testParse() {
        assertEquals(Granularity.absolute(2, CalendarUnit.HOURS), Granularity.parse("2 hours", TemporalType.ABSOLUTE));
        assertEquals(Granularity.absolute(1, CalendarUnit.YEARS), Granularity.parse("year", TemporalType.ABSOLUTE));
        assertEquals(Granularity.relative(5), Granularity.parse("5", TemporalType.RELATIVE));
        assertThrows(TemporalSyntaxException.class, () -> Granularity.parse("fortnight", TemporalType.ABSOLUTE));
        assertThrows(TemporalSyntaxException.class, () -> Granularity.parse("0", TemporalType.RELATIVE));
    }

    @Test
    void testStepping() {
        Granularity monthly = Granularity.absolute(1, CalendarUnit.MONTHS);
        assertEquals(LocalDateTime.of(2001, 2, 28, 0, 0), monthly.addTo(LocalDateTime.of(2001, 1, 28, 0, 0)));
        assertEquals(17, Granularity.relative(7).addTo(10));
        assertThrows(IllegalStateException.class, () -> monthly.addTo(10));
    }
}
