package dev.mars.spacetime.temporal.sql;

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
import dev.mars.spacetime.api.model.RelativeTemporalExtent;
import dev.mars.spacetime.api.relation.SamplingMethod;
import dev.mars.spacetime.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class TemporalRelationWhereBuilderTest {

    @Test
    void testRelativeClauses() {
        assertEquals("((start_time >= 1 and start_time < 2))",
            TemporalRelationWhereBuilder.buildWhere(1, 2, EnumSet.of(SamplingMethod.START)).orElseThrow());
        assertEquals("(((start_time > 1 and end_time < 2) OR (start_time >= 1 and end_time < 2) OR (start_time > 1 and end_time <= 2)))",
            TemporalRelationWhereBuilder.buildWhere(1, 2, EnumSet.of(SamplingMethod.DURING)).orElseThrow());
        assertEquals("(((start_time < 1 and end_time > 1 and end_time < 2) OR (start_time < 2 and start_time > 1 and end_time > 2)))",
            TemporalRelationWhereBuilder.buildWhere(1, 2, EnumSet.of(SamplingMethod.OVERLAP)).orElseThrow());
        assertEquals("(((start_time < 1 and end_time > 2) OR (start_time <= 1 and end_time > 2) OR (start_time < 1 and end_time >= 2)))",
            TemporalRelationWhereBuilder.buildWhere(1, 2, EnumSet.of(SamplingMethod.CONTAIN)).orElseThrow());
        assertEquals("((start_time = 1 and end_time = 2))",
            TemporalRelationWhereBuilder.buildWhere(1, 2, EnumSet.of(SamplingMethod.EQUAL)).orElseThrow());
        assertEquals("((start_time = 2))",
            TemporalRelationWhereBuilder.buildWhere(1, 2, EnumSet.of(SamplingMethod.FOLLOWS)).orElseThrow());
        assertEquals("((end_time = 1))",
            TemporalRelationWhereBuilder.buildWhere(1, 2, EnumSet.of(SamplingMethod.PRECEDES)).orElseThrow());
    }

    @Test
    void testAbsoluteLiteralsAreQuoted() {
        LocalDateTime start = LocalDateTime.of(2001, 1, 1, 12, 30);
        LocalDateTime end = LocalDateTime.of(2001, 3, 31, 14, 30);

        assertEquals("((start_time = '2001-01-01 12:30:00' and end_time = '2001-03-31 14:30:00') OR (start_time = '2001-03-31 14:30:00'))",
            TemporalRelationWhereBuilder.buildWhere(start, end, EnumSet.of(SamplingMethod.EQUAL, SamplingMethod.FOLLOWS)).orElseThrow());
        assertEquals(TemporalRelationWhereBuilder.buildWhere(start, end, EnumSet.of(SamplingMethod.START)),
            TemporalRelationWhereBuilder.buildWhere(new AbsoluteTemporalExtent(start, end), EnumSet.of(SamplingMethod.START)));
    }

    @Test
    void testEmptyMethodSetGivesNoPredicate() {
        assertTrue(TemporalRelationWhereBuilder.buildWhere(1, 2, EnumSet.noneOf(SamplingMethod.class)).isEmpty());
        assertTrue(TemporalRelationWhereBuilder.buildWhere(
            new RelativeTemporalExtent(1, 2L, CalendarUnit.DAYS), Set.of()).isEmpty());
    }

    @Test
    void testMethodOrderDoesNotMatter() {
        Set<SamplingMethod> forward = new LinkedHashSet<>(List.of(SamplingMethod.values()));
        List<SamplingMethod> reversed = new ArrayList<>(List.of(SamplingMethod.values()));
        Collections.reverse(reversed);
        Set<SamplingMethod> backward = new LinkedHashSet<>(reversed);

        assertEquals(TemporalRelationWhereBuilder.buildWhere(1, 2, forward),
            TemporalRelationWhereBuilder.buildWhere(1, 2, backward));
        String all = TemporalRelationWhereBuilder.buildWhere(1, 2, forward).orElseThrow();
        assertTrue(all.startsWith("((start_time >= 1 and start_time < 2) OR "), all);
        assertTrue(all.endsWith(" OR (end_time = 1))"), all);
    }
}
