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

import dev.mars.spacetime.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class SpatialExtentTest {

    @Test
    void testUnionTracksEveryAxisIndependently() {
        SpatialExtent a = new SpatialExtent(80, 20, 120, 60);
        SpatialExtent b = new SpatialExtent(90, 10, 110, 40);
        SpatialExtent union = SpatialExtent.unionOf(Arrays.asList(a, null, b));
        assertEquals(new SpatialExtent(90, 10, 120, 40), union);
    }

    @Test
    void testOverlapAndIntersection() {
        SpatialExtent a = new SpatialExtent(10, 0, 10, 0);
        SpatialExtent b = new SpatialExtent(15, 5, 15, 5);
        SpatialExtent c = new SpatialExtent(20, 10, 20, 10);
        assertTrue(a.overlaps(b, false));
        assertFalse(a.overlaps(c, false));
        assertEquals(new SpatialExtent(10, 5, 10, 5), a.intersect(b, false).orElseThrow());
    }

    @Test
    void testThreeDimensionalOverlapChecksVerticalAxis() {
        SpatialExtent low = new SpatialExtent(10, 0, 10, 0, 5, 0);
        SpatialExtent high = new SpatialExtent(10, 0, 10, 0, 15, 10);
        assertTrue(low.overlaps(high, false));
        assertFalse(low.overlaps(high, true));
    }
}
