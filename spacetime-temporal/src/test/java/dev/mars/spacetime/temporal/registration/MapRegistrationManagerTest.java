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

import dev.mars.spacetime.api.error.ConsistencyViolationException;
import dev.mars.spacetime.api.error.SpaceTimeErrorCodes;
import dev.mars.spacetime.api.error.SpaceTimeException;
import dev.mars.spacetime.api.model.AbsoluteTemporalExtent;
import dev.mars.spacetime.api.model.CalendarUnit;
import dev.mars.spacetime.api.model.DatasetKind;
import dev.mars.spacetime.api.model.Granularity;
import dev.mars.spacetime.api.model.MapDataset;
import dev.mars.spacetime.api.model.MapTime;
import dev.mars.spacetime.api.model.RelativeTemporalExtent;
import dev.mars.spacetime.api.model.SpaceTimeDataset;
import dev.mars.spacetime.api.model.TemporalType;
import dev.mars.spacetime.db.TemporalContext;
import dev.mars.spacetime.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.mars.spacetime.temporal.TemporalTestSupport.createDataset;
import static dev.mars.spacetime.temporal.TemporalTestSupport.date;
import static dev.mars.spacetime.temporal.TemporalTestSupport.insertMap;
import static dev.mars.spacetime.temporal.TemporalTestSupport.interval;
import static dev.mars.spacetime.temporal.TemporalTestSupport.newContext;
import static dev.mars.spacetime.temporal.TemporalTestSupport.relative;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Registration, unregistration and metadata maintenance against an H2 temporal database.
 */
@Tag(TestCategories.CORE)
class MapRegistrationManagerTest {

    private SimpleMeterRegistry registry;
    private TemporalContext context;
    private MapRegistrationManager manager;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        context = newContext("registration", registry);
        manager = new MapRegistrationManager(context);
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    void testRegisterCreatesBothRegisters() {
        SpaceTimeDataset dataset = createDataset(context, "precip", TemporalType.ABSOLUTE);
        MapDataset map = insertMap(context, "precip_1", interval(date(2001, 1, 1), date(2001, 2, 1)));

        assertTrue(manager.registerMap(dataset, map));

        assertTrue(dataset.getMapRegister().matches("precip_permanent_raster_[0-9a-f]{8}_register"),
            dataset.getMapRegister());
        assertEquals(1, dataset.getMapCounter());
        MapDataset stored = context.getStore().selectMap(DatasetKind.RASTER, map.getId()).orElseThrow();
        assertNotNull(stored.getStdsRegister());
        assertEquals(List.of(dataset.getId()), context.getStore().registerEntries(stored.getStdsRegister()));
        assertEquals(List.of(map.getId()), context.getStore().registerEntries(dataset.getMapRegister()));

        SpaceTimeDataset reloaded = manager.loadDataset(DatasetKind.RASTER, dataset.getId());
        assertEquals(dataset.getMapRegister(), reloaded.getMapRegister());
        assertEquals(1.0, registry.get("spacetime.maps.registered").counter().count());
    }

    @Test
    void testDuplicateRegistrationIsANoOp() {
        SpaceTimeDataset dataset = createDataset(context, "precip", TemporalType.ABSOLUTE);
        MapDataset map = insertMap(context, "precip_1", interval(date(2001, 1, 1), date(2001, 2, 1)));

        assertTrue(manager.registerMap(dataset, map));
        assertFalse(manager.registerMap(dataset, map));

        assertEquals(1, dataset.getMapCounter());
        assertEquals(1, context.getStore().registerEntries(dataset.getMapRegister()).size());
        assertEquals(1.0, registry.get("spacetime.maps.duplicate_registrations").counter().count());
    }

    @Test
    void testRelativeUnitMismatchFailsBeforeAnyWrite() {
        SpaceTimeDataset dataset = createDataset(context, "rel", TemporalType.RELATIVE);
        MapDataset years = insertMap(context, "y1", relative(1, 2L, CalendarUnit.YEARS));
        MapDataset months = insertMap(context, "m1", relative(1, 2L, CalendarUnit.MONTHS));
        manager.registerMap(dataset, years);
        manager.updateFromRegisteredMaps(dataset);
        assertEquals(CalendarUnit.YEARS, dataset.getRelativeUnit());

        ConsistencyViolationException e = assertThrows(ConsistencyViolationException.class,
            () -> manager.registerMap(dataset, months));

        assertEquals(SpaceTimeErrorCodes.RELATIVE_UNIT_MISMATCH, e.getCode());
        assertEquals(List.of(years.getId()), context.getStore().registerEntries(dataset.getMapRegister()));
        MapDataset storedMonths = context.getStore().selectMap(DatasetKind.RASTER, months.getId()).orElseThrow();
        assertNull(storedMonths.getStdsRegister(), "no register table may be created for the rejected map");
    }

    @Test
    void testFirstRelativeMapSetsTheUnit() {
        SpaceTimeDataset dataset = createDataset(context, "rel", TemporalType.RELATIVE);
        MapDataset days = insertMap(context, "d1", relative(5, 10L, CalendarUnit.DAYS));

        manager.registerMap(dataset, days);

        SpaceTimeDataset reloaded = manager.loadDataset(DatasetKind.RASTER, dataset.getId());
        assertEquals(CalendarUnit.DAYS, reloaded.getRelativeUnit());
    }

    @Test
    void testConsistencyChecks() {
        SpaceTimeDataset absolute = createDataset(context, "abs", TemporalType.ABSOLUTE);
        MapDataset relativeMap = insertMap(context, "r1", relative(1, 2L, CalendarUnit.DAYS));
        MapDataset invalid = insertMap(context, "bad", interval(date(2001, 2, 1), date(2001, 1, 1)));
        MapDataset foreign = DatasetKind.RASTER.newMap("other", "user1");
        foreign.setTemporalExtent(AbsoluteTemporalExtent.point(date(2001, 1, 1)));
        context.getStore().insertMap(foreign);
        MapDataset unknown = DatasetKind.RASTER.newMap("missing", "PERMANENT");

        assertEquals(SpaceTimeErrorCodes.TEMPORAL_TYPE_MISMATCH,
            assertThrows(ConsistencyViolationException.class, () -> manager.registerMap(absolute, relativeMap)).getCode());
        assertEquals(SpaceTimeErrorCodes.INVALID_TIME_STAMP,
            assertThrows(ConsistencyViolationException.class, () -> manager.registerMap(absolute, invalid)).getCode());
        assertEquals(SpaceTimeErrorCodes.MAPSET_MISMATCH,
            assertThrows(ConsistencyViolationException.class, () -> manager.registerMap(absolute, foreign)).getCode());
        assertEquals(SpaceTimeErrorCodes.MAP_NOT_FOUND,
            assertThrows(ConsistencyViolationException.class, () -> manager.registerMap(absolute, unknown)).getCode());
        assertNull(absolute.getMapRegister());
    }

    @Test
    void testMetadataFromRegisteredMaps() {
        SpaceTimeDataset dataset = createDataset(context, "monthly", TemporalType.ABSOLUTE);
        manager.registerMap(dataset, insertMap(context, "jan", interval(date(2001, 1, 1), date(2001, 2, 1))));
        manager.registerMap(dataset, insertMap(context, "feb", interval(date(2001, 2, 1), date(2001, 3, 1))));
        manager.registerMap(dataset, insertMap(context, "apr", interval(date(2001, 4, 1), date(2001, 5, 1))));

        manager.updateFromRegisteredMaps(dataset);

        SpaceTimeDataset reloaded = manager.loadDataset(DatasetKind.RASTER, dataset.getId());
        assertEquals(3, reloaded.getNumberOfMaps());
        assertEquals(3, reloaded.getMapCounter());
        assertEquals(MapTime.INTERVAL, reloaded.getMapTime());
        assertEquals(Granularity.absolute(1, CalendarUnit.MONTHS), reloaded.getGranularity());
        assertEquals(interval(date(2001, 1, 1), date(2001, 5, 1)), reloaded.getTemporalExtent());
        assertNotNull(reloaded.getSpatialExtent());
        assertEquals(1.0, registry.get("spacetime.datasets.metadata_updates").counter().count());
    }

    @Test
    void testSinglePointMapSetsEndToItsStart() {
        SpaceTimeDataset dataset = createDataset(context, "points", TemporalType.ABSOLUTE);
        manager.registerMap(dataset, insertMap(context, "p1", AbsoluteTemporalExtent.point(date(2001, 6, 1))));

        manager.updateFromRegisteredMaps(dataset);

        SpaceTimeDataset reloaded = manager.loadDataset(DatasetKind.RASTER, dataset.getId());
        AbsoluteTemporalExtent extent = (AbsoluteTemporalExtent) reloaded.getTemporalExtent();
        assertEquals(date(2001, 6, 1), extent.getStart());
        assertEquals(date(2001, 6, 1), extent.getEnd());
        assertEquals(MapTime.POINT, reloaded.getMapTime());
    }

    @Test
    void testEndFallsBackToLatestStartWhenEndsAreStale() {
        SpaceTimeDataset dataset = createDataset(context, "mixed", TemporalType.ABSOLUTE);
        manager.registerMap(dataset, insertMap(context, "a", interval(date(2001, 1, 1), date(2001, 2, 1))));
        manager.registerMap(dataset, insertMap(context, "b", AbsoluteTemporalExtent.point(date(2001, 6, 1))));

        manager.updateFromRegisteredMaps(dataset);

        assertEquals(interval(date(2001, 1, 1), date(2001, 6, 1)), dataset.getTemporalExtent());
        assertEquals(MapTime.MIXED, dataset.getMapTime());
    }

    @Test
    void testRegisterUnregisterRoundTrip() {
        SpaceTimeDataset dataset = createDataset(context, "roundtrip", TemporalType.RELATIVE);
        MapDataset map = insertMap(context, "r1", relative(1, 3L, CalendarUnit.HOURS));

        manager.registerMap(dataset, map);
        manager.updateFromRegisteredMaps(dataset);
        List<?> statements = manager.unregisterMap(dataset, map, true);
        manager.updateFromRegisteredMaps(dataset);

        assertEquals(2, statements.size());
        SpaceTimeDataset reloaded = manager.loadDataset(DatasetKind.RASTER, dataset.getId());
        assertEquals(0, reloaded.getNumberOfMaps());
        assertEquals(0, reloaded.getMapCounter());
        assertNull(reloaded.getTemporalExtent());
        assertNull(reloaded.getGranularity());
        assertNull(reloaded.getSpatialExtent());
        assertNull(reloaded.getMapTime());
        assertEquals(1.0, registry.get("spacetime.maps.unregistered").counter().count());
    }

    @Test
    void testUnregisterOfNonMemberIsANoOp() {
        SpaceTimeDataset dataset = createDataset(context, "empty", TemporalType.ABSOLUTE);
        MapDataset map = insertMap(context, "lonely", interval(date(2001, 1, 1), date(2001, 2, 1)));

        assertTrue(manager.unregisterMap(dataset, map, true).isEmpty());
        assertEquals(0, dataset.getMapCounter());
    }

    @Test
    void testDryRunUnregisterLeavesMembership() {
        SpaceTimeDataset dataset = createDataset(context, "dry", TemporalType.ABSOLUTE);
        MapDataset map = insertMap(context, "m", interval(date(2001, 1, 1), date(2001, 2, 1)));
        manager.registerMap(dataset, map);

        assertEquals(2, manager.unregisterMap(dataset, map, false).size());
        assertTrue(context.getStore().isRegistered(dataset.getMapRegister(), map.getId()));
    }

    @Test
    void testDeleteKeepsMemberMaps() {
        SpaceTimeDataset dataset = createDataset(context, "doomed", TemporalType.ABSOLUTE);
        MapDataset map = insertMap(context, "survivor", interval(date(2001, 1, 1), date(2001, 2, 1)));
        manager.registerMap(dataset, map);

        manager.delete(dataset, true);

        assertFalse(context.getStore().datasetExists(DatasetKind.RASTER, dataset.getId()));
        MapDataset stored = context.getStore().selectMap(DatasetKind.RASTER, map.getId()).orElseThrow();
        assertTrue(context.getStore().registerEntries(stored.getStdsRegister()).isEmpty());
        assertEquals(1.0, registry.get("spacetime.datasets.deleted").counter().count());
        SpaceTimeException e = assertThrows(SpaceTimeException.class,
            () -> manager.loadDataset(DatasetKind.RASTER, dataset.getId()));
        assertEquals(SpaceTimeErrorCodes.DATASET_NOT_FOUND, e.getCode());
    }

    @Test
    void testDeleteMapUpdatesItsDatasets() {
        SpaceTimeDataset first = createDataset(context, "first", TemporalType.ABSOLUTE);
        SpaceTimeDataset second = createDataset(context, "second", TemporalType.ABSOLUTE);
        MapDataset shared = insertMap(context, "shared", interval(date(2001, 1, 1), date(2001, 2, 1)));
        MapDataset other = insertMap(context, "other", interval(date(2001, 2, 1), date(2001, 3, 1)));
        manager.registerMap(first, shared);
        manager.registerMap(second, shared);
        manager.registerMap(second, other);
        manager.updateFromRegisteredMaps(second);

        manager.deleteMap(shared);

        assertFalse(context.getStore().mapExists(DatasetKind.RASTER, shared.getId()));
        SpaceTimeDataset reloaded = manager.loadDataset(DatasetKind.RASTER, second.getId());
        assertEquals(1, reloaded.getNumberOfMaps());
        assertEquals(interval(date(2001, 2, 1), date(2001, 3, 1)), reloaded.getTemporalExtent());
        assertEquals(0, manager.loadDataset(DatasetKind.RASTER, first.getId()).getNumberOfMaps());
    }

    @Test
    void testCreateDatasetRespectsOverwrite() {
        createDataset(context, "taken", TemporalType.ABSOLUTE);
        SpaceTimeDataset again = DatasetKind.RASTER.newDataset("taken", "PERMANENT");
        again.setTemporalType(TemporalType.RELATIVE);

        assertEquals(SpaceTimeErrorCodes.OUTPUT_EXISTS,
            assertThrows(ConsistencyViolationException.class, () -> manager.createDataset(again, false)).getCode());

        manager.createDataset(again, true);
        assertEquals(TemporalType.RELATIVE, manager.loadDataset(DatasetKind.RASTER, "taken@PERMANENT").getTemporalType());
    }

    @Test
    void testRelativeExtentKeepsDatasetUnit() {
        SpaceTimeDataset dataset = createDataset(context, "relx", TemporalType.RELATIVE);
        manager.registerMap(dataset, insertMap(context, "a", relative(0, 2L, CalendarUnit.DAYS)));
        manager.registerMap(dataset, insertMap(context, "b", relative(4, 6L, CalendarUnit.DAYS)));

        manager.updateFromRegisteredMaps(dataset);

        assertEquals(new RelativeTemporalExtent(0, 6L, CalendarUnit.DAYS), dataset.getTemporalExtent());
        assertEquals(Granularity.relative(2), dataset.getGranularity());
    }
}
