package dev.mars.spacetime.db.store;

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
import dev.mars.spacetime.api.model.AbsoluteTemporalExtent;
import dev.mars.spacetime.api.model.CalendarUnit;
import dev.mars.spacetime.api.model.DatasetKind;
import dev.mars.spacetime.api.model.Granularity;
import dev.mars.spacetime.api.model.MapDataset;
import dev.mars.spacetime.api.model.MapTime;
import dev.mars.spacetime.api.model.RelativeTemporalExtent;
import dev.mars.spacetime.api.model.SpaceTimeDataset;
import dev.mars.spacetime.api.model.SpatialExtent;
import dev.mars.spacetime.api.model.TemporalType;
import dev.mars.spacetime.db.jdbc.JdbcTemporalDatabase;
import dev.mars.spacetime.db.schema.TemporalSchemaInitializer;
import dev.mars.spacetime.test.categories.TestCategories;
import dev.mars.spacetime.test.h2.H2TestDatabases;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class DatasetStoreTest {

    private JdbcTemporalDatabase database;
    private DatasetStore store;

    @BeforeEach
    void setUp() {
        database = new JdbcTemporalDatabase(H2TestDatabases.newDataSource("store"), "h2 test");
        new TemporalSchemaInitializer(database).initializeSchema();
        store = new DatasetStore(database);
    }

    @Test
    void testSchemaInitializationIsIdempotent() {
        assertDoesNotThrow(() -> new TemporalSchemaInitializer(database).initializeSchema());
    }

    @Test
    void testAbsoluteMapRoundTrip() {
        MapDataset map = DatasetKind.RASTER.newMap("temp_1", "PERMANENT");
        map.setTemporalExtent(new AbsoluteTemporalExtent(LocalDateTime.of(2001, 1, 1, 0, 0), LocalDateTime.of(2001, 2, 1, 0, 0)));
        map.setSpatialExtent(new SpatialExtent(80, 0, 120, 0));
        map.setMinValue(-3.5);
        map.setMaxValue(12.0);
        store.insertMap(map);

        MapDataset loaded = store.selectMap(DatasetKind.RASTER, "temp_1@PERMANENT").orElseThrow();
        assertEquals(map.getTemporalExtent(), loaded.getTemporalExtent());
        assertEquals(map.getSpatialExtent(), loaded.getSpatialExtent());
        assertEquals(-3.5, loaded.getMinValue());
        assertTrue(store.mapExists(DatasetKind.RASTER, "temp_1@PERMANENT"));
        assertFalse(store.mapExists(DatasetKind.VECTOR, "temp_1@PERMANENT"));
    }

    @Test
    void testMapUpdateCanSwitchTemporalType() {
        MapDataset map = DatasetKind.VECTOR.newMap("roads", "PERMANENT");
        map.setTemporalExtent(AbsoluteTemporalExtent.point(LocalDateTime.of(2005, 6, 1, 0, 0)));
        store.insertMap(map);

        map.setTemporalExtent(new RelativeTemporalExtent(3, 4L, CalendarUnit.DAYS));
        store.updateMap(map);

        MapDataset loaded = store.selectMap(DatasetKind.VECTOR, "roads@PERMANENT").orElseThrow();
        assertEquals(TemporalType.RELATIVE, loaded.getTemporalType());
        assertEquals(CalendarUnit.DAYS, ((RelativeTemporalExtent) loaded.getTemporalExtent()).getUnit());
    }

    @Test
    void testLoadingDatasetResyncsMapCounter() {
        SpaceTimeDataset dataset = DatasetKind.RASTER.newDataset("precip", "PERMANENT");
        dataset.setTemporalType(TemporalType.ABSOLUTE);
        dataset.setTitle("Precipitation");
        store.insertDataset(dataset);

        dataset.setNumberOfMaps(4);
        dataset.setMapTime(MapTime.INTERVAL);
        dataset.setGranularity(Granularity.absolute(1, CalendarUnit.MONTHS));
        dataset.setTemporalExtent(new AbsoluteTemporalExtent(LocalDateTime.of(2001, 1, 1, 0, 0), LocalDateTime.of(2001, 5, 1, 0, 0)));
        database.executeTransaction(store.updateDatasetMetadataStatements(dataset));

        SpaceTimeDataset loaded = store.selectDataset(DatasetKind.RASTER, "precip@PERMANENT").orElseThrow();
        assertEquals(4, loaded.getMapCounter());
        assertEquals(Granularity.absolute(1, CalendarUnit.MONTHS), loaded.getGranularity());
        assertEquals(MapTime.INTERVAL, loaded.getMapTime());
        assertEquals("Precipitation", loaded.getTitle());
        assertEquals(dataset.getTemporalExtent(), loaded.getTemporalExtent());
        assertEquals(List.of("precip@PERMANENT"), store.listDatasetIds(DatasetKind.RASTER));
    }

    @Test
    void testRegisterTableLifecycle() {
        String table = "precip_permanent_raster_register";
        database.executeTransaction(store.createRegisterTableStatements(table));
        database.executeTransaction(List.of(store.insertRegisterEntryStatement(table, "a@PERMANENT")));
        assertTrue(store.isRegistered(table, "a@PERMANENT"));
        assertFalse(store.isRegistered(null, "a@PERMANENT"));

        database.executeTransaction(List.of(store.deleteRegisterEntryStatement(table, "a@PERMANENT")));
        assertTrue(store.registerEntries(table).isEmpty());
        database.executeTransaction(List.of(store.dropRegisterTableStatement(table)));
    }

    @Test
    void testOrderClause() {
        assertEquals("t.start_time", DatasetStore.orderClause("start_time"));
        assertEquals("b.name DESC, t.end_time", DatasetStore.orderClause("name desc, end_time"));
        assertThrows(TemporalSyntaxException.class, () -> DatasetStore.orderClause("start_time; DROP TABLE x"));
    }
}
