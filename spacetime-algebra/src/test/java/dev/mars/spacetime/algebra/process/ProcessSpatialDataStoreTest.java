package dev.mars.spacetime.algebra.process;

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
import dev.mars.spacetime.api.error.SpaceTimeException;
import dev.mars.spacetime.api.external.MapInfo;
import dev.mars.spacetime.api.external.UnivarStatistics;
import dev.mars.spacetime.api.model.DatasetKind;
import dev.mars.spacetime.api.model.SpatialExtent;
import dev.mars.spacetime.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag(TestCategories.CORE)
@ExtendWith(MockitoExtension.class)
class ProcessSpatialDataStoreTest {

    @Mock
    private CommandRunner runner;

    @Test
    void testReadRasterInfo() {
        when(runner.run(List.of("r.info", "-gr", "map=prec@PERMANENT"))).thenReturn(new CommandRunner.CommandResult(0,
            "north=80\nsouth=0\neast=120\nwest=0\nnsres=1\newres=1\nrows=80\ncols=120\ncells=9600\n"
                + "datatype=DCELL\nncats=0\nmin=-3.5\nmax=12\n"));

        MapInfo info = new ProcessSpatialDataStore(runner).readMapInfo(DatasetKind.RASTER, "prec@PERMANENT");

        assertEquals(new SpatialExtent(80, 0, 120, 0), info.spatialExtent());
        assertEquals(-3.5, info.minValue());
        assertEquals(12.0, info.maxValue());
        assertFalse(info.isNullMap());
    }

    @Test
    void testNullRaster() {
        when(runner.run(anyList())).thenReturn(new CommandRunner.CommandResult(0,
            "north=80\nsouth=0\neast=120\nwest=0\nmin=NULL\nmax=NULL\n"));

        assertTrue(new ProcessSpatialDataStore(runner).readMapInfo(DatasetKind.RASTER, "empty@PERMANENT").isNullMap());
    }

    @Test
    void testVolumeInfoKeepsVerticalExtent() {
        when(runner.run(List.of("r3.info", "-gr", "map=volume@PERMANENT"))).thenReturn(new CommandRunner.CommandResult(0,
            "north=80\nsouth=0\neast=120\nwest=0\ntop=50\nbottom=-10\nmin=1\nmax=2\n"));

        MapInfo info = new ProcessSpatialDataStore(runner).readMapInfo(DatasetKind.RASTER3D, "volume@PERMANENT");

        assertEquals(new SpatialExtent(80, 0, 120, 0, 50, -10), info.spatialExtent());
    }

    @Test
    void testMapExists() {
        when(runner.run(List.of("g.findfile", "-n", "element=raster", "file=prec", "mapset=PERMANENT")))
            .thenReturn(new CommandRunner.CommandResult(0, "name='prec'\nmapset='PERMANENT'\nfullname='prec@PERMANENT'\n"));
        when(runner.run(List.of("g.findfile", "-n", "element=raster", "file=other", "mapset=PERMANENT")))
            .thenReturn(new CommandRunner.CommandResult(1, "name=\nmapset=\nfullname=\n"));

        ProcessSpatialDataStore store = new ProcessSpatialDataStore(runner);

        assertTrue(store.mapExists(DatasetKind.RASTER, "prec@PERMANENT"));
        assertFalse(store.mapExists(DatasetKind.RASTER, "other@PERMANENT"));
    }

    @Test
    void testRemoveMaps() {
        when(runner.run(anyList())).thenReturn(new CommandRunner.CommandResult(0, ""));

        new ProcessSpatialDataStore(runner).removeMaps(DatasetKind.RASTER, List.of("r_0@PERMANENT", "r_3@PERMANENT"));

        verify(runner).run(List.of("g.remove", "-f", "type=raster", "name=r_0,r_3"));
    }

    @Test
    void testStatisticsAreReadFromUnivar() {
        when(runner.run(List.of("r.univar", "-g", "map=prec@PERMANENT"))).thenReturn(new CommandRunner.CommandResult(0,
            "n=90\nnull_cells=10\ncells=100\nmin=1\nmax=9\nrange=8\nmean=5\nmean_of_abs=5\n"
                + "stddev=2\nvariance=4\ncoeff_var=40\nsum=450\n"));

        UnivarStatistics stats = new ProcessSpatialDataStore(runner).readStatistics(DatasetKind.RASTER,
            "prec@PERMANENT", false);

        assertEquals(5.0, stats.mean());
        assertEquals(450.0, stats.sum());
        assertEquals(90, stats.nonNullCells());
        assertFalse(stats.isExtended());
    }

    @Test
    void testExtendedStatisticsOfVolume() {
        when(runner.run(List.of("r3.univar", "-ge", "map=volume@PERMANENT"))).thenReturn(new CommandRunner.CommandResult(0,
            "n=8\nnull_cells=0\ncells=8\nmin=1\nmax=8\nrange=7\nmean=4.5\nmean_of_abs=4.5\n"
                + "stddev=2.29129\nvariance=5.25\ncoeff_var=50.9175\nsum=36\n"
                + "first_quartile=2.5\nmedian=4.5\nthird_quartile=6.5\npercentile_90=8\n"));

        UnivarStatistics stats = new ProcessSpatialDataStore(runner).readStatistics(DatasetKind.RASTER3D,
            "volume@PERMANENT", true);

        assertTrue(stats.isExtended());
        assertEquals(4.5, stats.median());
        assertEquals(8.0, stats.percentile90());
    }

    @Test
    void testVectorMapsHaveNoCellStatistics() {
        SpaceTimeException e = assertThrows(SpaceTimeException.class,
            () -> new ProcessSpatialDataStore(runner).readStatistics(DatasetKind.VECTOR, "roads@PERMANENT", false));

        assertEquals(SpaceTimeErrorCodes.INVALID_ARGUMENT, e.getCode());
    }

    @Test
    void testFailedInfoCommand() {
        when(runner.run(anyList())).thenReturn(new CommandRunner.CommandResult(1, "ERROR: Raster map not found"));

        SpaceTimeException e = assertThrows(SpaceTimeException.class,
            () -> new ProcessSpatialDataStore(runner).readMapInfo(DatasetKind.RASTER, "missing@PERMANENT"));
        assertEquals(SpaceTimeErrorCodes.EXTERNAL_PROCESS_FAILED, e.getCode());
    }

    @Test
    void testParseKeyValues() {
        assertEquals("PERMANENT", ProcessSpatialDataStore.parseKeyValues("mapset='PERMANENT'\nnoise\n").get("mapset"));
        assertTrue(ProcessSpatialDataStore.parseKeyValues("no pairs here").isEmpty());
    }
}
