package dev.mars.spacetime.algebra;

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

import dev.mars.spacetime.algebra.eval.AlgebraMap;
import dev.mars.spacetime.algebra.exec.AlgebraOptions;
import dev.mars.spacetime.algebra.exec.AlgebraResult;
import dev.mars.spacetime.api.error.ConsistencyViolationException;
import dev.mars.spacetime.api.error.SpaceTimeErrorCodes;
import dev.mars.spacetime.api.error.SpaceTimeException;
import dev.mars.spacetime.api.error.TemporalSyntaxException;
import dev.mars.spacetime.api.model.DatasetKind;
import dev.mars.spacetime.api.model.SpaceTimeDataset;
import dev.mars.spacetime.db.TemporalContext;
import dev.mars.spacetime.test.categories.TestCategories;
import dev.mars.spacetime.test.fakes.InMemorySpatialDataStore;
import dev.mars.spacetime.test.fakes.RecordingRasterCalculator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.mars.spacetime.algebra.AlgebraTestSupport.MAPSET;
import static dev.mars.spacetime.algebra.AlgebraTestSupport.createInput;
import static dev.mars.spacetime.algebra.AlgebraTestSupport.map;
import static dev.mars.spacetime.algebra.AlgebraTestSupport.months;
import static dev.mars.spacetime.algebra.AlgebraTestSupport.newContext;
import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class TemporalAlgebraTest {

    private Vertx vertx;
    private TemporalContext context;
    private InMemorySpatialDataStore spatial;
    private RecordingRasterCalculator calculator;
    private TemporalAlgebra algebra;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        context = newContext("algebra", new SimpleMeterRegistry());
        spatial = new InMemorySpatialDataStore();
        calculator = new RecordingRasterCalculator(spatial, MAPSET);
        algebra = new TemporalAlgebra(context, calculator, spatial, vertx);
    }

    @AfterEach
    void tearDown() throws Exception {
        algebra.close();
        context.close();
        vertx.close().toCompletionStage().toCompletableFuture().get();
    }

    private static AlgebraOptions options() {
        return new AlgebraOptions(DatasetKind.RASTER, "r", 4, false, false, false);
    }

    @Test
    void testEqualMapsProduceOneResult() {
        createInput(context, spatial, "A", map("a1", months(1, 2)));
        createInput(context, spatial, "B", map("b1", months(1, 2)));

        AlgebraResult result = algebra.execute("R = A {equal} B", options());

        assertEquals(1, result.registered().size());
        assertEquals(List.of("r_0 = (a1@PERMANENT + b1@PERMANENT)"), calculator.getExpressions());
        SpaceTimeDataset dataset = context.getStore().selectDataset(DatasetKind.RASTER, "R@PERMANENT").orElseThrow();
        assertEquals(1, dataset.getNumberOfMaps());
        assertEquals(months(1, 2), dataset.getTemporalExtent());
    }

    @Test
    void testSeparatedMapsProduceNoResult() {
        createInput(context, spatial, "A", map("a1", months(1, 2)));
        createInput(context, spatial, "B", map("b1", months(5, 6)));

        AlgebraResult result = algebra.execute("R = A {equal} B", options());

        assertTrue(result.registered().isEmpty());
        assertTrue(calculator.getExpressions().isEmpty());
    }

    @Test
    void testMonthlySeriesAgainstSeason() {
        createInput(context, spatial, "precip", map("p1", months(1, 2)), map("p2", months(2, 3)),
            map("p3", months(3, 4)), map("p4", months(4, 5)));
        createInput(context, spatial, "season", map("winter", months(1, 4)));

        AlgebraResult result = algebra.execute("anomaly = precip {-,during|starts|finishes} season", options());

        assertEquals(3, result.registered().size());
        assertEquals(months(1, 4), context.getStore().selectDataset(DatasetKind.RASTER, "anomaly@PERMANENT")
            .orElseThrow().getTemporalExtent());
        assertTrue(calculator.getExpressions().contains("r_1 = (p2@PERMANENT - winter@PERMANENT)"));
    }

    @Test
    void testPlanDoesNotCompute() {
        createInput(context, spatial, "A", map("a1", months(1, 2)), map("a2", months(2, 3)));

        List<AlgebraMap> plan = algebra.plan("R = if(A > 10, A, null())", options());

        assertEquals(2, plan.size());
        assertEquals("if((a1@PERMANENT > 10), a1@PERMANENT, null())", plan.get(0).substitution());
        assertTrue(calculator.getExpressions().isEmpty());
    }

    @Test
    void testMissingInputs() {
        createInput(context, spatial, "A", map("a1", months(1, 2)));

        SpaceTimeException missingDataset = assertThrows(SpaceTimeException.class,
            () -> algebra.execute("R = A + B", options()));
        assertEquals(SpaceTimeErrorCodes.DATASET_NOT_FOUND, missingDataset.getCode());

        spatial.removeMaps(DatasetKind.RASTER, List.of("a1@PERMANENT"));
        ConsistencyViolationException missingMap = assertThrows(ConsistencyViolationException.class,
            () -> algebra.execute("R = A * 2", options()));
        assertEquals(SpaceTimeErrorCodes.MAP_NOT_FOUND, missingMap.getCode());
    }

    @Test
    void testScalarExpressionIsRejected() {
        assertThrows(TemporalSyntaxException.class, () -> algebra.execute("R = 1 + 2", options()));
    }
}
