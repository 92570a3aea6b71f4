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

import dev.mars.spacetime.algebra.ast.Assignment;
import dev.mars.spacetime.algebra.eval.AlgebraEvaluator;
import dev.mars.spacetime.algebra.eval.AlgebraMap;
import dev.mars.spacetime.algebra.eval.Operand;
import dev.mars.spacetime.algebra.eval.StoreDatasetResolver;
import dev.mars.spacetime.algebra.exec.AlgebraExecutor;
import dev.mars.spacetime.algebra.exec.AlgebraOptions;
import dev.mars.spacetime.algebra.exec.AlgebraResult;
import dev.mars.spacetime.algebra.parser.AlgebraParser;
import dev.mars.spacetime.api.error.SpaceTimeErrorCodes;
import dev.mars.spacetime.api.error.TemporalSyntaxException;
import dev.mars.spacetime.api.external.RasterCalculator;
import dev.mars.spacetime.api.external.SpatialDataStore;
import dev.mars.spacetime.db.TemporalContext;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point of the temporal raster algebra.
 * <p>
 * A statement {@code Result = expression} is parsed, lowered against the
 * datasets of the temporal database and executed with the raster calculator.
 * The result is registered as a new space time dataset.
 *
 * <pre>{@code
 * try (TemporalAlgebra algebra = new TemporalAlgebra(context, calculator, spatialStore)) {
 *     AlgebraResult result = algebra.execute("C = A {+,equal,l} B", options);
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-22
 * @version 1.0
 */
public class TemporalAlgebra implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TemporalAlgebra.class);

    private final TemporalContext context;
    private final SpatialDataStore spatialStore;
    private final AlgebraExecutor executor;

    public TemporalAlgebra(TemporalContext context, RasterCalculator calculator, SpatialDataStore spatialStore) {
        this(context, calculator, spatialStore, null);
    }

    public TemporalAlgebra(TemporalContext context, RasterCalculator calculator, SpatialDataStore spatialStore,
                           Vertx vertx) {
        this.context = context;
        this.spatialStore = spatialStore;
        this.executor = new AlgebraExecutor(context, calculator, spatialStore, vertx);
    }

    /**
     * Parses and lowers a statement without running anything.
     *
     * @return the planned result maps with their calculator substitutions
     */
    public List<AlgebraMap> plan(String statement, AlgebraOptions options) {
        return plan(AlgebraParser.parse(statement), options);
    }

    public AlgebraResult execute(String statement, AlgebraOptions options) {
        Assignment assignment = AlgebraParser.parse(statement);
        List<AlgebraMap> maps = plan(assignment, options);
        logger.info("Computing {} maps for <{}> with {} processes", maps.size(), assignment.target(),
            options.nprocs());
        return executor.execute(assignment.target(), maps, options);
    }

    private List<AlgebraMap> plan(Assignment assignment, AlgebraOptions options) {
        StoreDatasetResolver resolver = new StoreDatasetResolver(context.getStore(), spatialStore, options.kind(),
            context.getMapset());
        Operand result = new AlgebraEvaluator(resolver, options.spatial()).evaluate(assignment.expression());
        if (result.isScalar()) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.ALGEBRA_SYNTAX_ERROR,
                "Expression for <" + assignment.target() + "> does not reference any space time dataset");
        }
        return result.getMaps();
    }

    @Override
    public void close() {
        executor.close();
    }
}
