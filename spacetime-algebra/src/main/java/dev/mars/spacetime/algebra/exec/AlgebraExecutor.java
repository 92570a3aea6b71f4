package dev.mars.spacetime.algebra.exec;

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
import dev.mars.spacetime.api.error.ComputationFailedException;
import dev.mars.spacetime.api.error.ConsistencyViolationException;
import dev.mars.spacetime.api.error.SpaceTimeErrorCodes;
import dev.mars.spacetime.api.external.MapInfo;
import dev.mars.spacetime.api.external.RasterCalculator;
import dev.mars.spacetime.api.external.SpatialDataStore;
import dev.mars.spacetime.api.model.DatasetId;
import dev.mars.spacetime.api.model.DatasetKind;
import dev.mars.spacetime.api.model.MapDataset;
import dev.mars.spacetime.api.model.SpaceTimeDataset;
import dev.mars.spacetime.api.model.TemporalType;
import dev.mars.spacetime.db.TemporalContext;
import dev.mars.spacetime.db.metrics.SpaceTimeMetrics;
import dev.mars.spacetime.db.store.DatasetStore;
import dev.mars.spacetime.temporal.registration.MapRegistrationManager;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Materializes the result of an algebra expression.
 * <p>
 * All planned output names are checked before any job starts. The calculator
 * jobs then run on a shared Vert.x worker pool sized by
 * {@link AlgebraOptions#nprocs()} and are joined before anything is written to
 * the temporal database. A single failing job aborts the run. Results that
 * hold no data are removed unless null maps are to be registered.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-22
 * @version 1.0
 */
public class AlgebraExecutor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AlgebraExecutor.class);

    private static final String POOL_NAME = "spacetime-algebra-pool";

    private final TemporalContext context;
    private final MapRegistrationManager manager;
    private final RasterCalculator calculator;
    private final SpatialDataStore spatialStore;
    private final Vertx vertx;
    private final boolean vertxOwnedByExecutor;

    public AlgebraExecutor(TemporalContext context, RasterCalculator calculator, SpatialDataStore spatialStore) {
        this(context, calculator, spatialStore, null);
    }

    /**
     * @param vertx an externally owned Vert.x instance, or null to create and own one
     */
    public AlgebraExecutor(TemporalContext context, RasterCalculator calculator, SpatialDataStore spatialStore,
                           Vertx vertx) {
        this.context = context;
        this.manager = new MapRegistrationManager(context);
        this.calculator = calculator;
        this.spatialStore = spatialStore;
        if (vertx != null) {
            this.vertx = vertx;
            this.vertxOwnedByExecutor = false;
            logger.debug("Using provided Vert.x instance (external ownership)");
        } else {
            this.vertx = Vertx.vertx();
            this.vertxOwnedByExecutor = true;
            logger.debug("Created new Vert.x instance (executor ownership)");
        }
    }

    /**
     * Computes every map of {@code maps} as {@code basename_i} and registers the
     * results in a new dataset named {@code target}.
     *
     * @throws ConsistencyViolationException if an output exists and overwrite is not set
     * @throws ComputationFailedException if any calculator job fails
     */
    public AlgebraResult execute(String target, List<AlgebraMap> maps, AlgebraOptions options) {
        DatasetKind kind = options.kind();
        String mapset = context.getMapset();
        DatasetStore store = context.getStore();
        SpaceTimeDataset dataset = kind.newDataset(DatasetId.parse(target, mapset).name(), mapset);

        if (store.datasetExists(kind, dataset.getId()) && !options.overwrite()) {
            throw new ConsistencyViolationException(SpaceTimeErrorCodes.OUTPUT_EXISTS,
                "Space time " + kind.getDatasetType() + " dataset <" + dataset.getId()
                    + "> is already in the database. Use the overwrite flag.");
        }

        List<String> outputs = new ArrayList<>();
        List<String> expressions = new ArrayList<>();
        for (int i = 0; i < maps.size(); i++) {
            String name = options.basename() + "_" + i;
            String id = name + "@" + mapset;
            if (spatialStore.mapExists(kind, id) && !options.overwrite()) {
                throw new ConsistencyViolationException(SpaceTimeErrorCodes.OUTPUT_EXISTS,
                    "Error maps with basename " + options.basename() + " exist (" + id + "). Use the overwrite flag.");
            }
            outputs.add(id);
            expressions.add(name + " = " + maps.get(i).substitution());
        }

        runJobs(outputs, expressions, options);

        dataset.setTemporalType(maps.isEmpty() ? TemporalType.ABSOLUTE : maps.get(0).getTemporalExtent().getType());
        dataset.setSemanticType(SpaceTimeDataset.DEFAULT_SEMANTIC_TYPE);
        dataset.setTitle(target);
        dataset.setDescription(target);
        manager.createDataset(dataset, options.overwrite());

        List<MapDataset> registered = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        for (int i = 0; i < outputs.size(); i++) {
            String id = outputs.get(i);
            MapInfo info = spatialStore.readMapInfo(kind, id);
            if (info.isNullMap() && !options.registerNull()) {
                logger.debug("Result map <{}> holds no data and is not registered", id);
                removed.add(id);
                continue;
            }
            MapDataset map = resultMap(kind, id, maps.get(i), info);
            Optional<MapDataset> stored = store.selectMap(kind, id);
            if (stored.isPresent()) {
                if (!options.overwrite()) {
                    throw new ConsistencyViolationException(SpaceTimeErrorCodes.OUTPUT_EXISTS,
                        kind.getMapType() + " map <" + id + "> exists in the temporal database. Use the overwrite flag.");
                }
                map.setStdsRegister(stored.get().getStdsRegister());
                store.updateMap(map);
            } else {
                store.insertMap(map);
            }
            manager.registerMap(dataset, map);
            registered.add(map);
        }
        manager.updateFromRegisteredMaps(dataset);

        if (!removed.isEmpty()) {
            spatialStore.removeMaps(kind, removed);
        }
        logger.info("Temporal algebra created <{}> with {} maps ({} empty results removed)", dataset.getId(),
            registered.size(), removed.size());
        return new AlgebraResult(dataset, registered, removed, expressions);
    }

    private static MapDataset resultMap(DatasetKind kind, String id, AlgebraMap source, MapInfo info) {
        MapDataset map = kind.newMap(id, null, false);
        map.setTemporalExtent(source.getTemporalExtent());
        map.setSpatialExtent(info.spatialExtent() != null ? info.spatialExtent() : source.getSpatialExtent());
        map.setMinValue(info.minValue());
        map.setMaxValue(info.maxValue());
        return map;
    }

    /**
     * Runs all jobs on the worker pool and waits for every one of them.
     */
    private void runJobs(List<String> outputs, List<String> expressions, AlgebraOptions options) {
        if (expressions.isEmpty()) {
            logger.warn("The expression produced no maps, nothing to compute");
            return;
        }
        WorkerExecutor workers = vertx.createSharedWorkerExecutor(POOL_NAME, options.nprocs());
        List<Future<Integer>> jobs = new ArrayList<>();
        try {
            for (int i = 0; i < expressions.size(); i++) {
                String output = outputs.get(i);
                String expression = expressions.get(i);
                jobs.add(workers.executeBlocking(() -> {
                    try (MDC.MDCCloseable ignored = MDC.putCloseable("spacetime.output", output)) {
                        logger.debug("Running calculator job: {}", expression);
                        return calculator.compute(expression, options.overwrite());
                    }
                }, false));
            }
            awaitAll(jobs);
        } finally {
            workers.close();
        }

        List<String> failed = new ArrayList<>();
        for (int i = 0; i < jobs.size(); i++) {
            Future<Integer> job = jobs.get(i);
            if (job.failed()) {
                logger.error("Error computing map <{}>", outputs.get(i), job.cause());
                failed.add(outputs.get(i));
            } else if (job.result() != 0) {
                logger.error("Error computing map <{}>: calculator exited with code {}", outputs.get(i), job.result());
                failed.add(outputs.get(i));
            }
        }
        SpaceTimeMetrics metrics = context.getMetrics();
        if (metrics != null) {
            metrics.recordAlgebraJobs(jobs.size(), failed.size());
        }
        if (!failed.isEmpty()) {
            throw new ComputationFailedException("Error while computing " + failed.size() + " of " + jobs.size()
                + " maps: " + String.join(", ", failed), failed);
        }
    }

    /** Joins every job, successful or not. */
    private static void awaitAll(List<Future<Integer>> jobs) {
        try {
            Future.join(new ArrayList<>(jobs))
                .toCompletionStage()
                .toCompletableFuture()
                .get(1, TimeUnit.HOURS);
        } catch (ExecutionException e) {
            logger.debug("At least one calculator job failed: {}", e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ComputationFailedException("Interrupted while waiting for calculator jobs", e);
        } catch (TimeoutException e) {
            throw new ComputationFailedException("Timed out waiting for calculator jobs", e);
        }
    }

    @Override
    public void close() {
        if (!vertxOwnedByExecutor) {
            logger.debug("Skipping Vert.x close (external ownership)");
            return;
        }
        try {
            vertx.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while closing Vert.x instance");
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("Error closing Vert.x instance", e);
        }
    }
}
