package dev.mars.spacetime.algebra.extract;

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
import dev.mars.spacetime.algebra.exec.AlgebraExecutor;
import dev.mars.spacetime.algebra.exec.AlgebraOptions;
import dev.mars.spacetime.algebra.exec.AlgebraResult;
import dev.mars.spacetime.api.external.RasterCalculator;
import dev.mars.spacetime.api.external.SpatialDataStore;
import dev.mars.spacetime.api.model.DatasetId;
import dev.mars.spacetime.api.model.MapDataset;
import dev.mars.spacetime.api.model.SpaceTimeDataset;
import dev.mars.spacetime.db.TemporalContext;
import dev.mars.spacetime.temporal.registration.MapRegistrationManager;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a subset of a space time dataset into a new dataset.
 * <p>
 * Maps are selected with a SQL predicate over the map columns. Without an
 * expression the selected maps themselves are registered in the output. With
 * an expression every occurrence of the input dataset name is replaced by the
 * map id and the result is computed as {@code basename_i} with the raster
 * calculator, keeping the time stamp of the source map.
 *
 * <pre>{@code
 * try (DatasetExtractor extractor = new DatasetExtractor(context, calculator, spatialStore)) {
 *     extractor.extract("precip_abs1", "precip_abs2", "start_time > '2001-06-01'",
 *         "if(precip_abs1 > 400, precip_abs1, null())", options);
 * }
 * }</pre>
 */
public class DatasetExtractor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DatasetExtractor.class);

    private final TemporalContext context;
    private final MapRegistrationManager manager;
    private final AlgebraExecutor executor;

    public DatasetExtractor(TemporalContext context, RasterCalculator calculator, SpatialDataStore spatialStore) {
        this(context, calculator, spatialStore, null);
    }

    public DatasetExtractor(TemporalContext context, RasterCalculator calculator, SpatialDataStore spatialStore,
                            Vertx vertx) {
        this.context = context;
        this.manager = new MapRegistrationManager(context);
        this.executor = new AlgebraExecutor(context, calculator, spatialStore, vertx);
    }

    /**
     * @param where      SQL predicate over the map columns, null selects all maps
     * @param expression calculator expression over the input dataset name, null to copy the selection
     */
    public AlgebraResult extract(String input, String output, String where, String expression,
                                 AlgebraOptions options) {
        String mapset = context.getMapset();
        SpaceTimeDataset source = manager.loadDataset(options.kind(), DatasetId.parse(input, mapset).toString());
        List<MapDataset> selected = context.getStore().selectRegisteredMaps(source, blankToNull(where), "start_time");
        if (selected.isEmpty()) {
            logger.warn("No maps selected from <{}>", source.getId());
        }

        if (expression == null || expression.trim().isEmpty()) {
            return copySelection(source, output, selected, options.overwrite());
        }

        List<AlgebraMap> maps = new ArrayList<>();
        for (MapDataset map : selected) {
            maps.add(AlgebraMap.of(map).withCommand(substitute(expression, source, map.getId())));
        }
        logger.info("Extracting {} maps from <{}> into <{}> with {} processes", maps.size(), source.getId(),
            output, options.nprocs());
        return executor.execute(output, maps, options);
    }

    private AlgebraResult copySelection(SpaceTimeDataset source, String output, List<MapDataset> selected,
                                        boolean overwrite) {
        SpaceTimeDataset target = source.getKind().newDataset(
            DatasetId.parse(output, context.getMapset()).name(), context.getMapset());
        target.setTemporalType(source.getTemporalType());
        target.setSemanticType(source.getSemanticType());
        target.setTitle(source.getTitle());
        target.setDescription(source.getDescription());
        manager.createDataset(target, overwrite);

        List<MapDataset> registered = new ArrayList<>();
        for (MapDataset map : selected) {
            if (manager.registerMap(target, map)) {
                registered.add(map);
            }
        }
        manager.updateFromRegisteredMaps(target);
        logger.info("Extracted {} maps from <{}> into <{}>", registered.size(), source.getId(), target.getId());
        return new AlgebraResult(target, registered, Collections.emptyList(), Collections.emptyList());
    }

    /**
     * Replaces the input dataset, by name or full id, with {@code mapId}.
     */
    static String substitute(String expression, SpaceTimeDataset source, String mapId) {
        Pattern reference = Pattern.compile("(?<![\\w.@])" + Pattern.quote(source.getName())
            + "(@" + Pattern.quote(source.getMapset()) + ")?(?![\\w.@])");
        return reference.matcher(expression).replaceAll(Matcher.quoteReplacement(mapId));
    }

    private static String blankToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value;
    }

    @Override
    public void close() {
        executor.close();
    }
}
