package dev.mars.spacetime.algebra.eval;

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
import dev.mars.spacetime.api.external.SpatialDataStore;
import dev.mars.spacetime.api.model.DatasetId;
import dev.mars.spacetime.api.model.DatasetKind;
import dev.mars.spacetime.api.model.MapDataset;
import dev.mars.spacetime.api.model.SpaceTimeDataset;
import dev.mars.spacetime.db.store.DatasetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves operands from the temporal database and checks that every input map
 * is present in the spatial database.
 */
public class StoreDatasetResolver implements DatasetResolver {
    private static final Logger logger = LoggerFactory.getLogger(StoreDatasetResolver.class);

    private final DatasetStore store;
    private final SpatialDataStore spatialStore;
    private final DatasetKind kind;
    private final String mapset;

    public StoreDatasetResolver(DatasetStore store, SpatialDataStore spatialStore, DatasetKind kind, String mapset) {
        this.store = store;
        this.spatialStore = spatialStore;
        this.kind = kind;
        this.mapset = mapset;
    }

    @Override
    public List<AlgebraMap> resolveDataset(String name) {
        String id = DatasetId.parse(name, mapset).toString();
        SpaceTimeDataset dataset = store.selectDataset(kind, id).orElseThrow(() -> new SpaceTimeException(
            SpaceTimeErrorCodes.DATASET_NOT_FOUND,
            "Space time " + kind.getDatasetType() + " dataset <" + id + "> not found"));

        List<AlgebraMap> maps = new ArrayList<>();
        for (MapDataset map : store.selectRegisteredMaps(dataset, null, "start_time")) {
            requireMap(map.getId());
            maps.add(AlgebraMap.of(map));
        }
        logger.debug("Resolved <{}> to {} maps", id, maps.size());
        return maps;
    }

    @Override
    public String resolveMap(String name) {
        String id = DatasetId.parse(name, mapset).toString();
        requireMap(id);
        return id;
    }

    private void requireMap(String id) {
        if (!spatialStore.mapExists(kind, id)) {
            throw new ConsistencyViolationException(SpaceTimeErrorCodes.MAP_NOT_FOUND,
                kind.getMapType() + " map <" + id + "> not found in the spatial database");
        }
    }
}
