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
import dev.mars.spacetime.api.external.MapInfo;
import dev.mars.spacetime.api.external.SpatialDataStore;
import dev.mars.spacetime.api.model.MapDataset;
import dev.mars.spacetime.api.model.SpaceTimeDataset;
import dev.mars.spacetime.db.store.DatasetStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Registers a list of maps in a dataset, inserting maps that are not yet in the
 * temporal database. Metadata is recomputed once after the last map.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-17
 * @version 1.0
 */
public class BulkRegistration {
    private static final Logger logger = LoggerFactory.getLogger(BulkRegistration.class);

    private final MapRegistrationManager manager;
    private final SpatialDataStore spatialStore;

    public BulkRegistration(MapRegistrationManager manager, SpatialDataStore spatialStore) {
        this.manager = manager;
        this.spatialStore = spatialStore;
    }

    /**
     * @param mapIds map ids, the dataset's mapset is used where none is given
     * @return number of maps newly registered
     */
    public int registerMaps(SpaceTimeDataset dataset, List<String> mapIds, TimeStampOptions options) {
        DatasetStore store = manager.getStore();
        int registered = 0;
        for (int i = 0; i < mapIds.size(); i++) {
            MapDataset map = dataset.getKind().newMap(mapIds.get(i).trim(), dataset.getMapset(), true);
            if (!spatialStore.mapExists(map.getKind(), map.getId())) {
                throw new ConsistencyViolationException(SpaceTimeErrorCodes.MAP_NOT_FOUND,
                    "Unable to find " + map.getKind().getMapType() + " map <" + map.getId() + ">");
            }

            Optional<MapDataset> stored = store.selectMap(map.getKind(), map.getId());
            if (options.assignsTime()) {
                MapDataset target = stored.orElse(map);
                target.setTemporalExtent(options.timeStampFor(i));
                applyMapInfo(target, spatialStore.readMapInfo(target.getKind(), target.getId()));
                if (stored.isPresent()) {
                    store.updateMap(target);
                } else {
                    store.insertMap(target);
                }
                map = target;
            } else if (stored.isEmpty()) {
                throw new ConsistencyViolationException(SpaceTimeErrorCodes.INVALID_TIME_STAMP,
                    "Unable to register " + map.getKind().getMapType() + " map <" + map.getId()
                        + ">. The map has no valid time and the start time is not set.");
            } else {
                map = stored.get();
            }

            if (manager.registerMap(dataset, map)) {
                registered++;
            }
            logger.debug("Processed map {} of {}: {}", i + 1, mapIds.size(), map.getId());
        }
        manager.updateFromRegisteredMaps(dataset);
        logger.info("Registered {} of {} maps in space time dataset <{}>", registered, mapIds.size(), dataset.getId());
        return registered;
    }

    static void applyMapInfo(MapDataset map, MapInfo info) {
        if (info == null) {
            return;
        }
        map.setSpatialExtent(info.spatialExtent());
        map.setMinValue(info.minValue());
        map.setMaxValue(info.maxValue());
    }
}
