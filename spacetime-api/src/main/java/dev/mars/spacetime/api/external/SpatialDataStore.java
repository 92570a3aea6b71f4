package dev.mars.spacetime.api.external;

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

import dev.mars.spacetime.api.model.DatasetKind;

import java.util.List;

/**
 * The native spatial database holding the map contents. The engine only asks
 * whether maps exist, reads their extent and value range, and removes empty
 * results.
 */
public interface SpatialDataStore {

    /**
     * @param mapId full id {@code name@mapset}
     */
    boolean mapExists(DatasetKind kind, String mapId);

    MapInfo readMapInfo(DatasetKind kind, String mapId);

    /**
     * Univariate statistics of a raster or 3D raster map.
     *
     * @param extended also compute quartiles and the 90th percentile
     */
    UnivarStatistics readStatistics(DatasetKind kind, String mapId, boolean extended);

    void removeMaps(DatasetKind kind, List<String> mapIds);
}
