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

import dev.mars.spacetime.api.model.SpatialExtent;

/**
 * Metadata read from the spatial data store for a single map.
 *
 * @param spatialExtent bounding box of the map
 * @param minValue      minimum cell or attribute value, null for empty maps
 * @param maxValue      maximum cell or attribute value, null for empty maps
 */
public record MapInfo(SpatialExtent spatialExtent, Double minValue, Double maxValue) {

    public boolean isNullMap() {
        return minValue == null && maxValue == null;
    }
}
