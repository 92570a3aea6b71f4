package dev.mars.spacetime.api.model;

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
import dev.mars.spacetime.api.error.TemporalSyntaxException;

import java.util.Locale;

/**
 * The closed set of map kinds a space-time dataset can hold. Each kind knows the
 * table prefix of its maps and of its datasets, whether its spatial extent is
 * three dimensional, and how to create a new map instance.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public enum DatasetKind {

    RASTER("raster", "strds", false, "rast", "r"),
    RASTER3D("raster3d", "str3ds", true, "rast3d", "raster_3d", "r3"),
    VECTOR("vector", "stvds", false, "vect", "v");

    private final String mapType;
    private final String datasetType;
    private final boolean threeDimensional;
    private final String[] aliases;

    DatasetKind(String mapType, String datasetType, boolean threeDimensional, String... aliases) {
        this.mapType = mapType;
        this.datasetType = datasetType;
        this.threeDimensional = threeDimensional;
        this.aliases = aliases;
    }

    /** Map table prefix, e.g. {@code raster}. */
    public String getMapType() {
        return mapType;
    }

    /** Dataset table prefix, e.g. {@code strds}. */
    public String getDatasetType() {
        return datasetType;
    }

    public boolean isThreeDimensional() {
        return threeDimensional;
    }

    /**
     * Creates an empty map of this kind.
     */
    public MapDataset newMap(String name, String mapset) {
        return new MapDataset(this, name, null, mapset);
    }

    /**
     * Creates an empty map of this kind from a full id {@code name[:layer]@mapset}.
     */
    public MapDataset newMap(String id, String defaultMapset, boolean allowLayer) {
        DatasetId parsed = DatasetId.parse(id, defaultMapset);
        String layer = allowLayer && this == VECTOR ? parsed.layer() : null;
        return new MapDataset(this, parsed.name(), layer, parsed.mapset());
    }

    /**
     * Creates an empty dataset of this kind.
     */
    public SpaceTimeDataset newDataset(String name, String mapset) {
        return new SpaceTimeDataset(this, name, mapset);
    }

    /**
     * Resolves a map or dataset type name (strds, raster, rast, stvds, vector ...).
     */
    public static DatasetKind fromTypeName(String typeName) {
        if (typeName == null) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_DATASET_TYPE, "Dataset type must not be null");
        }
        String lower = typeName.trim().toLowerCase(Locale.ROOT);
        for (DatasetKind kind : values()) {
            if (kind.mapType.equals(lower) || kind.datasetType.equals(lower)) {
                return kind;
            }
            for (String alias : kind.aliases) {
                if (alias.equals(lower)) {
                    return kind;
                }
            }
        }
        throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_DATASET_TYPE,
            "Unknown dataset type '" + typeName + "'");
    }
}
