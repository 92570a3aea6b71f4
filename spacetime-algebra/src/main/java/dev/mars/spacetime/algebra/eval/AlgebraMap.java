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

import dev.mars.spacetime.api.model.MapDataset;
import dev.mars.spacetime.api.model.SpatialExtent;
import dev.mars.spacetime.api.model.TemporalExtent;
import dev.mars.spacetime.api.model.TimeStamped;

import java.util.Objects;

/**
 * Immutable working map of an evaluation pass: the extents a result map will
 * get and the calculator command producing it. Every pass creates new
 * instances, so input maps are never shared between results.
 */
public final class AlgebraMap implements TimeStamped {

    private final String mapId;
    private final TemporalExtent temporalExtent;
    private final SpatialExtent spatialExtent;
    private final boolean threeDimensional;
    private final String command;

    private AlgebraMap(String mapId, TemporalExtent temporalExtent, SpatialExtent spatialExtent,
                       boolean threeDimensional, String command) {
        this.mapId = mapId;
        this.temporalExtent = Objects.requireNonNull(temporalExtent, "temporalExtent must not be null");
        this.spatialExtent = spatialExtent;
        this.threeDimensional = threeDimensional;
        this.command = command;
    }

    /** Working copy of a registered map, referenced by its id. */
    public static AlgebraMap of(MapDataset map) {
        return new AlgebraMap(map.getId(), map.getTemporalExtent(), map.getSpatialExtent(),
            map.isThreeDimensional(), null);
    }

    public static AlgebraMap of(String mapId, TemporalExtent temporalExtent, SpatialExtent spatialExtent) {
        return new AlgebraMap(mapId, temporalExtent, spatialExtent, false, null);
    }

    public AlgebraMap withCommand(String newCommand) {
        return new AlgebraMap(mapId, temporalExtent, spatialExtent, threeDimensional, newCommand);
    }

    public AlgebraMap withExtents(TemporalExtent newTemporal, SpatialExtent newSpatial) {
        return new AlgebraMap(mapId, newTemporal, newSpatial, threeDimensional, command);
    }

    /** Text standing for this map inside a larger command: its command, or its id when unchanged. */
    public String substitution() {
        return command != null ? command : mapId;
    }

    public boolean hasCommand() {
        return command != null;
    }

    /** Id of the map this working map was derived from. */
    public String getMapId() {
        return mapId;
    }

    public String getCommand() {
        return command;
    }

    @Override
    public TemporalExtent getTemporalExtent() {
        return temporalExtent;
    }

    @Override
    public SpatialExtent getSpatialExtent() {
        return spatialExtent;
    }

    @Override
    public boolean isThreeDimensional() {
        return threeDimensional;
    }

    @Override
    public String toString() {
        return "AlgebraMap{" + substitution() + " " + temporalExtent + "}";
    }
}
