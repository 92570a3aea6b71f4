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

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A single map registered in the temporal database. A map without a name is a
 * gap placeholder that only carries a temporal extent.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class MapDataset implements TimeStamped {

    private final DatasetKind kind;
    private final String name;
    private final String layer;
    private final String mapset;

    private TemporalExtent temporalExtent;
    private SpatialExtent spatialExtent;
    private String stdsRegister;
    private Double minValue;
    private Double maxValue;
    private String creator;
    private LocalDateTime creationTime;

    public MapDataset(DatasetKind kind, String name, String layer, String mapset) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.name = name;
        this.layer = layer;
        this.mapset = mapset;
    }

    /**
     * Creates a gap placeholder covering {@code extent}.
     */
    public static MapDataset gap(DatasetKind kind, TemporalExtent extent) {
        MapDataset gap = new MapDataset(kind, null, null, null);
        gap.setTemporalExtent(extent);
        return gap;
    }

    /**
     * Full identifier {@code name[:layer]@mapset}, or null for gaps.
     */
    public String getId() {
        if (name == null) {
            return null;
        }
        return layer != null ? name + ":" + layer + "@" + mapset : name + "@" + mapset;
    }

    public boolean isGap() {
        return name == null;
    }

    /** Maps whose value range is empty hold no data. */
    public boolean isNullMap() {
        return minValue == null && maxValue == null;
    }

    @Override
    public boolean isThreeDimensional() {
        return kind.isThreeDimensional();
    }

    public TemporalType getTemporalType() {
        return temporalExtent == null ? null : temporalExtent.getType();
    }

    /**
     * Field-by-field copy; the copy shares no mutable state with this map.
     */
    public MapDataset copy() {
        MapDataset copy = new MapDataset(kind, name, layer, mapset);
        copy.temporalExtent = temporalExtent;
        copy.spatialExtent = spatialExtent;
        copy.stdsRegister = stdsRegister;
        copy.minValue = minValue;
        copy.maxValue = maxValue;
        copy.creator = creator;
        copy.creationTime = creationTime;
        return copy;
    }

    public DatasetKind getKind() { return kind; }
    public String getName() { return name; }
    public String getLayer() { return layer; }
    public String getMapset() { return mapset; }

    @Override
    public TemporalExtent getTemporalExtent() { return temporalExtent; }
    public void setTemporalExtent(TemporalExtent temporalExtent) { this.temporalExtent = temporalExtent; }

    @Override
    public SpatialExtent getSpatialExtent() { return spatialExtent; }
    public void setSpatialExtent(SpatialExtent spatialExtent) { this.spatialExtent = spatialExtent; }

    /** Name of the table listing the datasets this map is registered in. */
    public String getStdsRegister() { return stdsRegister; }
    public void setStdsRegister(String stdsRegister) { this.stdsRegister = stdsRegister; }

    public Double getMinValue() { return minValue; }
    public void setMinValue(Double minValue) { this.minValue = minValue; }

    public Double getMaxValue() { return maxValue; }
    public void setMaxValue(Double maxValue) { this.maxValue = maxValue; }

    public String getCreator() { return creator; }
    public void setCreator(String creator) { this.creator = creator; }

    public LocalDateTime getCreationTime() { return creationTime; }
    public void setCreationTime(LocalDateTime creationTime) { this.creationTime = creationTime; }

    @Override
    public String toString() {
        return "MapDataset{id=" + getId() + ", kind=" + kind.getMapType() + ", time=" + temporalExtent + "}";
    }
}
