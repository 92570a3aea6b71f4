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
 * A named, typed collection of maps together with its aggregate metadata.
 * <p>
 * {@link #getMapCounter()} tracks registrations made through this instance; it is
 * resynchronised with the persisted {@link #getNumberOfMaps()} whenever metadata is
 * loaded or recomputed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class SpaceTimeDataset {

    public static final String DEFAULT_SEMANTIC_TYPE = "mean";

    private final DatasetKind kind;
    private final String name;
    private final String mapset;

    private TemporalType temporalType;
    private String semanticType = DEFAULT_SEMANTIC_TYPE;
    private String title;
    private String description;
    private CalendarUnit relativeUnit;
    private String mapRegister;
    private Integer numberOfMaps;
    private SpatialExtent spatialExtent;
    private TemporalExtent temporalExtent;
    private Granularity granularity;
    private MapTime mapTime;
    private String creator;
    private LocalDateTime creationTime;
    private LocalDateTime modificationTime;
    private int mapCounter;

    public SpaceTimeDataset(DatasetKind kind, String name, String mapset) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.mapset = Objects.requireNonNull(mapset, "mapset must not be null");
    }

    public String getId() {
        return name + "@" + mapset;
    }

    /** True while no map has been registered, neither persisted nor in this session. */
    public boolean isEmpty() {
        return (numberOfMaps == null || numberOfMaps == 0) && mapCounter == 0;
    }

    public DatasetKind getKind() { return kind; }
    public String getName() { return name; }
    public String getMapset() { return mapset; }

    public TemporalType getTemporalType() { return temporalType; }
    public void setTemporalType(TemporalType temporalType) { this.temporalType = temporalType; }

    public String getSemanticType() { return semanticType; }
    public void setSemanticType(String semanticType) { this.semanticType = semanticType; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    /** Unit of relative time, fixed by the first registered map. */
    public CalendarUnit getRelativeUnit() { return relativeUnit; }
    public void setRelativeUnit(CalendarUnit relativeUnit) { this.relativeUnit = relativeUnit; }

    /** Name of the table listing the member maps; null until the first registration. */
    public String getMapRegister() { return mapRegister; }
    public void setMapRegister(String mapRegister) { this.mapRegister = mapRegister; }

    public Integer getNumberOfMaps() { return numberOfMaps; }
    public void setNumberOfMaps(Integer numberOfMaps) { this.numberOfMaps = numberOfMaps; }

    public SpatialExtent getSpatialExtent() { return spatialExtent; }
    public void setSpatialExtent(SpatialExtent spatialExtent) { this.spatialExtent = spatialExtent; }

    public TemporalExtent getTemporalExtent() { return temporalExtent; }
    public void setTemporalExtent(TemporalExtent temporalExtent) { this.temporalExtent = temporalExtent; }

    public Granularity getGranularity() { return granularity; }
    public void setGranularity(Granularity granularity) { this.granularity = granularity; }

    public MapTime getMapTime() { return mapTime; }
    public void setMapTime(MapTime mapTime) { this.mapTime = mapTime; }

    public String getCreator() { return creator; }
    public void setCreator(String creator) { this.creator = creator; }

    public LocalDateTime getCreationTime() { return creationTime; }
    public void setCreationTime(LocalDateTime creationTime) { this.creationTime = creationTime; }

    public LocalDateTime getModificationTime() { return modificationTime; }
    public void setModificationTime(LocalDateTime modificationTime) { this.modificationTime = modificationTime; }

    public int getMapCounter() { return mapCounter; }
    public void setMapCounter(int mapCounter) { this.mapCounter = mapCounter; }

    public void incrementMapCounter() { mapCounter++; }

    public void decrementMapCounter() {
        if (mapCounter > 0) {
            mapCounter--;
        }
    }

    @Override
    public String toString() {
        return "SpaceTimeDataset{id=" + getId() + ", kind=" + kind.getDatasetType()
            + ", temporalType=" + temporalType + ", numberOfMaps=" + numberOfMaps + "}";
    }
}
