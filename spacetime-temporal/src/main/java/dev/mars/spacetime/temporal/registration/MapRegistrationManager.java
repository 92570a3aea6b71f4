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

import dev.mars.spacetime.api.database.SqlStatement;
import dev.mars.spacetime.api.database.TemporalDatabase;
import dev.mars.spacetime.api.error.ConsistencyViolationException;
import dev.mars.spacetime.api.error.SpaceTimeErrorCodes;
import dev.mars.spacetime.api.error.SpaceTimeException;
import dev.mars.spacetime.api.model.AbsoluteTemporalExtent;
import dev.mars.spacetime.api.model.CalendarUnit;
import dev.mars.spacetime.api.model.DatasetId;
import dev.mars.spacetime.api.model.DatasetKind;
import dev.mars.spacetime.api.model.MapDataset;
import dev.mars.spacetime.api.model.MapTime;
import dev.mars.spacetime.api.model.RelativeTemporalExtent;
import dev.mars.spacetime.api.model.SpaceTimeDataset;
import dev.mars.spacetime.api.model.SpatialExtent;
import dev.mars.spacetime.api.model.TemporalExtent;
import dev.mars.spacetime.api.model.TemporalType;
import dev.mars.spacetime.db.TemporalContext;
import dev.mars.spacetime.db.metrics.SpaceTimeMetrics;
import dev.mars.spacetime.db.store.DatasetStore;
import dev.mars.spacetime.db.util.SqlIdentifierValidator;
import dev.mars.spacetime.temporal.granularity.GranularityCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maintains the membership of maps in space time datasets and the aggregate
 * metadata derived from it.
 * <p>
 * Membership is stored twice: the dataset register lists its member maps and
 * the map register lists the datasets a map belongs to. Both sides are always
 * written in one transaction. Registration tables are created lazily with
 * {@code CREATE TABLE IF NOT EXISTS} ahead of that transaction.
 * <p>
 * After any membership change callers must run {@link #updateFromRegisteredMaps}
 * to refresh extents, granularity and map time classification.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-16
 * @version 1.0
 */
public class MapRegistrationManager {
    private static final Logger logger = LoggerFactory.getLogger(MapRegistrationManager.class);

    private final DatasetStore store;
    private final TemporalDatabase database;
    private final SpaceTimeMetrics metrics;

    public MapRegistrationManager(TemporalContext context) {
        this(context.getStore(), context.getMetrics());
    }

    public MapRegistrationManager(DatasetStore store, SpaceTimeMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.database = store.getDatabase();
        this.metrics = metrics;
    }

    public DatasetStore getStore() {
        return store;
    }

    /**
     * Creates an empty dataset. An existing dataset with the same id is deleted
     * first when {@code overwrite} is set, otherwise creation fails.
     */
    public SpaceTimeDataset createDataset(SpaceTimeDataset dataset, boolean overwrite) {
        DatasetId.requireLegalName(dataset.getName());
        if (store.datasetExists(dataset.getKind(), dataset.getId())) {
            if (!overwrite) {
                throw new ConsistencyViolationException(SpaceTimeErrorCodes.OUTPUT_EXISTS,
                    "Space time " + dataset.getKind().getDatasetType() + " dataset <" + dataset.getId()
                        + "> is already in the database. Use the overwrite flag.");
            }
            SpaceTimeDataset existing = loadDataset(dataset.getKind(), dataset.getId());
            logger.info("Overwriting space time dataset {}", existing.getId());
            delete(existing, true);
        }
        store.insertDataset(dataset);
        return dataset;
    }

    /**
     * @throws SpaceTimeException with {@link SpaceTimeErrorCodes#DATASET_NOT_FOUND} if absent
     */
    public SpaceTimeDataset loadDataset(DatasetKind kind, String datasetId) {
        return store.selectDataset(kind, datasetId).orElseThrow(() -> new SpaceTimeException(
            SpaceTimeErrorCodes.DATASET_NOT_FOUND,
            "Space time " + kind.getDatasetType() + " dataset <" + datasetId + "> not found"));
    }

    /**
     * Registers {@code map} in {@code dataset}. All consistency checks run before
     * anything is written.
     *
     * @return false if the map was already registered
     * @throws ConsistencyViolationException if the map is unknown, has invalid
     *         time, lives in another mapset, or its temporal type or relative unit
     *         differs from the dataset's
     */
    public boolean registerMap(SpaceTimeDataset dataset, MapDataset map) {
        MapDataset stored = store.selectMap(map.getKind(), map.getId()).orElseThrow(() ->
            new ConsistencyViolationException(SpaceTimeErrorCodes.MAP_NOT_FOUND,
                "Only maps with absolute or relative valid time can be registered: <" + map.getId()
                    + "> is not in the temporal database"));
        logger.debug("Register {} map <{}> in space time dataset <{}>", stored.getKind().getMapType(),
            stored.getId(), dataset.getId());

        TemporalExtent time = stored.getTemporalExtent();
        if (time == null || !time.isValid()) {
            throw new ConsistencyViolationException(SpaceTimeErrorCodes.INVALID_TIME_STAMP,
                "Map <" + stored.getId() + "> has invalid time");
        }
        if (!Objects.equals(dataset.getMapset(), stored.getMapset())) {
            throw new ConsistencyViolationException(SpaceTimeErrorCodes.MAPSET_MISMATCH,
                "Only maps from the same mapset can be registered: <" + stored.getId() + "> into <"
                    + dataset.getId() + ">");
        }
        if (dataset.getTemporalType() != time.getType()) {
            throw new ConsistencyViolationException(SpaceTimeErrorCodes.TEMPORAL_TYPE_MISMATCH,
                "Temporal type of space time dataset <" + dataset.getId() + "> and map <" + stored.getId()
                    + "> are different");
        }

        boolean adoptUnit = false;
        if (time.getType() == TemporalType.RELATIVE) {
            RelativeTemporalExtent relative = (RelativeTemporalExtent) time;
            boolean empty = (dataset.getNumberOfMaps() == null || dataset.getNumberOfMaps() == 0)
                && dataset.getMapCounter() == 0;
            if (empty) {
                adoptUnit = dataset.getRelativeUnit() != relative.getUnit();
            } else if (dataset.getRelativeUnit() != relative.getUnit()) {
                throw new ConsistencyViolationException(SpaceTimeErrorCodes.RELATIVE_UNIT_MISMATCH,
                    "Relative time units of space time dataset <" + dataset.getId() + "> ("
                        + (dataset.getRelativeUnit() == null ? "none" : dataset.getRelativeUnit().getPlural())
                        + ") and map <" + stored.getId() + "> (" + relative.getUnit().getPlural() + ") are different");
            }
        }

        if (store.isRegistered(dataset.getMapRegister(), stored.getId())) {
            logger.warn("Map <{}> is already registered in space time dataset <{}>", stored.getId(), dataset.getId());
            if (metrics != null) {
                metrics.recordDuplicateRegistration();
            }
            return false;
        }

        String previousMapRegister = stored.getStdsRegister();
        String previousDatasetRegister = dataset.getMapRegister();
        CalendarUnit previousUnit = dataset.getRelativeUnit();
        List<SqlStatement> ddl = new ArrayList<>();
        List<SqlStatement> dml = new ArrayList<>();

        if (adoptUnit) {
            dataset.setRelativeUnit(((RelativeTemporalExtent) time).getUnit());
            dml.add(store.updateDatasetRelativeUnitStatement(dataset));
            logger.debug("Set temporal unit of space time dataset <{}> to {}", dataset.getId(),
                dataset.getRelativeUnit().getPlural());
        }
        if (stored.getStdsRegister() == null) {
            stored.setStdsRegister(SqlIdentifierValidator.mapRegisterTable(dataset.getKind().getDatasetType()));
            ddl.addAll(store.createRegisterTableStatements(stored.getStdsRegister()));
            dml.add(store.updateMapStdsRegisterStatement(stored));
            logger.debug("Created register table <{}> for map <{}>", stored.getStdsRegister(), stored.getId());
        }
        if (dataset.getMapRegister() == null) {
            dataset.setMapRegister(SqlIdentifierValidator.datasetRegisterTable(dataset.getName(), dataset.getMapset(),
                dataset.getKind().getMapType()));
            ddl.addAll(store.createRegisterTableStatements(dataset.getMapRegister()));
            dml.add(store.updateDatasetMapRegisterStatement(dataset));
            logger.debug("Created register table <{}> for space time dataset <{}>", dataset.getMapRegister(),
                dataset.getId());
        }

        try {
            database.executeTransaction(ddl);
            if (!store.isRegistered(stored.getStdsRegister(), dataset.getId())) {
                dml.add(store.insertRegisterEntryStatement(stored.getStdsRegister(), dataset.getId()));
            }
            dml.add(store.insertRegisterEntryStatement(dataset.getMapRegister(), stored.getId()));
            database.executeTransaction(dml);
        } catch (RuntimeException e) {
            stored.setStdsRegister(previousMapRegister);
            dataset.setMapRegister(previousDatasetRegister);
            dataset.setRelativeUnit(previousUnit);
            throw e;
        }

        map.setStdsRegister(stored.getStdsRegister());
        dataset.incrementMapCounter();
        if (metrics != null) {
            metrics.recordMapRegistered();
        }
        return true;
    }

    /**
     * Removes {@code map} from {@code dataset} in both registers.
     *
     * @param execute run the statements; otherwise they are only returned for batching
     * @return the statements removing the membership, empty if the map was not a member
     */
    public List<SqlStatement> unregisterMap(SpaceTimeDataset dataset, MapDataset map, boolean execute) {
        MapDataset stored = store.selectMap(map.getKind(), map.getId()).orElse(map);
        logger.debug("Unregister {} map <{}>", stored.getKind().getMapType(), stored.getId());

        List<SqlStatement> statements = new ArrayList<>();
        if (!store.isRegistered(dataset.getMapRegister(), stored.getId())) {
            logger.warn("Map <{}> is not registered in space time dataset <{}>", stored.getId(), dataset.getId());
            return statements;
        }

        if (stored.getStdsRegister() != null) {
            statements.add(store.deleteRegisterEntryStatement(stored.getStdsRegister(), dataset.getId()));
        }
        statements.add(store.deleteRegisterEntryStatement(dataset.getMapRegister(), stored.getId()));

        if (execute) {
            database.executeTransaction(statements);
            if (metrics != null) {
                metrics.recordMapUnregistered();
            }
        }
        dataset.decrementMapCounter();
        return statements;
    }

    /**
     * Recomputes number of maps, spatial extent, temporal extent, map time and
     * granularity from the current members and persists them in one transaction.
     * A dataset without members has all aggregates cleared.
     */
    public void updateFromRegisteredMaps(SpaceTimeDataset dataset) {
        logger.debug("Update metadata, spatial and temporal extent from all registered maps of <{}>", dataset.getId());
        List<MapDataset> maps = store.selectRegisteredMaps(dataset, null, "start_time");

        dataset.setNumberOfMaps(maps.size());
        dataset.setMapCounter(maps.size());
        dataset.setModificationTime(LocalDateTime.now());

        if (maps.isEmpty()) {
            dataset.setSpatialExtent(null);
            dataset.setTemporalExtent(null);
            dataset.setGranularity(null);
            dataset.setMapTime(null);
        } else {
            List<SpatialExtent> extents = new ArrayList<>();
            int points = 0;
            int intervals = 0;
            int invalid = 0;
            for (MapDataset map : maps) {
                extents.add(map.getSpatialExtent());
                TemporalExtent time = map.getTemporalExtent();
                if (!time.isValid()) {
                    invalid++;
                } else if (time.isPoint()) {
                    points++;
                } else {
                    intervals++;
                }
            }
            dataset.setSpatialExtent(SpatialExtent.unionOf(extents));
            dataset.setTemporalExtent(temporalExtentOf(dataset, maps));
            dataset.setMapTime(MapTime.classify(points, intervals, invalid));
            dataset.setGranularity(dataset.getMapTime() == MapTime.INVALID
                ? null : GranularityCalculator.compute(maps).orElse(null));
        }

        database.executeTransaction(store.updateDatasetMetadataStatements(dataset));
        if (metrics != null) {
            metrics.recordMetadataUpdate();
        }
        logger.debug("Space time dataset <{}>: {} maps, time {}, granularity {}, map time {}", dataset.getId(),
            dataset.getNumberOfMaps(), dataset.getTemporalExtent(), dataset.getGranularity(), dataset.getMapTime());
    }

    /**
     * Minimum start and maximum end of the members. The end falls back to the
     * latest start when no member has an end or the latest end lies before it.
     */
    static TemporalExtent temporalExtentOf(SpaceTimeDataset dataset, List<MapDataset> maps) {
        TemporalExtent minStart = null;
        TemporalExtent maxStart = null;
        TemporalExtent maxEnd = null;
        for (MapDataset map : maps) {
            TemporalExtent time = map.getTemporalExtent();
            if (minStart == null || time.startOrdinal() < minStart.startOrdinal()) {
                minStart = time;
            }
            if (maxStart == null || time.startOrdinal() > maxStart.startOrdinal()) {
                maxStart = time;
            }
            if (time.isInterval() && (maxEnd == null || time.endOrdinal() > maxEnd.endOrdinal())) {
                maxEnd = time;
            }
        }
        boolean useStart = maxEnd == null || maxEnd.endOrdinal() < maxStart.startOrdinal();

        if (dataset.getTemporalType() == TemporalType.ABSOLUTE) {
            LocalDateTime end = useStart
                ? ((AbsoluteTemporalExtent) maxStart).getStart() : ((AbsoluteTemporalExtent) maxEnd).getEnd();
            return new AbsoluteTemporalExtent(((AbsoluteTemporalExtent) minStart).getStart(), end);
        }
        RelativeTemporalExtent first = (RelativeTemporalExtent) minStart;
        long end = useStart ? maxStart.startOrdinal() : maxEnd.endOrdinal();
        return new RelativeTemporalExtent(first.getStart(), end,
            dataset.getRelativeUnit() != null ? dataset.getRelativeUnit() : first.getUnit());
    }

    /**
     * Deletes a dataset: every member is unregistered, the dataset register is
     * dropped and the dataset rows are removed, all in one transaction. Member
     * maps stay in the temporal database.
     *
     * @param execute run the statements; otherwise they are only returned
     */
    public List<SqlStatement> delete(SpaceTimeDataset dataset, boolean execute) {
        logger.info("Delete space time {} dataset <{}> from temporal database",
            dataset.getKind().getDatasetType(), dataset.getId());
        List<SqlStatement> statements = new ArrayList<>();
        if (dataset.getMapRegister() != null) {
            List<String> members = store.registerEntries(dataset.getMapRegister());
            for (String id : members) {
                MapDataset member = dataset.getKind().newMap(id, dataset.getMapset(), true);
                statements.addAll(unregisterMap(dataset, member, false));
            }
            logger.debug("Drop map register table: {}", dataset.getMapRegister());
            statements.add(store.dropRegisterTableStatement(dataset.getMapRegister()));
        }
        statements.addAll(store.deleteDatasetStatements(dataset));

        if (execute) {
            database.executeTransaction(statements);
            if (metrics != null) {
                metrics.recordDatasetDeleted();
            }
        }
        return statements;
    }

    /**
     * Removes a map from the temporal database. The map is first unregistered
     * from every dataset it belongs to and those datasets are updated.
     */
    public void deleteMap(MapDataset map) {
        MapDataset stored = store.selectMap(map.getKind(), map.getId()).orElseThrow(() ->
            new ConsistencyViolationException(SpaceTimeErrorCodes.MAP_NOT_FOUND,
                "Map <" + map.getId() + "> is not in the temporal database"));

        for (String datasetId : store.registerEntries(stored.getStdsRegister())) {
            store.selectDataset(stored.getKind(), datasetId).ifPresent(dataset -> {
                unregisterMap(dataset, stored, true);
                updateFromRegisteredMaps(dataset);
            });
        }

        List<SqlStatement> statements = new ArrayList<>();
        if (stored.getStdsRegister() != null) {
            statements.add(store.dropRegisterTableStatement(stored.getStdsRegister()));
        }
        statements.addAll(store.deleteMapStatements(stored));
        database.executeTransaction(statements);
        logger.info("Removed {} map <{}> from temporal database", stored.getKind().getMapType(), stored.getId());
    }
}
