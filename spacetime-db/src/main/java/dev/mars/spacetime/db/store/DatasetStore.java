package dev.mars.spacetime.db.store;

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
import dev.mars.spacetime.api.error.SpaceTimeErrorCodes;
import dev.mars.spacetime.api.error.TemporalSyntaxException;
import dev.mars.spacetime.api.model.AbsoluteTemporalExtent;
import dev.mars.spacetime.api.model.CalendarUnit;
import dev.mars.spacetime.api.model.DatasetKind;
import dev.mars.spacetime.api.model.Granularity;
import dev.mars.spacetime.api.model.MapDataset;
import dev.mars.spacetime.api.model.MapTime;
import dev.mars.spacetime.api.model.RelativeTemporalExtent;
import dev.mars.spacetime.api.model.SpaceTimeDataset;
import dev.mars.spacetime.api.model.SpatialExtent;
import dev.mars.spacetime.api.model.TemporalExtent;
import dev.mars.spacetime.api.model.TemporalType;
import dev.mars.spacetime.db.schema.SqlTemplate;
import dev.mars.spacetime.db.schema.TemporalSchemaInitializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Row level access to map, dataset and register tables. Read methods hit the
 * database directly; write methods return {@link SqlStatement}s so callers can
 * group them into one transaction.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class DatasetStore {
    private static final Logger logger = LoggerFactory.getLogger(DatasetStore.class);

    private static final Set<String> ORDER_COLUMNS = Set.of(
        "id", "name", "mapset", "start_time", "end_time", "min_value", "max_value");

    private final TemporalDatabase database;

    public DatasetStore(TemporalDatabase database) {
        this.database = database;
    }

    public TemporalDatabase getDatabase() {
        return database;
    }

    // ---------------------------------------------------------------- maps

    public boolean mapExists(DatasetKind kind, String mapId) {
        return database.fetchOne(sql(SqlTemplate.SELECT_MAP_BASE.render(kind)), mapId).isPresent();
    }

    public Optional<MapDataset> selectMap(DatasetKind kind, String mapId) {
        Optional<Map<String, Object>> base = database.fetchOne(sql(SqlTemplate.SELECT_MAP_BASE.render(kind)), mapId);
        if (base.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> row = base.get();
        MapDataset map = new MapDataset(kind, (String) row.get("name"), (String) row.get("layer"), (String) row.get("mapset"));
        readMapBase(map, row);

        TemporalType type = TemporalType.fromName((String) row.get("temporal_type"));
        if (type == TemporalType.ABSOLUTE) {
            database.fetchOne(sql(SqlTemplate.SELECT_MAP_ABSOLUTE_TIME.render(kind)), mapId)
                .ifPresent(time -> map.setTemporalExtent(readAbsoluteTime(time)));
        } else {
            database.fetchOne(sql(SqlTemplate.SELECT_MAP_RELATIVE_TIME.render(kind)), mapId)
                .ifPresent(time -> map.setTemporalExtent(readRelativeTime(time)));
        }
        return Optional.of(map);
    }

    public List<SqlStatement> insertMapStatements(MapDataset map) {
        DatasetKind kind = map.getKind();
        SpatialExtent extent = map.getSpatialExtent();
        List<SqlStatement> statements = new ArrayList<>();
        statements.add(statement(SqlTemplate.INSERT_MAP_BASE.render(kind),
            map.getId(), map.getName(), map.getMapset(), map.getLayer(), map.getTemporalType().getName(),
            map.getCreator(), map.getCreationTime() != null ? map.getCreationTime() : LocalDateTime.now(),
            map.getStdsRegister(), map.getMinValue(), map.getMaxValue(),
            extent == null ? null : extent.getNorth(), extent == null ? null : extent.getSouth(),
            extent == null ? null : extent.getEast(), extent == null ? null : extent.getWest(),
            extent == null ? null : extent.getTop(), extent == null ? null : extent.getBottom()));
        statements.add(insertTimeStatement(map));
        return statements;
    }

    public void insertMap(MapDataset map) {
        database.executeTransaction(insertMapStatements(map));
        logger.debug("Inserted map {} into temporal database", map.getId());
    }

    public List<SqlStatement> updateMapStatements(MapDataset map) {
        DatasetKind kind = map.getKind();
        SpatialExtent extent = map.getSpatialExtent();
        List<SqlStatement> statements = new ArrayList<>();
        statements.add(statement(SqlTemplate.UPDATE_MAP_BASE.render(kind),
            map.getTemporalType().getName(), map.getStdsRegister(), map.getMinValue(), map.getMaxValue(),
            extent == null ? null : extent.getNorth(), extent == null ? null : extent.getSouth(),
            extent == null ? null : extent.getEast(), extent == null ? null : extent.getWest(),
            extent == null ? null : extent.getTop(), extent == null ? null : extent.getBottom(),
            map.getId()));
        // The time row may live in the other time table when the type changed
        statements.add(statement(SqlTemplate.DELETE_MAP_ABSOLUTE_TIME.render(kind), map.getId()));
        statements.add(statement(SqlTemplate.DELETE_MAP_RELATIVE_TIME.render(kind), map.getId()));
        statements.add(insertTimeStatement(map));
        return statements;
    }

    public void updateMap(MapDataset map) {
        database.executeTransaction(updateMapStatements(map));
        logger.debug("Updated map {} in temporal database", map.getId());
    }

    public SqlStatement updateMapStdsRegisterStatement(MapDataset map) {
        return statement(SqlTemplate.UPDATE_MAP_STDS_REGISTER.render(map.getKind()), map.getStdsRegister(), map.getId());
    }

    public List<SqlStatement> deleteMapStatements(MapDataset map) {
        DatasetKind kind = map.getKind();
        List<SqlStatement> statements = new ArrayList<>();
        statements.add(statement(SqlTemplate.DELETE_MAP_ABSOLUTE_TIME.render(kind), map.getId()));
        statements.add(statement(SqlTemplate.DELETE_MAP_RELATIVE_TIME.render(kind), map.getId()));
        statements.add(statement(SqlTemplate.DELETE_MAP_BASE.render(kind), map.getId()));
        return statements;
    }

    private SqlStatement insertTimeStatement(MapDataset map) {
        TemporalExtent time = map.getTemporalExtent();
        DatasetKind kind = map.getKind();
        if (time instanceof AbsoluteTemporalExtent) {
            AbsoluteTemporalExtent abs = (AbsoluteTemporalExtent) time;
            return statement(SqlTemplate.INSERT_MAP_ABSOLUTE_TIME.render(kind),
                map.getId(), abs.getStart(), abs.getEnd(), abs.getTimezone());
        }
        RelativeTemporalExtent rel = (RelativeTemporalExtent) time;
        return statement(SqlTemplate.INSERT_MAP_RELATIVE_TIME.render(kind),
            map.getId(), rel.getStart(), rel.getEnd(), rel.getUnit().getPlural());
    }

    // ---------------------------------------------------------------- datasets

    public boolean datasetExists(DatasetKind kind, String datasetId) {
        return database.fetchOne(sql(SqlTemplate.SELECT_STDS_BASE.render(kind)), datasetId).isPresent();
    }

    /**
     * Loads a dataset. The in-memory map counter is reset to the persisted number of maps.
     */
    public Optional<SpaceTimeDataset> selectDataset(DatasetKind kind, String datasetId) {
        Optional<Map<String, Object>> base = database.fetchOne(sql(SqlTemplate.SELECT_STDS_BASE.render(kind)), datasetId);
        if (base.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> row = base.get();
        SpaceTimeDataset dataset = new SpaceTimeDataset(kind, (String) row.get("name"), (String) row.get("mapset"));
        dataset.setTemporalType(TemporalType.fromName((String) row.get("temporal_type")));
        dataset.setSemanticType((String) row.get("semantic_type"));
        dataset.setCreator((String) row.get("creator"));
        dataset.setCreationTime((LocalDateTime) row.get("creation_time"));
        dataset.setModificationTime((LocalDateTime) row.get("modification_time"));
        dataset.setTitle((String) row.get("title"));
        dataset.setDescription((String) row.get("description"));
        dataset.setMapRegister((String) row.get("map_register"));
        Integer numberOfMaps = toInteger(row.get("number_of_maps"));
        dataset.setNumberOfMaps(numberOfMaps);
        dataset.setMapCounter(numberOfMaps == null ? 0 : numberOfMaps);
        dataset.setSpatialExtent(readSpatialExtent(row));

        if (dataset.getTemporalType() == TemporalType.ABSOLUTE) {
            database.fetchOne(sql(SqlTemplate.SELECT_STDS_ABSOLUTE_TIME.render(kind)), datasetId).ifPresent(time -> {
                LocalDateTime start = (LocalDateTime) time.get("start_time");
                if (start != null) {
                    dataset.setTemporalExtent(new AbsoluteTemporalExtent(start, (LocalDateTime) time.get("end_time")));
                }
                String granularity = (String) time.get("granularity");
                if (granularity != null) {
                    dataset.setGranularity(Granularity.parse(granularity, TemporalType.ABSOLUTE));
                }
                dataset.setMapTime(MapTime.fromName((String) time.get("map_time")));
            });
        } else {
            database.fetchOne(sql(SqlTemplate.SELECT_STDS_RELATIVE_TIME.render(kind)), datasetId).ifPresent(time -> {
                String unit = (String) time.get("unit");
                if (unit != null) {
                    dataset.setRelativeUnit(CalendarUnit.fromName(unit));
                }
                Long start = toLong(time.get("start_time"));
                if (start != null && dataset.getRelativeUnit() != null) {
                    dataset.setTemporalExtent(new RelativeTemporalExtent(start, toLong(time.get("end_time")),
                        dataset.getRelativeUnit()));
                }
                Long granularity = toLong(time.get("granularity"));
                if (granularity != null) {
                    dataset.setGranularity(Granularity.relative(granularity));
                }
                dataset.setMapTime(MapTime.fromName((String) time.get("map_time")));
            });
        }
        return Optional.of(dataset);
    }

    public void insertDataset(SpaceTimeDataset dataset) {
        DatasetKind kind = dataset.getKind();
        LocalDateTime now = LocalDateTime.now();
        if (dataset.getCreationTime() == null) {
            dataset.setCreationTime(now);
        }
        dataset.setModificationTime(now);
        List<SqlStatement> statements = new ArrayList<>();
        statements.add(statement(SqlTemplate.INSERT_STDS_BASE.render(kind),
            dataset.getId(), dataset.getName(), dataset.getMapset(), dataset.getSemanticType(),
            dataset.getTemporalType().getName(), dataset.getCreator(), dataset.getCreationTime(),
            dataset.getModificationTime(), dataset.getTitle(), dataset.getDescription(),
            dataset.getMapRegister(), dataset.getNumberOfMaps()));
        if (dataset.getTemporalType() == TemporalType.ABSOLUTE) {
            statements.add(statement(SqlTemplate.INSERT_STDS_ABSOLUTE_TIME.render(kind),
                dataset.getId(), null, null, null, null));
        } else {
            statements.add(statement(SqlTemplate.INSERT_STDS_RELATIVE_TIME.render(kind),
                dataset.getId(), null, null,
                dataset.getRelativeUnit() == null ? null : dataset.getRelativeUnit().getPlural(), null, null));
        }
        database.executeTransaction(statements);
        logger.info("Created space time dataset {} ({})", dataset.getId(), kind.getDatasetType());
    }

    public SqlStatement updateDatasetMapRegisterStatement(SpaceTimeDataset dataset) {
        return statement(SqlTemplate.UPDATE_STDS_MAP_REGISTER.render(dataset.getKind()),
            dataset.getMapRegister(), dataset.getId());
    }

    public SqlStatement updateDatasetRelativeUnitStatement(SpaceTimeDataset dataset) {
        return statement(SqlTemplate.UPDATE_STDS_RELATIVE_UNIT.render(dataset.getKind()),
            dataset.getRelativeUnit().getPlural(), dataset.getId());
    }

    public SqlStatement updateDatasetDescriptionStatement(SpaceTimeDataset dataset) {
        return statement(SqlTemplate.UPDATE_STDS_DESCRIPTION.render(dataset.getKind()),
            dataset.getSemanticType(), dataset.getTitle(), dataset.getDescription(), LocalDateTime.now(),
            dataset.getId());
    }

    /**
     * Statements persisting the aggregate metadata held by {@code dataset}.
     */
    public List<SqlStatement> updateDatasetMetadataStatements(SpaceTimeDataset dataset) {
        DatasetKind kind = dataset.getKind();
        SpatialExtent extent = dataset.getSpatialExtent();
        List<SqlStatement> statements = new ArrayList<>();
        statements.add(statement(SqlTemplate.UPDATE_STDS_METADATA.render(kind),
            dataset.getNumberOfMaps(),
            extent == null ? null : extent.getNorth(), extent == null ? null : extent.getSouth(),
            extent == null ? null : extent.getEast(), extent == null ? null : extent.getWest(),
            extent == null ? null : extent.getTop(), extent == null ? null : extent.getBottom(),
            dataset.getModificationTime(), dataset.getId()));

        TemporalExtent time = dataset.getTemporalExtent();
        String mapTime = dataset.getMapTime() == null ? null : dataset.getMapTime().getName();
        if (dataset.getTemporalType() == TemporalType.ABSOLUTE) {
            AbsoluteTemporalExtent abs = (AbsoluteTemporalExtent) time;
            statements.add(statement(SqlTemplate.UPDATE_STDS_ABSOLUTE_TIME.render(kind),
                abs == null ? null : abs.getStart(), abs == null ? null : abs.getEnd(),
                dataset.getGranularity() == null ? null : dataset.getGranularity().toString(),
                mapTime, dataset.getId()));
        } else {
            RelativeTemporalExtent rel = (RelativeTemporalExtent) time;
            statements.add(statement(SqlTemplate.UPDATE_STDS_RELATIVE_TIME.render(kind),
                rel == null ? null : rel.getStart(), rel == null ? null : rel.getEnd(),
                dataset.getGranularity() == null ? null : dataset.getGranularity().getCount(),
                mapTime, dataset.getId()));
        }
        return statements;
    }

    public List<SqlStatement> deleteDatasetStatements(SpaceTimeDataset dataset) {
        DatasetKind kind = dataset.getKind();
        List<SqlStatement> statements = new ArrayList<>();
        statements.add(statement(SqlTemplate.DELETE_STDS_ABSOLUTE_TIME.render(kind), dataset.getId()));
        statements.add(statement(SqlTemplate.DELETE_STDS_RELATIVE_TIME.render(kind), dataset.getId()));
        statements.add(statement(SqlTemplate.DELETE_STDS_BASE.render(kind), dataset.getId()));
        return statements;
    }

    public List<String> listDatasetIds(DatasetKind kind) {
        List<String> ids = new ArrayList<>();
        for (Map<String, Object> row : database.fetchAll(sql(SqlTemplate.SELECT_STDS_IDS.render(kind)))) {
            ids.add((String) row.get("id"));
        }
        return ids;
    }

    // ---------------------------------------------------------------- register tables

    public List<SqlStatement> createRegisterTableStatements(String table) {
        List<SqlStatement> statements = new ArrayList<>();
        for (String sql : TemporalSchemaInitializer.parseSqlStatements(SqlTemplate.CREATE_REGISTER_TABLE.render(table))) {
            statements.add(SqlStatement.of(sql));
        }
        return statements;
    }

    public SqlStatement dropRegisterTableStatement(String table) {
        return SqlStatement.of(SqlTemplate.DROP_REGISTER_TABLE.render(table));
    }

    public SqlStatement insertRegisterEntryStatement(String table, String id) {
        return statement(SqlTemplate.INSERT_REGISTER_ENTRY.render(table), id);
    }

    public SqlStatement deleteRegisterEntryStatement(String table, String id) {
        return statement(SqlTemplate.DELETE_REGISTER_ENTRY.render(table), id);
    }

    public boolean isRegistered(String table, String id) {
        if (table == null) {
            return false;
        }
        return database.fetchOne(sql(SqlTemplate.SELECT_REGISTER_ENTRY.render(table)), id).isPresent();
    }

    public List<String> registerEntries(String table) {
        List<String> ids = new ArrayList<>();
        if (table == null) {
            return ids;
        }
        for (Map<String, Object> row : database.fetchAll(sql(SqlTemplate.SELECT_REGISTER_ENTRIES.render(table)))) {
            ids.add((String) row.get("id"));
        }
        return ids;
    }

    /**
     * Members of a dataset, optionally filtered by a SQL predicate over the map
     * columns and ordered by a comma separated column list (default {@code start_time}).
     */
    public List<MapDataset> selectRegisteredMaps(SpaceTimeDataset dataset, String where, String order) {
        List<MapDataset> maps = new ArrayList<>();
        if (dataset.getMapRegister() == null) {
            return maps;
        }
        DatasetKind kind = dataset.getKind();
        boolean absolute = dataset.getTemporalType() == TemporalType.ABSOLUTE;
        SqlTemplate template = absolute
            ? SqlTemplate.SELECT_REGISTERED_MAPS_ABSOLUTE : SqlTemplate.SELECT_REGISTERED_MAPS_RELATIVE;
        StringBuilder query = new StringBuilder(template.render(kind, dataset.getMapRegister()));
        if (where != null && !where.trim().isEmpty()) {
            query.append(" AND (").append(where).append(')');
        }
        query.append(" ORDER BY ").append(orderClause(order == null ? "start_time" : order));

        for (Map<String, Object> row : database.fetchAll(sql(query.toString()))) {
            MapDataset map = new MapDataset(kind, (String) row.get("name"), (String) row.get("layer"), (String) row.get("mapset"));
            readMapBase(map, row);
            map.setTemporalExtent(absolute ? readAbsoluteTime(row) : readRelativeTime(row));
            maps.add(map);
        }
        return maps;
    }

    static String orderClause(String order) {
        List<String> parts = new ArrayList<>();
        for (String token : order.split(",")) {
            String[] words = token.trim().split("\\s+");
            String column = words[0].toLowerCase(Locale.ROOT);
            if (!ORDER_COLUMNS.contains(column)) {
                throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT, "Unsupported order column '" + column + "'");
            }
            String prefix = column.endsWith("_time") ? "t." : "b.";
            String direction = "";
            if (words.length > 1) {
                direction = words[1].toUpperCase(Locale.ROOT);
                if (!"ASC".equals(direction) && !"DESC".equals(direction)) {
                    throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT, "Unsupported order direction '" + words[1] + "'");
                }
                direction = " " + direction;
            }
            parts.add(prefix + column + direction);
        }
        return String.join(", ", parts);
    }

    // ---------------------------------------------------------------- row mapping

    private static void readMapBase(MapDataset map, Map<String, Object> row) {
        map.setStdsRegister((String) row.get("stds_register"));
        map.setMinValue(toDouble(row.get("min_value")));
        map.setMaxValue(toDouble(row.get("max_value")));
        map.setSpatialExtent(readSpatialExtent(row));
        if (row.containsKey("creator")) {
            map.setCreator((String) row.get("creator"));
            map.setCreationTime((LocalDateTime) row.get("creation_time"));
        }
    }

    private static AbsoluteTemporalExtent readAbsoluteTime(Map<String, Object> row) {
        return new AbsoluteTemporalExtent((LocalDateTime) row.get("start_time"), (LocalDateTime) row.get("end_time"),
            toInteger(row.get("timezone")));
    }

    private static RelativeTemporalExtent readRelativeTime(Map<String, Object> row) {
        return new RelativeTemporalExtent(toLong(row.get("start_time")), toLong(row.get("end_time")),
            CalendarUnit.fromName((String) row.get("unit")));
    }

    private static SpatialExtent readSpatialExtent(Map<String, Object> row) {
        Double north = toDouble(row.get("north"));
        if (north == null) {
            return null;
        }
        Double top = toDouble(row.get("top_z"));
        Double bottom = toDouble(row.get("bottom_z"));
        return new SpatialExtent(north, toDouble(row.get("south")), toDouble(row.get("east")), toDouble(row.get("west")),
            top == null ? 0.0 : top, bottom == null ? 0.0 : bottom);
    }

    private SqlStatement statement(String sqlWithQmarks, Object... parameters) {
        return SqlStatement.of(sql(sqlWithQmarks), parameters);
    }

    private String sql(String sqlWithQmarks) {
        return database.getParamStyle().apply(sqlWithQmarks);
    }

    static Double toDouble(Object value) {
        return value == null ? null : ((Number) value).doubleValue();
    }

    static Long toLong(Object value) {
        return value == null ? null : ((Number) value).longValue();
    }

    static Integer toInteger(Object value) {
        return value == null ? null : ((Number) value).intValue();
    }
}
