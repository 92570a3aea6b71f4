package dev.mars.spacetime.db.schema;

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
import dev.mars.spacetime.db.util.SqlIdentifierValidator;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Every SQL statement the engine issues, per operation. Table names are filled in
 * per dataset kind ({@code {map}}, {@code {stds}}) or per register table
 * ({@code {table}}); values are always bound through {@code ?} placeholders.
 * <p>
 * DDL templates are loaded from {@code /db/templates/}; DML templates are inline.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public enum SqlTemplate {

    // Schema
    MAP_TABLES(Scope.KIND, null, "map_tables.sql"),
    STDS_TABLES(Scope.KIND, null, "stds_tables.sql"),
    CREATE_REGISTER_TABLE(Scope.TABLE, null, "register_table.sql"),
    DROP_REGISTER_TABLE(Scope.TABLE, "DROP TABLE IF EXISTS {table}", null),

    // Register tables
    INSERT_REGISTER_ENTRY(Scope.TABLE, "INSERT INTO {table} (id) VALUES (?)", null),
    DELETE_REGISTER_ENTRY(Scope.TABLE, "DELETE FROM {table} WHERE id = ?", null),
    SELECT_REGISTER_ENTRY(Scope.TABLE, "SELECT id FROM {table} WHERE id = ?", null),
    SELECT_REGISTER_ENTRIES(Scope.TABLE, "SELECT id FROM {table} ORDER BY id", null),

    // Maps
    INSERT_MAP_BASE(Scope.KIND,
        "INSERT INTO {map}_base (id, name, mapset, layer, temporal_type, creator, creation_time, stds_register, "
            + "min_value, max_value, north, south, east, west, top_z, bottom_z) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)", null),
    INSERT_MAP_ABSOLUTE_TIME(Scope.KIND,
        "INSERT INTO {map}_absolute_time (id, start_time, end_time, timezone) VALUES (?, ?, ?, ?)", null),
    INSERT_MAP_RELATIVE_TIME(Scope.KIND,
        "INSERT INTO {map}_relative_time (id, start_time, end_time, unit) VALUES (?, ?, ?, ?)", null),
    UPDATE_MAP_BASE(Scope.KIND,
        "UPDATE {map}_base SET temporal_type = ?, stds_register = ?, min_value = ?, max_value = ?, "
            + "north = ?, south = ?, east = ?, west = ?, top_z = ?, bottom_z = ? WHERE id = ?", null),
    UPDATE_MAP_ABSOLUTE_TIME(Scope.KIND,
        "UPDATE {map}_absolute_time SET start_time = ?, end_time = ?, timezone = ? WHERE id = ?", null),
    UPDATE_MAP_RELATIVE_TIME(Scope.KIND,
        "UPDATE {map}_relative_time SET start_time = ?, end_time = ?, unit = ? WHERE id = ?", null),
    UPDATE_MAP_STDS_REGISTER(Scope.KIND, "UPDATE {map}_base SET stds_register = ? WHERE id = ?", null),
    SELECT_MAP_BASE(Scope.KIND, "SELECT * FROM {map}_base WHERE id = ?", null),
    SELECT_MAP_ABSOLUTE_TIME(Scope.KIND,
        "SELECT start_time, end_time, timezone FROM {map}_absolute_time WHERE id = ?", null),
    SELECT_MAP_RELATIVE_TIME(Scope.KIND,
        "SELECT start_time, end_time, unit FROM {map}_relative_time WHERE id = ?", null),
    DELETE_MAP_BASE(Scope.KIND, "DELETE FROM {map}_base WHERE id = ?", null),
    DELETE_MAP_ABSOLUTE_TIME(Scope.KIND, "DELETE FROM {map}_absolute_time WHERE id = ?", null),
    DELETE_MAP_RELATIVE_TIME(Scope.KIND, "DELETE FROM {map}_relative_time WHERE id = ?", null),

    // Registered members of a dataset; {table} is the dataset register table
    SELECT_REGISTERED_MAPS_ABSOLUTE(Scope.KIND_AND_TABLE,
        "SELECT b.id, b.name, b.mapset, b.layer, b.stds_register, b.min_value, b.max_value, "
            + "b.north, b.south, b.east, b.west, b.top_z, b.bottom_z, t.start_time, t.end_time, t.timezone "
            + "FROM {map}_base b JOIN {map}_absolute_time t ON b.id = t.id "
            + "WHERE b.id IN (SELECT id FROM {table})", null),
    SELECT_REGISTERED_MAPS_RELATIVE(Scope.KIND_AND_TABLE,
        "SELECT b.id, b.name, b.mapset, b.layer, b.stds_register, b.min_value, b.max_value, "
            + "b.north, b.south, b.east, b.west, b.top_z, b.bottom_z, t.start_time, t.end_time, t.unit "
            + "FROM {map}_base b JOIN {map}_relative_time t ON b.id = t.id "
            + "WHERE b.id IN (SELECT id FROM {table})", null),

    // Space time datasets
    INSERT_STDS_BASE(Scope.KIND,
        "INSERT INTO {stds}_base (id, name, mapset, semantic_type, temporal_type, creator, creation_time, "
            + "modification_time, title, description, map_register, number_of_maps) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)", null),
    INSERT_STDS_ABSOLUTE_TIME(Scope.KIND,
        "INSERT INTO {stds}_absolute_time (id, start_time, end_time, granularity, map_time) VALUES (?, ?, ?, ?, ?)", null),
    INSERT_STDS_RELATIVE_TIME(Scope.KIND,
        "INSERT INTO {stds}_relative_time (id, start_time, end_time, unit, granularity, map_time) "
            + "VALUES (?, ?, ?, ?, ?, ?)", null),
    SELECT_STDS_BASE(Scope.KIND, "SELECT * FROM {stds}_base WHERE id = ?", null),
    SELECT_STDS_ABSOLUTE_TIME(Scope.KIND,
        "SELECT start_time, end_time, granularity, map_time FROM {stds}_absolute_time WHERE id = ?", null),
    SELECT_STDS_RELATIVE_TIME(Scope.KIND,
        "SELECT start_time, end_time, unit, granularity, map_time FROM {stds}_relative_time WHERE id = ?", null),
    SELECT_STDS_IDS(Scope.KIND, "SELECT id FROM {stds}_base ORDER BY id", null),
    UPDATE_STDS_MAP_REGISTER(Scope.KIND, "UPDATE {stds}_base SET map_register = ? WHERE id = ?", null),
    UPDATE_STDS_RELATIVE_UNIT(Scope.KIND, "UPDATE {stds}_relative_time SET unit = ? WHERE id = ?", null),
    UPDATE_STDS_DESCRIPTION(Scope.KIND,
        "UPDATE {stds}_base SET semantic_type = ?, title = ?, description = ?, modification_time = ? WHERE id = ?", null),
    UPDATE_STDS_METADATA(Scope.KIND,
        "UPDATE {stds}_base SET number_of_maps = ?, north = ?, south = ?, east = ?, west = ?, top_z = ?, "
            + "bottom_z = ?, modification_time = ? WHERE id = ?", null),
    UPDATE_STDS_ABSOLUTE_TIME(Scope.KIND,
        "UPDATE {stds}_absolute_time SET start_time = ?, end_time = ?, granularity = ?, map_time = ? WHERE id = ?", null),
    UPDATE_STDS_RELATIVE_TIME(Scope.KIND,
        "UPDATE {stds}_relative_time SET start_time = ?, end_time = ?, granularity = ?, map_time = ? WHERE id = ?", null),
    DELETE_STDS_BASE(Scope.KIND, "DELETE FROM {stds}_base WHERE id = ?", null),
    DELETE_STDS_ABSOLUTE_TIME(Scope.KIND, "DELETE FROM {stds}_absolute_time WHERE id = ?", null),
    DELETE_STDS_RELATIVE_TIME(Scope.KIND, "DELETE FROM {stds}_relative_time WHERE id = ?", null);

    /** Which placeholders a template needs. */
    public enum Scope { KIND, TABLE, KIND_AND_TABLE }

    private static final String TEMPLATE_BASE_PATH = "/db/templates/";
    private static final Map<SqlTemplate, String> LOADED = new ConcurrentHashMap<>();

    private final Scope scope;
    private final String inlineSql;
    private final String resource;

    SqlTemplate(Scope scope, String inlineSql, String resource) {
        this.scope = scope;
        this.inlineSql = inlineSql;
        this.resource = resource;
    }

    public Scope getScope() {
        return scope;
    }

    /**
     * Raw template text with placeholders.
     */
    public String text() {
        if (inlineSql != null) {
            return inlineSql;
        }
        return LOADED.computeIfAbsent(this, t -> load(TEMPLATE_BASE_PATH + t.resource));
    }

    /** Renders a kind scoped template. */
    public String render(DatasetKind kind) {
        requireScope(Scope.KIND);
        return substitute(text(), kind, null);
    }

    /** Renders a table scoped template after validating the table name. */
    public String render(String table) {
        requireScope(Scope.TABLE);
        return substitute(text(), null, table);
    }

    /** Renders a template scoped by both a kind and a register table. */
    public String render(DatasetKind kind, String table) {
        requireScope(Scope.KIND_AND_TABLE);
        return substitute(text(), kind, table);
    }

    private void requireScope(Scope expected) {
        if (scope != expected) {
            throw new IllegalStateException("Template " + name() + " has scope " + scope + ", not " + expected);
        }
    }

    private static String substitute(String template, DatasetKind kind, String table) {
        String result = template;
        if (kind != null) {
            result = result.replace("{map}", kind.getMapType()).replace("{stds}", kind.getDatasetType());
        }
        if (table != null) {
            result = result.replace("{table}", SqlIdentifierValidator.validate(table, "Register table"));
        }
        return result;
    }

    private static String load(String path) {
        try (InputStream is = SqlTemplate.class.getResourceAsStream(path)) {
            if (is == null) {
                throw new IllegalStateException("SQL template not found: " + path);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load SQL template: " + path, e);
        }
    }
}
