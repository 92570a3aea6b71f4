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

import dev.mars.spacetime.api.database.SqlStatement;
import dev.mars.spacetime.api.database.TemporalDatabase;
import dev.mars.spacetime.api.error.SpaceTimeErrorCodes;
import dev.mars.spacetime.api.error.TemporalDatabaseException;
import dev.mars.spacetime.api.model.DatasetKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Creates the map and dataset metadata tables for every {@link DatasetKind}.
 * Statements use {@code IF NOT EXISTS}, so initialization is idempotent.
 */
public class TemporalSchemaInitializer {
    private static final Logger logger = LoggerFactory.getLogger(TemporalSchemaInitializer.class);

    private final TemporalDatabase database;

    public TemporalSchemaInitializer(TemporalDatabase database) {
        this.database = database;
    }

    public void initializeSchema() {
        logger.info("Initializing temporal database schema");
        List<SqlStatement> statements = new ArrayList<>();
        for (DatasetKind kind : DatasetKind.values()) {
            for (String sql : parseSqlStatements(SqlTemplate.MAP_TABLES.render(kind))) {
                statements.add(SqlStatement.of(sql));
            }
            for (String sql : parseSqlStatements(SqlTemplate.STDS_TABLES.render(kind))) {
                statements.add(SqlStatement.of(sql));
            }
        }
        try {
            database.executeTransaction(statements);
        } catch (TemporalDatabaseException e) {
            throw new TemporalDatabaseException(SpaceTimeErrorCodes.SCHEMA_INIT_FAILED,
                "Failed to initialize temporal database schema", e);
        }
        logger.info("Temporal database schema initialized ({} statements)", statements.size());
    }

    /**
     * Splits a script into statements. Comment lines are dropped and the trailing
     * semicolon is removed from each statement.
     */
    public static List<String> parseSqlStatements(String content) {
        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String line : content.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("--")) {
                continue;
            }
            current.append(line).append('\n');
            if (trimmed.endsWith(";")) {
                String statement = current.toString().trim();
                statements.add(statement.substring(0, statement.length() - 1).trim());
                current = new StringBuilder();
            }
        }
        String last = current.toString().trim();
        if (!last.isEmpty()) {
            statements.add(last);
        }
        return statements;
    }
}
