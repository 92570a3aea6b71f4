package dev.mars.spacetime.api.database;

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

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Narrow interface to the relational side database holding temporal metadata.
 * <p>
 * Rows are returned as maps keyed by lower-case column label. Timestamps are
 * returned as {@link java.time.LocalDateTime}, integers as {@link Long} or
 * {@link Integer} and floating point values as {@link Double}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public interface TemporalDatabase extends AutoCloseable {

    /**
     * Placeholder style statements must be written in. Callers query it instead of assuming one.
     */
    ParamStyle getParamStyle();

    /**
     * Executes one statement in its own transaction.
     *
     * @throws dev.mars.spacetime.api.error.TemporalDatabaseException on failure
     */
    void execute(String sql, Object... parameters);

    /**
     * Executes all statements atomically. On failure the transaction is rolled back
     * and a {@link dev.mars.spacetime.api.error.TemporalDatabaseException} is thrown.
     */
    void executeTransaction(List<SqlStatement> statements);

    Optional<Map<String, Object>> fetchOne(String sql, Object... parameters);

    List<Map<String, Object>> fetchAll(String sql, Object... parameters);

    /**
     * Short description of the backend, used by the info command.
     */
    String describe();

    @Override
    void close();
}
