package dev.mars.spacetime.db.jdbc;

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

import dev.mars.spacetime.api.database.ParamStyle;
import dev.mars.spacetime.api.database.SqlStatement;
import dev.mars.spacetime.api.database.TemporalDatabase;
import dev.mars.spacetime.api.error.SpaceTimeErrorCodes;
import dev.mars.spacetime.api.error.TemporalDatabaseException;
import dev.mars.spacetime.db.metrics.SpaceTimeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@link TemporalDatabase} over a JDBC {@link DataSource}. Every call borrows a
 * connection; transactions run with auto-commit disabled and are rolled back on
 * the first failing statement.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class JdbcTemporalDatabase implements TemporalDatabase {
    private static final Logger logger = LoggerFactory.getLogger(JdbcTemporalDatabase.class);

    private final DataSource dataSource;
    private final String description;
    private final SpaceTimeMetrics metrics;

    public JdbcTemporalDatabase(DataSource dataSource, String description) {
        this(dataSource, description, null);
    }

    public JdbcTemporalDatabase(DataSource dataSource, String description, SpaceTimeMetrics metrics) {
        this.dataSource = dataSource;
        this.description = description;
        this.metrics = metrics;
    }

    @Override
    public ParamStyle getParamStyle() {
        return ParamStyle.QMARK;
    }

    @Override
    public void execute(String sql, Object... parameters) {
        executeTransaction(List.of(SqlStatement.of(sql, parameters)));
    }

    @Override
    public void executeTransaction(List<SqlStatement> statements) {
        if (statements.isEmpty()) {
            return;
        }
        long startNanos = System.nanoTime();
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                for (SqlStatement statement : statements) {
                    logger.trace("Executing: {}", statement);
                    try (PreparedStatement ps = conn.prepareStatement(statement.sql())) {
                        bind(ps, statement.parameters());
                        ps.execute();
                    }
                }
                conn.commit();
                logger.debug("Committed transaction with {} statements", statements.size());
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            logger.error("Transaction with {} statements rolled back: {}", statements.size(), e.getMessage());
            throw new TemporalDatabaseException(SpaceTimeErrorCodes.TRANSACTION_FAILED,
                "Unable to execute transaction: " + e.getMessage(), e);
        } finally {
            if (metrics != null) {
                metrics.recordTransaction(System.nanoTime() - startNanos);
            }
        }
    }

    @Override
    public Optional<Map<String, Object>> fetchOne(String sql, Object... parameters) {
        List<Map<String, Object>> rows = query(sql, parameters, 1);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<Map<String, Object>> fetchAll(String sql, Object... parameters) {
        return query(sql, parameters, 0);
    }

    @Override
    public String describe() {
        return description;
    }

    @Override
    public void close() {
        if (dataSource instanceof AutoCloseable) {
            try {
                ((AutoCloseable) dataSource).close();
            } catch (Exception e) {
                logger.warn("Error closing data source: {}", e.getMessage());
            }
        }
    }

    private List<Map<String, Object>> query(String sql, Object[] parameters, int maxRows) {
        logger.trace("Querying: {}", sql);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            if (maxRows > 0) {
                ps.setMaxRows(maxRows);
            }
            bind(ps, Arrays.asList(parameters));
            try (ResultSet rs = ps.executeQuery()) {
                ResultSetMetaData meta = rs.getMetaData();
                List<Map<String, Object>> rows = new ArrayList<>();
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 1; i <= meta.getColumnCount(); i++) {
                        row.put(meta.getColumnLabel(i).toLowerCase(Locale.ROOT), normalize(rs.getObject(i)));
                    }
                    rows.add(row);
                }
                return rows;
            }
        } catch (SQLException e) {
            throw new TemporalDatabaseException("Query failed: " + e.getMessage(), e);
        }
    }

    private static void bind(PreparedStatement ps, List<Object> parameters) throws SQLException {
        for (int i = 0; i < parameters.size(); i++) {
            Object value = parameters.get(i);
            if (value instanceof LocalDateTime) {
                ps.setTimestamp(i + 1, Timestamp.valueOf((LocalDateTime) value));
            } else {
                ps.setObject(i + 1, value);
            }
        }
    }

    private static Object normalize(Object value) {
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toLocalDateTime();
        }
        if (value instanceof Date) {
            return ((Date) value).toLocalDate().atStartOfDay();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).doubleValue();
        }
        return value;
    }
}
