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

import dev.mars.spacetime.db.config.SpaceTimeConfiguration;
import org.h2.jdbcx.JdbcDataSource;
import org.postgresql.ds.PGSimpleDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

/**
 * Creates the JDBC data source for the configured backend.
 */
public final class DataSourceFactory {
    private static final Logger logger = LoggerFactory.getLogger(DataSourceFactory.class);

    private DataSourceFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static DataSource create(SpaceTimeConfiguration.DatabaseConfig config) {
        logger.info("Creating data source for {}", config);
        if ("postgresql".equals(config.getBackend())) {
            PGSimpleDataSource dataSource = new PGSimpleDataSource();
            dataSource.setURL(config.getUrl());
            dataSource.setUser(config.getUsername());
            dataSource.setPassword(config.getPassword());
            return dataSource;
        }
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL(config.getUrl());
        dataSource.setUser(config.getUsername());
        dataSource.setPassword(config.getPassword());
        return dataSource;
    }
}
