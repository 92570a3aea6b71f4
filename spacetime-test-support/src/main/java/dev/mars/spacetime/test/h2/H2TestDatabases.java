package dev.mars.spacetime.test.h2;

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

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.util.UUID;

/**
 * Creates isolated in-memory H2 databases for engine tests. Each call returns a
 * data source pointing at a fresh database that lives until the JVM exits.
 */
public final class H2TestDatabases {

    private H2TestDatabases() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static DataSource newDataSource(String prefix) {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL(jdbcUrl(prefix));
        dataSource.setUser("sa");
        dataSource.setPassword("");
        return dataSource;
    }

    public static String jdbcUrl(String prefix) {
        return "jdbc:h2:mem:" + prefix + "_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1";
    }
}
