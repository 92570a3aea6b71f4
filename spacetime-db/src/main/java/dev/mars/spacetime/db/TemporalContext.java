package dev.mars.spacetime.db;

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

import dev.mars.spacetime.api.database.TemporalDatabase;
import dev.mars.spacetime.db.config.SpaceTimeConfiguration;
import dev.mars.spacetime.db.jdbc.DataSourceFactory;
import dev.mars.spacetime.db.jdbc.JdbcTemporalDatabase;
import dev.mars.spacetime.db.metrics.SpaceTimeMetrics;
import dev.mars.spacetime.db.schema.TemporalSchemaInitializer;
import dev.mars.spacetime.db.store.DatasetStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Explicit engine context: configuration, current mapset, temporal database,
 * row store and metrics. One context is created per session and passed to every
 * engine component instead of relying on process-wide state.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class TemporalContext implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TemporalContext.class);

    private final SpaceTimeConfiguration configuration;
    private final TemporalDatabase database;
    private final boolean databaseOwnedByContext;
    private final DatasetStore store;
    private final MeterRegistry meterRegistry;
    private final SpaceTimeMetrics metrics;
    private final String mapset;

    public TemporalContext(SpaceTimeConfiguration configuration) {
        this(configuration, new SimpleMeterRegistry());
    }

    public TemporalContext(SpaceTimeConfiguration configuration, MeterRegistry meterRegistry) {
        this(configuration, meterRegistry, null);
    }

    /**
     * @param database an externally owned database, or null to create one from the configuration
     */
    public TemporalContext(SpaceTimeConfiguration configuration, MeterRegistry meterRegistry, TemporalDatabase database) {
        this.configuration = configuration;
        this.meterRegistry = meterRegistry;
        this.mapset = configuration.getMapset();

        SpaceTimeConfiguration.MetricsConfig metricsConfig = configuration.getMetricsConfig();
        this.metrics = new SpaceTimeMetrics(metricsConfig.getInstanceId());
        if (metricsConfig.isEnabled()) {
            metrics.bindTo(meterRegistry);
        }

        if (database != null) {
            this.database = database;
            this.databaseOwnedByContext = false;
            logger.info("Using provided temporal database (external ownership)");
        } else {
            SpaceTimeConfiguration.DatabaseConfig dbConfig = configuration.getDatabaseConfig();
            this.database = new JdbcTemporalDatabase(DataSourceFactory.create(dbConfig),
                dbConfig.getBackend() + " " + dbConfig.getUrl(), metrics);
            this.databaseOwnedByContext = true;
        }

        this.store = new DatasetStore(this.database);
        new TemporalSchemaInitializer(this.database).initializeSchema();
        logger.info("Temporal context initialized for mapset {}", mapset);
    }

    public SpaceTimeConfiguration getConfiguration() { return configuration; }
    public TemporalDatabase getDatabase() { return database; }
    public DatasetStore getStore() { return store; }
    public MeterRegistry getMeterRegistry() { return meterRegistry; }
    public SpaceTimeMetrics getMetrics() { return metrics; }

    /** The mapset new maps and datasets are created in. */
    public String getMapset() { return mapset; }

    @Override
    public void close() {
        if (databaseOwnedByContext) {
            logger.info("Closing temporal database (context-owned)");
            database.close();
        }
    }
}
