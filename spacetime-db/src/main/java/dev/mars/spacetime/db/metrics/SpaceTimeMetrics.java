package dev.mars.spacetime.db.metrics;

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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer metrics for registrations, metadata recomputation, database
 * transactions and algebra jobs.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class SpaceTimeMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(SpaceTimeMetrics.class);

    private final String instanceId;

    // Counters
    private Counter mapsRegistered;
    private Counter duplicateRegistrations;
    private Counter mapsUnregistered;
    private Counter metadataUpdates;
    private Counter datasetsDeleted;
    private Counter algebraJobsSubmitted;
    private Counter algebraJobsFailed;

    // Timers
    private Timer transactionTime;

    public SpaceTimeMetrics(String instanceId) {
        this.instanceId = instanceId;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        mapsRegistered = Counter.builder("spacetime.maps.registered")
            .description("Total number of maps registered in space time datasets")
            .tag("instance", instanceId)
            .register(registry);

        duplicateRegistrations = Counter.builder("spacetime.maps.duplicate_registrations")
            .description("Registrations skipped because the map was already a member")
            .tag("instance", instanceId)
            .register(registry);

        mapsUnregistered = Counter.builder("spacetime.maps.unregistered")
            .description("Total number of maps removed from space time datasets")
            .tag("instance", instanceId)
            .register(registry);

        metadataUpdates = Counter.builder("spacetime.datasets.metadata_updates")
            .description("Aggregate metadata recomputations")
            .tag("instance", instanceId)
            .register(registry);

        datasetsDeleted = Counter.builder("spacetime.datasets.deleted")
            .description("Space time datasets deleted")
            .tag("instance", instanceId)
            .register(registry);

        algebraJobsSubmitted = Counter.builder("spacetime.algebra.jobs.submitted")
            .description("Map calculator jobs submitted to the worker pool")
            .tag("instance", instanceId)
            .register(registry);

        algebraJobsFailed = Counter.builder("spacetime.algebra.jobs.failed")
            .description("Map calculator jobs that exited with a nonzero code")
            .tag("instance", instanceId)
            .register(registry);

        transactionTime = Timer.builder("spacetime.database.transaction.time")
            .description("Time taken for temporal database transactions")
            .tag("instance", instanceId)
            .register(registry);

        logger.info("Space-time metrics bound to registry for instance: {}", instanceId);
    }

    public void recordMapRegistered() {
        if (mapsRegistered != null) mapsRegistered.increment();
    }

    public void recordDuplicateRegistration() {
        if (duplicateRegistrations != null) duplicateRegistrations.increment();
    }

    public void recordMapUnregistered() {
        if (mapsUnregistered != null) mapsUnregistered.increment();
    }

    public void recordMetadataUpdate() {
        if (metadataUpdates != null) metadataUpdates.increment();
    }

    public void recordDatasetDeleted() {
        if (datasetsDeleted != null) datasetsDeleted.increment();
    }

    public void recordAlgebraJobs(int submitted, int failed) {
        if (algebraJobsSubmitted != null) {
            algebraJobsSubmitted.increment(submitted);
            algebraJobsFailed.increment(failed);
        }
    }

    public void recordTransaction(long durationNanos) {
        if (transactionTime != null) transactionTime.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Snapshot of the counters, used by the info command.
     */
    public Map<String, Double> getSummary() {
        Map<String, Double> summary = new HashMap<>();
        if (mapsRegistered != null) {
            summary.put("maps.registered", mapsRegistered.count());
            summary.put("maps.duplicate_registrations", duplicateRegistrations.count());
            summary.put("maps.unregistered", mapsUnregistered.count());
            summary.put("datasets.metadata_updates", metadataUpdates.count());
            summary.put("datasets.deleted", datasetsDeleted.count());
            summary.put("algebra.jobs.submitted", algebraJobsSubmitted.count());
            summary.put("algebra.jobs.failed", algebraJobsFailed.count());
        }
        return summary;
    }

    public String getInstanceId() {
        return instanceId;
    }
}
