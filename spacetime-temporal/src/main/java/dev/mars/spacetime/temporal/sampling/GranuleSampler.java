package dev.mars.spacetime.temporal.sampling;

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

import dev.mars.spacetime.api.error.ConsistencyViolationException;
import dev.mars.spacetime.api.error.SpaceTimeErrorCodes;
import dev.mars.spacetime.api.model.AbsoluteTemporalExtent;
import dev.mars.spacetime.api.model.Granularity;
import dev.mars.spacetime.api.model.MapDataset;
import dev.mars.spacetime.api.model.MapTime;
import dev.mars.spacetime.api.model.RelativeTemporalExtent;
import dev.mars.spacetime.api.model.SpaceTimeDataset;
import dev.mars.spacetime.api.model.TemporalExtent;
import dev.mars.spacetime.api.model.TemporalType;
import dev.mars.spacetime.api.relation.SamplingMethod;
import dev.mars.spacetime.api.relation.TemporalRelation;
import dev.mars.spacetime.db.store.DatasetStore;
import dev.mars.spacetime.temporal.sql.TemporalRelationWhereBuilder;
import dev.mars.spacetime.temporal.topology.TemporalTopologyBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Walks the members of a dataset in time order: with gap placeholders between
 * them, in fixed granularity steps, or along the granules of another dataset.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-18
 * @version 1.0
 */
public class GranuleSampler {
    private static final Logger logger = LoggerFactory.getLogger(GranuleSampler.class);

    private final DatasetStore store;

    public GranuleSampler(DatasetStore store) {
        this.store = store;
    }

    /**
     * Members ordered by start time with a gap placeholder inserted wherever
     * the next member starts after the current one has ended.
     *
     * @param where optional SQL predicate restricting the members
     */
    public List<MapDataset> mapsWithGaps(SpaceTimeDataset dataset, String where) {
        List<MapDataset> maps = store.selectRegisteredMaps(dataset, where, "start_time");
        List<MapDataset> result = new ArrayList<>();
        for (int i = 0; i < maps.size(); i++) {
            MapDataset current = maps.get(i);
            result.add(current);
            if (i + 1 < maps.size()) {
                MapDataset following = maps.get(i + 1);
                TemporalExtent currentTime = current.getTemporalExtent();
                TemporalExtent followingTime = following.getTemporalExtent();
                if (followingTime.relationTo(currentTime) == TemporalRelation.AFTER) {
                    result.add(MapDataset.gap(dataset.getKind(),
                        extent(dataset, currentTime.effectiveEndOrdinal(), followingTime.startOrdinal(), currentTime)));
                }
            }
        }
        return result;
    }

    /**
     * Partitions the dataset extent into steps of {@code granularity} (the
     * dataset's own granularity when null). Steps without members are gaps.
     *
     * @throws ConsistencyViolationException unless the dataset has interval map time
     */
    public List<Granule> mapsByGranularity(SpaceTimeDataset dataset, Granularity granularity) {
        if (dataset.getMapTime() != MapTime.INTERVAL) {
            throw new ConsistencyViolationException(SpaceTimeErrorCodes.MAP_TIME_NOT_INTERVAL,
                "The space time " + dataset.getKind().getMapType() + " dataset <" + dataset.getId()
                    + "> must have interval time");
        }
        Granularity step = granularity != null ? granularity : dataset.getGranularity();
        if (step == null || dataset.getTemporalExtent() == null) {
            throw new ConsistencyViolationException(SpaceTimeErrorCodes.INVALID_GRANULARITY,
                "Space time dataset <" + dataset.getId() + "> has no granularity");
        }

        List<Granule> granules = new ArrayList<>();
        TemporalExtent extent = dataset.getTemporalExtent();
        if (extent.getType() == TemporalType.ABSOLUTE) {
            LocalDateTime start = ((AbsoluteTemporalExtent) extent).getStart();
            LocalDateTime end = ((AbsoluteTemporalExtent) extent).getEnd();
            while (start.isBefore(end)) {
                LocalDateTime next = step.addTo(start);
                granules.add(granule(dataset, new AbsoluteTemporalExtent(start, next)));
                start = next;
            }
        } else {
            RelativeTemporalExtent relative = (RelativeTemporalExtent) extent;
            long start = relative.getStart();
            long end = relative.getEnd();
            while (start < end) {
                long next = step.addTo(start);
                granules.add(granule(dataset, new RelativeTemporalExtent(start, next, relative.getUnit())));
                start = next;
            }
        }
        return granules;
    }

    private Granule granule(SpaceTimeDataset dataset, TemporalExtent step) {
        String where = "(start_time <= " + TemporalRelationWhereBuilder.startLiteral(step)
            + " and end_time >= " + TemporalRelationWhereBuilder.endLiteral(step) + ")";
        List<MapDataset> members = store.selectRegisteredMaps(dataset, where, "start_time");
        if (members.size() > 1) {
            logger.warn("More than one map found in a granule. Temporal granularity seems to be invalid or the chosen "
                + "granularity is not a greatest common divider of all intervals and gaps in the dataset.");
        }
        return new Granule(step, members);
    }

    /**
     * Samples the members of {@code dataset} by the granules of {@code sampler}.
     * A dataset with point map time is sampled by start time only.
     *
     * @param methods sampling methods; during, overlap, contain and equal when null or empty
     * @param spatial additionally require spatial overlap with the granule
     * @throws ConsistencyViolationException if the temporal types differ or the
     *         sampler does not have interval map time
     */
    public List<SampleEntry> sampleByDataset(SpaceTimeDataset dataset, SpaceTimeDataset sampler,
                                             Set<SamplingMethod> methods, boolean spatial) {
        if (dataset.getTemporalType() != sampler.getTemporalType()) {
            throw new ConsistencyViolationException(SpaceTimeErrorCodes.TEMPORAL_TYPE_MISMATCH,
                "The space time datasets must be of the same temporal type");
        }
        if (sampler.getMapTime() != MapTime.INTERVAL) {
            throw new ConsistencyViolationException(SpaceTimeErrorCodes.MAP_TIME_NOT_INTERVAL,
                "The temporal map type of the sample dataset must be interval");
        }

        Set<SamplingMethod> effective = methods == null || methods.isEmpty()
            ? SamplingMethod.defaults() : EnumSet.copyOf(methods);
        if (dataset.getMapTime() == MapTime.POINT) {
            effective = EnumSet.of(SamplingMethod.START);
        }

        List<SampleEntry> entries = new ArrayList<>();
        for (MapDataset granule : mapsWithGaps(sampler, null)) {
            TemporalExtent time = granule.getTemporalExtent();
            Optional<String> where = TemporalRelationWhereBuilder.buildWhere(time, effective);
            List<MapDataset> samples = new ArrayList<>();
            if (where.isPresent()) {
                for (MapDataset map : store.selectRegisteredMaps(dataset, where.get(), "start_time")) {
                    if (spatial && granule.getSpatialExtent() != null
                            && !TemporalTopologyBuilder.spatiallyOverlapping(granule, map)) {
                        continue;
                    }
                    samples.add(map);
                }
            }
            if (samples.isEmpty()) {
                samples.add(MapDataset.gap(dataset.getKind(),
                    extent(dataset, time.startOrdinal(), time.effectiveEndOrdinal(), time)));
            }
            entries.add(new SampleEntry(granule, samples));
        }
        logger.debug("Sampled <{}> by {} granules of <{}>", dataset.getId(), entries.size(), sampler.getId());
        return entries;
    }

    /**
     * Extent of {@code dataset}'s temporal type between two ordinals.
     */
    private static TemporalExtent extent(SpaceTimeDataset dataset, long start, long end, TemporalExtent template) {
        if (template.getType() == TemporalType.ABSOLUTE) {
            return new AbsoluteTemporalExtent(
                LocalDateTime.ofEpochSecond(start, 0, ZoneOffset.UTC),
                LocalDateTime.ofEpochSecond(end, 0, ZoneOffset.UTC));
        }
        RelativeTemporalExtent relative = (RelativeTemporalExtent) template;
        return new RelativeTemporalExtent(start, end,
            dataset.getRelativeUnit() != null ? dataset.getRelativeUnit() : relative.getUnit());
    }
}
