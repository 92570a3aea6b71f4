package dev.mars.spacetime.temporal.topology;

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

import dev.mars.spacetime.api.model.SpatialExtent;
import dev.mars.spacetime.api.model.TimeStamped;
import dev.mars.spacetime.api.relation.TemporalRelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds temporal relation indexes between start-time ordered entity lists.
 * <p>
 * Every pair is classified, so the cost grows with the product of both list
 * sizes. Callers must pass lists sorted by start time; the sort order is not
 * verified.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-14
 * @version 1.0
 */
public final class TemporalTopologyBuilder {
    private static final Logger logger = LoggerFactory.getLogger(TemporalTopologyBuilder.class);

    private TemporalTopologyBuilder() {
    }

    /**
     * Relations of a list with itself. Self pairs are skipped and temporal
     * neighbours are linked.
     */
    public static <T extends TimeStamped> RelationIndex<T, T> build(List<T> entities, boolean spatial) {
        RelationIndex<T, T> index = new RelationIndex<>(entities);
        for (int i = 0; i < entities.size(); i++) {
            T a = entities.get(i);
            for (int j = 0; j < entities.size(); j++) {
                if (i != j) {
                    relate(index, a, entities.get(j), spatial);
                }
            }
            if (i + 1 < entities.size()) {
                index.link(a, entities.get(i + 1));
            }
        }
        logger.debug("Built self topology of {} entities with {} comparisons", entities.size(), index.getComparisons());
        return index;
    }

    /**
     * Relations of every entity of {@code left} with respect to every entity of {@code right}.
     */
    public static <A extends TimeStamped, B extends TimeStamped> RelationIndex<A, B> build(
            List<A> left, List<B> right, boolean spatial) {
        RelationIndex<A, B> index = new RelationIndex<>(left);
        for (A a : left) {
            for (B b : right) {
                relate(index, a, b, spatial);
            }
        }
        logger.debug("Built topology of {} x {} entities with {} comparisons", left.size(), right.size(),
            index.getComparisons());
        return index;
    }

    private static <A extends TimeStamped, B extends TimeStamped> void relate(
            RelationIndex<A, B> index, A a, B b, boolean spatial) {
        index.countComparison();
        TemporalRelation relation = a.getTemporalExtent().relationTo(b.getTemporalExtent());
        if (!relation.isIndexed()) {
            return;
        }
        if (spatial && !spatiallyOverlapping(a, b)) {
            return;
        }
        index.add(a, relation, b);
    }

    /**
     * Bounding volume test; 3D when both entities are three dimensional.
     * Entities without a spatial extent never overlap.
     */
    public static boolean spatiallyOverlapping(TimeStamped a, TimeStamped b) {
        SpatialExtent sa = a.getSpatialExtent();
        SpatialExtent sb = b.getSpatialExtent();
        if (sa == null || sb == null) {
            return false;
        }
        return sa.overlaps(sb, a.isThreeDimensional() && b.isThreeDimensional());
    }
}
