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

import dev.mars.spacetime.api.model.MapDataset;
import dev.mars.spacetime.api.model.MapTime;
import dev.mars.spacetime.api.model.TimeStamped;
import dev.mars.spacetime.api.relation.TemporalRelation;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Topology diagnostics over the start-time ordered members of one dataset.
 */
public final class TemporalTopologyChecker {

    private static final Set<TemporalRelation> INTERVAL_VIOLATIONS = EnumSet.of(
        TemporalRelation.EQUAL, TemporalRelation.DURING, TemporalRelation.CONTAINS,
        TemporalRelation.OVERLAPS, TemporalRelation.OVERLAPPED, TemporalRelation.STARTS,
        TemporalRelation.STARTED, TemporalRelation.FINISHES, TemporalRelation.FINISHED);

    private TemporalTopologyChecker() {
    }

    /** Number of holes between temporal neighbours. */
    public static int countGaps(List<? extends TimeStamped> maps) {
        int gaps = 0;
        for (int i = 0; i + 1 < maps.size(); i++) {
            TemporalRelation relation = maps.get(i + 1).getTemporalExtent().relationTo(maps.get(i).getTemporalExtent());
            if (relation == TemporalRelation.AFTER) {
                gaps++;
            }
        }
        return gaps;
    }

    /**
     * Counts the relations of the upper right half of the relation matrix: each
     * unordered pair contributes the relation of the earlier entity to the later one.
     */
    public static Map<TemporalRelation, Integer> countTemporalRelations(List<? extends TimeStamped> maps) {
        Map<TemporalRelation, Integer> counts = new LinkedHashMap<>();
        for (int i = 0; i < maps.size(); i++) {
            for (int j = i + 1; j < maps.size(); j++) {
                TemporalRelation relation = maps.get(i).getTemporalExtent().relationTo(maps.get(j).getTemporalExtent());
                if (relation.isIndexed()) {
                    counts.merge(relation, 1, Integer::sum);
                }
            }
        }
        return counts;
    }

    /**
     * Interval and mixed datasets must not nest, overlap or repeat time
     * stamps; point datasets must not repeat them. Invalid datasets always fail.
     */
    public static boolean checkTemporalTopology(MapTime mapTime, List<? extends TimeStamped> maps) {
        Map<TemporalRelation, Integer> relations = countTemporalRelations(maps);
        if (mapTime == MapTime.INTERVAL || mapTime == MapTime.MIXED) {
            for (TemporalRelation relation : relations.keySet()) {
                if (INTERVAL_VIOLATIONS.contains(relation)) {
                    return false;
                }
            }
            return true;
        }
        if (mapTime == MapTime.POINT) {
            return !relations.containsKey(TemporalRelation.EQUAL);
        }
        return false;
    }

    /**
     * Human readable relation listing: one block per map with its related maps.
     */
    public static String formatRelationMatrix(List<MapDataset> maps) {
        RelationIndex<MapDataset, MapDataset> index = TemporalTopologyBuilder.build(maps, false);
        StringBuilder out = new StringBuilder();
        for (MapDataset map : index.getEntities()) {
            out.append(map.getId()).append(' ').append(map.getTemporalExtent()).append('\n');
            for (TemporalRelation relation : index.relationsOf(map)) {
                out.append("    ").append(relation.getName()).append(':');
                for (MapDataset related : index.related(map, relation)) {
                    out.append(' ').append(related.getId());
                }
                out.append('\n');
            }
        }
        return out.toString();
    }
}
