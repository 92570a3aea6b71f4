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

import dev.mars.spacetime.api.model.TimeStamped;
import dev.mars.spacetime.api.relation.TemporalRelation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Relations between the entities of a left list and those of a right list.
 * Entities are keyed by identity, so two maps with equal content are distinct
 * entries. An index is built per operation and never persisted.
 *
 * @param <A> left entity type
 * @param <B> right entity type
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-14
 * @version 1.0
 */
public final class RelationIndex<A extends TimeStamped, B extends TimeStamped> {

    private final List<A> entities;
    private final Map<A, Map<TemporalRelation, List<B>>> relations = new IdentityHashMap<>();
    private final Map<A, A> next = new IdentityHashMap<>();
    private final Map<A, A> previous = new IdentityHashMap<>();
    private int comparisons;

    RelationIndex(List<A> entities) {
        this.entities = Collections.unmodifiableList(new ArrayList<>(entities));
        for (A entity : entities) {
            relations.put(entity, new EnumMap<>(TemporalRelation.class));
        }
    }

    void add(A entity, TemporalRelation relation, B related) {
        relations.get(entity).computeIfAbsent(relation, r -> new ArrayList<>()).add(related);
    }

    void link(A current, A following) {
        next.put(current, following);
        previous.put(following, current);
    }

    void countComparison() {
        comparisons++;
    }

    /** Left entities in input order. */
    public List<A> getEntities() {
        return entities;
    }

    /** Entities related to {@code entity} by {@code relation}, in right list order. */
    public List<B> related(A entity, TemporalRelation relation) {
        Map<TemporalRelation, List<B>> byRelation = relations.get(entity);
        if (byRelation == null) {
            return List.of();
        }
        List<B> result = byRelation.get(relation);
        return result == null ? List.of() : Collections.unmodifiableList(result);
    }

    /**
     * Entities related to {@code entity} by any of {@code wanted}; an entity
     * matching several relations is listed once.
     */
    public List<B> related(A entity, Collection<TemporalRelation> wanted) {
        Map<B, Boolean> seen = new IdentityHashMap<>();
        List<B> result = new ArrayList<>();
        for (TemporalRelation relation : TemporalRelation.values()) {
            if (!wanted.contains(relation)) {
                continue;
            }
            for (B candidate : related(entity, relation)) {
                if (seen.put(candidate, Boolean.TRUE) == null) {
                    result.add(candidate);
                }
            }
        }
        return result;
    }

    /** Relation names present for {@code entity}. */
    public Set<TemporalRelation> relationsOf(A entity) {
        Map<TemporalRelation, List<B>> byRelation = relations.get(entity);
        return byRelation == null ? Set.of() : Collections.unmodifiableSet(byRelation.keySet());
    }

    /** Temporal successor in single-list mode. */
    public Optional<A> next(A entity) {
        return Optional.ofNullable(next.get(entity));
    }

    /** Temporal predecessor in single-list mode. */
    public Optional<A> previous(A entity) {
        return Optional.ofNullable(previous.get(entity));
    }

    /**
     * Number of related pairs per relation, over all left entities.
     */
    public Map<TemporalRelation, Integer> countRelations() {
        Map<TemporalRelation, Integer> counts = new LinkedHashMap<>();
        for (TemporalRelation relation : TemporalRelation.values()) {
            int count = 0;
            for (A entity : entities) {
                count += related(entity, relation).size();
            }
            if (count > 0) {
                counts.put(relation, count);
            }
        }
        return counts;
    }

    /** Pairwise comparisons performed while building the index. */
    public int getComparisons() {
        return comparisons;
    }
}
