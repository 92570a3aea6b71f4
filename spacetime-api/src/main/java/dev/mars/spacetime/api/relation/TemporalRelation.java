package dev.mars.spacetime.api.relation;

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

import dev.mars.spacetime.api.error.SpaceTimeErrorCodes;
import dev.mars.spacetime.api.error.TemporalSyntaxException;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Allen-style temporal relations between time stamps, each with its complement.
 * {@link #AFTER} and {@link #BEFORE} describe separated extents and are never
 * stored in a relation index.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public enum TemporalRelation {
    EQUAL,
    DURING,
    CONTAINS,
    OVERLAPS,
    OVERLAPPED,
    STARTS,
    STARTED,
    FINISHES,
    FINISHED,
    FOLLOWS,
    PRECEDES,
    AFTER,
    BEFORE;

    private static final Set<TemporalRelation> INDEXED = EnumSet.range(EQUAL, PRECEDES);
    private static final Set<TemporalRelation> INTERSECTING = EnumSet.range(EQUAL, FINISHED);

    public TemporalRelation complement() {
        switch (this) {
            case DURING: return CONTAINS;
            case CONTAINS: return DURING;
            case OVERLAPS: return OVERLAPPED;
            case OVERLAPPED: return OVERLAPS;
            case STARTS: return STARTED;
            case STARTED: return STARTS;
            case FINISHES: return FINISHED;
            case FINISHED: return FINISHES;
            case FOLLOWS: return PRECEDES;
            case PRECEDES: return FOLLOWS;
            case AFTER: return BEFORE;
            case BEFORE: return AFTER;
            default: return EQUAL;
        }
    }

    /** Relations kept in a relation index. */
    public boolean isIndexed() {
        return INDEXED.contains(this);
    }

    /** Relations whose extents share at least one instant of time. */
    public boolean isIntersecting() {
        return INTERSECTING.contains(this);
    }

    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive lookup of an indexed relation.
     *
     * @throws TemporalSyntaxException for unknown names
     */
    public static TemporalRelation fromName(String name) {
        if (name != null) {
            String upper = name.trim().toUpperCase(Locale.ROOT);
            for (TemporalRelation relation : values()) {
                if (relation.isIndexed() && relation.name().equals(upper)) {
                    return relation;
                }
            }
        }
        throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_RELATION_NAME,
            "Unpermitted temporal relation name '" + name + "'");
    }

    /**
     * Parses a {@code |} separated relation list such as {@code equal|during}.
     */
    public static Set<TemporalRelation> parseList(String relations) {
        Set<TemporalRelation> result = new LinkedHashSet<>();
        for (String part : relations.split("\\|")) {
            if (!part.trim().isEmpty()) {
                result.add(fromName(part));
            }
        }
        return result;
    }
}
