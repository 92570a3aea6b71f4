package dev.mars.spacetime.temporal.sql;

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

import dev.mars.spacetime.api.model.AbsoluteTemporalExtent;
import dev.mars.spacetime.api.model.RelativeTemporalExtent;
import dev.mars.spacetime.api.model.TemporalExtent;
import dev.mars.spacetime.api.relation.SamplingMethod;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds SQL predicates that select maps by their temporal relation to a
 * granule {@code [S, E)}. The predicate refers to the {@code start_time} and
 * {@code end_time} columns of the map time tables.
 * <p>
 * Clauses are always emitted in the order start, during, overlap, contain,
 * equal, follows, precedes, whatever the iteration order of the method set.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-15
 * @version 1.0
 */
public final class TemporalRelationWhereBuilder {

    private TemporalRelationWhereBuilder() {
    }

    /**
     * @return the predicate, or empty when {@code methods} is empty
     */
    public static Optional<String> buildWhere(LocalDateTime start, LocalDateTime end, Set<SamplingMethod> methods) {
        return build(literal(start), literal(end), methods);
    }

    public static Optional<String> buildWhere(long start, long end, Set<SamplingMethod> methods) {
        return build(Long.toString(start), Long.toString(end), methods);
    }

    /**
     * Predicate for an interval granule. Literal formatting follows the temporal type of {@code granule}.
     */
    public static Optional<String> buildWhere(TemporalExtent granule, Set<SamplingMethod> methods) {
        return build(startLiteral(granule), endLiteral(granule), methods);
    }

    /** SQL literal of the start of {@code extent}. */
    public static String startLiteral(TemporalExtent extent) {
        if (extent instanceof AbsoluteTemporalExtent) {
            return literal(((AbsoluteTemporalExtent) extent).getStart());
        }
        return Long.toString(((RelativeTemporalExtent) extent).getStart());
    }

    /** SQL literal of the end of {@code extent}, or of its start for instants. */
    public static String endLiteral(TemporalExtent extent) {
        if (extent instanceof AbsoluteTemporalExtent) {
            AbsoluteTemporalExtent abs = (AbsoluteTemporalExtent) extent;
            return literal(abs.getEnd() != null ? abs.getEnd() : abs.getStart());
        }
        RelativeTemporalExtent rel = (RelativeTemporalExtent) extent;
        return Long.toString(rel.getEnd() != null ? rel.getEnd() : rel.getStart());
    }

    public static String literal(LocalDateTime time) {
        return "'" + AbsoluteTemporalExtent.SQL_FORMAT.format(time) + "'";
    }

    private static Optional<String> build(String s, String e, Set<SamplingMethod> methods) {
        List<String> clauses = new ArrayList<>();
        if (methods.contains(SamplingMethod.START)) {
            clauses.add("(start_time >= " + s + " and start_time < " + e + ")");
        }
        if (methods.contains(SamplingMethod.DURING)) {
            clauses.add("((start_time > " + s + " and end_time < " + e + ") OR "
                + "(start_time >= " + s + " and end_time < " + e + ") OR "
                + "(start_time > " + s + " and end_time <= " + e + "))");
        }
        if (methods.contains(SamplingMethod.OVERLAP)) {
            clauses.add("((start_time < " + s + " and end_time > " + s + " and end_time < " + e + ") OR "
                + "(start_time < " + e + " and start_time > " + s + " and end_time > " + e + "))");
        }
        if (methods.contains(SamplingMethod.CONTAIN)) {
            clauses.add("((start_time < " + s + " and end_time > " + e + ") OR "
                + "(start_time <= " + s + " and end_time > " + e + ") OR "
                + "(start_time < " + s + " and end_time >= " + e + "))");
        }
        if (methods.contains(SamplingMethod.EQUAL)) {
            clauses.add("(start_time = " + s + " and end_time = " + e + ")");
        }
        if (methods.contains(SamplingMethod.FOLLOWS)) {
            clauses.add("(start_time = " + e + ")");
        }
        if (methods.contains(SamplingMethod.PRECEDES)) {
            clauses.add("(end_time = " + s + ")");
        }
        if (clauses.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of("(" + String.join(" OR ", clauses) + ")");
    }
}
