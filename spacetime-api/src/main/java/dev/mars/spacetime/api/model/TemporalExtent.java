package dev.mars.spacetime.api.model;

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
import dev.mars.spacetime.api.relation.TemporalRelation;

import java.util.Objects;
import java.util.Optional;

/**
 * A time instant (no end) or a half-open time interval {@code [start, end)}.
 * <p>
 * Relations and set operations are evaluated on ordinal values: epoch seconds
 * for absolute time, the raw integer for relative time. Subclasses convert
 * ordinals back into their own representation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public abstract class TemporalExtent {

    public abstract TemporalType getType();

    /** Start as ordinal value. */
    public abstract long startOrdinal();

    /** End as ordinal value, or null for a time instant. */
    public abstract Long endOrdinal();

    /** Creates an extent of the same type, time zone or unit from ordinal values. */
    protected abstract TemporalExtent fromOrdinals(long start, Long end);

    public boolean isPoint() {
        return endOrdinal() == null;
    }

    public boolean isInterval() {
        return endOrdinal() != null;
    }

    /**
     * A time stamp is valid when it is an instant, or an interval whose end lies after its start.
     */
    public boolean isValid() {
        Long end = endOrdinal();
        return end == null || end > startOrdinal();
    }

    /** End ordinal, or the start for instants. */
    public long effectiveEndOrdinal() {
        Long end = endOrdinal();
        return end != null ? end : startOrdinal();
    }

    /**
     * Classifies the relation of this extent with respect to {@code other}.
     * {@code a.relationTo(b)} is always the complement of {@code b.relationTo(a)}.
     */
    public TemporalRelation relationTo(TemporalExtent other) {
        if (other.getType() != getType()) {
            throw new ConsistencyViolationException(SpaceTimeErrorCodes.TEMPORAL_TYPE_MISMATCH,
                "Cannot relate " + getType().getName() + " and " + other.getType().getName() + " time stamps");
        }
        long s = startOrdinal();
        Long e = endOrdinal();
        long os = other.startOrdinal();
        Long oe = other.endOrdinal();

        if (e == null && oe == null) {
            if (s == os) {
                return TemporalRelation.EQUAL;
            }
            return s > os ? TemporalRelation.AFTER : TemporalRelation.BEFORE;
        }

        if (e == null) {
            if (s > os && s < oe) {
                return TemporalRelation.DURING;
            }
            if (s == os) {
                return TemporalRelation.STARTS;
            }
            if (s == oe) {
                return TemporalRelation.FINISHES;
            }
            return s > oe ? TemporalRelation.AFTER : TemporalRelation.BEFORE;
        }

        if (oe == null) {
            if (s < os && e > os) {
                return TemporalRelation.CONTAINS;
            }
            if (s == os) {
                return TemporalRelation.STARTED;
            }
            if (e == os) {
                return TemporalRelation.FINISHED;
            }
            return s > os ? TemporalRelation.AFTER : TemporalRelation.BEFORE;
        }

        if (s == os && e.longValue() == oe.longValue()) {
            return TemporalRelation.EQUAL;
        }
        if (s == os) {
            return e < oe ? TemporalRelation.STARTS : TemporalRelation.STARTED;
        }
        if (e.longValue() == oe.longValue()) {
            return s > os ? TemporalRelation.FINISHES : TemporalRelation.FINISHED;
        }
        if (s > os && e < oe) {
            return TemporalRelation.DURING;
        }
        if (s < os && e > oe) {
            return TemporalRelation.CONTAINS;
        }
        if (s < os && e > os && e < oe) {
            return TemporalRelation.OVERLAPS;
        }
        if (s > os && s < oe && e > oe) {
            return TemporalRelation.OVERLAPPED;
        }
        if (s == oe) {
            return TemporalRelation.FOLLOWS;
        }
        if (e == os) {
            return TemporalRelation.PRECEDES;
        }
        return s > oe ? TemporalRelation.AFTER : TemporalRelation.BEFORE;
    }

    /**
     * Common part of both extents; empty unless the extents share time.
     */
    public Optional<TemporalExtent> intersect(TemporalExtent other) {
        TemporalRelation relation = relationTo(other);
        if (!relation.isIntersecting()) {
            return Optional.empty();
        }
        long start = Math.max(startOrdinal(), other.startOrdinal());
        if (isPoint() || other.isPoint()) {
            return Optional.of(fromOrdinals(start, null));
        }
        long end = Math.min(endOrdinal(), other.endOrdinal());
        return Optional.of(fromOrdinals(start, end));
    }

    /**
     * Hull of both extents; empty when the extents are separated by a gap.
     */
    public Optional<TemporalExtent> union(TemporalExtent other) {
        TemporalRelation relation = relationTo(other);
        if (relation == TemporalRelation.AFTER || relation == TemporalRelation.BEFORE) {
            return Optional.empty();
        }
        return Optional.of(hull(other));
    }

    /**
     * Hull of both extents, whether they touch or not.
     */
    public TemporalExtent disjointUnion(TemporalExtent other) {
        if (other.getType() != getType()) {
            throw new ConsistencyViolationException(SpaceTimeErrorCodes.TEMPORAL_TYPE_MISMATCH,
                "Cannot combine " + getType().getName() + " and " + other.getType().getName() + " time stamps");
        }
        return hull(other);
    }

    private TemporalExtent hull(TemporalExtent other) {
        long start = Math.min(startOrdinal(), other.startOrdinal());
        long end = Math.max(effectiveEndOrdinal(), other.effectiveEndOrdinal());
        return fromOrdinals(start, end == start ? null : end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TemporalExtent that = (TemporalExtent) o;
        return startOrdinal() == that.startOrdinal()
            && Objects.equals(endOrdinal(), that.endOrdinal());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getType(), startOrdinal(), endOrdinal());
    }
}
