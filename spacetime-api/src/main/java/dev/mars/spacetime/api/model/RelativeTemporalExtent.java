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

import java.util.Objects;

/**
 * Relative time stamp: plain integers in a dataset-wide unit.
 */
public final class RelativeTemporalExtent extends TemporalExtent {

    private final long start;
    private final Long end;
    private final CalendarUnit unit;

    public RelativeTemporalExtent(long start, Long end, CalendarUnit unit) {
        this.start = start;
        this.end = end;
        this.unit = Objects.requireNonNull(unit, "unit must not be null");
    }

    public long getStart() {
        return start;
    }

    public Long getEnd() {
        return end;
    }

    public CalendarUnit getUnit() {
        return unit;
    }

    @Override
    public TemporalType getType() {
        return TemporalType.RELATIVE;
    }

    @Override
    public long startOrdinal() {
        return start;
    }

    @Override
    public Long endOrdinal() {
        return end;
    }

    @Override
    protected TemporalExtent fromOrdinals(long start, Long end) {
        return new RelativeTemporalExtent(start, end, unit);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + (end == null ? "None" : end) + ") " + unit.getPlural();
    }
}
