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

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Absolute (calendar) time stamp with an optional time zone offset in hours.
 */
public final class AbsoluteTemporalExtent extends TemporalExtent {

    public static final DateTimeFormatter SQL_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final LocalDateTime start;
    private final LocalDateTime end;
    private final Integer timezone;

    public AbsoluteTemporalExtent(LocalDateTime start, LocalDateTime end) {
        this(start, end, null);
    }

    public AbsoluteTemporalExtent(LocalDateTime start, LocalDateTime end, Integer timezone) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = end;
        this.timezone = timezone;
    }

    public static AbsoluteTemporalExtent point(LocalDateTime start) {
        return new AbsoluteTemporalExtent(start, null);
    }

    public LocalDateTime getStart() {
        return start;
    }

    public LocalDateTime getEnd() {
        return end;
    }

    public Integer getTimezone() {
        return timezone;
    }

    @Override
    public TemporalType getType() {
        return TemporalType.ABSOLUTE;
    }

    @Override
    public long startOrdinal() {
        return start.toEpochSecond(ZoneOffset.UTC);
    }

    @Override
    public Long endOrdinal() {
        return end == null ? null : end.toEpochSecond(ZoneOffset.UTC);
    }

    @Override
    protected TemporalExtent fromOrdinals(long start, Long end) {
        return new AbsoluteTemporalExtent(
            LocalDateTime.ofEpochSecond(start, 0, ZoneOffset.UTC),
            end == null ? null : LocalDateTime.ofEpochSecond(end, 0, ZoneOffset.UTC),
            timezone);
    }

    @Override
    public String toString() {
        return "[" + start.format(SQL_FORMAT) + ", " + (end == null ? "None" : end.format(SQL_FORMAT)) + ")";
    }
}
