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

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * Axis aligned bounding box. Two dimensional extents carry zero top and bottom.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public final class SpatialExtent {

    private final double north;
    private final double south;
    private final double east;
    private final double west;
    private final double top;
    private final double bottom;

    public SpatialExtent(double north, double south, double east, double west) {
        this(north, south, east, west, 0.0, 0.0);
    }

    public SpatialExtent(double north, double south, double east, double west, double top, double bottom) {
        this.north = north;
        this.south = south;
        this.east = east;
        this.west = west;
        this.top = top;
        this.bottom = bottom;
    }

    public double getNorth() { return north; }
    public double getSouth() { return south; }
    public double getEast() { return east; }
    public double getWest() { return west; }
    public double getTop() { return top; }
    public double getBottom() { return bottom; }

    /**
     * True when the boxes share interior area (or volume when {@code threeDimensional}).
     */
    public boolean overlaps(SpatialExtent other, boolean threeDimensional) {
        if (east <= other.west || west >= other.east) {
            return false;
        }
        if (north <= other.south || south >= other.north) {
            return false;
        }
        return !threeDimensional || (top > other.bottom && bottom < other.top);
    }

    public Optional<SpatialExtent> intersect(SpatialExtent other, boolean threeDimensional) {
        if (!overlaps(other, threeDimensional)) {
            return Optional.empty();
        }
        return Optional.of(new SpatialExtent(
            Math.min(north, other.north), Math.max(south, other.south),
            Math.min(east, other.east), Math.max(west, other.west),
            threeDimensional ? Math.min(top, other.top) : top,
            threeDimensional ? Math.max(bottom, other.bottom) : bottom));
    }

    /**
     * Bounding box of both extents. Every axis keeps its own minimum and maximum.
     */
    public SpatialExtent union(SpatialExtent other) {
        return new SpatialExtent(
            Math.max(north, other.north), Math.min(south, other.south),
            Math.max(east, other.east), Math.min(west, other.west),
            Math.max(top, other.top), Math.min(bottom, other.bottom));
    }

    /**
     * Union of all non-null extents, or null when there is none.
     */
    public static SpatialExtent unionOf(Collection<SpatialExtent> extents) {
        SpatialExtent result = null;
        for (SpatialExtent extent : extents) {
            if (extent != null) {
                result = result == null ? extent : result.union(extent);
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SpatialExtent that = (SpatialExtent) o;
        return Double.compare(that.north, north) == 0 && Double.compare(that.south, south) == 0
            && Double.compare(that.east, east) == 0 && Double.compare(that.west, west) == 0
            && Double.compare(that.top, top) == 0 && Double.compare(that.bottom, bottom) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(north, south, east, west, top, bottom);
    }

    @Override
    public String toString() {
        return "SpatialExtent{n=" + north + ", s=" + south + ", e=" + east + ", w=" + west
            + ", t=" + top + ", b=" + bottom + "}";
    }
}
