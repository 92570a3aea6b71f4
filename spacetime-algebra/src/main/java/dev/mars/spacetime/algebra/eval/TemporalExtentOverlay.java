package dev.mars.spacetime.algebra.eval;

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

import dev.mars.spacetime.algebra.operator.ExtentMode;
import dev.mars.spacetime.api.model.SpatialExtent;
import dev.mars.spacetime.api.model.TemporalExtent;

import java.util.Optional;

/**
 * Combines the extents of two related maps.
 * <p>
 * The temporal extent follows the {@link ExtentMode}. With spatial evaluation
 * the spatial extents are intersected as well; otherwise the base map keeps its
 * spatial extent. An empty result means the combination is dropped.
 */
public final class TemporalExtentOverlay {

    private final boolean spatial;

    public TemporalExtentOverlay(boolean spatial) {
        this.spatial = spatial;
    }

    public boolean isSpatial() {
        return spatial;
    }

    public Optional<AlgebraMap> overlay(AlgebraMap base, AlgebraMap other, ExtentMode mode) {
        Optional<TemporalExtent> temporal = temporal(base.getTemporalExtent(), other.getTemporalExtent(), mode);
        if (temporal.isEmpty()) {
            return Optional.empty();
        }

        SpatialExtent spatialExtent = base.getSpatialExtent();
        if (spatial) {
            if (base.getSpatialExtent() == null || other.getSpatialExtent() == null) {
                return Optional.empty();
            }
            Optional<SpatialExtent> common = base.getSpatialExtent().intersect(other.getSpatialExtent(),
                base.isThreeDimensional() && other.isThreeDimensional());
            if (common.isEmpty()) {
                return Optional.empty();
            }
            spatialExtent = common.get();
        }
        return Optional.of(base.withExtents(temporal.get(), spatialExtent));
    }

    static Optional<TemporalExtent> temporal(TemporalExtent base, TemporalExtent other, ExtentMode mode) {
        switch (mode) {
            case LEFT:
                return Optional.of(base);
            case RIGHT:
                return Optional.of(other);
            case UNION:
                return base.union(other);
            case INTERSECT:
                return base.intersect(other);
            case DISJOINT_UNION:
                return Optional.of(base.disjointUnion(other));
            default:
                throw new IllegalArgumentException("Unsupported extent mode " + mode);
        }
    }
}
