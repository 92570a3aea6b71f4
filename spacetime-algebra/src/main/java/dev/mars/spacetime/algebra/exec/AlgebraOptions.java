package dev.mars.spacetime.algebra.exec;

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
import dev.mars.spacetime.api.model.DatasetId;
import dev.mars.spacetime.api.model.DatasetKind;
import dev.mars.spacetime.db.config.SpaceTimeConfiguration;

/**
 * Settings of one algebra run.
 *
 * @param kind         dataset kind of operands and result
 * @param basename     result maps are named {@code basename_i}
 * @param nprocs       size of the calculator worker pool
 * @param spatial      pair maps only when their spatial extents overlap
 * @param registerNull also register results without any data
 * @param overwrite    replace existing result maps and dataset
 */
public record AlgebraOptions(DatasetKind kind, String basename, int nprocs, boolean spatial, boolean registerNull,
                             boolean overwrite) {

    public AlgebraOptions {
        if (basename == null || basename.trim().isEmpty()) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT, "A basename is required");
        }
        DatasetId.requireLegalName(basename);
        if (nprocs < 1) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT,
                "Number of processes must be at least 1, got " + nprocs);
        }
    }

    /** Raster options taking pool size, spatial and null handling from the configuration. */
    public static AlgebraOptions from(SpaceTimeConfiguration.AlgebraConfig config, String basename, boolean overwrite) {
        return new AlgebraOptions(DatasetKind.RASTER, basename, config.getNprocs(), config.isSpatial(),
            config.isRegisterNull(), overwrite);
    }

    public AlgebraOptions withNprocs(int value) {
        return new AlgebraOptions(kind, basename, value, spatial, registerNull, overwrite);
    }

    public AlgebraOptions withSpatial(boolean value) {
        return new AlgebraOptions(kind, basename, nprocs, value, registerNull, overwrite);
    }

    public AlgebraOptions withRegisterNull(boolean value) {
        return new AlgebraOptions(kind, basename, nprocs, spatial, value, overwrite);
    }

    public AlgebraOptions withKind(DatasetKind value) {
        return new AlgebraOptions(value, basename, nprocs, spatial, registerNull, overwrite);
    }
}
