package dev.mars.spacetime.temporal.sampling;

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
import dev.mars.spacetime.api.model.TemporalExtent;

import java.util.List;

/**
 * One step of a fixed granularity partition of a dataset's time axis with
 * the members found in it. A granule without members is a gap.
 */
public record Granule(TemporalExtent extent, List<MapDataset> maps) {

    public Granule {
        maps = List.copyOf(maps);
    }

    public boolean isGap() {
        return maps.isEmpty();
    }
}
