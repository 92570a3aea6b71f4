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

import java.util.List;

/**
 * A granule of the sampling dataset with the sampled maps related to it.
 * {@code samples} is never empty: when nothing matches it holds one gap
 * placeholder spanning the granule.
 */
public record SampleEntry(MapDataset granule, List<MapDataset> samples) {

    public SampleEntry {
        samples = List.copyOf(samples);
    }
}
