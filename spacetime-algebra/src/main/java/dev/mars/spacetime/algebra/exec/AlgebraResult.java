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

import dev.mars.spacetime.api.model.MapDataset;
import dev.mars.spacetime.api.model.SpaceTimeDataset;

import java.util.List;

/**
 * Outcome of a terminal assignment.
 *
 * @param dataset     the newly created result dataset
 * @param registered  result maps registered in it
 * @param removed     ids of empty result maps removed from the spatial database
 * @param expressions calculator expressions in submission order
 */
public record AlgebraResult(SpaceTimeDataset dataset, List<MapDataset> registered, List<String> removed,
                            List<String> expressions) {

    public AlgebraResult {
        registered = List.copyOf(registered);
        removed = List.copyOf(removed);
        expressions = List.copyOf(expressions);
    }
}
