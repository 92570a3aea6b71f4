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

import java.util.List;

/**
 * Looks up the operands named in an expression.
 */
public interface DatasetResolver {

    /**
     * Members of a space time dataset as fresh working maps, ordered by start time.
     *
     * @throws dev.mars.spacetime.api.error.SpaceTimeException if the dataset or one of its maps does not exist
     */
    List<AlgebraMap> resolveDataset(String name);

    /**
     * Full id of a single map.
     *
     * @throws dev.mars.spacetime.api.error.SpaceTimeException if the map does not exist
     */
    String resolveMap(String name);
}
