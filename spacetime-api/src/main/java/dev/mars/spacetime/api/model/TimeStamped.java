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

/**
 * Anything that can take part in temporal topology: registered maps, gap
 * placeholders and the working maps of the algebra evaluator.
 */
public interface TimeStamped {

    TemporalExtent getTemporalExtent();

    /** May be null when the spatial extent is unknown. */
    SpatialExtent getSpatialExtent();

    /** Whether spatial overlap tests include the vertical axis. */
    default boolean isThreeDimensional() {
        return false;
    }
}
