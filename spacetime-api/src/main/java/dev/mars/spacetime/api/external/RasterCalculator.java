package dev.mars.spacetime.api.external;

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
 * The external map calculator invoked once per result map.
 */
@FunctionalInterface
public interface RasterCalculator {

    /**
     * Runs one {@code name = expression} job and waits for it to finish.
     *
     * @param expression full calculator expression including the target name
     * @param overwrite  whether an existing target may be replaced
     * @return process exit code, zero on success
     */
    int compute(String expression, boolean overwrite);
}
