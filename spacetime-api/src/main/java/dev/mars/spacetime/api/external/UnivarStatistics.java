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
 * Univariate statistics over the non-null cells of one map. The quartiles and
 * the 90th percentile are only set when extended statistics were requested.
 */
public record UnivarStatistics(double mean, double min, double max, double meanOfAbs, double stddev,
                               double variance, double coeffVar, double sum, long nullCells, long cells,
                               Double firstQuartile, Double median, Double thirdQuartile, Double percentile90) {

    public static UnivarStatistics basic(double mean, double min, double max, double meanOfAbs, double stddev,
                                         double variance, double coeffVar, double sum, long nullCells, long cells) {
        return new UnivarStatistics(mean, min, max, meanOfAbs, stddev, variance, coeffVar, sum, nullCells, cells,
            null, null, null, null);
    }

    public long nonNullCells() {
        return cells - nullCells;
    }

    public boolean isExtended() {
        return median != null;
    }
}
