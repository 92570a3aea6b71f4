package dev.mars.spacetime.api.error;

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
 * One or more external raster calculator jobs returned a nonzero exit code.
 */
public class ComputationFailedException extends SpaceTimeException {

    private final List<String> failedOutputs;

    public ComputationFailedException(String message, List<String> failedOutputs) {
        super(SpaceTimeErrorCodes.COMPUTATION_FAILED, message);
        this.failedOutputs = List.copyOf(failedOutputs);
    }

    public ComputationFailedException(String message, Throwable cause) {
        super(SpaceTimeErrorCodes.EXTERNAL_PROCESS_FAILED, message, cause);
        this.failedOutputs = List.of();
    }

    public List<String> getFailedOutputs() {
        return failedOutputs;
    }
}
