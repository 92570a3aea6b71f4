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

/**
 * Standard error codes for the space-time dataset engine.
 *
 * Error code ranges:
 * - STERR0001-0049: General/System errors
 * - STERR0050-0099: Usage errors (bad names, bad expressions)
 * - STERR0100-0149: Consistency violations
 * - STERR0150-0199: Database/Transaction errors
 * - STERR0200-0249: External computation errors
 * - STERR0250-0299: Configuration errors
 */
public final class SpaceTimeErrorCodes {

    private SpaceTimeErrorCodes() {
        // Utility class - no instantiation
    }

    // General/System errors (0001-0049)
    public static final String INTERNAL_ERROR = "STERR0001";
    public static final String INVALID_ARGUMENT = "STERR0002";

    // Usage errors (0050-0099)
    public static final String INVALID_RELATION_NAME = "STERR0050";
    public static final String ALGEBRA_SYNTAX_ERROR = "STERR0051";
    public static final String INVALID_SAMPLING_METHOD = "STERR0052";
    public static final String INVALID_GRANULARITY = "STERR0053";
    public static final String INVALID_DATASET_TYPE = "STERR0054";
    public static final String DATASET_NOT_FOUND = "STERR0055";
    public static final String MAP_NOT_FOUND = "STERR0056";
    public static final String OUTPUT_EXISTS = "STERR0057";
    public static final String INVALID_TIME_UNIT = "STERR0058";

    // Consistency violations (0100-0149)
    public static final String INVALID_TIME_STAMP = "STERR0100";
    public static final String TEMPORAL_TYPE_MISMATCH = "STERR0101";
    public static final String RELATIVE_UNIT_MISMATCH = "STERR0102";
    public static final String MAPSET_MISMATCH = "STERR0103";
    public static final String MAP_TIME_NOT_INTERVAL = "STERR0104";

    // Database/Transaction errors (0150-0199)
    public static final String DATABASE_ERROR = "STERR0150";
    public static final String TRANSACTION_FAILED = "STERR0151";
    public static final String SCHEMA_INIT_FAILED = "STERR0152";

    // External computation errors (0200-0249)
    public static final String COMPUTATION_FAILED = "STERR0200";
    public static final String EXTERNAL_PROCESS_FAILED = "STERR0201";

    // Configuration errors (0250-0299)
    public static final String CONFIGURATION_INVALID = "STERR0250";
}
