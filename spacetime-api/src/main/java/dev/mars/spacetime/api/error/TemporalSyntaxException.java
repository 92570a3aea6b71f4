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
 * Usage error: unknown relation or sampling method names, malformed algebra
 * expressions and similar caller mistakes.
 */
public class TemporalSyntaxException extends SpaceTimeException {

    public TemporalSyntaxException(String message) {
        super(SpaceTimeErrorCodes.ALGEBRA_SYNTAX_ERROR, message);
    }

    public TemporalSyntaxException(String code, String message) {
        super(code, message);
    }
}
