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

import java.time.Instant;

/**
 * Immutable error record used for single-line diagnostics.
 *
 * @param code      The standard error code (e.g., STERR0101)
 * @param message   Human-readable error message
 * @param timestamp When the error occurred
 * @param details   Optional additional details (can be null)
 */
public record SpaceTimeError(
    String code,
    String message,
    Instant timestamp,
    String details
) {
    /**
     * Creates an error with code, message, and details, using current timestamp.
     */
    public static SpaceTimeError of(String code, String message, String details) {
        return new SpaceTimeError(code, message, Instant.now(), details);
    }

    /**
     * Creates an error from an engine exception.
     */
    public static SpaceTimeError from(SpaceTimeException exception) {
        Throwable cause = exception.getCause();
        return of(exception.getCode(), exception.getMessage(), cause != null ? cause.getMessage() : null);
    }

    /**
     * Renders the error as the one-line diagnostic printed by the command surface.
     */
    public String toDiagnostic() {
        StringBuilder sb = new StringBuilder("ERROR: ").append(oneLine(message == null ? code : message))
            .append(" [").append(code).append(']');
        if (details != null && !details.isEmpty() && !details.equals(message)) {
            sb.append(" (").append(oneLine(details)).append(')');
        }
        return sb.toString();
    }

    private static String oneLine(String text) {
        return text.replaceAll("\\s*\\R\\s*", " ").trim();
    }
}
