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

import java.util.Locale;

/**
 * Classification of the member time stamps of a dataset.
 */
public enum MapTime {
    /** All members are time instants. */
    POINT,
    /** All members are time intervals. */
    INTERVAL,
    /** Instants and intervals are mixed. */
    MIXED,
    /** At least one member has an invalid time stamp. */
    INVALID;

    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MapTime fromName(String name) {
        return name == null ? null : valueOf(name.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Derives the classification from member counts.
     */
    public static MapTime classify(int points, int intervals, int invalid) {
        if (invalid > 0) {
            return INVALID;
        }
        if (points > 0 && intervals > 0) {
            return MIXED;
        }
        if (points > 0) {
            return POINT;
        }
        if (intervals > 0) {
            return INTERVAL;
        }
        return INVALID;
    }
}
