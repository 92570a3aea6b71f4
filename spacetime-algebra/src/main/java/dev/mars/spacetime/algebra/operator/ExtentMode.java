package dev.mars.spacetime.algebra.operator;

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

import dev.mars.spacetime.api.error.SpaceTimeErrorCodes;
import dev.mars.spacetime.api.error.TemporalSyntaxException;

import java.util.Locale;

/**
 * How the temporal extent of a result map is derived from two related maps.
 */
public enum ExtentMode {
    /** Keep the extent of the left map. */
    LEFT("l", "left"),
    /** Take the extent of the right map, one result per related pair. */
    RIGHT("r", "right"),
    /** Hull of both extents; fails when they are separated by a gap. */
    UNION("u", "union"),
    /** Common part of both extents; fails when they do not intersect. */
    INTERSECT("i", "intersect"),
    /** Hull of both extents, whether they touch or not. */
    DISJOINT_UNION("d", "disjoint");

    private final String symbol;
    private final String word;

    ExtentMode(String symbol, String word) {
        this.symbol = symbol;
        this.word = word;
    }

    public String getSymbol() {
        return symbol;
    }

    public static boolean isMode(String text) {
        for (ExtentMode mode : values()) {
            if (mode.symbol.equalsIgnoreCase(text.trim()) || mode.word.equalsIgnoreCase(text.trim())) {
                return true;
            }
        }
        return false;
    }

    public static ExtentMode fromText(String text) {
        String value = text.trim().toLowerCase(Locale.ROOT);
        for (ExtentMode mode : values()) {
            if (mode.symbol.equals(value) || mode.word.equals(value)) {
                return mode;
            }
        }
        throw new TemporalSyntaxException(SpaceTimeErrorCodes.ALGEBRA_SYNTAX_ERROR,
            "Unknown temporal extent operator '" + text + "', expected one of l, r, u, i, d");
    }
}
