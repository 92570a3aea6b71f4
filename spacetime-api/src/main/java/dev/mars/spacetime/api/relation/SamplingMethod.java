package dev.mars.spacetime.api.relation;

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

import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Temporal sampling methods, in the order their SQL clauses are emitted.
 */
public enum SamplingMethod {
    START,
    DURING,
    OVERLAP,
    CONTAIN,
    EQUAL,
    FOLLOWS,
    PRECEDES;

    /** Methods used when a caller does not name any. */
    public static Set<SamplingMethod> defaults() {
        return EnumSet.of(DURING, OVERLAP, CONTAIN, EQUAL);
    }

    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SamplingMethod fromName(String name) {
        if (name != null) {
            String upper = name.trim().toUpperCase(Locale.ROOT);
            for (SamplingMethod method : values()) {
                if (method.name().equals(upper)) {
                    return method;
                }
            }
        }
        throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_SAMPLING_METHOD,
            "Unknown sampling method '" + name + "'");
    }

    public static Set<SamplingMethod> fromNames(Collection<String> names) {
        Set<SamplingMethod> methods = EnumSet.noneOf(SamplingMethod.class);
        for (String name : names) {
            methods.add(fromName(name));
        }
        return methods;
    }
}
