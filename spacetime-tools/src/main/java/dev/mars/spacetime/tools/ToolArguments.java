package dev.mars.spacetime.tools;

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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Module style command line: {@code key=value} parameters, single letter flags
 * such as {@code -g} or {@code -gt}, and {@code --o} / {@code --overwrite}.
 */
public final class ToolArguments {

    private final Map<String, String> parameters;
    private final Set<Character> flags;
    private final boolean overwrite;

    private ToolArguments(Map<String, String> parameters, Set<Character> flags, boolean overwrite) {
        this.parameters = Collections.unmodifiableMap(parameters);
        this.flags = Collections.unmodifiableSet(flags);
        this.overwrite = overwrite;
    }

    /**
     * @throws TemporalSyntaxException for unparseable arguments or repeated parameters
     */
    public static ToolArguments parse(List<String> args) {
        Map<String, String> parameters = new LinkedHashMap<>();
        Set<Character> flags = new LinkedHashSet<>();
        boolean overwrite = false;
        for (String arg : args) {
            if (arg.equals("--o") || arg.equals("--overwrite")) {
                overwrite = true;
            } else if (arg.startsWith("--")) {
                throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT, "Unknown option " + arg);
            } else if (arg.startsWith("-") && arg.length() > 1 && arg.indexOf('=') < 0) {
                for (char flag : arg.substring(1).toCharArray()) {
                    flags.add(flag);
                }
            } else {
                int eq = arg.indexOf('=');
                if (eq <= 0) {
                    throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT,
                        "Expected key=value but found '" + arg + "'");
                }
                String key = arg.substring(0, eq).trim();
                if (parameters.put(key, arg.substring(eq + 1)) != null) {
                    throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT,
                        "Parameter <" + key + "> given more than once");
                }
            }
        }
        return new ToolArguments(parameters, flags, overwrite);
    }

    public static ToolArguments parse(String... args) {
        return parse(Arrays.asList(args));
    }

    public String get(String key) {
        return parameters.get(key);
    }

    public String get(String key, String defaultValue) {
        return parameters.getOrDefault(key, defaultValue);
    }

    public String require(String key) {
        String value = parameters.get(key);
        if (value == null || value.trim().isEmpty()) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT,
                "Required parameter <" + key + "> not set");
        }
        return value.trim();
    }

    public int getInt(String key, int defaultValue) {
        String value = parameters.get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT,
                "Parameter <" + key + "> must be an integer, got '" + value + "'");
        }
    }

    /** Comma separated values, blanks dropped. */
    public List<String> getList(String key) {
        List<String> values = new ArrayList<>();
        String value = parameters.get(key);
        if (value != null) {
            for (String part : value.split(",")) {
                if (!part.trim().isEmpty()) {
                    values.add(part.trim());
                }
            }
        }
        return values;
    }

    public boolean hasFlag(char flag) {
        return flags.contains(flag);
    }

    public boolean isOverwrite() {
        return overwrite;
    }

    /**
     * Rejects parameters and flags a command does not know.
     */
    public void checkAllowed(Set<String> allowedKeys, String allowedFlags) {
        for (String key : parameters.keySet()) {
            if (!allowedKeys.contains(key)) {
                throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT, "Unknown parameter <" + key + ">");
            }
        }
        for (char flag : flags) {
            if (allowedFlags.indexOf(flag) < 0) {
                throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT, "Unknown flag -" + flag);
            }
        }
    }

    @Override
    public String toString() {
        return "ToolArguments{parameters=" + parameters + ", flags=" + flags + ", overwrite=" + overwrite + "}";
    }
}
