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

import dev.mars.spacetime.api.error.SpaceTimeErrorCodes;
import dev.mars.spacetime.api.error.TemporalSyntaxException;

import java.util.regex.Pattern;

/**
 * Parsed identity {@code name[:layer]@mapset}.
 *
 * @param name   map or dataset name
 * @param layer  vector layer, may be null
 * @param mapset owning mapset
 */
public record DatasetId(String name, String layer, String mapset) {

    private static final Pattern LEGAL_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_.]*");

    public static DatasetId parse(String id, String defaultMapset) {
        if (id == null || id.trim().isEmpty()) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT, "Identifier must not be empty");
        }
        String value = id.trim();
        String mapset = defaultMapset;
        int at = value.indexOf('@');
        if (at >= 0) {
            mapset = value.substring(at + 1);
            value = value.substring(0, at);
        }
        String layer = null;
        int colon = value.indexOf(':');
        if (colon >= 0) {
            layer = value.substring(colon + 1);
            value = value.substring(0, colon);
        }
        if (value.isEmpty() || mapset == null || mapset.isEmpty()) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT, "Invalid identifier '" + id + "'");
        }
        return new DatasetId(value, layer, mapset);
    }

    /**
     * Checks the name of a dataset or map about to be created. Names start with
     * a letter so algebra expressions never read them as numbers.
     *
     * @return the name
     * @throws TemporalSyntaxException for an illegal name
     */
    public static String requireLegalName(String name) {
        if (name == null || !LEGAL_NAME.matcher(name).matches()) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT, "Illegal name <" + name
                + ">. Names start with a letter followed by letters, digits, '_' or '.'");
        }
        return name;
    }

    @Override
    public String toString() {
        return layer != null ? name + ":" + layer + "@" + mapset : name + "@" + mapset;
    }
}
