package dev.mars.spacetime.algebra.process;

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
import dev.mars.spacetime.api.error.SpaceTimeException;
import dev.mars.spacetime.api.external.MapInfo;
import dev.mars.spacetime.api.external.SpatialDataStore;
import dev.mars.spacetime.api.external.UnivarStatistics;
import dev.mars.spacetime.api.model.DatasetKind;
import dev.mars.spacetime.api.model.SpatialExtent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Spatial database access through the GRASS command line modules.
 * <p>
 * Existence is checked with {@code g.findfile}, metadata is read from the shell
 * style output of {@code r.info -gr}, {@code r3.info -gr} and {@code v.info -g},
 * statistics come from {@code r.univar -g} and {@code r3.univar -g}, and maps
 * are removed with {@code g.remove -f}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-22
 * @version 1.0
 */
public class ProcessSpatialDataStore implements SpatialDataStore {
    private static final Logger logger = LoggerFactory.getLogger(ProcessSpatialDataStore.class);

    private final CommandRunner runner;

    public ProcessSpatialDataStore() {
        this(new ProcessCommandRunner());
    }

    public ProcessSpatialDataStore(CommandRunner runner) {
        this.runner = runner;
    }

    @Override
    public boolean mapExists(DatasetKind kind, String mapId) {
        String[] parts = split(mapId);
        List<String> command = new ArrayList<>(List.of("g.findfile", "-n", "element=" + element(kind),
            "file=" + parts[0]));
        if (parts[1] != null) {
            command.add("mapset=" + parts[1]);
        }
        CommandRunner.CommandResult result = runner.run(command);
        if (!result.succeeded()) {
            return false;
        }
        String name = parseKeyValues(result.output()).get("name");
        return name != null && !name.isEmpty();
    }

    @Override
    public MapInfo readMapInfo(DatasetKind kind, String mapId) {
        CommandRunner.CommandResult result = runner.run(infoCommand(kind, mapId));
        if (!result.succeeded()) {
            throw new SpaceTimeException(SpaceTimeErrorCodes.EXTERNAL_PROCESS_FAILED,
                "Unable to read metadata of " + kind.getMapType() + " map <" + mapId + ">");
        }
        return toMapInfo(kind, parseKeyValues(result.output()));
    }

    @Override
    public UnivarStatistics readStatistics(DatasetKind kind, String mapId, boolean extended) {
        CommandRunner.CommandResult result = runner.run(univarCommand(kind, mapId, extended));
        if (!result.succeeded()) {
            throw new SpaceTimeException(SpaceTimeErrorCodes.EXTERNAL_PROCESS_FAILED,
                "Unable to compute statistics of " + kind.getMapType() + " map <" + mapId + ">");
        }
        return toStatistics(parseKeyValues(result.output()), extended);
    }

    @Override
    public void removeMaps(DatasetKind kind, List<String> mapIds) {
        if (mapIds.isEmpty()) {
            return;
        }
        List<String> names = new ArrayList<>();
        for (String id : mapIds) {
            names.add(split(id)[0]);
        }
        CommandRunner.CommandResult result = runner.run(List.of("g.remove", "-f",
            "type=" + element(kind), "name=" + String.join(",", names)));
        if (!result.succeeded()) {
            throw new SpaceTimeException(SpaceTimeErrorCodes.EXTERNAL_PROCESS_FAILED,
                "Unable to remove " + kind.getMapType() + " maps " + names);
        }
        logger.info("Removed {} {} maps", names.size(), kind.getMapType());
    }

    static List<String> infoCommand(DatasetKind kind, String mapId) {
        switch (kind) {
            case RASTER:
                return List.of("r.info", "-gr", "map=" + mapId);
            case RASTER3D:
                return List.of("r3.info", "-gr", "map=" + mapId);
            default:
                return List.of("v.info", "-g", "map=" + mapId);
        }
    }

    static List<String> univarCommand(DatasetKind kind, String mapId, boolean extended) {
        String module;
        switch (kind) {
            case RASTER:
                module = "r.univar";
                break;
            case RASTER3D:
                module = "r3.univar";
                break;
            default:
                throw new SpaceTimeException(SpaceTimeErrorCodes.INVALID_ARGUMENT,
                    "Univariate statistics are only available for raster and 3D raster maps");
        }
        return List.of(module, extended ? "-ge" : "-g", "map=" + mapId);
    }

    static UnivarStatistics toStatistics(Map<String, String> values, boolean extended) {
        long nullCells = (long) number(values, "null_cells");
        long cells = values.containsKey("cells") ? (long) number(values, "cells")
            : (long) number(values, "n") + nullCells;
        return new UnivarStatistics(number(values, "mean"), number(values, "min"), number(values, "max"),
            number(values, "mean_of_abs"), number(values, "stddev"), number(values, "variance"),
            number(values, "coeff_var"), number(values, "sum"), nullCells, cells,
            extended ? number(values, "first_quartile") : null,
            extended ? number(values, "median") : null,
            extended ? number(values, "third_quartile") : null,
            extended ? number(values, "percentile_90") : null);
    }

    static MapInfo toMapInfo(DatasetKind kind, Map<String, String> values) {
        double north = number(values, "north");
        double south = number(values, "south");
        double east = number(values, "east");
        double west = number(values, "west");
        SpatialExtent extent;
        if (kind.isThreeDimensional() || values.containsKey("top")) {
            extent = new SpatialExtent(north, south, east, west, number(values, "top"), number(values, "bottom"));
        } else {
            extent = new SpatialExtent(north, south, east, west);
        }
        return new MapInfo(extent, optionalNumber(values.get("min")), optionalNumber(values.get("max")));
    }

    /** Parses {@code key=value} lines, ignoring anything else. */
    static Map<String, String> parseKeyValues(String output) {
        Map<String, String> values = new HashMap<>();
        for (String line : output.split("\\R")) {
            int eq = line.indexOf('=');
            if (eq > 0) {
                String value = line.substring(eq + 1).trim();
                if (value.length() >= 2 && value.startsWith("'") && value.endsWith("'")) {
                    value = value.substring(1, value.length() - 1);
                }
                values.put(line.substring(0, eq).trim(), value);
            }
        }
        return values;
    }

    private static double number(Map<String, String> values, String key) {
        Double value = optionalNumber(values.get(key));
        if (value == null) {
            throw new SpaceTimeException(SpaceTimeErrorCodes.EXTERNAL_PROCESS_FAILED,
                "Map metadata is missing <" + key + ">");
        }
        return value;
    }

    private static Double optionalNumber(String text) {
        if (text == null || text.isEmpty() || "NULL".equalsIgnoreCase(text)) {
            return null;
        }
        try {
            return Double.valueOf(text);
        } catch (NumberFormatException e) {
            throw new SpaceTimeException(SpaceTimeErrorCodes.EXTERNAL_PROCESS_FAILED,
                "Invalid number <" + text + "> in map metadata", e);
        }
    }

    private static String element(DatasetKind kind) {
        switch (kind) {
            case RASTER:
                return "raster";
            case RASTER3D:
                return "raster_3d";
            default:
                return "vector";
        }
    }

    private static String[] split(String mapId) {
        int at = mapId.indexOf('@');
        return at < 0 ? new String[] {mapId, null} : new String[] {mapId.substring(0, at), mapId.substring(at + 1)};
    }
}
