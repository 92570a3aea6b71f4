package dev.mars.spacetime.tools.command;

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
import dev.mars.spacetime.api.error.TemporalSyntaxException;
import dev.mars.spacetime.api.external.SpatialDataStore;
import dev.mars.spacetime.api.external.UnivarStatistics;
import dev.mars.spacetime.api.model.AbsoluteTemporalExtent;
import dev.mars.spacetime.api.model.DatasetId;
import dev.mars.spacetime.api.model.DatasetKind;
import dev.mars.spacetime.api.model.MapDataset;
import dev.mars.spacetime.api.model.RelativeTemporalExtent;
import dev.mars.spacetime.api.model.SpaceTimeDataset;
import dev.mars.spacetime.api.model.TemporalExtent;
import dev.mars.spacetime.db.TemporalContext;
import dev.mars.spacetime.temporal.registration.MapRegistrationManager;
import dev.mars.spacetime.tools.ToolArguments;
import dev.mars.spacetime.tools.ToolEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Prints univariate statistics of every map of a raster or 3D raster dataset,
 * one separated line per map in start time order.
 */
public class UnivarCommand implements ToolCommand {
    private static final Logger logger = LoggerFactory.getLogger(UnivarCommand.class);

    private static final Set<String> PARAMETERS = Set.of("input", "where", "output", "separator", "type");
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    static final List<String> COLUMNS = List.of("id", "start", "end", "mean", "min", "max", "mean_of_abs",
        "stddev", "variance", "coeff_var", "sum", "null_cells", "cells", "non_null_cells");
    static final List<String> EXTENDED_COLUMNS = List.of("first_quartile", "median", "third_quartile",
        "percentile_90");

    @Override
    public String getName() {
        return "univar";
    }

    @Override
    public String getDescription() {
        return "Print univariate statistics of each map of a space time raster dataset";
    }

    @Override
    public String getUsage() {
        return "input=name [where=sql] [output=file] [separator=pipe] [type=strds|str3ds] [-e] [-s]";
    }

    @Override
    public int run(ToolArguments arguments, ToolEnvironment environment) {
        arguments.checkAllowed(PARAMETERS, "es");
        DatasetKind kind = DatasetKind.fromTypeName(arguments.get("type", "strds"));
        if (kind == DatasetKind.VECTOR) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT,
                "Univariate statistics are only available for raster and 3D raster datasets");
        }
        boolean extended = arguments.hasFlag('e');
        String separator = separator(arguments.get("separator", "pipe"));

        TemporalContext context = environment.getContext();
        String id = DatasetId.parse(arguments.require("input"), context.getMapset()).toString();
        SpaceTimeDataset dataset = new MapRegistrationManager(context).loadDataset(kind, id);
        List<MapDataset> maps = context.getStore().selectRegisteredMaps(dataset, arguments.get("where"), "start_time");

        List<String> lines = new ArrayList<>();
        if (!arguments.hasFlag('s')) {
            List<String> header = new ArrayList<>(COLUMNS);
            if (extended) {
                header.addAll(EXTENDED_COLUMNS);
            }
            lines.add(String.join(separator, header));
        }
        SpatialDataStore spatialStore = environment.getSpatialStore();
        for (MapDataset map : maps) {
            logger.debug("Computing statistics of <{}>", map.getId());
            lines.add(row(map, spatialStore.readStatistics(kind, map.getId(), extended), extended, separator));
        }

        String output = arguments.get("output");
        if (output == null || output.equals("-")) {
            lines.forEach(environment.getOut()::println);
        } else {
            write(output, lines);
            environment.getOut().println("Wrote statistics of " + maps.size() + " maps to " + output);
        }
        return 0;
    }

    static String row(MapDataset map, UnivarStatistics stats, boolean extended, String separator) {
        List<Object> values = new ArrayList<>();
        values.add(map.getId());
        addTime(values, map.getTemporalExtent());
        values.add(stats.mean());
        values.add(stats.min());
        values.add(stats.max());
        values.add(stats.meanOfAbs());
        values.add(stats.stddev());
        values.add(stats.variance());
        values.add(stats.coeffVar());
        values.add(stats.sum());
        values.add(stats.nullCells());
        values.add(stats.cells());
        values.add(stats.nonNullCells());
        if (extended) {
            values.add(stats.firstQuartile());
            values.add(stats.median());
            values.add(stats.thirdQuartile());
            values.add(stats.percentile90());
        }
        StringBuilder line = new StringBuilder();
        for (Object value : values) {
            if (line.length() > 0) {
                line.append(separator);
            }
            line.append(value == null ? "None" : value);
        }
        return line.toString();
    }

    private static void addTime(List<Object> values, TemporalExtent extent) {
        if (extent instanceof AbsoluteTemporalExtent absolute) {
            values.add(time(absolute.getStart()));
            values.add(time(absolute.getEnd()));
        } else if (extent instanceof RelativeTemporalExtent relative) {
            values.add(relative.getStart());
            values.add(relative.getEnd());
        } else {
            values.add(null);
            values.add(null);
        }
    }

    private static String time(LocalDateTime value) {
        return value == null ? null : TIME_FORMAT.format(value);
    }

    /** Accepts a separator name or the literal separator. */
    static String separator(String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "pipe":
                return "|";
            case "comma":
                return ",";
            case "space":
                return " ";
            case "tab":
                return "\t";
            case "newline":
                return "\n";
            default:
                return value;
        }
    }

    private static void write(String file, List<String> lines) {
        try {
            Files.write(Paths.get(file), lines, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SpaceTimeException(SpaceTimeErrorCodes.INVALID_ARGUMENT,
                "Unable to write statistics to " + file + ": " + e.getMessage(), e);
        }
    }
}
