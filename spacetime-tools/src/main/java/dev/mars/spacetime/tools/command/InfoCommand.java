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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.spacetime.api.error.SpaceTimeErrorCodes;
import dev.mars.spacetime.api.error.SpaceTimeException;
import dev.mars.spacetime.api.error.TemporalSyntaxException;
import dev.mars.spacetime.api.model.AbsoluteTemporalExtent;
import dev.mars.spacetime.api.model.DatasetId;
import dev.mars.spacetime.api.model.DatasetKind;
import dev.mars.spacetime.api.model.MapDataset;
import dev.mars.spacetime.api.model.RelativeTemporalExtent;
import dev.mars.spacetime.api.model.SpaceTimeDataset;
import dev.mars.spacetime.api.model.SpatialExtent;
import dev.mars.spacetime.api.model.TemporalExtent;
import dev.mars.spacetime.db.TemporalContext;
import dev.mars.spacetime.db.config.SpaceTimeConfiguration;
import dev.mars.spacetime.temporal.registration.MapRegistrationManager;
import dev.mars.spacetime.temporal.topology.TemporalTopologyChecker;
import dev.mars.spacetime.tools.ToolArguments;
import dev.mars.spacetime.tools.ToolEnvironment;

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Prints the metadata of a space time dataset or a single map.
 * <p>
 * Output is a human readable block by default, {@code key=value} lines with
 * {@code -g}, or a JSON object with {@code format=json}. {@code -t} lists the
 * temporal relations between the members of a dataset and {@code -s} describes
 * the temporal database backend.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-23
 * @version 1.0
 */
public class InfoCommand implements ToolCommand {

    private static final Set<String> PARAMETERS = Set.of("input", "type", "format");

    private final ObjectMapper objectMapper;

    public InfoCommand() {
        this.objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String getName() {
        return "info";
    }

    @Override
    public String getDescription() {
        return "Show metadata of a space time dataset or map";
    }

    @Override
    public String getUsage() {
        return "input=name [type=strds|raster|...] [format=plain|shell|json] [-g] [-t] [-s]";
    }

    @Override
    public int run(ToolArguments arguments, ToolEnvironment environment) {
        arguments.checkAllowed(PARAMETERS, "gts");
        PrintStream out = environment.getOut();
        TemporalContext context = environment.getContext();

        if (arguments.hasFlag('s')) {
            print(out, backendInfo(context), format(arguments), "Temporal database");
            if (arguments.get("input") == null) {
                return 0;
            }
        }

        String type = arguments.get("type", "strds").trim().toLowerCase(Locale.ROOT);
        DatasetKind kind = DatasetKind.fromTypeName(type);
        String id = DatasetId.parse(arguments.require("input"), context.getMapset()).toString();

        if (!kind.getDatasetType().equals(type)) {
            MapDataset map = context.getStore().selectMap(kind, id).orElseThrow(() -> new SpaceTimeException(
                SpaceTimeErrorCodes.MAP_NOT_FOUND, kind.getMapType() + " map <" + id + "> not found in the temporal database"));
            print(out, mapInfo(map, context.getStore().registerEntries(map.getStdsRegister())), format(arguments),
                "Map " + kind.getMapType());
            return 0;
        }

        SpaceTimeDataset dataset = new MapRegistrationManager(context).loadDataset(kind, id);
        if (arguments.hasFlag('t')) {
            List<MapDataset> maps = context.getStore().selectRegisteredMaps(dataset, null, "start_time");
            out.print(TemporalTopologyChecker.formatRelationMatrix(maps));
            out.println("gaps=" + TemporalTopologyChecker.countGaps(maps));
            out.println("topology_valid=" + TemporalTopologyChecker.checkTemporalTopology(dataset.getMapTime(), maps));
            new TreeMap<>(TemporalTopologyChecker.countTemporalRelations(maps))
                .forEach((relation, count) -> out.println(relation.getName() + "=" + count));
            return 0;
        }
        print(out, datasetInfo(dataset), format(arguments), "Space time " + kind.getDatasetType() + " dataset");
        return 0;
    }

    private static String format(ToolArguments arguments) {
        String format = arguments.get("format", arguments.hasFlag('g') ? "shell" : "plain").trim().toLowerCase(Locale.ROOT);
        if (!format.equals("plain") && !format.equals("shell") && !format.equals("json")) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT,
                "Unknown format '" + format + "', expected plain, shell or json");
        }
        return format;
    }

    private void print(PrintStream out, Map<String, Object> values, String format, String title) {
        switch (format) {
            case "json":
                try {
                    out.println(objectMapper.writeValueAsString(values));
                } catch (JsonProcessingException e) {
                    throw new SpaceTimeException(SpaceTimeErrorCodes.INTERNAL_ERROR,
                        "Unable to write JSON: " + e.getOriginalMessage(), e);
                }
                break;
            case "shell":
                values.forEach((key, value) -> out.println(key + "=" + (value == null ? "None" : value)));
                break;
            default:
                out.println(" +-------------------- " + title + " --------------------");
                values.forEach((key, value) -> out.println(String.format(" | %-22s %s", label(key) + ":",
                    value == null ? "None" : value)));
                out.println(" +----------------------------------------------------------------");
                break;
        }
    }

    private static String label(String key) {
        String text = key.replace('_', ' ');
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    static Map<String, Object> datasetInfo(SpaceTimeDataset dataset) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("id", dataset.getId());
        values.put("name", dataset.getName());
        values.put("mapset", dataset.getMapset());
        values.put("creator", dataset.getCreator());
        values.put("temporal_type", dataset.getTemporalType() == null ? null : dataset.getTemporalType().getName());
        values.put("creation_time", dataset.getCreationTime());
        values.put("modification_time", dataset.getModificationTime());
        values.put("semantic_type", dataset.getSemanticType());
        putTime(values, dataset.getTemporalExtent());
        if (dataset.getRelativeUnit() != null) {
            values.put("unit", dataset.getRelativeUnit().getPlural());
        }
        values.put("granularity", dataset.getGranularity() == null ? null : dataset.getGranularity().toString());
        values.put("map_time", dataset.getMapTime() == null ? null : dataset.getMapTime().getName());
        values.put("number_of_maps", dataset.getNumberOfMaps());
        putExtent(values, dataset.getSpatialExtent());
        values.put("title", dataset.getTitle());
        values.put("description", dataset.getDescription());
        return values;
    }

    static Map<String, Object> mapInfo(MapDataset map, List<String> datasets) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("id", map.getId());
        values.put("name", map.getName());
        values.put("mapset", map.getMapset());
        values.put("creator", map.getCreator());
        values.put("temporal_type", map.getTemporalType() == null ? null : map.getTemporalType().getName());
        values.put("creation_time", map.getCreationTime());
        putTime(values, map.getTemporalExtent());
        if (map.getTemporalExtent() instanceof RelativeTemporalExtent relative) {
            values.put("unit", relative.getUnit().getPlural());
        }
        putExtent(values, map.getSpatialExtent());
        values.put("min", map.getMinValue());
        values.put("max", map.getMaxValue());
        values.put("registered_datasets", datasets.isEmpty() ? null : String.join(",", datasets));
        return values;
    }

    static Map<String, Object> backendInfo(TemporalContext context) {
        SpaceTimeConfiguration.DatabaseConfig database = context.getConfiguration().getDatabaseConfig();
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("backend", database.getBackend());
        values.put("url", database.getUrl());
        values.put("mapset", context.getMapset());
        values.put("param_style", context.getDatabase().getParamStyle().name().toLowerCase(Locale.ROOT));
        new TreeMap<>(context.getMetrics().getSummary()).forEach((key, value) -> values.put(key, value.longValue()));
        return values;
    }

    private static void putTime(Map<String, Object> values, TemporalExtent extent) {
        if (extent instanceof AbsoluteTemporalExtent absolute) {
            LocalDateTime start = absolute.getStart();
            values.put("start_time", start);
            values.put("end_time", absolute.getEnd());
        } else if (extent instanceof RelativeTemporalExtent relative) {
            values.put("start_time", relative.getStart());
            values.put("end_time", relative.getEnd());
        } else {
            values.put("start_time", null);
            values.put("end_time", null);
        }
    }

    private static void putExtent(Map<String, Object> values, SpatialExtent extent) {
        values.put("north", extent == null ? null : extent.getNorth());
        values.put("south", extent == null ? null : extent.getSouth());
        values.put("east", extent == null ? null : extent.getEast());
        values.put("west", extent == null ? null : extent.getWest());
        values.put("top", extent == null ? null : extent.getTop());
        values.put("bottom", extent == null ? null : extent.getBottom());
    }
}
