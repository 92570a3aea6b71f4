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
import dev.mars.spacetime.api.error.TemporalSyntaxException;
import dev.mars.spacetime.api.model.DatasetId;
import dev.mars.spacetime.api.model.DatasetKind;
import dev.mars.spacetime.api.model.MapDataset;
import dev.mars.spacetime.api.model.SpaceTimeDataset;
import dev.mars.spacetime.temporal.registration.MapRegistrationManager;
import dev.mars.spacetime.tools.ToolArguments;
import dev.mars.spacetime.tools.ToolEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Removes maps from one dataset or, without {@code input}, from the temporal
 * database altogether.
 */
public class UnregisterCommand implements ToolCommand {
    private static final Logger logger = LoggerFactory.getLogger(UnregisterCommand.class);

    private static final Set<String> PARAMETERS = Set.of("input", "maps", "type");

    @Override
    public String getName() {
        return "unregister";
    }

    @Override
    public String getDescription() {
        return "Unregister maps from a space time dataset or the temporal database";
    }

    @Override
    public String getUsage() {
        return "maps=a,b,... [input=name] [type=raster]";
    }

    @Override
    public int run(ToolArguments arguments, ToolEnvironment environment) {
        arguments.checkAllowed(PARAMETERS, "");
        DatasetKind kind = DatasetKind.fromTypeName(arguments.get("type", "raster"));
        List<String> maps = arguments.getList("maps");
        if (maps.isEmpty()) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT, "Required parameter <maps> not set");
        }
        String mapset = environment.getContext().getMapset();
        MapRegistrationManager manager = new MapRegistrationManager(environment.getContext());

        String input = arguments.get("input");
        if (input != null) {
            SpaceTimeDataset dataset = manager.loadDataset(kind, DatasetId.parse(input, mapset).toString());
            int removed = 0;
            for (String id : maps) {
                MapDataset map = kind.newMap(id, mapset, true);
                if (!manager.unregisterMap(dataset, map, true).isEmpty()) {
                    removed++;
                }
            }
            manager.updateFromRegisteredMaps(dataset);
            environment.getOut().println("Unregistered " + removed + " maps from <" + dataset.getId() + ">");
            return 0;
        }

        int deleted = 0;
        for (String id : maps) {
            MapDataset map = kind.newMap(id, mapset, true);
            if (!environment.getContext().getStore().mapExists(kind, map.getId())) {
                logger.warn("Map <{}> is not in the temporal database", map.getId());
                continue;
            }
            manager.deleteMap(map);
            deleted++;
        }
        environment.getOut().println("Removed " + deleted + " maps from the temporal database");
        return 0;
    }
}
