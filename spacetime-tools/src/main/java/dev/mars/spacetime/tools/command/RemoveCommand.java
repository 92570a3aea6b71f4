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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Deletes space time datasets. With {@code -rf} the member maps are removed from
 * the temporal and the spatial database as well.
 */
public class RemoveCommand implements ToolCommand {

    private static final Set<String> PARAMETERS = Set.of("inputs", "type");

    @Override
    public String getName() {
        return "remove";
    }

    @Override
    public String getDescription() {
        return "Remove space time datasets";
    }

    @Override
    public String getUsage() {
        return "inputs=a,b,... [type=strds] [-r -f]";
    }

    @Override
    public int run(ToolArguments arguments, ToolEnvironment environment) {
        arguments.checkAllowed(PARAMETERS, "rf");
        boolean recursive = arguments.hasFlag('r');
        if (recursive && !arguments.hasFlag('f')) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT,
                "Recursive removal deletes maps from the mapset and needs the force flag -f");
        }
        DatasetKind kind = DatasetKind.fromTypeName(arguments.get("type", "strds"));
        List<String> inputs = arguments.getList("inputs");
        if (inputs.isEmpty()) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT, "Required parameter <inputs> not set");
        }
        String mapset = environment.getContext().getMapset();
        MapRegistrationManager manager = new MapRegistrationManager(environment.getContext());

        // Load everything first so an unknown name removes nothing.
        List<SpaceTimeDataset> datasets = new ArrayList<>();
        for (String input : inputs) {
            datasets.add(manager.loadDataset(kind, DatasetId.parse(input, mapset).toString()));
        }

        for (SpaceTimeDataset dataset : datasets) {
            List<MapDataset> members = recursive
                ? environment.getContext().getStore().selectRegisteredMaps(dataset, null, "start_time") : List.of();
            manager.delete(dataset, true);
            if (!members.isEmpty()) {
                List<String> ids = new ArrayList<>();
                for (MapDataset member : members) {
                    manager.deleteMap(member);
                    ids.add(member.getId());
                }
                environment.getSpatialStore().removeMaps(kind, ids);
            }
            environment.getOut().println("Removed space time " + kind.getDatasetType() + " dataset <"
                + dataset.getId() + ">" + (recursive ? " and " + members.size() + " maps" : ""));
        }
        return 0;
    }
}
