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
import dev.mars.spacetime.api.model.CalendarUnit;
import dev.mars.spacetime.api.model.DatasetId;
import dev.mars.spacetime.api.model.DatasetKind;
import dev.mars.spacetime.api.model.SpaceTimeDataset;
import dev.mars.spacetime.temporal.registration.BulkRegistration;
import dev.mars.spacetime.temporal.registration.MapRegistrationManager;
import dev.mars.spacetime.temporal.registration.TimeStampOptions;
import dev.mars.spacetime.tools.ToolArguments;
import dev.mars.spacetime.tools.ToolEnvironment;

import java.util.List;
import java.util.Set;

/**
 * Registers maps in a space time dataset, optionally assigning time stamps.
 */
public class RegisterCommand implements ToolCommand {

    private static final Set<String> PARAMETERS = Set.of("input", "maps", "type", "start", "end", "increment", "unit");

    @Override
    public String getName() {
        return "register";
    }

    @Override
    public String getDescription() {
        return "Register maps in a space time dataset";
    }

    @Override
    public String getUsage() {
        return "input=name maps=a,b,... [type=raster] [start=time] [end=time] [increment=step] [unit=months] [-i]";
    }

    @Override
    public int run(ToolArguments arguments, ToolEnvironment environment) {
        arguments.checkAllowed(PARAMETERS, "i");
        DatasetKind kind = DatasetKind.fromTypeName(arguments.get("type", "raster"));
        List<String> maps = arguments.getList("maps");
        if (maps.isEmpty()) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT, "Required parameter <maps> not set");
        }
        String unit = arguments.get("unit");
        TimeStampOptions options = new TimeStampOptions(arguments.get("start"), arguments.get("end"),
            arguments.get("increment"), arguments.hasFlag('i'), unit == null ? null : CalendarUnit.fromName(unit));

        MapRegistrationManager manager = new MapRegistrationManager(environment.getContext());
        String id = DatasetId.parse(arguments.require("input"), environment.getContext().getMapset()).toString();
        SpaceTimeDataset dataset = manager.loadDataset(kind, id);

        int registered = new BulkRegistration(manager, environment.getSpatialStore()).registerMaps(dataset, maps, options);
        environment.getOut().println("Registered " + registered + " of " + maps.size() + " maps in <" + dataset.getId() + ">");
        return 0;
    }
}
