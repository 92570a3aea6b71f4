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
import dev.mars.spacetime.api.model.SpaceTimeDataset;
import dev.mars.spacetime.api.model.TemporalType;
import dev.mars.spacetime.temporal.registration.MapRegistrationManager;
import dev.mars.spacetime.tools.ToolArguments;
import dev.mars.spacetime.tools.ToolEnvironment;

import java.util.Set;

/**
 * Creates an empty space time dataset.
 */
public class CreateCommand implements ToolCommand {

    private static final Set<String> PARAMETERS =
        Set.of("output", "type", "temporaltype", "semantictype", "title", "description");

    @Override
    public String getName() {
        return "create";
    }

    @Override
    public String getDescription() {
        return "Create an empty space time dataset";
    }

    @Override
    public String getUsage() {
        return "output=name title=text [type=strds] [temporaltype=absolute|relative] [semantictype=mean]"
            + " [description=text] [--o]";
    }

    @Override
    public int run(ToolArguments arguments, ToolEnvironment environment) {
        arguments.checkAllowed(PARAMETERS, "");
        DatasetKind kind = DatasetKind.fromTypeName(arguments.get("type", "strds"));
        String mapset = environment.getContext().getMapset();
        String title = arguments.require("title");

        SpaceTimeDataset dataset = kind.newDataset(DatasetId.parse(arguments.require("output"), mapset).name(), mapset);
        dataset.setTemporalType(temporalType(arguments.get("temporaltype", "absolute")));
        dataset.setSemanticType(arguments.get("semantictype", SpaceTimeDataset.DEFAULT_SEMANTIC_TYPE));
        dataset.setTitle(title);
        dataset.setDescription(arguments.get("description", title));

        new MapRegistrationManager(environment.getContext()).createDataset(dataset, arguments.isOverwrite());
        environment.getOut().println("Created space time " + kind.getDatasetType() + " dataset <" + dataset.getId() + ">");
        return 0;
    }

    private static TemporalType temporalType(String name) {
        try {
            return TemporalType.fromName(name);
        } catch (IllegalArgumentException e) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT,
                "Temporal type must be absolute or relative, got '" + name + "'");
        }
    }
}
