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

import dev.mars.spacetime.algebra.exec.AlgebraOptions;
import dev.mars.spacetime.algebra.exec.AlgebraResult;
import dev.mars.spacetime.algebra.extract.DatasetExtractor;
import dev.mars.spacetime.api.error.SpaceTimeErrorCodes;
import dev.mars.spacetime.api.error.TemporalSyntaxException;
import dev.mars.spacetime.api.model.DatasetId;
import dev.mars.spacetime.api.model.DatasetKind;
import dev.mars.spacetime.db.config.SpaceTimeConfiguration;
import dev.mars.spacetime.tools.ToolArguments;
import dev.mars.spacetime.tools.ToolEnvironment;

import java.util.Set;

/**
 * Extracts a subset of a dataset into a new one, for example
 * {@code input=precip output=wet where="start_time > '2001-06-01'" expression="if(precip > 400, precip, null())" basename=wet}.
 */
public class ExtractCommand implements ToolCommand {

    private static final Set<String> PARAMETERS = Set.of("input", "output", "where", "expression", "basename",
        "nprocs", "type");

    @Override
    public String getName() {
        return "extract";
    }

    @Override
    public String getDescription() {
        return "Extract a subset of a space time dataset";
    }

    @Override
    public String getUsage() {
        return "input=name output=name [where=sql] [expression=\"if(name > 0, name, null())\" basename=name] "
            + "[nprocs=n] [type=strds|str3ds] [-n] [--o]";
    }

    @Override
    public int run(ToolArguments arguments, ToolEnvironment environment) {
        arguments.checkAllowed(PARAMETERS, "n");
        SpaceTimeConfiguration.AlgebraConfig config = environment.getContext().getConfiguration().getAlgebraConfig();
        DatasetKind kind = DatasetKind.fromTypeName(arguments.get("type", "strds"));
        String output = arguments.require("output");
        String expression = arguments.get("expression");
        String basename = arguments.get("basename");
        if (expression != null && basename == null) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT,
                "A basename is required when an expression is given");
        }
        if (expression != null && kind == DatasetKind.VECTOR) {
            throw new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT,
                "Expressions are only supported for raster and 3D raster datasets");
        }

        // basename is unused without an expression but the options still need a legal one
        String effectiveBasename = basename != null ? basename
            : DatasetId.parse(output, environment.getContext().getMapset()).name();
        AlgebraOptions options = AlgebraOptions.from(config, effectiveBasename, arguments.isOverwrite())
            .withKind(kind)
            .withNprocs(arguments.getInt("nprocs", config.getNprocs()))
            .withRegisterNull(arguments.hasFlag('n') || config.isRegisterNull());

        try (DatasetExtractor extractor = new DatasetExtractor(environment.getContext(), environment.getCalculator(),
                environment.getSpatialStore())) {
            AlgebraResult result = extractor.extract(arguments.require("input"), output, arguments.get("where"),
                expression, options);
            environment.getOut().println("Created <" + result.dataset().getId() + "> with "
                + result.registered().size() + " maps");
            if (!result.removed().isEmpty()) {
                environment.getOut().println("Removed " + result.removed().size() + " empty maps");
            }
        }
        return 0;
    }
}
