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

import dev.mars.spacetime.algebra.TemporalAlgebra;
import dev.mars.spacetime.algebra.exec.AlgebraOptions;
import dev.mars.spacetime.algebra.exec.AlgebraResult;
import dev.mars.spacetime.api.model.DatasetKind;
import dev.mars.spacetime.db.config.SpaceTimeConfiguration;
import dev.mars.spacetime.tools.ToolArguments;
import dev.mars.spacetime.tools.ToolEnvironment;

import java.util.Set;

/**
 * Evaluates a temporal raster algebra statement such as
 * {@code expression="C = A {+,equal,l} B" basename=c}.
 */
public class AlgebraCommand implements ToolCommand {

    private static final Set<String> PARAMETERS = Set.of("expression", "basename", "nprocs", "type");

    @Override
    public String getName() {
        return "algebra";
    }

    @Override
    public String getDescription() {
        return "Evaluate a temporal raster algebra expression";
    }

    @Override
    public String getUsage() {
        return "expression=\"R = A + B\" basename=name [nprocs=n] [type=raster|raster3d] [-s] [-n] [--o]";
    }

    @Override
    public int run(ToolArguments arguments, ToolEnvironment environment) {
        arguments.checkAllowed(PARAMETERS, "sn");
        SpaceTimeConfiguration.AlgebraConfig config = environment.getContext().getConfiguration().getAlgebraConfig();
        String expression = arguments.require("expression");

        AlgebraOptions options = AlgebraOptions.from(config, arguments.require("basename"), arguments.isOverwrite())
            .withKind(DatasetKind.fromTypeName(arguments.get("type", "raster")))
            .withNprocs(arguments.getInt("nprocs", config.getNprocs()))
            .withSpatial(arguments.hasFlag('s') || config.isSpatial())
            .withRegisterNull(arguments.hasFlag('n') || config.isRegisterNull());

        try (TemporalAlgebra algebra = new TemporalAlgebra(environment.getContext(), environment.getCalculator(),
                environment.getSpatialStore())) {
            AlgebraResult result = algebra.execute(expression, options);
            environment.getOut().println("Created <" + result.dataset().getId() + "> with "
                + result.registered().size() + " maps");
            if (!result.removed().isEmpty()) {
                environment.getOut().println("Removed " + result.removed().size() + " empty maps");
            }
        }
        return 0;
    }
}
