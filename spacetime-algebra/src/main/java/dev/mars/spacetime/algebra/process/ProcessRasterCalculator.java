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

import dev.mars.spacetime.api.external.RasterCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs map calculator jobs as external {@code r.mapcalc} style processes.
 */
public class ProcessRasterCalculator implements RasterCalculator {
    private static final Logger logger = LoggerFactory.getLogger(ProcessRasterCalculator.class);

    private final String command;
    private final CommandRunner runner;

    public ProcessRasterCalculator(String command) {
        this(command, new ProcessCommandRunner());
    }

    public ProcessRasterCalculator(String command, CommandRunner runner) {
        this.command = command;
        this.runner = runner;
    }

    @Override
    public int compute(String expression, boolean overwrite) {
        List<String> args = new ArrayList<>();
        args.add(command);
        args.add("expression=" + expression);
        if (overwrite) {
            args.add("--o");
        }
        CommandRunner.CommandResult result = runner.run(args);
        if (!result.output().isBlank()) {
            logger.debug("{}: {}", command, result.output().trim());
        }
        return result.exitCode();
    }
}
