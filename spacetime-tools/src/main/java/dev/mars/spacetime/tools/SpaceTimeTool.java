package dev.mars.spacetime.tools;

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
import dev.mars.spacetime.db.config.SpaceTimeConfiguration;
import dev.mars.spacetime.tools.command.AlgebraCommand;
import dev.mars.spacetime.tools.command.CreateCommand;
import dev.mars.spacetime.tools.command.ExtractCommand;
import dev.mars.spacetime.tools.command.InfoCommand;
import dev.mars.spacetime.tools.command.RegisterCommand;
import dev.mars.spacetime.tools.command.RemoveCommand;
import dev.mars.spacetime.tools.command.ToolCommand;
import dev.mars.spacetime.tools.command.UnivarCommand;
import dev.mars.spacetime.tools.command.UnregisterCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Command line entry point for the space time dataset engine.
 * <p>
 * Usage:
 * <ul>
 *   <li>{@code spacetime create output=precip title="Monthly precipitation"}</li>
 *   <li>{@code spacetime register input=precip maps=p1,p2,p3 start=2001-01-01 increment="1 month" -i}</li>
 *   <li>{@code spacetime info input=precip -g}</li>
 *   <li>{@code spacetime algebra expression="C = A {+,equal} B" basename=c}</li>
 * </ul>
 * The exit code is 0 on success and 1 on any failure, which is reported as a
 * single {@code ERROR:} line on standard error.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-23
 * @version 1.0
 */
public class SpaceTimeTool {

    private static final Logger logger = LoggerFactory.getLogger(SpaceTimeTool.class);

    private final Map<String, ToolCommand> commands = new LinkedHashMap<>();
    private final Supplier<ToolEnvironment> environmentFactory;
    private final PrintStream out;
    private final PrintStream err;

    public SpaceTimeTool(Supplier<ToolEnvironment> environmentFactory, PrintStream out, PrintStream err) {
        this.environmentFactory = environmentFactory;
        this.out = out;
        this.err = err;
        register(new CreateCommand());
        register(new RegisterCommand());
        register(new UnregisterCommand());
        register(new RemoveCommand());
        register(new InfoCommand());
        register(new AlgebraCommand());
        register(new ExtractCommand());
        register(new UnivarCommand());
    }

    private void register(ToolCommand command) {
        commands.put(command.getName(), command);
    }

    public static void main(String[] args) {
        SpaceTimeTool tool = new SpaceTimeTool(
            () -> ToolEnvironment.create(new SpaceTimeConfiguration(), System.out), System.out, System.err);
        System.exit(tool.run(args));
    }

    /**
     * Runs one command.
     *
     * @return the process exit code
     */
    public int run(String... args) {
        if (args.length == 0 || args[0].equals("--help") || args[0].equals("help")) {
            printUsage();
            return args.length == 0 ? 1 : 0;
        }
        ToolCommand command = commands.get(args[0]);
        if (command == null) {
            return fail(new TemporalSyntaxException(SpaceTimeErrorCodes.INVALID_ARGUMENT,
                "Unknown command '" + args[0] + "'. Available: " + String.join(", ", commands.keySet())));
        }

        try {
            ToolArguments arguments = ToolArguments.parse(Arrays.asList(args).subList(1, args.length));
            try (ToolEnvironment environment = environmentFactory.get()) {
                logger.debug("Running {} with {}", command.getName(), arguments);
                return command.run(arguments, environment);
            }
        } catch (SpaceTimeException e) {
            logger.debug("Command {} failed with {}", command.getName(), e.getCode(), e);
            return fail(e);
        } catch (IllegalStateException e) {
            // configuration validation
            logger.debug("Command {} failed", command.getName(), e);
            return fail(new SpaceTimeException(SpaceTimeErrorCodes.CONFIGURATION_INVALID, e.getMessage()));
        } catch (RuntimeException e) {
            logger.debug("Command {} failed unexpectedly", command.getName(), e);
            return fail(new SpaceTimeException(SpaceTimeErrorCodes.INTERNAL_ERROR,
                "Command " + command.getName() + " failed unexpectedly", e));
        }
    }

    private int fail(SpaceTimeException e) {
        err.println(e.toError().toDiagnostic());
        return 1;
    }

    private void printUsage() {
        out.println("Usage: spacetime <command> [key=value ...] [-flags] [--o]");
        out.println();
        for (ToolCommand command : commands.values()) {
            out.println(String.format("  %-11s %s", command.getName(), command.getDescription()));
            out.println(String.format("  %-11s   %s", "", command.getUsage()));
        }
    }
}
