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

import dev.mars.spacetime.tools.ToolArguments;
import dev.mars.spacetime.tools.ToolEnvironment;

/**
 * One sub command of the space time tool.
 */
public interface ToolCommand {

    String getName();

    /** One line shown in the usage listing. */
    String getDescription();

    /** Parameter synopsis, e.g. {@code input=name maps=a,b [--o]}. */
    String getUsage();

    /**
     * @return process exit code
     * @throws dev.mars.spacetime.api.error.SpaceTimeException on any failure
     */
    int run(ToolArguments arguments, ToolEnvironment environment);
}
