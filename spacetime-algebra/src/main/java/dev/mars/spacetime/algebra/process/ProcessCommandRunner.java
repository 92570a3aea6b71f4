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

import dev.mars.spacetime.api.error.SpaceTimeErrorCodes;
import dev.mars.spacetime.api.error.SpaceTimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 */
public class ProcessCommandRunner implements CommandRunner {
    private static final Logger logger = LoggerFactory.getLogger(ProcessCommandRunner.class);

    @Override
    public CommandResult run(List<String> command) {
        logger.debug("Executing: {}", String.join(" ", command));
        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
        try {
            Process process = builder.start();
            String output;
            try (InputStream in = process.getInputStream()) {
                output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                logger.warn("Command {} exited with code {}: {}", command.get(0), exitCode, output.trim());
            }
            return new CommandResult(exitCode, output);
        } catch (IOException e) {
            throw new SpaceTimeException(SpaceTimeErrorCodes.EXTERNAL_PROCESS_FAILED,
                "Unable to run " + command.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SpaceTimeException(SpaceTimeErrorCodes.EXTERNAL_PROCESS_FAILED,
                "Interrupted while waiting for " + command.get(0), e);
        }
    }
}
