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

import dev.mars.spacetime.algebra.process.ProcessRasterCalculator;
import dev.mars.spacetime.algebra.process.ProcessSpatialDataStore;
import dev.mars.spacetime.api.external.RasterCalculator;
import dev.mars.spacetime.api.external.SpatialDataStore;
import dev.mars.spacetime.db.TemporalContext;
import dev.mars.spacetime.db.config.SpaceTimeConfiguration;

import java.io.PrintStream;

/**
 * Collaborators shared by all commands of one invocation.
 */
public class ToolEnvironment implements AutoCloseable {

    private final TemporalContext context;
    private final SpatialDataStore spatialStore;
    private final RasterCalculator calculator;
    private final PrintStream out;

    public ToolEnvironment(TemporalContext context, SpatialDataStore spatialStore, RasterCalculator calculator,
                           PrintStream out) {
        this.context = context;
        this.spatialStore = spatialStore;
        this.calculator = calculator;
        this.out = out;
    }

    /** Environment talking to the GRASS modules found on the path. */
    public static ToolEnvironment create(SpaceTimeConfiguration configuration, PrintStream out) {
        return new ToolEnvironment(new TemporalContext(configuration), new ProcessSpatialDataStore(),
            new ProcessRasterCalculator(configuration.getAlgebraConfig().getMapcalcCommand()), out);
    }

    public TemporalContext getContext() {
        return context;
    }

    public SpatialDataStore getSpatialStore() {
        return spatialStore;
    }

    public RasterCalculator getCalculator() {
        return calculator;
    }

    public PrintStream getOut() {
        return out;
    }

    @Override
    public void close() {
        context.close();
    }
}
