package dev.mars.spacetime.test.fakes;

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

import dev.mars.spacetime.api.external.MapInfo;
import dev.mars.spacetime.api.external.RasterCalculator;
import dev.mars.spacetime.api.model.DatasetKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Raster calculator that records every expression and, on success, creates the
 * target map in an {@link InMemorySpatialDataStore}.
 */
public class RecordingRasterCalculator implements RasterCalculator {

    private final InMemorySpatialDataStore store;
    private final String mapset;
    private final List<String> expressions = Collections.synchronizedList(new ArrayList<>());
    private final Set<String> failingTargets = ConcurrentHashMap.newKeySet();
    private final Set<String> nullTargets = ConcurrentHashMap.newKeySet();

    public RecordingRasterCalculator(InMemorySpatialDataStore store, String mapset) {
        this.store = store;
        this.mapset = mapset;
    }

    /** Jobs writing {@code target} exit with code 1. */
    public RecordingRasterCalculator failFor(String target) {
        failingTargets.add(target);
        return this;
    }

    /** Jobs writing {@code target} produce an empty map. */
    public RecordingRasterCalculator nullResultFor(String target) {
        nullTargets.add(target);
        return this;
    }

    @Override
    public int compute(String expression, boolean overwrite) {
        expressions.add(expression);
        String target = expression.substring(0, expression.indexOf('=')).trim();
        if (failingTargets.contains(target)) {
            return 1;
        }
        String id = target.contains("@") ? target : target + "@" + mapset;
        if (nullTargets.contains(target)) {
            store.put(DatasetKind.RASTER, id, new MapInfo(InMemorySpatialDataStore.DEFAULT_EXTENT, null, null));
        } else {
            store.put(DatasetKind.RASTER, id);
        }
        return 0;
    }

    public List<String> getExpressions() {
        synchronized (expressions) {
            return new ArrayList<>(expressions);
        }
    }
}
