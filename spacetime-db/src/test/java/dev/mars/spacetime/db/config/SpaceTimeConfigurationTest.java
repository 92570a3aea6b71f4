package dev.mars.spacetime.db.config;

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

import dev.mars.spacetime.test.categories.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class SpaceTimeConfigurationTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("spacetime.algebra.nprocs");
    }

    @Test
    void testDefaultsAreLoadedFromClasspath() {
        SpaceTimeConfiguration config = new SpaceTimeConfiguration("default");
        assertEquals("PERMANENT", config.getMapset());
        assertEquals("h2", config.getDatabaseConfig().getBackend());
        assertEquals("r.mapcalc", config.getAlgebraConfig().getMapcalcCommand());
        assertFalse(config.getAlgebraConfig().isRegisterNull());
    }

    @Test
    void testProfileFileOverridesDefaults() {
        SpaceTimeConfiguration config = new SpaceTimeConfiguration("test");
        assertEquals("testing", config.getMapset());
        assertEquals(2, config.getAlgebraConfig().getNprocs());
    }

    @Test
    void testSystemPropertiesOverrideProfile() {
        System.setProperty("spacetime.algebra.nprocs", "6");
        SpaceTimeConfiguration config = new SpaceTimeConfiguration("test");
        assertEquals(6, config.getAlgebraConfig().getNprocs());
    }

    @Test
    void testExplicitOverridesWin() {
        SpaceTimeConfiguration config = new SpaceTimeConfiguration("default",
            Map.of("spacetime.mapset", "user1", "spacetime.metrics.instance-id", "st-test"));
        assertEquals("user1", config.getMapset());
        assertEquals("st-test", config.getMetricsConfig().getInstanceId());
    }

    @Test
    void testInvalidIntegerFallsBackToDefault() {
        SpaceTimeConfiguration config = new SpaceTimeConfiguration("default",
            Map.of("spacetime.some.count", "not-a-number"));
        assertEquals(7, config.getInt("spacetime.some.count", 7));
    }

    @Test
    void testValidationCollectsErrors() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () ->
            new SpaceTimeConfiguration("default", Map.of(
                "spacetime.database.backend", "oracle",
                "spacetime.algebra.nprocs", "0")));
        assertTrue(e.getMessage().contains("Database backend must be h2 or postgresql"));
        assertTrue(e.getMessage().contains("at least 1"));
    }
}
