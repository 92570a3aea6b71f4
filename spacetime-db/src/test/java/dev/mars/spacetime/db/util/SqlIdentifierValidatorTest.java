package dev.mars.spacetime.db.util;

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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SqlIdentifierValidator.
 */
@Tag(TestCategories.CORE)
class SqlIdentifierValidatorTest {

    @Test
    void testValidIdentifiers() {
        assertEquals("strds_base", SqlIdentifierValidator.validate("strds_base", "Table"));
        assertTrue(SqlIdentifierValidator.isValid("_leading_underscore"));
    }

    @Test
    void testInvalidIdentifiers() {
        assertThrows(IllegalArgumentException.class, () -> SqlIdentifierValidator.validate(null, "Table"));
        assertThrows(IllegalArgumentException.class, () -> SqlIdentifierValidator.validate("a; DROP TABLE x", "Table"));
        assertThrows(IllegalArgumentException.class, () -> SqlIdentifierValidator.validate("123table", "Table"));
        assertThrows(IllegalArgumentException.class, () -> SqlIdentifierValidator.validate("pg_catalog", "Table"));
    }

    @Test
    void testDatasetRegisterTableIsSanitized() {
        String table = SqlIdentifierValidator.datasetRegisterTable("precip.monthly", "PERMANENT", "raster");
        assertTrue(table.matches("precip_monthly_permanent_raster_[0-9a-f]{8}_register"), table);
    }

    @Test
    void testRegisterTablesOfIdsThatSanitizeAlikeDiffer() {
        String first = SqlIdentifierValidator.datasetRegisterTable("a_b", "c", "raster");
        String second = SqlIdentifierValidator.datasetRegisterTable("a", "b_c", "raster");
        assertTrue(first.startsWith("a_b_c_raster_"), first);
        assertTrue(second.startsWith("a_b_c_raster_"), second);
        assertNotEquals(first, second);
    }

    @Test
    void testLongRegisterTableNamesAreTruncatedDeterministically() {
        String name = "a_very_long_dataset_name_that_keeps_going_and_going_and_going";
        String first = SqlIdentifierValidator.datasetRegisterTable(name, "PERMANENT", "raster3d");
        String second = SqlIdentifierValidator.datasetRegisterTable(name, "PERMANENT", "raster3d");
        assertEquals(first, second);
        assertEquals(SqlIdentifierValidator.MAX_IDENTIFIER_LENGTH, first.length());
    }

    @Test
    void testMapRegisterTablesAreUnique() {
        String a = SqlIdentifierValidator.mapRegisterTable("strds");
        String b = SqlIdentifierValidator.mapRegisterTable("strds");
        assertNotEquals(a, b);
        assertTrue(a.startsWith("map_") && a.endsWith("_strds_register"));
    }
}
